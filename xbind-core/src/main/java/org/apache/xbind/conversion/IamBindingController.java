/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
 
package org.apache.xbind.conversion;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.extern.log4j.Log4j2;

import com.google.common.collect.ImmutableList;

import org.apache.xbind.binding.BindingIngestor;
import org.apache.xbind.binding.PermissionResolver;
import org.apache.xbind.config.IamBindingConfig;
import org.apache.xbind.exception.ConfigurationException;
import org.apache.xbind.exception.StepFailedException;
import org.apache.xbind.model.source.PolicyScope;
import org.apache.xbind.model.sync.ErrorDetails;
import org.apache.xbind.model.sync.IamBindingSyncResult;
import org.apache.xbind.model.sync.StepResult;
import org.apache.xbind.model.sync.StepStatusCode;
import org.apache.xbind.principal.PrincipalResolver;
import org.apache.xbind.relationship.BindingPrincipalRelationshipStep;
import org.apache.xbind.relationship.BindingResourceRelationshipStep;
import org.apache.xbind.relationship.BindingRoleRelationshipStep;
import org.apache.xbind.relationship.PrincipalRelationshipTable;
import org.apache.xbind.resource.ProjectIdResolver;
import org.apache.xbind.resource.ResourceKindTable;
import org.apache.xbind.resource.ResourceTargetResolver;
import org.apache.xbind.role.ManagedRoleCatalog;
import org.apache.xbind.role.RoleResolver;
import org.apache.xbind.spi.event.MissingPermissionNotifier;
import org.apache.xbind.spi.extractor.EnabledServicesProvider;
import org.apache.xbind.spi.extractor.PolicySearchSource;
import org.apache.xbind.spi.store.GraphObjectStore;

/**
 * Runs the steps that resolve the IAM bindings of a scope into the graph: fetching the bindings,
 * creating basic roles, then relating the bindings to principals, roles and resources.
 *
 * <p>A missing permission on the policy search only makes the fetch step partial. Any other error
 * aborts the run with a {@link StepFailedException} carrying the results so far.
 */
@Log4j2
public class IamBindingController {
  private final List<IamBindingStep> steps;

  public IamBindingController(List<IamBindingStep> steps) {
    this.steps = ImmutableList.copyOf(steps);
  }

  /** Wires the default steps for the scope configured in {@code config}. */
  public static IamBindingController create(
      IamBindingConfig config,
      PolicySearchSource policySearchSource,
      EnabledServicesProvider enabledServicesProvider,
      GraphObjectStore store,
      MissingPermissionNotifier missingPermissionNotifier,
      ManagedRoleCatalog managedRoleCatalog) {
    PolicyScope scope = config.getPolicyScope();
    ProjectIdResolver projectIdResolver = new ProjectIdResolver(store);
    ResourceTargetResolver resourceTargetResolver =
        new ResourceTargetResolver(
            store,
            ResourceKindTable.getDefault(),
            projectIdResolver,
            enabledServicesProvider,
            scope);
    RoleResolver roleResolver =
        new RoleResolver(store, resourceTargetResolver, managedRoleCatalog);
    BindingIngestor bindingIngestor =
        new BindingIngestor(
            policySearchSource,
            store,
            new PermissionResolver(store, managedRoleCatalog),
            projectIdResolver,
            missingPermissionNotifier);
    return new IamBindingController(
        Arrays.asList(
            new FetchIamBindingsStep(bindingIngestor, scope),
            new CreateBasicRolesStep(roleResolver),
            new BindingPrincipalRelationshipStep(
                store, new PrincipalResolver(store), PrincipalRelationshipTable.getInstance()),
            new BindingRoleRelationshipStep(store, roleResolver),
            new BindingResourceRelationshipStep(store, resourceTargetResolver)));
  }

  public IamBindingSyncResult sync() {
    Instant syncStartTime = Instant.now();
    List<StepResult> stepResults = new ArrayList<>();
    Set<String> completedSteps = new HashSet<>();
    for (IamBindingStep step : steps) {
      List<String> missingDependencies =
          step.getDependsOn().stream()
              .filter(dependency -> !completedSteps.contains(dependency))
              .collect(Collectors.toList());
      if (!missingDependencies.isEmpty()) {
        throw new ConfigurationException(
            String.format(
                "Step %s must run after %s", step.getStepId(), missingDependencies));
      }
      Instant startTime = Instant.now();
      log.info("Running step {}", step.getStepId());
      try {
        StepResult result =
            step.execute().toBuilder()
                .startTime(startTime)
                .duration(Duration.between(startTime, Instant.now()))
                .build();
        stepResults.add(result);
        completedSteps.add(step.getStepId());
      } catch (RuntimeException e) {
        log.error("Step {} failed", step.getStepId(), e);
        stepResults.add(
            StepResult.builder()
                .stepId(step.getStepId())
                .statusCode(StepStatusCode.ERROR)
                .startTime(startTime)
                .duration(Duration.between(startTime, Instant.now()))
                .errorDetails(ErrorDetails.create(e, "Failed to run step " + step.getStepId()))
                .build());
        throw new StepFailedException(
            step.getStepId(), buildResult(syncStartTime, stepResults), e);
      }
    }
    IamBindingSyncResult result = buildResult(syncStartTime, stepResults);
    log.info("Completed {} steps in {}", stepResults.size(), result.getSyncDuration());
    return result;
  }

  private static IamBindingSyncResult buildResult(
      Instant syncStartTime, List<StepResult> stepResults) {
    return IamBindingSyncResult.builder()
        .stepResults(ImmutableList.copyOf(stepResults))
        .syncStartTime(syncStartTime)
        .syncDuration(Duration.between(syncStartTime, Instant.now()))
        .build();
  }
}
