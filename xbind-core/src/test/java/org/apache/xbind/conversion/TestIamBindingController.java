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

import static org.apache.xbind.IamBindingTestUtils.BUCKET_RESOURCE;
import static org.apache.xbind.IamBindingTestUtils.PROJECT_NAME;
import static org.apache.xbind.IamBindingTestUtils.PROJECT_RESOURCE;
import static org.apache.xbind.IamBindingTestUtils.bucketEntity;
import static org.apache.xbind.IamBindingTestUtils.createProps;
import static org.apache.xbind.IamBindingTestUtils.page;
import static org.apache.xbind.IamBindingTestUtils.policyBinding;
import static org.apache.xbind.IamBindingTestUtils.projectEntity;
import static org.apache.xbind.IamBindingTestUtils.searchResult;
import static org.apache.xbind.IamBindingTestUtils.userEntity;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableSet;

import org.apache.xbind.config.IamBindingConfig;
import org.apache.xbind.event.LoggingMissingPermissionNotifier;
import org.apache.xbind.exception.ConfigurationException;
import org.apache.xbind.exception.MissingPermissionException;
import org.apache.xbind.exception.StepFailedException;
import org.apache.xbind.model.source.IamPolicySearchResult;
import org.apache.xbind.model.source.PolicyScope;
import org.apache.xbind.model.sync.IamBindingSyncResult;
import org.apache.xbind.model.sync.StepResult;
import org.apache.xbind.model.sync.StepStatusCode;
import org.apache.xbind.role.ManagedRoleCatalog;
import org.apache.xbind.spi.extractor.EnabledServicesProvider;
import org.apache.xbind.spi.extractor.PolicySearchSource;
import org.apache.xbind.store.InMemoryGraphObjectStore;

public class TestIamBindingController {
  private static final PolicyScope SCOPE = PolicyScope.forProject("my-proj");

  private final PolicySearchSource mockSource = mock(PolicySearchSource.class);
  private final EnabledServicesProvider mockProvider = mock(EnabledServicesProvider.class);
  private final InMemoryGraphObjectStore store = new InMemoryGraphObjectStore();
  private final LoggingMissingPermissionNotifier notifier = new LoggingMissingPermissionNotifier();

  @Test
  void testSync() {
    store.addEntity(projectEntity());
    store.addEntity(userEntity("alice@example.com"));
    store.addEntity(bucketEntity("my-bucket"));
    IamPolicySearchResult projectPolicy =
        searchResult(
            PROJECT_RESOURCE,
            PROJECT_NAME,
            policyBinding("roles/editor", "user:alice@example.com", "allUsers"));
    IamPolicySearchResult bucketPolicy =
        searchResult(
            BUCKET_RESOURCE,
            PROJECT_NAME,
            policyBinding(
                "roles/storage.objectViewer", "user:alice@example.com", "group:devs@example.com"));
    when(mockSource.search(eq(SCOPE), isNull()))
        .thenReturn(page("t1", projectPolicy, bucketPolicy));
    when(mockSource.search(SCOPE, "t1")).thenReturn(page(null, projectPolicy));
    when(mockProvider.getEnabledServiceNames(SCOPE))
        .thenReturn(
            ImmutableSet.of("cloudresourcemanager.googleapis.com", "storage.googleapis.com"));

    IamBindingSyncResult result = createController().sync();

    assertEquals(
        Arrays.asList(
            "fetch-iam-bindings",
            "create-basic-roles",
            "create-binding-principal-relationships",
            "create-binding-role-relationships",
            "create-binding-any-resource-relationships"),
        result.getStepResults().stream().map(StepResult::getStepId).collect(Collectors.toList()));
    assertTrue(
        result.getStepResults().stream()
            .allMatch(step -> step.getStatusCode() == StepStatusCode.SUCCESS));

    StepResult fetch = result.getStepResult("fetch-iam-bindings").get();
    assertEquals(2, fetch.getEntitiesCreated());
    assertEquals(1, fetch.getDuplicatesSkipped());
    assertEquals(1, result.getStepResult("create-basic-roles").get().getEntitiesCreated());
    assertEquals(
        4,
        result
            .getStepResult("create-binding-principal-relationships")
            .get()
            .getRelationshipsCreated());
    assertEquals(
        2,
        result.getStepResult("create-binding-role-relationships").get().getRelationshipsCreated());
    assertEquals(
        2,
        result
            .getStepResult("create-binding-any-resource-relationships")
            .get()
            .getRelationshipsCreated());

    // project, user, bucket, two bindings and the editor role of the project
    assertEquals(6, store.getEntities().size());
    assertEquals(8, store.getRelationships().size());
    assertTrue(store.hasKey("projects/my-proj/roles/editor"));
    assertTrue(notifier.getEvents().isEmpty());
  }

  @Test
  void testSync_missingSearchPermission() {
    when(mockSource.search(eq(SCOPE), isNull()))
        .thenThrow(
            new MissingPermissionException("cloudasset.assets.searchAllIamPolicies", "denied"));

    IamBindingSyncResult result = createController().sync();

    assertEquals(5, result.getStepResults().size());
    assertEquals(
        StepStatusCode.PARTIAL, result.getStepResult("fetch-iam-bindings").get().getStatusCode());
    assertEquals(1, notifier.getEvents().size());
    assertEquals("fetch-iam-bindings", notifier.getEvents().get(0).getStepId());
    assertTrue(store.getRelationships().isEmpty());
    verify(mockProvider, never()).getEnabledServiceNames(SCOPE);
  }

  @Test
  void testSync_stepFailure() {
    IamBindingStep first = mockStep("first", Collections.emptyList());
    when(first.execute())
        .thenReturn(
            StepResult.builder().stepId("first").statusCode(StepStatusCode.SUCCESS).build());
    IamBindingStep second = mockStep("second", Collections.singletonList("first"));
    when(second.execute()).thenThrow(new IllegalStateException("store unavailable"));
    IamBindingStep third = mockStep("third", Collections.singletonList("second"));

    StepFailedException e =
        assertThrows(
            StepFailedException.class,
            () -> new IamBindingController(Arrays.asList(first, second, third)).sync());

    assertEquals("second", e.getStepId());
    IamBindingSyncResult partial = e.getPartialResult();
    assertEquals(2, partial.getStepResults().size());
    StepResult failed = partial.getStepResult("second").get();
    assertEquals(StepStatusCode.ERROR, failed.getStatusCode());
    assertEquals("store unavailable", failed.getErrorDetails().getErrorMessage());
    assertTrue(failed.getErrorDetails().isCanRetryOnFailure());
    verify(third, never()).execute();
  }

  @Test
  void testSync_dependencyOrder() {
    IamBindingStep dependent =
        mockStep("create-basic-roles", Collections.singletonList("fetch-iam-bindings"));
    IamBindingStep fetch = mockStep("fetch-iam-bindings", Collections.emptyList());

    assertThrows(
        ConfigurationException.class,
        () -> new IamBindingController(Arrays.asList(dependent, fetch)).sync());
    verify(dependent, never()).execute();
    verify(fetch, never()).execute();
  }

  private IamBindingController createController() {
    return IamBindingController.create(
        IamBindingConfig.of(createProps(IamBindingConfig.PROJECT_ID_KEY, "my-proj")),
        mockSource,
        mockProvider,
        store,
        notifier,
        ManagedRoleCatalog.loadDefault());
  }

  private static IamBindingStep mockStep(String stepId, List<String> dependsOn) {
    IamBindingStep step = mock(IamBindingStep.class);
    when(step.getStepId()).thenReturn(stepId);
    when(step.getDependsOn()).thenReturn(dependsOn);
    return step;
  }
}
