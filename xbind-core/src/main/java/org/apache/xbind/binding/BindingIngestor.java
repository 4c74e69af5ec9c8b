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
 
package org.apache.xbind.binding;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;

import org.apache.commons.lang3.StringUtils;

import org.apache.xbind.conversion.BindingConstants;
import org.apache.xbind.exception.MissingPermissionException;
import org.apache.xbind.model.entity.InternalIamBinding;
import org.apache.xbind.model.source.IamPolicySearchResult;
import org.apache.xbind.model.source.PolicyBinding;
import org.apache.xbind.model.source.PolicyScope;
import org.apache.xbind.model.source.PolicySearchPage;
import org.apache.xbind.model.sync.BindingIngestionResult;
import org.apache.xbind.model.sync.MissingPermissionEvent;
import org.apache.xbind.resource.ProjectIdResolver;
import org.apache.xbind.spi.event.MissingPermissionNotifier;
import org.apache.xbind.spi.extractor.PolicySearchSource;
import org.apache.xbind.spi.store.GraphObjectStore;

/**
 * Pages through the IAM policies of a scope and stores one {@link InternalIamBinding} per distinct
 * binding. The same binding is commonly returned more than once, e.g. when a policy is inherited,
 * so bindings are deduplicated on their content-derived key.
 */
@Log4j2
@RequiredArgsConstructor
public class BindingIngestor {
  private final PolicySearchSource policySearchSource;
  private final GraphObjectStore store;
  private final PermissionResolver permissionResolver;
  private final ProjectIdResolver projectIdResolver;
  private final MissingPermissionNotifier missingPermissionNotifier;

  public BindingIngestionResult ingest(PolicyScope scope) {
    Set<String> seenKeys = new HashSet<>();
    List<String> duplicateKeys = new ArrayList<>();
    int count = 0;
    boolean missingPermission = false;
    try {
      String pageToken = null;
      PolicySearchPage page;
      do {
        page = policySearchSource.search(scope, pageToken);
        for (IamPolicySearchResult result : page.getResults()) {
          if (StringUtils.isBlank(result.getResource())) {
            log.warn("Skipping policy search result without a resource: {}", result);
            continue;
          }
          for (PolicyBinding binding : result.getBindings()) {
            String key =
                BindingKeyBuilder.buildKey(binding, result.getResource(), result.getProject());
            // bindings stored by an earlier run count as duplicates
            if (!seenKeys.add(key) || store.hasKey(key)) {
              duplicateKeys.add(key);
              continue;
            }
            store.addEntity(toBindingEntity(key, binding, result));
            count++;
          }
        }
        pageToken = page.getNextPageToken();
      } while (page.hasNextPage());
    } catch (MissingPermissionException e) {
      log.info("Missing permission while searching IAM policies of {}", scope, e);
      String permission =
          StringUtils.defaultIfBlank(
              e.getPermission(), BindingConstants.SEARCH_IAM_POLICIES_PERMISSION);
      missingPermissionNotifier.publish(
          MissingPermissionEvent.builder()
              .stepId(BindingConstants.FETCH_IAM_BINDINGS_STEP)
              .permission(permission)
              .build());
      missingPermission = true;
    }

    log.info("Created {} IAM binding entities for {}", count, scope);
    if (!duplicateKeys.isEmpty()) {
      log.info(
          "Skipped {} duplicate IAM bindings for {}: {}",
          duplicateKeys.size(),
          scope,
          duplicateKeys);
    }
    return BindingIngestionResult.builder()
        .count(count)
        .duplicateKeys(duplicateKeys)
        .missingPermission(missingPermission)
        .build();
  }

  private InternalIamBinding toBindingEntity(
      String key, PolicyBinding binding, IamPolicySearchResult result) {
    return InternalIamBinding.builder()
        .key(key)
        .resource(result.getResource())
        .projectName(result.getProject())
        .projectId(projectIdResolver.resolveProjectId(result.getProject()).orElse(null))
        .role(binding.getRole())
        .members(binding.getMembers())
        .permissions(permissionResolver.resolvePermissions(binding.getRole()))
        .condition(binding.getCondition())
        .rawData(binding)
        .build();
  }
}
