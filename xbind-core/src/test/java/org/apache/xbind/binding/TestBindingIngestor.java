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

import static org.apache.xbind.IamBindingTestUtils.BUCKET_RESOURCE;
import static org.apache.xbind.IamBindingTestUtils.PROJECT_ID;
import static org.apache.xbind.IamBindingTestUtils.PROJECT_NAME;
import static org.apache.xbind.IamBindingTestUtils.PROJECT_RESOURCE;
import static org.apache.xbind.IamBindingTestUtils.page;
import static org.apache.xbind.IamBindingTestUtils.policyBinding;
import static org.apache.xbind.IamBindingTestUtils.projectEntity;
import static org.apache.xbind.IamBindingTestUtils.searchResult;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Collections;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import org.apache.xbind.exception.MissingPermissionException;
import org.apache.xbind.exception.ReadException;
import org.apache.xbind.model.entity.GraphEntity;
import org.apache.xbind.model.entity.InternalIamBinding;
import org.apache.xbind.model.source.PolicyBinding;
import org.apache.xbind.model.source.PolicyScope;
import org.apache.xbind.model.source.PolicySearchPage;
import org.apache.xbind.model.sync.BindingIngestionResult;
import org.apache.xbind.model.sync.MissingPermissionEvent;
import org.apache.xbind.resource.ProjectIdResolver;
import org.apache.xbind.role.ManagedRoleCatalog;
import org.apache.xbind.spi.event.MissingPermissionNotifier;
import org.apache.xbind.spi.extractor.PolicySearchSource;
import org.apache.xbind.store.InMemoryGraphObjectStore;

public class TestBindingIngestor {
  private static final PolicyScope SCOPE = PolicyScope.forProject(PROJECT_ID);
  private static final PolicyBinding EDITORS =
      policyBinding("roles/editor", "user:alice@example.com", "group:devs@example.com");
  private static final PolicyBinding EDITORS_REORDERED =
      policyBinding("roles/editor", "group:devs@example.com", "user:alice@example.com");
  private static final PolicyBinding READERS =
      policyBinding("roles/storage.objectViewer", "allUsers");

  private final PolicySearchSource mockSource = mock(PolicySearchSource.class);
  private final MissingPermissionNotifier mockNotifier = mock(MissingPermissionNotifier.class);

  @Test
  void testIngest_pagesAndDeduplicates() {
    InMemoryGraphObjectStore store = new InMemoryGraphObjectStore();
    store.addEntity(projectEntity());
    when(mockSource.search(eq(SCOPE), isNull()))
        .thenReturn(page("token-2", searchResult(PROJECT_RESOURCE, PROJECT_NAME, EDITORS)));
    when(mockSource.search(SCOPE, "token-2"))
        .thenReturn(
            page(
                null,
                searchResult(PROJECT_RESOURCE, PROJECT_NAME, EDITORS_REORDERED),
                searchResult(BUCKET_RESOURCE, PROJECT_NAME, READERS)));

    BindingIngestionResult result = ingestor(store).ingest(SCOPE);

    assertEquals(2, result.getCount());
    assertEquals(1, result.getDuplicates());
    assertEquals(
        Collections.singletonList(
            BindingKeyBuilder.buildKey(EDITORS, PROJECT_RESOURCE, PROJECT_NAME)),
        result.getDuplicateKeys());
    assertFalse(result.isMissingPermission());
    verify(mockNotifier, never()).publish(any());

    InternalIamBinding editors =
        (InternalIamBinding)
            store
                .findEntity(BindingKeyBuilder.buildKey(EDITORS, PROJECT_RESOURCE, PROJECT_NAME))
                .get();
    assertEquals(PROJECT_RESOURCE, editors.getResource());
    assertEquals(PROJECT_NAME, editors.getProjectName());
    assertEquals(PROJECT_ID, editors.getProjectId());
    assertEquals(EDITORS.getMembers(), editors.getMembers());
    assertTrue(editors.getPermissions().contains("resourcemanager.projects.get"));
    assertEquals(EDITORS, editors.getRawData().get());
  }

  @Test
  void testIngest_sameKeysRegardlessOfPageOrder() {
    PolicySearchSource reorderedSource = mock(PolicySearchSource.class);
    when(mockSource.search(eq(SCOPE), isNull()))
        .thenReturn(page("next", searchResult(PROJECT_RESOURCE, PROJECT_NAME, EDITORS)));
    when(mockSource.search(SCOPE, "next"))
        .thenReturn(page(null, searchResult(BUCKET_RESOURCE, PROJECT_NAME, READERS)));
    when(reorderedSource.search(eq(SCOPE), isNull()))
        .thenReturn(page("next", searchResult(BUCKET_RESOURCE, PROJECT_NAME, READERS)));
    when(reorderedSource.search(SCOPE, "next"))
        .thenReturn(page(null, searchResult(PROJECT_RESOURCE, PROJECT_NAME, EDITORS_REORDERED)));

    InMemoryGraphObjectStore firstStore = new InMemoryGraphObjectStore();
    InMemoryGraphObjectStore secondStore = new InMemoryGraphObjectStore();
    ingestor(firstStore).ingest(SCOPE);
    ingestor(secondStore, reorderedSource).ingest(SCOPE);

    assertEquals(keysOf(firstStore), keysOf(secondStore));
    assertEquals(2, keysOf(firstStore).size());
  }

  @Test
  void testIngest_repeatedRunIntoSameStore() {
    InMemoryGraphObjectStore store = new InMemoryGraphObjectStore();
    when(mockSource.search(eq(SCOPE), isNull()))
        .thenReturn(page(null, searchResult(PROJECT_RESOURCE, PROJECT_NAME, EDITORS)));

    BindingIngestionResult first = ingestor(store).ingest(SCOPE);
    Set<String> keysAfterFirstRun = keysOf(store);
    BindingIngestionResult second = ingestor(store).ingest(SCOPE);

    assertEquals(1, first.getCount());
    assertEquals(0, second.getCount());
    assertEquals(
        Collections.singletonList(
            BindingKeyBuilder.buildKey(EDITORS, PROJECT_RESOURCE, PROJECT_NAME)),
        second.getDuplicateKeys());
    assertFalse(second.isMissingPermission());
    assertEquals(keysAfterFirstRun, keysOf(store));
  }

  @Test
  void testIngest_missingPermissionKeepsFetchedBindings() {
    InMemoryGraphObjectStore store = new InMemoryGraphObjectStore();
    when(mockSource.search(eq(SCOPE), isNull()))
        .thenReturn(page("token-2", searchResult(PROJECT_RESOURCE, PROJECT_NAME, EDITORS)));
    when(mockSource.search(SCOPE, "token-2"))
        .thenThrow(
            new MissingPermissionException(
                "cloudasset.assets.searchAllIamPolicies", "Permission denied"));

    BindingIngestionResult result = ingestor(store).ingest(SCOPE);

    assertTrue(result.isMissingPermission());
    assertEquals(1, result.getCount());
    assertEquals(1, store.getEntities().size());
    verify(mockNotifier)
        .publish(
            MissingPermissionEvent.builder()
                .stepId("fetch-iam-bindings")
                .permission("cloudasset.assets.searchAllIamPolicies")
                .build());
  }

  @Test
  void testIngest_otherErrorsPropagate() {
    when(mockSource.search(eq(SCOPE), isNull())).thenThrow(new ReadException("unavailable"));
    assertThrows(ReadException.class, () -> ingestor(new InMemoryGraphObjectStore()).ingest(SCOPE));
    verify(mockNotifier, never()).publish(any());
  }

  @Test
  void testIngest_bindingWithoutRole() {
    InMemoryGraphObjectStore store = new InMemoryGraphObjectStore();
    PolicyBinding noRole = policyBinding(null, "user:alice@example.com");
    when(mockSource.search(eq(SCOPE), isNull()))
        .thenReturn(page(null, searchResult(BUCKET_RESOURCE, null, noRole)));

    BindingIngestionResult result = ingestor(store).ingest(SCOPE);

    assertEquals(1, result.getCount());
    InternalIamBinding binding =
        (InternalIamBinding)
            store.findEntity(BindingKeyBuilder.buildKey(noRole, BUCKET_RESOURCE, null)).get();
    assertTrue(binding.getPermissions().isEmpty());
    assertEquals(null, binding.getProjectId());
  }

  @Test
  void testIngest_emptyScope() {
    when(mockSource.search(eq(SCOPE), isNull())).thenReturn(PolicySearchPage.builder().build());
    BindingIngestionResult result = ingestor(new InMemoryGraphObjectStore()).ingest(SCOPE);
    assertEquals(0, result.getCount());
    assertEquals(0, result.getDuplicates());
  }

  private BindingIngestor ingestor(InMemoryGraphObjectStore store) {
    return ingestor(store, mockSource);
  }

  private BindingIngestor ingestor(InMemoryGraphObjectStore store, PolicySearchSource source) {
    return new BindingIngestor(
        source,
        store,
        new PermissionResolver(store, ManagedRoleCatalog.loadDefault()),
        new ProjectIdResolver(store),
        mockNotifier);
  }

  private static Set<String> keysOf(InMemoryGraphObjectStore store) {
    return store.getEntities().stream()
        .filter(entity -> entity.getType().equals(InternalIamBinding.ENTITY_TYPE))
        .map(GraphEntity::getKey)
        .collect(Collectors.toSet());
  }
}
