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
 
package org.apache.xbind.relationship;

import static org.apache.xbind.IamBindingTestUtils.BUCKET_RESOURCE;
import static org.apache.xbind.IamBindingTestUtils.PROJECT_NAME;
import static org.apache.xbind.IamBindingTestUtils.PROJECT_RESOURCE;
import static org.apache.xbind.IamBindingTestUtils.bindingEntity;
import static org.apache.xbind.IamBindingTestUtils.policyBinding;
import static org.apache.xbind.IamBindingTestUtils.projectEntity;
import static org.apache.xbind.relationship.RelationshipTestUtils.findRelationship;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import org.apache.xbind.model.entity.InternalIamBinding;
import org.apache.xbind.model.entity.InternalIamRole;
import org.apache.xbind.model.relationship.DirectRelationship;
import org.apache.xbind.model.relationship.MappedRelationship;
import org.apache.xbind.model.relationship.RelationshipDirection;
import org.apache.xbind.model.source.PolicyScope;
import org.apache.xbind.model.sync.StepResult;
import org.apache.xbind.model.sync.StepStatusCode;
import org.apache.xbind.resource.ProjectIdResolver;
import org.apache.xbind.resource.ResourceKindTable;
import org.apache.xbind.resource.ResourceTargetResolver;
import org.apache.xbind.role.ManagedRoleCatalog;
import org.apache.xbind.role.RoleResolver;
import org.apache.xbind.spi.extractor.EnabledServicesProvider;
import org.apache.xbind.store.InMemoryGraphObjectStore;

public class TestBindingRoleRelationshipStep {
  private final InMemoryGraphObjectStore store = new InMemoryGraphObjectStore();
  private final BindingRoleRelationshipStep step =
      new BindingRoleRelationshipStep(
          store,
          new RoleResolver(
              store,
              new ResourceTargetResolver(
                  store,
                  ResourceKindTable.getDefault(),
                  new ProjectIdResolver(store),
                  mock(EnabledServicesProvider.class),
                  PolicyScope.forProject("my-proj")),
              ManagedRoleCatalog.loadDefault()));

  @Test
  void testExecute() {
    store.addEntity(projectEntity());
    InternalIamBinding basic =
        store.addEntity(
            bindingEntity(
                PROJECT_RESOURCE,
                PROJECT_NAME,
                policyBinding("roles/editor", "user:a@example.com")));
    InternalIamBinding predefined =
        store.addEntity(
            bindingEntity(
                BUCKET_RESOURCE,
                PROJECT_NAME,
                policyBinding("roles/storage.admin", "user:a@example.com")));
    // skipped: no role, and a basic role without an attachment point
    store.addEntity(
        bindingEntity(PROJECT_RESOURCE, PROJECT_NAME, policyBinding(null, "user:a@example.com")));
    store.addEntity(
        bindingEntity(
            BUCKET_RESOURCE, PROJECT_NAME, policyBinding("roles/viewer", "user:a@example.com")));

    StepResult result = step.execute();

    assertEquals("create-binding-role-relationships", result.getStepId());
    assertEquals(StepStatusCode.SUCCESS, result.getStatusCode());
    assertEquals(2, result.getRelationshipsCreated());
    assertEquals(2, store.getRelationships().size());

    DirectRelationship uses =
        findRelationship(
            store,
            basic.getKey() + "|uses|projects/my-proj/roles/editor",
            DirectRelationship.class);
    assertEquals("google_iam_binding_uses_role", uses.getType());
    assertEquals("projects/my-proj/roles/editor", uses.getToKey());
    assertTrue(store.findEntity("projects/my-proj/roles/editor").get() instanceof InternalIamRole);

    MappedRelationship mapped =
        findRelationship(
            store, predefined.getKey() + "|uses|roles/storage.admin", MappedRelationship.class);
    assertEquals("google_iam_binding_uses_role", mapped.getType());
    assertEquals(RelationshipDirection.FORWARD, mapped.getRelationshipDirection());
    assertEquals(RelationshipBuilder.TYPE_AND_KEY_FILTER, mapped.getTargetFilterKeys());
    assertFalse(mapped.isSkipTargetCreation());
    assertEquals(InternalIamRole.ENTITY_TYPE, mapped.getTargetEntity().getType());
    assertEquals("roles/storage.admin", mapped.getTargetEntity().getKey());
    assertTrue(
        String.valueOf(mapped.getTargetEntity().getProperties().get("permissions"))
            .contains("storage.buckets.create"));
    assertFalse(store.hasKey("roles/storage.admin"));
  }

  @Test
  void testExecuteTwiceIntoSameStore() {
    store.addEntity(projectEntity());
    store.addEntity(
        bindingEntity(
            PROJECT_RESOURCE, PROJECT_NAME, policyBinding("roles/editor", "user:a@example.com")));
    store.addEntity(
        bindingEntity(
            BUCKET_RESOURCE,
            PROJECT_NAME,
            policyBinding("roles/storage.admin", "user:a@example.com")));

    StepResult first = step.execute();
    StepResult second = step.execute();

    assertEquals(2, first.getRelationshipsCreated());
    assertEquals(StepStatusCode.SUCCESS, second.getStatusCode());
    assertEquals(0, second.getRelationshipsCreated());
    assertEquals(2, second.getDuplicatesSkipped());
    assertEquals(2, store.getRelationships().size());
  }

  @Test
  void testDependsOnBasicRoles() {
    assertEquals(
        Arrays.asList("fetch-iam-bindings", "create-basic-roles"), step.getDependsOn());
  }
}
