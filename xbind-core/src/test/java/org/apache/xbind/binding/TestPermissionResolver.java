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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import org.apache.xbind.model.entity.InternalEntity;
import org.apache.xbind.model.entity.InternalIamRole;
import org.apache.xbind.role.ManagedRoleCatalog;
import org.apache.xbind.store.InMemoryGraphObjectStore;

public class TestPermissionResolver {
  private final InMemoryGraphObjectStore store = new InMemoryGraphObjectStore();
  private final PermissionResolver permissionResolver =
      new PermissionResolver(
          store,
          ManagedRoleCatalog.of(
              Collections.singletonMap(
                  "roles/pubsub.publisher", Collections.singletonList("pubsub.topics.publish"))));

  @Test
  void testResolvePermissions_fromCatalog() {
    assertEquals(
        Collections.singletonList("pubsub.topics.publish"),
        permissionResolver.resolvePermissions("roles/pubsub.publisher"));
  }

  @Test
  void testResolvePermissions_storedRoleWinsOverCatalog() {
    store.addEntity(
        InternalIamRole.builder()
            .key("roles/pubsub.publisher")
            .name("roles/pubsub.publisher")
            .includedPermissions(Arrays.asList("pubsub.topics.publish", "pubsub.topics.get"))
            .build());
    assertEquals(
        Arrays.asList("pubsub.topics.publish", "pubsub.topics.get"),
        permissionResolver.resolvePermissions("roles/pubsub.publisher"));
  }

  @Test
  void testResolvePermissions_genericRoleEntity() {
    store.addEntity(
        InternalEntity.builder()
            .key("projects/my-proj/roles/deployer")
            .type(InternalIamRole.ENTITY_TYPE)
            .properties(
                Collections.singletonMap("permissions", "run.services.update, ,run.services.get "))
            .build());
    assertEquals(
        Arrays.asList("run.services.update", "run.services.get"),
        permissionResolver.resolvePermissions("projects/my-proj/roles/deployer"));
  }

  @Test
  void testResolvePermissions_unknownOrMissingRole() {
    assertTrue(permissionResolver.resolvePermissions("roles/unknown").isEmpty());
    assertTrue(permissionResolver.resolvePermissions(null).isEmpty());
    assertTrue(permissionResolver.resolvePermissions("").isEmpty());
  }
}
