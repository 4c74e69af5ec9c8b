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
 
package org.apache.xbind.role;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import org.apache.xbind.exception.ConfigurationException;

public class TestManagedRoleCatalog {

  @Test
  void testLoadDefault_containsBasicRoles() {
    ManagedRoleCatalog catalog = ManagedRoleCatalog.loadDefault();
    for (BasicRole role : BasicRole.values()) {
      assertTrue(catalog.contains(role.getRoleName()), role.getRoleName());
      assertFalse(catalog.getPermissions(role.getRoleName()).isEmpty(), role.getRoleName());
    }
    assertEquals(
        Collections.singletonList("pubsub.topics.publish"),
        catalog.getPermissions("roles/pubsub.publisher"));
  }

  @Test
  void testGetPermissions_unknownRole() {
    assertTrue(ManagedRoleCatalog.loadDefault().getPermissions("roles/unknown").isEmpty());
  }

  @Test
  void testLoad_missingResource() {
    assertThrows(
        ConfigurationException.class, () -> ManagedRoleCatalog.load("/does-not-exist.yaml"));
  }

  @Test
  void testOf_isImmutableCopy() {
    ManagedRoleCatalog catalog =
        ManagedRoleCatalog.of(
            Collections.singletonMap("roles/custom", Arrays.asList("a.b.c", "a.b.d")));
    assertEquals(1, catalog.size());
    assertThrows(
        UnsupportedOperationException.class,
        () -> catalog.getPermissions("roles/custom").add("x.y.z"));
  }
}
