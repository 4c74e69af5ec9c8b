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

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import lombok.RequiredArgsConstructor;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Splitter;

import org.apache.xbind.model.entity.GraphEntity;
import org.apache.xbind.model.entity.InternalIamRole;
import org.apache.xbind.role.ManagedRoleCatalog;
import org.apache.xbind.spi.store.GraphObjectStore;

/**
 * Resolves the permissions granted by a role. A role already present in the store (a custom role
 * ingested earlier) wins over the managed-role catalog.
 */
@RequiredArgsConstructor
public class PermissionResolver {
  static final String PERMISSIONS_PROPERTY = "permissions";
  private static final Splitter PERMISSION_SPLITTER =
      Splitter.on(',').trimResults().omitEmptyStrings();

  private final GraphObjectStore store;
  private final ManagedRoleCatalog managedRoleCatalog;

  public List<String> resolvePermissions(String role) {
    if (StringUtils.isEmpty(role)) {
      return Collections.emptyList();
    }
    Optional<GraphEntity> roleEntity = store.findEntity(role);
    if (roleEntity.isPresent()) {
      return permissionsOf(roleEntity.get());
    }
    return managedRoleCatalog.getPermissions(role);
  }

  private static List<String> permissionsOf(GraphEntity roleEntity) {
    if (roleEntity instanceof InternalIamRole) {
      return ((InternalIamRole) roleEntity).getIncludedPermissions();
    }
    Object permissions = roleEntity.getProperties().get(PERMISSIONS_PROPERTY);
    if (permissions == null) {
      return Collections.emptyList();
    }
    if (permissions instanceof Collection) {
      return ((Collection<?>) permissions)
          .stream().map(String::valueOf).collect(Collectors.toList());
    }
    // comma separated, as roles are stored
    return PERMISSION_SPLITTER.splitToList(permissions.toString());
  }
}
