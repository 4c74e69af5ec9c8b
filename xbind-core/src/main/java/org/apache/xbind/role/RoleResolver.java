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

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;

import org.apache.commons.lang3.StringUtils;

import org.apache.xbind.conversion.BindingConstants;
import org.apache.xbind.model.entity.GraphEntity;
import org.apache.xbind.model.entity.InternalIamBinding;
import org.apache.xbind.model.entity.InternalIamRole;
import org.apache.xbind.model.resource.ResourceTarget;
import org.apache.xbind.model.sync.StepResult;
import org.apache.xbind.model.sync.StepStatusCode;
import org.apache.xbind.resource.ResourceTargetResolver;
import org.apache.xbind.spi.store.GraphObjectStore;

/**
 * Resolves the role entity a binding refers to. Basic roles are keyed by the organization, folder
 * or project they are granted on, e.g. {@code projects/my-proj/roles/editor}; every other role is
 * keyed by its name.
 */
@Log4j2
@RequiredArgsConstructor
public class RoleResolver {
  private final GraphObjectStore store;
  private final ResourceTargetResolver resourceTargetResolver;
  private final ManagedRoleCatalog managedRoleCatalog;

  public Optional<String> resolveRoleKey(InternalIamBinding binding) {
    String role = binding.getRole();
    if (StringUtils.isEmpty(role)) {
      return Optional.empty();
    }
    if (!BasicRole.isBasicRole(role)) {
      return Optional.of(role);
    }
    Optional<ResourceTarget> attachmentPoint =
        resourceTargetResolver.resolveAttachmentPoint(binding.getResource());
    if (!attachmentPoint.isPresent()) {
      log.warn(
          "Unable to resolve the attachment point of basic role {} on {}",
          role,
          binding.getResource());
      return Optional.empty();
    }
    return Optional.of(attachmentPoint.get().getKey() + "/" + role);
  }

  /**
   * Returns the stored role with the given key. A missing basic role is created; any other missing
   * role is left to the caller.
   */
  public Optional<GraphEntity> findOrCreateIamRoleEntity(String roleName, String roleKey) {
    Optional<GraphEntity> existing = store.findEntity(roleKey);
    if (existing.isPresent() || !BasicRole.isBasicRole(roleName)) {
      return existing;
    }
    return Optional.of(store.addEntity(buildManagedRole(roleName, roleKey)));
  }

  /** Describes a managed role that is not in the graph, with the permissions of the catalog. */
  public InternalIamRole buildManagedRole(String roleName, String roleKey) {
    return InternalIamRole.builder()
        .key(roleKey)
        .name(roleName)
        .title(roleName)
        .includedPermissions(managedRoleCatalog.getPermissions(roleName))
        .custom(false)
        .build();
  }

  /** Creates the role entity of every basic role granted by a stored binding. */
  public StepResult createBasicRolesForBindings() {
    AtomicInteger created = new AtomicInteger();
    store.iterateEntities(
        InternalIamBinding.ENTITY_TYPE,
        entity -> {
          if (!(entity instanceof InternalIamBinding)) {
            return;
          }
          InternalIamBinding binding = (InternalIamBinding) entity;
          if (!BasicRole.isBasicRole(binding.getRole())) {
            return;
          }
          resolveRoleKey(binding)
              .filter(roleKey -> !store.hasKey(roleKey))
              .ifPresent(
                  roleKey -> {
                    findOrCreateIamRoleEntity(binding.getRole(), roleKey);
                    created.incrementAndGet();
                  });
        });
    log.info("Created {} basic role entities", created.get());
    return StepResult.builder()
        .stepId(BindingConstants.CREATE_BASIC_ROLES_STEP)
        .statusCode(StepStatusCode.SUCCESS)
        .entitiesCreated(created.get())
        .build();
  }
}
