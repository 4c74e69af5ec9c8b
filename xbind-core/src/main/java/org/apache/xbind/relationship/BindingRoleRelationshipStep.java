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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

import org.apache.xbind.conversion.BindingConstants;
import org.apache.xbind.model.entity.GraphEntity;
import org.apache.xbind.model.entity.InternalIamBinding;
import org.apache.xbind.model.entity.InternalIamRole;
import org.apache.xbind.model.relationship.RelationshipClass;
import org.apache.xbind.model.relationship.TargetEntity;
import org.apache.xbind.role.RoleResolver;
import org.apache.xbind.spi.store.GraphObjectStore;

/** Relates every binding to the role it grants. */
@Log4j2
public class BindingRoleRelationshipStep extends BindingRelationshipStep {
  private final RoleResolver roleResolver;

  public BindingRoleRelationshipStep(GraphObjectStore store, RoleResolver roleResolver) {
    super(store);
    this.roleResolver = roleResolver;
  }

  @Override
  public String getStepId() {
    return BindingConstants.BINDING_ROLE_RELATIONSHIPS_STEP;
  }

  @Override
  public List<String> getDependsOn() {
    return Arrays.asList(
        BindingConstants.FETCH_IAM_BINDINGS_STEP, BindingConstants.CREATE_BASIC_ROLES_STEP);
  }

  @Override
  protected void processBinding(InternalIamBinding binding) {
    if (binding.getRole() == null) {
      return;
    }
    Optional<String> roleKey = roleResolver.resolveRoleKey(binding);
    if (!roleKey.isPresent()) {
      log.warn("Unable to resolve the role of IAM binding {}", binding.getKey());
      return;
    }
    Optional<GraphEntity> role =
        roleResolver.findOrCreateIamRoleEntity(binding.getRole(), roleKey.get());
    if (role.isPresent()) {
      emit(
          RelationshipBuilder.createDirectRelationship(
              RelationshipClass.USES, binding, role.get()));
      return;
    }
    // predefined roles are created from the catalog when the mapping is resolved
    InternalIamRole placeholder = roleResolver.buildManagedRole(binding.getRole(), roleKey.get());
    emit(
        RelationshipBuilder.createMappedRelationship(
            RelationshipClass.USES,
            binding,
            TargetEntity.builder()
                .type(placeholder.getType())
                .entityClass(placeholder.getEntityClass())
                .key(placeholder.getKey())
                .properties(placeholder.getProperties())
                .build(),
            RelationshipBuilder.TYPE_AND_KEY_FILTER,
            false,
            Collections.emptyMap()));
  }
}
