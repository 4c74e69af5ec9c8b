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

import java.util.Collections;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

import org.apache.xbind.conversion.BindingConstants;
import org.apache.xbind.model.entity.GraphEntity;
import org.apache.xbind.model.entity.InternalIamBinding;
import org.apache.xbind.model.relationship.RelationshipClass;
import org.apache.xbind.model.relationship.TargetEntity;
import org.apache.xbind.model.resource.ResourceTarget;
import org.apache.xbind.resource.ResourceTargetResolver;
import org.apache.xbind.spi.store.GraphObjectStore;

/**
 * Relates every binding to the resource its policy is attached to. Resources are never created
 * from a binding, so an unmatched target is dropped when the mapping is resolved.
 */
@Log4j2
public class BindingResourceRelationshipStep extends BindingRelationshipStep {
  static final String RESOURCE_IDENTIFIER_PROPERTY = "resourceIdentifier";

  private final ResourceTargetResolver resourceTargetResolver;

  public BindingResourceRelationshipStep(
      GraphObjectStore store, ResourceTargetResolver resourceTargetResolver) {
    super(store);
    this.resourceTargetResolver = resourceTargetResolver;
  }

  @Override
  public String getStepId() {
    return BindingConstants.BINDING_RESOURCE_RELATIONSHIPS_STEP;
  }

  @Override
  protected void processBinding(InternalIamBinding binding) {
    Optional<ResourceTarget> target = resourceTargetResolver.resolve(binding.getResource());
    if (!target.isPresent()) {
      log.warn(
          "Skipping resource relationship of IAM binding {}, unsupported resource {}",
          binding.getKey(),
          binding.getResource());
      return;
    }
    Optional<GraphEntity> entity =
        resourceTargetResolver.findLocalEntity(binding.getResource(), target.get());
    if (entity.isPresent()) {
      emit(
          RelationshipBuilder.createDirectRelationship(
              RelationshipClass.ALLOWS, binding, entity.get()));
      return;
    }
    boolean ambiguous = target.get().isAmbiguous();
    emit(
        RelationshipBuilder.createMappedRelationship(
            RelationshipClass.ALLOWS,
            binding,
            TargetEntity.builder()
                .type(ambiguous ? null : target.get().getType())
                .key(target.get().getKey())
                .properties(
                    Collections.singletonMap(RESOURCE_IDENTIFIER_PROPERTY, binding.getResource()))
                .build(),
            ambiguous ? RelationshipBuilder.KEY_FILTER : RelationshipBuilder.TYPE_AND_KEY_FILTER,
            true,
            Collections.emptyMap()));
  }
}
