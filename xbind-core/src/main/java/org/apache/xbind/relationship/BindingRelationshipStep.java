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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

import org.apache.xbind.conversion.BindingConstants;
import org.apache.xbind.conversion.IamBindingStep;
import org.apache.xbind.model.entity.InternalIamBinding;
import org.apache.xbind.model.relationship.GraphRelationship;
import org.apache.xbind.model.sync.StepResult;
import org.apache.xbind.model.sync.StepStatusCode;
import org.apache.xbind.spi.store.GraphObjectStore;

/**
 * A pass over every stored binding that relates it to other entities. Each pass only emits a
 * relationship key once; repeats are counted as duplicates.
 */
@Log4j2
public abstract class BindingRelationshipStep implements IamBindingStep {
  protected final GraphObjectStore store;
  private final Set<String> emittedKeys = new HashSet<>();
  private int relationshipsCreated;
  private int duplicatesSkipped;

  protected BindingRelationshipStep(GraphObjectStore store) {
    this.store = store;
  }

  @Override
  public List<String> getDependsOn() {
    return Collections.singletonList(BindingConstants.FETCH_IAM_BINDINGS_STEP);
  }

  @Override
  public StepResult execute() {
    emittedKeys.clear();
    relationshipsCreated = 0;
    duplicatesSkipped = 0;
    store.iterateEntities(
        InternalIamBinding.ENTITY_TYPE,
        entity -> {
          if (entity instanceof InternalIamBinding) {
            processBinding((InternalIamBinding) entity);
          }
        });
    log.info(
        "Step {} created {} relationships and skipped {} duplicates",
        getStepId(),
        relationshipsCreated,
        duplicatesSkipped);
    return StepResult.builder()
        .stepId(getStepId())
        .statusCode(StepStatusCode.SUCCESS)
        .relationshipsCreated(relationshipsCreated)
        .duplicatesSkipped(duplicatesSkipped)
        .build();
  }

  protected abstract void processBinding(InternalIamBinding binding);

  /**
   * Stores the relationship unless one with the same key was already emitted by this pass or is
   * already in the store.
   */
  protected void emit(GraphRelationship relationship) {
    if (!emittedKeys.add(relationship.getKey()) || store.hasKey(relationship.getKey())) {
      duplicatesSkipped++;
      return;
    }
    store.addRelationship(relationship);
    relationshipsCreated++;
  }
}
