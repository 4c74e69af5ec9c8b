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
 
package org.apache.xbind.spi.store;

import java.util.Collection;
import java.util.Optional;
import java.util.function.Consumer;

import org.apache.xbind.annotations.Evolving;
import org.apache.xbind.model.entity.GraphEntity;
import org.apache.xbind.model.relationship.GraphRelationship;

/**
 * The store shared by all steps of a run. Entities and relationships are keyed; adding an object
 * whose key is already present is signalled with {@link
 * org.apache.xbind.exception.DuplicateKeyException} and never overwrites the stored object.
 */
@Evolving
public interface GraphObjectStore {

  /**
   * Stores the entity.
   *
   * @return the stored entity
   * @throws org.apache.xbind.exception.DuplicateKeyException if the key is already used
   */
  <T extends GraphEntity> T addEntity(T entity);

  Optional<GraphEntity> findEntity(String key);

  /**
   * Visits every stored entity of the given type, in the order they were added. Each call starts a
   * new iteration.
   */
  void iterateEntities(String type, Consumer<GraphEntity> consumer);

  /**
   * Stores the relationship.
   *
   * @throws org.apache.xbind.exception.DuplicateKeyException if the key is already used
   */
  void addRelationship(GraphRelationship relationship);

  /** True if an entity or relationship with the key is stored. */
  boolean hasKey(String key);

  Collection<GraphEntity> getEntities();

  Collection<GraphRelationship> getRelationships();
}
