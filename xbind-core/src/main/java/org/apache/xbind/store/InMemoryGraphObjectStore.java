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
 
package org.apache.xbind.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import lombok.extern.log4j.Log4j2;

import org.apache.xbind.exception.DuplicateKeyException;
import org.apache.xbind.model.entity.GraphEntity;
import org.apache.xbind.model.relationship.GraphRelationship;
import org.apache.xbind.spi.store.GraphObjectStore;

/**
 * {@link GraphObjectStore} keeping all objects in memory, in insertion order. Intended for a single
 * run; nothing is persisted.
 */
@Log4j2
public class InMemoryGraphObjectStore implements GraphObjectStore {
  private final Map<String, GraphEntity> entities = new LinkedHashMap<>();
  private final Map<String, GraphRelationship> relationships = new LinkedHashMap<>();

  @Override
  public synchronized <T extends GraphEntity> T addEntity(T entity) {
    if (hasKey(entity.getKey())) {
      throw new DuplicateKeyException(entity.getKey());
    }
    entities.put(entity.getKey(), entity);
    return entity;
  }

  @Override
  public synchronized Optional<GraphEntity> findEntity(String key) {
    if (key == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(entities.get(key));
  }

  @Override
  public void iterateEntities(String type, Consumer<GraphEntity> consumer) {
    // consumers may add entities while iterating, so iterate over a snapshot
    List<GraphEntity> snapshot;
    synchronized (this) {
      snapshot =
          entities.values().stream()
              .filter(entity -> entity.getType().equals(type))
              .collect(Collectors.toList());
    }
    log.debug("Iterating {} entities of type {}", snapshot.size(), type);
    snapshot.forEach(consumer);
  }

  @Override
  public synchronized void addRelationship(GraphRelationship relationship) {
    if (hasKey(relationship.getKey())) {
      throw new DuplicateKeyException(relationship.getKey());
    }
    relationships.put(relationship.getKey(), relationship);
  }

  @Override
  public synchronized boolean hasKey(String key) {
    return entities.containsKey(key) || relationships.containsKey(key);
  }

  @Override
  public synchronized Collection<GraphEntity> getEntities() {
    return Collections.unmodifiableList(new ArrayList<>(entities.values()));
  }

  @Override
  public synchronized Collection<GraphRelationship> getRelationships() {
    return Collections.unmodifiableList(new ArrayList<>(relationships.values()));
  }
}
