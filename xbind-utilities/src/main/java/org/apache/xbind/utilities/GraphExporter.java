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
 
package org.apache.xbind.utilities;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.annotations.VisibleForTesting;

import org.apache.xbind.exception.ReadException;
import org.apache.xbind.model.entity.GraphEntity;
import org.apache.xbind.model.entity.InternalEntity;
import org.apache.xbind.model.relationship.DirectRelationship;
import org.apache.xbind.model.relationship.GraphRelationship;
import org.apache.xbind.model.relationship.MappedRelationship;
import org.apache.xbind.model.relationship.TargetEntity;
import org.apache.xbind.spi.store.GraphObjectStore;

/**
 * Writes the contents of a {@link GraphObjectStore} as JSON, and reads back the entities of such a
 * file so they can be preloaded into the store of another run.
 *
 * <p>Entities are flat objects of their properties plus {@code _key}, {@code _type} and {@code
 * _class}. Mapped relationships carry their target description under {@code _mapping}.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class GraphExporter {
  static final String KEY = "_key";
  static final String TYPE = "_type";
  static final String CLASS = "_class";
  static final String ENTITIES = "entities";
  static final String RELATIONSHIPS = "relationships";

  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  public static void export(GraphObjectStore store, OutputStream outputStream) throws IOException {
    List<Map<String, Object>> entities = new ArrayList<>();
    store.getEntities().forEach(entity -> entities.add(toMap(entity)));
    List<Map<String, Object>> relationships = new ArrayList<>();
    store.getRelationships().forEach(relationship -> relationships.add(toMap(relationship)));
    Map<String, Object> graph = new LinkedHashMap<>();
    graph.put(ENTITIES, entities);
    graph.put(RELATIONSHIPS, relationships);
    JSON_MAPPER.writeValue(outputStream, graph);
  }

  /** Reads the entities of a file written by {@link #export}, relationships are ignored. */
  public static List<InternalEntity> readEntities(InputStream inputStream) throws IOException {
    Map<String, List<Map<String, Object>>> graph =
        JSON_MAPPER.readValue(
            inputStream, new TypeReference<Map<String, List<Map<String, Object>>>>() {});
    List<InternalEntity> entities = new ArrayList<>();
    for (Map<String, Object> values : graph.getOrDefault(ENTITIES, new ArrayList<>())) {
      Map<String, Object> properties = new LinkedHashMap<>(values);
      Object key = properties.remove(KEY);
      Object type = properties.remove(TYPE);
      Object entityClass = properties.remove(CLASS);
      if (key == null || type == null) {
        throw new ReadException("Entity without _key or _type: " + values);
      }
      entities.add(
          InternalEntity.builder()
              .key(key.toString())
              .type(type.toString())
              .entityClass(entityClass == null ? null : entityClass.toString())
              .properties(properties)
              .build());
    }
    return entities;
  }

  @VisibleForTesting
  static Map<String, Object> toMap(GraphEntity entity) {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put(KEY, entity.getKey());
    values.put(TYPE, entity.getType());
    values.put(CLASS, entity.getEntityClass());
    values.putAll(entity.getProperties());
    return values;
  }

  @VisibleForTesting
  static Map<String, Object> toMap(GraphRelationship relationship) {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put(KEY, relationship.getKey());
    values.put(TYPE, relationship.getType());
    values.put(CLASS, relationship.getRelationshipClass().name());
    if (relationship instanceof DirectRelationship) {
      DirectRelationship direct = (DirectRelationship) relationship;
      values.put("_fromEntityKey", direct.getFromKey());
      values.put("_toEntityKey", direct.getToKey());
    } else if (relationship instanceof MappedRelationship) {
      MappedRelationship mapped = (MappedRelationship) relationship;
      Map<String, Object> mapping = new LinkedHashMap<>();
      mapping.put("sourceEntityKey", mapped.getSourceEntityKey());
      mapping.put("relationshipDirection", mapped.getRelationshipDirection().name());
      mapping.put("targetFilterKeys", mapped.getTargetFilterKeys());
      mapping.put("skipTargetCreation", mapped.isSkipTargetCreation());
      mapping.put("targetEntity", toMap(mapped.getTargetEntity()));
      values.put("_mapping", mapping);
    }
    values.putAll(relationship.getProperties());
    return values;
  }

  private static Map<String, Object> toMap(TargetEntity target) {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put(KEY, target.getKey());
    if (target.getType() != null) {
      values.put(TYPE, target.getType());
    }
    if (target.getEntityClass() != null) {
      values.put(CLASS, target.getEntityClass());
    }
    values.putAll(target.getProperties());
    return values;
  }
}
