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
import java.util.Map;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import com.google.common.collect.ImmutableList;

import org.apache.xbind.model.entity.GraphEntity;
import org.apache.xbind.model.relationship.DirectRelationship;
import org.apache.xbind.model.relationship.MappedRelationship;
import org.apache.xbind.model.relationship.RelationshipClass;
import org.apache.xbind.model.relationship.RelationshipDirection;
import org.apache.xbind.model.relationship.TargetEntity;

/** Builds the keys, types and values of the relationships created from bindings. */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class RelationshipBuilder {
  /** Type used in place of the target type when it is not known. */
  static final String ANY_RESOURCE_TYPE = "resource";

  public static final List<List<String>> TYPE_AND_KEY_FILTER =
      ImmutableList.of(
          ImmutableList.of(MappedRelationship.TYPE_FILTER, MappedRelationship.KEY_FILTER));
  public static final List<List<String>> KEY_FILTER =
      ImmutableList.of(ImmutableList.of(MappedRelationship.KEY_FILTER));

  /**
   * Builds a relationship type from the class and the types of both ends, dropping the leading
   * segments the target type shares with the source type: {@code google_iam_binding} uses {@code
   * google_iam_role} gives {@code google_iam_binding_uses_role}.
   */
  public static String generateRelationshipType(
      RelationshipClass relationshipClass, String fromType, String toType) {
    List<String> fromParts = Arrays.asList(fromType.split("_"));
    List<String> toParts = Arrays.asList(toType.split("_"));
    int shared = 0;
    while (shared < fromParts.size()
        && shared < toParts.size() - 1
        && fromParts.get(shared).equals(toParts.get(shared))) {
      shared++;
    }
    return fromType
        + "_"
        + relationshipClass.toVerb()
        + "_"
        + String.join("_", toParts.subList(shared, toParts.size()));
  }

  public static String relationshipKey(
      String fromKey, RelationshipClass relationshipClass, String toKey) {
    return fromKey + "|" + relationshipClass.toVerb() + "|" + toKey;
  }

  public static DirectRelationship createDirectRelationship(
      RelationshipClass relationshipClass, GraphEntity from, GraphEntity to) {
    return createDirectRelationship(relationshipClass, from, to, Collections.emptyMap());
  }

  public static DirectRelationship createDirectRelationship(
      RelationshipClass relationshipClass,
      GraphEntity from,
      GraphEntity to,
      Map<String, Object> properties) {
    return DirectRelationship.builder()
        .key(relationshipKey(from.getKey(), relationshipClass, to.getKey()))
        .type(generateRelationshipType(relationshipClass, from.getType(), to.getType()))
        .relationshipClass(relationshipClass)
        .fromKey(from.getKey())
        .fromType(from.getType())
        .toKey(to.getKey())
        .toType(to.getType())
        .properties(properties)
        .build();
  }

  /**
   * Builds a relationship to an entity that is not in the graph, described by {@code target} and
   * matched later on {@code targetFilterKeys}.
   */
  public static MappedRelationship createMappedRelationship(
      RelationshipClass relationshipClass,
      GraphEntity source,
      TargetEntity target,
      List<List<String>> targetFilterKeys,
      boolean skipTargetCreation,
      Map<String, Object> properties) {
    String targetType = target.getType() == null ? ANY_RESOURCE_TYPE : target.getType();
    return MappedRelationship.builder()
        .key(relationshipKey(source.getKey(), relationshipClass, target.getKey()))
        .type(generateRelationshipType(relationshipClass, source.getType(), targetType))
        .relationshipClass(relationshipClass)
        .sourceEntityKey(source.getKey())
        .relationshipDirection(RelationshipDirection.FORWARD)
        .targetFilterKeys(targetFilterKeys)
        .skipTargetCreation(skipTargetCreation)
        .targetEntity(target)
        .properties(properties)
        .build();
  }
}
