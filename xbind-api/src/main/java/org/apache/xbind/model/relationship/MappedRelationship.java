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
 
package org.apache.xbind.model.relationship;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A relationship whose target is described by matching criteria instead of a local entity. An
 * external reconciliation process connects it to the entity matching {@link #targetFilterKeys}
 * once that entity is ingested, or creates the target from {@link #targetEntity} unless {@link
 * #skipTargetCreation} is set.
 *
 * <p>Targets created by the reconciliation process are never removed when bindings are ingested
 * again, so repeated runs accumulate duplicate targets for roles. Resource targets are never
 * created for the same reason.
 */
@Value
@Builder
public class MappedRelationship implements GraphRelationship {
  public static final String KEY_FILTER = "_key";
  public static final String TYPE_FILTER = "_type";

  @NonNull String key;
  @NonNull String type;
  @NonNull RelationshipClass relationshipClass;
  @NonNull String sourceEntityKey;
  @NonNull RelationshipDirection relationshipDirection;

  /** Each inner list is one set of target properties that must all match, e.g. [_type, _key]. */
  @NonNull List<List<String>> targetFilterKeys;

  boolean skipTargetCreation;
  @NonNull TargetEntity targetEntity;
  @Builder.Default Map<String, Object> properties = Collections.emptyMap();
}
