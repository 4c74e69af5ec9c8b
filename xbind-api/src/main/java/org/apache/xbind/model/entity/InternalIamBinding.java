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
 
package org.apache.xbind.model.entity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Value;

import org.apache.xbind.model.source.BindingCondition;
import org.apache.xbind.model.source.PolicyBinding;

/**
 * Represents one access grant, a role given to one or more members, discovered on a resource.
 *
 * <p>The permissions of the role are copied onto the binding. A query layer that cannot follow
 * branching traversals can then connect a resource to a principal to a permission without a hop
 * through the role.
 *
 * <p>Bindings are created once per ingestion and never modified; relationships to roles,
 * principals and resources only reference them.
 */
@Value
@Builder
public class InternalIamBinding implements GraphEntity {
  public static final String ENTITY_TYPE = "google_iam_binding";
  public static final String ENTITY_CLASS = "AccessPolicy";

  @NonNull String key;

  /** Full identifier of the resource the policy is attached to. */
  @NonNull String resource;

  /** Owning project in the projects/<number> form, absent above the project level. */
  String projectName;

  /** Owning project id, only set when it could be resolved from {@link #projectName}. */
  String projectId;

  String role;
  @Builder.Default List<String> members = Collections.emptyList();
  @Builder.Default List<String> permissions = Collections.emptyList();
  BindingCondition condition;

  /** The source binding as returned by the search, kept for traceability. */
  @Getter(AccessLevel.NONE)
  PolicyBinding rawData;

  public Optional<PolicyBinding> getRawData() {
    return Optional.ofNullable(rawData);
  }

  public Optional<BindingCondition> getRawCondition() {
    return getRawData().map(PolicyBinding::getCondition);
  }

  @Override
  public String getType() {
    return ENTITY_TYPE;
  }

  @Override
  public String getEntityClass() {
    return ENTITY_CLASS;
  }

  @Override
  public Map<String, Object> getProperties() {
    Map<String, Object> properties = new LinkedHashMap<>();
    properties.put("resource", resource);
    properties.put("projectName", projectName);
    properties.put("projectId", projectId);
    properties.put("role", role);
    properties.put("members", members);
    properties.put("permissions", permissions);
    if (condition != null) {
      properties.put("conditionTitle", condition.getTitle());
      properties.put("conditionDescription", condition.getDescription());
      properties.put("conditionExpression", condition.getExpression());
    }
    return properties;
  }
}
