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

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Represents an IAM role referenced by one or more bindings.
 *
 * <p>Custom and predefined roles have a single global key, the role name. Basic roles (owner,
 * editor, viewer, browser) exist at every level of the resource hierarchy, so their key is prefixed
 * with the key of the organization, folder or project they are bound on.
 */
@Value
@Builder
public class InternalIamRole implements GraphEntity {
  public static final String ENTITY_TYPE = "google_iam_role";
  public static final String ENTITY_CLASS = "AccessRole";

  @NonNull String key;
  @NonNull String name;
  String title;
  @Builder.Default List<String> includedPermissions = Collections.emptyList();
  boolean custom;

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
    properties.put("name", name);
    properties.put("title", title);
    properties.put("permissions", String.join(",", includedPermissions));
    properties.put("custom", custom);
    return properties;
  }
}
