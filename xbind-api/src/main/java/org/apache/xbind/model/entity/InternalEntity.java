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
import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A generic graph entity, used for anything converted outside of the binding engine such as
 * projects, users, service accounts or buckets.
 */
@Value
@Builder(toBuilder = true)
public class InternalEntity implements GraphEntity {
  @NonNull String key;
  @NonNull String type;
  String entityClass;
  @Builder.Default Map<String, Object> properties = Collections.emptyMap();

  public Optional<String> getStringProperty(String name) {
    Object value = properties.get(name);
    return value == null ? Optional.empty() : Optional.of(String.valueOf(value));
  }
}
