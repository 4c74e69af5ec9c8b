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
 
package org.apache.xbind.model.resource;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * The graph type and key a resource identifier maps to. When the resource kind maps to more than
 * one graph type, {@link #ambiguous} is set and {@link #type} must not be used for matching.
 */
@Value
@Builder
public class ResourceTarget {
  public static final String MULTIPLE_TYPES_FOR_RESOURCE_KIND = "MULTIPLE_TYPES_FOR_RESOURCE_KIND";

  @NonNull String type;
  @NonNull String key;

  public boolean isAmbiguous() {
    return MULTIPLE_TYPES_FOR_RESOURCE_KIND.equals(type);
  }
}
