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
 
package org.apache.xbind.model.principal;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A member string of a binding broken into its kind and identifier, e.g. {@code
 * user:alice@example.com} becomes (USER, alice@example.com).
 */
@Value
@Builder
public class ParsedMember {
  @NonNull String member;
  @NonNull PrincipalKind kind;

  /** Normalized identifier, null for allUsers and allAuthenticatedUsers. */
  String identifier;

  /** True for members of the deleted:<kind>:<id>?uid=<uid> form. */
  boolean deleted;

  /** Unique id of a deleted principal, if present. */
  String uid;
}
