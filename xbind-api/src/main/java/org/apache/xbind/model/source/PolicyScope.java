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
 
package org.apache.xbind.model.source;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * The organizational boundary a policy search runs against.
 *
 * <p>A scope is rendered as {@code projects/<id>}, {@code folders/<id>} or {@code
 * organizations/<id>}. When {@code resourceQuery} is set, the search is narrowed to policies
 * attached directly to that resource.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PolicyScope {

  public enum ScopeType {
    PROJECT("projects"),
    FOLDER("folders"),
    ORGANIZATION("organizations");

    private final String collection;

    ScopeType(String collection) {
      this.collection = collection;
    }

    public String getCollection() {
      return collection;
    }
  }

  @NonNull ScopeType scopeType;
  @NonNull String id;
  String resourceQuery;

  public static PolicyScope forProject(String projectId) {
    return new PolicyScope(ScopeType.PROJECT, projectId, null);
  }

  public static PolicyScope forFolder(String folderId) {
    return new PolicyScope(ScopeType.FOLDER, folderId, null);
  }

  public static PolicyScope forOrganization(String organizationId) {
    return new PolicyScope(ScopeType.ORGANIZATION, organizationId, null);
  }

  /**
   * Returns a scope searching only the policy attached to the scope resource itself. This can only
   * be used when the scope and the resource are the same, e.g. projects/foo-bar.
   */
  public PolicyScope restrictedToScopeResource() {
    return new PolicyScope(scopeType, id, "resource:" + getName());
  }

  /** The scope in the {@code <collection>/<id>} form used by the search API. */
  public String getName() {
    return scopeType.getCollection() + "/" + id;
  }

  @Override
  public String toString() {
    return resourceQuery == null ? getName() : getName() + " (" + resourceQuery + ")";
  }
}
