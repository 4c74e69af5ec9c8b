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

/** Kinds of principals that can appear as members of a policy binding. */
public enum PrincipalKind {
  USER("user"),
  SERVICE_ACCOUNT("serviceAccount"),
  GROUP("group"),
  DOMAIN("domain"),
  ALL_USERS("allUsers"),
  ALL_AUTHENTICATED_USERS("allAuthenticatedUsers"),
  PROJECT_OWNER("projectOwner"),
  PROJECT_EDITOR("projectEditor"),
  PROJECT_VIEWER("projectViewer");

  private final String memberPrefix;

  PrincipalKind(String memberPrefix) {
    this.memberPrefix = memberPrefix;
  }

  /** The prefix used for this kind in member strings, e.g. serviceAccount */
  public String getMemberPrefix() {
    return memberPrefix;
  }

  /** True for kinds whose member string has no identifier part. */
  public boolean isPublic() {
    return this == ALL_USERS || this == ALL_AUTHENTICATED_USERS;
  }
}
