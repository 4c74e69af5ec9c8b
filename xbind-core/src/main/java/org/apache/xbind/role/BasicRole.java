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
 
package org.apache.xbind.role;

import java.util.Arrays;
import java.util.Optional;

/**
 * The primitive roles. Unlike predefined and custom roles they are scoped to the organization,
 * folder or project they are granted on, so each attachment point gets its own role entity.
 */
public enum BasicRole {
  OWNER("roles/owner"),
  EDITOR("roles/editor"),
  VIEWER("roles/viewer"),
  BROWSER("roles/browser");

  private final String roleName;

  BasicRole(String roleName) {
    this.roleName = roleName;
  }

  public String getRoleName() {
    return roleName;
  }

  public static Optional<BasicRole> fromRoleName(String roleName) {
    return Arrays.stream(values()).filter(role -> role.roleName.equals(roleName)).findFirst();
  }

  public static boolean isBasicRole(String roleName) {
    return fromRoleName(roleName).isPresent();
  }
}
