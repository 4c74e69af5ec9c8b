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
 
package org.apache.xbind.conversion;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class BindingConstants {
  public static final String FETCH_IAM_BINDINGS_STEP = "fetch-iam-bindings";
  public static final String CREATE_BASIC_ROLES_STEP = "create-basic-roles";
  public static final String BINDING_PRINCIPAL_RELATIONSHIPS_STEP =
      "create-binding-principal-relationships";
  public static final String BINDING_ROLE_RELATIONSHIPS_STEP = "create-binding-role-relationships";
  public static final String BINDING_RESOURCE_RELATIONSHIPS_STEP =
      "create-binding-any-resource-relationships";

  public static final String SEARCH_IAM_POLICIES_PERMISSION =
      "cloudasset.assets.searchAllIamPolicies";
}
