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
 
package org.apache.xbind.config;

import java.util.Map;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import org.apache.commons.lang3.StringUtils;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.apache.xbind.exception.ConfigurationException;
import org.apache.xbind.model.source.PolicyScope;

/** Configurations for a binding resolution run: which scope to search and how. */
@Getter
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class IamBindingConfig {

  private static final ObjectMapper OBJECT_MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  public static final String PROJECT_ID_KEY = "xbind.scope.projectId";
  public static final String FOLDER_ID_KEY = "xbind.scope.folderId";
  public static final String ORGANIZATION_ID_KEY = "xbind.scope.organizationId";
  public static final String RESTRICT_TO_SCOPE_RESOURCE_KEY =
      "xbind.search.restrictToScopeResource";

  @JsonProperty(PROJECT_ID_KEY)
  private String projectId;

  @JsonProperty(FOLDER_ID_KEY)
  private String folderId;

  @JsonProperty(ORGANIZATION_ID_KEY)
  private String organizationId;

  /**
   * When set, only the policy attached to the scope resource itself is searched instead of the
   * policies of every resource within the scope.
   */
  @JsonProperty(RESTRICT_TO_SCOPE_RESOURCE_KEY)
  private boolean restrictToScopeResource;

  /** Creates IamBindingConfig from given key-value map */
  public static IamBindingConfig of(Map<String, String> properties) {
    try {
      return OBJECT_MAPPER.convertValue(properties, IamBindingConfig.class);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid binding configuration: " + properties, e);
    }
  }

  /**
   * Returns the scope to search. Exactly one of the project, folder and organization ids must be
   * configured.
   */
  public PolicyScope getPolicyScope() {
    int configured =
        (StringUtils.isNotBlank(projectId) ? 1 : 0)
            + (StringUtils.isNotBlank(folderId) ? 1 : 0)
            + (StringUtils.isNotBlank(organizationId) ? 1 : 0);
    if (configured != 1) {
      throw new ConfigurationException(
          String.format(
              "Exactly one of %s, %s or %s must be set",
              PROJECT_ID_KEY, FOLDER_ID_KEY, ORGANIZATION_ID_KEY));
    }
    PolicyScope scope;
    if (StringUtils.isNotBlank(organizationId)) {
      scope = PolicyScope.forOrganization(organizationId);
    } else if (StringUtils.isNotBlank(folderId)) {
      scope = PolicyScope.forFolder(folderId);
    } else {
      scope = PolicyScope.forProject(projectId);
    }
    return restrictToScopeResource ? scope.restrictedToScopeResource() : scope;
  }
}
