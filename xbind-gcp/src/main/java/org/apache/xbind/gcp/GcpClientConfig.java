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
 
package org.apache.xbind.gcp;

import java.util.Map;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.apache.xbind.exception.ConfigurationException;

/** Configurations for the Google Cloud clients used to read IAM policies and enabled services. */
@Getter
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class GcpClientConfig {

  private static final ObjectMapper OBJECT_MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  public static final String CREDENTIALS_FILE_KEY = "xbind.gcp.credentialsFile";
  public static final String SERVICE_USAGE_PROJECT_ID_KEY = "xbind.gcp.serviceUsageProjectId";
  public static final String SEARCH_PAGE_SIZE_KEY = "xbind.gcp.searchPageSize";

  /** Largest page size accepted by searchAllIamPolicies. */
  public static final int MAX_SEARCH_PAGE_SIZE = 500;

  /** Service account key file, application default credentials are used when unset. */
  @JsonProperty(CREDENTIALS_FILE_KEY)
  private String credentialsFile;

  /**
   * Project whose enabled services are used when the search scope is a folder or an organization.
   */
  @JsonProperty(SERVICE_USAGE_PROJECT_ID_KEY)
  private String serviceUsageProjectId;

  @JsonProperty(SEARCH_PAGE_SIZE_KEY)
  private int searchPageSize = MAX_SEARCH_PAGE_SIZE;

  /** Creates GcpClientConfig from given key-value map */
  public static GcpClientConfig of(Map<String, String> properties) {
    GcpClientConfig config;
    try {
      config = OBJECT_MAPPER.convertValue(properties, GcpClientConfig.class);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid GCP client configuration: " + properties, e);
    }
    if (config.searchPageSize <= 0 || config.searchPageSize > MAX_SEARCH_PAGE_SIZE) {
      throw new ConfigurationException(
          String.format(
              "%s must be between 1 and %d, got %d",
              SEARCH_PAGE_SIZE_KEY, MAX_SEARCH_PAGE_SIZE, config.searchPageSize));
    }
    return config;
  }
}
