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

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import lombok.AccessLevel;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.apache.xbind.exception.ConfigurationException;

/** Immutable map from a managed (predefined or basic) role name to the permissions it grants. */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class ManagedRoleCatalog {
  static final String DEFAULT_CATALOG_RESOURCE = "/managed-role-permissions.yaml";
  private static final ObjectMapper YAML_MAPPER =
      new ObjectMapper(new YAMLFactory())
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private final Map<String, List<String>> permissionsByRole;

  public static ManagedRoleCatalog loadDefault() {
    return load(DEFAULT_CATALOG_RESOURCE);
  }

  /** Loads a catalog from a YAML class path resource. */
  public static ManagedRoleCatalog load(String resourceName) {
    try (InputStream inputStream = ManagedRoleCatalog.class.getResourceAsStream(resourceName)) {
      if (inputStream == null) {
        throw new ConfigurationException("Managed role catalog not found: " + resourceName);
      }
      CatalogFile catalogFile = YAML_MAPPER.readValue(inputStream, CatalogFile.class);
      return of(catalogFile.getRoles());
    } catch (IOException e) {
      throw new ConfigurationException("Unable to read managed role catalog " + resourceName, e);
    }
  }

  public static ManagedRoleCatalog of(Map<String, List<String>> permissionsByRole) {
    ImmutableMap.Builder<String, List<String>> builder = ImmutableMap.builder();
    permissionsByRole.forEach(
        (role, permissions) ->
            builder.put(
                role,
                permissions == null ? ImmutableList.of() : ImmutableList.copyOf(permissions)));
    return new ManagedRoleCatalog(builder.build());
  }

  /** Returns the permissions of the role, empty when the role is unknown. */
  public List<String> getPermissions(String role) {
    return permissionsByRole.getOrDefault(role, Collections.emptyList());
  }

  public boolean contains(String role) {
    return permissionsByRole.containsKey(role);
  }

  public int size() {
    return permissionsByRole.size();
  }

  @Data
  @NoArgsConstructor
  static class CatalogFile {
    private Map<String, List<String>> roles = Collections.emptyMap();
  }
}
