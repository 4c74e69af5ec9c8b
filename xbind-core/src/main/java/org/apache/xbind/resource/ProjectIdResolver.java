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
 
package org.apache.xbind.resource;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;

import org.apache.commons.lang3.StringUtils;

import org.apache.xbind.model.entity.GraphEntity;
import org.apache.xbind.spi.store.GraphObjectStore;

/**
 * Translates a project in the {@code projects/<number>} form into its project id by looking for a
 * stored project entity with a matching project number. Results, including misses, are cached for
 * the lifetime of the resolver.
 */
@Log4j2
@RequiredArgsConstructor
public class ProjectIdResolver {
  static final String PROJECT_NUMBER_PROPERTY = "projectNumber";
  static final String PROJECT_ID_PROPERTY = "projectId";
  private static final String PROJECTS_PREFIX = "projects/";

  private final GraphObjectStore store;
  private final Map<String, Optional<String>> cache = new HashMap<>();

  /**
   * @param projectName either {@code projects/<number>} or a bare project number
   * @return the project id, or empty if no stored project has that number
   */
  public synchronized Optional<String> resolveProjectId(String projectName) {
    if (StringUtils.isBlank(projectName)) {
      return Optional.empty();
    }
    String projectNumber = StringUtils.removeStart(projectName, PROJECTS_PREFIX);
    return cache.computeIfAbsent(projectNumber, this::lookup);
  }

  private Optional<String> lookup(String projectNumber) {
    AtomicReference<String> projectId = new AtomicReference<>();
    store.iterateEntities(
        ResourceKindTable.PROJECT_TYPE,
        entity -> {
          if (projectId.get() == null
              && projectNumber.equals(propertyOf(entity, PROJECT_NUMBER_PROPERTY))) {
            projectId.set(projectIdOf(entity));
          }
        });
    if (projectId.get() == null) {
      log.debug("No project entity found for project number {}", projectNumber);
    }
    return Optional.ofNullable(projectId.get());
  }

  private static String projectIdOf(GraphEntity project) {
    String projectId = propertyOf(project, PROJECT_ID_PROPERTY);
    return projectId != null
        ? projectId
        : StringUtils.removeStart(project.getKey(), PROJECTS_PREFIX);
  }

  private static String propertyOf(GraphEntity entity, String name) {
    Object value = entity.getProperties().get(name);
    return value == null ? null : String.valueOf(value);
  }
}
