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

import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

import lombok.extern.log4j.Log4j2;

import org.apache.commons.lang3.StringUtils;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableSet;

import org.apache.xbind.exception.MissingPermissionException;
import org.apache.xbind.model.entity.GraphEntity;
import org.apache.xbind.model.resource.ResourceTarget;
import org.apache.xbind.model.source.PolicyScope;
import org.apache.xbind.spi.extractor.EnabledServicesProvider;
import org.apache.xbind.spi.store.GraphObjectStore;

/**
 * Resolves resource identifiers to the type and key of the entity that represents them, and finds
 * that entity in the store when its service is enabled.
 */
@Log4j2
public class ResourceTargetResolver {
  private final GraphObjectStore store;
  private final ResourceKindTable resourceKindTable;
  private final ProjectIdResolver projectIdResolver;
  private final Supplier<Set<String>> enabledServices;

  public ResourceTargetResolver(
      GraphObjectStore store,
      ResourceKindTable resourceKindTable,
      ProjectIdResolver projectIdResolver,
      EnabledServicesProvider enabledServicesProvider,
      PolicyScope scope) {
    this.store = store;
    this.resourceKindTable = resourceKindTable;
    this.projectIdResolver = projectIdResolver;
    this.enabledServices =
        Suppliers.memoize(() -> loadEnabledServices(enabledServicesProvider, scope));
  }

  public Optional<ResourceTarget> resolve(String identifier) {
    Optional<ResourceIdentifier> parsed = ResourceIdentifier.parse(identifier);
    if (!parsed.isPresent()) {
      log.warn("Unable to parse resource identifier {}", identifier);
      return Optional.empty();
    }
    Optional<ResourceTarget> target = resolveParsed(parsed.get());
    makeLogsForTypeAndKeyResponse(parsed.get(), target);
    return target;
  }

  /**
   * Resolves the organization, folder or project a resource is attached to. Identifiers of those
   * resources resolve to themselves, anything else to the innermost enclosing project, folder or
   * organization found in its path.
   */
  public Optional<ResourceTarget> resolveAttachmentPoint(String identifier) {
    Optional<ResourceIdentifier> parsed = ResourceIdentifier.parse(identifier);
    if (!parsed.isPresent()) {
      log.warn("Unable to parse resource identifier {}", identifier);
      return Optional.empty();
    }
    ResourceIdentifier resource = parsed.get();
    if (ResourceKindTable.isHierarchyKind(resource.getKind())) {
      return resolveParsed(resource);
    }
    Optional<ResourceIdentifier> enclosing =
        enclosing(resource, "projects")
            .or(() -> enclosing(resource, "folders"))
            .or(() -> enclosing(resource, "organizations"));
    if (!enclosing.isPresent()) {
      log.warn("No project, folder or organization found in resource identifier {}", identifier);
      return Optional.empty();
    }
    return resolveParsed(enclosing.get());
  }

  /**
   * Finds the stored entity for a resolved target. The store is only consulted when the service of
   * the resource is enabled, since no entity can have been ingested otherwise.
   */
  public Optional<GraphEntity> findLocalEntity(String identifier, ResourceTarget target) {
    Optional<ResourceIdentifier> parsed = ResourceIdentifier.parse(identifier);
    if (!parsed.isPresent() || !enabledServices.get().contains(parsed.get().getService())) {
      return Optional.empty();
    }
    return store.findEntity(target.getKey());
  }

  @VisibleForTesting
  Optional<ResourceTarget> resolveParsed(ResourceIdentifier identifier) {
    return resourceKindTable
        .lookup(identifier.getKind())
        .map(
            mapping ->
                ResourceTarget.builder()
                    .type(mapping.getType())
                    .key(buildKey(identifier, mapping.getKeyStrategy()))
                    .build());
  }

  private String buildKey(ResourceIdentifier identifier, ResourceKindTable.KeyStrategy strategy) {
    switch (strategy) {
      case NAME:
        return identifier.getLastSegment();
      case PROJECT:
        return projectKey(identifier);
      case PATH:
      default:
        return identifier.getPath();
    }
  }

  private String projectKey(ResourceIdentifier identifier) {
    if (identifier.getPathSegments().size() != 2) {
      return identifier.getPath();
    }
    String project = identifier.getLastSegment();
    if (StringUtils.isNumeric(project)) {
      project = projectIdResolver.resolveProjectId(project).orElse(project);
    }
    return "projects/" + project;
  }

  private static Optional<ResourceIdentifier> enclosing(
      ResourceIdentifier identifier, String collection) {
    return identifier
        .findCollectionId(collection)
        .flatMap(
            id ->
                ResourceIdentifier.parse(
                    String.format(
                        "//%s/%s/%s",
                        ResourceKindTable.RESOURCE_MANAGER_SERVICE, collection, id)));
  }

  private static void makeLogsForTypeAndKeyResponse(
      ResourceIdentifier identifier, Optional<ResourceTarget> target) {
    if (!target.isPresent()) {
      log.warn(
          "Unable to find a type for resource kind {} of {}",
          identifier.getKind(),
          identifier.getIdentifier());
    } else if (target.get().isAmbiguous()) {
      log.debug(
          "Resource kind {} maps to multiple types, {} will be matched on key only",
          identifier.getKind(),
          identifier.getIdentifier());
    }
  }

  private static Set<String> loadEnabledServices(
      EnabledServicesProvider enabledServicesProvider, PolicyScope scope) {
    try {
      Set<String> services =
          ImmutableSet.copyOf(enabledServicesProvider.getEnabledServiceNames(scope));
      log.info("Found {} enabled services for {}", services.size(), scope);
      return services;
    } catch (MissingPermissionException e) {
      log.warn(
          "Missing permission {} to list the enabled services of {}, resources are not matched",
          e.getPermission(),
          scope,
          e);
      return Collections.emptySet();
    }
  }
}
