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

import java.util.List;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Splitter;

/**
 * A parsed full resource name such as {@code
 * //compute.googleapis.com/projects/my-proj/zones/us-east1-b/instances/vm-1}: the service followed
 * by the path of the resource within that service.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ResourceIdentifier {
  private static final String PREFIX = "//";
  private static final Splitter PATH_SPLITTER = Splitter.on('/');

  @NonNull String identifier;
  @NonNull String service;
  @NonNull List<String> pathSegments;

  public static Optional<ResourceIdentifier> parse(String identifier) {
    if (StringUtils.isBlank(identifier) || !identifier.startsWith(PREFIX)) {
      return Optional.empty();
    }
    List<String> parts = PATH_SPLITTER.splitToList(identifier.substring(PREFIX.length()));
    if (parts.size() < 2 || parts.stream().anyMatch(String::isEmpty)) {
      return Optional.empty();
    }
    return Optional.of(
        new ResourceIdentifier(identifier, parts.get(0), parts.subList(1, parts.size())));
  }

  /** The path after the service, e.g. projects/my-proj/zones/us-east1-b/instances/vm-1 */
  public String getPath() {
    return String.join("/", pathSegments);
  }

  public String getLastSegment() {
    return pathSegments.get(pathSegments.size() - 1);
  }

  /**
   * The kind of resource, {@code <service>/<collection>} where the collection is the segment before
   * the resource id. Paths that are not made of collection/id pairs, like a storage bucket name,
   * have the service alone as their kind.
   */
  public String getKind() {
    if (pathSegments.size() % 2 != 0) {
      return service;
    }
    return service + "/" + pathSegments.get(pathSegments.size() - 2);
  }

  /**
   * Finds the id following the innermost occurrence of {@code collection} in the path, e.g. the
   * project of a compute instance.
   */
  public Optional<String> findCollectionId(String collection) {
    if (pathSegments.size() % 2 != 0) {
      return Optional.empty();
    }
    for (int i = pathSegments.size() - 2; i >= 0; i -= 2) {
      if (pathSegments.get(i).equals(collection)) {
        return Optional.of(pathSegments.get(i + 1));
      }
    }
    return Optional.empty();
  }
}
