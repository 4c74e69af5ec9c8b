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

import java.util.Map;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.Value;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.apache.xbind.model.resource.ResourceTarget;

/** Maps the kind of a resource identifier to the graph type and key of the matching entity. */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class ResourceKindTable {
  public static final String ORGANIZATION_TYPE = "google_cloud_organization";
  public static final String FOLDER_TYPE = "google_cloud_folder";
  public static final String PROJECT_TYPE = "google_cloud_project";

  public static final String RESOURCE_MANAGER_SERVICE = "cloudresourcemanager.googleapis.com";
  public static final String ORGANIZATION_KIND = RESOURCE_MANAGER_SERVICE + "/organizations";
  public static final String FOLDER_KIND = RESOURCE_MANAGER_SERVICE + "/folders";
  public static final String PROJECT_KIND = RESOURCE_MANAGER_SERVICE + "/projects";

  private static final ImmutableSet<String> HIERARCHY_KINDS =
      ImmutableSet.of(ORGANIZATION_KIND, FOLDER_KIND, PROJECT_KIND);

  /** How the key of an entity is derived from its resource identifier. */
  public enum KeyStrategy {
    /** The path after the service, e.g. projects/p/topics/t */
    PATH,
    /** The last path segment, e.g. a bucket name or a service account email */
    NAME,
    /** projects/<projectId>, translating a project number into the project id */
    PROJECT
  }

  @Value
  public static class KindMapping {
    @NonNull String type;
    @NonNull KeyStrategy keyStrategy;
  }

  private static final ResourceKindTable DEFAULT =
      new ResourceKindTable(
          ImmutableMap.<String, KindMapping>builder()
              .put(ORGANIZATION_KIND, path(ORGANIZATION_TYPE))
              .put(FOLDER_KIND, path(FOLDER_TYPE))
              .put(PROJECT_KIND, new KindMapping(PROJECT_TYPE, KeyStrategy.PROJECT))
              .put(
                  "storage.googleapis.com",
                  new KindMapping("google_storage_bucket", KeyStrategy.NAME))
              .put(
                  "iam.googleapis.com/serviceAccounts",
                  new KindMapping("google_iam_service_account", KeyStrategy.NAME))
              .put("iam.googleapis.com/roles", path("google_iam_role"))
              .put("compute.googleapis.com/instances", path("google_compute_instance"))
              .put("compute.googleapis.com/disks", path("google_compute_disk"))
              .put("compute.googleapis.com/networks", path("google_compute_network"))
              .put("compute.googleapis.com/subnetworks", path("google_compute_subnetwork"))
              .put("compute.googleapis.com/images", path("google_compute_image"))
              // global and regional backend services share a kind
              .put("compute.googleapis.com/backendServices", ambiguous())
              .put("bigquery.googleapis.com/datasets", path("google_bigquery_dataset"))
              .put("bigquery.googleapis.com/tables", path("google_bigquery_table"))
              .put("pubsub.googleapis.com/topics", path("google_pubsub_topic"))
              .put("pubsub.googleapis.com/subscriptions", path("google_pubsub_subscription"))
              .put("cloudkms.googleapis.com/keyRings", path("google_kms_key_ring"))
              .put("cloudkms.googleapis.com/cryptoKeys", path("google_kms_crypto_key"))
              .put("secretmanager.googleapis.com/secrets", path("google_secret_manager_secret"))
              .put("spanner.googleapis.com/instances", path("google_spanner_instance"))
              .put("spanner.googleapis.com/databases", path("google_spanner_database"))
              .put("run.googleapis.com/services", path("google_cloud_run_service"))
              .put("cloudfunctions.googleapis.com/functions", path("google_cloud_function"))
              // MySQL, PostgreSQL and SQL Server instances share a kind
              .put("sqladmin.googleapis.com/instances", ambiguous())
              .put("appengine.googleapis.com/apps", path("google_app_engine_application"))
              .put("appengine.googleapis.com/services", path("google_app_engine_service"))
              // standard and flexible versions share a kind
              .put("appengine.googleapis.com/versions", ambiguous())
              .build());

  private final Map<String, KindMapping> mappings;

  public static ResourceKindTable getDefault() {
    return DEFAULT;
  }

  public static ResourceKindTable of(Map<String, KindMapping> mappings) {
    return new ResourceKindTable(ImmutableMap.copyOf(mappings));
  }

  public Optional<KindMapping> lookup(String kind) {
    return Optional.ofNullable(mappings.get(kind));
  }

  /** True for organizations, folders and projects, the points basic roles attach to. */
  public static boolean isHierarchyKind(String kind) {
    return HIERARCHY_KINDS.contains(kind);
  }

  private static KindMapping path(String type) {
    return new KindMapping(type, KeyStrategy.PATH);
  }

  private static KindMapping ambiguous() {
    return new KindMapping(ResourceTarget.MULTIPLE_TYPES_FOR_RESOURCE_KIND, KeyStrategy.PATH);
  }
}
