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

import java.io.Closeable;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

import org.apache.commons.lang3.StringUtils;

import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.PermissionDeniedException;
import com.google.api.serviceusage.v1.ListServicesRequest;
import com.google.api.serviceusage.v1.Service;
import com.google.api.serviceusage.v1.ServiceUsageClient;
import com.google.common.annotations.VisibleForTesting;

import org.apache.xbind.exception.MissingPermissionException;
import org.apache.xbind.exception.ReadException;
import org.apache.xbind.model.source.PolicyScope;
import org.apache.xbind.spi.extractor.EnabledServicesProvider;

/**
 * Lists the services enabled on the searched project, e.g. {@code storage.googleapis.com}. For a
 * folder or organization scope the services of the configured service usage project are listed.
 */
@Log4j2
public class ServiceUsageEnabledServicesProvider implements EnabledServicesProvider, Closeable {
  public static final String LIST_SERVICES_PERMISSION = "serviceusage.services.list";
  private static final String ENABLED_FILTER = "state:ENABLED";

  private final ServiceUsageClient serviceUsageClient;
  private final String serviceUsageProjectId;

  public ServiceUsageEnabledServicesProvider(
      GcpClientConfig gcpConfig, GcpClientFactory clientFactory) {
    this(clientFactory.getServiceUsageClient(), gcpConfig.getServiceUsageProjectId());
  }

  @VisibleForTesting
  ServiceUsageEnabledServicesProvider(
      ServiceUsageClient serviceUsageClient, String serviceUsageProjectId) {
    this.serviceUsageClient = serviceUsageClient;
    this.serviceUsageProjectId = serviceUsageProjectId;
  }

  @Override
  public Set<String> getEnabledServiceNames(PolicyScope scope) {
    String projectId =
        scope.getScopeType() == PolicyScope.ScopeType.PROJECT
            ? scope.getId()
            : serviceUsageProjectId;
    if (StringUtils.isEmpty(projectId)) {
      log.warn(
          "No project to list enabled services for scope {}, set {}",
          scope,
          GcpClientConfig.SERVICE_USAGE_PROJECT_ID_KEY);
      return Collections.emptySet();
    }
    ListServicesRequest request =
        ListServicesRequest.newBuilder()
            .setParent("projects/" + projectId)
            .setFilter(ENABLED_FILTER)
            .build();
    Set<String> services = new HashSet<>();
    try {
      for (Service service : serviceUsageClient.listServices(request).iterateAll()) {
        services.add(service.getConfig().getName());
      }
    } catch (PermissionDeniedException e) {
      throw new MissingPermissionException(
          LIST_SERVICES_PERMISSION, "Permission denied listing services of " + projectId, e);
    } catch (ApiException e) {
      throw new ReadException("Failed to list enabled services of " + projectId, e);
    }
    return services;
  }

  @Override
  public void close() {
    serviceUsageClient.close();
  }
}
