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

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;

import com.google.api.gax.core.CredentialsProvider;
import com.google.api.gax.core.FixedCredentialsProvider;
import com.google.api.serviceusage.v1.ServiceUsageClient;
import com.google.api.serviceusage.v1.ServiceUsageSettings;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.asset.v1.AssetServiceClient;
import com.google.cloud.asset.v1.AssetServiceSettings;

import org.apache.xbind.exception.ConfigurationException;
import org.apache.xbind.exception.ReadException;

/**
 * Creates clients authenticated with the service account key file of {@link GcpClientConfig}, or
 * with application default credentials when none is configured.
 */
public class DefaultGcpClientFactory extends GcpClientFactory {
  private static final String CLOUD_PLATFORM_SCOPE =
      "https://www.googleapis.com/auth/cloud-platform";

  public DefaultGcpClientFactory(GcpClientConfig gcpConfig) {
    super(gcpConfig);
  }

  @Override
  public AssetServiceClient getAssetServiceClient() {
    AssetServiceSettings.Builder settings = AssetServiceSettings.newBuilder();
    credentialsProvider().ifPresent(settings::setCredentialsProvider);
    try {
      return AssetServiceClient.create(settings.build());
    } catch (IOException e) {
      throw new ReadException("Unable to create Cloud Asset client", e);
    }
  }

  @Override
  public ServiceUsageClient getServiceUsageClient() {
    ServiceUsageSettings.Builder settings = ServiceUsageSettings.newBuilder();
    credentialsProvider().ifPresent(settings::setCredentialsProvider);
    try {
      return ServiceUsageClient.create(settings.build());
    } catch (IOException e) {
      throw new ReadException("Unable to create Service Usage client", e);
    }
  }

  private Optional<CredentialsProvider> credentialsProvider() {
    if (StringUtils.isEmpty(gcpConfig.getCredentialsFile())) {
      return Optional.empty();
    }
    try (InputStream credentials = new FileInputStream(gcpConfig.getCredentialsFile())) {
      return Optional.of(
          FixedCredentialsProvider.create(
              GoogleCredentials.fromStream(credentials).createScoped(CLOUD_PLATFORM_SCOPE)));
    } catch (IOException e) {
      throw new ConfigurationException(
          "Unable to load credentials from " + gcpConfig.getCredentialsFile(), e);
    }
  }
}
