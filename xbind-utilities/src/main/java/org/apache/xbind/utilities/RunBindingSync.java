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
 
package org.apache.xbind.utilities;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;

import lombok.Data;
import lombok.extern.log4j.Log4j2;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import com.fasterxml.jackson.annotation.JsonMerge;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.annotations.VisibleForTesting;

import org.apache.xbind.config.IamBindingConfig;
import org.apache.xbind.conversion.IamBindingController;
import org.apache.xbind.event.LoggingMissingPermissionNotifier;
import org.apache.xbind.exception.StepFailedException;
import org.apache.xbind.gcp.CloudAssetPolicySearchSource;
import org.apache.xbind.gcp.DefaultGcpClientFactory;
import org.apache.xbind.gcp.GcpClientConfig;
import org.apache.xbind.gcp.GcpClientFactory;
import org.apache.xbind.gcp.ServiceUsageEnabledServicesProvider;
import org.apache.xbind.model.entity.InternalEntity;
import org.apache.xbind.model.sync.IamBindingSyncResult;
import org.apache.xbind.model.sync.MissingPermissionEvent;
import org.apache.xbind.model.sync.StepResult;
import org.apache.xbind.role.ManagedRoleCatalog;
import org.apache.xbind.spi.store.GraphObjectStore;
import org.apache.xbind.store.InMemoryGraphObjectStore;

/**
 * Provides a standalone runner that resolves the IAM bindings of a Google Cloud project, folder or
 * organization and writes the resulting graph as JSON.
 */
@Log4j2
public class RunBindingSync {

  public static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
  private static final String DEFAULTS_RESOURCE = "xbind-defaults.yaml";
  private static final String CONFIG_OPTION = "c";
  private static final String ENTITIES_OPTION = "e";
  private static final String OUTPUT_OPTION = "o";
  private static final String HELP_OPTION = "h";

  private static final Options OPTIONS =
      new Options()
          .addRequiredOption(
              CONFIG_OPTION,
              "config",
              true,
              "The path to a yaml file containing the scope and client configuration")
          .addOption(
              ENTITIES_OPTION,
              "entities",
              true,
              "The path to a graph json file whose entities (projects, users, resources...) are "
                  + "loaded before the bindings are resolved")
          .addOption(
              OUTPUT_OPTION,
              "output",
              true,
              "The path of the graph json file to write. Nothing is written when not set.")
          .addOption(HELP_OPTION, "help", false, "Displays help information to run this utility");

  public static void main(String[] args) throws IOException {
    CommandLineParser parser = new DefaultParser();

    CommandLine cmd;
    try {
      cmd = parser.parse(OPTIONS, args);
    } catch (ParseException e) {
      new HelpFormatter().printHelp("xbind-utilities.jar", OPTIONS, true);
      return;
    }

    if (cmd.hasOption(HELP_OPTION)) {
      HelpFormatter formatter = new HelpFormatter();
      formatter.printHelp("RunBindingSync", OPTIONS);
      return;
    }

    BindingSyncConfig syncConfig =
        loadBindingSyncConfig(Files.readAllBytes(Paths.get(cmd.getOptionValue(CONFIG_OPTION))));
    IamBindingConfig bindingConfig = IamBindingConfig.of(syncConfig.getConfiguration());
    GcpClientConfig gcpConfig = GcpClientConfig.of(syncConfig.getConfiguration());

    GraphObjectStore store = new InMemoryGraphObjectStore();
    if (cmd.hasOption(ENTITIES_OPTION)) {
      loadEntities(store, cmd.getOptionValue(ENTITIES_OPTION));
    }

    LoggingMissingPermissionNotifier notifier = new LoggingMissingPermissionNotifier();
    GcpClientFactory clientFactory = new DefaultGcpClientFactory(gcpConfig);
    try (CloudAssetPolicySearchSource policySearchSource =
            new CloudAssetPolicySearchSource(gcpConfig, clientFactory);
        ServiceUsageEnabledServicesProvider enabledServicesProvider =
            new ServiceUsageEnabledServicesProvider(gcpConfig, clientFactory)) {
      log.info("Running binding sync for {}", bindingConfig.getPolicyScope());
      IamBindingSyncResult result =
          IamBindingController.create(
                  bindingConfig,
                  policySearchSource,
                  enabledServicesProvider,
                  store,
                  notifier,
                  ManagedRoleCatalog.loadDefault())
              .sync();
      logResult(result);
    } catch (StepFailedException e) {
      log.error(String.format("Error running binding sync at step %s", e.getStepId()), e);
      logResult(e.getPartialResult());
    }
    for (MissingPermissionEvent event : notifier.getEvents()) {
      log.warn("Missing permission: {}", event.getDescription());
    }

    if (cmd.hasOption(OUTPUT_OPTION)) {
      try (OutputStream outputStream =
          Files.newOutputStream(Paths.get(cmd.getOptionValue(OUTPUT_OPTION)))) {
        GraphExporter.export(store, outputStream);
      }
    }
  }

  @VisibleForTesting
  static void loadEntities(GraphObjectStore store, String entitiesPath) throws IOException {
    try (InputStream inputStream = Files.newInputStream(Paths.get(entitiesPath))) {
      for (InternalEntity entity : GraphExporter.readEntities(inputStream)) {
        store.addEntity(entity);
      }
    }
    log.info("Loaded {} entities from {}", store.getEntities().size(), entitiesPath);
  }

  private static void logResult(IamBindingSyncResult result) {
    for (StepResult stepResult : result.getStepResults()) {
      log.info(
          "Step {} {}: {} entities, {} relationships, {} duplicates skipped in {}",
          stepResult.getStepId(),
          stepResult.getStatusCode(),
          stepResult.getEntitiesCreated(),
          stepResult.getRelationshipsCreated(),
          stepResult.getDuplicatesSkipped(),
          stepResult.getDuration());
    }
  }

  /**
   * Loads the sync config. The method first loads the default configs and then merges the configs
   * provided by the user.
   *
   * @param customConfig the yaml config provided by the user
   * @return the merged config
   */
  @VisibleForTesting
  static BindingSyncConfig loadBindingSyncConfig(byte[] customConfig) throws IOException {
    try (InputStream inputStream =
        RunBindingSync.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
      BindingSyncConfig config = YAML_MAPPER.readValue(inputStream, BindingSyncConfig.class);
      if (customConfig != null) {
        YAML_MAPPER.readerForUpdating(config).readValue(customConfig);
      }
      return config;
    }
  }

  @Data
  public static class BindingSyncConfig {
    /** The xbind.* configuration keys, e.g. xbind.scope.projectId */
    @JsonProperty("configuration")
    @JsonMerge
    Map<String, String> configuration;
  }
}
