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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

public class TestResourceIdentifier {

  @ParameterizedTest
  @CsvSource({
    "//cloudresourcemanager.googleapis.com/projects/123,cloudresourcemanager.googleapis.com/projects",
    "//storage.googleapis.com/my-bucket,storage.googleapis.com",
    "//compute.googleapis.com/projects/p/zones/us-east1-b/instances/vm-1,compute.googleapis.com/instances",
    "//cloudkms.googleapis.com/projects/p/locations/global/keyRings/ring/cryptoKeys/key,cloudkms.googleapis.com/cryptoKeys"
  })
  void testGetKind(String identifier, String expectedKind) {
    assertEquals(expectedKind, ResourceIdentifier.parse(identifier).get().getKind());
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "",
        "   ",
        "storage.googleapis.com/my-bucket",
        "//storage.googleapis.com",
        "//storage.googleapis.com/",
        "//compute.googleapis.com/projects//instances/vm-1"
      })
  void testParse_malformed(String identifier) {
    assertFalse(ResourceIdentifier.parse(identifier).isPresent());
  }

  @Test
  void testParse_components() {
    ResourceIdentifier identifier =
        ResourceIdentifier.parse("//pubsub.googleapis.com/projects/my-proj/topics/events").get();
    assertEquals("pubsub.googleapis.com", identifier.getService());
    assertEquals("projects/my-proj/topics/events", identifier.getPath());
    assertEquals("events", identifier.getLastSegment());
  }

  @Test
  void testFindCollectionId() {
    ResourceIdentifier identifier =
        ResourceIdentifier.parse(
                "//compute.googleapis.com/projects/my-proj/zones/us-east1-b/instances/vm-1")
            .get();
    assertEquals(Optional.of("my-proj"), identifier.findCollectionId("projects"));
    assertEquals(Optional.of("us-east1-b"), identifier.findCollectionId("zones"));
    assertFalse(identifier.findCollectionId("folders").isPresent());
    // ids are not collections
    assertFalse(identifier.findCollectionId("my-proj").isPresent());
    assertFalse(
        ResourceIdentifier.parse("//storage.googleapis.com/projects")
            .get()
            .findCollectionId("projects")
            .isPresent());
  }
}
