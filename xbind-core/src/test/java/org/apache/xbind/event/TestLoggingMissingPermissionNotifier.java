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
 
package org.apache.xbind.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import org.apache.xbind.model.sync.MissingPermissionEvent;

public class TestLoggingMissingPermissionNotifier {

  @Test
  void testPublish() {
    LoggingMissingPermissionNotifier notifier = new LoggingMissingPermissionNotifier();
    MissingPermissionEvent search =
        MissingPermissionEvent.builder()
            .stepId("fetch-iam-bindings")
            .permission("cloudasset.assets.searchAllIamPolicies")
            .build();
    MissingPermissionEvent services =
        MissingPermissionEvent.builder()
            .stepId("create-binding-any-resource-relationships")
            .permission("serviceusage.services.list")
            .build();
    notifier.publish(search);
    notifier.publish(services);

    List<MissingPermissionEvent> events = notifier.getEvents();
    assertEquals(Arrays.asList(search, services), events);
    assertEquals(
        "Step \"fetch-iam-bindings\" failed to complete due to missing permission: "
            + "cloudasset.assets.searchAllIamPolicies",
        events.get(0).getDescription());
    assertThrows(UnsupportedOperationException.class, () -> events.add(search));
  }
}
