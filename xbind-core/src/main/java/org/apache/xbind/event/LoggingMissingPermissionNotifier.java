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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.extern.log4j.Log4j2;

import org.apache.xbind.model.sync.MissingPermissionEvent;
import org.apache.xbind.spi.event.MissingPermissionNotifier;

/** Logs every missing permission event and keeps them for the end-of-run summary. */
@Log4j2
public class LoggingMissingPermissionNotifier implements MissingPermissionNotifier {
  private final List<MissingPermissionEvent> events = new ArrayList<>();

  @Override
  public synchronized void publish(MissingPermissionEvent event) {
    log.warn(event.getDescription());
    events.add(event);
  }

  public synchronized List<MissingPermissionEvent> getEvents() {
    return Collections.unmodifiableList(new ArrayList<>(events));
  }
}
