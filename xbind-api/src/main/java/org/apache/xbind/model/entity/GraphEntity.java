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
 
package org.apache.xbind.model.entity;

import java.util.Map;

import org.apache.xbind.annotations.Evolving;

/**
 * An entity stored in the graph. Every entity is identified by a key that is unique across the
 * whole graph, and carries a type (e.g. google_iam_binding) and a class (e.g. AccessPolicy).
 */
@Evolving
public interface GraphEntity {
  String getKey();

  String getType();

  String getEntityClass();

  /**
   * The entity's attributes other than key, type and class, keyed by the attribute name used in
   * the graph.
   */
  Map<String, Object> getProperties();
}
