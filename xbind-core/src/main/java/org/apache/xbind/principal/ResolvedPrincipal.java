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
 
package org.apache.xbind.principal;

import java.util.Optional;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Value;

import org.apache.xbind.model.entity.GraphEntity;
import org.apache.xbind.model.principal.ParsedMember;

/** A binding member, with its parsed form when recognized and the local entity when found. */
@Value
@Builder
public class ResolvedPrincipal {
  @NonNull String member;

  @Getter(AccessLevel.NONE)
  ParsedMember parsedMember;

  @Getter(AccessLevel.NONE)
  GraphEntity entity;

  public Optional<ParsedMember> getParsedMember() {
    return Optional.ofNullable(parsedMember);
  }

  public Optional<GraphEntity> getEntity() {
    return Optional.ofNullable(entity);
  }
}
