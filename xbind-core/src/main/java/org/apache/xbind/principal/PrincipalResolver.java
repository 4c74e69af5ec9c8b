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

import lombok.RequiredArgsConstructor;

import com.google.common.collect.ImmutableSet;

import org.apache.xbind.model.entity.GraphEntity;
import org.apache.xbind.model.principal.ParsedMember;
import org.apache.xbind.model.principal.PrincipalKind;
import org.apache.xbind.spi.store.GraphObjectStore;

@RequiredArgsConstructor
public class PrincipalResolver {
  // only these kinds are ingested as entities keyed by their email
  private static final ImmutableSet<PrincipalKind> LOCAL_KINDS =
      ImmutableSet.of(PrincipalKind.USER, PrincipalKind.SERVICE_ACCOUNT, PrincipalKind.GROUP);

  private final GraphObjectStore store;

  public ResolvedPrincipal resolve(String member) {
    Optional<ParsedMember> parsedMember = MemberParser.parse(member);
    Optional<GraphEntity> entity =
        parsedMember
            .filter(parsed -> LOCAL_KINDS.contains(parsed.getKind()) && !parsed.isDeleted())
            .flatMap(parsed -> store.findEntity(parsed.getIdentifier()));
    return ResolvedPrincipal.builder()
        .member(member == null ? "" : member)
        .parsedMember(parsedMember.orElse(null))
        .entity(entity.orElse(null))
        .build();
  }
}
