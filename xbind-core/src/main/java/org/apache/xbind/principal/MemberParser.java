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

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableSet;

import org.apache.xbind.model.principal.ParsedMember;
import org.apache.xbind.model.principal.PrincipalKind;

/**
 * Parses the member strings of a binding, e.g. {@code user:alice@example.com}, {@code allUsers} or
 * {@code deleted:serviceAccount:sa@p.iam.gserviceaccount.com?uid=123}. Unrecognized members parse
 * to empty, they never fail.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class MemberParser {
  private static final String DELETED_PREFIX = "deleted:";
  private static final String UID_SEPARATOR = "?uid=";

  private static final ImmutableSet<PrincipalKind> DELETABLE_KINDS =
      ImmutableSet.of(PrincipalKind.USER, PrincipalKind.SERVICE_ACCOUNT, PrincipalKind.GROUP);
  private static final ImmutableSet<PrincipalKind> CASE_INSENSITIVE_KINDS =
      ImmutableSet.of(
          PrincipalKind.USER,
          PrincipalKind.SERVICE_ACCOUNT,
          PrincipalKind.GROUP,
          PrincipalKind.DOMAIN);

  public static Optional<ParsedMember> parse(String member) {
    if (StringUtils.isBlank(member)) {
      return Optional.empty();
    }
    for (PrincipalKind kind : PrincipalKind.values()) {
      if (kind.isPublic() && kind.getMemberPrefix().equals(member)) {
        return Optional.of(ParsedMember.builder().member(member).kind(kind).build());
      }
    }

    boolean deleted = member.startsWith(DELETED_PREFIX);
    String remainder = deleted ? member.substring(DELETED_PREFIX.length()) : member;
    int separator = remainder.indexOf(':');
    if (separator <= 0) {
      return Optional.empty();
    }
    String prefix = remainder.substring(0, separator);
    String identifier = remainder.substring(separator + 1);
    Optional<PrincipalKind> kind =
        Arrays.stream(PrincipalKind.values())
            .filter(candidate -> !candidate.isPublic())
            .filter(candidate -> candidate.getMemberPrefix().equals(prefix))
            .findFirst();
    if (!kind.isPresent() || (deleted && !DELETABLE_KINDS.contains(kind.get()))) {
      return Optional.empty();
    }

    String uid = null;
    if (deleted && identifier.contains(UID_SEPARATOR)) {
      uid = StringUtils.substringAfter(identifier, UID_SEPARATOR);
      identifier = StringUtils.substringBefore(identifier, UID_SEPARATOR);
    }
    if (StringUtils.isBlank(identifier)) {
      return Optional.empty();
    }
    if (CASE_INSENSITIVE_KINDS.contains(kind.get())) {
      identifier = identifier.toLowerCase(Locale.ROOT);
    }
    return Optional.of(
        ParsedMember.builder()
            .member(member)
            .kind(kind.get())
            .identifier(identifier)
            .deleted(deleted)
            .uid(StringUtils.defaultIfEmpty(uid, null))
            .build());
  }
}
