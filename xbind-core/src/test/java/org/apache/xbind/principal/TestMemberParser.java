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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import org.apache.xbind.model.principal.ParsedMember;
import org.apache.xbind.model.principal.PrincipalKind;

public class TestMemberParser {

  @ParameterizedTest
  @CsvSource({
    "user:Alice@Example.com,USER,alice@example.com",
    "serviceAccount:sa@my-proj.iam.gserviceaccount.com,SERVICE_ACCOUNT,sa@my-proj.iam.gserviceaccount.com",
    "group:Devs@example.com,GROUP,devs@example.com",
    "domain:Example.com,DOMAIN,example.com",
    "projectOwner:my-proj,PROJECT_OWNER,my-proj",
    "projectEditor:my-proj,PROJECT_EDITOR,my-proj",
    "projectViewer:My-Proj,PROJECT_VIEWER,My-Proj"
  })
  void testParse(String member, PrincipalKind expectedKind, String expectedIdentifier) {
    ParsedMember parsed = MemberParser.parse(member).get();
    assertEquals(member, parsed.getMember());
    assertEquals(expectedKind, parsed.getKind());
    assertEquals(expectedIdentifier, parsed.getIdentifier());
    assertFalse(parsed.isDeleted());
    assertNull(parsed.getUid());
  }

  @Test
  void testParse_publicMembers() {
    ParsedMember allUsers = MemberParser.parse("allUsers").get();
    assertEquals(PrincipalKind.ALL_USERS, allUsers.getKind());
    assertNull(allUsers.getIdentifier());
    assertEquals(
        PrincipalKind.ALL_AUTHENTICATED_USERS,
        MemberParser.parse("allAuthenticatedUsers").get().getKind());
  }

  @Test
  void testParse_deletedMember() {
    ParsedMember parsed =
        MemberParser.parse("deleted:serviceAccount:Old@my-proj.iam.gserviceaccount.com?uid=12345")
            .get();
    assertEquals(PrincipalKind.SERVICE_ACCOUNT, parsed.getKind());
    assertEquals("old@my-proj.iam.gserviceaccount.com", parsed.getIdentifier());
    assertTrue(parsed.isDeleted());
    assertEquals("12345", parsed.getUid());

    ParsedMember withoutUid = MemberParser.parse("deleted:user:bob@example.com").get();
    assertTrue(withoutUid.isDeleted());
    assertNull(withoutUid.getUid());
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "",
        " ",
        "user",
        "user:",
        ":alice@example.com",
        "robot:r2d2",
        "allUsers:extra",
        "deleted:domain:example.com",
        "deleted:allUsers",
        "deleted:user:?uid=1"
      })
  void testParse_unrecognized(String member) {
    assertFalse(MemberParser.parse(member).isPresent());
  }

  @Test
  void testParse_null() {
    assertFalse(MemberParser.parse(null).isPresent());
  }
}
