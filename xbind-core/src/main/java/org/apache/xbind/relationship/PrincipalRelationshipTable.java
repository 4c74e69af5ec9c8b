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
 
package org.apache.xbind.relationship;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import com.google.common.collect.ImmutableMap;

import org.apache.xbind.model.principal.ParsedMember;
import org.apache.xbind.model.principal.PrincipalKind;
import org.apache.xbind.model.relationship.RelationshipClass;
import org.apache.xbind.model.relationship.TargetEntity;
import org.apache.xbind.resource.ResourceKindTable;

/** How a binding is related to each kind of principal, and how that principal is described. */
public class PrincipalRelationshipTable {
  public static final String USER_TYPE = "google_user";
  public static final String SERVICE_ACCOUNT_TYPE = "google_iam_service_account";
  public static final String GROUP_TYPE = "google_group";
  public static final String DOMAIN_TYPE = "google_domain";
  public static final String EVERYONE_TYPE = "everyone";
  public static final String AUTHENTICATED_USERS_TYPE = "google_cloud_authenticated_users";

  @Value
  @Builder
  public static class Rule {
    @NonNull String targetType;
    @NonNull String targetClass;
    @NonNull RelationshipClass relationshipClass;
    @NonNull List<List<String>> targetFilterKeys;
    boolean skipTargetCreation;
    // property the normalized identifier is stored under on the target
    String identifierProperty;
    // prefix of the target key, the identifier follows
    @Builder.Default String keyPrefix = "";
    // key of a target that does not depend on the member, e.g. everyone
    String fixedKey;
  }

  private static final PrincipalRelationshipTable INSTANCE =
      new PrincipalRelationshipTable(
          ImmutableMap.<PrincipalKind, Rule>builder()
              .put(PrincipalKind.USER, assigned(USER_TYPE, "User", "email"))
              .put(PrincipalKind.SERVICE_ACCOUNT, assigned(SERVICE_ACCOUNT_TYPE, "User", "email"))
              .put(PrincipalKind.GROUP, assigned(GROUP_TYPE, "UserGroup", "email"))
              .put(PrincipalKind.DOMAIN, assigned(DOMAIN_TYPE, "Group", "domain"))
              .put(PrincipalKind.ALL_USERS, everyone(EVERYONE_TYPE, "global:everyone"))
              .put(
                  PrincipalKind.ALL_AUTHENTICATED_USERS,
                  everyone(AUTHENTICATED_USERS_TYPE, "global:" + AUTHENTICATED_USERS_TYPE))
              .put(PrincipalKind.PROJECT_OWNER, projectMembers())
              .put(PrincipalKind.PROJECT_EDITOR, projectMembers())
              .put(PrincipalKind.PROJECT_VIEWER, projectMembers())
              .build());

  private final Map<PrincipalKind, Rule> rules;

  private PrincipalRelationshipTable(Map<PrincipalKind, Rule> rules) {
    this.rules = rules;
  }

  public static PrincipalRelationshipTable getInstance() {
    return INSTANCE;
  }

  public Optional<Rule> lookup(PrincipalKind kind) {
    return Optional.ofNullable(rules.get(kind));
  }

  /** Describes the principal of a member that has no entity in the graph. */
  public TargetEntity buildTargetEntity(Rule rule, ParsedMember member) {
    Map<String, Object> properties = new LinkedHashMap<>();
    if (rule.getIdentifierProperty() != null && member.getIdentifier() != null) {
      properties.put(rule.getIdentifierProperty(), member.getIdentifier());
    }
    properties.put("member", member.getMember());
    if (member.isDeleted()) {
      properties.put("deleted", true);
    }
    if (member.getUid() != null) {
      properties.put("uid", member.getUid());
    }
    return TargetEntity.builder()
        .type(rule.getTargetType())
        .entityClass(rule.getTargetClass())
        .key(targetKey(rule, member))
        .properties(properties)
        .build();
  }

  static String targetKey(Rule rule, ParsedMember member) {
    return rule.getFixedKey() != null
        ? rule.getFixedKey()
        : rule.getKeyPrefix() + member.getIdentifier();
  }

  private static Rule assigned(String targetType, String targetClass, String identifierProperty) {
    return Rule.builder()
        .targetType(targetType)
        .targetClass(targetClass)
        .relationshipClass(RelationshipClass.ASSIGNED)
        .targetFilterKeys(RelationshipBuilder.TYPE_AND_KEY_FILTER)
        .skipTargetCreation(false)
        .identifierProperty(identifierProperty)
        .build();
  }

  private static Rule everyone(String targetType, String key) {
    return Rule.builder()
        .targetType(targetType)
        .targetClass("UserGroup")
        .relationshipClass(RelationshipClass.ASSIGNED)
        .targetFilterKeys(RelationshipBuilder.TYPE_AND_KEY_FILTER)
        .skipTargetCreation(false)
        .fixedKey(key)
        .build();
  }

  // members of the owner, editor or viewer role of a project; the project itself is never created
  private static Rule projectMembers() {
    return Rule.builder()
        .targetType(ResourceKindTable.PROJECT_TYPE)
        .targetClass("Project")
        .relationshipClass(RelationshipClass.ASSIGNED)
        .targetFilterKeys(RelationshipBuilder.TYPE_AND_KEY_FILTER)
        .skipTargetCreation(true)
        .identifierProperty("projectId")
        .keyPrefix("projects/")
        .build();
  }
}
