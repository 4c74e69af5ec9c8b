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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

import org.apache.xbind.conversion.BindingConstants;
import org.apache.xbind.model.entity.GraphEntity;
import org.apache.xbind.model.entity.InternalIamBinding;
import org.apache.xbind.model.principal.ParsedMember;
import org.apache.xbind.model.source.BindingCondition;
import org.apache.xbind.principal.PrincipalResolver;
import org.apache.xbind.principal.ResolvedPrincipal;
import org.apache.xbind.spi.store.GraphObjectStore;

/** Relates every binding to each of its members. */
@Log4j2
public class BindingPrincipalRelationshipStep extends BindingRelationshipStep {
  private final PrincipalResolver principalResolver;
  private final PrincipalRelationshipTable relationshipTable;

  public BindingPrincipalRelationshipStep(
      GraphObjectStore store,
      PrincipalResolver principalResolver,
      PrincipalRelationshipTable relationshipTable) {
    super(store);
    this.principalResolver = principalResolver;
    this.relationshipTable = relationshipTable;
  }

  @Override
  public String getStepId() {
    return BindingConstants.BINDING_PRINCIPAL_RELATIONSHIPS_STEP;
  }

  @Override
  public List<String> getDependsOn() {
    return Arrays.asList(
        BindingConstants.FETCH_IAM_BINDINGS_STEP, BindingConstants.CREATE_BASIC_ROLES_STEP);
  }

  @Override
  protected void processBinding(InternalIamBinding binding) {
    if (binding.getRole() == null) {
      log.warn("IAM binding {} on {} has no role", binding.getKey(), binding.getResource());
    }
    Map<String, Object> properties = conditionProperties(binding);
    for (String member : binding.getMembers()) {
      ResolvedPrincipal principal = principalResolver.resolve(member);
      Optional<ParsedMember> parsedMember = principal.getParsedMember();
      Optional<PrincipalRelationshipTable.Rule> rule =
          parsedMember.flatMap(parsed -> relationshipTable.lookup(parsed.getKind()));
      if (!rule.isPresent()) {
        log.warn("Unable to parse member {} of IAM binding {}", member, binding.getKey());
        continue;
      }
      Optional<GraphEntity> entity = principal.getEntity();
      if (entity.isPresent()) {
        emit(
            RelationshipBuilder.createDirectRelationship(
                rule.get().getRelationshipClass(), binding, entity.get(), properties));
      } else {
        emit(
            RelationshipBuilder.createMappedRelationship(
                rule.get().getRelationshipClass(),
                binding,
                relationshipTable.buildTargetEntity(rule.get(), parsedMember.get()),
                rule.get().getTargetFilterKeys(),
                rule.get().isSkipTargetCreation(),
                properties));
      }
    }
  }

  private static Map<String, Object> conditionProperties(InternalIamBinding binding) {
    Optional<BindingCondition> condition = binding.getRawCondition();
    if (!condition.isPresent()) {
      return Collections.emptyMap();
    }
    Map<String, Object> properties = new LinkedHashMap<>();
    properties.put("conditionTitle", condition.get().getTitle());
    properties.put("conditionDescription", condition.get().getDescription());
    properties.put("conditionExpression", condition.get().getExpression());
    return properties;
  }
}
