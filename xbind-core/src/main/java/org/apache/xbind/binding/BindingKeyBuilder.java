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
 
package org.apache.xbind.binding;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import org.apache.commons.lang3.StringUtils;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.hash.Hashing;

import org.apache.xbind.model.entity.InternalIamBinding;
import org.apache.xbind.model.source.BindingCondition;
import org.apache.xbind.model.source.PolicyBinding;

/**
 * Builds the content-derived key of a binding. Two bindings get the same key exactly when they
 * grant the same role to the same set of members on the same resource and project, under the same
 * condition.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class BindingKeyBuilder {
  public static final String KEY_PREFIX = InternalIamBinding.ENTITY_TYPE + ":";

  public static String buildKey(PolicyBinding binding, String resource, String projectName) {
    return KEY_PREFIX
        + Hashing.sha256()
            .hashString(canonicalize(binding, resource, projectName), StandardCharsets.UTF_8)
            .toString();
  }

  @VisibleForTesting
  static String canonicalize(PolicyBinding binding, String resource, String projectName) {
    List<String> members =
        binding.getMembers().stream().sorted().collect(Collectors.toList());
    BindingCondition condition = binding.getCondition();
    return String.join(
        "|",
        "resource=" + StringUtils.defaultString(resource),
        "project=" + StringUtils.defaultString(projectName),
        "role=" + StringUtils.defaultString(binding.getRole()),
        "members=" + String.join(",", members),
        "conditionTitle="
            + (condition == null ? "" : StringUtils.defaultString(condition.getTitle())),
        "conditionDescription="
            + (condition == null ? "" : StringUtils.defaultString(condition.getDescription())),
        "conditionExpression="
            + (condition == null ? "" : StringUtils.defaultString(condition.getExpression())));
  }
}
