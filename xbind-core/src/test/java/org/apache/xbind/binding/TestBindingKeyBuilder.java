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

import static org.apache.xbind.IamBindingTestUtils.BUCKET_RESOURCE;
import static org.apache.xbind.IamBindingTestUtils.PROJECT_NAME;
import static org.apache.xbind.IamBindingTestUtils.PROJECT_RESOURCE;
import static org.apache.xbind.IamBindingTestUtils.condition;
import static org.apache.xbind.IamBindingTestUtils.policyBinding;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import org.apache.xbind.model.source.PolicyBinding;

public class TestBindingKeyBuilder {

  @Test
  void testBuildKey_format() {
    String key =
        BindingKeyBuilder.buildKey(
            policyBinding("roles/viewer", "user:alice@example.com"),
            PROJECT_RESOURCE,
            PROJECT_NAME);
    assertTrue(key.startsWith("google_iam_binding:"));
    assertTrue(key.substring("google_iam_binding:".length()).matches("[0-9a-f]{64}"));
  }

  @Test
  void testBuildKey_memberOrderDoesNotMatter() {
    PolicyBinding first =
        policyBinding("roles/viewer", "user:a@example.com", "group:g@example.com");
    PolicyBinding second =
        policyBinding("roles/viewer", "group:g@example.com", "user:a@example.com");
    assertEquals(
        BindingKeyBuilder.buildKey(first, PROJECT_RESOURCE, PROJECT_NAME),
        BindingKeyBuilder.buildKey(second, PROJECT_RESOURCE, PROJECT_NAME));
  }

  @Test
  void testBuildKey_differsOnEveryField() {
    PolicyBinding binding = policyBinding("roles/viewer", "user:a@example.com");
    String key = BindingKeyBuilder.buildKey(binding, PROJECT_RESOURCE, PROJECT_NAME);
    assertNotEquals(key, BindingKeyBuilder.buildKey(binding, BUCKET_RESOURCE, PROJECT_NAME));
    assertNotEquals(key, BindingKeyBuilder.buildKey(binding, PROJECT_RESOURCE, null));
    assertNotEquals(
        key,
        BindingKeyBuilder.buildKey(
            binding.toBuilder().role("roles/editor").build(), PROJECT_RESOURCE, PROJECT_NAME));
    assertNotEquals(
        key,
        BindingKeyBuilder.buildKey(
            policyBinding("roles/viewer", "user:b@example.com"), PROJECT_RESOURCE, PROJECT_NAME));
    assertNotEquals(
        key,
        BindingKeyBuilder.buildKey(
            binding.toBuilder()
                .condition(condition("request.time < timestamp(\"2030-01-01\")"))
                .build(),
            PROJECT_RESOURCE,
            PROJECT_NAME));
  }

  @Test
  void testCanonicalize_withoutRoleOrCondition() {
    PolicyBinding binding = policyBinding(null, "user:b@example.com", "user:a@example.com");
    assertEquals(
        "resource=//storage.googleapis.com/my-bucket|project=|role="
            + "|members=user:a@example.com,user:b@example.com"
            + "|conditionTitle=|conditionDescription=|conditionExpression=",
        BindingKeyBuilder.canonicalize(binding, BUCKET_RESOURCE, null));
  }
}
