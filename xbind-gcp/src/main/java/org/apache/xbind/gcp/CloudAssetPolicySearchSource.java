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
 
package org.apache.xbind.gcp;

import java.util.List;
import java.util.stream.Collectors;

import lombok.extern.log4j.Log4j2;

import org.apache.commons.lang3.StringUtils;

import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.PermissionDeniedException;
import com.google.cloud.asset.v1.AssetServiceClient;
import com.google.cloud.asset.v1.SearchAllIamPoliciesRequest;
import com.google.cloud.asset.v1.SearchAllIamPoliciesResponse;
import com.google.common.annotations.VisibleForTesting;
import com.google.iam.v1.Binding;
import com.google.type.Expr;

import org.apache.xbind.exception.MissingPermissionException;
import org.apache.xbind.exception.ReadException;
import org.apache.xbind.model.source.BindingCondition;
import org.apache.xbind.model.source.IamPolicySearchResult;
import org.apache.xbind.model.source.PolicyBinding;
import org.apache.xbind.model.source.PolicyScope;
import org.apache.xbind.model.source.PolicySearchPage;
import org.apache.xbind.spi.extractor.PolicySearchSource;

/** Searches IAM policies with the Cloud Asset Inventory searchAllIamPolicies API. */
@Log4j2
public class CloudAssetPolicySearchSource implements PolicySearchSource {
  public static final String SEARCH_ALL_IAM_POLICIES_PERMISSION =
      "cloudasset.assets.searchAllIamPolicies";

  private final AssetServiceClient assetServiceClient;
  private final int pageSize;

  public CloudAssetPolicySearchSource(GcpClientConfig gcpConfig, GcpClientFactory clientFactory) {
    this(clientFactory.getAssetServiceClient(), gcpConfig.getSearchPageSize());
  }

  @VisibleForTesting
  CloudAssetPolicySearchSource(AssetServiceClient assetServiceClient, int pageSize) {
    this.assetServiceClient = assetServiceClient;
    this.pageSize = pageSize;
  }

  @Override
  public PolicySearchPage search(PolicyScope scope, String pageToken) {
    SearchAllIamPoliciesRequest.Builder request =
        SearchAllIamPoliciesRequest.newBuilder().setScope(scope.getName()).setPageSize(pageSize);
    if (scope.getResourceQuery() != null) {
      request.setQuery(scope.getResourceQuery());
    }
    if (StringUtils.isNotEmpty(pageToken)) {
      request.setPageToken(pageToken);
    }
    SearchAllIamPoliciesResponse response;
    try {
      response = assetServiceClient.searchAllIamPoliciesCallable().call(request.build());
    } catch (PermissionDeniedException e) {
      throw new MissingPermissionException(
          SEARCH_ALL_IAM_POLICIES_PERMISSION,
          "Permission denied searching IAM policies of " + scope,
          e);
    } catch (ApiException e) {
      throw new ReadException("Failed to search IAM policies of " + scope, e);
    }
    log.debug("Fetched {} IAM policy search results for {}", response.getResultsCount(), scope);
    return PolicySearchPage.builder()
        .results(
            response.getResultsList().stream()
                .map(CloudAssetPolicySearchSource::toSearchResult)
                .collect(Collectors.toList()))
        .nextPageToken(response.getNextPageToken())
        .build();
  }

  @VisibleForTesting
  static IamPolicySearchResult toSearchResult(
      com.google.cloud.asset.v1.IamPolicySearchResult result) {
    List<PolicyBinding> bindings =
        result.getPolicy().getBindingsList().stream()
            .map(CloudAssetPolicySearchSource::toPolicyBinding)
            .collect(Collectors.toList());
    return IamPolicySearchResult.builder()
        .resource(result.getResource())
        .project(StringUtils.defaultIfEmpty(result.getProject(), null))
        .assetType(StringUtils.defaultIfEmpty(result.getAssetType(), null))
        .bindings(bindings)
        .build();
  }

  private static PolicyBinding toPolicyBinding(Binding binding) {
    return PolicyBinding.builder()
        .role(StringUtils.defaultIfEmpty(binding.getRole(), null))
        .members(binding.getMembersList())
        .condition(binding.hasCondition() ? toCondition(binding.getCondition()) : null)
        .build();
  }

  private static BindingCondition toCondition(Expr expr) {
    return BindingCondition.builder()
        .title(StringUtils.defaultIfEmpty(expr.getTitle(), null))
        .description(StringUtils.defaultIfEmpty(expr.getDescription(), null))
        .expression(expr.getExpression())
        .build();
  }

  @Override
  public void close() {
    assetServiceClient.close();
  }
}
