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
 
package org.apache.xbind.spi.extractor;

import java.io.Closeable;

import org.apache.xbind.model.source.PolicySearchPage;
import org.apache.xbind.model.source.PolicyScope;

/**
 * A client that searches the IAM policies attached to all resources within a scope. Results are
 * returned one page at a time; pagination itself is driven by the caller.
 */
public interface PolicySearchSource extends Closeable {
  /**
   * Fetches one page of policy search results.
   *
   * @param scope the organization, folder or project to search within
   * @param pageToken the token returned with the previous page, null for the first page
   * @return the page of results and the token for the next page
   * @throws org.apache.xbind.exception.MissingPermissionException if the caller is not allowed to
   *     search policies in the scope
   */
  PolicySearchPage search(PolicyScope scope, String pageToken);
}
