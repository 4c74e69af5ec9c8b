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
 
package org.apache.xbind.exception;

import lombok.Getter;

import org.apache.xbind.model.exception.ErrorCode;
import org.apache.xbind.model.exception.InternalException;

/**
 * Thrown by a source when the caller's credentials lack a permission required to read policy
 * state. Callers treat this as non-fatal: the step stops, a notification is published and the
 * remaining steps continue.
 */
@Getter
public class MissingPermissionException extends InternalException {
  /** The permission the request was denied for, e.g. cloudasset.assets.searchAllIamPolicies */
  private final String permission;

  public MissingPermissionException(String permission, String message, Throwable e) {
    super(ErrorCode.MISSING_PERMISSION, message, e);
    this.permission = permission;
  }

  public MissingPermissionException(String permission, String message) {
    super(ErrorCode.MISSING_PERMISSION, message);
    this.permission = permission;
  }
}
