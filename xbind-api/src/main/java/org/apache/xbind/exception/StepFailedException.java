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
import org.apache.xbind.model.sync.IamBindingSyncResult;

/**
 * Aborts a run when a step fails. Carries the results of the steps that ran, including the failed
 * one.
 */
@Getter
public class StepFailedException extends InternalException {
  private final String stepId;
  private final IamBindingSyncResult partialResult;

  public StepFailedException(String stepId, IamBindingSyncResult partialResult, Throwable e) {
    super(ErrorCode.STEP_FAILURE, "Step " + stepId + " failed: " + e.getMessage(), e);
    this.stepId = stepId;
    this.partialResult = partialResult;
  }
}
