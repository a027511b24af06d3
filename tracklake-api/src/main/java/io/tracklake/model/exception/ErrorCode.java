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

package io.tracklake.model.exception;

import lombok.Getter;

/** Error codes attached to every {@link InternalException}. */
@Getter
public enum ErrorCode {
  INVALID_CONFIGURATION(10001),
  READ_EXCEPTION(10002),
  WRITE_EXCEPTION(10003),
  SCHEMA_CONFLICT(10004),
  UNSUPPORTED_SCHEMA_TYPE(10005),
  MALFORMED_RECORD(10006),
  MISSING_SOURCE_TABLE(10007),
  QUERY_EXCEPTION(10008);

  private final int errorCode;

  ErrorCode(int errorCode) {
    this.errorCode = errorCode;
  }
}
