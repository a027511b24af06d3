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

package io.tracklake.model.write;

import lombok.Builder;
import lombok.Value;

/**
 * Result of a table write.
 *
 * @since 0.1
 */
@Value
@Builder(toBuilder = true)
public class WriteResult {
  String tableName;
  // Mode requested by the caller
  WriteMode mode;
  WriteStatus status;
  // Number of incoming records that made it into the table
  long recordsWritten;
  // Number of incoming records dropped as malformed
  long recordsDropped;
  // Number of records in the table after the write
  long totalRecords;
  String message;
  // errorDetails if any
  ErrorDetails errorDetails;

  public boolean isSuccess() {
    return status != WriteStatus.ERROR;
  }

  public static WriteResult noUpdates(String tableName, WriteMode mode, String message) {
    return WriteResult.builder()
        .tableName(tableName)
        .mode(mode)
        .status(WriteStatus.NO_UPDATES)
        .message(message)
        .build();
  }

  public static WriteResult error(
      String tableName, WriteMode mode, Exception e, String errorDescription) {
    return WriteResult.builder()
        .tableName(tableName)
        .mode(mode)
        .status(WriteStatus.ERROR)
        .message(e.getMessage())
        .errorDetails(ErrorDetails.create(e, errorDescription))
        .build();
  }
}
