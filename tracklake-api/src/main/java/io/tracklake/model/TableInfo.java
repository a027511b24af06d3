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

package io.tracklake.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Value;

import io.tracklake.model.schema.TableSchema;

/**
 * Footer level description of a table, computed without reading any rows.
 *
 * @since 0.1
 */
@Value
@Builder
public class TableInfo {
  private static final TableInfo NOT_FOUND = TableInfo.builder().exists(false).build();

  boolean exists;
  long recordCount;
  @Builder.Default List<String> columns = Collections.emptyList();
  @Builder.Default TableSchema schema = TableSchema.empty();
  int fileCount;
  // file name to size in bytes, ordered by file name
  @Builder.Default Map<String, Long> fileSizes = Collections.emptyMap();

  public static TableInfo notFound() {
    return NOT_FOUND;
  }

  public long getTotalSizeBytes() {
    return fileSizes.values().stream().mapToLong(Long::longValue).sum();
  }
}
