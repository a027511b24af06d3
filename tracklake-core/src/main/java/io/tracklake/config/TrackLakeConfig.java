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

package io.tracklake.config;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import io.tracklake.model.dedup.PlayEventColumns;
import io.tracklake.model.gap.GapQuery;
import io.tracklake.model.write.MalformedRecordPolicy;
import io.tracklake.model.write.MergeKeyPolicy;
import io.tracklake.parquet.ParquetFileConfig;

/**
 * Configuration of an {@link io.tracklake.store.IncrementalStore}, usually loaded with {@link
 * TrackLakeConfigLoader}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TrackLakeConfig {
  // Directory holding one sub directory per table
  String basePath;
  // Table name to the ordered merge key columns
  @Builder.Default Map<String, List<String>> mergeKeys = Collections.emptyMap();
  @Builder.Default MalformedRecordPolicy malformedRecordPolicy = MalformedRecordPolicy.DROP;
  @Builder.Default String playHistoryTable = "play_history";
  @Builder.Default PlayEventColumns playEventColumns = PlayEventColumns.defaults();
  // Entity type to the query finding its missing keys
  @Builder.Default Map<String, GapQuery> gapQueries = Collections.emptyMap();
  @Builder.Default ParquetFileConfig parquet = ParquetFileConfig.defaults();

  public MergeKeyPolicy getMergeKeyPolicy() {
    return MergeKeyPolicy.builder().mergeKeys(mergeKeys).build();
  }
}
