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

package io.tracklake.model.gap;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Describes which keys of a source table still lack a record in a target table. A key is missing
 * when no target row has the same key, or when {@link #getIncompleteTargetColumn()} is set and
 * every matching target row has a null value in that column.
 *
 * @since 0.1
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class GapQuery {
  // Name of the entity, used to look up the query
  String entityType;
  @NonNull String sourceTable;
  @NonNull String sourceKeyColumn;
  @NonNull String targetTable;
  @NonNull String targetKeyColumn;
  // Source columns returned alongside the key, resolved with min() per key
  @Builder.Default List<String> contextColumns = Collections.emptyList();
  // Source columns defining the natural order of the result, the key always breaks ties
  @Builder.Default List<String> orderBy = Collections.emptyList();
  // Source columns that must be non-null for a row to be considered
  @Builder.Default List<String> requiredSourceColumns = Collections.emptyList();
  // Timestamp column of the source restricting rows to the recency window
  String recencyColumn;
  Duration recencyWindow;
  // Source rows whose exclusion column holds one of these values are ignored
  @Builder.Default Set<String> excludedValues = Collections.emptySet();
  String exclusionColumn;
  String incompleteTargetColumn;

  public boolean hasRecencyWindow() {
    return recencyColumn != null && recencyWindow != null;
  }

  public boolean hasExclusions() {
    return exclusionColumn != null && !excludedValues.isEmpty();
  }
}
