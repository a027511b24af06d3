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

package io.tracklake.model.dedup;

import java.util.List;

import lombok.Builder;
import lombok.Value;

import io.tracklake.model.Record;

/**
 * Canonical play events together with the number of records removed by each phase.
 *
 * @since 0.1
 */
@Value
@Builder
public class DedupResult {
  // Deduplicated events ordered by play time
  List<Record> events;
  int inputCount;
  // Removed because an event with the same track and play time was already kept
  int exactDuplicates;
  // Removed because they started while the previous play of the same track was still running
  int windowDuplicates;
  // Kept without the duration window check because track name, artist or play time is missing
  int sparseRecords;

  public int getRemovedCount() {
    return exactDuplicates + windowDuplicates;
  }
}
