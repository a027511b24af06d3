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

package io.tracklake.gap;

import java.util.ArrayList;
import java.util.List;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import com.google.common.base.Preconditions;

import io.tracklake.model.gap.BatchPlan;

/** Splits a number of missing items into pages for {@link GapDetector#findMissing}. */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class BatchPlanner {
  private static final BatchPlanner INSTANCE = new BatchPlanner();

  public static BatchPlanner getInstance() {
    return INSTANCE;
  }

  public BatchPlan plan(long totalItems, int batchSize) {
    Preconditions.checkArgument(totalItems >= 0, "totalItems must not be negative");
    Preconditions.checkArgument(batchSize > 0, "batchSize must be positive");
    List<BatchPlan.Batch> batches = new ArrayList<>();
    for (long offset = 0; offset < totalItems; offset += batchSize) {
      batches.add(
          BatchPlan.Batch.builder()
              .index(batches.size())
              .offset(offset)
              .size((int) Math.min(batchSize, totalItems - offset))
              .build());
    }
    return BatchPlan.builder().totalItems(totalItems).batchSize(batchSize).batches(batches).build();
  }
}
