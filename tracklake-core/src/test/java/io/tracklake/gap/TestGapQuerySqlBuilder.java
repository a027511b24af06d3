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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;

import org.junit.jupiter.api.Test;

import io.tracklake.model.gap.GapQuery;

public class TestGapQuerySqlBuilder {
  private final GapQuerySqlBuilder sqlBuilder = new GapQuerySqlBuilder();

  private static final GapQuery QUERY =
      GapQuery.builder()
          .sourceTable("play_history")
          .sourceKeyColumn("track_isrc")
          .targetTable("mbz_artists")
          .targetKeyColumn("isrc")
          .recencyColumn("played_at")
          .recencyWindow(Duration.ofHours(48))
          .exclusionColumn("track_isrc")
          .excludedValues(new HashSet<>(Arrays.asList("b", "a")))
          .build();

  @Test
  void testQuoting() {
    assertEquals("\"weird\"\"name\"", GapQuerySqlBuilder.quoteIdentifier("weird\"name"));
    assertEquals(
        "'/data/o''brien.parquet'", GapQuerySqlBuilder.quoteLiteral("/data/o'brien.parquet"));
  }

  @Test
  void testParametersAreBoundInOrder() {
    Instant cutoff = Instant.parse("2024-03-08T00:00:00Z");
    SqlStatement statement =
        sqlBuilder.selectMissing(
            QUERY,
            Collections.singletonList("/data/play_history/p.parquet"),
            Collections.singletonList("/data/mbz_artists/m.parquet"),
            cutoff,
            50,
            25);
    assertEquals(Arrays.asList(cutoff.toEpochMilli(), "a", "b"), statement.getParameters());
    assertTrue(statement.getSql().endsWith("LIMIT 25 OFFSET 50"));
    assertTrue(statement.getSql().contains("LEFT JOIN"));
  }

  @Test
  void testNoJoinWithoutTargetFiles() {
    SqlStatement statement =
        sqlBuilder.countMissing(
            QUERY.toBuilder().excludedValues(Collections.emptySet()).build(),
            Collections.singletonList("/data/play_history/p.parquet"),
            Collections.emptyList(),
            null);
    assertFalse(statement.getSql().contains("JOIN"));
    assertTrue(statement.getParameters().isEmpty());
  }
}
