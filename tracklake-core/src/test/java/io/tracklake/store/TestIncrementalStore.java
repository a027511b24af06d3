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

package io.tracklake.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.hadoop.conf.Configuration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.tracklake.config.TrackLakeConfig;
import io.tracklake.config.TrackLakeConfigLoader;
import io.tracklake.model.Record;
import io.tracklake.model.context.OperationContext;
import io.tracklake.model.gap.BatchPlan;
import io.tracklake.model.gap.GapResult;
import io.tracklake.model.write.WriteMode;
import io.tracklake.model.write.WriteResult;
import io.tracklake.model.write.WriteStatus;

public class TestIncrementalStore {
  private static final Instant T = Instant.parse("2024-03-01T12:00:00Z");

  @TempDir java.nio.file.Path tempDir;

  private OperationContext operationContext;
  private IncrementalStore store;

  @BeforeEach
  void setUp() {
    operationContext = new OperationContext();
    TrackLakeConfig config =
        TrackLakeConfigLoader.loadDefaults().toBuilder().basePath(tempDir.toString()).build();
    store =
        IncrementalStore.fromConfig(
            config,
            new Configuration(),
            operationContext,
            Clock.fixed(T.plusSeconds(3600), ZoneOffset.UTC));
  }

  private static Record play(String trackId, long offsetSeconds, String artistId) {
    return Record.builder()
        .set("track_id", trackId)
        .set("track_name", "Song " + trackId)
        .set("artist", "Artist " + artistId)
        .set("artist_id", artistId)
        .set("played_at", T.plusSeconds(offsetSeconds))
        .set("duration_ms", 180_000L)
        .build();
  }

  @Test
  void testAppendPlayEventsDeduplicates() {
    WriteResult result =
        store.appendPlayEvents(
            Arrays.asList(play("t1", 0, "a1"), play("t1", 90, "a1"), play("t1", 400, "a1")));
    assertEquals(WriteStatus.SUCCESS, result.getStatus());
    assertEquals(2, result.getRecordsWritten());
    assertEquals(2, store.readTable("play_history").get().getRecordCount());
    assertEquals(1L, operationContext.getCount(OperationContext.WINDOW_DUPLICATES));
  }

  @Test
  void testAppendingSameEventsTwiceIsNoUpdates() {
    List<Record> events = Arrays.asList(play("t1", 0, "a1"), play("t2", 30, "a2"));
    assertEquals(WriteStatus.SUCCESS, store.appendPlayEvents(events).getStatus());
    WriteResult again = store.appendPlayEvents(events);
    assertEquals(WriteStatus.NO_UPDATES, again.getStatus());
    assertEquals(2, again.getTotalRecords());
    assertEquals(1, store.tableInfo("play_history").getFileCount());
  }

  @Test
  void testAppendOverlappingFeeds() {
    store.appendPlayEvents(Arrays.asList(play("t1", 0, "a1"), play("t2", 200, "a2")));
    WriteResult result =
        store.appendPlayEvents(
            Arrays.asList(play("t2", 200, "a2"), play("t2", 260, "a2"), play("t3", 900, "a3")));
    assertEquals(WriteStatus.SUCCESS, result.getStatus());
    assertEquals(1, result.getRecordsWritten());
    assertEquals(3, result.getTotalRecords());
  }

  @Test
  void testAppendWithNewColumn() {
    store.appendPlayEvents(Collections.singletonList(play("t1", 0, "a1")));
    WriteResult result =
        store.appendPlayEvents(
            Collections.singletonList(play("t2", 500, "a2").with("track_isrc", "US123")));
    assertEquals(WriteStatus.SUCCESS, result.getStatus());
    assertTrue(store.tableInfo("play_history").getColumns().contains("track_isrc"));
  }

  @Test
  void testAppendConflictingEventsIsError() {
    store.appendPlayEvents(Collections.singletonList(play("t1", 0, "a1")));
    WriteResult result =
        store.appendPlayEvents(
            Collections.singletonList(play("t2", 500, "a2").with("duration_ms", "long")));
    assertEquals(WriteStatus.ERROR, result.getStatus());
    assertEquals(1, store.readTable("play_history").get().getRecordCount());
  }

  @Test
  void testCompactPlayHistory() {
    assertEquals(WriteStatus.NO_UPDATES, store.compactPlayHistory().getStatus());
    store.writeTable(
        "play_history",
        Arrays.asList(play("t1", 0, "a1"), play("t1", 0, "a1"), play("t1", 60, "a1")),
        WriteMode.APPEND);
    WriteResult result = store.compactPlayHistory();
    assertEquals(WriteStatus.SUCCESS, result.getStatus());
    assertEquals(2, result.getRecordsDropped());
    assertEquals(1, result.getTotalRecords());
    assertEquals(WriteStatus.NO_UPDATES, store.compactPlayHistory().getStatus());
  }

  @Test
  void testEnrichmentWorkflow() {
    store.appendPlayEvents(
        Arrays.asList(
            play("t1", 0, "a1"),
            play("t2", 300, "a2"),
            play("t3", 600, "a3"),
            play("t4", 900, "a4")));
    store.writeTable(
        "artists",
        Collections.singletonList(
            Record.builder().set("artist_id", "a2").set("popularity", 50).build()),
        WriteMode.MERGE);

    assertTrue(store.getEntityTypes().contains("artists"));
    assertEquals(3, store.countMissing("artists"));
    BatchPlan plan = store.planBatches("artists", 2);
    assertEquals(2, plan.getBatchCount());

    GapResult first = store.getBatch("artists", 2, plan.getBatches().get(0).getOffset());
    GapResult second = store.getBatch("artists", 2, plan.getBatches().get(1).getOffset());
    Set<String> missing = new HashSet<>(first.getKeys());
    missing.addAll(second.getKeys());
    assertEquals(new HashSet<>(Arrays.asList("a1", "a3", "a4")), missing);

    List<Record> fetched =
        Arrays.asList(
            Record.builder().set("artist_id", "a1").set("popularity", 10).build(),
            Record.builder().set("artist_id", "a3").set("popularity", 30).build(),
            Record.builder().set("artist_id", "a4").set("popularity", 40).build());
    assertEquals(3, store.writeTable("artists", fetched, WriteMode.MERGE).getRecordsWritten());
    assertEquals(0, store.countMissing("artists"));

    Map<String, Boolean> exists =
        store.checkExists("artists", "artist_id", Arrays.asList("a1", "a9"));
    assertTrue(exists.get("a1"));
    assertFalse(exists.get("a9"));
    assertEquals(4, store.tableInfo("artists").getRecordCount());
  }

  @Test
  void testDelegatesTableOperations() {
    assertFalse(store.tableExists("albums"));
    store.writeTable(
        "albums",
        Collections.singletonList(Record.builder().set("album_id", "b1").build()),
        WriteMode.MERGE);
    assertTrue(store.tableExists("albums"));
    assertEquals(0, store.cleanupOldFiles("albums", 1));
    assertEquals("play_history", store.getPlayHistoryTable());
    List<Record> duplicated = Arrays.asList(play("t1", 0, "a1"), play("t1", 0, "a1"));
    assertEquals(1, store.deduplicate(duplicated).getEvents().size());
  }
}
