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

package io.tracklake.merge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import io.tracklake.model.Record;
import io.tracklake.model.Table;
import io.tracklake.model.exception.ErrorCode;
import io.tracklake.model.exception.MalformedRecordException;
import io.tracklake.model.exception.SchemaConflictException;
import io.tracklake.model.schema.ColumnType;
import io.tracklake.model.schema.TableSchema;
import io.tracklake.model.write.MalformedRecordPolicy;
import io.tracklake.model.write.MergeKeyPolicy;
import io.tracklake.model.write.WriteMode;

public class TestMergeEngine {
  private final MergeEngine mergeEngine = MergeEngine.builder().build();

  private static Record artist(String id, Object popularity) {
    return Record.builder().set("artist_id", id).set("popularity", popularity).build();
  }

  private static Table table(String name, Record... records) {
    List<Record> recordList = Arrays.asList(records);
    TableSchema schema = TableSchema.inferFrom(recordList).resolveNullColumns(ColumnType.STRING);
    return new Table(
        name, schema, recordList.stream().map(schema::conform).collect(Collectors.toList()));
  }

  private Table merge(Table existing, List<Record> incoming) {
    return mergeEngine
        .merge(existing.getName(), Optional.of(existing), incoming, WriteMode.MERGE)
        .getTable();
  }

  private static Map<String, Record> byArtistId(Table table) {
    return table.getRecords().stream()
        .collect(Collectors.toMap(record -> record.getString("artist_id"), Function.identity()));
  }

  @Test
  void testMergeIntoAbsentTableCreatesIt() {
    MergeOutcome outcome =
        mergeEngine.merge(
            "artists",
            Optional.empty(),
            Arrays.asList(artist("a1", 1), artist("a2", 2), artist("a3", 3)),
            WriteMode.MERGE);
    assertEquals(WriteMode.OVERWRITE, outcome.getEffectiveMode());
    assertEquals(3, outcome.getRecordsWritten());
    assertEquals(3, outcome.getTable().getRecordCount());
  }

  @Test
  void testMergeReplacesRecordsWithSameKey() {
    Table existing = table("artists", artist("a1", 10));
    MergeOutcome outcome =
        mergeEngine.merge(
            "artists",
            Optional.of(existing),
            Arrays.asList(artist("a1", 20), artist("a4", 5)),
            WriteMode.MERGE);
    Map<String, Record> merged = byArtistId(outcome.getTable());
    assertEquals(2, merged.size());
    assertEquals(20L, merged.get("a1").getLong("popularity"));
    assertEquals(5L, merged.get("a4").getLong("popularity"));
    assertEquals(1, outcome.getRecordsSuperseded());
    assertEquals(2, outcome.getRecordsWritten());
  }

  @Test
  void testMergeIsIdempotent() {
    Table existing = table("artists", artist("a1", 1), artist("a2", 2));
    List<Record> batch = Arrays.asList(artist("a2", 20), artist("a3", 30));
    Table once = merge(existing, batch);
    Table twice = merge(once, batch);
    assertEquals(new HashSet<>(once.getRecords()), new HashSet<>(twice.getRecords()));
    assertEquals(once.getRecordCount(), twice.getRecordCount());
  }

  @Test
  void testMergeWithDisjointKeysKeepsEveryRow() {
    Table existing = table("artists", artist("a1", 1));
    List<Record> first = Arrays.asList(artist("a2", 2), artist("a3", 3));
    List<Record> second = Collections.singletonList(artist("a4", 4));
    Table result = merge(merge(existing, first), second);

    Set<Record> expected = new HashSet<>(existing.getRecords());
    expected.addAll(first);
    expected.addAll(second);
    assertEquals(expected, new HashSet<>(result.getRecords()));
  }

  @Test
  void testLastWriteWins() {
    Table existing = table("artists", artist("a1", 1));
    Table result =
        merge(
            merge(existing, Collections.singletonList(artist("k", 100))),
            Collections.singletonList(artist("k", 200)));
    assertEquals(200L, byArtistId(result).get("k").getLong("popularity"));
  }

  @Test
  void testLastOccurrenceWinsWithinBatch() {
    Table existing = table("artists", artist("a1", 1));
    MergeOutcome outcome =
        mergeEngine.merge(
            "artists",
            Optional.of(existing),
            Arrays.asList(artist("a2", 1), artist("a2", 2), artist("a2", 3)),
            WriteMode.MERGE);
    assertEquals(2, outcome.getTable().getRecordCount());
    assertEquals(3L, byArtistId(outcome.getTable()).get("a2").getLong("popularity"));
    assertEquals(1, outcome.getRecordsWritten());
  }

  @Test
  void testCompositeKey() {
    Record rock = Record.builder().set("artist_id", "a1").set("genre", "rock").build();
    Record pop = Record.builder().set("artist_id", "a1").set("genre", "pop").build();
    Table existing = table("artist_genre", rock);
    Table result = merge(existing, Arrays.asList(rock, pop));
    assertEquals(new HashSet<>(Arrays.asList(rock, pop)), new HashSet<>(result.getRecords()));
  }

  @Test
  void testMergeWithoutKeyDropsExactDuplicates() {
    Record first = Record.builder().set("track_id", "t1").set("played_at_ms", 1).build();
    Record second = Record.builder().set("track_id", "t2").set("played_at_ms", 2).build();
    Table existing = table("play_history", first);
    MergeOutcome outcome =
        mergeEngine.merge(
            "play_history",
            Optional.of(existing),
            Arrays.asList(first, second, second),
            WriteMode.MERGE);
    assertEquals(Arrays.asList(first, second), outcome.getTable().getRecords());
    assertEquals(1, outcome.getRecordsWritten());
  }

  @Test
  void testMergeWithoutKeyAndNothingNewHasNoChanges() {
    Record first = Record.builder().set("track_id", "t1").build();
    MergeOutcome outcome =
        mergeEngine.merge(
            "play_history",
            Optional.of(table("play_history", first)),
            Collections.singletonList(first),
            WriteMode.MERGE);
    assertFalse(outcome.hasChanges());
  }

  @Test
  void testAppendKeepsDuplicates() {
    Table existing = table("artists", artist("a1", 1));
    MergeOutcome outcome =
        mergeEngine.merge(
            "artists",
            Optional.of(existing),
            Collections.singletonList(artist("a1", 1)),
            WriteMode.APPEND);
    assertEquals(2, outcome.getTable().getRecordCount());
  }

  @Test
  void testOverwriteReplacesContent() {
    Table existing = table("artists", artist("a1", 1), artist("a2", 2));
    MergeOutcome outcome =
        mergeEngine.merge(
            "artists",
            Optional.of(existing),
            Collections.singletonList(Record.builder().set("artist_id", "a9").build()),
            WriteMode.OVERWRITE);
    assertEquals(1, outcome.getTable().getRecordCount());
    assertEquals(
        Collections.singletonList("artist_id"), outcome.getTable().getSchema().getColumnNames());
  }

  @Test
  void testSchemaEvolutionAddsColumnsAndWidensNumbers() {
    Table existing = table("artists", artist("a1", 10));
    Record incoming =
        Record.builder().set("artist_id", "a2").set("popularity", 7.5).set("country", "FR").build();
    Table result = merge(existing, Collections.singletonList(incoming));
    TableSchema schema = result.getSchema();
    assertEquals(Arrays.asList("artist_id", "popularity", "country"), schema.getColumnNames());
    assertEquals(ColumnType.DOUBLE, schema.getColumn("popularity").get().getType());
    Record a1 = byArtistId(result).get("a1");
    assertEquals(10.0d, a1.get("popularity"));
    assertNull(a1.get("country"));
  }

  @Test
  void testIncompatibleTypeIsSchemaConflict() {
    Table existing = table("artists", artist("a1", 10));
    SchemaConflictException exception =
        assertThrows(
            SchemaConflictException.class,
            () -> merge(existing, Collections.singletonList(artist("a2", "popular"))));
    assertEquals(ErrorCode.SCHEMA_CONFLICT, exception.getErrorCode());
  }

  @Test
  void testAllNullExistingColumnAdoptsIncomingType() {
    Table existing = table("artists", artist("a1", null));
    assertEquals(
        ColumnType.STRING, existing.getSchema().getColumn("popularity").get().getType());
    Table result = merge(existing, Collections.singletonList(artist("a2", 5)));
    assertEquals(ColumnType.LONG, result.getSchema().getColumn("popularity").get().getType());
  }

  @Test
  void testMalformedRecordsAreDroppedAndCounted() {
    Table existing = table("artists", artist("a1", 1));
    MergeOutcome outcome =
        mergeEngine.merge(
            "artists",
            Optional.of(existing),
            Arrays.asList(artist(null, 2), Record.builder().set("popularity", 3).build()),
            WriteMode.MERGE);
    assertEquals(2, outcome.getRecordsDropped());
    assertFalse(outcome.hasChanges());
  }

  @Test
  void testMalformedRecordsFailTheBatchWhenConfigured() {
    MergeEngine strict =
        MergeEngine.builder()
            .mergeKeyPolicy(MergeKeyPolicy.defaults())
            .malformedRecordPolicy(MalformedRecordPolicy.FAIL)
            .build();
    List<Record> incoming = new ArrayList<>();
    incoming.add(artist("a2", 2));
    incoming.add(artist(null, 3));
    MalformedRecordException exception =
        assertThrows(
            MalformedRecordException.class,
            () -> strict.merge("artists", Optional.empty(), incoming, WriteMode.MERGE));
    assertEquals(ErrorCode.MALFORMED_RECORD, exception.getErrorCode());
  }
}
