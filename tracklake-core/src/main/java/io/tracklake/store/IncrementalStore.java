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

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import org.apache.hadoop.conf.Configuration;

import com.google.common.base.Preconditions;

import io.tracklake.config.TrackLakeConfig;
import io.tracklake.dedup.EventDeduplicator;
import io.tracklake.gap.BatchPlanner;
import io.tracklake.gap.GapDetector;
import io.tracklake.model.Record;
import io.tracklake.model.Table;
import io.tracklake.model.TableInfo;
import io.tracklake.model.context.OperationContext;
import io.tracklake.model.dedup.DedupResult;
import io.tracklake.model.gap.BatchPlan;
import io.tracklake.model.gap.GapResult;
import io.tracklake.model.schema.TableSchema;
import io.tracklake.model.write.WriteMode;
import io.tracklake.model.write.WriteResult;
import io.tracklake.spi.store.TableStore;

/**
 * Entry point for the collectors feeding the store: persists tables, tells which entities still
 * need to be fetched and folds new play events into the listening history.
 */
@Log4j2
public class IncrementalStore implements TableStore {
  private final ParquetTableStore tableStore;
  private final GapDetector gapDetector;
  private final EventDeduplicator deduplicator;
  private final BatchPlanner batchPlanner = BatchPlanner.getInstance();
  @Getter private final String playHistoryTable;
  @Getter private final OperationContext operationContext;

  public IncrementalStore(
      @NonNull ParquetTableStore tableStore,
      @NonNull GapDetector gapDetector,
      @NonNull EventDeduplicator deduplicator,
      @NonNull String playHistoryTable,
      @NonNull OperationContext operationContext) {
    this.tableStore = tableStore;
    this.gapDetector = gapDetector;
    this.deduplicator = deduplicator;
    this.playHistoryTable = playHistoryTable;
    this.operationContext = operationContext;
  }

  public static IncrementalStore fromConfig(
      TrackLakeConfig config, Configuration hadoopConf, OperationContext operationContext) {
    return fromConfig(config, hadoopConf, operationContext, Clock.systemUTC());
  }

  public static IncrementalStore fromConfig(
      @NonNull TrackLakeConfig config,
      @NonNull Configuration hadoopConf,
      @NonNull OperationContext operationContext,
      @NonNull Clock clock) {
    Preconditions.checkArgument(config.getBasePath() != null, "basePath must be configured");
    ParquetTableStore tableStore =
        ParquetTableStore.builder()
            .hadoopConf(hadoopConf)
            .basePath(config.getBasePath())
            .mergeKeyPolicy(config.getMergeKeyPolicy())
            .malformedRecordPolicy(config.getMalformedRecordPolicy())
            .parquetFileConfig(config.getParquet())
            .operationContext(operationContext)
            .clock(clock)
            .build();
    GapDetector gapDetector =
        GapDetector.builder()
            .tableStore(tableStore)
            .gapQueries(config.getGapQueries())
            .operationContext(operationContext)
            .clock(clock)
            .build();
    EventDeduplicator deduplicator =
        EventDeduplicator.builder()
            .columns(config.getPlayEventColumns())
            .operationContext(operationContext)
            .build();
    return new IncrementalStore(
        tableStore, gapDetector, deduplicator, config.getPlayHistoryTable(), operationContext);
  }

  @Override
  public Optional<Table> readTable(String tableName) {
    return tableStore.readTable(tableName);
  }

  @Override
  public WriteResult writeTable(String tableName, List<Record> records, WriteMode mode) {
    return tableStore.writeTable(tableName, records, mode);
  }

  @Override
  public boolean tableExists(String tableName) {
    return tableStore.tableExists(tableName);
  }

  @Override
  public TableInfo tableInfo(String tableName) {
    return tableStore.tableInfo(tableName);
  }

  @Override
  public int cleanupOldFiles(String tableName, int keepLatest) {
    return tableStore.cleanupOldFiles(tableName, keepLatest);
  }

  public Set<String> getEntityTypes() {
    return gapDetector.getEntityTypes();
  }

  public long countMissing(String entityType) {
    return gapDetector.countMissing(entityType);
  }

  public GapResult getBatch(String entityType, int batchSize, long offset) {
    return gapDetector.findMissing(entityType, batchSize, offset);
  }

  /** Plans the pages needed to fetch every entity of the type that is currently missing. */
  public BatchPlan planBatches(String entityType, int batchSize) {
    BatchPlan plan = batchPlanner.plan(countMissing(entityType), batchSize);
    log.info(
        "Planned {} batches of {} for {} missing {}",
        plan.getBatchCount(),
        batchSize,
        plan.getTotalItems(),
        entityType);
    return plan;
  }

  public Map<String, Boolean> checkExists(
      String tableName, String keyColumn, Collection<String> ids) {
    return gapDetector.checkExists(tableName, keyColumn, ids);
  }

  public DedupResult deduplicate(List<Record> events) {
    return deduplicator.deduplicate(events);
  }

  /**
   * Deduplicates the stored listening history in place.
   *
   * @return the write result, {@link WriteResult#getRecordsDropped()} counting the removed events
   */
  public WriteResult compactPlayHistory() {
    Optional<Table> history = tableStore.readTable(playHistoryTable);
    if (!history.isPresent()) {
      return WriteResult.noUpdates(playHistoryTable, WriteMode.OVERWRITE, "No play history");
    }
    DedupResult deduplicated = deduplicator.deduplicate(history.get().getRecords());
    if (deduplicated.getRemovedCount() == 0) {
      log.info("Play history {} has no duplicates", playHistoryTable);
      return WriteResult.noUpdates(playHistoryTable, WriteMode.OVERWRITE, "No duplicates")
          .toBuilder()
          .totalRecords(history.get().getRecordCount())
          .build();
    }
    WriteResult result =
        tableStore.writeTable(playHistoryTable, deduplicated.getEvents(), WriteMode.OVERWRITE);
    return result.isSuccess()
        ? result.toBuilder()
            .recordsWritten(0)
            .recordsDropped(deduplicated.getRemovedCount())
            .message(
                String.format(
                    "Removed %d exact and %d window duplicates",
                    deduplicated.getExactDuplicates(),
                    deduplicated.getWindowDuplicates()))
            .build()
        : result;
  }

  /**
   * Adds play events to the listening history. The stored history and the new events are
   * deduplicated together and the result replaces the history table, so feeding the same events
   * twice leaves the history unchanged.
   *
   * @return the write result, {@link WriteResult#getRecordsWritten()} counting the events that were
   *     not in the history yet
   */
  public WriteResult appendPlayEvents(List<Record> events) {
    if (events == null || events.isEmpty()) {
      return WriteResult.noUpdates(playHistoryTable, WriteMode.OVERWRITE, "No play events");
    }
    Optional<Table> history;
    List<Record> combined = new ArrayList<>();
    try {
      history = tableStore.readTable(playHistoryTable);
      TableSchema schema =
          history
              .map(Table::getSchema)
              .orElse(TableSchema.empty())
              .union(TableSchema.inferFrom(events));
      history
          .map(Table::getRecords)
          .ifPresent(records -> records.forEach(record -> combined.add(schema.conform(record))));
      events.forEach(event -> combined.add(schema.conform(event)));
    } catch (RuntimeException e) {
      log.error("Failed to combine play events with {}", playHistoryTable, e);
      return WriteResult.error(
          playHistoryTable, WriteMode.OVERWRITE, e, "Failed to append play events");
    }
    int historySize = history.map(Table::getRecordCount).orElse(0);
    DedupResult deduplicated = deduplicator.deduplicate(combined);
    Set<Record> stored = new HashSet<>(combined.subList(0, historySize));
    if (stored.equals(new HashSet<>(deduplicated.getEvents()))) {
      log.info("All {} play events are already in {}", events.size(), playHistoryTable);
      return WriteResult.noUpdates(
              playHistoryTable, WriteMode.OVERWRITE, "All play events are already stored")
          .toBuilder()
          .totalRecords(historySize)
          .build();
    }
    WriteResult result =
        tableStore.writeTable(playHistoryTable, deduplicated.getEvents(), WriteMode.OVERWRITE);
    long added =
        deduplicated.getEvents().stream().filter(event -> !stored.contains(event)).count();
    return result.isSuccess()
        ? result.toBuilder()
            .recordsWritten(added)
            .message(
                String.format(
                    "Added %d play events, %d exact and %d window duplicates removed",
                    added,
                    deduplicated.getExactDuplicates(),
                    deduplicated.getWindowDuplicates()))
            .build()
        : result;
  }
}
