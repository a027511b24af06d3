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

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import org.apache.hadoop.fs.FileStatus;

import com.google.common.base.Preconditions;

import io.tracklake.model.Record;
import io.tracklake.model.context.OperationContext;
import io.tracklake.model.exception.MissingSourceTableException;
import io.tracklake.model.gap.GapQuery;
import io.tracklake.model.gap.GapResult;
import io.tracklake.store.ParquetTableStore;

/**
 * Finds the keys of a source table that have no counterpart in a target table yet, by running the
 * configured {@link GapQuery} of an entity type directly over the parquet files of both tables.
 *
 * <p>A missing target table means every key of the source is missing. A missing source table is
 * an error since the result would silently be empty.
 */
@Log4j2
public class GapDetector {
  private final ParquetTableStore tableStore;
  private final Map<String, GapQuery> gapQueries;
  private final DuckDBQueryEngine queryEngine;
  private final GapQuerySqlBuilder sqlBuilder = new GapQuerySqlBuilder();
  private final OperationContext operationContext;
  private final Clock clock;

  @Builder
  public GapDetector(
      @NonNull ParquetTableStore tableStore,
      Map<String, GapQuery> gapQueries,
      DuckDBQueryEngine queryEngine,
      OperationContext operationContext,
      Clock clock) {
    this.tableStore = tableStore;
    this.gapQueries = gapQueries == null ? Collections.emptyMap() : new LinkedHashMap<>(gapQueries);
    this.queryEngine = queryEngine == null ? new DuckDBQueryEngine() : queryEngine;
    this.operationContext = operationContext == null ? new OperationContext() : operationContext;
    this.clock = clock == null ? Clock.systemUTC() : clock;
  }

  public Set<String> getEntityTypes() {
    return Collections.unmodifiableSet(new TreeSet<>(gapQueries.keySet()));
  }

  /**
   * Returns the query registered for the entity type.
   *
   * @throws IllegalArgumentException if no query is registered for the entity type
   */
  public GapQuery getGapQuery(String entityType) {
    GapQuery query = gapQueries.get(entityType);
    if (query == null) {
      throw new IllegalArgumentException(
          String.format(
              "Unknown entity type %s, expected one of %s", entityType, getEntityTypes()));
    }
    return query;
  }

  public GapResult findMissing(String entityType, int limit, long offset) {
    return findMissing(getGapQuery(entityType), limit, offset);
  }

  /**
   * Returns one page of missing keys with their context columns. Pages of a fixed size taken at
   * consecutive offsets cover every missing key exactly once, as long as the tables do not change
   * in between.
   */
  public GapResult findMissing(GapQuery query, int limit, long offset) {
    Preconditions.checkArgument(limit > 0, "limit must be positive");
    Preconditions.checkArgument(offset >= 0, "offset must not be negative");
    List<String> sourceFiles = sourceFiles(query);
    List<Record> rows =
        queryEngine.query(
            sqlBuilder.selectMissing(
                query, sourceFiles, targetFiles(query), recencyCutoff(query), offset, limit));
    operationContext.increment(OperationContext.GAP_QUERIES);
    log.info(
        "Found {} missing {} at offset {} (limit {})",
        rows.size(),
        entityName(query),
        offset,
        limit);
    return GapResult.builder()
        .entityType(query.getEntityType())
        .keyColumn(query.getSourceKeyColumn())
        .rows(rows)
        .offset(offset)
        .limit(limit)
        .build();
  }

  public long countMissing(String entityType) {
    return countMissing(getGapQuery(entityType));
  }

  /** Counts the distinct missing keys, using the same predicates as {@link #findMissing}. */
  public long countMissing(GapQuery query) {
    List<String> sourceFiles = sourceFiles(query);
    long count =
        queryEngine.queryForLong(
            sqlBuilder.countMissing(query, sourceFiles, targetFiles(query), recencyCutoff(query)));
    operationContext.increment(OperationContext.GAP_QUERIES);
    log.info("{} {} missing", count, entityName(query));
    return count;
  }

  /**
   * Checks which of the ids are present in the key column of a table.
   *
   * @return every id mapped to whether the table has a row with that key, in the order given
   */
  public Map<String, Boolean> checkExists(
      String tableName, String keyColumn, Collection<String> ids) {
    Map<String, Boolean> result = new LinkedHashMap<>();
    ids.forEach(id -> result.put(id, false));
    List<String> files = dataFiles(tableName);
    if (files.isEmpty() || ids.isEmpty()) {
      return result;
    }
    Set<String> existing =
        queryEngine
            .query(sqlBuilder.selectExisting(files, keyColumn, new HashSet<>(ids)))
            .stream()
            .map(row -> row.getString(keyColumn))
            .collect(Collectors.toSet());
    operationContext.increment(OperationContext.GAP_QUERIES);
    result.replaceAll((id, ignored) -> existing.contains(id));
    return result;
  }

  private List<String> sourceFiles(GapQuery query) {
    List<String> files = dataFiles(query.getSourceTable());
    if (files.isEmpty()) {
      throw new MissingSourceTableException(query.getSourceTable());
    }
    return files;
  }

  private List<String> targetFiles(GapQuery query) {
    List<String> files = dataFiles(query.getTargetTable());
    if (files.isEmpty()) {
      log.debug("Target table {} does not exist, every key is missing", query.getTargetTable());
    }
    return files;
  }

  private List<String> dataFiles(String tableName) {
    return tableStore.getDataFiles(tableName).stream()
        .map(FileStatus::getPath)
        .map(path -> path.toUri().getPath())
        .collect(Collectors.toList());
  }

  private Instant recencyCutoff(GapQuery query) {
    return query.hasRecencyWindow() ? clock.instant().minus(query.getRecencyWindow()) : null;
  }

  private static String entityName(GapQuery query) {
    return query.getEntityType() == null ? query.getTargetTable() : query.getEntityType();
  }
}
