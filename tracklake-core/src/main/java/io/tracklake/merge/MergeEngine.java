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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import io.tracklake.model.Record;
import io.tracklake.model.Table;
import io.tracklake.model.exception.MalformedRecordException;
import io.tracklake.model.schema.Column;
import io.tracklake.model.schema.ColumnType;
import io.tracklake.model.schema.TableSchema;
import io.tracklake.model.write.MalformedRecordPolicy;
import io.tracklake.model.write.MergeKeyPolicy;
import io.tracklake.model.write.WriteMode;

/**
 * Computes the content of a table after a write. The engine is purely in-memory: it never touches
 * storage, so a failure leaves the persisted table untouched.
 *
 * <p>The schema of the result is the union of the existing and incoming schemas. Columns that are
 * null in every existing record do not constrain the incoming type, and columns that are null
 * everywhere keep their existing type or become strings.
 */
@Log4j2
@Builder
public class MergeEngine {
  @NonNull @Builder.Default private final MergeKeyPolicy mergeKeyPolicy = MergeKeyPolicy.defaults();

  @NonNull @Builder.Default
  private final MalformedRecordPolicy malformedRecordPolicy = MalformedRecordPolicy.DROP;

  /**
   * Combines the incoming records with the existing table.
   *
   * @param tableName name of the table, used to resolve the merge keys
   * @param existing current content of the table, empty if the table does not exist
   * @param incoming records to write, never modified
   * @param mode requested write mode
   * @throws io.tracklake.model.exception.SchemaConflictException if the schemas cannot be
   *     reconciled
   * @throws MalformedRecordException if a record lacks its merge key under {@link
   *     MalformedRecordPolicy#FAIL}
   */
  public MergeOutcome merge(
      String tableName, Optional<Table> existing, List<Record> incoming, WriteMode mode) {
    WriteMode effectiveMode = existing.isPresent() ? mode : WriteMode.OVERWRITE;
    if (effectiveMode != mode) {
      log.debug("Table {} does not exist, {} degenerates to OVERWRITE", tableName, mode);
    }
    List<String> mergeKeys = mergeKeyPolicy.getMergeKeys(tableName);
    List<Record> accepted = filterMalformed(tableName, incoming, mergeKeys);
    long dropped = incoming.size() - accepted.size();
    if (accepted.isEmpty()) {
      return MergeOutcome.builder()
          .effectiveMode(effectiveMode)
          .recordsDropped(dropped)
          .build();
    }

    TableSchema incomingSchema = TableSchema.inferFrom(accepted);
    TableSchema schema =
        effectiveMode == WriteMode.OVERWRITE
            ? incomingSchema.resolveNullColumns(ColumnType.STRING)
            : reconcileSchemas(existing.get(), incomingSchema);
    List<Record> conformedIncoming = conformAll(schema, accepted);

    List<Record> result;
    long written;
    long superseded = 0;
    switch (effectiveMode) {
      case OVERWRITE:
        result = conformedIncoming;
        written = result.size();
        break;
      case APPEND:
        result = new ArrayList<>(conformAll(schema, existing.get().getRecords()));
        result.addAll(conformedIncoming);
        written = conformedIncoming.size();
        break;
      case MERGE:
        List<Record> conformedExisting = conformAll(schema, existing.get().getRecords());
        if (mergeKeys.isEmpty()) {
          Set<Record> distinct = new LinkedHashSet<>(conformedExisting);
          int before = distinct.size();
          distinct.addAll(conformedIncoming);
          result = new ArrayList<>(distinct);
          written = distinct.size() - before;
        } else {
          Map<List<Object>, Record> latestByKey = new LinkedHashMap<>();
          conformedIncoming.forEach(record -> latestByKey.put(keyOf(record, mergeKeys), record));
          Set<List<Object>> incomingKeys = new HashSet<>(latestByKey.keySet());
          result =
              conformedExisting.stream()
                  .filter(record -> !incomingKeys.contains(keyOf(record, mergeKeys)))
                  .collect(Collectors.toCollection(ArrayList::new));
          superseded = conformedExisting.size() - result.size();
          result.addAll(latestByKey.values());
          written = latestByKey.size();
        }
        break;
      default:
        throw new IllegalArgumentException("Unsupported write mode " + effectiveMode);
    }
    log.debug(
        "Merged {} incoming records into {} with mode {}: {} written, {} dropped, {} superseded",
        incoming.size(),
        tableName,
        effectiveMode,
        written,
        dropped,
        superseded);
    return MergeOutcome.builder()
        .table(new Table(tableName, schema, result))
        .effectiveMode(effectiveMode)
        .recordsWritten(written)
        .recordsDropped(dropped)
        .recordsSuperseded(superseded)
        .build();
  }

  private List<Record> filterMalformed(
      String tableName, List<Record> incoming, List<String> mergeKeys) {
    if (mergeKeys.isEmpty()) {
      return incoming;
    }
    List<Record> accepted = new ArrayList<>(incoming.size());
    for (Record record : incoming) {
      if (mergeKeys.stream().anyMatch(record::isNull)) {
        if (malformedRecordPolicy == MalformedRecordPolicy.FAIL) {
          throw new MalformedRecordException(
              String.format(
                  "Record of table %s has no value for merge key %s: %s",
                  tableName, mergeKeys, record));
        }
        log.warn("Dropping record of table {} without merge key {}", tableName, mergeKeys);
      } else {
        accepted.add(record);
      }
    }
    return accepted;
  }

  private static TableSchema reconcileSchemas(Table existing, TableSchema incomingSchema) {
    TableSchema existingSchema = existing.getSchema();
    TableSchema relaxed =
        TableSchema.of(
            existingSchema.getColumns().stream()
                .map(
                    column ->
                        isAllNull(existing.getRecords(), column.getName())
                            ? column.withType(ColumnType.NULL)
                            : column)
                .collect(Collectors.toList()));
    TableSchema union = relaxed.union(incomingSchema);
    return TableSchema.of(
        union.getColumns().stream()
            .map(
                column ->
                    column.getType() == ColumnType.NULL
                        ? column.withType(
                            existingSchema
                                .getColumn(column.getName())
                                .map(Column::getType)
                                .filter(type -> type != ColumnType.NULL)
                                .orElse(ColumnType.STRING))
                        : column)
            .collect(Collectors.toList()));
  }

  private static boolean isAllNull(List<Record> records, String column) {
    return records.stream().allMatch(record -> record.isNull(column));
  }

  private static List<Record> conformAll(TableSchema schema, List<Record> records) {
    return records.stream().map(schema::conform).collect(Collectors.toList());
  }

  private static List<Object> keyOf(Record record, List<String> mergeKeys) {
    List<Object> key = new ArrayList<>(mergeKeys.size());
    mergeKeys.forEach(column -> key.add(record.get(column)));
    return key;
  }
}
