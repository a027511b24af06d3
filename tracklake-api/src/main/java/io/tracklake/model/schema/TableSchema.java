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

package io.tracklake.model.schema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import io.tracklake.model.Record;
import io.tracklake.model.exception.SchemaConflictException;

/**
 * Ordered set of columns describing a table. The schema of a table only ever grows: new columns
 * are appended by {@link #union(TableSchema)} and existing columns may only be widened from
 * {@link ColumnType#LONG} to {@link ColumnType#DOUBLE}.
 *
 * @since 0.1
 */
@EqualsAndHashCode
@ToString
public final class TableSchema {
  private static final TableSchema EMPTY = new TableSchema(Collections.emptyList());

  private final List<Column> columns;

  private TableSchema(List<Column> columns) {
    this.columns = Collections.unmodifiableList(columns);
  }

  public static TableSchema empty() {
    return EMPTY;
  }

  /**
   * Creates a schema from the given columns.
   *
   * @throws IllegalArgumentException if a column name is repeated
   */
  public static TableSchema of(List<Column> columns) {
    Map<String, Column> byName = new LinkedHashMap<>();
    for (Column column : columns) {
      if (byName.put(column.getName(), column) != null) {
        throw new IllegalArgumentException("Duplicate column " + column.getName());
      }
    }
    return new TableSchema(new ArrayList<>(columns));
  }

  /**
   * Infers the schema of a batch of records. Columns appear in the order they are first seen and
   * columns without any non-null value get the type {@link ColumnType#NULL}.
   *
   * @throws SchemaConflictException if the same column holds incompatible values in the batch
   */
  public static TableSchema inferFrom(Collection<Record> records) {
    Map<String, ColumnType> types = new LinkedHashMap<>();
    for (Record record : records) {
      for (Map.Entry<String, Object> entry : record.asMap().entrySet()) {
        ColumnType valueType = ColumnType.ofValue(entry.getValue());
        ColumnType current = types.get(entry.getKey());
        if (current == null) {
          types.put(entry.getKey(), valueType);
        } else {
          types.put(entry.getKey(), reconcile(entry.getKey(), current, valueType));
        }
      }
    }
    return new TableSchema(
        types.entrySet().stream()
            .map(entry -> Column.of(entry.getKey(), entry.getValue()))
            .collect(Collectors.toList()));
  }

  public List<Column> getColumns() {
    return columns;
  }

  public List<String> getColumnNames() {
    return columns.stream().map(Column::getName).collect(Collectors.toList());
  }

  public Optional<Column> getColumn(String name) {
    return columns.stream().filter(column -> column.getName().equals(name)).findFirst();
  }

  public boolean hasColumn(String name) {
    return getColumn(name).isPresent();
  }

  public boolean isEmpty() {
    return columns.isEmpty();
  }

  /**
   * Combines this schema with another one. Columns of this schema keep their position, columns
   * only known to the other schema are appended in their original order.
   *
   * @throws SchemaConflictException if a shared column has incompatible types
   */
  public TableSchema union(TableSchema other) {
    Map<String, Column> merged = new LinkedHashMap<>();
    columns.forEach(column -> merged.put(column.getName(), column));
    for (Column column : other.columns) {
      Column existing = merged.get(column.getName());
      if (existing == null) {
        merged.put(column.getName(), column);
      } else {
        merged.put(
            column.getName(),
            existing.withType(reconcile(column.getName(), existing.getType(), column.getType())));
      }
    }
    return new TableSchema(new ArrayList<>(merged.values()));
  }

  /** Replaces every {@link ColumnType#NULL} column with the given type. */
  public TableSchema resolveNullColumns(ColumnType fallback) {
    return new TableSchema(
        columns.stream()
            .map(column -> column.getType() == ColumnType.NULL ? column.withType(fallback) : column)
            .collect(Collectors.toList()));
  }

  /**
   * Rewrites a record to match this schema: columns are ordered as in the schema, missing columns
   * are filled with nulls and integral values of widened columns become doubles.
   *
   * @throws SchemaConflictException if the record has a column unknown to this schema or a value
   *     of the wrong type
   */
  public Record conform(Record record) {
    List<String> unknown = new ArrayList<>(record.getColumnNames());
    unknown.removeAll(getColumnNames());
    if (!unknown.isEmpty()) {
      throw new SchemaConflictException("Record has columns unknown to the schema: " + unknown);
    }
    Record.Builder builder = Record.builder();
    for (Column column : columns) {
      builder.set(column.getName(), coerce(column, record.get(column.getName())));
    }
    return builder.build();
  }

  private static Object coerce(Column column, Object value) {
    if (value == null) {
      return null;
    }
    ColumnType valueType = ColumnType.ofValue(value);
    if (valueType == column.getType() || column.getType() == ColumnType.NULL) {
      return value;
    }
    if (column.getType() == ColumnType.DOUBLE && valueType == ColumnType.LONG) {
      return ((Long) value).doubleValue();
    }
    throw new SchemaConflictException(
        String.format(
            "Column %s of type %s cannot hold value %s of type %s",
            column.getName(), column.getType(), value, valueType));
  }

  private static ColumnType reconcile(String column, ColumnType left, ColumnType right) {
    return ColumnType.reconcile(left, right)
        .orElseThrow(
            () ->
                new SchemaConflictException(
                    String.format(
                        "Column %s has incompatible types %s and %s", column, left, right)));
  }
}
