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

package io.tracklake.parquet;

import java.util.ArrayList;
import java.util.List;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.apache.parquet.schema.Type;
import org.apache.parquet.schema.Types;

import io.tracklake.exception.UnsupportedSchemaTypeException;
import io.tracklake.model.schema.Column;
import io.tracklake.model.schema.ColumnType;
import io.tracklake.model.schema.TableSchema;

/**
 * Converts between parquet {@link MessageType} and {@link TableSchema}. Every column is written as
 * an optional primitive; timestamps are stored as microseconds since the epoch without the
 * adjusted-to-UTC flag so that query engines compare them as plain UTC wall clock values.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class ParquetSchemaExtractor {
  static final String MESSAGE_NAME = "tracklake_record";
  private static final ParquetSchemaExtractor INSTANCE = new ParquetSchemaExtractor();

  public static ParquetSchemaExtractor getInstance() {
    return INSTANCE;
  }

  /**
   * Converts the parquet schema of a data file to a {@link TableSchema}.
   *
   * @throws UnsupportedSchemaTypeException if the file has nested or binary columns
   */
  public TableSchema toTableSchema(MessageType messageType) {
    List<Column> columns = new ArrayList<>(messageType.getFieldCount());
    for (Type field : messageType.getFields()) {
      columns.add(Column.of(field.getName(), toColumnType(field)));
    }
    return TableSchema.of(columns);
  }

  public ColumnType toColumnType(Type field) {
    if (!field.isPrimitive() || field.isRepetition(Type.Repetition.REPEATED)) {
      throw new UnsupportedSchemaTypeException(
          String.format("Unsupported schema type %s", field));
    }
    PrimitiveType primitiveType = field.asPrimitiveType();
    LogicalTypeAnnotation logicalType = field.getLogicalTypeAnnotation();
    switch (primitiveType.getPrimitiveTypeName()) {
      case BINARY:
        if (logicalType instanceof LogicalTypeAnnotation.StringLogicalTypeAnnotation
            || logicalType instanceof LogicalTypeAnnotation.EnumLogicalTypeAnnotation
            || logicalType instanceof LogicalTypeAnnotation.JsonLogicalTypeAnnotation) {
          return ColumnType.STRING;
        }
        break;
      case INT64:
        if (logicalType instanceof LogicalTypeAnnotation.TimestampLogicalTypeAnnotation) {
          return ColumnType.TIMESTAMP;
        } else if (logicalType == null
            || logicalType instanceof LogicalTypeAnnotation.IntLogicalTypeAnnotation) {
          return ColumnType.LONG;
        }
        break;
      case INT32:
        if (logicalType instanceof LogicalTypeAnnotation.DateLogicalTypeAnnotation) {
          return ColumnType.TIMESTAMP;
        } else if (logicalType == null
            || logicalType instanceof LogicalTypeAnnotation.IntLogicalTypeAnnotation) {
          return ColumnType.LONG;
        }
        break;
      case INT96:
        return ColumnType.TIMESTAMP;
      case DOUBLE:
      case FLOAT:
        return ColumnType.DOUBLE;
      case BOOLEAN:
        return ColumnType.BOOLEAN;
      default:
        break;
    }
    throw new UnsupportedSchemaTypeException(String.format("Unsupported schema type %s", field));
  }

  /** Converts the schema of a table to the parquet schema its data files are written with. */
  public MessageType toParquetSchema(TableSchema tableSchema) {
    Types.MessageTypeBuilder builder = Types.buildMessage();
    for (Column column : tableSchema.getColumns()) {
      builder.addField(toParquetType(column));
    }
    return builder.named(MESSAGE_NAME);
  }

  private Type toParquetType(Column column) {
    switch (column.getType()) {
      case STRING:
      case NULL:
        return Types.optional(PrimitiveTypeName.BINARY)
            .as(LogicalTypeAnnotation.stringType())
            .named(column.getName());
      case LONG:
        return Types.optional(PrimitiveTypeName.INT64).named(column.getName());
      case DOUBLE:
        return Types.optional(PrimitiveTypeName.DOUBLE).named(column.getName());
      case BOOLEAN:
        return Types.optional(PrimitiveTypeName.BOOLEAN).named(column.getName());
      case TIMESTAMP:
        return Types.optional(PrimitiveTypeName.INT64)
            .as(LogicalTypeAnnotation.timestampType(false, LogicalTypeAnnotation.TimeUnit.MICROS))
            .named(column.getName());
      default:
        throw new UnsupportedSchemaTypeException(
            String.format("Unsupported column type %s", column.getType()));
    }
  }
}
