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

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.io.api.Binary;
import org.apache.parquet.schema.GroupType;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.Type;

import io.tracklake.exception.UnsupportedSchemaTypeException;
import io.tracklake.exception.WriteException;
import io.tracklake.model.Record;
import io.tracklake.model.schema.Column;
import io.tracklake.model.schema.TableSchema;

/** Converts single rows between the parquet example {@link Group} model and {@link Record}. */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class ParquetRecordConverter {
  private static final ParquetRecordConverter INSTANCE = new ParquetRecordConverter();
  // julian day number of 1970-01-01
  private static final long JULIAN_EPOCH_DAY = 2_440_588L;

  public static ParquetRecordConverter getInstance() {
    return INSTANCE;
  }

  /**
   * Builds the parquet row of a record. The record must already conform to the table schema the
   * factory was created from.
   */
  public Group toGroup(Record record, TableSchema tableSchema, SimpleGroupFactory groupFactory) {
    Group group = groupFactory.newGroup();
    for (Column column : tableSchema.getColumns()) {
      Object value = record.get(column.getName());
      if (value == null) {
        continue;
      }
      switch (column.getType()) {
        case STRING:
        case NULL:
          group.append(column.getName(), value.toString());
          break;
        case LONG:
          group.append(column.getName(), (Long) value);
          break;
        case DOUBLE:
          group.append(column.getName(), (Double) value);
          break;
        case BOOLEAN:
          group.append(column.getName(), (Boolean) value);
          break;
        case TIMESTAMP:
          group.append(column.getName(), toEpochMicros((Instant) value));
          break;
        default:
          throw new UnsupportedSchemaTypeException(
              String.format("Unsupported column type %s", column.getType()));
      }
    }
    return group;
  }

  /** Reads a parquet row into a record with one entry per field of the file schema. */
  public Record toRecord(Group group) {
    GroupType type = group.getType();
    Record.Builder builder = Record.builder();
    for (int i = 0; i < type.getFieldCount(); i++) {
      Type field = type.getType(i);
      if (group.getFieldRepetitionCount(i) == 0) {
        builder.set(field.getName(), null);
      } else {
        builder.set(field.getName(), readValue(group, i, field.asPrimitiveType()));
      }
    }
    return builder.build();
  }

  private Object readValue(Group group, int fieldIndex, PrimitiveType field) {
    LogicalTypeAnnotation logicalType = field.getLogicalTypeAnnotation();
    switch (field.getPrimitiveTypeName()) {
      case BINARY:
        return group.getString(fieldIndex, 0);
      case INT64:
        long longValue = group.getLong(fieldIndex, 0);
        if (logicalType instanceof LogicalTypeAnnotation.TimestampLogicalTypeAnnotation) {
          return fromEpoch(
              longValue,
              ((LogicalTypeAnnotation.TimestampLogicalTypeAnnotation) logicalType).getUnit());
        }
        return longValue;
      case INT32:
        int intValue = group.getInteger(fieldIndex, 0);
        if (logicalType instanceof LogicalTypeAnnotation.DateLogicalTypeAnnotation) {
          return LocalDate.ofEpochDay(intValue).atStartOfDay().toInstant(ZoneOffset.UTC);
        }
        return (long) intValue;
      case INT96:
        return fromInt96(group.getInt96(fieldIndex, 0));
      case DOUBLE:
        return group.getDouble(fieldIndex, 0);
      case FLOAT:
        return group.getFloat(fieldIndex, 0);
      case BOOLEAN:
        return group.getBoolean(fieldIndex, 0);
      default:
        throw new UnsupportedSchemaTypeException(
            String.format("Unsupported schema type %s", field));
    }
  }

  /** Fails for instants outside the range of int64 microseconds since the epoch. */
  static long toEpochMicros(Instant instant) {
    try {
      return Math.addExact(
          Math.multiplyExact(instant.getEpochSecond(), 1_000_000L), instant.getNano() / 1_000);
    } catch (ArithmeticException e) {
      throw new WriteException("Timestamp " + instant + " does not fit in epoch micros", e);
    }
  }

  private static Instant fromEpoch(long value, LogicalTypeAnnotation.TimeUnit unit) {
    switch (unit) {
      case MILLIS:
        return Instant.ofEpochMilli(value);
      case MICROS:
        return Instant.EPOCH.plus(value, ChronoUnit.MICROS);
      case NANOS:
        return Instant.EPOCH.plusNanos(value);
      default:
        throw new UnsupportedSchemaTypeException("Unsupported timestamp unit " + unit);
    }
  }

  // INT96 holds the nanoseconds of the day followed by the julian day, little endian
  private static Instant fromInt96(Binary binary) {
    ByteBuffer buffer = binary.toByteBuffer().order(ByteOrder.LITTLE_ENDIAN);
    long nanosOfDay = buffer.getLong();
    long julianDay = Integer.toUnsignedLong(buffer.getInt());
    return Instant.EPOCH
        .plus(julianDay - JULIAN_EPOCH_DAY, ChronoUnit.DAYS)
        .plusNanos(nanosOfDay);
  }
}
