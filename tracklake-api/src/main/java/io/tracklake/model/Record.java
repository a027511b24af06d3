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

package io.tracklake.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * An ordered mapping of column name to value. Values are normalized on the way in so that two
 * records holding the same logical data are always equal: integral numbers become {@link Long},
 * floating point numbers become {@link Double} and all temporal values become an {@link Instant}
 * truncated to microseconds, the precision at which timestamps are persisted.
 *
 * <p>Records are immutable, use {@link #toBuilder()} or {@link #with(String, Object)} to derive a
 * modified copy.
 *
 * @since 0.1
 */
@EqualsAndHashCode
@ToString
public final class Record {
  private final Map<String, Object> values;

  private Record(Map<String, Object> values) {
    this.values = Collections.unmodifiableMap(values);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static Record of(Map<String, ?> values) {
    Builder builder = builder();
    values.forEach(builder::set);
    return builder.build();
  }

  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.values.putAll(values);
    return builder;
  }

  public Record with(String column, Object value) {
    return toBuilder().set(column, value).build();
  }

  public Object get(String column) {
    return values.get(column);
  }

  public boolean hasColumn(String column) {
    return values.containsKey(column);
  }

  /** Returns true if the column is absent or holds a null value. */
  public boolean isNull(String column) {
    return values.get(column) == null;
  }

  public String getString(String column) {
    Object value = values.get(column);
    return value == null ? null : value.toString();
  }

  public Long getLong(String column) {
    Object value = values.get(column);
    if (value == null) {
      return null;
    }
    if (value instanceof Number) {
      return ((Number) value).longValue();
    }
    throw new ClassCastException(
        String.format("Column %s holds a %s, not a number", column, value.getClass().getName()));
  }

  public Double getDouble(String column) {
    Object value = values.get(column);
    if (value == null) {
      return null;
    }
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    throw new ClassCastException(
        String.format("Column %s holds a %s, not a number", column, value.getClass().getName()));
  }

  public Instant getInstant(String column) {
    return (Instant) values.get(column);
  }

  public List<String> getColumnNames() {
    return new ArrayList<>(values.keySet());
  }

  public Map<String, Object> asMap() {
    return values;
  }

  public int size() {
    return values.size();
  }

  /**
   * Converts a java value into the representation stored in a record.
   *
   * @throws IllegalArgumentException if the value has no column type counterpart
   */
  public static Object normalize(Object value) {
    if (value == null
        || value instanceof String
        || value instanceof Long
        || value instanceof Double
        || value instanceof Boolean) {
      return value;
    }
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof BigInteger) {
      return ((BigInteger) value).longValueExact();
    }
    if (value instanceof Float) {
      return Double.valueOf(value.toString());
    }
    if (value instanceof BigDecimal) {
      return ((BigDecimal) value).doubleValue();
    }
    if (value instanceof Instant) {
      return ((Instant) value).truncatedTo(ChronoUnit.MICROS);
    }
    if (value instanceof OffsetDateTime) {
      return normalize(((OffsetDateTime) value).toInstant());
    }
    if (value instanceof ZonedDateTime) {
      return normalize(((ZonedDateTime) value).toInstant());
    }
    if (value instanceof LocalDateTime) {
      // local date times are interpreted as UTC wall clock time
      return normalize(((LocalDateTime) value).toInstant(ZoneOffset.UTC));
    }
    if (value instanceof Date) {
      return normalize(((Date) value).toInstant());
    }
    if (value instanceof CharSequence) {
      return value.toString();
    }
    throw new IllegalArgumentException(
        "Unsupported record value of type " + value.getClass().getName());
  }

  /** Builder preserving the order in which columns are first set. */
  public static final class Builder {
    private final Map<String, Object> values = new LinkedHashMap<>();

    private Builder() {}

    public Builder set(String column, Object value) {
      if (column == null || column.isEmpty()) {
        throw new IllegalArgumentException("Column name must not be empty");
      }
      values.put(column, normalize(value));
      return this;
    }

    public Builder remove(String column) {
      values.remove(column);
      return this;
    }

    public Record build() {
      return new Record(new LinkedHashMap<>(values));
    }
  }
}
