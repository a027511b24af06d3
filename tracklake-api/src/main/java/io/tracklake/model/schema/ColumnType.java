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

import java.time.Instant;
import java.util.Optional;

import lombok.Getter;

/**
 * Collection of supported column types. {@link #NULL} marks a column for which no non-null value
 * has been observed yet; it adopts the type of any other column it is reconciled with.
 *
 * @since 0.1
 */
@Getter
public enum ColumnType {
  STRING,
  LONG,
  DOUBLE,
  BOOLEAN,
  TIMESTAMP,
  NULL;

  private final String name;

  ColumnType() {
    this.name = this.name().toLowerCase();
  }

  public boolean isNumeric() {
    return this == LONG || this == DOUBLE;
  }

  /**
   * Returns the type of a normalized record value.
   *
   * @throws IllegalArgumentException if the value is not one of the supported java types
   */
  public static ColumnType ofValue(Object value) {
    if (value == null) {
      return NULL;
    } else if (value instanceof String) {
      return STRING;
    } else if (value instanceof Long) {
      return LONG;
    } else if (value instanceof Double) {
      return DOUBLE;
    } else if (value instanceof Boolean) {
      return BOOLEAN;
    } else if (value instanceof Instant) {
      return TIMESTAMP;
    }
    throw new IllegalArgumentException(
        "Unsupported value type " + value.getClass().getName() + " for value " + value);
  }

  /**
   * Finds the type that can hold values of both types. Numeric types widen to {@link #DOUBLE} and
   * {@link #NULL} yields to the other type.
   *
   * @return the reconciled type or empty if the types are incompatible
   */
  public static Optional<ColumnType> reconcile(ColumnType left, ColumnType right) {
    if (left == right) {
      return Optional.of(left);
    }
    if (left == NULL) {
      return Optional.of(right);
    }
    if (right == NULL) {
      return Optional.of(left);
    }
    if (left.isNumeric() && right.isNumeric()) {
      return Optional.of(DOUBLE);
    }
    return Optional.empty();
  }
}
