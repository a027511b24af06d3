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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class TestRecord {

  @Test
  void testNumbersAreNormalized() {
    Record record =
        Record.builder()
            .set("int", 5)
            .set("short", (short) 2)
            .set("float", 1.5f)
            .set("decimal", new BigDecimal("2.25"))
            .build();
    assertEquals(5L, record.get("int"));
    assertEquals(2L, record.get("short"));
    assertEquals(1.5d, record.get("float"));
    assertEquals(2.25d, record.get("decimal"));
  }

  @Test
  void testTemporalValuesBecomeMicrosecondInstants() {
    Instant instant = Instant.parse("2024-03-01T10:15:30.123456789Z");
    Record record =
        Record.builder()
            .set("instant", instant)
            .set("local", LocalDateTime.of(2024, 3, 1, 10, 15, 30))
            .set("offset", OffsetDateTime.of(2024, 3, 1, 12, 15, 30, 0, ZoneOffset.ofHours(2)))
            .build();
    assertEquals(Instant.parse("2024-03-01T10:15:30.123456Z"), record.getInstant("instant"));
    assertEquals(Instant.parse("2024-03-01T10:15:30Z"), record.getInstant("local"));
    assertEquals(Instant.parse("2024-03-01T10:15:30Z"), record.getInstant("offset"));
  }

  @Test
  void testEqualityIgnoresValueRepresentation() {
    Record first = Record.builder().set("id", 1).set("name", "a").build();
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("id", 1L);
    values.put("name", "a");
    assertEquals(first, Record.of(values));
    assertEquals(first.hashCode(), Record.of(values).hashCode());
  }

  @Test
  void testColumnOrderIsPreserved() {
    Record record = Record.builder().set("b", 1).set("a", 2).set("c", null).build();
    assertEquals(Arrays.asList("b", "a", "c"), record.getColumnNames());
    assertTrue(record.hasColumn("c"));
    assertTrue(record.isNull("c"));
    assertTrue(record.isNull("missing"));
    assertNull(record.getString("missing"));
  }

  @Test
  void testWithReturnsModifiedCopy() {
    Record record = Record.builder().set("id", 1).build();
    Record modified = record.with("id", 2).with("name", "x");
    assertEquals(1L, record.getLong("id"));
    assertEquals(2L, modified.getLong("id"));
    assertEquals("x", modified.getString("name"));
  }

  @Test
  void testUnsupportedValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> Record.builder().set("bytes", new byte[1]));
    assertThrows(IllegalArgumentException.class, () -> Record.builder().set("", "value"));
    Record record = Record.builder().set("name", "a").build();
    assertThrows(ClassCastException.class, () -> record.getLong("name"));
  }
}
