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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.hadoop.metadata.ParquetMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.tracklake.exception.ReadException;
import io.tracklake.exception.WriteException;
import io.tracklake.model.Record;
import io.tracklake.model.schema.ColumnType;
import io.tracklake.model.schema.TableSchema;

public class TestParquetDataManager {
  private static final Configuration CONF = new Configuration();

  @TempDir java.nio.file.Path tempDir;

  private static List<Record> playEvents() {
    return Arrays.asList(
        Record.builder()
            .set("track_id", "t1")
            .set("played_at", Instant.parse("2024-03-01T12:00:00.123456Z"))
            .set("duration_ms", 180_000L)
            .set("energy", 0.5)
            .set("explicit", true)
            .build(),
        Record.builder()
            .set("track_id", "t2")
            .set("played_at", null)
            .set("duration_ms", null)
            .set("energy", null)
            .set("explicit", null)
            .build());
  }

  @Test
  void testWriteAndReadRecords() {
    List<Record> records = playEvents();
    TableSchema schema = TableSchema.inferFrom(records);
    Path file = new Path(tempDir.resolve("play_history.parquet").toUri());
    ParquetDataManager dataManager =
        ParquetDataManager.builder()
            .fileConfig(
                ParquetFileConfig.builder().compression(CompressionCodecName.GZIP).build())
            .build();
    dataManager.writeRecords(CONF, file, schema, records);

    assertEquals(records, dataManager.readRecords(CONF, file));

    ParquetMetadata footer = ParquetMetadataExtractor.getInstance().readParquetMetadata(CONF, file);
    assertEquals(2L, ParquetMetadataExtractor.getRowCount(footer));
    assertEquals(
        ColumnType.TIMESTAMP,
        ParquetSchemaExtractor.getInstance()
            .toTableSchema(ParquetMetadataExtractor.getSchema(footer))
            .getColumn("played_at")
            .get()
            .getType());
  }

  @Test
  void testWriteReplacesExistingFile() {
    List<Record> records = playEvents();
    TableSchema schema = TableSchema.inferFrom(records);
    Path file = new Path(tempDir.resolve("artists.parquet").toUri());
    ParquetDataManager dataManager = ParquetDataManager.builder().build();
    dataManager.writeRecords(CONF, file, schema, records);
    dataManager.writeRecords(CONF, file, schema, records.subList(0, 1));
    assertEquals(records.subList(0, 1), dataManager.readRecords(CONF, file));
  }

  @Test
  void testReadMissingFile() {
    Path file = new Path(tempDir.resolve("missing.parquet").toUri());
    assertThrows(
        ReadException.class, () -> ParquetDataManager.builder().build().readRecords(CONF, file));
  }

  @Test
  void testWriteIntoUnwritableLocation() throws IOException {
    java.nio.file.Path blocker = tempDir.resolve("blocker");
    Files.write(blocker, new byte[] {1});
    Path file = new Path(blocker.resolve("nested.parquet").toUri());
    List<Record> records = playEvents();
    assertThrows(
        WriteException.class,
        () ->
            ParquetDataManager.builder()
                .build()
                .writeRecords(CONF, file, TableSchema.inferFrom(records), records));
  }
}
