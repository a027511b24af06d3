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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.extern.log4j.Log4j2;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.example.ExampleParquetWriter;
import org.apache.parquet.hadoop.example.GroupReadSupport;
import org.apache.parquet.hadoop.util.HadoopOutputFile;
import org.apache.parquet.schema.MessageType;

import io.tracklake.exception.ReadException;
import io.tracklake.exception.WriteException;
import io.tracklake.model.Record;
import io.tracklake.model.schema.TableSchema;

/** Reads and writes whole parquet data files of a table. */
@Log4j2
@Builder
public class ParquetDataManager {
  @Builder.Default
  private final ParquetSchemaExtractor schemaExtractor = ParquetSchemaExtractor.getInstance();

  @Builder.Default
  private final ParquetRecordConverter recordConverter = ParquetRecordConverter.getInstance();

  @Builder.Default private final ParquetFileConfig fileConfig = ParquetFileConfig.defaults();

  public ParquetReader<Group> getParquetReader(Path file, Configuration conf) throws IOException {
    try {
      return ParquetReader.builder(new GroupReadSupport(), file).withConf(conf).build();
    } catch (IOException e) {
      log.error("Unexpected error during Parquet read: {}", file, e);
      throw new IOException("Unexpected error reading Parquet file", e);
    }
  }

  /** Reads every row of a data file in file order. */
  public List<Record> readRecords(Configuration conf, Path file) {
    List<Record> records = new ArrayList<>();
    try (ParquetReader<Group> reader = getParquetReader(file, conf)) {
      Group group;
      while ((group = reader.read()) != null) {
        records.add(recordConverter.toRecord(group));
      }
    } catch (IOException e) {
      throw new ReadException("Failed to read records from " + file, e);
    }
    log.debug("Read {} records from {}", records.size(), file);
    return records;
  }

  /**
   * Writes the records into a new data file, replacing any file already at the output path. The
   * records must conform to the schema.
   */
  public void writeRecords(
      Configuration conf, Path outputFile, TableSchema tableSchema, List<Record> records) {
    MessageType messageType = schemaExtractor.toParquetSchema(tableSchema);
    SimpleGroupFactory groupFactory = new SimpleGroupFactory(messageType);
    try (ParquetWriter<Group> writer =
        ExampleParquetWriter.builder(HadoopOutputFile.fromPath(outputFile, conf))
            .withConf(conf)
            .withType(messageType)
            .withCompressionCodec(fileConfig.getCompression())
            .withRowGroupSize(fileConfig.getRowGroupSizeBytes())
            .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
            .build()) {
      for (Record record : records) {
        writer.write(recordConverter.toGroup(record, tableSchema, groupFactory));
      }
    } catch (IOException e) {
      log.error("Unexpected error during Parquet write: {}", outputFile, e);
      throw new WriteException("Failed to complete Parquet write operation", e);
    }
    log.debug("Wrote {} records to {}", records.size(), outputFile);
  }
}
