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

package io.tracklake.store;

import java.io.IOException;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.parquet.hadoop.metadata.ParquetMetadata;

import com.google.common.base.Preconditions;

import io.tracklake.exception.WriteException;
import io.tracklake.merge.MergeEngine;
import io.tracklake.merge.MergeOutcome;
import io.tracklake.model.Record;
import io.tracklake.model.Table;
import io.tracklake.model.TableInfo;
import io.tracklake.model.context.OperationContext;
import io.tracklake.model.schema.TableSchema;
import io.tracklake.model.write.MalformedRecordPolicy;
import io.tracklake.model.write.MergeKeyPolicy;
import io.tracklake.model.write.WriteMode;
import io.tracklake.model.write.WriteResult;
import io.tracklake.model.write.WriteStatus;
import io.tracklake.parquet.ParquetDataManager;
import io.tracklake.parquet.ParquetFileConfig;
import io.tracklake.parquet.ParquetMetadataExtractor;
import io.tracklake.parquet.ParquetSchemaExtractor;
import io.tracklake.spi.store.TableStore;
import io.tracklake.storage.FileSystemHelper;

/**
 * {@link TableStore} keeping every table as parquet files in {@code <basePath>/<tableName>/}.
 *
 * <p>A write always produces exactly one data file holding the complete new content of the table.
 * The file is first written under a hidden in-progress name, then the previous data files are
 * removed and the new file is renamed to {@code <table>-<timestamp>-<uuid>.parquet}.
 */
@Log4j2
public class ParquetTableStore implements TableStore {
  static final String IN_PROGRESS_PREFIX = "_inprogress-";
  private static final DateTimeFormatter FILE_TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS").withZone(ZoneOffset.UTC);

  private final Configuration hadoopConf;
  @Getter private final Path basePath;
  private final MergeEngine mergeEngine;
  private final ParquetDataManager dataManager;
  private final ParquetMetadataExtractor metadataExtractor;
  private final ParquetSchemaExtractor schemaExtractor;
  private final FileSystemHelper fileSystemHelper;
  private final OperationContext operationContext;
  private final Clock clock;

  @Builder
  public ParquetTableStore(
      @NonNull Configuration hadoopConf,
      @NonNull String basePath,
      MergeKeyPolicy mergeKeyPolicy,
      MalformedRecordPolicy malformedRecordPolicy,
      ParquetFileConfig parquetFileConfig,
      OperationContext operationContext,
      Clock clock) {
    this.hadoopConf = hadoopConf;
    this.basePath = new Path(basePath);
    this.mergeEngine =
        MergeEngine.builder()
            .mergeKeyPolicy(mergeKeyPolicy == null ? MergeKeyPolicy.defaults() : mergeKeyPolicy)
            .malformedRecordPolicy(
                malformedRecordPolicy == null ? MalformedRecordPolicy.DROP : malformedRecordPolicy)
            .build();
    this.dataManager =
        ParquetDataManager.builder()
            .fileConfig(
                parquetFileConfig == null ? ParquetFileConfig.defaults() : parquetFileConfig)
            .build();
    this.metadataExtractor = ParquetMetadataExtractor.getInstance();
    this.schemaExtractor = ParquetSchemaExtractor.getInstance();
    this.fileSystemHelper = FileSystemHelper.getInstance();
    this.operationContext = operationContext == null ? new OperationContext() : operationContext;
    this.clock = clock == null ? Clock.systemUTC() : clock;
  }

  public Path getTablePath(String tableName) {
    Preconditions.checkArgument(
        tableName != null && !tableName.isEmpty() && !tableName.contains("/"),
        "Invalid table name %s",
        tableName);
    return new Path(basePath, tableName);
  }

  /** Data files of the table ordered by file name. */
  public List<FileStatus> getDataFiles(String tableName) {
    return fileSystemHelper.getDataFiles(hadoopConf, getTablePath(tableName));
  }

  @Override
  public Optional<Table> readTable(String tableName) {
    List<FileStatus> dataFiles = getDataFiles(tableName);
    if (dataFiles.isEmpty()) {
      return Optional.empty();
    }
    TableSchema schema = TableSchema.empty();
    List<List<Record>> fileRecords = new ArrayList<>(dataFiles.size());
    for (FileStatus dataFile : dataFiles) {
      schema = schema.union(readFileSchema(dataFile));
      fileRecords.add(dataManager.readRecords(hadoopConf, dataFile.getPath()));
    }
    List<Record> records = new ArrayList<>();
    for (List<Record> batch : fileRecords) {
      for (Record record : batch) {
        records.add(schema.conform(record));
      }
    }
    log.debug(
        "Read {} records from {} files of table {}", records.size(), dataFiles.size(), tableName);
    return Optional.of(new Table(tableName, schema, records));
  }

  @Override
  public WriteResult writeTable(String tableName, List<Record> records, WriteMode mode) {
    if (records == null || records.isEmpty()) {
      log.info("No records to write to table {}", tableName);
      return WriteResult.noUpdates(tableName, mode, "No records to write");
    }
    try {
      Optional<Table> existing = readTable(tableName);
      MergeOutcome outcome = mergeEngine.merge(tableName, existing, records, mode);
      operationContext.increment(OperationContext.RECORDS_DROPPED, outcome.getRecordsDropped());
      if (!outcome.hasChanges()) {
        log.info(
            "No new records for table {}, {} records dropped",
            tableName,
            outcome.getRecordsDropped());
        return WriteResult.noUpdates(tableName, mode, "No new records to write").toBuilder()
            .recordsDropped(outcome.getRecordsDropped())
            .totalRecords(existing.map(Table::getRecordCount).orElse(0))
            .build();
      }
      Table table = outcome.getTable();
      if (table.getSchema().isEmpty()) {
        throw new WriteException("Cannot write table " + tableName + " without columns");
      }
      replaceDataFiles(table);
      operationContext.increment(OperationContext.RECORDS_WRITTEN, outcome.getRecordsWritten());
      operationContext.increment(
          OperationContext.RECORDS_SUPERSEDED, outcome.getRecordsSuperseded());
      operationContext.increment(OperationContext.TABLES_WRITTEN);
      log.info(
          "Wrote {} records to table {} with mode {} ({} dropped, {} superseded, {} total)",
          outcome.getRecordsWritten(),
          tableName,
          outcome.getEffectiveMode(),
          outcome.getRecordsDropped(),
          outcome.getRecordsSuperseded(),
          table.getRecordCount());
      return WriteResult.builder()
          .tableName(tableName)
          .mode(mode)
          .status(WriteStatus.SUCCESS)
          .recordsWritten(outcome.getRecordsWritten())
          .recordsDropped(outcome.getRecordsDropped())
          .totalRecords(table.getRecordCount())
          .message(
              String.format(
                  "Wrote %d records with mode %s",
                  outcome.getRecordsWritten(),
                  outcome.getEffectiveMode()))
          .build();
    } catch (Exception e) {
      log.error("Failed to write table {} with mode {}", tableName, mode, e);
      operationContext.increment(OperationContext.WRITE_ERRORS);
      return WriteResult.error(tableName, mode, e, "Failed to write table " + tableName);
    }
  }

  @Override
  public boolean tableExists(String tableName) {
    return !getDataFiles(tableName).isEmpty();
  }

  @Override
  public TableInfo tableInfo(String tableName) {
    List<FileStatus> dataFiles = getDataFiles(tableName);
    if (dataFiles.isEmpty()) {
      return TableInfo.notFound();
    }
    long recordCount = 0;
    TableSchema schema = TableSchema.empty();
    Map<String, Long> fileSizes = new LinkedHashMap<>();
    for (FileStatus dataFile : dataFiles) {
      ParquetMetadata footer =
          metadataExtractor.readParquetMetadata(hadoopConf, dataFile.getPath());
      recordCount += ParquetMetadataExtractor.getRowCount(footer);
      schema =
          schema.union(
              schemaExtractor.toTableSchema(ParquetMetadataExtractor.getSchema(footer)));
      fileSizes.put(dataFile.getPath().getName(), dataFile.getLen());
    }
    return TableInfo.builder()
        .exists(true)
        .recordCount(recordCount)
        .columns(schema.getColumnNames())
        .schema(schema)
        .fileCount(dataFiles.size())
        .fileSizes(fileSizes)
        .build();
  }

  @Override
  public int cleanupOldFiles(String tableName, int keepLatest) {
    Preconditions.checkArgument(keepLatest >= 0, "keepLatest must not be negative");
    List<FileStatus> newestFirst =
        getDataFiles(tableName).stream()
            .sorted(
                Comparator.comparingLong(FileStatus::getModificationTime)
                    .thenComparing(file -> file.getPath().getName())
                    .reversed())
            .collect(Collectors.toList());
    if (newestFirst.size() <= keepLatest) {
      return 0;
    }
    List<FileStatus> toDelete = newestFirst.subList(keepLatest, newestFirst.size());
    try {
      FileSystem fs = getTablePath(tableName).getFileSystem(hadoopConf);
      for (FileStatus file : toDelete) {
        if (!fs.delete(file.getPath(), false)) {
          throw new WriteException("Failed to delete old data file " + file.getPath());
        }
        log.info("Deleted old data file {}", file.getPath());
      }
    } catch (IOException e) {
      throw new WriteException("Failed to delete old data files of table " + tableName, e);
    }
    operationContext.increment(OperationContext.FILES_DELETED, toDelete.size());
    return toDelete.size();
  }

  private TableSchema readFileSchema(FileStatus dataFile) {
    ParquetMetadata footer = metadataExtractor.readParquetMetadata(hadoopConf, dataFile.getPath());
    return schemaExtractor.toTableSchema(ParquetMetadataExtractor.getSchema(footer));
  }

  private void replaceDataFiles(Table table) {
    Path tablePath = getTablePath(table.getName());
    List<FileStatus> previousFiles = getDataFiles(table.getName());
    String uuid = UUID.randomUUID().toString();
    Path inProgressFile =
        new Path(tablePath, IN_PROGRESS_PREFIX + uuid + FileSystemHelper.DATA_FILE_SUFFIX);
    Path dataFile =
        new Path(
            tablePath,
            String.format(
                "%s-%s-%s%s",
                table.getName(),
                FILE_TIMESTAMP_FORMAT.format(clock.instant()),
                uuid,
                FileSystemHelper.DATA_FILE_SUFFIX));
    try {
      dataManager.writeRecords(hadoopConf, inProgressFile, table.getSchema(), table.getRecords());
    } catch (RuntimeException e) {
      deleteInProgressFile(inProgressFile);
      throw e;
    }
    // from here on the in-progress file may be the only full copy of the table, so it is kept
    try {
      FileSystem fs = tablePath.getFileSystem(hadoopConf);
      for (FileStatus previousFile : previousFiles) {
        if (!fs.delete(previousFile.getPath(), false)) {
          throw new WriteException(
              "Failed to delete previous data file " + previousFile.getPath());
        }
      }
      if (!fs.rename(inProgressFile, dataFile)) {
        throw new WriteException("Failed to rename " + inProgressFile + " to " + dataFile);
      }
    } catch (IOException e) {
      throw new WriteException("Failed to replace data files of table " + table.getName(), e);
    }
    log.debug(
        "Replaced {} data files of table {} with {}",
        previousFiles.size(),
        table.getName(),
        dataFile);
  }

  private void deleteInProgressFile(Path inProgressFile) {
    try {
      FileSystem fs = inProgressFile.getFileSystem(hadoopConf);
      if (fs.exists(inProgressFile) && !fs.delete(inProgressFile, false)) {
        log.warn("Could not delete in-progress file {}", inProgressFile);
      }
    } catch (IOException e) {
      log.warn("Could not delete in-progress file {}", inProgressFile, e);
    }
  }
}
