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

package io.tracklake.spi.store;

import java.util.List;
import java.util.Optional;

import io.tracklake.model.Record;
import io.tracklake.model.Table;
import io.tracklake.model.TableInfo;
import io.tracklake.model.write.WriteMode;
import io.tracklake.model.write.WriteResult;

/**
 * Persists named tables of records. A table is created by its first successful write and a table
 * without any data file does not exist.
 *
 * @since 0.1
 */
public interface TableStore {

  /**
   * Reads every record of a table.
   *
   * @return the table or empty if it does not exist
   */
  Optional<Table> readTable(String tableName);

  /**
   * Combines the records with the current content of the table according to the mode. Failures
   * are reported through {@link WriteResult#getErrorDetails()} and leave the table unchanged.
   */
  WriteResult writeTable(String tableName, List<Record> records, WriteMode mode);

  boolean tableExists(String tableName);

  /** Describes the table from file metadata only. */
  TableInfo tableInfo(String tableName);

  /**
   * Deletes all but the {@code keepLatest} most recently modified data files of the table.
   *
   * @return number of deleted files
   */
  int cleanupOldFiles(String tableName, int keepLatest);
}
