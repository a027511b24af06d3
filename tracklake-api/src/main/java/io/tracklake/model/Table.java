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

import java.util.List;

import lombok.NonNull;
import lombok.Value;

import io.tracklake.model.schema.TableSchema;

/**
 * Fully materialized content of a table. Every record conforms to {@link #getSchema()}.
 *
 * @since 0.1
 */
@Value
public class Table {
  @NonNull String name;
  @NonNull TableSchema schema;
  @NonNull List<Record> records;

  public int getRecordCount() {
    return records.size();
  }
}
