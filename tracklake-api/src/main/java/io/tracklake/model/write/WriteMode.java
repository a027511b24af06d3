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

package io.tracklake.model.write;

import java.util.Locale;

/**
 * How an incoming batch of records is combined with the content of an existing table.
 *
 * @since 0.1
 */
public enum WriteMode {
  /** The incoming batch replaces the table content. */
  OVERWRITE,
  /** The incoming batch is added to the table content without any deduplication. */
  APPEND,
  /**
   * Existing records whose merge key appears in the incoming batch are replaced, the rest is kept.
   * Tables without a merge key append and drop exact duplicate rows.
   */
  MERGE;

  public static WriteMode fromString(String value) {
    try {
      return WriteMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown write mode: " + value, e);
    }
  }
}
