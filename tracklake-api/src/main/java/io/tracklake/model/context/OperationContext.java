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

package io.tracklake.model.context;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import lombok.ToString;

/**
 * Counters of a single caller-owned unit of work, such as one enrichment run. Components receive
 * the context at construction and add to it; the caller reads it once the work is done.
 *
 * <p>Not thread safe.
 *
 * @since 0.1
 */
@ToString
public class OperationContext {
  public static final String RECORDS_WRITTEN = "records_written";
  public static final String RECORDS_DROPPED = "records_dropped";
  public static final String RECORDS_SUPERSEDED = "records_superseded";
  public static final String TABLES_WRITTEN = "tables_written";
  public static final String WRITE_ERRORS = "write_errors";
  public static final String EXACT_DUPLICATES = "exact_duplicates";
  public static final String WINDOW_DUPLICATES = "window_duplicates";
  public static final String GAP_QUERIES = "gap_queries";
  public static final String FILES_DELETED = "files_deleted";

  private final Map<String, Long> counters = new TreeMap<>();

  public void increment(String counter) {
    increment(counter, 1);
  }

  public void increment(String counter, long delta) {
    counters.merge(counter, delta, Long::sum);
  }

  public long getCount(String counter) {
    return counters.getOrDefault(counter, 0L);
  }

  public Map<String, Long> getCounters() {
    return Collections.unmodifiableMap(counters);
  }
}
