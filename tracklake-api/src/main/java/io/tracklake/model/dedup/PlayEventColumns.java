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

package io.tracklake.model.dedup;

import java.util.concurrent.TimeUnit;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Names of the play event columns used for deduplication.
 *
 * @since 0.1
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PlayEventColumns {
  private static final PlayEventColumns DEFAULTS = PlayEventColumns.builder().build();

  @Builder.Default String trackId = "track_id";
  @Builder.Default String trackName = "track_name";
  @Builder.Default String artist = "artist";
  @Builder.Default String playedAt = "played_at";
  @Builder.Default String duration = "duration_ms";
  @Builder.Default TimeUnit durationUnit = TimeUnit.MILLISECONDS;

  public static PlayEventColumns defaults() {
    return DEFAULTS;
  }
}
