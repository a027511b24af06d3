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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Maps table names to the ordered list of columns that identify a record of the table. Tables
 * without an entry have no merge key.
 *
 * @since 0.1
 */
@Value
@Builder(toBuilder = true)
public class MergeKeyPolicy {
  @Singular("mergeKey")
  Map<String, List<String>> mergeKeys;

  public List<String> getMergeKeys(String tableName) {
    List<String> keys = mergeKeys.get(tableName);
    return keys == null ? Collections.emptyList() : Collections.unmodifiableList(keys);
  }

  public boolean hasMergeKeys(String tableName) {
    return !getMergeKeys(tableName).isEmpty();
  }

  /** Keys of the tables populated by the enrichment collaborators. */
  public static MergeKeyPolicy defaults() {
    return MergeKeyPolicy.builder()
        .mergeKey("artists", Collections.singletonList("artist_id"))
        .mergeKey("albums", Collections.singletonList("album_id"))
        .mergeKey("artist_genre", Arrays.asList("artist_id", "genre"))
        .mergeKey("album_genre", Arrays.asList("album_id", "genre"))
        .mergeKey("area_hierarchy", Collections.singletonList("area_id"))
        .mergeKey("coordinates", Collections.singletonList("location_params"))
        .mergeKey("mbz_artists", Collections.singletonList("spotify_id"))
        .build();
  }
}
