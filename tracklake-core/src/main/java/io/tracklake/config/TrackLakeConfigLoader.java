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

package io.tracklake.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.log4j.Log4j2;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.annotations.VisibleForTesting;

import io.tracklake.exception.ConfigurationException;
import io.tracklake.model.gap.GapQuery;

/**
 * Loads {@link TrackLakeConfig} from YAML. The defaults bundled as {@value #DEFAULTS_RESOURCE} are
 * loaded first and the custom configuration is merged over them: mappings are merged key by key,
 * any other value replaces the default.
 */
@Log4j2
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class TrackLakeConfigLoader {
  public static final ObjectMapper YAML_MAPPER =
      new ObjectMapper(new YAMLFactory()).registerModule(new JavaTimeModule());
  public static final String DEFAULTS_RESOURCE = "tracklake-defaults.yaml";

  public static TrackLakeConfig loadDefaults() {
    return load((byte[]) null);
  }

  public static TrackLakeConfig load(Path configPath) {
    try {
      log.info("Loading configuration from {}", configPath);
      return load(Files.readAllBytes(configPath));
    } catch (IOException e) {
      throw new ConfigurationException("Failed to read configuration file " + configPath, e);
    }
  }

  /**
   * Loads the default configuration and merges the custom configuration over it.
   *
   * @param customConfig YAML content, may be null
   */
  public static TrackLakeConfig load(byte[] customConfig) {
    try {
      JsonNode merged = readDefaults();
      if (customConfig != null) {
        JsonNode custom = YAML_MAPPER.readTree(customConfig);
        if (custom != null && !custom.isMissingNode() && !custom.isNull()) {
          merged = merge(merged, custom);
        }
      }
      return withEntityTypes(YAML_MAPPER.treeToValue(merged, TrackLakeConfig.class));
    } catch (IOException | IllegalArgumentException e) {
      throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
    }
  }

  private static JsonNode readDefaults() throws IOException {
    try (InputStream inputStream =
        TrackLakeConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (inputStream == null) {
        throw new ConfigurationException("Missing default configuration " + DEFAULTS_RESOURCE);
      }
      return YAML_MAPPER.readTree(inputStream);
    }
  }

  @VisibleForTesting
  static JsonNode merge(JsonNode base, JsonNode override) {
    if (!(base instanceof ObjectNode) || !override.isObject()) {
      return override;
    }
    ObjectNode result = ((ObjectNode) base).deepCopy();
    Iterator<Map.Entry<String, JsonNode>> fields = override.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode current = result.get(field.getKey());
      result.set(
          field.getKey(), current == null ? field.getValue() : merge(current, field.getValue()));
    }
    return result;
  }

  // queries are keyed by entity type, the key wins over an entityType written in the query
  private static TrackLakeConfig withEntityTypes(TrackLakeConfig config) {
    Map<String, GapQuery> gapQueries = new LinkedHashMap<>();
    config
        .getGapQueries()
        .forEach(
            (entityType, query) ->
                gapQueries.put(entityType, query.toBuilder().entityType(entityType).build()));
    return config.toBuilder().gapQueries(gapQueries).build();
  }
}
