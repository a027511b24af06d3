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

package io.tracklake.utilities;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import lombok.extern.log4j.Log4j2;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.hadoop.conf.Configuration;

import com.google.common.annotations.VisibleForTesting;

import io.tracklake.config.TrackLakeConfig;
import io.tracklake.config.TrackLakeConfigLoader;
import io.tracklake.model.TableInfo;
import io.tracklake.model.context.OperationContext;
import io.tracklake.model.gap.BatchPlan;
import io.tracklake.model.gap.GapResult;
import io.tracklake.model.write.WriteResult;
import io.tracklake.store.IncrementalStore;

/**
 * Command line runner to inspect and maintain a store: describe tables, count and list the
 * entities still missing enrichment, compact the play history and delete old data files.
 */
@Log4j2
public class RunStore {
  private static final String CONFIG_OPTION = "c";
  private static final String HADOOP_CONFIG_PATH = "p";
  private static final String BASE_PATH_OPTION = "b";
  private static final String ACTION_OPTION = "a";
  private static final String TABLE_OPTION = "t";
  private static final String ENTITY_OPTION = "e";
  private static final String BATCH_SIZE_OPTION = "s";
  private static final String OFFSET_OPTION = "o";
  private static final String KEEP_LATEST_OPTION = "k";
  private static final String HELP_OPTION = "h";

  static final String DEFAULT_BATCH_SIZE = "50";
  static final String DEFAULT_KEEP_LATEST = "1";

  private static final Options OPTIONS =
      new Options()
          .addOption(
              CONFIG_OPTION,
              "config",
              true,
              "The path to a yaml file with the store configuration. "
                  + "These configs will override the defaults.")
          .addOption(
              HADOOP_CONFIG_PATH,
              "hadoopConfig",
              true,
              "Hadoop config xml file path containing configs necessary to access the "
                  + "file system. These configs will override the default configs.")
          .addOption(
              BASE_PATH_OPTION,
              "basePath",
              true,
              "Directory holding the tables, overrides the configured basePath")
          .addRequiredOption(
              ACTION_OPTION,
              "action",
              true,
              "One of " + Action.names() + ". info and cleanup need --table, batch needs --entity")
          .addOption(TABLE_OPTION, "table", true, "Name of the table")
          .addOption(
              ENTITY_OPTION,
              "entity",
              true,
              "Entity type of the gap query, missing reports every entity type when omitted")
          .addOption(
              BATCH_SIZE_OPTION,
              "batchSize",
              true,
              "Number of missing entities per batch. Defaults to " + DEFAULT_BATCH_SIZE)
          .addOption(OFFSET_OPTION, "offset", true, "Offset of the batch. Defaults to 0")
          .addOption(
              KEEP_LATEST_OPTION,
              "keepLatest",
              true,
              "Number of data files kept by cleanup. Defaults to " + DEFAULT_KEEP_LATEST)
          .addOption(HELP_OPTION, "help", false, "Displays help information to run this utility");

  enum Action {
    INFO,
    MISSING,
    BATCH,
    COMPACT,
    CLEANUP;

    static Action fromString(String value) {
      try {
        return Action.valueOf(value.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException(
            String.format("Unknown action %s, expected one of %s", value, names()), e);
      }
    }

    static List<String> names() {
      List<String> names = new ArrayList<>();
      for (Action action : values()) {
        names.add(action.name().toLowerCase(Locale.ROOT));
      }
      return names;
    }
  }

  public static void main(String[] args) throws IOException {
    CommandLineParser parser = new DefaultParser();

    CommandLine cmd;
    try {
      cmd = parser.parse(OPTIONS, args);
    } catch (ParseException e) {
      new HelpFormatter().printHelp("tracklake.jar", OPTIONS, true);
      return;
    }

    if (cmd.hasOption(HELP_OPTION)) {
      HelpFormatter formatter = new HelpFormatter();
      formatter.printHelp("RunStore", OPTIONS);
      return;
    }

    OperationContext operationContext = new OperationContext();
    IncrementalStore store = createStore(cmd, operationContext);
    for (String line : runAction(store, cmd)) {
      log.info(line);
    }
    log.info("Counters: {}", operationContext.getCounters());
  }

  @VisibleForTesting
  static CommandLine parseArgs(String... args) throws ParseException {
    return new DefaultParser().parse(OPTIONS, args);
  }

  @VisibleForTesting
  static IncrementalStore createStore(CommandLine cmd, OperationContext operationContext)
      throws IOException {
    TrackLakeConfig config =
        cmd.hasOption(CONFIG_OPTION)
            ? TrackLakeConfigLoader.load(Paths.get(cmd.getOptionValue(CONFIG_OPTION)))
            : TrackLakeConfigLoader.loadDefaults();
    if (cmd.hasOption(BASE_PATH_OPTION)) {
      config = config.toBuilder().basePath(cmd.getOptionValue(BASE_PATH_OPTION)).build();
    }
    Configuration hadoopConf = loadHadoopConf(getCustomConfigurations(cmd, HADOOP_CONFIG_PATH));
    return IncrementalStore.fromConfig(config, hadoopConf, operationContext);
  }

  /** Runs the requested action and returns the lines describing its outcome. */
  @VisibleForTesting
  static List<String> runAction(IncrementalStore store, CommandLine cmd) {
    Action action = Action.fromString(cmd.getOptionValue(ACTION_OPTION));
    switch (action) {
      case INFO:
        return describeTable(store, requiredValue(cmd, TABLE_OPTION));
      case MISSING:
        return countMissing(store, cmd);
      case BATCH:
        GapResult batch =
            store.getBatch(
                requiredValue(cmd, ENTITY_OPTION),
                Integer.parseInt(cmd.getOptionValue(BATCH_SIZE_OPTION, DEFAULT_BATCH_SIZE)),
                Long.parseLong(cmd.getOptionValue(OFFSET_OPTION, "0")));
        List<String> lines = new ArrayList<>();
        lines.add(
            String.format(
                "%d missing %s at offset %d",
                batch.size(), batch.getEntityType(), batch.getOffset()));
        batch.getRows().forEach(row -> lines.add(row.asMap().toString()));
        return lines;
      case COMPACT:
        return describeWrite(store.compactPlayHistory());
      case CLEANUP:
        String table = requiredValue(cmd, TABLE_OPTION);
        int deleted =
            store.cleanupOldFiles(
                table,
                Integer.parseInt(cmd.getOptionValue(KEEP_LATEST_OPTION, DEFAULT_KEEP_LATEST)));
        return Collections.singletonList(
            String.format("Deleted %d old data files of %s", deleted, table));
      default:
        throw new IllegalArgumentException("Unsupported action " + action);
    }
  }

  private static List<String> describeTable(IncrementalStore store, String table) {
    TableInfo info = store.tableInfo(table);
    if (!info.isExists()) {
      return Collections.singletonList(String.format("Table %s does not exist", table));
    }
    List<String> lines = new ArrayList<>();
    lines.add(
        String.format(
            "Table %s: %d records in %d files (%d bytes)",
            table, info.getRecordCount(), info.getFileCount(), info.getTotalSizeBytes()));
    info.getSchema()
        .getColumns()
        .forEach(
            column ->
                lines.add(
                    String.format("  %s %s", column.getName(), column.getType().getName())));
    return lines;
  }

  private static List<String> countMissing(IncrementalStore store, CommandLine cmd) {
    Collection<String> entityTypes =
        cmd.hasOption(ENTITY_OPTION)
            ? Collections.singletonList(cmd.getOptionValue(ENTITY_OPTION))
            : store.getEntityTypes();
    int batchSize = Integer.parseInt(cmd.getOptionValue(BATCH_SIZE_OPTION, DEFAULT_BATCH_SIZE));
    return entityTypes.stream()
        .map(
            entityType -> {
              BatchPlan plan = store.planBatches(entityType, batchSize);
              return String.format(
                  "%s: %d missing, %d batches of %d",
                  entityType, plan.getTotalItems(), plan.getBatchCount(), batchSize);
            })
        .collect(Collectors.toList());
  }

  private static List<String> describeWrite(WriteResult result) {
    return Collections.singletonList(
        String.format(
            "%s %s: %s (%d records)",
            result.getTableName(),
            result.getStatus(),
            result.getMessage(),
            result.getTotalRecords()));
  }

  private static String requiredValue(CommandLine cmd, String option) {
    String value = cmd.getOptionValue(option);
    if (value == null) {
      throw new IllegalArgumentException(
          String.format(
              "Option --%s is required for this action", OPTIONS.getOption(option).getLongOpt()));
    }
    return value;
  }

  static byte[] getCustomConfigurations(CommandLine cmd, String option) throws IOException {
    byte[] customConfig = null;
    if (cmd.hasOption(option)) {
      customConfig = Files.readAllBytes(Paths.get(cmd.getOptionValue(option)));
    }
    return customConfig;
  }

  @VisibleForTesting
  static Configuration loadHadoopConf(byte[] customConfig) {
    Configuration conf = new Configuration();
    conf.addResource("tracklake-hadoop-defaults.xml");
    if (customConfig != null) {
      conf.addResource(new ByteArrayInputStream(customConfig), "customConfigStream");
    }
    return conf;
  }
}
