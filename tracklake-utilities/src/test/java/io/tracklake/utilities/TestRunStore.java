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

import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.MissingOptionException;
import org.apache.hadoop.conf.Configuration;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.tracklake.model.Record;
import io.tracklake.model.context.OperationContext;
import io.tracklake.model.write.WriteMode;
import io.tracklake.store.IncrementalStore;

class TestRunStore {
  private static final Instant T = Instant.parse("2024-03-01T12:00:00Z");

  @TempDir Path tempDir;

  private IncrementalStore store;

  @BeforeEach
  void setUp() throws Exception {
    store =
        RunStore.createStore(
            RunStore.parseArgs("-a", "info", "-b", tempDir.toString()), new OperationContext());
  }

  private List<String> run(String... args) throws Exception {
    String[] withBasePath = Arrays.copyOf(args, args.length + 2);
    withBasePath[args.length] = "--basePath";
    withBasePath[args.length + 1] = tempDir.toString();
    return RunStore.runAction(store, RunStore.parseArgs(withBasePath));
  }

  private static Record play(String artistId, long offsetSeconds) {
    return Record.builder()
        .set("track_id", "t-" + artistId)
        .set("track_name", "Song " + artistId)
        .set("artist", "Artist " + artistId)
        .set("artist_id", artistId)
        .set("played_at", T.plusSeconds(offsetSeconds))
        .set("duration_ms", 180_000L)
        .build();
  }

  /** Tests that the default hadoop configs are loaded. */
  @Test
  public void testLoadDefaultHadoopConfig() {
    Configuration conf;
    conf = new Configuration();
    String value = conf.get("fs.file.impl");
    Assertions.assertNull(value);

    conf = RunStore.loadHadoopConf(null);
    value = conf.get("fs.file.impl");
    Assertions.assertEquals("org.apache.hadoop.fs.LocalFileSystem", value);
    Assertions.assertEquals("NONE", conf.get("parquet.summary.metadata.level"));
  }

  /** Hadoop logs through SLF4J, which must bind to Log4j2 and nothing else. */
  @Test
  public void testSingleSlf4jBinding() throws Exception {
    List<URL> bindings =
        Collections.list(
            getClass().getClassLoader().getResources("org/slf4j/impl/StaticLoggerBinder.class"));
    Assertions.assertEquals(1, bindings.size(), bindings.toString());
    Assertions.assertTrue(
        bindings.get(0).toString().contains("log4j-slf4j-impl"), bindings.toString());
    List<String> log4j1 =
        Collections.list(getClass().getClassLoader().getResources("org/apache/log4j/Level.class"))
            .stream()
            .map(URL::toString)
            .collect(Collectors.toList());
    Assertions.assertEquals(Collections.emptyList(), log4j1);
    Assertions.assertNotNull(RunStore.loadHadoopConf(null).get("fs.file.impl"));
  }

  /** Tests that the custom hadoop configs are loaded and can override defaults. */
  @Test
  public void testLoadCustomHadoopConfig() {
    String customXmlConfig =
        "<configuration>"
            + "  <property>"
            + "    <name>fs.file.impl</name>"
            + "    <value>override_default_value</value>"
            + "  </property>"
            + "  <property>"
            + "    <name>fs.s3a.endpoint</name>"
            + "    <value>http://localhost:9000</value>"
            + "  </property>"
            + "</configuration>";

    Configuration conf = RunStore.loadHadoopConf(customXmlConfig.getBytes());
    Assertions.assertEquals("override_default_value", conf.get("fs.file.impl"));
    Assertions.assertEquals("http://localhost:9000", conf.get("fs.s3a.endpoint"));
  }

  @Test
  public void testActionIsRequired() {
    Assertions.assertThrows(MissingOptionException.class, () -> RunStore.parseArgs("-t", "x"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> run("-a", "sync"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> run("-a", "info"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> run("-a", "batch"));
  }

  @Test
  public void testCustomConfigFile() throws Exception {
    Path configFile = tempDir.resolve("tracklake.yaml");
    Files.write(
        configFile,
        ("basePath: " + tempDir.resolve("custom") + "\nplayHistoryTable: listens\n")
            .getBytes(StandardCharsets.UTF_8));
    CommandLine cmd = RunStore.parseArgs("-a", "compact", "-c", configFile.toString());
    IncrementalStore custom = RunStore.createStore(cmd, new OperationContext());
    Assertions.assertEquals("listens", custom.getPlayHistoryTable());
    Assertions.assertEquals(
        Collections.singletonList("listens NO_UPDATES: No play history (0 records)"),
        RunStore.runAction(custom, cmd));
  }

  @Test
  public void testInfo() throws Exception {
    Assertions.assertEquals(
        Collections.singletonList("Table artists does not exist"),
        run("-a", "info", "-t", "artists"));

    store.writeTable(
        "artists",
        Collections.singletonList(
            Record.builder().set("artist_id", "a1").set("popularity", 10).build()),
        WriteMode.MERGE);
    List<String> lines = run("--action", "INFO", "--table", "artists");
    Assertions.assertEquals(3, lines.size());
    Assertions.assertTrue(lines.get(0).startsWith("Table artists: 1 records in 1 files"));
    Assertions.assertEquals("  artist_id string", lines.get(1));
    Assertions.assertEquals("  popularity long", lines.get(2));
  }

  @Test
  public void testMissingAndBatch() throws Exception {
    store.appendPlayEvents(Arrays.asList(play("a1", 0), play("a2", 300), play("a3", 600)));

    Assertions.assertEquals(
        Collections.singletonList("artists: 3 missing, 2 batches of 2"),
        run("-a", "missing", "-e", "artists", "-s", "2"));

    List<String> batch = run("-a", "batch", "-e", "artists", "-s", "2", "-o", "2");
    Assertions.assertEquals(2, batch.size());
    Assertions.assertEquals("1 missing artists at offset 2", batch.get(0));
    Assertions.assertTrue(batch.get(1).contains("artist_id=a3"));
  }

  @Test
  public void testCompactAndCleanup() throws Exception {
    store.writeTable(
        "play_history", Arrays.asList(play("a1", 0), play("a1", 0)), WriteMode.APPEND);
    List<String> compact = run("-a", "compact");
    Assertions.assertEquals(1, compact.size());
    Assertions.assertTrue(compact.get(0).startsWith("play_history SUCCESS"));

    Assertions.assertEquals(
        Collections.singletonList("Deleted 0 old data files of play_history"),
        run("-a", "cleanup", "-t", "play_history", "-k", "1"));
  }
}
