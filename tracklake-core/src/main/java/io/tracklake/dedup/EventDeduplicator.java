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

package io.tracklake.dedup;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.extern.log4j.Log4j2;

import io.tracklake.model.Record;
import io.tracklake.model.context.OperationContext;
import io.tracklake.model.dedup.DedupResult;
import io.tracklake.model.dedup.PlayEventColumns;

/**
 * Reduces overlapping play event feeds to one canonical listening history.
 *
 * <p>Deduplication runs in two phases over the events sorted in a canonical total order:
 *
 * <ol>
 *   <li>Exact duplicates: events of the same track played at the same instant collapse into the
 *       first one. A track is identified by its id, or by name and artist when it has no id.
 *   <li>Duration window: among the events of the same track name and artist, an event that starts
 *       before the last kept play of that track has finished is an echo of it and is dropped.
 * </ol>
 *
 * <p>The window is anchored on the last kept play of the track, not on the event right before it.
 * A chain of echoes a few seconds apart therefore never stretches the window past the end of the
 * play it echoes, and a new listen that starts after that play has finished is always kept.
 *
 * <p>Events without a track name, artist or play time skip the second phase and are always kept.
 * The result does not depend on the input order and deduplicating it again changes nothing.
 */
@Log4j2
public class EventDeduplicator {
  private final PlayEventColumns columns;
  private final OperationContext operationContext;
  private final Comparator<Record> canonicalOrder;

  @Builder
  public EventDeduplicator(PlayEventColumns columns, OperationContext operationContext) {
    this.columns = columns == null ? PlayEventColumns.defaults() : columns;
    this.operationContext = operationContext == null ? new OperationContext() : operationContext;
    this.canonicalOrder =
        Comparator.<Record, Instant>comparing(
                this::playedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing(this::identity, Comparator.nullsLast(Comparator.<String>naturalOrder()))
            .thenComparing(EventDeduplicator::valueTuple);
  }

  public DedupResult deduplicate(List<Record> events) {
    List<Record> sorted = new ArrayList<>(events);
    sorted.sort(canonicalOrder);

    Map<Object, Record> firstByPlay = new LinkedHashMap<>();
    for (Record event : sorted) {
      firstByPlay.putIfAbsent(exactKey(event), event);
    }
    List<Record> distinct = new ArrayList<>(firstByPlay.values());
    int exactDuplicates = sorted.size() - distinct.size();

    Map<List<String>, Record> lastKeptByTrack = new HashMap<>();
    List<Record> kept = new ArrayList<>(distinct.size());
    int windowDuplicates = 0;
    int sparse = 0;
    for (Record event : distinct) {
      Instant playedAt = playedAt(event);
      String trackName = event.getString(columns.getTrackName());
      String artist = event.getString(columns.getArtist());
      if (playedAt == null || trackName == null || artist == null) {
        sparse++;
        kept.add(event);
        continue;
      }
      List<String> track = Arrays.asList(trackName, artist);
      Record previous = lastKeptByTrack.get(track);
      if (previous != null && isWithinPlay(previous, playedAt)) {
        windowDuplicates++;
        continue;
      }
      lastKeptByTrack.put(track, event);
      kept.add(event);
    }

    operationContext.increment(OperationContext.EXACT_DUPLICATES, exactDuplicates);
    operationContext.increment(OperationContext.WINDOW_DUPLICATES, windowDuplicates);
    log.info(
        "Deduplicated {} play events to {}: {} exact, {} within play duration, {} sparse",
        events.size(),
        kept.size(),
        exactDuplicates,
        windowDuplicates,
        sparse);
    return DedupResult.builder()
        .events(kept)
        .inputCount(events.size())
        .exactDuplicates(exactDuplicates)
        .windowDuplicates(windowDuplicates)
        .sparseRecords(sparse)
        .build();
  }

  // a previous play without duration opens no window
  private boolean isWithinPlay(Record previous, Instant playedAt) {
    Duration duration = duration(previous);
    if (duration == null) {
      return false;
    }
    Duration sincePrevious = Duration.between(playedAt(previous), playedAt);
    return sincePrevious.compareTo(duration) <= 0;
  }

  private Object exactKey(Record event) {
    String identity = identity(event);
    Instant playedAt = playedAt(event);
    if (identity == null || playedAt == null) {
      return event;
    }
    return Arrays.asList(identity, playedAt);
  }

  private String identity(Record event) {
    String trackId = event.getString(columns.getTrackId());
    if (trackId != null && !trackId.trim().isEmpty()) {
      return "id:" + trackId;
    }
    String trackName = event.getString(columns.getTrackName());
    String artist = event.getString(columns.getArtist());
    if (trackName == null && artist == null) {
      return null;
    }
    return "name:" + Objects.toString(trackName, "") + "\u0000" + Objects.toString(artist, "");
  }

  private Instant playedAt(Record event) {
    Object value = event.get(columns.getPlayedAt());
    return value instanceof Instant ? (Instant) value : null;
  }

  private Duration duration(Record event) {
    Object value = event.get(columns.getDuration());
    if (!(value instanceof Number)) {
      return null;
    }
    return Duration.ofNanos(columns.getDurationUnit().toNanos(((Number) value).longValue()));
  }

  // ties between different events with the same play time and track are broken on every value
  private static String valueTuple(Record event) {
    return new TreeMap<>(event.asMap())
        .entrySet().stream()
            .map(
                entry ->
                    entry.getKey()
                        + "="
                        + (entry.getValue() == null
                            ? "\u0000"
                            : entry.getValue().getClass().getSimpleName()
                                + ":"
                                + entry.getValue()))
            .collect(Collectors.joining("\u0001"));
  }
}
