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

package io.tracklake.storage;

import java.io.IOException;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.LocatedFileStatus;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.fs.RemoteIterator;

import io.tracklake.exception.ReadException;

/**
 * Lists the data files of a table directory. Only the direct children of the directory ending in
 * {@code .parquet} count as data files; names starting with {@code .} or {@code _} are hidden and
 * used for checksums and in-progress writes.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class FileSystemHelper {
  public static final String DATA_FILE_SUFFIX = ".parquet";
  private static final FileSystemHelper INSTANCE = new FileSystemHelper();

  public static FileSystemHelper getInstance() {
    return INSTANCE;
  }

  public static boolean isDataFile(Path path) {
    String name = path.getName();
    return name.endsWith(DATA_FILE_SUFFIX) && !name.startsWith(".") && !name.startsWith("_");
  }

  /**
   * Returns the data files of the directory ordered by file name.
   *
   * @return an empty list if the directory does not exist
   */
  public List<FileStatus> getDataFiles(Configuration hadoopConf, Path tableDir) {
    try {
      FileSystem fs = tableDir.getFileSystem(hadoopConf);
      if (!fs.exists(tableDir)) {
        return Collections.emptyList();
      }
      try (Stream<LocatedFileStatus> files =
          remoteIteratorToStream(fs.listFiles(tableDir, false))) {
        return files
            .filter(file -> isDataFile(file.getPath()))
            .sorted(Comparator.comparing(file -> file.getPath().getName()))
            .collect(Collectors.toList());
      }
    } catch (IOException | UncheckedReadException e) {
      throw new ReadException("Failed to list data files of " + tableDir, e);
    }
  }

  private static <T> Stream<T> remoteIteratorToStream(RemoteIterator<T> remoteIterator) {
    Iterator<T> iterator =
        new Iterator<T>() {
          @Override
          public boolean hasNext() {
            try {
              return remoteIterator.hasNext();
            } catch (IOException e) {
              throw new UncheckedReadException(e);
            }
          }

          @Override
          public T next() {
            try {
              return remoteIterator.next();
            } catch (IOException e) {
              throw new UncheckedReadException(e);
            }
          }
        };
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED), false);
  }

  private static class UncheckedReadException extends RuntimeException {
    UncheckedReadException(IOException cause) {
      super(cause);
    }
  }
}
