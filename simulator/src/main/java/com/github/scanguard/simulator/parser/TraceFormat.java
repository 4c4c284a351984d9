/*
 * Copyright 2026 The ScanGuard Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.scanguard.simulator.parser;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Locale.US;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Stream;

import com.github.scanguard.simulator.parser.csv.CsvTraceReader;
import com.github.scanguard.simulator.parser.record.RecordTraceReader;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.Var;

/**
 * The trace file formats.
 */
@SuppressWarnings("ImmutableEnumChecker")
public enum TraceFormat {
  CSV(CsvTraceReader::new, ".csv", ".txt"),
  BINARY(RecordTraceReader::new, ".bin");

  private static final ImmutableSet<String> COMPRESSED = ImmutableSet.of(".gz", ".bz2", ".xz");

  private final Function<String, TraceReader> factory;
  private final ImmutableList<String> extensions;

  TraceFormat(Function<String, TraceReader> factory, String... extensions) {
    this.extensions = ImmutableList.copyOf(extensions);
    this.factory = factory;
  }

  /** Returns a new reader for streaming the events from the trace file. */
  public TraceReader readFile(String filePath) {
    return factory.apply(filePath);
  }

  /**
   * Returns a new reader for streaming the events from the trace files in order. Each path may be
   * prefixed by its format's name, as in {@code binary:/path/to/trace}, and otherwise the format
   * is chosen by the file's extension.
   *
   * @param filePaths the paths to the trace files
   * @return a reader for streaming the events from the files
   */
  public static TraceReader readFiles(List<String> filePaths) {
    var readers = filePaths.stream().map(TraceFormat::reader).collect(toImmutableList());
    return () -> readers.stream().flatMap(TraceReader::events);
  }

  private static TraceReader reader(String path) {
    List<String> parts = Splitter.on(':').limit(2).splitToList(path.trim());
    if ((parts.size() == 2) && isFormat(parts.get(0))) {
      return named(parts.get(0)).readFile(parts.get(1));
    }
    return forPath(path).readFile(path);
  }

  /**
   * Returns the format of the file based on its extension, ignoring a compression suffix.
   *
   * @throws IllegalArgumentException if the extension does not match a known format
   */
  public static TraceFormat forPath(String filePath) {
    @Var String name = filePath.trim().toLowerCase(US);
    for (String suffix : COMPRESSED) {
      if (name.endsWith(suffix)) {
        name = name.substring(0, name.length() - suffix.length());
        break;
      }
    }
    for (TraceFormat format : values()) {
      for (String extension : format.extensions) {
        if (name.endsWith(extension)) {
          return format;
        }
      }
    }
    throw new IllegalArgumentException("Unknown trace format for file: " + filePath);
  }

  /** Returns the format based on its configuration name. */
  public static TraceFormat named(String name) {
    return TraceFormat.valueOf(name.trim().replace('-', '_').toUpperCase(US));
  }

  private static boolean isFormat(String name) {
    String normalized = name.trim().replace('-', '_').toUpperCase(US);
    return Stream.of(values()).anyMatch(format -> format.name().equals(normalized));
  }
}
