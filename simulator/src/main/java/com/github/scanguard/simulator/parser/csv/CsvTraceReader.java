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
package com.github.scanguard.simulator.parser.csv;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.util.List;
import java.util.stream.Stream;

import com.github.scanguard.simulator.parser.AbstractTraceReader;
import com.github.scanguard.simulator.parser.AccessEvent;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.io.Closeables;

/**
 * A reader for traces of comma-separated values in the format
 * {@code time,key,size,next_vtime}. The trailing columns may be omitted and a line holding a
 * single value is read as the key. Blank lines, and header or comment lines that do not begin with
 * a number, are skipped.
 */
public final class CsvTraceReader extends AbstractTraceReader {
  private static final Splitter SPLITTER = Splitter.on(',').trimResults();
  private static final CharMatcher NUMERIC = CharMatcher.inRange('0', '9').or(CharMatcher.is('-'));

  public CsvTraceReader(String filePath) {
    super(filePath);
  }

  @Override
  @SuppressWarnings("PMD.CloseResource")
  public Stream<AccessEvent> events() {
    var reader = new BufferedReader(new InputStreamReader(readFile(), UTF_8));
    return reader.lines()
        .map(CharMatcher.whitespace()::trimFrom)
        .filter(line -> !line.isEmpty() && NUMERIC.matches(line.charAt(0)))
        .map(this::parse)
        .onClose(() -> Closeables.closeQuietly(reader));
  }

  private AccessEvent parse(String line) {
    List<String> columns = SPLITTER.splitToList(line);
    try {
      switch (columns.size()) {
        case 1:
          return AccessEvent.forKey(Long.parseLong(columns.get(0)));
        case 2:
          return new AccessEvent(Long.parseLong(columns.get(0)),
              Long.parseLong(columns.get(1)), 1, -1L);
        case 3:
          return new AccessEvent(Long.parseLong(columns.get(0)),
              Long.parseLong(columns.get(1)), Integer.parseInt(columns.get(2)), -1L);
        default:
          return new AccessEvent(Long.parseLong(columns.get(0)), Long.parseLong(columns.get(1)),
              Integer.parseInt(columns.get(2)), Long.parseLong(columns.get(3)));
      }
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("Malformed line in %s: %s", filePath, line), e);
    }
  }
}
