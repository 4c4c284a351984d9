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
package com.github.scanguard.simulator.report;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Locale.US;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.github.scanguard.simulator.SimulatorSettings;
import com.github.scanguard.simulator.policy.PolicyStats;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.typesafe.config.Config;

/**
 * A skeletal plain text implementation applicable for printing to the console or a file.
 */
public abstract class TextReporter implements Reporter {
  private static final ImmutableMap<String, Comparator<PolicyStats>> COLUMNS =
      ImmutableMap.<String, Comparator<PolicyStats>>builder()
          .put("Policy", Comparator.comparing(PolicyStats::name))
          .put("Hit Rate", Comparator.comparingDouble(PolicyStats::hitRate))
          .put("Hits", Comparator.comparingLong(PolicyStats::hitCount))
          .put("Misses", Comparator.comparingLong(PolicyStats::missCount))
          .put("Requests", Comparator.comparingLong(PolicyStats::requestCount))
          .put("Evictions", Comparator.comparingLong(PolicyStats::evictionCount))
          .put("Rejections", Comparator.comparingLong(PolicyStats::rejectionCount))
          .put("Time", Comparator.comparing(stats -> stats.stopwatch().elapsed()))
          .buildOrThrow();

  private final SimulatorSettings settings;

  protected TextReporter(Config config) {
    this.settings = new SimulatorSettings(config);
  }

  @Override
  public void print(List<PolicyStats> results) {
    var sorted = ImmutableList.sortedCopyOf(comparator(), results);
    try (var writer = makeWriter()) {
      writer.write(assemble(headers(), sorted));
      writer.flush();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Returns the column headers in display order. */
  protected static ImmutableList<String> headers() {
    return COLUMNS.keySet().asList();
  }

  /** Returns the cells of a row, in the order of the {@link #headers()}. */
  protected static ImmutableList<String> row(PolicyStats policyStats,
      Function<Double, String> percentFormatter, Function<Long, String> longFormatter,
      Function<Stopwatch, String> timeFormatter) {
    return ImmutableList.of(
        policyStats.name(),
        percentFormatter.apply(policyStats.hitRate()),
        longFormatter.apply(policyStats.hitCount()),
        longFormatter.apply(policyStats.missCount()),
        longFormatter.apply(policyStats.requestCount()),
        longFormatter.apply(policyStats.evictionCount()),
        longFormatter.apply(policyStats.rejectionCount()),
        timeFormatter.apply(policyStats.stopwatch()));
  }

  private Writer makeWriter() throws IOException {
    String output = settings.report().output();
    if (output.equalsIgnoreCase("console")) {
      return new PrintWriter(System.out, /* autoFlush= */ true, UTF_8) {
        @Override public void close() {
          flush();
        }
      };
    }
    var path = Path.of(output);
    var parent = path.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    return Files.newBufferedWriter(path, UTF_8);
  }

  /** Returns a comparator that sorts by the configured column. */
  private Comparator<PolicyStats> comparator() {
    String sortBy = settings.report().sortBy();
    Comparator<PolicyStats> comparator = COLUMNS.entrySet().stream()
        .filter(column -> column.getKey().toLowerCase(US).equals(sortBy.toLowerCase(US)))
        .map(Map.Entry::getValue)
        .findAny().orElseThrow(() -> new IllegalArgumentException(
            "Unknown sort order: " + sortBy));
    return settings.report().ascending() ? comparator : comparator.reversed();
  }

  /** Assembles an aggregated report. */
  protected abstract String assemble(List<String> headers, List<PolicyStats> results);
}
