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
package com.github.scanguard.simulator.report.csv;

import static java.util.Locale.US;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

import com.github.scanguard.simulator.policy.PolicyStats;
import com.github.scanguard.simulator.report.TextReporter;
import com.typesafe.config.Config;

import de.siegmar.fastcsv.writer.CsvWriter;

/**
 * A plain text report that prints comma-separated values.
 */
public final class CsvReporter extends TextReporter {

  public CsvReporter(Config config) {
    super(config);
  }

  @Override
  protected String assemble(List<String> headers, List<PolicyStats> results) {
    try (var output = new StringWriter();
         var writer = CsvWriter.builder().build(output)) {
      writer.writeRecord(headers);
      for (PolicyStats policyStats : results) {
        writer.writeRecord(row(policyStats,
            value -> String.format(US, "%.2f", 100 * value),
            value -> Long.toString(value),
            stopwatch -> Long.toString(stopwatch.elapsed(TimeUnit.MILLISECONDS))));
      }
      writer.flush();
      return output.toString();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
