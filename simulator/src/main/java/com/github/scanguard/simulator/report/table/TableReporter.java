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
package com.github.scanguard.simulator.report.table;

import static java.util.Locale.US;

import java.util.List;

import com.github.scanguard.simulator.policy.PolicyStats;
import com.github.scanguard.simulator.report.TextReporter;
import com.jakewharton.fliptables.FlipTable;
import com.typesafe.config.Config;

/**
 * A plain text report that pretty-prints to a table.
 */
public final class TableReporter extends TextReporter {

  public TableReporter(Config config) {
    super(config);
  }

  @Override
  protected String assemble(List<String> headers, List<PolicyStats> results) {
    String[][] data = new String[results.size()][];
    for (int i = 0; i < results.size(); i++) {
      data[i] = row(results.get(i),
          value -> String.format(US, "%.2f %%", 100 * value),
          value -> String.format(US, "%,d", value),
          stopwatch -> stopwatch.toString()).toArray(String[]::new);
    }
    return FlipTable.of(headers.toArray(String[]::new), data);
  }
}
