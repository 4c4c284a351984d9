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
package com.github.scanguard.simulator;

import static com.google.common.truth.Truth.assertThat;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import org.testng.annotations.Test;

import picocli.CommandLine;

public final class SimulateTest {

  @Test
  public void parse_numericSeparators() {
    var result = new CommandLine(new Simulate()).parseArgs("--maximumSize", "1_000,500");
    SortedSet<Integer> maximumSizes = result.matchedOptionValue("--maximumSize", new TreeSet<>());
    assertThat(maximumSizes).containsExactly(500, 1_000).inOrder();
  }

  @Test
  public void overrides_files() {
    var simulate = new Simulate();
    new CommandLine(simulate).parseArgs("--files", "web_1.csv,binary:db_2.bin",
        "--policies", "lru", "--shards", "4", "--format", "csv");

    var overrides = simulate.overrides(1_000);
    assertThat(overrides).containsEntry("scanguard.simulator.maximum-size", 1_000);
    assertThat(overrides).containsEntry("scanguard.simulator.trace.source", "files");
    assertThat(overrides).containsEntry("scanguard.simulator.files.paths",
        List.of("web_1.csv", "binary:db_2.bin"));
    assertThat(overrides).containsEntry("scanguard.simulator.policies", List.of("lru"));
    assertThat(overrides).containsEntry("scanguard.simulator.shards", 4);
    assertThat(overrides).containsEntry("scanguard.simulator.report.format", "csv");
  }

  @Test
  public void overrides_synthetic() {
    var simulate = new Simulate();
    new CommandLine(simulate).parseArgs("--distribution", "scan", "--events", "10_000");

    var overrides = simulate.overrides(0);
    assertThat(overrides).containsEntry("scanguard.simulator.trace.source", "synthetic");
    assertThat(overrides).containsEntry("scanguard.simulator.synthetic.distribution", "scan");
    assertThat(overrides).containsEntry("scanguard.simulator.synthetic.events", 10_000);
    assertThat(overrides).doesNotContainKey("scanguard.simulator.policies");
  }
}
