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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.IOException;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;

import org.testng.annotations.Test;

import com.github.scanguard.simulator.SimulatorSettings;
import com.github.scanguard.simulator.policy.PolicyStats;
import com.typesafe.config.ConfigFactory;

public final class CsvReporterTest {

  @Test
  public void print_sortedDescending() throws IOException {
    var report = Files.createTempFile("report", ".csv");
    report.toFile().deleteOnExit();
    var config = ConfigFactory.parseMap(Map.of(
        "report.output", report.toString(),
        "report.sort-by", "Hits",
        "report.ascending", false))
        .withFallback(ConfigFactory.load().getConfig(SimulatorSettings.PATH));

    var lru = new PolicyStats("lru");
    lru.addHits(10);
    lru.addMisses(30);
    var adaptive = new PolicyStats("adaptive");
    adaptive.addHits(20);
    adaptive.addMisses(20);
    adaptive.addRejections(5);
    new CsvReporter(config).print(List.of(lru, adaptive));

    List<String> lines = Files.readAllLines(report, UTF_8);
    assertThat(lines).containsExactly(
        "Policy,Hit Rate,Hits,Misses,Requests,Evictions,Rejections,Time",
        "adaptive,50.00,20,20,40,0,5,0",
        "lru,25.00,10,30,40,0,0,0").inOrder();
  }
}
