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

import static java.util.Locale.US;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.Stack;

import org.jspecify.annotations.Nullable;

import com.google.common.base.Stopwatch;
import com.typesafe.config.ConfigFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help;
import picocli.CommandLine.IParameterPreprocessor;
import picocli.CommandLine.Model.ArgSpec;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;

/**
 * A command that replays a trace through the policies at one or more store sizes and prints a
 * report for each. An underscore may be used as a numeric separator and the default
 * configuration may be overridden by using system properties.
 * <p>
 * <pre>{@code
 *   java -cp simulator.jar com.github.scanguard.simulator.Simulate \
 *     --files=traces/web.csv,binary:traces/db.trace \
 *     --maximumSize=100,1_000,10_000
 * }</pre>
 */
@Command(mixinStandardHelpOptions = true)
public final class Simulate implements Runnable {
  @SuppressWarnings("MismatchedQueryAndUpdateOfCollection")
  @Option(names = "--maximumSize", split = ",", preprocessor = NumericPreprocessor.class,
      description = "The maximum sizes; derived from the trace's distinct keys if omitted")
  private @Nullable SortedSet<Integer> maximumSizes;
  @Option(names = "--policies", split = ",", description = "The policies to compare")
  private @Nullable List<String> policies;
  @Option(names = "--files", split = ",", description = "The trace files to replay")
  private @Nullable List<String> files;
  @Option(names = "--distribution", description = "The synthetic distribution to replay")
  private @Nullable String distribution;
  @Option(names = "--events", preprocessor = NumericPreprocessor.class,
      description = "The number of synthetic events")
  private @Nullable Integer events;
  @Option(names = "--shards", description = "The number of store partitions")
  private @Nullable Integer shards;
  @Option(names = "--format", description = "The report format: table or csv")
  private @Nullable String format;

  @Override
  public void run() {
    if ((maximumSizes == null) || maximumSizes.isEmpty()) {
      simulate(0);
      return;
    }
    for (int maximumSize : maximumSizes) {
      simulate(maximumSize);
    }
  }

  private void simulate(int maximumSize) {
    var stopwatch = Stopwatch.createStarted();
    var config = ConfigFactory.parseMap(overrides(maximumSize)).withFallback(ConfigFactory.load());
    new Simulator(config).run();
    System.out.printf(US, "Executed in %s%n", stopwatch);
  }

  /** Returns the configuration settings given on the command line. */
  Map<String, Object> overrides(int maximumSize) {
    var path = SimulatorSettings.PATH + ".";
    var overrides = new HashMap<String, Object>();
    overrides.put(path + "maximum-size", maximumSize);
    if (policies != null) {
      overrides.put(path + "policies", policies);
    }
    if (files != null) {
      overrides.put(path + "trace.source", "files");
      overrides.put(path + "files.paths", files);
    } else if (distribution != null) {
      overrides.put(path + "trace.source", "synthetic");
      overrides.put(path + "synthetic.distribution", distribution);
    }
    if (events != null) {
      overrides.put(path + "synthetic.events", events);
    }
    if (shards != null) {
      overrides.put(path + "shards", shards);
    }
    if (format != null) {
      overrides.put(path + "report.format", format);
    }
    return overrides;
  }

  public static void main(String[] args) {
    new CommandLine(Simulate.class)
        .setColorScheme(Help.defaultColorScheme(Help.Ansi.AUTO))
        .setCommandName(Simulate.class.getSimpleName())
        .setCaseInsensitiveEnumValuesAllowed(true)
        .execute(args);
  }

  private static final class NumericPreprocessor implements IParameterPreprocessor {
    @SuppressWarnings("PMD.ReplaceVectorWithList")
    @Override public boolean preprocess(Stack<String> args,
        CommandSpec commandSpec, ArgSpec argSpec, Map<String, Object> info) {
      if (!args.isEmpty()) {
        args.push(args.pop().replaceAll("(?<=\\d)_(?=\\d)", ""));
      }
      return false;
    }
  }
}
