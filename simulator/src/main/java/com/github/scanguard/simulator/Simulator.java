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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Locale.US;

import java.util.function.IntFunction;
import java.util.stream.Stream;

import com.github.scanguard.policy.ReplacementPolicy;
import com.github.scanguard.simulator.parser.AccessEvent;
import com.github.scanguard.simulator.parser.TraceFormat;
import com.github.scanguard.simulator.parser.TraceReader;
import com.github.scanguard.simulator.policy.PolicyStats;
import com.github.scanguard.simulator.policy.Registry;
import com.github.scanguard.simulator.store.BoundedStore;
import com.github.scanguard.simulator.store.ShardedStore;
import com.github.scanguard.simulator.store.Store;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import it.unimi.dsi.fastutil.longs.LongOpenHashSet;

/**
 * A simulator that replays an access trace through each configured policy and generates an
 * aggregated report. See <tt>reference.conf</tt> for details on the configuration.
 * <p>
 * Each policy decides the victims of its own store, which holds up to the configured number of
 * keys. When no size is configured the store holds a tenth of the trace's distinct keys, so that
 * the comparison is made at a size where the policies' choices matter.
 */
public final class Simulator {
  private final SimulatorSettings settings;
  private final Registry registry;
  private final Config config;

  public Simulator(Config config) {
    this.settings = SimulatorSettings.of(config);
    this.registry = new Registry(config);
    this.config = config;
  }

  /** Replays the trace through the policies and prints the report. */
  public void run() {
    var results = simulate();
    if (results.isEmpty()) {
      System.err.println("No active policies in the current configuration");
      return;
    }
    var reporter = settings.report().format().create(config.getConfig(SimulatorSettings.PATH));
    reporter.print(results);
  }

  /** Replays the trace through each policy, returning their statistics in configured order. */
  public ImmutableList<PolicyStats> simulate() {
    var trace = getTraceReader();
    int maximumSize = (settings.maximumSize() > 0)
        ? settings.maximumSize()
        : defaultMaximumSize(trace);
    return settings.policies().stream()
        .map(name -> replay(trace, name, registry.factory(name), maximumSize))
        .collect(toImmutableList());
  }

  private PolicyStats replay(TraceReader trace, String name,
      IntFunction<ReplacementPolicy<Long>> factory, int maximumSize) {
    var policyStats = new PolicyStats("%s (%,d)", name, maximumSize);
    Store<Long> store = (settings.shards() == 1)
        ? new BoundedStore<>(maximumSize, factory.apply(maximumSize))
        : new ShardedStore<>(maximumSize, settings.shards(), factory);

    policyStats.stopwatch().start();
    try (Stream<AccessEvent> events = events(trace)) {
      events.forEach(event -> store.get(event.key()));
    }
    policyStats.stopwatch().stop();

    policyStats.addHits(store.hitCount());
    policyStats.addMisses(store.missCount());
    policyStats.addEvictions(store.evictionCount());
    policyStats.addRejections(store.rejectionCount());
    return policyStats;
  }

  /** Returns a tenth of the number of distinct keys in the trace, and at least one. */
  int defaultMaximumSize(TraceReader trace) {
    var keys = new LongOpenHashSet();
    try (Stream<AccessEvent> events = events(trace)) {
      events.forEach(event -> keys.add(event.key()));
    }
    return Math.max(1, keys.size() / 10);
  }

  private Stream<AccessEvent> events(TraceReader trace) {
    return trace.events().skip(settings.trace().skip()).limit(settings.trace().limit());
  }

  /** Returns a trace reader for the access events. */
  private TraceReader getTraceReader() {
    if (settings.trace().isSynthetic()) {
      return Synthetic.generate(settings.trace().synthetic(), settings.randomSeed());
    }
    return TraceFormat.readFiles(settings.trace().traceFiles().paths());
  }

  public static void main(String[] args) {
    var stopwatch = Stopwatch.createStarted();
    new Simulator(ConfigFactory.load()).run();
    System.out.printf(US, "Executed in %s%n", stopwatch);
  }
}
