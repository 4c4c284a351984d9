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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Locale.US;

import java.util.Random;
import java.util.stream.LongStream;

import com.github.scanguard.simulator.SimulatorSettings.SyntheticSettings;
import com.github.scanguard.simulator.SimulatorSettings.SyntheticSettings.HotSetSettings;
import com.github.scanguard.simulator.parser.TraceReader.KeyOnlyTraceReader;

import site.ycsb.generator.CounterGenerator;
import site.ycsb.generator.NumberGenerator;
import site.ycsb.generator.UniformLongGenerator;
import site.ycsb.generator.ZipfianGenerator;

/**
 * A generator of synthetic access patterns that exercise the recency, frequency, and scan
 * resistance of a policy.
 */
public final class Synthetic {

  private Synthetic() {}

  /** Returns a sequence of events based on the setting's distribution. */
  public static KeyOnlyTraceReader generate(SyntheticSettings settings, long seed) {
    int events = settings.events();
    switch (settings.distribution().toLowerCase(US)) {
      case "scan":
        long start = settings.scanStart();
        return () -> scan(start, events);
      case "loop":
        int items = settings.loopItems();
        return () -> loop(items, events);
      case "hot-set":
        HotSetSettings hotSet = settings.hotSet();
        return () -> hotSet(hotSet.items(), hotSet.fraction(), seed, events);
      case "zipfian":
        return () -> zipfian(settings.zipfian().items(), settings.zipfian().constant(), events);
      case "uniform":
        return () -> uniform(settings.uniform().lowerBound(),
            settings.uniform().upperBound(), events);
      default:
        throw new IllegalStateException("Unknown distribution: " + settings.distribution());
    }
  }

  /**
   * Returns a sequential scan of distinct keys, none of which is requested twice.
   *
   * @param start the first key of the scan
   * @param events the number of events in the distribution
   */
  public static LongStream scan(long start, int events) {
    return generate(new CounterGenerator(start), events);
  }

  /**
   * Returns the keys {@code [0, items)} requested in the same order repeatedly.
   *
   * @param items the number of distinct keys in the loop
   * @param events the number of events in the distribution
   */
  public static LongStream loop(int items, int events) {
    checkArgument(items > 0, "items must be positive: %s", items);
    return LongStream.range(0, events).map(i -> i % items);
  }

  /**
   * Returns a sequence where a fraction of the requests are chosen uniformly from a small hot set
   * of keys {@code [0, items)} and the remainder are cold keys that are never requested again.
   *
   * @param items the number of keys in the hot set
   * @param fraction the fraction of the events that request a hot key
   * @param seed the seed of the pseudo-random source, so that the sequence is repeatable
   * @param events the number of events in the distribution
   */
  public static LongStream hotSet(int items, double fraction, long seed, int events) {
    checkArgument(items > 0, "items must be positive: %s", items);
    checkArgument((fraction >= 0.0) && (fraction <= 1.0), "fraction must be in [0, 1]");
    var random = new Random(seed);
    var cold = new CounterGenerator(items);
    return LongStream.range(0, events).map(ignored -> (random.nextDouble() < fraction)
        ? random.nextInt(items)
        : cold.nextValue());
  }

  /**
   * Returns a sequence of events where some items are more popular than others, according to a
   * zipfian distribution.
   *
   * @param items the number of items in the distribution
   * @param constant the skew factor for the distribution
   * @param events the number of events in the distribution
   */
  public static LongStream zipfian(int items, double constant, int events) {
    return generate(new ZipfianGenerator(items, constant), events);
  }

  /**
   * Returns a sequence of events where items are selected uniformly randomly from the interval
   * inclusively.
   *
   * @param lowerBound lower bound of the distribution
   * @param upperBound upper bound of the distribution
   * @param events the number of events in the distribution
   */
  public static LongStream uniform(int lowerBound, int upperBound, int events) {
    return generate(new UniformLongGenerator(lowerBound, upperBound), events);
  }

  /** Returns a sequence of items constructed by the generator. */
  private static LongStream generate(NumberGenerator generator, long count) {
    return LongStream.range(0, count).map(ignored -> generator.nextValue().longValue());
  }
}
