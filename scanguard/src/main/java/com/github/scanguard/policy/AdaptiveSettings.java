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
package com.github.scanguard.policy;

import static com.google.common.base.Preconditions.checkArgument;

import com.github.scanguard.BasicSettings;
import com.typesafe.config.Config;

/**
 * The tuning parameters of the {@link AdaptiveReplacementPolicy}. Most values are expressed
 * relative to the capacity so that a single configuration applies to caches of any size; the
 * {@code *For(capacity)} accessors resolve them.
 */
public final class AdaptiveSettings extends BasicSettings {
  public static final String PATH = "scanguard.policy";

  public AdaptiveSettings(Config config) {
    super(config);
  }

  /** Returns the settings from the application's configuration. */
  public static AdaptiveSettings load() {
    return new AdaptiveSettings(BasicSettings.load(PATH));
  }

  public int ghostMultiplier() {
    int multiplier = config().getInt("ghost-multiplier");
    checkArgument((multiplier == 1) || (multiplier == 2),
        "ghost-multiplier must be 1 or 2: %s", multiplier);
    return multiplier;
  }

  public int ghostBoundFor(int capacity) {
    return Math.max(1, ghostMultiplier() * capacity);
  }

  public int strikeLimit() {
    int limit = config().getInt("strike-limit");
    checkArgument(limit > 0, "strike-limit must be positive: %s", limit);
    return limit;
  }

  public int sampleSizeFor(int capacity) {
    int minimum = config().getInt("sample.minimum");
    int maximum = config().getInt("sample.maximum");
    checkArgument((minimum > 0) && (minimum <= maximum),
        "invalid sample bounds: [%s, %s]", minimum, maximum);
    int size = config().getInt("sample.size");
    if (size > 0) {
      return size;
    }
    return Math.max(minimum, Math.min(maximum, capacity / 8));
  }

  public int baselineFor(int capacity) {
    return fractionOf("target.baseline", capacity, 0);
  }

  public int stepCapFor(int capacity) {
    return fractionOf("target.step-cap", capacity, 1);
  }

  public int scanStepCapFor(int capacity) {
    return fractionOf("target.scan-step-cap", capacity, 1);
  }

  public int scanThresholdFor(int capacity) {
    return fractionOf("scan.threshold", capacity, 0);
  }

  public int guardWindowFor(int capacity) {
    return fractionOf("scan.guard-window", capacity, 1);
  }

  public int targetReductionFor(int capacity) {
    return fractionOf("scan.target-reduction", capacity, 0);
  }

  public int maximumCount() {
    int maximum = config().getInt("sketch.maximum-count");
    checkArgument((maximum > 0) && (maximum <= 255),
        "sketch.maximum-count must be in [1, 255]: %s", maximum);
    return maximum;
  }

  public int agePeriodFor(int capacity) {
    long period = (long) config().getInt("sketch.age-period-multiplier") * capacity;
    return (int) Math.max(1, Math.min(period, Integer.MAX_VALUE));
  }

  public boolean admissionEnabled() {
    return config().getBoolean("admission.enabled");
  }

  public int jitterThreshold() {
    return config().getInt("admission.jitter.threshold");
  }

  public double jitterProbability() {
    return config().getDouble("admission.jitter.probability");
  }

  public int hotBypassThreshold() {
    return config().getInt("admission.hot-bypass.threshold");
  }

  public int hotBypassLimitFor(int capacity) {
    return fractionOf("admission.hot-bypass.fraction", capacity, 0);
  }

  private int fractionOf(String path, int capacity, int minimum) {
    double fraction = config().getDouble(path);
    checkArgument((fraction >= 0.0) && (fraction <= 1.0),
        "%s must be in [0, 1]: %s", path, fraction);
    return Math.max(minimum, (int) (fraction * capacity));
  }
}
