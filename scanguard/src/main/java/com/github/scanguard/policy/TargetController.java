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

import java.math.RoundingMode;

import com.google.common.base.MoreObjects;
import com.google.common.math.IntMath;

/**
 * Maintains the adaptive target size {@code p} of the recency pool. A miss that is found in the
 * recency ghost means that the recency pool was too small, so the target grows; a miss found in
 * the frequency ghost shrinks it. The step is the ratio of the ghost sizes, as in ARC, but bounded
 * to damp oscillation. Once no ghost hit has been observed for longer than a capacity's worth of
 * accesses, every further access moves the target one step toward a baseline until the next ghost
 * hit, which recovers from the extremes that a scan can leave behind.
 */
final class TargetController {
  private final int scanStepCap;
  private final int capacity;
  private final int baseline;
  private final int stepCap;

  private long lastGhostHit;
  private int target;

  TargetController(int capacity, int baseline, int stepCap, int scanStepCap) {
    checkArgument(capacity >= 0, "capacity must be non-negative: %s", capacity);
    checkArgument((baseline >= 0) && (baseline <= capacity), "baseline out of range: %s", baseline);
    checkArgument((stepCap > 0) && (scanStepCap > 0), "step caps must be positive");
    this.scanStepCap = scanStepCap;
    this.capacity = capacity;
    this.baseline = baseline;
    this.stepCap = stepCap;
    this.target = baseline;
  }

  /** Returns the current target size of the recency pool. */
  int target() {
    return target;
  }

  int baseline() {
    return baseline;
  }

  /** Grows the target after a miss that was found in the recency ghost. */
  void onRecencyGhostHit(int recencyGhosts, int frequencyGhosts, boolean scanning, long now) {
    target = clamp(target + step(frequencyGhosts, recencyGhosts, scanning));
    lastGhostHit = now;
  }

  /** Shrinks the target after a miss that was found in the frequency ghost. */
  void onFrequencyGhostHit(int recencyGhosts, int frequencyGhosts, boolean scanning, long now) {
    target = clamp(target - step(recencyGhosts, frequencyGhosts, scanning));
    lastGhostHit = now;
  }

  /** Moves the target one step toward the baseline if the ghosts have been quiet for too long. */
  void decayIfIdle(long now) {
    if ((now - lastGhostHit) > capacity) {
      target = clamp(target + Integer.signum(baseline - target));
    }
  }

  private int step(int numerator, int denominator, boolean scanning) {
    int ratio = IntMath.divide(numerator, Math.max(1, denominator), RoundingMode.CEILING);
    return Math.min(scanning ? scanStepCap : stepCap, Math.max(1, ratio));
  }

  private int clamp(int value) {
    return Math.max(0, Math.min(capacity, value));
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("target", target)
        .add("baseline", baseline)
        .add("stepCap", stepCap)
        .add("lastGhostHit", lastGhostHit)
        .toString();
  }
}
