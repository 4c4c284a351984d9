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

import com.google.common.base.MoreObjects;

/**
 * Detects a scan as a streak of consecutive cold misses, being misses on keys that are neither
 * resident nor remembered by the ghost history. Once the streak exceeds the threshold the detector
 * is guarded until a deadline that each further cold miss pushes back. Any reuse, whether a hit or
 * a ghost hit, ends the streak immediately.
 * <p>
 * While guarded, new arrivals are placed where they will be evicted first and the effective
 * recency target is lowered, so that the one-time keys of a scan churn through the recency pool
 * instead of displacing the frequency pool.
 */
final class ScanDetector {

  /** The detector's states. */
  enum State { NORMAL, GUARDED }

  private final int targetReduction;
  private final int guardWindow;
  private final int threshold;

  private State state;
  private long deadline;
  private int coldStreak;

  ScanDetector(int threshold, int guardWindow, int targetReduction) {
    checkArgument(threshold >= 0, "threshold must be non-negative: %s", threshold);
    checkArgument(guardWindow > 0, "guardWindow must be positive: %s", guardWindow);
    checkArgument(targetReduction >= 0, "targetReduction must be non-negative: %s",
        targetReduction);
    this.targetReduction = targetReduction;
    this.guardWindow = guardWindow;
    this.threshold = threshold;
    this.state = State.NORMAL;
  }

  /** Records a miss on a key that is absent from both the resident set and the ghosts. */
  void onColdMiss(long now) {
    coldStreak++;
    if (coldStreak > threshold) {
      state = State.GUARDED;
      deadline = now + guardWindow;
    }
  }

  /** Records a hit or a ghost hit, which cancels any guard. */
  void onReuse() {
    coldStreak = 0;
    state = State.NORMAL;
    deadline = 0;
  }

  /** Returns if the guard is in effect, lapsing it if the deadline has passed. */
  boolean isGuarded(long now) {
    if ((state == State.GUARDED) && (now >= deadline)) {
      state = State.NORMAL;
    }
    return (state == State.GUARDED);
  }

  /** Returns the recency target to evict by, lowered by a bounded amount while guarded. */
  int effectiveTarget(int target, long now) {
    return isGuarded(now) ? (target - Math.min(target, targetReduction)) : target;
  }

  State state(long now) {
    isGuarded(now);
    return state;
  }

  int coldStreak() {
    return coldStreak;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("state", state)
        .add("coldStreak", coldStreak)
        .add("deadline", deadline)
        .toString();
  }
}
