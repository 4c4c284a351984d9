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

import static com.github.scanguard.policy.Segment.FREQUENCY;
import static com.github.scanguard.policy.Segment.RECENCY;

import java.util.Random;

import org.jspecify.annotations.Nullable;

import com.google.common.base.MoreObjects;

/**
 * Decides whether a missed key may replace the chosen victim and, once inserted, which pool it
 * starts in.
 * <p>
 * The admission filter follows TinyLFU: a cold candidate that would displace a member of the
 * frequency pool must be estimated as more popular than it. A small random chance admits a warm
 * candidate anyway, which keeps an attacker from pinning the pool with artificially hot victims.
 * Candidates recovered from the ghost history, and candidates that would only displace a member of
 * the recency pool, are always admitted.
 * <p>
 * Placement sends recovered ghosts to the frequency pool, lets a limited share of sketch-hot keys
 * bypass the recency pool, and places the cold keys that arrive during a scan at the eviction end
 * of the recency pool.
 *
 * @param <K> the type of keys
 */
final class AdmissionController<K> {
  private final ResidentSegments<K> segments;
  private final FrequencySketch<K> sketch;
  private final Random random;

  private final double jitterProbability;
  private final int hotBypassThreshold;
  private final int hotBypassLimit;
  private final int jitterThreshold;
  private final boolean enabled;
  private final int window;

  private int admissions;
  private int bypassed;
  private long rejections;

  AdmissionController(AdaptiveSettings settings, int capacity,
      ResidentSegments<K> segments, FrequencySketch<K> sketch, Random random) {
    this.hotBypassLimit = settings.hotBypassLimitFor(capacity);
    this.hotBypassThreshold = settings.hotBypassThreshold();
    this.jitterProbability = settings.jitterProbability();
    this.jitterThreshold = settings.jitterThreshold();
    this.enabled = settings.admissionEnabled();
    this.segments = segments;
    this.window = capacity;
    this.random = random;
    this.sketch = sketch;
  }

  /**
   * Returns if the candidate should replace the victim.
   *
   * @param candidate the key that missed
   * @param origin the ghost list that the candidate was found in, or null if it is cold
   * @param victim the resident key that would be evicted
   */
  boolean admit(K candidate, @Nullable Segment origin, K victim) {
    if (!enabled || (origin != null) || (segments.segmentOf(victim) != FREQUENCY)) {
      return true;
    }
    int candidateFreq = sketch.frequency(candidate);
    int victimFreq = sketch.frequency(victim);
    if (candidateFreq > victimFreq) {
      return true;
    } else if ((candidateFreq >= jitterThreshold) && (random.nextDouble() < jitterProbability)) {
      return true;
    }
    rejections++;
    return false;
  }

  /**
   * Tracks a newly inserted key in the appropriate pool.
   *
   * @param key the inserted key
   * @param origin the ghost list that the key was found in, or null if it is cold
   * @param guarded if a scan is in progress
   * @param now the current logical time
   */
  void place(K key, @Nullable Segment origin, boolean guarded, long now) {
    if (++admissions > window) {
      admissions = 1;
      bypassed = 0;
    }

    if (origin != null) {
      segments.insert(key, FREQUENCY, now);
    } else if ((bypassed < hotBypassLimit) && (sketch.frequency(key) >= hotBypassThreshold)) {
      segments.insert(key, FREQUENCY, now);
      bypassed++;
    } else if (guarded) {
      segments.insertAtLru(key, RECENCY, now);
    } else {
      segments.insert(key, RECENCY, now);
    }
  }

  /** Returns the number of candidates that the filter declined. */
  long rejections() {
    return rejections;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("enabled", enabled)
        .add("admissions", admissions)
        .add("bypassed", bypassed)
        .add("rejections", rejections)
        .toString();
  }
}
