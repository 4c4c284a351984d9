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
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import org.jspecify.annotations.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.collect.Iterables;
import com.google.errorprone.annotations.Var;

/**
 * Chooses the victim on a capacity miss. The pool to evict from is decided by comparing the
 * recency pool against the adaptive target; within that pool a small sample of the least recently
 * used keys is scored by the frequency sketch and the least frequent is chosen, with the older key
 * winning a tie.
 * <p>
 * Tracked keys that the store no longer holds are discarded as they are encountered, so a victim
 * is always resident. When neither pool yields a candidate, the oldest tracked key and finally any
 * key of the store are used.
 *
 * @param <K> the type of keys
 */
final class VictimSelector<K> {
  private final ResidentSegments<K> segments;
  private final FrequencySketch<K> sketch;
  private final int sampleSize;

  private int staleDiscards;

  VictimSelector(ResidentSegments<K> segments, FrequencySketch<K> sketch, int sampleSize) {
    checkArgument(sampleSize > 0, "sampleSize must be positive: %s", sampleSize);
    this.segments = segments;
    this.sampleSize = sampleSize;
    this.sketch = sketch;
  }

  /**
   * Returns the key to evict.
   *
   * @param store the store's contents
   * @param origin the ghost list that the incoming key was found in, or null if it is cold
   * @param target the recency target to evict by
   */
  K select(StoreView<K> store, @Nullable Segment origin, int target) {
    Segment pool = poolFor(origin, target);
    @Var K victim = sample(store, pool);
    if (victim == null) {
      victim = sample(store, pool.opposite());
    }
    if (victim == null) {
      victim = oldestResident(store);
    }
    if (victim == null) {
      victim = Iterables.getFirst(store.keys(), null);
    }
    checkState(victim != null, "No victim found in a store of size %s", store.size());
    return victim;
  }

  /** Returns the pool that should shrink. */
  Segment poolFor(@Nullable Segment origin, int target) {
    int recency = segments.size(RECENCY);
    if (segments.size(FREQUENCY) == 0) {
      return RECENCY;
    } else if (recency == 0) {
      return FREQUENCY;
    } else if (recency > target) {
      return RECENCY;
    }
    return ((origin == FREQUENCY) && (recency == target)) ? RECENCY : FREQUENCY;
  }

  /** Returns the least frequent of the oldest keys in the pool, or null if it has none. */
  private @Nullable K sample(StoreView<K> store, Segment pool) {
    @Var K victim = null;
    @Var int victimFreq = Integer.MAX_VALUE;
    @Var long victimTime = Long.MAX_VALUE;
    for (K candidate : segments.oldest(pool, sampleSize)) {
      if (!store.contains(candidate)) {
        discard(candidate);
        continue;
      }
      int freq = sketch.frequency(candidate);
      long time = segments.lastAccess(candidate);
      if ((freq < victimFreq) || ((freq == victimFreq) && (time < victimTime))) {
        victim = candidate;
        victimFreq = freq;
        victimTime = time;
      }
    }
    return victim;
  }

  private @Nullable K oldestResident(StoreView<K> store) {
    for (;;) {
      K candidate = segments.oldestOverall();
      if ((candidate == null) || store.contains(candidate)) {
        return candidate;
      }
      discard(candidate);
    }
  }

  private void discard(K key) {
    segments.remove(key);
    staleDiscards++;
  }

  /** Returns the number of tracked keys that were found to be absent from the store. */
  int staleDiscards() {
    return staleDiscards;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("sampleSize", sampleSize)
        .add("staleDiscards", staleDiscards)
        .toString();
  }
}
