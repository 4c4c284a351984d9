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
import static java.util.Objects.requireNonNull;

import com.google.common.base.MoreObjects;
import com.google.common.math.IntMath;
import com.google.errorprone.annotations.Var;

/**
 * A probabilistic multiset for estimating the popularity of a key within a time window. This is a
 * Count-Min sketch of depth 4 whose counters are 8 bits wide, so an estimate saturates at a
 * configured maximum of at most 255.
 * <p>
 * The counter matrix is a single array of longs holding 8 counters per slot. A key selects one
 * slot per row and, within the slot, one of two groups of four counters so that each row uses a
 * distinct counter. An increment is conservative: only the counters at the key's current minimum
 * are raised, which reduces the overestimation caused by collisions. Every {@code agePeriod}
 * increments all counters are halved by a single word-parallel shift, allowing stale popularity
 * to fade away.
 *
 * @param <K> the type of keys
 */
final class FrequencySketch<K> {
  static final long[] SEED = { // A mixture of seeds from FNV-1a, CityHash, and Murmur3
      0xc3a5c85c97cb3127L, 0xb492b66fbe98f273L, 0x9ae16a3b2f90404fL, 0xcbf29ce484222325L};
  static final long RESET_MASK = 0x7f7f7f7f7f7f7f7fL;
  static final int MINIMUM_LENGTH = 64;

  final int maximumCount;
  final int agePeriod;
  final int tableMask;
  final long[] table;

  int operations;
  int agings;

  FrequencySketch(int capacity, int maximumCount, int agePeriod) {
    checkArgument(capacity >= 0, "capacity must be non-negative: %s", capacity);
    checkArgument((maximumCount > 0) && (maximumCount <= 255),
        "maximumCount must be in [1, 255]: %s", maximumCount);
    checkArgument(agePeriod > 0, "agePeriod must be positive: %s", agePeriod);
    int length = IntMath.ceilingPowerOfTwo(Math.max(MINIMUM_LENGTH, capacity));
    this.table = new long[length];
    this.tableMask = length - 1;
    this.maximumCount = maximumCount;
    this.agePeriod = agePeriod;
  }

  /**
   * Returns the estimated number of occurrences of the key, up to the maximum count.
   *
   * @param key the key to count occurrences of
   * @return the estimated number of occurrences; possibly zero but never negative
   */
  int frequency(K key) {
    int hash = spread(requireNonNull(key).hashCode());
    int start = (hash & 1) << 2;
    @Var int frequency = Integer.MAX_VALUE;
    for (int i = 0; i < 4; i++) {
      frequency = Math.min(frequency, counterAt(indexOf(hash, i), start + i));
    }
    return frequency;
  }

  /** Increments the popularity of the key by one. */
  void increment(K key) {
    increment(key, 1);
  }

  /**
   * Increases the popularity of the key, raising only the counters that are below the key's new
   * minimum estimate. The popularity of all keys is halved periodically.
   *
   * @param key the key to add
   * @param weight the number of occurrences to add
   */
  void increment(K key, int weight) {
    checkArgument(weight >= 0, "weight must be non-negative: %s", weight);
    int hash = spread(requireNonNull(key).hashCode());
    int start = (hash & 1) << 2;

    int index0 = indexOf(hash, 0);
    int index1 = indexOf(hash, 1);
    int index2 = indexOf(hash, 2);
    int index3 = indexOf(hash, 3);
    int count0 = counterAt(index0, start);
    int count1 = counterAt(index1, start + 1);
    int count2 = counterAt(index2, start + 2);
    int count3 = counterAt(index3, start + 3);

    int min = Math.min(Math.min(count0, count1), Math.min(count2, count3));
    int target = Math.min(maximumCount, min + weight);
    raise(index0, start, count0, target);
    raise(index1, start + 1, count1, target);
    raise(index2, start + 2, count2, target);
    raise(index3, start + 3, count3, target);

    if (++operations >= agePeriod) {
      age();
    }
  }

  /** Reduces every counter by half of its value, rounding down. */
  void age() {
    for (int i = 0; i < table.length; i++) {
      table[i] = (table[i] >>> 1) & RESET_MASK;
    }
    operations = 0;
    agings++;
  }

  /** Returns the number of increments since the last aging. */
  int operations() {
    return operations;
  }

  /** Returns the number of times that the counters were halved. */
  int agings() {
    return agings;
  }

  private void raise(int i, int j, int count, int target) {
    if (count < target) {
      setCounterAt(i, j, target);
    }
  }

  private int counterAt(int i, int j) {
    return (int) ((table[i] >>> (j << 3)) & 0xffL);
  }

  private void setCounterAt(int i, int j, int value) {
    int offset = j << 3;
    long mask = (0xffL << offset);
    table[i] = (table[i] & ~mask) | ((long) value << offset);
  }

  /**
   * Returns the table index for the counter at the specified depth.
   *
   * @param item the key's hash
   * @param i the counter depth
   * @return the table index
   */
  int indexOf(int item, int i) {
    @Var long hash = (item + SEED[i]) * SEED[i];
    hash += (hash >>> 32);
    return ((int) hash) & tableMask;
  }

  /**
   * Applies a supplemental hash function to a given hashCode, which defends against poor quality
   * hash functions.
   */
  static int spread(@Var int x) {
    x = ((x >>> 16) ^ x) * 0x45d9f3b;
    x = ((x >>> 16) ^ x) * 0x45d9f3b;
    return (x >>> 16) ^ x;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("width", table.length)
        .add("maximumCount", maximumCount)
        .add("agePeriod", agePeriod)
        .add("operations", operations)
        .toString();
  }
}
