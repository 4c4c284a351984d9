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

import java.util.List;
import java.util.function.Consumer;

import org.jspecify.annotations.Nullable;

import com.google.common.base.MoreObjects;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * The resident keys, partitioned into a recency pool and a frequency pool that are each kept in
 * least-recently-used order. Every mutation stamps the key with the caller's logical time.
 * <p>
 * A key also carries its strikes, the number of consecutive stays in the cache, including the
 * current one, during which it was never hit. A hit clears them.
 *
 * @param <K> the type of keys
 */
final class ResidentSegments<K> {
  private static final Segment[] SEGMENTS = Segment.values();

  private final KeyArena<K> arena;

  ResidentSegments(int capacity) {
    this.arena = new KeyArena<>(SEGMENTS.length, capacity);
  }

  /** Returns the segment holding the key, or null if it is not tracked. */
  @Nullable Segment segmentOf(K key) {
    int list = arena.listOf(key);
    return (list == KeyArena.NIL) ? null : SEGMENTS[list];
  }

  boolean contains(K key) {
    return arena.listOf(key) != KeyArena.NIL;
  }

  /** Adds the key at the most recently used end of the segment. */
  void insert(K key, Segment segment, long now) {
    arena.addLast(key, segment.ordinal(), now);
  }

  /**
   * Adds the key at the least recently used end of the segment, so that it is the next candidate
   * for eviction. The key is stamped no later than the current head so that the timestamp order
   * agrees with the list order.
   */
  void insertAtLru(K key, Segment segment, long now) {
    long time = (arena.size(segment.ordinal()) == 0)
        ? now
        : Math.min(now, arena.firstTime(segment.ordinal()));
    arena.addFirst(key, segment.ordinal(), time);
  }

  /**
   * Moves the key to the most recently used end of the frequency pool.
   *
   * @return if the key was tracked
   */
  @CanIgnoreReturnValue
  boolean promote(K key, long now) {
    return arena.moveToLast(key, FREQUENCY.ordinal(), now);
  }

  /**
   * Moves the key to the most recently used end of its current segment.
   *
   * @return if the key was tracked
   */
  @CanIgnoreReturnValue
  boolean touch(K key, long now) {
    int list = arena.listOf(key);
    return (list != KeyArena.NIL) && arena.moveToLast(key, list, now);
  }

  /**
   * Removes the key.
   *
   * @return the segment it was evicted from, or null if it was not tracked
   */
  @CanIgnoreReturnValue
  @Nullable Segment remove(K key) {
    int list = arena.remove(key);
    return (list == KeyArena.NIL) ? null : SEGMENTS[list];
  }

  /** Returns up to {@code limit} of the least recently used keys of the segment. */
  List<K> oldest(Segment segment, int limit) {
    return arena.oldest(segment.ordinal(), limit);
  }

  /** Returns the least recently used key of the segment, or null if it is empty. */
  @Nullable K first(Segment segment) {
    return arena.peekFirst(segment.ordinal());
  }

  /** Returns the strikes of the key, or zero if it is not tracked. */
  int strikes(K key) {
    return arena.markOf(key);
  }

  void setStrikes(K key, int strikes) {
    arena.setMark(key, strikes);
  }

  /** Returns the last access time of the key, or {@code -1} if not tracked. */
  long lastAccess(K key) {
    return arena.timeOf(key);
  }

  /** Returns the least recently used key across both segments, or null if both are empty. */
  @Nullable K oldestOverall() {
    K recency = first(RECENCY);
    K frequency = first(FREQUENCY);
    if (recency == null) {
      return frequency;
    } else if (frequency == null) {
      return recency;
    }
    return (lastAccess(recency) <= lastAccess(frequency)) ? recency : frequency;
  }

  int size(Segment segment) {
    return arena.size(segment.ordinal());
  }

  int size() {
    return arena.size();
  }

  boolean isFull() {
    return arena.isFull();
  }

  /** Performs the action on each key of the segment, from least to most recently used. */
  void forEach(Segment segment, Consumer<? super K> action) {
    arena.forEach(segment.ordinal(), action);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("recency", size(RECENCY))
        .add("frequency", size(FREQUENCY))
        .toString();
  }
}
