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

import java.util.function.Consumer;

import org.jspecify.annotations.Nullable;

import com.google.common.base.MoreObjects;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * The non-resident history of recently evicted keys, split by the segment that each key was
 * evicted from. Only the key, its eviction time, and the strikes that it left with are retained.
 * <p>
 * The combined size is bounded. When full, the oldest ghost on the side opposite to the most
 * recent ghost hit is discarded, since the side that was just hit is the one proving useful;
 * without a recorded hit the oldest ghost overall is discarded.
 *
 * @param <K> the type of keys
 */
final class GhostHistory<K> {
  private static final Segment[] SEGMENTS = Segment.values();

  private final KeyArena<K> arena;
  private final int maximumSize;

  private @Nullable Segment lastHit;

  GhostHistory(int maximumSize) {
    checkArgument(maximumSize > 0, "maximumSize must be positive: %s", maximumSize);
    this.arena = new KeyArena<>(SEGMENTS.length, maximumSize);
    this.maximumSize = maximumSize;
  }

  /** Records or refreshes the key as the most recent ghost of its origin segment. */
  void record(K key, Segment origin, long now) {
    record(key, origin, 0, now);
  }

  /**
   * Records or refreshes the key as the most recent ghost of its origin segment.
   *
   * @param key the evicted key
   * @param origin the segment that the key was evicted from
   * @param strikes the consecutive stays that ended without a hit
   * @param now the current logical time
   */
  void record(K key, Segment origin, int strikes, long now) {
    if (arena.remove(key) == KeyArena.NIL) {
      while (arena.size() >= maximumSize) {
        trim();
      }
    }
    arena.addLast(key, origin.ordinal(), now);
    arena.setMark(key, strikes);
  }

  /** Returns the strikes that the ghost was evicted with, or zero if it is not a ghost. */
  int strikesOf(K key) {
    return arena.markOf(key);
  }

  /** Returns the segment the key was evicted from, or null if it is not a ghost. */
  @Nullable Segment originOf(K key) {
    int list = arena.listOf(key);
    return (list == KeyArena.NIL) ? null : SEGMENTS[list];
  }

  /**
   * Removes the key due to a miss that found it in the history.
   *
   * @return the segment the key was evicted from, or null if it was not a ghost
   */
  @CanIgnoreReturnValue
  @Nullable Segment consume(K key) {
    Segment origin = remove(key);
    if (origin != null) {
      lastHit = origin;
    }
    return origin;
  }

  /**
   * Removes the key, such as when it becomes resident by other means.
   *
   * @return the segment the key was evicted from, or null if it was not a ghost
   */
  @CanIgnoreReturnValue
  @Nullable Segment remove(K key) {
    int list = arena.remove(key);
    return (list == KeyArena.NIL) ? null : SEGMENTS[list];
  }

  int size(Segment origin) {
    return arena.size(origin.ordinal());
  }

  int size() {
    return arena.size();
  }

  int maximumSize() {
    return maximumSize;
  }

  void forEach(Segment origin, Consumer<? super K> action) {
    arena.forEach(origin.ordinal(), action);
  }

  /** Discards a single ghost. */
  private void trim() {
    if ((lastHit != null) && (size(lastHit.opposite()) > 0)) {
      discardOldest(lastHit.opposite());
    } else if (size(RECENCY) == 0) {
      discardOldest(FREQUENCY);
    } else if (size(FREQUENCY) == 0) {
      discardOldest(RECENCY);
    } else if (arena.firstTime(RECENCY.ordinal()) <= arena.firstTime(FREQUENCY.ordinal())) {
      discardOldest(RECENCY);
    } else {
      discardOldest(FREQUENCY);
    }
  }

  private void discardOldest(Segment origin) {
    K victim = arena.peekFirst(origin.ordinal());
    if (victim != null) {
      arena.remove(victim);
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("recency", size(RECENCY))
        .add("frequency", size(FREQUENCY))
        .add("maximumSize", maximumSize)
        .add("lastHit", lastHit)
        .toString();
  }
}
