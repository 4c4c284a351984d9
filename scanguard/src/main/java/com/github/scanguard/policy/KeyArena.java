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
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

import org.jspecify.annotations.Nullable;

import com.google.common.base.MoreObjects;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * A preallocated slab of entries that are threaded onto a fixed number of access-ordered lists.
 * Each entry is addressed by an integer slot and linked through parallel {@code prev} and
 * {@code next} arrays, so that moving an entry to the tail of any list, or unlinking it, is a
 * constant time operation that does not allocate.
 * <p>
 * The first {@code lists} slots are sentinels of circular lists, where the sentinel's next entry is
 * the least recently used (the head) and its previous entry is the most recently used (the tail).
 * Each entry also carries an integer mark for its owner's bookkeeping, which starts at zero.
 * This class is not thread-safe.
 *
 * @param <K> the type of keys
 */
final class KeyArena<K> {
  static final int NIL = -1;

  final Object2IntOpenHashMap<K> index;
  final @Nullable Object[] keys;
  final long[] times;
  final int[] owner;
  final int[] marks;
  final int[] prev;
  final int[] next;
  final int[] sizes;
  final int[] free;
  final int capacity;
  final int lists;

  int freeCount;

  KeyArena(int lists, int capacity) {
    checkArgument(lists > 0, "lists must be positive: %s", lists);
    checkArgument(capacity >= 0, "capacity must be non-negative: %s", capacity);
    this.lists = lists;
    this.capacity = capacity;

    int slots = lists + capacity;
    this.keys = new Object[slots];
    this.times = new long[slots];
    this.owner = new int[slots];
    this.marks = new int[slots];
    this.prev = new int[slots];
    this.next = new int[slots];
    this.sizes = new int[lists];
    this.free = new int[capacity];
    this.index = new Object2IntOpenHashMap<>(capacity);
    index.defaultReturnValue(NIL);
    clear();
  }

  /** Returns the number of entries across all lists. */
  int size() {
    return index.size();
  }

  /** Returns the number of entries on the list. */
  int size(int list) {
    return sizes[list];
  }

  /** Returns if no more entries can be added. */
  boolean isFull() {
    return freeCount == 0;
  }

  /** Returns the list that the key is on, or {@link #NIL} if absent. */
  int listOf(K key) {
    int slot = index.getInt(key);
    return (slot == NIL) ? NIL : owner[slot];
  }

  /** Returns the time stamped on the key, or {@link #NIL} if absent. */
  long timeOf(K key) {
    int slot = index.getInt(key);
    return (slot == NIL) ? NIL : times[slot];
  }

  /** Returns the mark of the key, or zero if absent. */
  int markOf(K key) {
    int slot = index.getInt(key);
    return (slot == NIL) ? 0 : marks[slot];
  }

  /**
   * Sets the mark of the key.
   *
   * @return if the key was present
   */
  @CanIgnoreReturnValue
  boolean setMark(K key, int mark) {
    int slot = index.getInt(key);
    if (slot == NIL) {
      return false;
    }
    marks[slot] = mark;
    return true;
  }

  /** Returns the least recently used key of the list, or null if it is empty. */
  @Nullable K peekFirst(int list) {
    int head = next[list];
    return (head == list) ? null : keyAt(head);
  }

  /** Returns the time stamped on the least recently used key of the list. */
  long firstTime(int list) {
    int head = next[list];
    checkState(head != list, "list %s is empty", list);
    return times[head];
  }

  /** Adds the key as the most recently used entry of the list. */
  void addLast(K key, int list, long time) {
    int slot = allocate(key, list, time);
    linkLast(slot, list);
  }

  /** Adds the key as the least recently used entry of the list. */
  void addFirst(K key, int list, long time) {
    int slot = allocate(key, list, time);
    linkFirst(slot, list);
  }

  /**
   * Moves the key to the most recently used position of the list, which may differ from the one
   * it is currently on.
   *
   * @return if the key was present
   */
  @CanIgnoreReturnValue
  boolean moveToLast(K key, int list, long time) {
    int slot = index.getInt(key);
    if (slot == NIL) {
      return false;
    }
    unlink(slot);
    owner[slot] = list;
    times[slot] = time;
    linkLast(slot, list);
    return true;
  }

  /**
   * Removes the key.
   *
   * @return the list that the key was on, or {@link #NIL} if absent
   */
  @CanIgnoreReturnValue
  int remove(K key) {
    int slot = index.removeInt(key);
    if (slot == NIL) {
      return NIL;
    }
    int list = owner[slot];
    unlink(slot);
    keys[slot] = null;
    free[freeCount++] = slot;
    return list;
  }

  /** Returns up to {@code limit} keys from the least recently used end, without reordering. */
  List<K> oldest(int list, int limit) {
    var result = new ArrayList<K>(Math.min(limit, sizes[list]));
    for (int slot = next[list]; (slot != list) && (result.size() < limit); slot = next[slot]) {
      result.add(keyAt(slot));
    }
    return result;
  }

  /** Performs the action on each key of the list, from least to most recently used. */
  void forEach(int list, Consumer<? super K> action) {
    for (int slot = next[list]; slot != list; slot = next[slot]) {
      action.accept(keyAt(slot));
    }
  }

  /** Removes all of the entries. */
  void clear() {
    index.clear();
    Arrays.fill(keys, null);
    Arrays.fill(sizes, 0);
    for (int list = 0; list < lists; list++) {
      prev[list] = list;
      next[list] = list;
    }
    freeCount = capacity;
    for (int i = 0; i < capacity; i++) {
      free[i] = lists + capacity - i - 1;
    }
  }

  @SuppressWarnings("unchecked")
  private K keyAt(int slot) {
    return (K) requireNonNull(keys[slot]);
  }

  private int allocate(K key, int list, long time) {
    requireNonNull(key);
    checkState(freeCount > 0, "arena is full (capacity %s)", capacity);
    checkState(!index.containsKey(key), "duplicate key: %s", key);

    int slot = free[--freeCount];
    keys[slot] = key;
    times[slot] = time;
    owner[slot] = list;
    marks[slot] = 0;
    index.put(key, slot);
    return slot;
  }

  private void linkLast(int slot, int list) {
    int tail = prev[list];
    next[tail] = slot;
    prev[slot] = tail;
    next[slot] = list;
    prev[list] = slot;
    sizes[list]++;
  }

  private void linkFirst(int slot, int list) {
    int head = next[list];
    prev[head] = slot;
    next[slot] = head;
    prev[slot] = list;
    next[list] = slot;
    sizes[list]++;
  }

  private void unlink(int slot) {
    int before = prev[slot];
    int after = next[slot];
    next[before] = after;
    prev[after] = before;
    prev[slot] = next[slot] = NIL;
    sizes[owner[slot]]--;
  }

  @Override
  public String toString() {
    var helper = MoreObjects.toStringHelper(this).add("capacity", capacity);
    for (int list = 0; list < lists; list++) {
      helper.add("list" + list, sizes[list]);
    }
    return helper.toString();
  }
}
