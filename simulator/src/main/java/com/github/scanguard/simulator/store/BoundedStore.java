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
package com.github.scanguard.simulator.store;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import com.github.scanguard.policy.ReplacementPolicy;
import com.github.scanguard.policy.StoreView;
import com.google.common.base.MoreObjects;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * A store that holds up to a fixed number of keys and delegates the choice of which key to discard
 * to a {@link ReplacementPolicy}. A miss on a full store asks the policy for a victim, asks it to
 * admit the incoming key, and then either evicts the victim and inserts the key or discards the
 * key. Every policy hook observes the store's contents as they are at the time of the call.
 * <p>
 * This class is not thread-safe.
 *
 * @param <K> the type of keys
 */
public final class BoundedStore<K> implements Store<K>, StoreView<K> {
  private final ReplacementPolicy<K> policy;
  private final Set<K> keys;
  private final int capacity;

  private long hitCount;
  private long missCount;
  private long evictionCount;
  private long rejectionCount;

  public BoundedStore(int capacity, ReplacementPolicy<K> policy) {
    checkArgument(capacity > 0, "capacity must be positive: %s", capacity);
    this.policy = requireNonNull(policy);
    this.keys = new LinkedHashSet<>();
    this.capacity = capacity;
  }

  @Override
  @CanIgnoreReturnValue
  public boolean get(K key) {
    requireNonNull(key);
    if (keys.contains(key)) {
      hitCount++;
      policy.onHit(this, key);
      return true;
    }

    missCount++;
    if (keys.size() >= capacity) {
      K victim = policy.selectVictim(this, key);
      checkState(keys.contains(victim), "The policy chose the non-resident victim %s", victim);
      if (!policy.admit(this, key, victim)) {
        rejectionCount++;
        policy.onRejected(this, key);
        return false;
      }
      keys.remove(victim);
      evictionCount++;
      policy.onEvicted(this, victim);
    }
    keys.add(key);
    policy.onInserted(this, key);
    return false;
  }

  /** Returns the replacement policy that chooses the victims. */
  public ReplacementPolicy<K> policy() {
    return policy;
  }

  @Override
  public int capacity() {
    return capacity;
  }

  @Override
  public int size() {
    return keys.size();
  }

  @Override
  public boolean contains(K key) {
    return keys.contains(key);
  }

  @Override
  public Iterable<K> keys() {
    return Collections.unmodifiableSet(keys);
  }

  @Override
  public long hitCount() {
    return hitCount;
  }

  @Override
  public long missCount() {
    return missCount;
  }

  @Override
  public long evictionCount() {
    return evictionCount;
  }

  @Override
  public long rejectionCount() {
    return rejectionCount;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("capacity", capacity)
        .add("size", keys.size())
        .add("hits", hitCount)
        .add("misses", missCount)
        .toString();
  }
}
