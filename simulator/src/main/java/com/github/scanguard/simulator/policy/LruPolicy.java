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
package com.github.scanguard.simulator.policy;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.util.LinkedHashSet;

import com.github.scanguard.policy.ReplacementPolicy;
import com.github.scanguard.policy.StoreView;
import com.google.common.collect.Iterables;

/**
 * Least Recently Used eviction, the baseline that the adaptive policy is compared against.
 * <p>
 * The recency order is kept independently of the store, so the victim is the store's resident
 * key that was requested least recently. Keys that the store reports as absent are discarded
 * when they reach the head of the order.
 *
 * @param <K> the type of keys
 */
public final class LruPolicy<K> implements ReplacementPolicy<K> {
  private final LinkedHashSet<K> order;
  private final int capacity;

  public LruPolicy(int capacity) {
    checkArgument(capacity > 0, "capacity must be positive: %s", capacity);
    this.order = new LinkedHashSet<>();
    this.capacity = capacity;
  }

  @Override
  public K selectVictim(StoreView<K> store, K incoming) {
    checkState(store.size() > 0, "Cannot select a victim from an empty store");
    var iterator = order.iterator();
    while (iterator.hasNext()) {
      K key = iterator.next();
      if (store.contains(key)) {
        return key;
      }
      iterator.remove();
    }
    return Iterables.get(store.keys(), 0);
  }

  @Override
  public void onEvicted(StoreView<K> store, K victim) {
    order.remove(victim);
  }

  @Override
  public void onInserted(StoreView<K> store, K key) {
    order.remove(key);
    order.add(key);
  }

  @Override
  public void onHit(StoreView<K> store, K key) {
    order.remove(key);
    order.add(key);
  }

  /** Returns the capacity that the policy was created for. */
  public int capacity() {
    return capacity;
  }
}
