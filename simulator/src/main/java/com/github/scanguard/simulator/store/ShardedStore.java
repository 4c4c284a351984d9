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
import static java.util.Objects.requireNonNull;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.IntFunction;
import java.util.function.ToLongFunction;

import com.github.scanguard.policy.ReplacementPolicy;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Var;

/**
 * A store that partitions its keys across independent {@link BoundedStore} shards, each with its
 * own replacement policy and guarded by its own lock. A key is always routed to the same shard, so
 * the shards' policies never share state and requests to different shards proceed concurrently.
 *
 * @param <K> the type of keys
 */
public final class ShardedStore<K> implements Store<K> {
  private final ImmutableList<Shard<K>> shards;
  private final int capacity;

  /**
   * Creates a store whose capacity is divided as evenly as possible among the shards.
   *
   * @param capacity the total number of keys that may be resident
   * @param shardCount the number of partitions
   * @param policyFactory creates a policy for a shard of the given capacity
   */
  public ShardedStore(int capacity, int shardCount,
      IntFunction<? extends ReplacementPolicy<K>> policyFactory) {
    checkArgument(shardCount > 0, "shard count must be positive: %s", shardCount);
    checkArgument(capacity >= shardCount,
        "capacity %s is less than the shard count %s", capacity, shardCount);
    requireNonNull(policyFactory);

    var builder = ImmutableList.<Shard<K>>builderWithExpectedSize(shardCount);
    for (int i = 0; i < shardCount; i++) {
      int shardCapacity = (capacity / shardCount) + ((i < (capacity % shardCount)) ? 1 : 0);
      var policy = requireNonNull(policyFactory.apply(shardCapacity));
      builder.add(new Shard<>(new BoundedStore<>(shardCapacity, policy)));
    }
    this.shards = builder.build();
    this.capacity = capacity;
  }

  @Override
  public boolean get(K key) {
    Shard<K> shard = shardFor(key);
    shard.lock.lock();
    try {
      return shard.store.get(key);
    } finally {
      shard.lock.unlock();
    }
  }

  /** Returns the number of partitions. */
  public int shardCount() {
    return shards.size();
  }

  /** Returns the index of the shard that the key is routed to. */
  int shardIndex(K key) {
    int hash = key.hashCode();
    return Math.floorMod(hash ^ (hash >>> 16), shards.size());
  }

  private Shard<K> shardFor(K key) {
    return shards.get(shardIndex(requireNonNull(key)));
  }

  @Override
  public int capacity() {
    return capacity;
  }

  @Override
  public int size() {
    return (int) sum(BoundedStore::size);
  }

  @Override
  public long hitCount() {
    return sum(BoundedStore::hitCount);
  }

  @Override
  public long missCount() {
    return sum(BoundedStore::missCount);
  }

  @Override
  public long evictionCount() {
    return sum(BoundedStore::evictionCount);
  }

  @Override
  public long rejectionCount() {
    return sum(BoundedStore::rejectionCount);
  }

  private long sum(ToLongFunction<BoundedStore<K>> counter) {
    @Var long total = 0L;
    for (Shard<K> shard : shards) {
      shard.lock.lock();
      try {
        total += counter.applyAsLong(shard.store);
      } finally {
        shard.lock.unlock();
      }
    }
    return total;
  }

  private static final class Shard<K> {
    final ReentrantLock lock;
    final BoundedStore<K> store;

    Shard(BoundedStore<K> store) {
      this.lock = new ReentrantLock();
      this.store = store;
    }
  }
}
