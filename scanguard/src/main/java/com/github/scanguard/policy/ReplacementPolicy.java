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

/**
 * The hooks that a bounded key store invokes so that a replacement policy can choose which
 * resident key to evict. All hooks run on the calling thread, and an implementation is not
 * required to be thread-safe, so a concurrent store must serialize them per policy instance.
 * <p>
 * For a miss on a full store the calls are ordered as
 * {@code selectVictim → admit → (store removes the victim) → onEvicted → (store inserts the key)
 * → onInserted}. If {@link #admit} declines the candidate then the store leaves its contents
 * unchanged and calls {@link #onRejected} instead. A miss on a store that has room is reported
 * only by {@link #onInserted}, and a hit only by {@link #onHit}.
 *
 * @param <K> the type of keys maintained by the store
 */
public interface ReplacementPolicy<K> {

  /**
   * Returns the resident key that should be removed to make room for the incoming key. This is
   * called exactly once per miss while the store is full and before the store is modified.
   *
   * @param store the store's current contents
   * @param incoming the key of the entry that missed
   * @return a key that is currently resident in the store
   * @throws IllegalStateException if the store is empty or has room for the incoming key
   */
  K selectVictim(StoreView<K> store, K incoming);

  /**
   * Returns if the incoming key should replace the victim. When declined the store keeps the
   * victim, discards the incoming entry, and calls {@link #onRejected}.
   *
   * @param store the store's current contents
   * @param incoming the key of the entry that missed
   * @param victim the key returned by {@link #selectVictim}
   * @return if the victim should be evicted and the incoming entry inserted
   */
  default boolean admit(StoreView<K> store, K incoming, K victim) {
    return true;
  }

  /** Called immediately after the store has removed the victim and before the insertion. */
  void onEvicted(StoreView<K> store, K victim);

  /** Called immediately after the store has inserted the key. */
  void onInserted(StoreView<K> store, K key);

  /** Called when the store discarded the incoming key because {@link #admit} declined it. */
  default void onRejected(StoreView<K> store, K key) {}

  /** Called on every hit, before the value is returned to the caller. */
  void onHit(StoreView<K> store, K key);
}
