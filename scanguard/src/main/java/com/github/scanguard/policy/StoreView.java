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
 * A read-only view of the key store that a {@link ReplacementPolicy} advises. The store owns the
 * values, enforces the capacity, and performs the physical insertions and removals; the view is
 * the authority on which keys are resident.
 *
 * @param <K> the type of keys maintained by the store
 */
public interface StoreView<K> {

  /** Returns the maximum number of entries that the store may hold. */
  int capacity();

  /** Returns the number of entries currently held by the store. */
  int size();

  /** Returns if the key is currently held by the store. */
  boolean contains(K key);

  /** Returns the keys currently held by the store, in no particular order. */
  Iterable<K> keys();
}
