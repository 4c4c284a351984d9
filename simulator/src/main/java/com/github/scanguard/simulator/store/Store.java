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

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * A bounded key store that consults a replacement policy when it is full.
 *
 * @param <K> the type of keys
 */
public interface Store<K> {

  /**
   * Records a request for the key, inserting it on a miss.
   *
   * @param key the requested key
   * @return if the key was resident
   */
  @CanIgnoreReturnValue
  boolean get(K key);

  /** Returns the maximum number of entries. */
  int capacity();

  /** Returns the number of resident entries. */
  int size();

  long hitCount();

  long missCount();

  long evictionCount();

  /** Returns the number of misses that the policy declined to admit. */
  long rejectionCount();
}
