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
package com.github.scanguard.simulator.parser;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A single request in an access trace.
 *
 * @param time the logical time of the request, or zero if not recorded
 * @param key the requested key
 * @param size the entry's size, or one if not recorded
 * @param nextAccess the logical time of the key's next request, or a negative value if it is not
 *     requested again or not recorded
 */
public record AccessEvent(long time, long key, int size, long nextAccess) {

  public AccessEvent {
    checkArgument(size >= 0, "Negative size: %s", size);
  }

  /** Returns an event that only records the key. */
  public static AccessEvent forKey(long key) {
    return new AccessEvent(0L, key, 1, -1L);
  }

  /** Returns if the trace recorded when the key is requested next. */
  public boolean hasNextAccess() {
    return nextAccess >= 0;
  }
}
