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

/** The resident pools, also used to remember where a ghost entry was evicted from. */
public enum Segment {
  /** Keys that were seen once recently. */
  RECENCY,
  /** Keys that have demonstrated reuse. */
  FREQUENCY;

  /** Returns the other segment. */
  public Segment opposite() {
    return (this == RECENCY) ? FREQUENCY : RECENCY;
  }
}
