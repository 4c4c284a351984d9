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
import static com.google.common.truth.Truth.assertThat;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public final class VictimSelectorTest {
  ResidentSegments<String> segments;
  FrequencySketch<String> sketch;
  VictimSelector<String> selector;
  RecordingStore<String> store;

  @BeforeMethod
  public void before() {
    segments = new ResidentSegments<>(16);
    sketch = new FrequencySketch<>(1024, 255, Integer.MAX_VALUE);
    selector = new VictimSelector<>(segments, sketch, 4);
    store = new RecordingStore<>(16, new AdaptiveReplacementPolicy<>(16));
  }

  private void add(String key, Segment segment, long now, int frequency) {
    segments.insert(key, segment, now);
    sketch.increment(key, frequency);
    store.keys.add(key);
  }

  @Test
  public void poolFor() {
    add("f", FREQUENCY, 1, 0);
    assertThat(selector.poolFor(null, 0)).isEqualTo(FREQUENCY);

    add("r1", RECENCY, 2, 0);
    add("r2", RECENCY, 3, 0);
    assertThat(selector.poolFor(null, 1)).isEqualTo(RECENCY);
    assertThat(selector.poolFor(null, 2)).isEqualTo(FREQUENCY);
    assertThat(selector.poolFor(RECENCY, 2)).isEqualTo(FREQUENCY);
    assertThat(selector.poolFor(FREQUENCY, 2)).isEqualTo(RECENCY);
    assertThat(selector.poolFor(FREQUENCY, 3)).isEqualTo(FREQUENCY);
  }

  @Test
  public void poolFor_emptyFrequency() {
    add("r", RECENCY, 1, 0);
    assertThat(selector.poolFor(null, 8)).isEqualTo(RECENCY);
  }

  @Test
  public void select_leastFrequentOfSample() {
    add("a", RECENCY, 1, 3);
    add("b", RECENCY, 2, 2);
    add("c", RECENCY, 3, 1);
    add("d", RECENCY, 4, 1);
    add("e", RECENCY, 5, 0);

    // "e" is outside of the sample and the tie between "c" and "d" favors the older
    assertThat(selector.select(store, null, 0)).isEqualTo("c");
  }

  @Test
  public void select_discardsStale() {
    add("a", RECENCY, 1, 3);
    add("b", RECENCY, 2, 2);
    add("c", RECENCY, 3, 1);
    add("d", RECENCY, 4, 1);
    store.keys.remove("c");

    assertThat(selector.select(store, null, 0)).isEqualTo("d");
    assertThat(segments.contains("c")).isFalse();
    assertThat(selector.staleDiscards()).isEqualTo(1);
  }

  @Test
  public void select_otherPool() {
    add("f", FREQUENCY, 1, 0);
    add("r", RECENCY, 2, 0);
    store.keys.remove("r");

    assertThat(selector.select(store, null, 0)).isEqualTo("f");
  }

  @Test
  public void select_oldestOverall() {
    for (int i = 0; i < 5; i++) {
      add("r" + i, RECENCY, i, 0);
      add("f" + i, FREQUENCY, 10 + i, 0);
    }
    for (int i = 0; i < 4; i++) {
      store.keys.remove("r" + i);
      store.keys.remove("f" + i);
    }

    // both samples of four are entirely stale
    assertThat(selector.select(store, null, 0)).isEqualTo("r4");
    assertThat(segments.size()).isEqualTo(2);
    assertThat(selector.staleDiscards()).isEqualTo(8);
  }

  @Test
  public void select_untrackedStoreKey() {
    add("a", RECENCY, 1, 0);
    store.keys.remove("a");
    store.keys.add("z");

    assertThat(selector.select(store, null, 0)).isEqualTo("z");
    assertThat(segments.size()).isEqualTo(0);
  }
}
