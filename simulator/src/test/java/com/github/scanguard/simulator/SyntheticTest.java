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
package com.github.scanguard.simulator;

import static com.google.common.truth.Truth.assertThat;
import static org.testng.Assert.assertThrows;

import java.util.Map;

import org.testng.annotations.Test;

import com.typesafe.config.ConfigFactory;

import it.unimi.dsi.fastutil.longs.LongOpenHashSet;

public final class SyntheticTest {

  @Test
  public void scan_distinct() {
    assertThat(Synthetic.scan(10, 5).toArray()).asList()
        .containsExactly(10L, 11L, 12L, 13L, 14L).inOrder();
  }

  @Test
  public void loop_repeats() {
    assertThat(Synthetic.loop(3, 7).toArray()).asList()
        .containsExactly(0L, 1L, 2L, 0L, 1L, 2L, 0L).inOrder();
    assertThrows(IllegalArgumentException.class, () -> Synthetic.loop(0, 1));
  }

  @Test
  public void hotSet_repeatable() {
    long[] first = Synthetic.hotSet(10, 0.5, 42, 1_000).toArray();
    long[] second = Synthetic.hotSet(10, 0.5, 42, 1_000).toArray();
    assertThat(first).isEqualTo(second);
  }

  @Test
  public void hotSet_coldKeysNeverRepeat() {
    var cold = new LongOpenHashSet();
    int hot = 0;
    for (long key : Synthetic.hotSet(10, 0.5, 42, 10_000).toArray()) {
      if (key < 10) {
        hot++;
      } else {
        assertThat(cold.add(key)).isTrue();
      }
    }
    assertThat(hot).isGreaterThan(4_500);
    assertThat(hot).isLessThan(5_500);
  }

  @Test
  public void hotSet_invalid() {
    assertThrows(IllegalArgumentException.class, () -> Synthetic.hotSet(0, 0.5, 1, 1));
    assertThrows(IllegalArgumentException.class, () -> Synthetic.hotSet(1, 1.5, 1, 1));
  }

  @Test
  public void uniform_bounded() {
    for (long key : Synthetic.uniform(5, 9, 1_000).toArray()) {
      assertThat(key).isAtLeast(5L);
      assertThat(key).isAtMost(9L);
    }
  }

  @Test
  public void zipfian_bounded() {
    for (long key : Synthetic.zipfian(100, 0.99, 1_000).toArray()) {
      assertThat(key).isAtLeast(0L);
      assertThat(key).isLessThan(100L);
    }
  }

  @Test
  public void generate_fromSettings() {
    var settings = SimulatorSettings.of(ConfigFactory.parseMap(Map.of(
        "scanguard.simulator.synthetic.distribution", "loop",
        "scanguard.simulator.synthetic.loop.items", 4,
        "scanguard.simulator.synthetic.events", 10))
        .withFallback(ConfigFactory.load()));
    var reader = Synthetic.generate(settings.trace().synthetic(), settings.randomSeed());
    assertThat(reader.keys().toArray()).asList()
        .containsExactly(0L, 1L, 2L, 3L, 0L, 1L, 2L, 3L, 0L, 1L).inOrder();
    assertThat(reader.events().count()).isEqualTo(10L);
  }

  @Test
  public void generate_unknown() {
    var settings = SimulatorSettings.of(ConfigFactory.parseMap(Map.of(
        "scanguard.simulator.synthetic.distribution", "unknown"))
        .withFallback(ConfigFactory.load()));
    assertThrows(IllegalStateException.class,
        () -> Synthetic.generate(settings.trace().synthetic(), 1));
  }
}
