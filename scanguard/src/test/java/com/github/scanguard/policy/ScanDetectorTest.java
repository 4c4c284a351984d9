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

import static com.google.common.truth.Truth.assertThat;

import org.testng.annotations.Test;

import com.github.scanguard.policy.ScanDetector.State;

public final class ScanDetectorTest {

  @Test
  public void guard_afterThreshold() {
    var scan = new ScanDetector(3, 5, 10);
    for (int i = 1; i <= 3; i++) {
      scan.onColdMiss(i);
      assertThat(scan.isGuarded(i)).isFalse();
    }
    scan.onColdMiss(4);
    assertThat(scan.coldStreak()).isEqualTo(4);
    assertThat(scan.state(4)).isEqualTo(State.GUARDED);
  }

  @Test
  public void guard_lapses() {
    var scan = new ScanDetector(0, 5, 10);
    scan.onColdMiss(4);
    assertThat(scan.isGuarded(8)).isTrue();
    assertThat(scan.isGuarded(9)).isFalse();
    assertThat(scan.state(9)).isEqualTo(State.NORMAL);
  }

  @Test
  public void guard_rearmed() {
    var scan = new ScanDetector(0, 5, 10);
    scan.onColdMiss(4);
    scan.onColdMiss(6);
    assertThat(scan.isGuarded(10)).isTrue();
    assertThat(scan.isGuarded(11)).isFalse();
  }

  @Test
  public void reuse_cancels() {
    var scan = new ScanDetector(1, 100, 10);
    scan.onColdMiss(1);
    scan.onColdMiss(2);
    assertThat(scan.isGuarded(2)).isTrue();

    scan.onReuse();
    assertThat(scan.isGuarded(3)).isFalse();
    assertThat(scan.coldStreak()).isEqualTo(0);

    scan.onColdMiss(4);
    assertThat(scan.isGuarded(4)).isFalse();
  }

  @Test
  public void effectiveTarget() {
    var scan = new ScanDetector(0, 100, 10);
    assertThat(scan.effectiveTarget(30, 0)).isEqualTo(30);

    scan.onColdMiss(1);
    assertThat(scan.effectiveTarget(30, 1)).isEqualTo(20);
    assertThat(scan.effectiveTarget(5, 1)).isEqualTo(0);
  }
}
