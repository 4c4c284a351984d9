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

import org.testng.annotations.Test;

public final class ResidentSegmentsTest {

  @Test
  public void insert() {
    var segments = new ResidentSegments<String>(4);
    segments.insert("a", RECENCY, 1);
    segments.insert("b", FREQUENCY, 2);

    assertThat(segments.segmentOf("a")).isEqualTo(RECENCY);
    assertThat(segments.segmentOf("b")).isEqualTo(FREQUENCY);
    assertThat(segments.segmentOf("c")).isNull();
    assertThat(segments.contains("a")).isTrue();
    assertThat(segments.size()).isEqualTo(2);
    assertThat(segments.lastAccess("b")).isEqualTo(2);
  }

  @Test
  public void insertAtLru() {
    var segments = new ResidentSegments<String>(4);
    segments.insert("a", RECENCY, 5);
    segments.insertAtLru("b", RECENCY, 6);

    assertThat(segments.first(RECENCY)).isEqualTo("b");
    assertThat(segments.lastAccess("b")).isEqualTo(5);
    assertThat(segments.oldest(RECENCY, 4)).containsExactly("b", "a").inOrder();
  }

  @Test
  public void insertAtLru_empty() {
    var segments = new ResidentSegments<String>(4);
    segments.insertAtLru("a", RECENCY, 7);
    assertThat(segments.lastAccess("a")).isEqualTo(7);
  }

  @Test
  public void promote() {
    var segments = new ResidentSegments<String>(4);
    segments.insert("a", RECENCY, 1);
    segments.insert("b", FREQUENCY, 2);

    assertThat(segments.promote("a", 3)).isTrue();
    assertThat(segments.segmentOf("a")).isEqualTo(FREQUENCY);
    assertThat(segments.oldest(FREQUENCY, 4)).containsExactly("b", "a").inOrder();
    assertThat(segments.size(RECENCY)).isEqualTo(0);
    assertThat(segments.promote("z", 4)).isFalse();
  }

  @Test
  public void touch() {
    var segments = new ResidentSegments<String>(4);
    segments.insert("a", RECENCY, 1);
    segments.insert("b", RECENCY, 2);

    assertThat(segments.touch("a", 3)).isTrue();
    assertThat(segments.segmentOf("a")).isEqualTo(RECENCY);
    assertThat(segments.oldest(RECENCY, 4)).containsExactly("b", "a").inOrder();
    assertThat(segments.touch("z", 4)).isFalse();
  }

  @Test
  public void remove() {
    var segments = new ResidentSegments<String>(2);
    segments.insert("a", FREQUENCY, 1);
    assertThat(segments.remove("a")).isEqualTo(FREQUENCY);
    assertThat(segments.remove("a")).isNull();
    assertThat(segments.size()).isEqualTo(0);
  }

  @Test
  public void oldestOverall() {
    var segments = new ResidentSegments<String>(4);
    assertThat(segments.oldestOverall()).isNull();

    segments.insert("a", FREQUENCY, 1);
    assertThat(segments.oldestOverall()).isEqualTo("a");

    segments.insert("b", RECENCY, 2);
    assertThat(segments.oldestOverall()).isEqualTo("a");

    segments.touch("a", 3);
    assertThat(segments.oldestOverall()).isEqualTo("b");
  }

  @Test
  public void isFull() {
    var segments = new ResidentSegments<String>(2);
    segments.insert("a", RECENCY, 1);
    assertThat(segments.isFull()).isFalse();
    segments.insert("b", FREQUENCY, 2);
    assertThat(segments.isFull()).isTrue();

    segments.remove("a");
    assertThat(segments.size()).isEqualTo(1);
    assertThat(segments.isFull()).isFalse();
  }
}
