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

import static com.google.common.truth.Truth.assertThat;
import static org.testng.Assert.assertThrows;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.testng.annotations.Test;

import com.github.scanguard.policy.AdaptiveReplacementPolicy;
import com.github.scanguard.policy.ReplacementPolicy;
import com.github.scanguard.policy.StoreView;
import com.github.scanguard.simulator.policy.LruPolicy;

public final class BoundedStoreTest {

  @Test
  public void constructor_invalidCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new BoundedStore<>(0, new LruPolicy<>(1)));
  }

  @Test
  public void get_null() {
    var store = new BoundedStore<String>(2, new LruPolicy<>(2));
    assertThrows(NullPointerException.class, () -> store.get(null));
  }

  @Test
  public void get_evictsLeastRecentlyUsed() {
    var store = new BoundedStore<String>(2, new LruPolicy<>(2));
    assertThat(store.get("a")).isFalse();
    assertThat(store.get("b")).isFalse();
    assertThat(store.get("a")).isTrue();
    assertThat(store.get("c")).isFalse();

    assertThat(store.keys()).containsExactly("a", "c");
    assertThat(store.hitCount()).isEqualTo(1);
    assertThat(store.missCount()).isEqualTo(3);
    assertThat(store.evictionCount()).isEqualTo(1);
    assertThat(store.rejectionCount()).isEqualTo(0);
  }

  @Test
  public void get_hookOrder() {
    var policy = new HookRecorder(/* admit= */ true);
    var store = new BoundedStore<String>(1, policy);
    store.get("a");
    store.get("a");
    store.get("b");

    assertThat(policy.calls).containsExactly("inserted a size=1", "hit a size=1",
        "select b size=1", "admit b over a size=1", "evicted a size=0",
        "inserted b size=1").inOrder();
  }

  @Test
  public void get_rejected() {
    var policy = new HookRecorder(/* admit= */ false);
    var store = new BoundedStore<String>(1, policy);
    store.get("a");
    store.get("b");

    assertThat(store.keys()).containsExactly("a");
    assertThat(store.rejectionCount()).isEqualTo(1);
    assertThat(store.evictionCount()).isEqualTo(0);
    assertThat(policy.calls).containsExactly("inserted a size=1", "select b size=1",
        "admit b over a size=1", "rejected b size=1").inOrder();
  }

  @Test
  public void get_nonResidentVictim() {
    var store = new BoundedStore<String>(1, new HookRecorder(/* admit= */ true) {
      @Override public String selectVictim(StoreView<String> view, String incoming) {
        return "absent";
      }
    });
    store.get("a");
    assertThrows(IllegalStateException.class, () -> store.get("b"));
    assertThat(store.keys()).containsExactly("a");
  }

  @Test
  public void keys_unmodifiable() {
    var store = new BoundedStore<String>(2, new LruPolicy<>(2));
    store.get("a");
    assertThrows(UnsupportedOperationException.class,
        () -> ((Collection<String>) store.keys()).clear());
  }

  @Test
  public void adaptive_loopBeyondCapacity() {
    var adaptive = new BoundedStore<Long>(4, new AdaptiveReplacementPolicy<>(4));
    var lru = new BoundedStore<Long>(4, new LruPolicy<>(4));
    for (long i = 0; i < 15; i++) {
      adaptive.get(i % 5);
      lru.get(i % 5);
    }
    assertThat(lru.hitCount()).isEqualTo(0);
    assertThat(adaptive.hitCount()).isEqualTo(4);
    assertThat(adaptive.size()).isEqualTo(4);
  }

  /** Records each hook call along with the store's size at the time. */
  private static class HookRecorder implements ReplacementPolicy<String> {
    final List<String> calls = new ArrayList<>();
    final boolean admit;

    HookRecorder(boolean admit) {
      this.admit = admit;
    }

    @Override
    public String selectVictim(StoreView<String> store, String incoming) {
      calls.add("select " + incoming + " size=" + store.size());
      return store.keys().iterator().next();
    }

    @Override
    public boolean admit(StoreView<String> store, String incoming, String victim) {
      calls.add("admit " + incoming + " over " + victim + " size=" + store.size());
      return admit;
    }

    @Override
    public void onEvicted(StoreView<String> store, String victim) {
      calls.add("evicted " + victim + " size=" + store.size());
    }

    @Override
    public void onInserted(StoreView<String> store, String key) {
      calls.add("inserted " + key + " size=" + store.size());
    }

    @Override
    public void onRejected(StoreView<String> store, String key) {
      calls.add("rejected " + key + " size=" + store.size());
    }

    @Override
    public void onHit(StoreView<String> store, String key) {
      calls.add("hit " + key + " size=" + store.size());
    }
  }
}
