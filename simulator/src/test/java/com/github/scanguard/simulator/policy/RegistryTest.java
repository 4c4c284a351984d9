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
package com.github.scanguard.simulator.policy;

import static com.google.common.truth.Truth.assertThat;
import static org.testng.Assert.assertThrows;

import java.util.Map;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import com.github.scanguard.policy.AdaptiveReplacementPolicy;
import com.github.scanguard.simulator.store.BoundedStore;
import com.typesafe.config.ConfigFactory;

public final class RegistryTest {

  @Test
  public void names() {
    var registry = new Registry(ConfigFactory.load());
    assertThat(registry.names()).containsExactly("adaptive", "lru");
  }

  @Test
  public void factory() {
    var registry = new Registry(ConfigFactory.load());
    assertThat(registry.factory("lru").apply(10)).isInstanceOf(LruPolicy.class);
    assertThat(registry.factory(" Adaptive ").apply(10))
        .isInstanceOf(AdaptiveReplacementPolicy.class);
    assertThrows(IllegalArgumentException.class, () -> registry.factory("fifo"));
  }

  @Test(dataProvider = "admission")
  public void factory_configuresAdaptive(boolean enabled, long rejections) {
    var config = ConfigFactory.parseMap(Map.of("scanguard.policy.admission.enabled", enabled))
        .withFallback(ConfigFactory.load());
    var registry = new Registry(config);
    var store = new BoundedStore<Long>(2, registry.factory("adaptive").apply(2));
    for (long key : new long[] {1, 2, 1, 2, 1, 2, 3}) {
      store.get(key);
    }
    assertThat(store.rejectionCount()).isEqualTo(rejections);
  }

  @DataProvider(name = "admission")
  public Object[][] admission() {
    return new Object[][] {{ true, 1L }, { false, 0L }};
  }
}
