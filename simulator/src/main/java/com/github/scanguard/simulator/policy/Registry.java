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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Locale.US;

import java.util.function.IntFunction;

import com.github.scanguard.policy.AdaptiveReplacementPolicy;
import com.github.scanguard.policy.AdaptiveSettings;
import com.github.scanguard.policy.ReplacementPolicy;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.typesafe.config.Config;

/**
 * The registry of policies that the simulator can replay a trace through, by name.
 */
public final class Registry {
  private final ImmutableMap<String, IntFunction<ReplacementPolicy<Long>>> factories;

  /**
   * Creates the registry, configuring the policies from the root configuration.
   *
   * @param config the root configuration, which includes the policies' own settings
   */
  public Registry(Config config) {
    var adaptive = new AdaptiveSettings(config.getConfig(AdaptiveSettings.PATH));
    factories = ImmutableMap.<String, IntFunction<ReplacementPolicy<Long>>>of(
        "adaptive", capacity -> new AdaptiveReplacementPolicy<>(capacity, adaptive),
        "lru", LruPolicy::new);
  }

  /** Returns the names of the registered policies. */
  public ImmutableSet<String> names() {
    return factories.keySet();
  }

  /**
   * Returns the factory that creates the named policy for a given capacity.
   *
   * @throws IllegalArgumentException if no policy is registered under the name
   */
  public IntFunction<ReplacementPolicy<Long>> factory(String name) {
    var factory = factories.get(name.trim().toLowerCase(US));
    checkArgument(factory != null, "Unknown policy: %s", name);
    return factory;
  }
}
