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
package com.github.scanguard;

import static java.util.Objects.requireNonNull;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * The configuration resolved at a component's path. A component can extend this class as a
 * convenient way to extract its own settings.
 */
public class BasicSettings {
  private final Config config;

  public BasicSettings(Config config) {
    this.config = requireNonNull(config);
  }

  /** Returns the settings at the default path of the loaded configuration. */
  public static Config load(String path) {
    return ConfigFactory.load().getConfig(path);
  }

  public int randomSeed() {
    return config().getInt("random-seed");
  }

  /** Returns the config resolved at the component's path. */
  public Config config() {
    return config;
  }
}
