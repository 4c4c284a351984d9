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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Locale.US;

import java.util.List;

import com.github.scanguard.BasicSettings;
import com.github.scanguard.simulator.report.ReportFormat;
import com.google.common.collect.ImmutableSet;
import com.typesafe.config.Config;

/**
 * The simulator's configuration, resolved at {@value #PATH}.
 */
public final class SimulatorSettings extends BasicSettings {
  public static final String PATH = "scanguard.simulator";

  public SimulatorSettings(Config config) {
    super(config);
  }

  /** Returns the settings read from the root configuration. */
  public static SimulatorSettings of(Config root) {
    return new SimulatorSettings(root.getConfig(PATH));
  }

  public ImmutableSet<String> policies() {
    return config().getStringList("policies").stream()
        .map(policy -> policy.trim().toLowerCase(US))
        .collect(ImmutableSet.toImmutableSet());
  }

  /** Returns the configured store capacity, or zero if it should be derived from the trace. */
  public int maximumSize() {
    return config().getInt("maximum-size");
  }

  public int shards() {
    return config().getInt("shards");
  }

  public ReportSettings report() {
    return new ReportSettings();
  }

  public TraceSettings trace() {
    return new TraceSettings();
  }

  public final class ReportSettings {
    public ReportFormat format() {
      return ReportFormat.valueOf(config().getString("report.format").toUpperCase(US));
    }
    public String sortBy() {
      return config().getString("report.sort-by").trim();
    }
    public boolean ascending() {
      return config().getBoolean("report.ascending");
    }
    public String output() {
      return config().getString("report.output").trim();
    }
  }

  public final class TraceSettings {
    public long skip() {
      return config().getLong("trace.skip");
    }
    public long limit() {
      return config().getIsNull("trace.limit") ? Long.MAX_VALUE : config().getLong("trace.limit");
    }
    public boolean isFiles() {
      return config().getString("trace.source").equals("files");
    }
    public boolean isSynthetic() {
      return config().getString("trace.source").equals("synthetic");
    }
    public TraceFilesSettings traceFiles() {
      checkState(isFiles());
      return new TraceFilesSettings();
    }
    public SyntheticSettings synthetic() {
      checkState(isSynthetic());
      return new SyntheticSettings();
    }
  }

  public final class TraceFilesSettings {
    public List<String> paths() {
      return config().getStringList("files.paths");
    }
  }

  public final class SyntheticSettings {
    public String distribution() {
      return config().getString("synthetic.distribution");
    }
    public int events() {
      return config().getInt("synthetic.events");
    }
    public long scanStart() {
      return config().getLong("synthetic.scan.start");
    }
    public int loopItems() {
      return config().getInt("synthetic.loop.items");
    }
    public HotSetSettings hotSet() {
      return new HotSetSettings();
    }
    public ZipfianSettings zipfian() {
      return new ZipfianSettings();
    }
    public UniformSettings uniform() {
      return new UniformSettings();
    }

    public final class HotSetSettings {
      public int items() {
        return config().getInt("synthetic.hot-set.items");
      }
      public double fraction() {
        return config().getDouble("synthetic.hot-set.fraction");
      }
    }
    public final class ZipfianSettings {
      public int items() {
        return config().getInt("synthetic.zipfian.items");
      }
      public double constant() {
        return config().getDouble("synthetic.zipfian.constant");
      }
    }
    public final class UniformSettings {
      public int lowerBound() {
        return config().getInt("synthetic.uniform.lower-bound");
      }
      public int upperBound() {
        return config().getInt("synthetic.uniform.upper-bound");
      }
    }
  }
}
