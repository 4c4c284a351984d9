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
package com.github.scanguard.simulator.parser;

import java.util.stream.LongStream;
import java.util.stream.Stream;

/**
 * A reader to an access trace.
 */
public interface TraceReader {

  /**
   * Creates a stream that lazily reads the trace source.
   * <p>
   * If timely disposal of underlying resources is required, the try-with-resources construct should
   * be used to ensure that the stream's {@link Stream#close close} method is invoked after the
   * stream operations are completed.
   *
   * @return a lazy stream of access events
   */
  Stream<AccessEvent> events();

  /** A trace reader that does not contain external event metadata. */
  interface KeyOnlyTraceReader extends TraceReader {

    @Override default Stream<AccessEvent> events() {
      return keys().mapToObj(AccessEvent::forKey);
    }

    LongStream keys();
  }
}
