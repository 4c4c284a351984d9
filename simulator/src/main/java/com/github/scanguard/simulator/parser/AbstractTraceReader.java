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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Locale.US;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.apache.commons.compress.compressors.CompressorException;
import org.apache.commons.compress.compressors.CompressorStreamFactory;
import org.tukaani.xz.XZInputStream;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableMap;

/**
 * A skeletal implementation that reads the trace files into a data stream. A file whose name ends
 * with a compression suffix is decompressed while it is read.
 */
public abstract class AbstractTraceReader implements TraceReader {
  private static final ImmutableMap<String, String> COMPRESSORS = ImmutableMap.of(
      ".gz", CompressorStreamFactory.GZIP,
      ".bz2", CompressorStreamFactory.BZIP2);
  private static final int BUFFER_SIZE = 1 << 16;

  protected final String filePath;

  protected AbstractTraceReader(String filePath) {
    this.filePath = filePath.trim();
  }

  /** Returns the input stream of the trace data. */
  protected BufferedInputStream readFile() {
    try {
      return readInput(openFile());
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @SuppressWarnings("PMD.CloseResource")
  protected BufferedInputStream readInput(InputStream input) {
    try {
      String name = filePath.toLowerCase(US);
      if (name.endsWith(".xz")) {
        return new BufferedInputStream(new XZInputStream(input), BUFFER_SIZE);
      }
      for (var compressor : COMPRESSORS.entrySet()) {
        if (name.endsWith(compressor.getKey())) {
          var factory = new CompressorStreamFactory();
          return new BufferedInputStream(factory.createCompressorInputStream(
              compressor.getValue(), input), BUFFER_SIZE);
        }
      }
      return new BufferedInputStream(input, BUFFER_SIZE);
    } catch (IOException | CompressorException | RuntimeException e) {
      try {
        input.close();
      } catch (IOException suppressed) {
        e.addSuppressed(suppressed);
      }
      if (e instanceof IOException) {
        throw new UncheckedIOException((IOException) e);
      }
      Throwables.throwIfUnchecked(e);
      throw new IllegalArgumentException("Could not decompress file: " + filePath, e);
    }
  }

  /** Returns the input stream for the raw file. */
  private InputStream openFile() throws IOException {
    Path file = Paths.get(filePath);
    if (Files.exists(file)) {
      return Files.newInputStream(file);
    }
    InputStream input = getClass().getResourceAsStream(filePath);
    checkArgument(input != null, "Could not find file: %s", filePath);
    return input;
  }
}
