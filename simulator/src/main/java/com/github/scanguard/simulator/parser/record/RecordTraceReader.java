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
package com.github.scanguard.simulator.parser.record;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.jspecify.annotations.Nullable;

import com.github.scanguard.simulator.parser.AbstractTraceReader;
import com.github.scanguard.simulator.parser.AccessEvent;
import com.google.common.collect.AbstractIterator;
import com.google.common.io.ByteStreams;
import com.google.common.io.Closeables;

/**
 * A reader for traces of fixed-width binary records. Each record is 24 bytes in little-endian
 * order: an unsigned 32-bit time, a 64-bit key, an unsigned 32-bit size, and a signed 64-bit
 * logical time of the key's next request. A partial record at the end of the file is ignored.
 */
public final class RecordTraceReader extends AbstractTraceReader {
  public static final int RECORD_SIZE = 24;

  public RecordTraceReader(String filePath) {
    super(filePath);
  }

  @Override
  @SuppressWarnings("PMD.CloseResource")
  public Stream<AccessEvent> events() {
    InputStream input = readFile();
    var records = new RecordIterator(input);
    return StreamSupport.stream(Spliterators.spliteratorUnknownSize(
        records, Spliterator.ORDERED | Spliterator.NONNULL), /* parallel */ false)
        .onClose(() -> Closeables.closeQuietly(input));
  }

  /** Decodes the record held in the buffer's backing array. */
  static AccessEvent decode(ByteBuffer record) {
    record.clear();
    long time = Integer.toUnsignedLong(record.getInt());
    long key = record.getLong();
    long size = Integer.toUnsignedLong(record.getInt());
    long nextAccess = record.getLong();
    return new AccessEvent(time, key, (int) Math.min(size, Integer.MAX_VALUE), nextAccess);
  }

  private static final class RecordIterator extends AbstractIterator<AccessEvent> {
    final ByteBuffer record = ByteBuffer.allocate(RECORD_SIZE).order(ByteOrder.LITTLE_ENDIAN);
    final InputStream input;

    RecordIterator(InputStream input) {
      this.input = input;
    }

    @Override
    protected @Nullable AccessEvent computeNext() {
      try {
        int read = ByteStreams.read(input, record.array(), 0, RECORD_SIZE);
        return (read == RECORD_SIZE) ? decode(record) : endOfData();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }
  }
}
