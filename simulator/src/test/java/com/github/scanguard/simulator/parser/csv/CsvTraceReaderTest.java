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
package com.github.scanguard.simulator.parser.csv;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.expectThrows;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPOutputStream;

import org.testng.annotations.Test;

import com.github.scanguard.simulator.parser.AccessEvent;

public final class CsvTraceReaderTest {

  @Test
  public void events_skipsHeader() throws IOException {
    var file = write(".csv", "time,key,size,next_vtime\n"
        + "1,42,100,3\n"
        + "\n"
        + "2,7,1,-1\n"
        + "3,42,100,-1\n");
    try (var events = new CsvTraceReader(file.toString()).events()) {
      assertThat(events.collect(toImmutableList())).containsExactly(
          new AccessEvent(1, 42, 100, 3),
          new AccessEvent(2, 7, 1, -1),
          new AccessEvent(3, 42, 100, -1)).inOrder();
    }
  }

  @Test
  public void events_partialColumns() throws IOException {
    var file = write(".csv", "# keys only\n5\n6, 8\n7,9,4\n");
    try (var events = new CsvTraceReader(file.toString()).events()) {
      var read = events.collect(toImmutableList());
      assertThat(read).containsExactly(AccessEvent.forKey(5),
          new AccessEvent(6, 8, 1, -1), new AccessEvent(7, 9, 4, -1)).inOrder();
      assertThat(read.get(0).hasNextAccess()).isFalse();
    }
  }

  @Test
  public void events_malformed() throws IOException {
    var file = write(".csv", "1,abc,1,1\n");
    try (var events = new CsvTraceReader(file.toString()).events()) {
      var e = expectThrows(IllegalArgumentException.class, () -> events.count());
      assertThat(e).hasMessageThat().contains("1,abc,1,1");
    }
  }

  @Test
  public void events_gzipped() throws IOException {
    var file = Files.createTempFile("trace", ".csv.gz");
    file.toFile().deleteOnExit();
    try (OutputStream output = new GZIPOutputStream(Files.newOutputStream(file))) {
      output.write("1,10,1,-1\n2,11,1,-1\n".getBytes(UTF_8));
    }
    try (var events = new CsvTraceReader(file.toString()).events()) {
      assertThat(events.map(AccessEvent::key).collect(toImmutableList()))
          .containsExactly(10L, 11L).inOrder();
    }
  }

  @Test
  public void events_missingFile() {
    assertThrows(IllegalArgumentException.class,
        () -> new CsvTraceReader("/does/not/exist.csv").events());
  }

  static Path write(String suffix, String content) throws IOException {
    var file = Files.createTempFile("trace", suffix);
    file.toFile().deleteOnExit();
    return Files.writeString(file, content, UTF_8);
  }
}
