package io.ptychotools.patterns.dataset;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.ptychotools.api.geometry.ImageExtent;
import io.ptychotools.api.patterns.DiffractionPatterns;
import io.ptychotools.api.patterns.PixelType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PatternBufferTest {

  private static final ImageExtent FRAME = new ImageExtent(3, 2);

  @TempDir
  Path tempDir;

  private static DiffractionPatterns frames(int count, int offset) {
    DiffractionPatterns patterns = DiffractionPatterns.zeros(count, 2, 3);
    int[] values = patterns.values();
    for (int i = 0; i < values.length; i++) {
      values[i] = offset + i;
    }
    return patterns;
  }

  @Test
  void heapBufferStartsZeroedAndStoresRows() throws IOException {
    try (PatternBuffer buffer = PatternBuffer.allocate(4, FRAME, PixelType.UINT16)) {
      assertThat(buffer.readRows(0, 4).values()).containsOnly(0);

      buffer.writeRows(1, frames(2, 100));

      assertThat(buffer.readRows(1, 2)).isEqualTo(frames(2, 100));
      assertThat(buffer.readRows(0, 1).values()).containsOnly(0);
      assertThat(buffer.shape()).containsExactly(4, 2, 3);
      assertThat(buffer.sizeInBytes()).isEqualTo(4L * 6 * 2);
      assertThat(buffer.isMapped()).isFalse();
    }
  }

  @Test
  void narrowsToPixelType() throws IOException {
    try (PatternBuffer buffer = PatternBuffer.allocate(1, FRAME, PixelType.UINT8)) {
      buffer.writeRows(0, DiffractionPatterns.wrap(new int[]{1, 2, 3}, new int[]{255, 256, 257, -1, 0, 1}));

      assertThat(buffer.readRows(0, 1).values()).containsExactly(255, 0, 1, 255, 0, 1);
    }
  }

  @Test
  void rowsSpanSegments() throws IOException {
    try (PatternBuffer buffer = PatternBuffer.allocate(5, FRAME, PixelType.INT32, 2L * 6 * 4)) {
      assertThat(buffer.segmentCount()).isEqualTo(3);

      buffer.writeRows(0, frames(5, 0));

      assertThat(buffer.readRows(0, 5)).isEqualTo(frames(5, 0));
      assertThat(buffer.readRows(new int[]{4, 1}).values())
          .containsExactly(24, 25, 26, 27, 28, 29, 6, 7, 8, 9, 10, 11);
    }
  }

  @Test
  void mappedBufferUsesPrivateScratchFileDeletedOnClose() throws IOException {
    Path scratch = tempDir.resolve("scratch");
    PatternBuffer buffer = PatternBuffer.map(3, FRAME, PixelType.INT16, scratch, 6L * 2);
    Path file = buffer.getScratchFile().orElseThrow();

    assertThat(file).exists().hasParent(scratch);
    assertThat(Files.size(file)).isEqualTo(3L * 6 * 2);
    assertThat(buffer.segmentCount()).isEqualTo(3);

    buffer.writeRows(0, frames(3, -9));
    assertThat(buffer.readRows(0, 3)).isEqualTo(frames(3, -9));

    buffer.close();
    assertThat(file).doesNotExist();
    assertThatThrownBy(() -> buffer.readRows(0, 1)).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void rejectsRowsOutsideBufferAndWrongExtent() throws IOException {
    try (PatternBuffer buffer = PatternBuffer.allocate(2, FRAME, PixelType.UINT16)) {
      assertThatThrownBy(() -> buffer.writeRows(1, frames(2, 0)))
          .isInstanceOf(IndexOutOfBoundsException.class);
      assertThatThrownBy(() -> buffer.readRows(-1, 1))
          .isInstanceOf(IndexOutOfBoundsException.class);
      assertThatThrownBy(() -> buffer.writeRows(0, DiffractionPatterns.zeros(1, 3, 2)))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Test
  void copiesRowsBetweenHeapAndMappedBuffersAsBytes() throws IOException {
    Path scratch = Files.createDirectory(tempDir.resolve("copy"));
    try (PatternBuffer source = PatternBuffer.allocate(3, FRAME, PixelType.UINT16, 6L * 2);
         PatternBuffer target = PatternBuffer.map(3, FRAME, PixelType.UINT16, scratch, 6L * 2)) {
      source.writeRows(0, frames(3, 65500));
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      for (int row = 2; row >= 0; row--) {
        source.copyRowTo(row, out);
      }
      assertThat(out.size()).isEqualTo(3 * 6 * 2);

      ByteArrayInputStream in = new ByteArrayInputStream(out.toByteArray());
      for (int row = 0; row < 3; row++) {
        target.copyRowFrom(row, in);
      }

      assertThat(target.readRows(new int[]{2, 1, 0})).isEqualTo(frames(3, 65500));
      assertThat(in.available()).isZero();
    }
  }

  @Test
  void copyFromShortStreamFails() throws IOException {
    try (PatternBuffer buffer = PatternBuffer.allocate(2, FRAME, PixelType.INT32)) {
      ByteArrayInputStream in = new ByteArrayInputStream(new byte[6 * 4 - 1]);

      assertThatThrownBy(() -> buffer.copyRowFrom(1, in))
          .isInstanceOf(EOFException.class).hasMessageContaining("row 1");
      assertThatThrownBy(() -> buffer.copyRowTo(2, new ByteArrayOutputStream()))
          .isInstanceOf(IndexOutOfBoundsException.class);
    }
  }

  @Test
  void emptyBufferHasNoRows() throws IOException {
    try (PatternBuffer buffer = PatternBuffer.empty()) {
      assertThat(buffer.rows()).isZero();
      assertThat(buffer.readRows(0, 0).count()).isZero();
    }
  }
}
