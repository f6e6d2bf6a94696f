package io.ptychotools.api.patterns;

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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiffractionPatternsTest {

  @Test
  void indexesRowMajor() {
    DiffractionPatterns patterns = DiffractionPatterns.zeros(2, 3, 4);
    patterns.set(1, 2, 3, 7);

    assertThat(patterns.values()[23]).isEqualTo(7);
    assertThat(patterns.get(1, 2, 3)).isEqualTo(7);
    assertThat(patterns.frameSize()).isEqualTo(12);
  }

  @Test
  void rejectsShapeValueMismatch() {
    assertThatThrownBy(() -> DiffractionPatterns.wrap(new int[]{2, 2, 2}, new int[7]))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("needs 8 values");
  }

  @Test
  void rankTwoBlockCanBeWrappedButNotIndexedAsFrames() {
    DiffractionPatterns image = DiffractionPatterns.wrap(new int[]{2, 2}, new int[4]);

    assertThat(image.rank()).isEqualTo(2);
    assertThatThrownBy(image::count).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void frameCountsSkipMaskedPixels() {
    DiffractionPatterns patterns = DiffractionPatterns.wrap(new int[]{1, 2, 2}, new int[]{1, 2, 3, 4});

    assertThat(patterns.frameCounts(0, null, PixelType.UINT16)).isEqualTo(10L);
    assertThat(patterns.frameCounts(0, new boolean[]{true, false, true, false}, PixelType.UINT16)).isEqualTo(4L);
  }

  @Test
  void frameCountsReadUnsigned32BitPixelsAsPositive() {
    int large = (int) 3_000_000_000L;
    DiffractionPatterns patterns = DiffractionPatterns.wrap(new int[]{1, 1, 2}, new int[]{large, 5});

    assertThat(patterns.frameCounts(0, null, PixelType.UINT32)).isEqualTo(3_000_000_005L);
    assertThat(patterns.frameCounts(0, null, PixelType.INT32)).isEqualTo(large + 5L);
  }

  @Test
  void shapeIsDefensivelyCopied() {
    DiffractionPatterns patterns = DiffractionPatterns.zeros(1, 2, 2);
    patterns.shape()[0] = 99;
    assertThat(patterns.count()).isEqualTo(1);
  }
}
