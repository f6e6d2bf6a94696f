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


import java.util.Arrays;
import java.util.Objects;

/// A dense row-major block of pixel values with an explicit shape.
///
/// Readers deliver stacks of frames as rank 3 blocks `(count, height, width)`. Other ranks can be
/// represented so that a malformed source can be described and rejected by the processing stage
/// instead of failing while it is being wrapped.
///
/// The value array is shared, not copied. Callers that hand a block to another thread must not
/// modify it afterwards.
public final class DiffractionPatterns {

  private final int[] shape;
  private final int[] values;

  private DiffractionPatterns(int[] shape, int[] values) {
    this.shape = shape;
    this.values = values;
  }

  /// Wrap existing values
  /// @param shape the dimensions, outermost first
  /// @param values row-major values; the length must equal the product of the shape
  /// @return a block sharing the given value array
  public static DiffractionPatterns wrap(int[] shape, int[] values) {
    Objects.requireNonNull(shape, "shape cannot be null");
    Objects.requireNonNull(values, "values cannot be null");
    long expected = 1L;
    for (int dimension : shape) {
      if (dimension < 0) {
        throw new IllegalArgumentException("negative dimension in shape " + Arrays.toString(shape));
      }
      expected *= dimension;
    }
    if (expected != values.length) {
      throw new IllegalArgumentException(
          "shape " + Arrays.toString(shape) + " needs " + expected + " values, got " + values.length);
    }
    return new DiffractionPatterns(shape.clone(), values);
  }

  /// Allocate a zeroed stack of frames
  /// @param count number of frames
  /// @param height frame height in pixels
  /// @param width frame width in pixels
  /// @return a new zero-filled rank 3 block
  public static DiffractionPatterns zeros(int count, int height, int width) {
    long size = (long) count * height * width;
    if (size > Integer.MAX_VALUE - 8) {
      throw new IllegalArgumentException(
          "pattern block too large for one array: " + count + "x" + height + "x" + width);
    }
    return new DiffractionPatterns(new int[]{count, height, width}, new int[(int) size]);
  }

  public int rank() {
    return shape.length;
  }

  /// @return a copy of the shape
  public int[] shape() {
    return shape.clone();
  }

  public int count() {
    requireRank3();
    return shape[0];
  }

  public int height() {
    requireRank3();
    return shape[1];
  }

  public int width() {
    requireRank3();
    return shape[2];
  }

  /// @return pixels per frame for a rank 3 block
  public int frameSize() {
    requireRank3();
    return shape[1] * shape[2];
  }

  /// @return the backing value array
  public int[] values() {
    return values;
  }

  public int get(int frame, int y, int x) {
    return values[offset(frame, y, x)];
  }

  public void set(int frame, int y, int x, int value) {
    values[offset(frame, y, x)] = value;
  }

  /// Sum of one frame, optionally skipping masked pixels
  /// @param frame the frame index
  /// @param goodPixels pixels to include, or null for all
  /// @param pixelType element type the values were read as; decides how they are widened
  /// @return the total counts
  public long frameCounts(int frame, boolean[] goodPixels, PixelType pixelType) {
    int frameSize = frameSize();
    int base = frame * frameSize;
    long total = 0L;
    for (int i = 0; i < frameSize; i++) {
      if (goodPixels == null || goodPixels[i]) {
        total += pixelType.widen(values[base + i]);
      }
    }
    return total;
  }

  private int offset(int frame, int y, int x) {
    requireRank3();
    return (frame * shape[1] + y) * shape[2] + x;
  }

  private void requireRank3() {
    if (shape.length != 3) {
      throw new IllegalStateException(
          "expected (count, height, width) but shape is " + Arrays.toString(shape));
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DiffractionPatterns that)) {
      return false;
    }
    return Arrays.equals(shape, that.shape) && Arrays.equals(values, that.values);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(shape) + Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return "DiffractionPatterns" + Arrays.toString(shape);
  }
}
