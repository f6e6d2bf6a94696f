package io.ptychotools.patterns.npz;

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


import io.ptychotools.api.patterns.DiffractionPatterns;
import io.ptychotools.api.patterns.PixelType;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Objects;

/// A C-ordered, little-endian array as stored in one `.npy` member of an NPZ archive.
/// @param descr the NumPy type string, such as `<i8` or `<u2`
/// @param shape the dimensions, outermost first
/// @param data the raw element bytes
public record NpyArray(String descr, int[] shape, byte[] data) {

  public static final String INT64_DESCR = "<i8";

  public NpyArray {
    Objects.requireNonNull(descr, "descr cannot be null");
    shape = shape.clone();
    long expected = elementCount(shape) * itemSize(descr);
    if (expected != data.length) {
      throw new IllegalArgumentException(
          "array of " + descr + Arrays.toString(shape) + " needs " + expected + " bytes, got " + data.length);
    }
  }

  /// @param values the values
  /// @return a one-dimensional `<i8` array
  public static NpyArray ofLongs(long[] values) {
    ByteBuffer buffer = ByteBuffer.allocate(values.length * Long.BYTES).order(ByteOrder.LITTLE_ENDIAN);
    for (long value : values) {
      buffer.putLong(value);
    }
    return new NpyArray(INT64_DESCR, new int[]{values.length}, buffer.array());
  }

  /// @param patterns the frames
  /// @param pixelType element type to store
  /// @return an array with the shape of the frames
  public static NpyArray ofPatterns(DiffractionPatterns patterns, PixelType pixelType) {
    int[] values = patterns.values();
    ByteBuffer buffer = ByteBuffer.allocate(values.length * pixelType.bytes()).order(ByteOrder.LITTLE_ENDIAN);
    for (int i = 0; i < values.length; i++) {
      pixelType.put(buffer, i * pixelType.bytes(), values[i]);
    }
    return new NpyArray(pixelType.descr(), patterns.shape(), buffer.array());
  }

  /// @param descr a NumPy type string
  /// @return the element size in bytes
  public static int itemSize(String descr) {
    if (descr.length() < 3) {
      throw new IllegalArgumentException("unsupported descr '" + descr + "'");
    }
    try {
      return Integer.parseInt(descr.substring(2));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("unsupported descr '" + descr + "'", e);
    }
  }

  static long elementCount(int[] shape) {
    long count = 1L;
    for (int dimension : shape) {
      count *= dimension;
    }
    return count;
  }

  @Override
  public int[] shape() {
    return shape.clone();
  }

  public int rank() {
    return shape.length;
  }

  /// @return the elements widened to long
  /// @throws IllegalArgumentException if the element type is not an integer type
  public long[] toLongs() {
    int count = (int) elementCount(shape);
    long[] values = new long[count];
    ByteBuffer buffer = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
    if (descr.equals(INT64_DESCR)) {
      for (int i = 0; i < count; i++) {
        values[i] = buffer.getLong(i * Long.BYTES);
      }
      return values;
    }
    PixelType type = PixelType.fromDescr(descr);
    for (int i = 0; i < count; i++) {
      int value = type.get(buffer, i * type.bytes());
      values[i] = type == PixelType.UINT32 ? Integer.toUnsignedLong(value) : value;
    }
    return values;
  }

  /// @return true for every nonzero element of a one byte array such as `|b1` or `|u1`
  /// @throws IllegalArgumentException if elements are wider than one byte
  public boolean[] toBooleans() {
    if (itemSize(descr) != 1) {
      throw new IllegalArgumentException("expected a boolean or byte array, got " + descr);
    }
    boolean[] values = new boolean[data.length];
    for (int i = 0; i < data.length; i++) {
      values[i] = data[i] != 0;
    }
    return values;
  }

  /// @return the pixel type of this array
  /// @throws IllegalArgumentException if the element type is not a supported pixel type
  public PixelType pixelType() {
    return PixelType.fromDescr(descr);
  }

  /// @return the elements as diffraction patterns of the same shape
  /// @throws IllegalArgumentException if the element type is not a supported pixel type
  public DiffractionPatterns toPatterns() {
    PixelType type = pixelType();
    int count = (int) elementCount(shape);
    int[] values = new int[count];
    ByteBuffer buffer = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
    for (int i = 0; i < count; i++) {
      values[i] = type.get(buffer, i * type.bytes());
    }
    return DiffractionPatterns.wrap(shape, values);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NpyArray that)) {
      return false;
    }
    return descr.equals(that.descr) && Arrays.equals(shape, that.shape) && Arrays.equals(data, that.data);
  }

  @Override
  public int hashCode() {
    return Objects.hash(descr, Arrays.hashCode(shape), Arrays.hashCode(data));
  }

  @Override
  public String toString() {
    return "NpyArray{" + descr + Arrays.toString(shape) + "}";
  }
}
