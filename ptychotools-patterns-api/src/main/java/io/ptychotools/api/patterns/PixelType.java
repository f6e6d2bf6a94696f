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


import java.nio.ByteBuffer;
import java.util.Arrays;

/// Element type of stored diffraction pattern pixels.
///
/// Pixels are processed as `int` values and narrowed to the element type when stored, with the
/// same wrap-around a NumPy `astype` cast would give. All access is absolute and expects a
/// little-endian buffer, so concurrent writers touching disjoint byte ranges never interfere.
///
/// `UINT32` values at or above 2^31 are carried as their bit pattern, so an `int` holding one is
/// negative. Use [#widen(int)] wherever such values are compared or summed.
public enum PixelType {
  UINT8(1, "|u1"),
  INT16(2, "<i2"),
  UINT16(2, "<u2"),
  INT32(4, "<i4"),
  UINT32(4, "<u4");

  private final int bytes;
  private final String descr;

  PixelType(int bytes, String descr) {
    this.bytes = bytes;
    this.descr = descr;
  }

  /// @return the size of one element in bytes
  public int bytes() {
    return bytes;
  }

  /// @return the NumPy array-protocol type string for this element type
  public String descr() {
    return descr;
  }

  /// Read one element
  /// @param buffer a little-endian buffer
  /// @param byteOffset absolute byte offset of the element
  /// @return the element value widened to int
  public int get(ByteBuffer buffer, int byteOffset) {
    return switch (this) {
      case UINT8 -> buffer.get(byteOffset) & 0xff;
      case INT16 -> buffer.getShort(byteOffset);
      case UINT16 -> buffer.getShort(byteOffset) & 0xffff;
      case INT32, UINT32 -> buffer.getInt(byteOffset);
    };
  }

  /// @param value an element value as returned by [#get(ByteBuffer, int)]
  /// @return the numeric value of the element; `UINT32` bit patterns are read as unsigned
  public long widen(int value) {
    return this == UINT32 ? Integer.toUnsignedLong(value) : value;
  }

  /// Write one element, narrowing the value to this type
  /// @param buffer a little-endian buffer
  /// @param byteOffset absolute byte offset of the element
  /// @param value the value to store
  public void put(ByteBuffer buffer, int byteOffset, int value) {
    switch (this) {
      case UINT8 -> buffer.put(byteOffset, (byte) value);
      case INT16, UINT16 -> buffer.putShort(byteOffset, (short) value);
      case INT32, UINT32 -> buffer.putInt(byteOffset, value);
    }
  }

  /// Find the element type for a NumPy descr string such as `<u2`
  /// @param descr the descr string; `=` and `|` byte order marks are accepted for single bytes
  /// @return the matching type
  /// @throws IllegalArgumentException if the descr is not supported
  public static PixelType fromDescr(String descr) {
    String normalized = descr.trim();
    if (normalized.equals("<u1") || normalized.equals("=u1") || normalized.equals("u1")) {
      normalized = "|u1";
    }
    for (PixelType type : values()) {
      if (type.descr.equals(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException(
        "unsupported pixel descr '" + descr + "', expected one of " + Arrays.toString(
            Arrays.stream(values()).map(PixelType::descr).toArray()));
  }

  /// Choose the narrowest unsigned element type that holds a detector's bit depth
  /// @param bitDepth detector bit depth
  /// @return UINT8, UINT16 or UINT32
  public static PixelType forBitDepth(int bitDepth) {
    if (bitDepth <= 8) {
      return UINT8;
    } else if (bitDepth <= 16) {
      return UINT16;
    }
    return UINT32;
  }
}
