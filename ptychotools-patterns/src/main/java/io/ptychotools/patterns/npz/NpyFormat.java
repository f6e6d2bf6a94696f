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


import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Encoder and decoder for the NumPy `.npy` array file format.
///
/// Arrays are written as format version 1.0 with the header padded so the data starts on a
/// 64 byte boundary. Versions 1.0, 2.0 and 3.0 can be read. Only little-endian, C-ordered arrays
/// are supported.
public final class NpyFormat {

  private static final byte[] MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y'};
  private static final int ALIGNMENT = 64;

  private static final Pattern DESCR = Pattern.compile("'descr'\\s*:\\s*'([^']*)'");
  private static final Pattern FORTRAN_ORDER = Pattern.compile("'fortran_order'\\s*:\\s*(True|False)");
  private static final Pattern SHAPE = Pattern.compile("'shape'\\s*:\\s*\\(([^)]*)\\)");

  private NpyFormat() {
  }

  /// Element type and shape of an npy array, as found in its header.
  /// @param descr the NumPy type string
  /// @param shape the dimensions, outermost first
  public record Header(String descr, int[] shape) {

    public Header {
      Objects.requireNonNull(descr, "descr cannot be null");
      shape = shape.clone();
    }

    /// @return the number of data bytes that follow the header
    /// @throws IllegalArgumentException if the descr is not supported
    public long dataBytes() {
      return NpyArray.elementCount(shape) * NpyArray.itemSize(descr);
    }

    @Override
    public int[] shape() {
      return shape.clone();
    }
  }

  /// @param array the array to encode
  /// @param out the stream to write to; not closed
  /// @throws IOException if the stream fails
  public static void write(NpyArray array, OutputStream out) throws IOException {
    writeHeader(new Header(array.descr(), array.shape()), out);
    out.write(array.data());
  }

  /// Write only the magic string and header; exactly [Header#dataBytes()] little-endian,
  /// C-ordered bytes must follow.
  /// @param header element type and shape of the data
  /// @param out the stream to write to; not closed
  /// @throws IOException if the stream fails
  public static void writeHeader(Header header, OutputStream out) throws IOException {
    StringBuilder text = new StringBuilder()
        .append("{'descr': '").append(header.descr())
        .append("', 'fortran_order': False, 'shape': ")
        .append(shapeText(header.shape()))
        .append(", }");
    int preamble = MAGIC.length + 2 + 2;
    int total = preamble + text.length() + 1;
    int padding = (ALIGNMENT - total % ALIGNMENT) % ALIGNMENT;
    text.append(" ".repeat(padding)).append('\n');
    byte[] headerBytes = text.toString().getBytes(StandardCharsets.US_ASCII);
    if (headerBytes.length > 0xffff) {
      throw new IOException("npy header too long: " + headerBytes.length + " bytes");
    }

    ByteBuffer prefix = ByteBuffer.allocate(preamble).order(ByteOrder.LITTLE_ENDIAN);
    prefix.put(MAGIC).put((byte) 1).put((byte) 0).putShort((short) headerBytes.length);
    out.write(prefix.array());
    out.write(headerBytes);
  }

  /// @param in the stream to read from; not closed
  /// @return the decoded array
  /// @throws IOException if the stream fails or does not hold a supported npy array
  public static NpyArray read(InputStream in) throws IOException {
    return readData(readHeader(in), in);
  }

  /// Read the data that follows a header read by [#readHeader(InputStream)]
  /// @param header the element type and shape
  /// @param in the stream positioned at the first data byte; not closed
  /// @return the decoded array
  /// @throws IOException if the stream ends early or the data does not fit in one Java array
  public static NpyArray readData(Header header, InputStream in) throws IOException {
    long byteCount = header.dataBytes();
    if (byteCount > Integer.MAX_VALUE - 8) {
      throw new IOException("npy array of " + byteCount + " bytes is too large to load");
    }
    byte[] values = new byte[(int) byteCount];
    readFully(new DataInputStream(in), values, "array data");
    return new NpyArray(header.descr(), header.shape(), values);
  }

  /// Read the magic string and header, leaving the stream at the first data byte
  /// @param in the stream to read from; not closed
  /// @return the element type and shape
  /// @throws IOException if the stream fails or does not hold a supported npy array
  public static Header readHeader(InputStream in) throws IOException {
    DataInputStream data = new DataInputStream(in);
    byte[] magic = new byte[MAGIC.length];
    readFully(data, magic, "magic string");
    for (int i = 0; i < MAGIC.length; i++) {
      if (magic[i] != MAGIC[i]) {
        throw new IOException("not an npy array: bad magic string");
      }
    }
    int major = data.readUnsignedByte();
    data.readUnsignedByte();

    int headerLength;
    if (major == 1) {
      byte[] length = new byte[2];
      readFully(data, length, "header length");
      headerLength = ByteBuffer.wrap(length).order(ByteOrder.LITTLE_ENDIAN).getShort() & 0xffff;
    } else if (major == 2 || major == 3) {
      byte[] length = new byte[4];
      readFully(data, length, "header length");
      headerLength = ByteBuffer.wrap(length).order(ByteOrder.LITTLE_ENDIAN).getInt();
    } else {
      throw new IOException("unsupported npy format version " + major);
    }
    if (headerLength < 0) {
      throw new IOException("invalid npy header length " + headerLength);
    }
    byte[] headerBytes = new byte[headerLength];
    readFully(data, headerBytes, "header");
    String text = new String(headerBytes, major == 3 ? StandardCharsets.UTF_8 : StandardCharsets.ISO_8859_1);

    String descr = group(DESCR, text, "descr");
    if (descr.startsWith(">")) {
      throw new IOException("big-endian npy arrays are not supported: " + descr);
    }
    if (group(FORTRAN_ORDER, text, "fortran_order").equals("True")) {
      throw new IOException("Fortran-ordered npy arrays are not supported");
    }
    Header header = new Header(descr, parseShape(group(SHAPE, text, "shape")));
    try {
      header.dataBytes();
    } catch (IllegalArgumentException e) {
      throw new IOException(e.getMessage(), e);
    }
    return header;
  }

  static String shapeText(int[] shape) {
    StringBuilder sb = new StringBuilder("(");
    for (int i = 0; i < shape.length; i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(shape[i]);
    }
    if (shape.length == 1) {
      sb.append(',');
    }
    return sb.append(')').toString();
  }

  static int[] parseShape(String text) throws IOException {
    String trimmed = text.trim();
    if (trimmed.isEmpty()) {
      return new int[0];
    }
    String[] parts = trimmed.split(",");
    int count = parts[parts.length - 1].isBlank() ? parts.length - 1 : parts.length;
    int[] shape = new int[count];
    for (int i = 0; i < count; i++) {
      String part = parts[i].trim().replace("L", "");
      try {
        shape[i] = Integer.parseInt(part);
      } catch (NumberFormatException e) {
        throw new IOException("invalid npy shape (" + text + ")", e);
      }
      if (shape[i] < 0) {
        throw new IOException("invalid npy shape (" + text + ")");
      }
    }
    return shape;
  }

  private static String group(Pattern pattern, String header, String key) throws IOException {
    Matcher matcher = pattern.matcher(header);
    if (!matcher.find()) {
      throw new IOException("npy header has no " + key + ": " + header.trim());
    }
    return matcher.group(1);
  }

  private static void readFully(DataInputStream in, byte[] target, String what) throws IOException {
    try {
      in.readFully(target);
    } catch (EOFException e) {
      throw new IOException("truncated npy array while reading " + what, e);
    }
  }
}
