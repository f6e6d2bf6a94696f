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


import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;

/// Reads and writes NPZ archives, zip files of named `.npy` arrays as written by `numpy.savez`.
///
/// [#write(Path, Map)] and [#read(Path)] move whole arrays through memory. A [Writer] and
/// [#readArray(Path, String, ArrayReader)] stream one array at a time, for arrays too large to
/// hold in a single Java array.
public final class NpzArchive {

  private static final String SUFFIX = ".npy";

  private NpzArchive() {
  }

  /// Produces the data bytes of one array entry.
  @FunctionalInterface
  public interface ArrayData {
    void writeTo(OutputStream out) throws IOException;
  }

  /// Consumes one array entry, positioned at its first data byte.
  /// @param <T> the result type
  @FunctionalInterface
  public interface ArrayReader<T> {
    T read(NpyFormat.Header header, InputStream data) throws IOException;
  }

  /// @param path the archive to create or replace
  /// @param arrays arrays by name, without the `.npy` suffix
  /// @throws IOException if the archive cannot be written
  public static void write(Path path, Map<String, NpyArray> arrays) throws IOException {
    try (Writer writer = create(path)) {
      for (Map.Entry<String, NpyArray> entry : arrays.entrySet()) {
        writer.putArray(entry.getKey(), entry.getValue());
      }
    }
  }

  /// @param path the archive to create or replace
  /// @return a writer that adds entries in call order
  /// @throws IOException if the file cannot be created
  public static Writer create(Path path) throws IOException {
    return new Writer(new ZipOutputStream(new BufferedOutputStream(Files.newOutputStream(path))));
  }

  /// @param path the archive to read
  /// @return arrays by name, without the `.npy` suffix, in archive order
  /// @throws IOException if the archive cannot be read or holds a malformed array
  public static Map<String, NpyArray> read(Path path) throws IOException {
    Map<String, NpyArray> arrays = new LinkedHashMap<>();
    try (ZipFile zip = new ZipFile(path.toFile())) {
      Enumeration<? extends ZipEntry> entries = zip.entries();
      while (entries.hasMoreElements()) {
        ZipEntry entry = entries.nextElement();
        if (entry.isDirectory() || !entry.getName().endsWith(SUFFIX)) {
          continue;
        }
        String name = entry.getName().substring(0, entry.getName().length() - SUFFIX.length());
        try (InputStream in = zip.getInputStream(entry)) {
          arrays.put(name, NpyFormat.read(in));
        } catch (IOException e) {
          throw new IOException("unable to read " + entry.getName() + " from " + path + ": " + e.getMessage(), e);
        }
      }
    }
    return arrays;
  }

  /// Stream one array of an archive
  /// @param path the archive to read
  /// @param name the array name, without the `.npy` suffix
  /// @param reader consumes the header and data of the array
  /// @param <T> the result type
  /// @return the reader's result, or empty if the archive has no such array
  /// @throws IOException if the archive cannot be read or the reader fails
  public static <T> Optional<T> readArray(Path path, String name, ArrayReader<T> reader) throws IOException {
    try (ZipFile zip = new ZipFile(path.toFile())) {
      ZipEntry entry = zip.getEntry(name + SUFFIX);
      if (entry == null || entry.isDirectory()) {
        return Optional.empty();
      }
      try (InputStream in = new BufferedInputStream(zip.getInputStream(entry))) {
        return Optional.of(reader.read(NpyFormat.readHeader(in), in));
      } catch (IOException e) {
        throw new IOException("unable to read " + entry.getName() + " from " + path + ": " + e.getMessage(), e);
      }
    }
  }

  /// Adds `.npy` entries to a new archive one at a time.
  public static final class Writer implements Closeable {
    private final ZipOutputStream zip;

    private Writer(ZipOutputStream zip) {
      this.zip = zip;
    }

    /// @param name the array name, without the `.npy` suffix
    /// @param array the array
    /// @throws IOException if the entry cannot be written
    public void putArray(String name, NpyArray array) throws IOException {
      zip.putNextEntry(new ZipEntry(name + SUFFIX));
      NpyFormat.write(array, zip);
      zip.closeEntry();
    }

    /// Write an array whose data is produced in pieces
    /// @param name the array name, without the `.npy` suffix
    /// @param header element type and shape
    /// @param data writes exactly [NpyFormat.Header#dataBytes()] bytes
    /// @throws IOException if the entry cannot be written or the data has the wrong length
    public void putArray(String name, NpyFormat.Header header, ArrayData data) throws IOException {
      zip.putNextEntry(new ZipEntry(name + SUFFIX));
      NpyFormat.writeHeader(header, zip);
      CountingOutputStream counted = new CountingOutputStream(zip);
      data.writeTo(counted);
      if (counted.count != header.dataBytes()) {
        throw new IOException("array " + name + " needs " + header.dataBytes() + " data bytes, got " + counted.count);
      }
      zip.closeEntry();
    }

    @Override
    public void close() throws IOException {
      zip.close();
    }
  }

  private static final class CountingOutputStream extends FilterOutputStream {
    private long count;

    CountingOutputStream(OutputStream out) {
      super(out);
    }

    @Override
    public void write(int b) throws IOException {
      out.write(b);
      count++;
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
      out.write(b, off, len);
      count += len;
    }
  }
}
