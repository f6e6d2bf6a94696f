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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;

/// Fixed-size store of processed frames, `rows x height x width` elements of one [PixelType].
///
/// The store is split into segments of whole rows, each a little-endian [ByteBuffer] that is
/// either on the heap or mapped from a scratch file. All access uses absolute offsets, so threads
/// writing disjoint rows need no locking.
///
/// Closing a mapped buffer deletes its scratch file. The mapping itself is released when the
/// segments are garbage collected.
public final class PatternBuffer implements AutoCloseable {
  private static final Logger logger = LogManager.getLogger(PatternBuffer.class);

  static final long MAX_SEGMENT_BYTES = 1L << 30;
  private static final int COPY_CHUNK_BYTES = 1 << 16;

  private final int rows;
  private final ImageExtent frameExtent;
  private final PixelType pixelType;
  private final int rowBytes;
  private final int rowsPerSegment;
  private final Path scratchFile;
  private volatile ByteBuffer[] segments;

  private PatternBuffer(int rows, ImageExtent frameExtent, PixelType pixelType, long maxSegmentBytes,
                        Path scratchFile, ByteBuffer[] segments) {
    this.rows = rows;
    this.frameExtent = frameExtent;
    this.pixelType = pixelType;
    this.rowBytes = rowBytes(frameExtent, pixelType);
    this.rowsPerSegment = rowsPerSegment(rowBytes, maxSegmentBytes);
    this.scratchFile = scratchFile;
    this.segments = segments;
  }

  /// @return a buffer with no rows
  public static PatternBuffer empty() {
    return new PatternBuffer(0, new ImageExtent(0, 0), PixelType.UINT8, MAX_SEGMENT_BYTES, null, new ByteBuffer[0]);
  }

  /// Allocate a zeroed heap buffer
  /// @param rows number of frames
  /// @param frameExtent processed frame extent
  /// @param pixelType element type
  /// @return the buffer
  public static PatternBuffer allocate(int rows, ImageExtent frameExtent, PixelType pixelType) {
    return allocate(rows, frameExtent, pixelType, MAX_SEGMENT_BYTES);
  }

  static PatternBuffer allocate(int rows, ImageExtent frameExtent, PixelType pixelType, long maxSegmentBytes) {
    int rowBytes = rowBytes(frameExtent, pixelType);
    int perSegment = rowsPerSegment(rowBytes, maxSegmentBytes);
    ByteBuffer[] segments = new ByteBuffer[segmentCount(rows, perSegment)];
    for (int i = 0; i < segments.length; i++) {
      int segmentRows = Math.min(perSegment, rows - i * perSegment);
      segments[i] = ByteBuffer.allocate(segmentRows * rowBytes).order(ByteOrder.LITTLE_ENDIAN);
    }
    return new PatternBuffer(rows, frameExtent, pixelType, maxSegmentBytes, null, segments);
  }

  /// Create a zeroed buffer backed by a new scratch file
  ///
  /// The file is readable and writable only by its owner where the file system supports POSIX
  /// permissions, and is deleted on [#close()] or at JVM exit.
  /// @param rows number of frames
  /// @param frameExtent processed frame extent
  /// @param pixelType element type
  /// @param scratchDirectory directory for the scratch file, created if missing
  /// @return the buffer
  /// @throws IOException if the file cannot be created, sized or mapped
  public static PatternBuffer map(int rows, ImageExtent frameExtent, PixelType pixelType, Path scratchDirectory)
      throws IOException {
    return map(rows, frameExtent, pixelType, scratchDirectory, MAX_SEGMENT_BYTES);
  }

  static PatternBuffer map(int rows, ImageExtent frameExtent, PixelType pixelType, Path scratchDirectory,
                           long maxSegmentBytes) throws IOException {
    int rowBytes = rowBytes(frameExtent, pixelType);
    int perSegment = rowsPerSegment(rowBytes, maxSegmentBytes);
    long totalBytes = (long) rows * rowBytes;

    Files.createDirectories(scratchDirectory);
    Path file;
    if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
      file = Files.createTempFile(scratchDirectory, "patterns-", ".bin",
          PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rw-------")));
    } else {
      file = Files.createTempFile(scratchDirectory, "patterns-", ".bin");
    }
    file.toFile().deleteOnExit();

    try (RandomAccessFile randomAccessFile = new RandomAccessFile(file.toFile(), "rw");
         FileChannel channel = randomAccessFile.getChannel()) {
      randomAccessFile.setLength(totalBytes);
      ByteBuffer[] segments = new ByteBuffer[segmentCount(rows, perSegment)];
      for (int i = 0; i < segments.length; i++) {
        long offset = (long) i * perSegment * rowBytes;
        int segmentRows = Math.min(perSegment, rows - i * perSegment);
        segments[i] = channel.map(FileChannel.MapMode.READ_WRITE, offset, (long) segmentRows * rowBytes)
            .order(ByteOrder.LITTLE_ENDIAN);
      }
      logger.info("Mapped {} bytes of pattern data to {}", totalBytes, file);
      return new PatternBuffer(rows, frameExtent, pixelType, maxSegmentBytes, file, segments);
    } catch (IOException | RuntimeException e) {
      Files.deleteIfExists(file);
      throw e;
    }
  }

  private static int rowBytes(ImageExtent frameExtent, PixelType pixelType) {
    long bytes = (long) frameExtent.widthInPixels() * frameExtent.heightInPixels() * pixelType.bytes();
    if (bytes > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("a single " + frameExtent + " frame of " + pixelType + " is too large");
    }
    return (int) bytes;
  }

  private static int rowsPerSegment(int rowBytes, long maxSegmentBytes) {
    if (rowBytes == 0) {
      return Integer.MAX_VALUE;
    }
    return (int) Math.max(1L, Math.min(Integer.MAX_VALUE, maxSegmentBytes / rowBytes));
  }

  private static int segmentCount(int rows, int rowsPerSegment) {
    if (rows == 0) {
      return 0;
    }
    return (int) (((long) rows + rowsPerSegment - 1) / rowsPerSegment);
  }

  public int rows() {
    return rows;
  }

  public ImageExtent frameExtent() {
    return frameExtent;
  }

  public PixelType pixelType() {
    return pixelType;
  }

  /// @return the `(rows, height, width)` shape
  public int[] shape() {
    return new int[]{rows, frameExtent.heightInPixels(), frameExtent.widthInPixels()};
  }

  public boolean isMapped() {
    return scratchFile != null;
  }

  public Optional<Path> getScratchFile() {
    return Optional.ofNullable(scratchFile);
  }

  int segmentCount() {
    ByteBuffer[] current = segments;
    return current == null ? 0 : current.length;
  }

  /// @return total bytes of pixel data
  public long sizeInBytes() {
    return (long) rows * rowBytes;
  }

  /// Store consecutive frames
  /// @param firstRow row of the first frame
  /// @param patterns a `(count, height, width)` batch of this buffer's frame extent
  /// @throws IndexOutOfBoundsException if the rows are outside the buffer
  /// @throws IllegalArgumentException if the frame extent differs
  public void writeRows(int firstRow, DiffractionPatterns patterns) {
    if (patterns.width() != frameExtent.widthInPixels() || patterns.height() != frameExtent.heightInPixels()) {
      throw new IllegalArgumentException(
          "frames of " + patterns.width() + "W x " + patterns.height() + "H do not fit buffer frames of " + frameExtent);
    }
    checkRows(firstRow, patterns.count());
    int[] values = patterns.values();
    int frameSize = frameExtent.size();
    int elementBytes = pixelType.bytes();
    ByteBuffer[] current = segments;
    for (int n = 0; n < patterns.count(); n++) {
      int row = firstRow + n;
      ByteBuffer segment = current[row / rowsPerSegment];
      int base = (row % rowsPerSegment) * rowBytes;
      int src = n * frameSize;
      for (int i = 0; i < frameSize; i++) {
        pixelType.put(segment, base + i * elementBytes, values[src + i]);
      }
    }
  }

  /// Load consecutive frames
  /// @param firstRow row of the first frame
  /// @param count number of frames
  /// @return a new `(count, height, width)` batch
  public DiffractionPatterns readRows(int firstRow, int count) {
    checkRows(firstRow, count);
    DiffractionPatterns patterns = DiffractionPatterns.zeros(count, frameExtent.heightInPixels(), frameExtent.widthInPixels());
    int[] values = patterns.values();
    int frameSize = frameExtent.size();
    int elementBytes = pixelType.bytes();
    ByteBuffer[] current = segments;
    for (int n = 0; n < count; n++) {
      int row = firstRow + n;
      ByteBuffer segment = current[row / rowsPerSegment];
      int base = (row % rowsPerSegment) * rowBytes;
      int dst = n * frameSize;
      for (int i = 0; i < frameSize; i++) {
        values[dst + i] = pixelType.get(segment, base + i * elementBytes);
      }
    }
    return patterns;
  }

  /// Load a selection of frames in the given order
  /// @param rowNumbers rows to read
  /// @return a new `(rowNumbers.length, height, width)` batch
  public DiffractionPatterns readRows(int[] rowNumbers) {
    DiffractionPatterns patterns = DiffractionPatterns.zeros(
        rowNumbers.length, frameExtent.heightInPixels(), frameExtent.widthInPixels());
    int frameSize = frameExtent.size();
    for (int n = 0; n < rowNumbers.length; n++) {
      DiffractionPatterns row = readRows(rowNumbers[n], 1);
      System.arraycopy(row.values(), 0, patterns.values(), n * frameSize, frameSize);
    }
    return patterns;
  }

  /// Write the stored little-endian bytes of one row, as they appear in an npy array of this
  /// buffer's pixel type
  /// @param row the row
  /// @param out the stream to write to; not closed
  /// @throws IOException if the stream fails
  public void copyRowTo(int row, OutputStream out) throws IOException {
    checkRows(row, 1);
    ByteBuffer view = rowView(row);
    if (view.hasArray()) {
      out.write(view.array(), view.arrayOffset() + view.position(), rowBytes);
      return;
    }
    byte[] chunk = new byte[Math.min(rowBytes, COPY_CHUNK_BYTES)];
    while (view.hasRemaining()) {
      int length = Math.min(chunk.length, view.remaining());
      view.get(chunk, 0, length);
      out.write(chunk, 0, length);
    }
  }

  /// Fill one row from little-endian bytes of this buffer's pixel type
  /// @param row the row
  /// @param in the stream to read exactly one row of bytes from; not closed
  /// @throws IOException if the stream fails or ends early
  public void copyRowFrom(int row, InputStream in) throws IOException {
    checkRows(row, 1);
    ByteBuffer view = rowView(row);
    byte[] chunk = new byte[Math.min(rowBytes, COPY_CHUNK_BYTES)];
    while (view.hasRemaining()) {
      int length = Math.min(chunk.length, view.remaining());
      if (in.readNBytes(chunk, 0, length) != length) {
        throw new EOFException("stream ended inside row " + row + " of " + rows);
      }
      view.put(chunk, 0, length);
    }
  }

  private ByteBuffer rowView(int row) {
    ByteBuffer[] current = segments;
    if (current == null) {
      throw new IllegalStateException("pattern buffer is closed");
    }
    ByteBuffer segment = current[row / rowsPerSegment];
    int base = (row % rowsPerSegment) * rowBytes;
    return segment.duplicate().position(base).limit(base + rowBytes);
  }

  private void checkRows(int firstRow, int count) {
    if (segments == null) {
      throw new IllegalStateException("pattern buffer is closed");
    }
    if (firstRow < 0 || count < 0 || (long) firstRow + count > rows) {
      throw new IndexOutOfBoundsException(
          "rows [" + firstRow + ", " + ((long) firstRow + count) + ") outside buffer of " + rows + " rows");
    }
  }

  @Override
  public void close() throws IOException {
    if (segments == null) {
      return;
    }
    segments = null;
    if (scratchFile != null) {
      Files.deleteIfExists(scratchFile);
      logger.debug("Deleted pattern scratch file {}", scratchFile);
    }
  }

  @Override
  public String toString() {
    return "PatternBuffer{" + rows + " x " + frameExtent + ", " + pixelType + (isMapped() ? ", mapped to " + scratchFile : "") + "}";
  }
}
