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


import java.io.IOException;
import java.util.Objects;

/// A source array whose frames are either held in memory or loaded on demand.
///
/// Lazy arrays defer the read to [#getData()], which is called from a loader worker thread,
/// so file readers can hand over many arrays without reading any pixels up front.
public class SimpleDiffractionPatternArray implements DiffractionPatternArray {

  /// Reads the frames of one lazily loaded array.
  @FunctionalInterface
  public interface PatternSource {
    DiffractionPatterns read() throws IOException;
  }

  private final String label;
  private final long[] indexes;
  private final PatternSource source;

  /// Create an in-memory array
  /// @param label the array label
  /// @param indexes global pattern index of each frame
  /// @param data the frames
  public SimpleDiffractionPatternArray(String label, long[] indexes, DiffractionPatterns data) {
    this(label, indexes, constant(Objects.requireNonNull(data, "data cannot be null")));
  }

  private SimpleDiffractionPatternArray(String label, long[] indexes, PatternSource source) {
    this.label = Objects.requireNonNull(label, "label cannot be null");
    this.indexes = Objects.requireNonNull(indexes, "indexes cannot be null").clone();
    this.source = source;
  }

  /// Create an array that reads its frames when first asked
  /// @param label the array label
  /// @param indexes global pattern index of each frame
  /// @param source reads the frames; may throw on I/O failure
  /// @return a lazily loaded array
  public static SimpleDiffractionPatternArray lazy(String label, long[] indexes, PatternSource source) {
    return new SimpleDiffractionPatternArray(label, indexes, Objects.requireNonNull(source, "source cannot be null"));
  }

  /// Create a contiguous range of pattern indexes
  /// @param first the first global index
  /// @param count the number of indexes
  /// @return `{first, first + 1, ..., first + count - 1}`
  public static long[] indexRange(long first, int count) {
    long[] indexes = new long[count];
    for (int i = 0; i < count; i++) {
      indexes[i] = first + i;
    }
    return indexes;
  }

  private static PatternSource constant(DiffractionPatterns data) {
    return () -> data;
  }

  @Override
  public String getLabel() {
    return label;
  }

  @Override
  public long[] getIndexes() {
    return indexes.clone();
  }

  @Override
  public DiffractionPatterns getData() throws IOException {
    return source.read();
  }

  @Override
  public int getNumberOfPatterns() {
    return indexes.length;
  }

  @Override
  public String toString() {
    return "SimpleDiffractionPatternArray{" + label + ", patterns=" + indexes.length + "}";
  }
}
