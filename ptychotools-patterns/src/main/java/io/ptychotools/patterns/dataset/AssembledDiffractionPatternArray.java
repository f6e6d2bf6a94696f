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


import io.ptychotools.api.patterns.DiffractionPatternArray;
import io.ptychotools.api.patterns.DiffractionPatterns;
import io.ptychotools.api.patterns.PatternState;
import io.ptychotools.api.patterns.PixelType;

import java.util.Arrays;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;
import java.util.stream.IntStream;

/// Read-only view of the buffer rows owned by one source array.
///
/// The view reads through to the shared buffer and index array, so it reflects assembly as it
/// happens. It reports [PatternState#LOADING] until the rows of its source array are written.
public class AssembledDiffractionPatternArray implements DiffractionPatternArray {

  private final String label;
  private final int arrayIndex;
  private final int firstRow;
  private final int rowCount;
  private final long[] indexes;
  private final PatternBuffer buffer;
  private final Lock indexLock;
  private final Supplier<boolean[]> goodPixels;
  private volatile PatternState state;

  AssembledDiffractionPatternArray(String label, int arrayIndex, int firstRow, int rowCount, long[] indexes,
                                   PatternBuffer buffer, Lock indexLock, Supplier<boolean[]> goodPixels,
                                   PatternState state) {
    this.label = label;
    this.arrayIndex = arrayIndex;
    this.firstRow = firstRow;
    this.rowCount = rowCount;
    this.indexes = indexes;
    this.buffer = buffer;
    this.indexLock = indexLock;
    this.goodPixels = goodPixels;
    this.state = state;
  }

  @Override
  public String getLabel() {
    return label;
  }

  /// @return position of the source array in the dataset
  public int getArrayIndex() {
    return arrayIndex;
  }

  public int getFirstRow() {
    return firstRow;
  }

  /// @return pattern index of each row of this view, -1 for rows not yet loaded
  @Override
  public long[] getIndexes() {
    indexLock.lock();
    try {
      return Arrays.copyOfRange(indexes, firstRow, firstRow + rowCount);
    } finally {
      indexLock.unlock();
    }
  }

  @Override
  public int getNumberOfPatterns() {
    return rowCount;
  }

  @Override
  public DiffractionPatterns getData() {
    return buffer.readRows(firstRow, rowCount);
  }

  @Override
  public PatternState getState() {
    return state;
  }

  void markLoaded() {
    state = PatternState.LOADED;
  }

  /// @param index row within this view
  /// @return the frame at that row
  public DiffractionPatterns getPattern(int index) {
    checkIndex(index);
    return buffer.readRows(firstRow + index, 1);
  }

  /// @param index row within this view
  /// @return the summed counts of the good pixels of that frame
  public long getPatternCounts(int index) {
    return getPattern(index).frameCounts(0, goodPixels.get(), buffer.pixelType());
  }

  /// @return the pixel-wise mean over all rows of this view, row-major
  public double[] getAveragePattern() {
    PixelType pixelType = buffer.pixelType();
    int frameSize = buffer.frameExtent().size();
    double[] average = new double[frameSize];
    if (rowCount == 0) {
      return average;
    }
    for (int n = 0; n < rowCount; n++) {
      int[] values = getPattern(n).values();
      for (int i = 0; i < frameSize; i++) {
        average[i] += pixelType.widen(values[i]);
      }
    }
    for (int i = 0; i < frameSize; i++) {
      average[i] /= rowCount;
    }
    return average;
  }

  /// @return the mean counts of loaded rows, or 0 when none are loaded
  public double getMeanPatternCounts() {
    return Arrays.stream(loadedCounts()).average().orElse(0.0);
  }

  /// @return the largest counts of a loaded row, or 0 when none are loaded
  public long getMaxPatternCounts() {
    return Arrays.stream(loadedCounts()).max().orElse(0L);
  }

  private long[] loadedCounts() {
    long[] rowIndexes = getIndexes();
    boolean[] good = goodPixels.get();
    PixelType pixelType = buffer.pixelType();
    return IntStream.range(0, rowCount)
        .filter(n -> rowIndexes[n] >= 0)
        .mapToLong(n -> getPattern(n).frameCounts(0, good, pixelType))
        .toArray();
  }

  private void checkIndex(int index) {
    if (index < 0 || index >= rowCount) {
      throw new IndexOutOfBoundsException("pattern " + index + " outside array of " + rowCount);
    }
  }

  @Override
  public String toString() {
    return "AssembledDiffractionPatternArray{" + label + ", array=" + arrayIndex + ", rows=[" + firstRow + ", "
        + (firstRow + rowCount) + "), " + state + "}";
  }
}
