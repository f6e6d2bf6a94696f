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


import java.util.Iterator;
import java.util.NoSuchElementException;

/// An ordered sequence of pattern arrays with the metadata that describes them.
public interface DiffractionDataset extends Iterable<DiffractionPatternArray> {

  DiffractionMetadata getMetadata();

  SimpleTreeNode getContentsTree();

  /// @param index position of the array in this dataset
  /// @return the array at that position
  /// @throws IndexOutOfBoundsException if the position is out of range
  DiffractionPatternArray get(int index);

  /// @return the number of arrays
  int size();

  default boolean isEmpty() {
    return size() == 0;
  }

  @Override
  default Iterator<DiffractionPatternArray> iterator() {
    return new Iterator<>() {
      private int next = 0;

      @Override
      public boolean hasNext() {
        return next < size();
      }

      @Override
      public DiffractionPatternArray next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        return get(next++);
      }
    };
  }
}
