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

/// One unit of pattern data: a stack of frames with the global pattern index of each frame.
///
/// Source arrays come from file readers or live acquisition and may load their data lazily.
/// Assembled arrays are read-only views into a shared pattern buffer.
public interface DiffractionPatternArray {

  /// @return a human readable label, usually derived from the file or acquisition
  String getLabel();

  /// @return the global pattern index of each frame, in frame order
  long[] getIndexes();

  /// Load or view the frames
  /// @return frames as a `(count, height, width)` block
  /// @throws IOException if lazily loaded data cannot be read
  DiffractionPatterns getData() throws IOException;

  default PatternState getState() {
    return PatternState.UNKNOWN;
  }

  default int getNumberOfPatterns() {
    return getIndexes().length;
  }
}
