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


/// A change to an [AssembledDiffractionDataset], delivered to [DiffractionDatasetObserver]s.
/// @param kind what changed
/// @param index the source array position for [Kind#INSERTED] and [Kind#CHANGED], -1 for
///     [Kind#RELOADED]
public record DatasetEvent(Kind kind, int index) {

  /// Kinds of dataset change
  public enum Kind {
    /// A source array was appended; its rows are not loaded yet
    INSERTED,
    /// The rows of a source array were written
    CHANGED,
    /// The whole dataset was replaced or cleared
    RELOADED
  }

  public static DatasetEvent inserted(int index) {
    return new DatasetEvent(Kind.INSERTED, index);
  }

  public static DatasetEvent changed(int index) {
    return new DatasetEvent(Kind.CHANGED, index);
  }

  public static DatasetEvent reloaded() {
    return new DatasetEvent(Kind.RELOADED, -1);
  }
}
