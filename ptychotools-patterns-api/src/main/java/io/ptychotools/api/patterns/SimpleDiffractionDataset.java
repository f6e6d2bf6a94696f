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


import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/// An immutable dataset over a fixed list of arrays, as produced by file readers.
/// @param metadata the dataset metadata
/// @param contentsTree a description of the source file contents
/// @param arrays the arrays, in source order
public record SimpleDiffractionDataset(
    DiffractionMetadata metadata,
    SimpleTreeNode contentsTree,
    List<DiffractionPatternArray> arrays
) implements DiffractionDataset {

  public SimpleDiffractionDataset {
    Objects.requireNonNull(metadata, "metadata cannot be null");
    Objects.requireNonNull(contentsTree, "contentsTree cannot be null");
    arrays = List.copyOf(arrays);
  }

  /// @param filePath the file path to remember, or null
  /// @return a dataset with no arrays and null metadata
  public static SimpleDiffractionDataset createNull(Path filePath) {
    return new SimpleDiffractionDataset(
        DiffractionMetadata.createNull(filePath), SimpleTreeNode.createRoot(List.of()), List.of());
  }

  @Override
  public DiffractionMetadata getMetadata() {
    return metadata;
  }

  @Override
  public SimpleTreeNode getContentsTree() {
    return contentsTree;
  }

  @Override
  public DiffractionPatternArray get(int index) {
    return arrays.get(index);
  }

  @Override
  public int size() {
    return arrays.size();
  }
}
