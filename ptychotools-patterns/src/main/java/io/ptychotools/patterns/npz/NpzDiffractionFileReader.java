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


import io.ptychotools.api.geometry.ImageExtent;
import io.ptychotools.api.patterns.DiffractionDataset;
import io.ptychotools.api.patterns.DiffractionMetadata;
import io.ptychotools.api.patterns.DiffractionPatternArray;
import io.ptychotools.api.patterns.DiffractionPatterns;
import io.ptychotools.api.patterns.SimpleDiffractionDataset;
import io.ptychotools.api.patterns.SimpleDiffractionPatternArray;
import io.ptychotools.api.patterns.SimpleTreeNode;
import io.ptychotools.api.services.DiffractionFileReader;
import io.ptychotools.api.services.FileFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/// Reads an NPZ archive holding a `patterns` array of shape `(N, H, W)` and an optional
/// `indexes` array of N pattern indexes. Without `indexes` the patterns are numbered from 0.
@FileFormat(simpleName = "NPZ", displayName = "NumPy Zipped Archive (*.npz)", extensions = {".npz"})
public class NpzDiffractionFileReader implements DiffractionFileReader {
  private static final Logger logger = LogManager.getLogger(NpzDiffractionFileReader.class);

  public static final String PATTERNS = "patterns";
  public static final String INDEXES = "indexes";

  @Override
  public DiffractionDataset read(Path filePath) throws IOException {
    Map<String, NpyArray> contents = NpzArchive.read(filePath);

    SimpleTreeNode tree = SimpleTreeNode.createRoot(List.of("Name", "Type", "Details"));
    contents.forEach((name, array) ->
        tree.createChild(List.of(name, array.descr(), NpyFormat.shapeText(array.shape()))));

    NpyArray patternsArray = contents.get(PATTERNS);
    if (patternsArray == null) {
      throw new IOException(filePath + " has no '" + PATTERNS + "' array, found " + contents.keySet());
    }
    if (patternsArray.rank() != 3) {
      throw new IOException(filePath + ": '" + PATTERNS + "' must have rank 3, shape is "
          + Arrays.toString(patternsArray.shape()));
    }
    DiffractionPatterns patterns;
    try {
      patterns = patternsArray.toPatterns();
    } catch (IllegalArgumentException e) {
      throw new IOException(filePath + ": " + e.getMessage(), e);
    }

    long[] indexes;
    NpyArray indexesArray = contents.get(INDEXES);
    if (indexesArray == null) {
      logger.debug("{} has no '{}' array, numbering patterns from 0", filePath, INDEXES);
      indexes = SimpleDiffractionPatternArray.indexRange(0, patterns.count());
    } else {
      try {
        indexes = indexesArray.toLongs();
      } catch (IllegalArgumentException e) {
        throw new IOException(filePath + ": " + e.getMessage(), e);
      }
      if (indexes.length != patterns.count()) {
        throw new IOException(filePath + ": " + indexes.length + " indexes for " + patterns.count() + " patterns");
      }
    }

    DiffractionMetadata metadata = DiffractionMetadata
        .builder(patterns.count(), patterns.count(), patternsArray.pixelType())
        .detectorExtent(new ImageExtent(patterns.width(), patterns.height()))
        .filePath(filePath)
        .build();
    DiffractionPatternArray array =
        new SimpleDiffractionPatternArray(DiffractionMetadata.fileStem(filePath), indexes, patterns);
    return new SimpleDiffractionDataset(metadata, tree, List.of(array));
  }
}
