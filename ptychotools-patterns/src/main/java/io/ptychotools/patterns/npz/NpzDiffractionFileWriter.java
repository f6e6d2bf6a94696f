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


import io.ptychotools.api.patterns.DiffractionDataset;
import io.ptychotools.api.patterns.DiffractionPatternArray;
import io.ptychotools.api.patterns.DiffractionPatterns;
import io.ptychotools.api.patterns.PixelType;
import io.ptychotools.api.services.DiffractionFileWriter;
import io.ptychotools.api.services.FileFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Writes the loaded patterns of a dataset as an NPZ archive with `indexes` and `patterns`
/// arrays. Frames whose pattern index is negative are not written.
@FileFormat(simpleName = "NPZ", displayName = "NumPy Zipped Archive (*.npz)", extensions = {".npz"})
public class NpzDiffractionFileWriter implements DiffractionFileWriter {
  private static final Logger logger = LogManager.getLogger(NpzDiffractionFileWriter.class);

  @Override
  public void write(Path filePath, DiffractionDataset dataset) throws IOException {
    PixelType pixelType = dataset.getMetadata().patternDataType();
    List<Long> indexes = new ArrayList<>();
    List<int[]> frames = new ArrayList<>();
    int height = 0;
    int width = 0;

    for (DiffractionPatternArray array : dataset) {
      long[] arrayIndexes = array.getIndexes();
      DiffractionPatterns data = array.getData();
      if (data.count() == 0) {
        continue;
      }
      if (frames.isEmpty()) {
        height = data.height();
        width = data.width();
      } else if (data.height() != height || data.width() != width) {
        throw new IOException("array " + array.getLabel() + " has " + data.width() + "W x " + data.height()
            + "H frames, expected " + width + "W x " + height + "H");
      }
      int frameSize = data.frameSize();
      for (int n = 0; n < Math.min(arrayIndexes.length, data.count()); n++) {
        if (arrayIndexes[n] < 0) {
          continue;
        }
        int[] frame = new int[frameSize];
        System.arraycopy(data.values(), n * frameSize, frame, 0, frameSize);
        indexes.add(arrayIndexes[n]);
        frames.add(frame);
      }
    }

    DiffractionPatterns patterns = DiffractionPatterns.zeros(frames.size(), height, width);
    for (int n = 0; n < frames.size(); n++) {
      System.arraycopy(frames.get(n), 0, patterns.values(), n * height * width, height * width);
    }
    Map<String, NpyArray> contents = new LinkedHashMap<>();
    contents.put(NpzDiffractionFileReader.INDEXES, NpyArray.ofLongs(indexes.stream().mapToLong(Long::longValue).toArray()));
    contents.put(NpzDiffractionFileReader.PATTERNS, NpyArray.ofPatterns(patterns, pixelType));
    NpzArchive.write(filePath, contents);
    logger.info("Wrote {} patterns of {}W x {}H to {}", frames.size(), width, height, filePath);
  }
}
