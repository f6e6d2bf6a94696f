package io.ptychotools.patterns.processor;

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
import io.ptychotools.api.patterns.BadPixels;
import io.ptychotools.api.patterns.DiffractionPatterns;

/// Mirror frames, first top to bottom when `flipY` is set, then left to right when `flipX` is set.
/// @param flipX reverse the column order
/// @param flipY reverse the row order
public record PatternFlip(boolean flipX, boolean flipY) implements PatternStep {

  @Override
  public ImageExtent apply(ImageExtent extent) {
    return extent;
  }

  @Override
  public DiffractionPatterns apply(DiffractionPatterns patterns) {
    int count = patterns.count();
    int width = patterns.width();
    int height = patterns.height();
    int[] in = patterns.values();
    DiffractionPatterns flipped = DiffractionPatterns.zeros(count, height, width);
    int[] out = flipped.values();
    for (int n = 0; n < count; n++) {
      for (int y = 0; y < height; y++) {
        int srcRow = (n * height + (flipY ? height - 1 - y : y)) * width;
        int dstRow = (n * height + y) * width;
        for (int x = 0; x < width; x++) {
          out[dstRow + x] = in[srcRow + (flipX ? width - 1 - x : x)];
        }
      }
    }
    return flipped;
  }

  @Override
  public BadPixels apply(BadPixels badPixels) {
    ImageExtent extent = badPixels.extent();
    int width = extent.widthInPixels();
    int height = extent.heightInPixels();
    boolean[] mask = new boolean[extent.size()];
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        mask[y * width + x] = badPixels.isBad(flipX ? width - 1 - x : x, flipY ? height - 1 - y : y);
      }
    }
    return BadPixels.of(extent, mask);
  }
}
