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

import java.util.Arrays;

/// Sum pixels over `binSizeX x binSizeY` blocks.
///
/// The frame width and height must be exact multiples of the bin sizes. A binned mask pixel is
/// bad only when every pixel of its block is bad.
/// @param binSizeX block width
/// @param binSizeY block height
public record PatternBinning(int binSizeX, int binSizeY) implements PatternStep {

  public PatternBinning {
    if (binSizeX < 1 || binSizeY < 1) {
      throw new PatternConfigurationException(
          "bin sizes must be positive, got " + binSizeX + "x" + binSizeY);
    }
  }

  @Override
  public ImageExtent apply(ImageExtent extent) {
    if (extent.widthInPixels() % binSizeX != 0) {
      throw new PatternConfigurationException(
          "width " + extent.widthInPixels() + " is not divisible by bin size " + binSizeX);
    }
    if (extent.heightInPixels() % binSizeY != 0) {
      throw new PatternConfigurationException(
          "height " + extent.heightInPixels() + " is not divisible by bin size " + binSizeY);
    }
    return new ImageExtent(extent.widthInPixels() / binSizeX, extent.heightInPixels() / binSizeY);
  }

  @Override
  public DiffractionPatterns apply(DiffractionPatterns patterns) {
    ImageExtent binned = apply(new ImageExtent(patterns.width(), patterns.height()));
    int count = patterns.count();
    int inWidth = patterns.width();
    int inFrame = patterns.frameSize();
    int width = binned.widthInPixels();
    int height = binned.heightInPixels();
    int[] in = patterns.values();
    DiffractionPatterns result = DiffractionPatterns.zeros(count, height, width);
    int[] out = result.values();
    for (int n = 0; n < count; n++) {
      for (int y = 0; y < patterns.height(); y++) {
        int rowBase = n * inFrame + y * inWidth;
        int outRow = (n * height + y / binSizeY) * width;
        for (int x = 0; x < inWidth; x++) {
          out[outRow + x / binSizeX] += in[rowBase + x];
        }
      }
    }
    return result;
  }

  @Override
  public BadPixels apply(BadPixels badPixels) {
    ImageExtent binned = apply(badPixels.extent());
    boolean[] mask = new boolean[binned.size()];
    Arrays.fill(mask, true);
    ImageExtent in = badPixels.extent();
    for (int y = 0; y < in.heightInPixels(); y++) {
      for (int x = 0; x < in.widthInPixels(); x++) {
        if (!badPixels.isBad(x, y)) {
          mask[(y / binSizeY) * binned.widthInPixels() + x / binSizeX] = false;
        }
      }
    }
    return BadPixels.of(binned, mask);
  }
}
