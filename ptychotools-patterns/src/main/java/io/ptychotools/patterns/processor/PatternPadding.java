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

/// Surround every frame with a border of zeros, `padX` columns on the left and on the right and
/// `padY` rows on the top and on the bottom. Padded mask pixels are good.
/// @param padX columns added on each side
/// @param padY rows added on each side
public record PatternPadding(int padX, int padY) implements PatternStep {

  public PatternPadding {
    if (padX < 0 || padY < 0) {
      throw new PatternConfigurationException("padding must not be negative, got " + padX + "x" + padY);
    }
  }

  @Override
  public ImageExtent apply(ImageExtent extent) {
    return new ImageExtent(extent.widthInPixels() + 2 * padX, extent.heightInPixels() + 2 * padY);
  }

  @Override
  public DiffractionPatterns apply(DiffractionPatterns patterns) {
    int count = patterns.count();
    int inWidth = patterns.width();
    int inHeight = patterns.height();
    int width = inWidth + 2 * padX;
    int height = inHeight + 2 * padY;
    int[] in = patterns.values();
    DiffractionPatterns padded = DiffractionPatterns.zeros(count, height, width);
    int[] out = padded.values();
    for (int n = 0; n < count; n++) {
      for (int y = 0; y < inHeight; y++) {
        int src = (n * inHeight + y) * inWidth;
        int dst = (n * height + y + padY) * width + padX;
        System.arraycopy(in, src, out, dst, inWidth);
      }
    }
    return padded;
  }

  @Override
  public BadPixels apply(BadPixels badPixels) {
    ImageExtent in = badPixels.extent();
    ImageExtent extent = apply(in);
    boolean[] mask = new boolean[extent.size()];
    for (int y = 0; y < in.heightInPixels(); y++) {
      for (int x = 0; x < in.widthInPixels(); x++) {
        mask[(y + padY) * extent.widthInPixels() + x + padX] = badPixels.isBad(x, y);
      }
    }
    return BadPixels.of(extent, mask);
  }
}
