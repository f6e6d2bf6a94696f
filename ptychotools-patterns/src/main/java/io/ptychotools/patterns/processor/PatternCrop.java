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
import io.ptychotools.api.geometry.Interval;
import io.ptychotools.api.patterns.BadPixels;
import io.ptychotools.api.patterns.DiffractionPatterns;

/// Cut a window out of every frame.
/// @param columns half-open column range `[lower, upper)` of the window
/// @param rows half-open row range `[lower, upper)` of the window
public record PatternCrop(Interval columns, Interval rows) implements PatternStep {

  /// Build a crop window of the given size around a center pixel
  /// @param centerX center column
  /// @param centerY center row
  /// @param extent window size
  /// @return the crop step
  public static PatternCrop around(int centerX, int centerY, ImageExtent extent) {
    int left = centerX - extent.widthInPixels() / 2;
    int top = centerY - extent.heightInPixels() / 2;
    return new PatternCrop(
        new Interval(left, left + extent.widthInPixels()),
        new Interval(top, top + extent.heightInPixels()));
  }

  @Override
  public ImageExtent apply(ImageExtent extent) {
    if (columns.lower() < 0 || columns.upper() > extent.widthInPixels() || columns.length() < 1
        || rows.lower() < 0 || rows.upper() > extent.heightInPixels() || rows.length() < 1) {
      throw new PatternConfigurationException(
          "crop window columns " + columns + ", rows " + rows + " does not fit a " + extent + " frame");
    }
    return new ImageExtent(columns.length(), rows.length());
  }

  @Override
  public DiffractionPatterns apply(DiffractionPatterns patterns) {
    int count = patterns.count();
    int width = columns.length();
    int height = rows.length();
    int inWidth = patterns.width();
    int inFrame = patterns.frameSize();
    int[] in = patterns.values();
    DiffractionPatterns cropped = DiffractionPatterns.zeros(count, height, width);
    int[] out = cropped.values();
    for (int n = 0; n < count; n++) {
      for (int y = 0; y < height; y++) {
        int src = n * inFrame + (rows.lower() + y) * inWidth + columns.lower();
        System.arraycopy(in, src, out, (n * height + y) * width, width);
      }
    }
    return cropped;
  }

  @Override
  public BadPixels apply(BadPixels badPixels) {
    ImageExtent extent = apply(badPixels.extent());
    boolean[] mask = new boolean[extent.size()];
    for (int y = 0; y < extent.heightInPixels(); y++) {
      for (int x = 0; x < extent.widthInPixels(); x++) {
        mask[y * extent.widthInPixels() + x] = badPixels.isBad(columns.lower() + x, rows.lower() + y);
      }
    }
    return BadPixels.of(extent, mask);
  }
}
