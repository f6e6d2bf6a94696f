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
import io.ptychotools.api.patterns.PixelType;

import java.util.Objects;

/// Zero out pixel values outside an accepted range.
///
/// Values below the lower bound and values at or above the upper bound become zero. Either
/// bound may be null to leave that side open. Values are compared as the pixel type reads them,
/// so `UINT32` pixels at or above 2^31 count as large positive values.
/// @param lowerBound smallest accepted value, or null
/// @param upperBound first rejected value, or null
/// @param pixelType element type of the raw frames
public record PatternValueFilter(Integer lowerBound, Integer upperBound, PixelType pixelType) implements PatternStep {

  public PatternValueFilter {
    Objects.requireNonNull(pixelType, "pixelType cannot be null");
  }

  @Override
  public ImageExtent apply(ImageExtent extent) {
    return extent;
  }

  @Override
  public DiffractionPatterns apply(DiffractionPatterns patterns) {
    int[] values = patterns.values().clone();
    boolean hasLower = lowerBound != null;
    boolean hasUpper = upperBound != null;
    long lower = hasLower ? lowerBound : 0L;
    long upper = hasUpper ? upperBound : 0L;
    for (int i = 0; i < values.length; i++) {
      long v = pixelType.widen(values[i]);
      if ((hasLower && v < lower) || (hasUpper && v >= upper)) {
        values[i] = 0;
      }
    }
    return DiffractionPatterns.wrap(patterns.shape(), values);
  }

  @Override
  public BadPixels apply(BadPixels badPixels) {
    return badPixels;
  }
}
