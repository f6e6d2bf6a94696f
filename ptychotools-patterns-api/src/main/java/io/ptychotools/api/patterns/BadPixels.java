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


import io.ptychotools.api.geometry.ImageExtent;

import java.util.Arrays;
import java.util.Objects;

/// A per-pixel mask of detector pixels that must not contribute to pattern counts.
public final class BadPixels {

  private final ImageExtent extent;
  private final boolean[] mask;

  private BadPixels(ImageExtent extent, boolean[] mask) {
    this.extent = extent;
    this.mask = mask;
  }

  /// @param extent the mask extent
  /// @return a mask with no bad pixels
  public static BadPixels none(ImageExtent extent) {
    return new BadPixels(extent, new boolean[extent.size()]);
  }

  /// @param extent the mask extent
  /// @param mask row-major flags, true for a bad pixel; copied
  /// @return the mask
  public static BadPixels of(ImageExtent extent, boolean[] mask) {
    Objects.requireNonNull(extent, "extent cannot be null");
    if (mask.length != extent.size()) {
      throw new IllegalArgumentException(
          "bad pixel mask has " + mask.length + " entries, extent " + extent + " needs " + extent.size());
    }
    return new BadPixels(extent, mask.clone());
  }

  public ImageExtent extent() {
    return extent;
  }

  public boolean isBad(int x, int y) {
    return mask[y * extent.widthInPixels() + x];
  }

  /// @return a row-major copy of the mask
  public boolean[] toArray() {
    return mask.clone();
  }

  /// @return row-major flags, true for pixels that may be counted
  public boolean[] goodPixels() {
    boolean[] good = new boolean[mask.length];
    for (int i = 0; i < mask.length; i++) {
      good[i] = !mask[i];
    }
    return good;
  }

  public int countBad() {
    int count = 0;
    for (boolean bad : mask) {
      if (bad) {
        count++;
      }
    }
    return count;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BadPixels that)) {
      return false;
    }
    return extent.equals(that.extent) && Arrays.equals(mask, that.mask);
  }

  @Override
  public int hashCode() {
    return 31 * extent.hashCode() + Arrays.hashCode(mask);
  }

  @Override
  public String toString() {
    return "BadPixels{" + extent + ", bad=" + countBad() + "}";
  }
}
