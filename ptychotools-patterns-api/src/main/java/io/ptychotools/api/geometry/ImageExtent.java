package io.ptychotools.api.geometry;

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


/// Width and height of an image in pixels.
/// @param widthInPixels number of columns
/// @param heightInPixels number of rows
public record ImageExtent(int widthInPixels, int heightInPixels) {

  public ImageExtent {
    if (widthInPixels < 0 || heightInPixels < 0) {
      throw new IllegalArgumentException(
          "image extent must not be negative: " + widthInPixels + "W x " + heightInPixels + "H");
    }
  }

  /// @return the number of pixels in the image
  public int size() {
    return widthInPixels * heightInPixels;
  }

  /// @return the row-major shape `{height, width}`
  public int[] shape() {
    return new int[]{heightInPixels, widthInPixels};
  }

  @Override
  public String toString() {
    return widthInPixels + "W x " + heightInPixels + "H";
  }
}
