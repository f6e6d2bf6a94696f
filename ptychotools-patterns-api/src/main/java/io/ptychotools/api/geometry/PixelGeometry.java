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


/// Physical size of one detector pixel.
/// @param widthInMeters pixel pitch along x
/// @param heightInMeters pixel pitch along y
public record PixelGeometry(double widthInMeters, double heightInMeters) {

  public double areaInSquareMeters() {
    return widthInMeters * heightInMeters;
  }

  public double aspectRatio() {
    return widthInMeters / heightInMeters;
  }
}
