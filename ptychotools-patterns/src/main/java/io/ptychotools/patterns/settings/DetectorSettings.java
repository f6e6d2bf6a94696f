package io.ptychotools.patterns.settings;

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
import io.ptychotools.api.geometry.PixelGeometry;

/// Detector geometry settings, group `Detector` of the settings file.
///
/// Values may be changed from any thread; readers see the latest write of each field.
public class DetectorSettings {

  private volatile int widthInPixels = 1024;
  private volatile int heightInPixels = 1024;
  private volatile double pixelWidthInMeters = 75e-6;
  private volatile double pixelHeightInMeters = 75e-6;
  private volatile int bitDepth = 8;

  public int getWidthInPixels() {
    return widthInPixels;
  }

  public void setWidthInPixels(int widthInPixels) {
    this.widthInPixels = Math.max(1, widthInPixels);
  }

  public int getHeightInPixels() {
    return heightInPixels;
  }

  public void setHeightInPixels(int heightInPixels) {
    this.heightInPixels = Math.max(1, heightInPixels);
  }

  public double getPixelWidthInMeters() {
    return pixelWidthInMeters;
  }

  public void setPixelWidthInMeters(double pixelWidthInMeters) {
    this.pixelWidthInMeters = Math.max(0.0, pixelWidthInMeters);
  }

  public double getPixelHeightInMeters() {
    return pixelHeightInMeters;
  }

  public void setPixelHeightInMeters(double pixelHeightInMeters) {
    this.pixelHeightInMeters = Math.max(0.0, pixelHeightInMeters);
  }

  public int getBitDepth() {
    return bitDepth;
  }

  public void setBitDepth(int bitDepth) {
    this.bitDepth = Math.max(1, bitDepth);
  }

  public ImageExtent getImageExtent() {
    return new ImageExtent(widthInPixels, heightInPixels);
  }

  public void setImageExtent(ImageExtent extent) {
    setWidthInPixels(extent.widthInPixels());
    setHeightInPixels(extent.heightInPixels());
  }

  public PixelGeometry getPixelGeometry() {
    return new PixelGeometry(pixelWidthInMeters, pixelHeightInMeters);
  }

  public void setPixelGeometry(PixelGeometry geometry) {
    setPixelWidthInMeters(geometry.widthInMeters());
    setPixelHeightInMeters(geometry.heightInMeters());
  }
}
