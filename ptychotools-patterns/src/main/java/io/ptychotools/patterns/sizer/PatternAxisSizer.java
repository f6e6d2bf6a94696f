package io.ptychotools.patterns.sizer;

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


import io.ptychotools.api.geometry.Interval;
import io.ptychotools.patterns.processor.PatternConfigurationException;

/// Sizing along one detector axis, taken from a snapshot of the detector and pattern settings.
/// @param detectorSize detector pixels along the axis
/// @param detectorPixelSizeInMeters detector pixel pitch along the axis
/// @param cropEnabled whether frames are cropped
/// @param requestedCropSize configured crop window size
/// @param requestedCropCenter configured crop window center
/// @param binningEnabled whether frames are binned
/// @param requestedBinSize configured bin size
/// @param paddingEnabled whether frames are padded
/// @param requestedPadSize configured padding on each side
public record PatternAxisSizer(
    int detectorSize,
    double detectorPixelSizeInMeters,
    boolean cropEnabled,
    int requestedCropSize,
    int requestedCropCenter,
    boolean binningEnabled,
    int requestedBinSize,
    boolean paddingEnabled,
    int requestedPadSize
) {

  /// Clamp a crop center so that a window of the given size stays on the detector
  ///
  /// The window covers `[center - window/2, center - window/2 + window)`. When no center keeps
  /// the window inside, the lower limit wins.
  /// @param requested the requested center
  /// @param window the window size, at most `detector`
  /// @param detector the detector size
  /// @return the clamped center
  public static int safeCropCenter(int requested, int window, int detector) {
    int lower = window / 2;
    int upper = detector - 1 - lower;
    if (upper < lower) {
      return lower;
    }
    return new Interval(lower, upper).clamp(requested);
  }

  public Interval getCropSizeLimits() {
    return new Interval(1, Math.max(1, detectorSize));
  }

  /// @return the crop window size, or the detector size when cropping is off
  public int getCropSize() {
    return cropEnabled ? getCropSizeLimits().clamp(requestedCropSize) : detectorSize;
  }

  public Interval getCropCenterLimits() {
    return new Interval(0, detectorSize);
  }

  /// @return the configured center clamped to the detector, or the detector midrange when
  ///     cropping is off
  public int getCropCenter() {
    Interval limits = getCropCenterLimits();
    return cropEnabled ? limits.clamp(requestedCropCenter) : limits.midrange();
  }

  public int getSafeCropCenter() {
    return safeCropCenter(getCropCenter(), getCropSize(), detectorSize);
  }

  /// @return the half-open pixel range of the crop window
  public Interval getCropInterval() {
    int lower = getSafeCropCenter() - getCropSize() / 2;
    return new Interval(lower, lower + getCropSize());
  }

  /// @return the bin size, clamped to `[1, crop size]`, or 1 when binning is off
  public int getBinSize() {
    return binningEnabled ? new Interval(1, getCropSize()).clamp(requestedBinSize) : 1;
  }

  /// @throws PatternConfigurationException if the bin size does not divide the crop size
  public void validateBinSize() {
    int cropSize = getCropSize();
    int binSize = getBinSize();
    if (cropSize % binSize != 0) {
      throw new PatternConfigurationException(
          "invalid bin size " + binSize + " for crop size " + cropSize);
    }
  }

  public int getPadSize() {
    return paddingEnabled ? Math.max(0, requestedPadSize) : 0;
  }

  /// @return processed pixels along the axis, `crop / bin + 2 * pad`
  public int getProcessedSize() {
    return getCropSize() / getBinSize() + 2 * getPadSize();
  }

  public double getProcessedPixelSizeInMeters() {
    return getBinSize() * detectorPixelSizeInMeters;
  }

  public double getProcessedSizeInMeters() {
    return getProcessedSize() * getProcessedPixelSizeInMeters();
  }
}
