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


import io.ptychotools.api.geometry.ImageExtent;
import io.ptychotools.api.geometry.PixelGeometry;
import io.ptychotools.api.patterns.BadPixels;
import io.ptychotools.api.patterns.PixelType;
import io.ptychotools.patterns.processor.PatternBinning;
import io.ptychotools.patterns.processor.PatternConfigurationException;
import io.ptychotools.patterns.processor.PatternCrop;
import io.ptychotools.patterns.processor.PatternFlip;
import io.ptychotools.patterns.processor.PatternPadding;
import io.ptychotools.patterns.processor.PatternProcessor;
import io.ptychotools.patterns.processor.PatternValueFilter;
import io.ptychotools.patterns.settings.DetectorSettings;
import io.ptychotools.patterns.settings.PatternSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Derives processed frame geometry and processors from the current detector and pattern
/// settings.
///
/// Every call reads the settings afresh. A processor built here is a snapshot; later changes to
/// the settings do not affect it.
public class PatternSizer {
  private static final Logger logger = LogManager.getLogger(PatternSizer.class);

  private final DetectorSettings detectorSettings;
  private final PatternSettings patternSettings;

  public PatternSizer(DetectorSettings detectorSettings, PatternSettings patternSettings) {
    this.detectorSettings = detectorSettings;
    this.patternSettings = patternSettings;
  }

  public DetectorSettings getDetectorSettings() {
    return detectorSettings;
  }

  public PatternSettings getPatternSettings() {
    return patternSettings;
  }

  public PatternAxisSizer getAxisX() {
    PatternSettings s = patternSettings;
    return new PatternAxisSizer(
        detectorSettings.getWidthInPixels(),
        detectorSettings.getPixelWidthInMeters(),
        s.isCropEnabled(), s.getCropWidthInPixels(), s.getCropCenterXInPixels(),
        s.isBinningEnabled(), s.getBinSizeX(),
        s.isPaddingEnabled(), s.getPadX());
  }

  public PatternAxisSizer getAxisY() {
    PatternSettings s = patternSettings;
    return new PatternAxisSizer(
        detectorSettings.getHeightInPixels(),
        detectorSettings.getPixelHeightInMeters(),
        s.isCropEnabled(), s.getCropHeightInPixels(), s.getCropCenterYInPixels(),
        s.isBinningEnabled(), s.getBinSizeY(),
        s.isPaddingEnabled(), s.getPadY());
  }

  public ImageExtent getDetectorExtent() {
    return detectorSettings.getImageExtent();
  }

  /// @return the crop window extent, or the detector extent when cropping is off
  public ImageExtent getCropExtent() {
    return new ImageExtent(getAxisX().getCropSize(), getAxisY().getCropSize());
  }

  /// @return the extent of processed frames
  public ImageExtent getProcessedImageExtent() {
    return new ImageExtent(getAxisX().getProcessedSize(), getAxisY().getProcessedSize());
  }

  public PixelGeometry getProcessedPixelGeometry() {
    return new PixelGeometry(
        getAxisX().getProcessedPixelSizeInMeters(), getAxisY().getProcessedPixelSizeInMeters());
  }

  public double getProcessedWidthInMeters() {
    return getAxisX().getProcessedSizeInMeters();
  }

  public double getProcessedHeightInMeters() {
    return getAxisY().getProcessedSizeInMeters();
  }

  /// Build a processor for signed 32-bit raw frames
  /// @param badPixels the detector bad pixel mask, or null
  /// @return the processor
  /// @throws PatternConfigurationException if the bin sizes do not divide the crop extent or
  ///     the mask does not match the detector extent
  public PatternProcessor buildProcessor(BadPixels badPixels) {
    return buildProcessor(badPixels, PixelType.INT32);
  }

  /// Build a processor from the current settings
  /// @param badPixels the detector bad pixel mask, or null
  /// @param rawPixelType element type of the raw frames, used by the value filter
  /// @return the processor
  /// @throws PatternConfigurationException if the bin sizes do not divide the crop extent or
  ///     the mask does not match the detector extent
  public PatternProcessor buildProcessor(BadPixels badPixels, PixelType rawPixelType) {
    PatternAxisSizer x = getAxisX();
    PatternAxisSizer y = getAxisY();
    x.validateBinSize();
    y.validateBinSize();

    ImageExtent detectorExtent = new ImageExtent(x.detectorSize(), y.detectorSize());
    if (badPixels != null && !badPixels.extent().equals(detectorExtent)) {
      throw new PatternConfigurationException(
          "bad pixel mask extent " + badPixels.extent() + " does not match detector extent " + detectorExtent);
    }

    PatternSettings s = patternSettings;
    PatternProcessor.Builder builder = PatternProcessor.builder(detectorExtent);
    if (s.isCropEnabled()) {
      builder.crop(new PatternCrop(x.getCropInterval(), y.getCropInterval()));
    }
    if (s.isValueLowerBoundEnabled() || s.isValueUpperBoundEnabled()) {
      builder.valueFilter(new PatternValueFilter(
          s.isValueLowerBoundEnabled() ? s.getValueLowerBound() : null,
          s.isValueUpperBoundEnabled() ? s.getValueUpperBound() : null,
          rawPixelType));
    }
    if (s.isBinningEnabled()) {
      builder.binning(new PatternBinning(x.getBinSize(), y.getBinSize()));
    }
    if (s.isPaddingEnabled()) {
      builder.padding(new PatternPadding(x.getPadSize(), y.getPadSize()));
    }
    if (s.isFlipXEnabled() || s.isFlipYEnabled()) {
      builder.flip(new PatternFlip(s.isFlipXEnabled(), s.isFlipYEnabled()));
    }
    PatternProcessor processor = builder.build();
    logger.debug("Built {}", processor);
    return processor;
  }

  /// @param badPixels the detector bad pixel mask
  /// @return the mask as it applies to processed frames
  public BadPixels getProcessedBadPixels(BadPixels badPixels) {
    return buildProcessor(badPixels).processBadPixels(badPixels);
  }
}
