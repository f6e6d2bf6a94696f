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
import io.ptychotools.api.patterns.CropCenter;

import java.nio.file.Path;

/// User settings of the pattern pipeline, group `Patterns` of the settings file.
///
/// Settings are read by the sizer whenever a processor is built and by the assembled dataset
/// on every reload. Changing a value never affects a loader that is already running.
public class PatternSettings {

  public static final int MIN_THREADS = 1;
  public static final int MAX_THREADS = 64;

  private volatile String fileType = "NPZ";
  private volatile Path filePath = Path.of("");
  private volatile boolean memmapEnabled = false;
  private volatile Path scratchDirectory = Path.of(System.getProperty("user.home"), ".ptychotools");
  private volatile int numberOfDataThreads = 8;
  private volatile int processingQueueCapacity = 0;

  private volatile boolean cropEnabled = true;
  private volatile int cropCenterXInPixels = 32;
  private volatile int cropCenterYInPixels = 32;
  private volatile int cropWidthInPixels = 64;
  private volatile int cropHeightInPixels = 64;

  private volatile boolean binningEnabled = false;
  private volatile int binSizeX = 1;
  private volatile int binSizeY = 1;

  private volatile boolean paddingEnabled = false;
  private volatile int padX = 0;
  private volatile int padY = 0;

  private volatile boolean flipXEnabled = false;
  private volatile boolean flipYEnabled = false;

  private volatile boolean valueLowerBoundEnabled = false;
  private volatile int valueLowerBound = 0;
  private volatile boolean valueUpperBoundEnabled = false;
  private volatile int valueUpperBound = 65535;

  public String getFileType() {
    return fileType;
  }

  public void setFileType(String fileType) {
    this.fileType = fileType;
  }

  public Path getFilePath() {
    return filePath;
  }

  public void setFilePath(Path filePath) {
    this.filePath = filePath;
  }

  public boolean isMemmapEnabled() {
    return memmapEnabled;
  }

  public void setMemmapEnabled(boolean memmapEnabled) {
    this.memmapEnabled = memmapEnabled;
  }

  public Path getScratchDirectory() {
    return scratchDirectory;
  }

  public void setScratchDirectory(Path scratchDirectory) {
    this.scratchDirectory = scratchDirectory;
  }

  public int getNumberOfDataThreads() {
    return numberOfDataThreads;
  }

  /// @param numberOfDataThreads worker thread count, clamped to `[1, 64]`
  public void setNumberOfDataThreads(int numberOfDataThreads) {
    this.numberOfDataThreads = Math.max(MIN_THREADS, Math.min(numberOfDataThreads, MAX_THREADS));
  }

  public int getProcessingQueueCapacity() {
    return processingQueueCapacity;
  }

  /// @param processingQueueCapacity bound of the processing queue, 0 for unbounded
  public void setProcessingQueueCapacity(int processingQueueCapacity) {
    this.processingQueueCapacity = Math.max(0, processingQueueCapacity);
  }

  public boolean isCropEnabled() {
    return cropEnabled;
  }

  public void setCropEnabled(boolean cropEnabled) {
    this.cropEnabled = cropEnabled;
  }

  public int getCropCenterXInPixels() {
    return cropCenterXInPixels;
  }

  public void setCropCenterXInPixels(int cropCenterXInPixels) {
    this.cropCenterXInPixels = cropCenterXInPixels;
  }

  public int getCropCenterYInPixels() {
    return cropCenterYInPixels;
  }

  public void setCropCenterYInPixels(int cropCenterYInPixels) {
    this.cropCenterYInPixels = cropCenterYInPixels;
  }

  public void setCropCenter(CropCenter center) {
    setCropCenterXInPixels(center.positionXInPixels());
    setCropCenterYInPixels(center.positionYInPixels());
  }

  public int getCropWidthInPixels() {
    return cropWidthInPixels;
  }

  public void setCropWidthInPixels(int cropWidthInPixels) {
    this.cropWidthInPixels = cropWidthInPixels;
  }

  public int getCropHeightInPixels() {
    return cropHeightInPixels;
  }

  public void setCropHeightInPixels(int cropHeightInPixels) {
    this.cropHeightInPixels = cropHeightInPixels;
  }

  public void setCropExtent(ImageExtent extent) {
    setCropWidthInPixels(extent.widthInPixels());
    setCropHeightInPixels(extent.heightInPixels());
  }

  public boolean isBinningEnabled() {
    return binningEnabled;
  }

  public void setBinningEnabled(boolean binningEnabled) {
    this.binningEnabled = binningEnabled;
  }

  public int getBinSizeX() {
    return binSizeX;
  }

  public void setBinSizeX(int binSizeX) {
    this.binSizeX = binSizeX;
  }

  public int getBinSizeY() {
    return binSizeY;
  }

  public void setBinSizeY(int binSizeY) {
    this.binSizeY = binSizeY;
  }

  public boolean isPaddingEnabled() {
    return paddingEnabled;
  }

  public void setPaddingEnabled(boolean paddingEnabled) {
    this.paddingEnabled = paddingEnabled;
  }

  public int getPadX() {
    return padX;
  }

  public void setPadX(int padX) {
    this.padX = padX;
  }

  public int getPadY() {
    return padY;
  }

  public void setPadY(int padY) {
    this.padY = padY;
  }

  public boolean isFlipXEnabled() {
    return flipXEnabled;
  }

  public void setFlipXEnabled(boolean flipXEnabled) {
    this.flipXEnabled = flipXEnabled;
  }

  public boolean isFlipYEnabled() {
    return flipYEnabled;
  }

  public void setFlipYEnabled(boolean flipYEnabled) {
    this.flipYEnabled = flipYEnabled;
  }

  public boolean isValueLowerBoundEnabled() {
    return valueLowerBoundEnabled;
  }

  public void setValueLowerBoundEnabled(boolean valueLowerBoundEnabled) {
    this.valueLowerBoundEnabled = valueLowerBoundEnabled;
  }

  public int getValueLowerBound() {
    return valueLowerBound;
  }

  public void setValueLowerBound(int valueLowerBound) {
    this.valueLowerBound = valueLowerBound;
  }

  public boolean isValueUpperBoundEnabled() {
    return valueUpperBoundEnabled;
  }

  public void setValueUpperBoundEnabled(boolean valueUpperBoundEnabled) {
    this.valueUpperBoundEnabled = valueUpperBoundEnabled;
  }

  public int getValueUpperBound() {
    return valueUpperBound;
  }

  public void setValueUpperBound(int valueUpperBound) {
    this.valueUpperBound = valueUpperBound;
  }
}
