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
import io.ptychotools.api.patterns.DiffractionPatternArray;
import io.ptychotools.api.patterns.DiffractionPatterns;
import io.ptychotools.api.patterns.SimpleDiffractionPatternArray;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// An immutable chain of processing steps for frames of one detector extent.
///
/// Steps always run in the order crop, value filter, binning, padding, flip. Every step is
/// optional. The chain is checked against the detector extent when it is built, so a processor
/// that exists can process any frame of that extent.
///
/// Instances hold no mutable state and may be shared by any number of worker threads.
public final class PatternProcessor {

  private final ImageExtent detectorExtent;
  private final PatternCrop crop;
  private final PatternValueFilter valueFilter;
  private final PatternBinning binning;
  private final PatternPadding padding;
  private final PatternFlip flip;
  private final List<PatternStep> steps;
  private final ImageExtent processedExtent;

  private PatternProcessor(Builder builder) {
    this.detectorExtent = builder.detectorExtent;
    this.crop = builder.crop;
    this.valueFilter = builder.valueFilter;
    this.binning = builder.binning;
    this.padding = builder.padding;
    this.flip = builder.flip;

    List<PatternStep> chain = new ArrayList<>();
    for (PatternStep step : new PatternStep[]{crop, valueFilter, binning, padding, flip}) {
      if (step != null) {
        chain.add(step);
      }
    }
    this.steps = List.copyOf(chain);

    ImageExtent extent = detectorExtent;
    for (PatternStep step : steps) {
      extent = step.apply(extent);
    }
    this.processedExtent = extent;
  }

  /// @param detectorExtent extent of the raw frames the processor accepts
  /// @return a builder with no steps
  public static Builder builder(ImageExtent detectorExtent) {
    return new Builder(detectorExtent);
  }

  /// @param detectorExtent extent of the raw frames
  /// @return a processor that passes frames through unchanged
  public static PatternProcessor identity(ImageExtent detectorExtent) {
    return builder(detectorExtent).build();
  }

  public ImageExtent getDetectorExtent() {
    return detectorExtent;
  }

  /// @return the extent of every processed frame
  public ImageExtent getProcessedExtent() {
    return processedExtent;
  }

  public Optional<PatternCrop> getCrop() {
    return Optional.ofNullable(crop);
  }

  public Optional<PatternValueFilter> getValueFilter() {
    return Optional.ofNullable(valueFilter);
  }

  public Optional<PatternBinning> getBinning() {
    return Optional.ofNullable(binning);
  }

  public Optional<PatternPadding> getPadding() {
    return Optional.ofNullable(padding);
  }

  public Optional<PatternFlip> getFlip() {
    return Optional.ofNullable(flip);
  }

  /// Process a batch of raw frames
  /// @param patterns a `(count, height, width)` batch of raw frames; not modified
  /// @return the processed batch
  /// @throws PatternDimensionException if the batch is not rank 3 or its frames are not of the
  ///     detector extent
  public DiffractionPatterns process(DiffractionPatterns patterns) {
    if (patterns.rank() != 3) {
      throw new PatternDimensionException("diffraction patterns must have rank 3", patterns.shape());
    }
    if (patterns.width() != detectorExtent.widthInPixels()
        || patterns.height() != detectorExtent.heightInPixels()) {
      throw new PatternDimensionException(
          "diffraction pattern frames do not match detector extent " + detectorExtent, patterns.shape());
    }
    DiffractionPatterns result = patterns;
    for (PatternStep step : steps) {
      result = step.apply(result);
    }
    return result;
  }

  /// Load and process one source array
  /// @param array the raw array
  /// @return an in-memory array with the same label and indexes and processed frames
  /// @throws IOException if the raw frames cannot be read
  public DiffractionPatternArray process(DiffractionPatternArray array) throws IOException {
    DiffractionPatterns processed = process(array.getData());
    return new SimpleDiffractionPatternArray(array.getLabel(), array.getIndexes(), processed);
  }

  /// Run a detector bad pixel mask through the geometric steps
  /// @param badPixels a mask of the detector extent
  /// @return a mask of the processed extent
  public BadPixels processBadPixels(BadPixels badPixels) {
    if (!badPixels.extent().equals(detectorExtent)) {
      throw new PatternConfigurationException(
          "bad pixel mask extent " + badPixels.extent() + " does not match detector extent " + detectorExtent);
    }
    BadPixels result = badPixels;
    for (PatternStep step : steps) {
      result = step.apply(result);
    }
    return result;
  }

  @Override
  public String toString() {
    return "PatternProcessor{" + detectorExtent + " -> " + processedExtent + ", steps=" + steps + "}";
  }

  /// Builder for [PatternProcessor]
  public static final class Builder {
    private final ImageExtent detectorExtent;
    private PatternCrop crop;
    private PatternValueFilter valueFilter;
    private PatternBinning binning;
    private PatternPadding padding;
    private PatternFlip flip;

    private Builder(ImageExtent detectorExtent) {
      this.detectorExtent = detectorExtent;
    }

    public Builder crop(PatternCrop crop) {
      this.crop = crop;
      return this;
    }

    public Builder valueFilter(PatternValueFilter valueFilter) {
      this.valueFilter = valueFilter;
      return this;
    }

    public Builder binning(PatternBinning binning) {
      this.binning = binning;
      return this;
    }

    public Builder padding(PatternPadding padding) {
      this.padding = padding;
      return this;
    }

    public Builder flip(PatternFlip flip) {
      this.flip = flip;
      return this;
    }

    /// @return the processor
    /// @throws PatternConfigurationException if a step does not fit the frames it receives
    public PatternProcessor build() {
      return new PatternProcessor(this);
    }
  }
}
