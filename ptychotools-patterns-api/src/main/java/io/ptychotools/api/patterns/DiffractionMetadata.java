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
import io.ptychotools.api.geometry.PixelGeometry;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/// Description of a dataset before any pixel data has been loaded.
///
/// The counts and pixel type are always present. The detector and file fields are hints a reader
/// may or may not know; they are null when absent and can be read through the `Optional`
/// accessors.
/// @param numberOfPatternsPerArray frames per source array; sizes the buffer slice of each array
/// @param numberOfPatternsTotal frames in the whole dataset; sizes the pattern buffer
/// @param patternDataType pixel element type of the stored patterns
/// @param detectorDistanceInMeters sample to detector distance, or null
/// @param detectorExtent raw detector frame extent, or null
/// @param detectorPixelGeometry detector pixel pitch, or null
/// @param detectorBitDepth detector bit depth, or null
/// @param cropCenter crop center suggested by the source, or null
/// @param probeEnergyInElectronVolts probe energy, or null
/// @param filePath the file the dataset was read from, or null
public record DiffractionMetadata(
    int numberOfPatternsPerArray,
    int numberOfPatternsTotal,
    PixelType patternDataType,
    Double detectorDistanceInMeters,
    ImageExtent detectorExtent,
    PixelGeometry detectorPixelGeometry,
    Integer detectorBitDepth,
    CropCenter cropCenter,
    Double probeEnergyInElectronVolts,
    Path filePath
) {

  public DiffractionMetadata {
    Objects.requireNonNull(patternDataType, "patternDataType cannot be null");
    if (numberOfPatternsPerArray < 0 || numberOfPatternsTotal < 0) {
      throw new IllegalArgumentException(
          "pattern counts must not be negative: perArray=" + numberOfPatternsPerArray + ", total="
              + numberOfPatternsTotal);
    }
  }

  /// @return metadata of an empty dataset
  public static DiffractionMetadata createNull() {
    return createNull(null);
  }

  /// @param filePath the file path to remember, or null
  /// @return metadata of an empty dataset
  public static DiffractionMetadata createNull(Path filePath) {
    return builder(0, 0, PixelType.UINT8).filePath(filePath).build();
  }

  /// Start building metadata
  /// @param numberOfPatternsPerArray frames per source array
  /// @param numberOfPatternsTotal frames in the dataset
  /// @param patternDataType pixel element type
  /// @return a builder
  public static Builder builder(int numberOfPatternsPerArray, int numberOfPatternsTotal, PixelType patternDataType) {
    return new Builder(numberOfPatternsPerArray, numberOfPatternsTotal, patternDataType);
  }

  public Optional<ImageExtent> getDetectorExtent() {
    return Optional.ofNullable(detectorExtent);
  }

  public Optional<PixelGeometry> getDetectorPixelGeometry() {
    return Optional.ofNullable(detectorPixelGeometry);
  }

  public Optional<Integer> getDetectorBitDepth() {
    return Optional.ofNullable(detectorBitDepth);
  }

  public Optional<CropCenter> getCropCenter() {
    return Optional.ofNullable(cropCenter);
  }

  public Optional<Path> getFilePath() {
    return Optional.ofNullable(filePath);
  }

  /// @return the file name of [#filePath()] without its last extension
  public Optional<String> getFileStem() {
    return getFilePath().map(DiffractionMetadata::fileStem);
  }

  /// @param filePath a file path
  /// @return the file name without its last extension; names starting with a dot are kept whole
  public static String fileStem(Path filePath) {
    String name = filePath.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  /// Builder for [DiffractionMetadata]
  public static final class Builder {
    private final int numberOfPatternsPerArray;
    private final int numberOfPatternsTotal;
    private final PixelType patternDataType;
    private Double detectorDistanceInMeters;
    private ImageExtent detectorExtent;
    private PixelGeometry detectorPixelGeometry;
    private Integer detectorBitDepth;
    private CropCenter cropCenter;
    private Double probeEnergyInElectronVolts;
    private Path filePath;

    private Builder(int numberOfPatternsPerArray, int numberOfPatternsTotal, PixelType patternDataType) {
      this.numberOfPatternsPerArray = numberOfPatternsPerArray;
      this.numberOfPatternsTotal = numberOfPatternsTotal;
      this.patternDataType = patternDataType;
    }

    public Builder detectorDistanceInMeters(Double detectorDistanceInMeters) {
      this.detectorDistanceInMeters = detectorDistanceInMeters;
      return this;
    }

    public Builder detectorExtent(ImageExtent detectorExtent) {
      this.detectorExtent = detectorExtent;
      return this;
    }

    public Builder detectorPixelGeometry(PixelGeometry detectorPixelGeometry) {
      this.detectorPixelGeometry = detectorPixelGeometry;
      return this;
    }

    public Builder detectorBitDepth(Integer detectorBitDepth) {
      this.detectorBitDepth = detectorBitDepth;
      return this;
    }

    public Builder cropCenter(CropCenter cropCenter) {
      this.cropCenter = cropCenter;
      return this;
    }

    public Builder probeEnergyInElectronVolts(Double probeEnergyInElectronVolts) {
      this.probeEnergyInElectronVolts = probeEnergyInElectronVolts;
      return this;
    }

    public Builder filePath(Path filePath) {
      this.filePath = filePath;
      return this;
    }

    public DiffractionMetadata build() {
      return new DiffractionMetadata(
          numberOfPatternsPerArray,
          numberOfPatternsTotal,
          patternDataType,
          detectorDistanceInMeters,
          detectorExtent,
          detectorPixelGeometry,
          detectorBitDepth,
          cropCenter,
          probeEnergyInElectronVolts,
          filePath
      );
    }
  }
}
