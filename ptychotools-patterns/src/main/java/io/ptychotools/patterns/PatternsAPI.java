package io.ptychotools.patterns;

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
import io.ptychotools.api.patterns.DiffractionDataset;
import io.ptychotools.api.patterns.DiffractionMetadata;
import io.ptychotools.api.services.DiffractionFileIO;
import io.ptychotools.api.services.DiffractionFileReader;
import io.ptychotools.api.services.DiffractionFileWriter;
import io.ptychotools.patterns.dataset.AssembledDiffractionDataset;
import io.ptychotools.patterns.npz.NpyArray;
import io.ptychotools.patterns.npz.NpyFormat;
import io.ptychotools.patterns.settings.DetectorSettings;
import io.ptychotools.patterns.settings.PatternSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/// Entry points for reading, assembling and writing diffraction patterns.
public class PatternsAPI {
  private static final Logger logger = LogManager.getLogger(PatternsAPI.class);

  private final PatternSettings patternSettings;
  private final DetectorSettings detectorSettings;
  private final AssembledDiffractionDataset dataset;
  private final DiffractionFileIO fileIO;

  public PatternsAPI(PatternSettings patternSettings, DetectorSettings detectorSettings,
                     AssembledDiffractionDataset dataset, DiffractionFileIO fileIO) {
    this.patternSettings = patternSettings;
    this.detectorSettings = detectorSettings;
    this.dataset = dataset;
    this.fileIO = fileIO;
  }

  public DiffractionFileIO getFileIO() {
    return fileIO;
  }

  /// @param metadata describes the patterns the acquisition will deliver
  /// @return a context that is not started yet
  public PatternsStreamingContext createStreamingContext(DiffractionMetadata metadata) {
    return new PatternsStreamingContext(dataset, metadata);
  }

  /// Read, process and assemble a file with the reader named by `FileType`
  /// @param filePath the file to read
  /// @return false if the path is not a regular file
  /// @throws IOException if the file cannot be read or the buffer cannot be allocated
  public boolean openPatterns(Path filePath) throws IOException {
    return openPatterns(filePath, patternSettings.getFileType());
  }

  /// Read, process and assemble a file
  ///
  /// Detector extent, pixel geometry, bit depth and crop center found in the file metadata are
  /// copied into the settings before the buffer is sized. The call returns after every array
  /// has been processed and assembled.
  /// @param filePath the file to read
  /// @param fileType simple name of the reader
  /// @return false if the path is not a regular file
  /// @throws IOException if the file cannot be read or the buffer cannot be allocated
  /// @throws IllegalArgumentException if no reader has that name
  public boolean openPatterns(Path filePath, String fileType) throws IOException {
    if (!Files.isRegularFile(filePath)) {
      logger.warn("Refusing to read invalid file path {}", filePath);
      return false;
    }
    DiffractionFileIO.Plugin<DiffractionFileReader> plugin = fileIO.getReader(fileType)
        .orElseThrow(() -> new IllegalArgumentException(
            "no diffraction file reader named '" + fileType + "', available: " + fileIO.getReaderNames()));
    logger.debug("Reading {} as {}", filePath, plugin.simpleName());

    DiffractionDataset source;
    try {
      source = plugin.create().read(filePath);
    } catch (IOException | RuntimeException e) {
      throw new IOException("Failed to read " + filePath, e);
    }
    applyMetadataHints(source.getMetadata());

    dataset.reload(source);
    dataset.startLoading();
    dataset.finishLoading(true);
    int assembled = dataset.assemblePatterns();
    logger.info("Assembled {} of {} arrays from {}", assembled, source.size(), filePath);
    return true;
  }

  private void applyMetadataHints(DiffractionMetadata metadata) {
    metadata.getDetectorExtent().ifPresent(detectorSettings::setImageExtent);
    metadata.getDetectorPixelGeometry().ifPresent(detectorSettings::setPixelGeometry);
    metadata.getDetectorBitDepth().ifPresent(detectorSettings::setBitDepth);
    metadata.getCropCenter().ifPresent(patternSettings::setCropCenter);
  }

  /// Restart processing of the arrays still queued, with the current settings
  public void startAssembling() {
    dataset.startLoading();
  }

  /// @param block wait for queued arrays and assemble them
  public void finishAssembling(boolean block) {
    dataset.finishLoading(block);
    if (block) {
      dataset.assemblePatterns();
    }
  }

  public void closePatterns() {
    dataset.clear();
  }

  /// Write the assembled patterns with a registered writer
  /// @param filePath the file to write
  /// @param fileType simple name of the writer
  /// @throws IOException if the file cannot be written
  /// @throws IllegalArgumentException if no writer has that name
  public void savePatterns(Path filePath, String fileType) throws IOException {
    DiffractionFileIO.Plugin<DiffractionFileWriter> plugin = fileIO.getWriter(fileType)
        .orElseThrow(() -> new IllegalArgumentException(
            "no diffraction file writer named '" + fileType + "', available: " + fileIO.getWriterNames()));
    logger.debug("Writing {} as {}", filePath, plugin.simpleName());
    plugin.create().write(filePath, dataset);
  }

  /// @param filePath an archive written by [#exportAssembledPatterns(Path)]
  /// @return false if the path is not a regular file
  /// @throws IOException if the archive cannot be read
  public boolean importAssembledPatterns(Path filePath) throws IOException {
    return dataset.importAssembledPatterns(filePath);
  }

  /// @param filePath the archive to write
  /// @throws IOException if the archive cannot be written
  public void exportAssembledPatterns(Path filePath) throws IOException {
    dataset.exportAssembledPatterns(filePath);
  }

  /// Read a detector bad pixel mask from a two-dimensional `.npy` array
  ///
  /// Nonzero elements mark bad pixels. The mask is used from the next start of assembly.
  /// @param filePath the mask file
  /// @return false if the path is not a regular file
  /// @throws IOException if the file cannot be read or is not a two-dimensional byte array
  public boolean openBadPixels(Path filePath) throws IOException {
    if (!Files.isRegularFile(filePath)) {
      logger.warn("Refusing to read invalid file path {}", filePath);
      return false;
    }
    NpyArray array;
    try (InputStream in = Files.newInputStream(filePath)) {
      array = NpyFormat.read(in);
    }
    if (array.rank() != 2) {
      throw new IOException(filePath + ": bad pixel mask must have rank 2, got " + array.rank());
    }
    int[] shape = array.shape();
    BadPixels badPixels;
    try {
      badPixels = BadPixels.of(new ImageExtent(shape[1], shape[0]), array.toBooleans());
    } catch (IllegalArgumentException e) {
      throw new IOException(filePath + ": " + e.getMessage(), e);
    }
    dataset.setBadPixels(badPixels);
    logger.info("Read {} bad pixels from {}", badPixels.countBad(), filePath);
    return true;
  }

  public void clearBadPixels() {
    dataset.setBadPixels(null);
  }
}
