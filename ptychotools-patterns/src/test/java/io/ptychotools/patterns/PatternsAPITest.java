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
import io.ptychotools.api.patterns.DiffractionPatterns;
import io.ptychotools.api.patterns.PixelType;
import io.ptychotools.patterns.dataset.AssembledDiffractionDataset;
import io.ptychotools.patterns.npz.NpyArray;
import io.ptychotools.patterns.npz.NpyFormat;
import io.ptychotools.patterns.npz.NpzArchive;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PatternsAPITest {

  @TempDir
  Path tempDir;

  private PatternsCore core;
  private PatternsAPI api;

  @BeforeEach
  void setUp() {
    core = new PatternsCore();
    api = core.getPatternsAPI();
  }

  @AfterEach
  void tearDown() {
    core.close();
  }

  /// three 16x16 frames, every pixel of frame `n` holding `n + 1`
  private Path writeScan(String name) throws IOException {
    DiffractionPatterns patterns = DiffractionPatterns.zeros(3, 16, 16);
    for (int n = 0; n < 3; n++) {
      for (int i = 0; i < 256; i++) {
        patterns.values()[n * 256 + i] = n + 1;
      }
    }
    Map<String, NpyArray> contents = new LinkedHashMap<>();
    contents.put("indexes", NpyArray.ofLongs(new long[]{5, 6, 7}));
    contents.put("patterns", NpyArray.ofPatterns(patterns, PixelType.UINT16));
    Path file = tempDir.resolve(name);
    NpzArchive.write(file, contents);
    return file;
  }

  @Test
  void registersNpzFormat() {
    assertThat(api.getFileIO().getReaderNames()).contains("NPZ");
    assertThat(api.getFileIO().getWriterNames()).contains("NPZ");
  }

  @Test
  void openAssemblesWithDetectorExtentFromFile() throws IOException {
    core.getPatternSettings().setCropCenterXInPixels(8);
    core.getPatternSettings().setCropCenterYInPixels(8);
    core.getPatternSettings().setCropWidthInPixels(8);
    core.getPatternSettings().setCropHeightInPixels(4);

    assertThat(api.openPatterns(writeScan("scan.npz"))).isTrue();

    AssembledDiffractionDataset dataset = core.getDataset();
    assertThat(core.getDetectorSettings().getImageExtent()).isEqualTo(new ImageExtent(16, 16));
    assertThat(dataset.getAssembledIndexes()).containsExactly(5, 6, 7);
    DiffractionPatterns assembled = dataset.getAssembledPatterns();
    assertThat(assembled.shape()).containsExactly(3, 4, 8);
    assertThat(assembled.get(2, 3, 7)).isEqualTo(3);
    assertThat(dataset.getInfoText()).startsWith("scan: 3 x 8W x 4H uint16");
  }

  @Test
  void refusesMissingFile() throws IOException {
    assertThat(api.openPatterns(tempDir.resolve("absent.npz"))).isFalse();
    assertThat(core.getDataset().size()).isZero();
  }

  @Test
  void unknownReaderIsRejected() throws IOException {
    Path file = writeScan("scan.npz");

    assertThatThrownBy(() -> api.openPatterns(file, "HDF5"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("NPZ");
  }

  @Test
  void unreadableFileIsReported() throws IOException {
    Path file = tempDir.resolve("corrupt.npz");
    Files.writeString(file, "not a zip archive");

    assertThatThrownBy(() -> api.openPatterns(file, "npz"))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("Failed to read");
  }

  @Test
  void savedPatternsOpenAgain() throws IOException {
    core.getPatternSettings().setCropEnabled(false);
    core.getPatternSettings().setBinningEnabled(true);
    core.getPatternSettings().setBinSizeX(2);
    core.getPatternSettings().setBinSizeY(2);
    api.openPatterns(writeScan("scan.npz"));
    Path saved = tempDir.resolve("binned.npz");

    api.savePatterns(saved, "NPZ");

    Map<String, NpyArray> contents = NpzArchive.read(saved);
    assertThat(contents.get("indexes").toLongs()).containsExactly(5, 6, 7);
    DiffractionPatterns patterns = contents.get("patterns").toPatterns();
    assertThat(patterns.shape()).containsExactly(3, 8, 8);
    assertThat(patterns.get(1, 0, 0)).isEqualTo(8);
  }

  @Test
  void badPixelsAreExcludedFromCounts() throws IOException {
    core.getDetectorSettings().setImageExtent(new ImageExtent(16, 16));
    core.getPatternSettings().setCropEnabled(false);
    byte[] mask = new byte[256];
    mask[0] = 1;
    mask[255] = 1;
    Path maskFile = tempDir.resolve("mask.npy");
    try (OutputStream out = Files.newOutputStream(maskFile)) {
      NpyFormat.write(new NpyArray("|b1", new int[]{16, 16}, mask), out);
    }

    assertThat(api.openBadPixels(maskFile)).isTrue();
    api.openPatterns(writeScan("scan.npz"));

    assertThat(core.getDataset().getMaximumPatternCounts()).isEqualTo(3L * 254);

    api.clearBadPixels();
    assertThat(core.getDataset().getMaximumPatternCounts()).isEqualTo(3L * 256);
  }

  @Test
  void badPixelMaskMustBeTwoDimensional() throws IOException {
    Path maskFile = tempDir.resolve("flat.npy");
    try (OutputStream out = Files.newOutputStream(maskFile)) {
      NpyFormat.write(new NpyArray("|b1", new int[]{4}, new byte[4]), out);
    }

    assertThatThrownBy(() -> api.openBadPixels(maskFile))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("rank 2");
    assertThat(api.openBadPixels(tempDir.resolve("absent.npy"))).isFalse();
  }

  @Test
  void exportAndImportAssembledPatterns() throws IOException {
    core.getPatternSettings().setCropEnabled(false);
    api.openPatterns(writeScan("scan.npz"));
    Path exported = tempDir.resolve("assembled.npz");
    api.exportAssembledPatterns(exported);
    api.closePatterns();
    assertThat(core.getDataset().size()).isZero();

    assertThat(api.importAssembledPatterns(exported)).isTrue();

    assertThat(core.getDataset().getAssembledIndexes()).containsExactly(5, 6, 7);
    assertThat(core.getDataset().getAssembledPatterns().shape()).containsExactly(3, 16, 16);
  }

  @Test
  void settingsFileConfiguresProcessing() throws IOException {
    Path settings = tempDir.resolve("settings.yaml");
    Files.writeString(settings, """
        Patterns:
          CropEnabled: false
          FlipXEnabled: true
          NumberOfDataThreads: 2
        """);

    core.loadSettings(settings);
    api.openPatterns(writeScan("scan.npz"));

    assertThat(core.getPatternSettings().getNumberOfDataThreads()).isEqualTo(2);
    assertThat(core.getDataset().getAssembledPatterns().shape()).containsExactly(3, 16, 16);

    Path saved = tempDir.resolve("saved.yaml");
    core.saveSettings(saved);
    assertThat(Files.readString(saved)).contains("FlipXEnabled: true");
  }
}
