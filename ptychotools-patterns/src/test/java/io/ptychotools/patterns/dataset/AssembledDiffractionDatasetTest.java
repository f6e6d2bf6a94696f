package io.ptychotools.patterns.dataset;

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
import io.ptychotools.api.patterns.DiffractionMetadata;
import io.ptychotools.api.patterns.DiffractionPatternArray;
import io.ptychotools.api.patterns.DiffractionPatterns;
import io.ptychotools.api.patterns.PatternState;
import io.ptychotools.api.patterns.PixelType;
import io.ptychotools.api.patterns.SimpleDiffractionDataset;
import io.ptychotools.api.patterns.SimpleDiffractionPatternArray;
import io.ptychotools.api.patterns.SimpleTreeNode;
import io.ptychotools.patterns.npz.NpyArray;
import io.ptychotools.patterns.npz.NpzArchive;
import io.ptychotools.patterns.processor.PatternConfigurationException;
import io.ptychotools.patterns.settings.DetectorSettings;
import io.ptychotools.patterns.settings.PatternSettings;
import io.ptychotools.patterns.sizer.PatternSizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Timeout(60)
class AssembledDiffractionDatasetTest {

  private static final int SIZE = 128;

  @TempDir
  Path tempDir;

  private DetectorSettings detector;
  private PatternSettings settings;
  private AssembledDiffractionDataset dataset;

  @BeforeEach
  void setUp() {
    detector = new DetectorSettings();
    detector.setImageExtent(new ImageExtent(SIZE, SIZE));
    settings = new PatternSettings();
    settings.setCropEnabled(false);
    settings.setNumberOfDataThreads(3);
    dataset = new AssembledDiffractionDataset(settings, new PatternSizer(detector, settings));
  }

  @AfterEach
  void tearDown() {
    dataset.close();
  }

  /// every pixel of the frame for pattern index `i` holds the value `i + 1`
  private static DiffractionPatternArray array(String label, long firstIndex, int count, boolean slow) {
    long[] indexes = SimpleDiffractionPatternArray.indexRange(firstIndex, count);
    return SimpleDiffractionPatternArray.lazy(label, indexes, () -> {
      if (slow) {
        try {
          Thread.sleep(ThreadLocalRandom.current().nextInt(5, 40));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new IOException("interrupted", e);
        }
      }
      DiffractionPatterns patterns = DiffractionPatterns.zeros(count, SIZE, SIZE);
      int frameSize = SIZE * SIZE;
      for (int n = 0; n < count; n++) {
        for (int i = 0; i < frameSize; i++) {
          patterns.values()[n * frameSize + i] = (int) (firstIndex + n + 1);
        }
      }
      return patterns;
    });
  }

  private static SimpleDiffractionDataset source(int perArray, int total, List<DiffractionPatternArray> arrays) {
    DiffractionMetadata metadata = DiffractionMetadata.builder(perArray, total, PixelType.UINT16)
        .filePath(Path.of("/data/scan42.npz"))
        .build();
    return new SimpleDiffractionDataset(metadata, SimpleTreeNode.createRoot(List.of("Name", "Type", "Details")),
        arrays);
  }

  private static SimpleDiffractionDataset threeArraysOfTwo() {
    return source(2, 6, List.of(array("a", 0, 2, false), array("b", 2, 2, false), array("c", 4, 2, false)));
  }

  private void loadAll() {
    dataset.startLoading();
    dataset.finishLoading(true);
    dataset.assemblePatterns();
  }

  @Test
  void assemblesEveryArrayIntoItsRows() throws IOException {
    dataset.reload(threeArraysOfTwo());
    dataset.startLoading();
    dataset.finishLoading(true);

    assertThat(dataset.assemblePatterns()).isEqualTo(3);
    assertThat(dataset.getAssembledIndexes()).containsExactly(0, 1, 2, 3, 4, 5);
    DiffractionPatterns patterns = dataset.getAssembledPatterns();
    assertThat(patterns.shape()).containsExactly(6, SIZE, SIZE);
    for (int n = 0; n < 6; n++) {
      assertThat(patterns.get(n, 0, 0)).isEqualTo(n + 1);
      assertThat(patterns.get(n, SIZE - 1, SIZE - 1)).isEqualTo(n + 1);
    }
    assertThat(dataset.size()).isEqualTo(3);
    for (AssembledDiffractionPatternArray view : List.of(dataset.get(0), dataset.get(1), dataset.get(2))) {
      assertThat(view.getState()).isEqualTo(PatternState.LOADED);
      assertThat(view.getNumberOfPatterns()).isEqualTo(2);
    }
    assertThat(dataset.get(1).getIndexes()).containsExactly(2, 3);
    assertThat(dataset.get(1).getLabel()).isEqualTo("b");
  }

  @Test
  void completionOrderDoesNotMoveRows() throws IOException {
    List<DiffractionPatternArray> arrays = new ArrayList<>();
    for (int k = 0; k < 12; k++) {
      arrays.add(array("a" + k, 3L * k, 3, true));
    }
    settings.setNumberOfDataThreads(6);
    dataset.reload(source(3, 36, arrays));
    loadAll();

    assertThat(dataset.getAssembledIndexes()).containsExactly(LongStream.range(0, 36).toArray());
    DiffractionPatterns patterns = dataset.getAssembledPatterns();
    for (int row = 0; row < 36; row++) {
      assertThat(patterns.get(row, 7, 9)).as("row %d", row).isEqualTo(row + 1);
    }
  }

  @Test
  void nothingIsAssembledBeforeLoadingStarts() throws IOException {
    dataset.reload(threeArraysOfTwo());

    assertThat(dataset.assemblePatterns()).isZero();
    assertThat(dataset.getAssembledIndexes()).isEmpty();
    assertThat(dataset.getAssembledPatterns().count()).isZero();
    assertThat(dataset.get(0).getState()).isEqualTo(PatternState.LOADING);
    assertThat(dataset.get(0).getIndexes()).containsExactly(-1, -1);
    assertThat(dataset.getQueueSize()).isEqualTo(3);
  }

  @Test
  void stoppingEarlyAssemblesASubset() throws IOException {
    List<DiffractionPatternArray> arrays = new ArrayList<>();
    for (int k = 0; k < 40; k++) {
      arrays.add(array("a" + k, 2L * k, 2, true));
    }
    settings.setNumberOfDataThreads(1);
    dataset.reload(source(2, 80, arrays));
    dataset.startLoading();
    dataset.finishLoading(false);
    dataset.assemblePatterns();

    long[] assembled = dataset.getAssembledIndexes();
    assertThat(assembled.length).isLessThan(80);
    assertThat(assembled).isSorted();
    DiffractionPatterns patterns = dataset.getAssembledPatterns();
    for (int n = 0; n < assembled.length; n++) {
      assertThat(patterns.get(n, 0, 0)).isEqualTo((int) assembled[n] + 1);
    }
  }

  @Test
  void assemblingTwiceChangesNothing() throws IOException {
    dataset.reload(threeArraysOfTwo());
    loadAll();
    long[] indexes = dataset.getAssembledIndexes();
    DiffractionPatterns patterns = dataset.getAssembledPatterns();

    assertThat(dataset.assemblePatterns()).isZero();
    assertThat(dataset.getAssembledIndexes()).isEqualTo(indexes);
    assertThat(dataset.getAssembledPatterns()).isEqualTo(patterns);
  }

  @Test
  void shortLastArrayLeavesUnloadedRows() throws IOException {
    dataset.reload(source(4, 8, List.of(array("a", 0, 4, false), array("b", 4, 2, false))));
    loadAll();

    assertThat(dataset.getAssembledIndexes()).containsExactly(0, 1, 2, 3, 4, 5);
    assertThat(dataset.get(1).getIndexes()).containsExactly(4, 5, -1, -1);
    assertThat(dataset.get(1).getMaxPatternCounts()).isEqualTo(6L * SIZE * SIZE);
  }

  @Test
  void oversizedArrayIsDropped() throws IOException {
    dataset.reload(source(2, 4, List.of(array("a", 0, 3, false), array("b", 2, 2, false))));
    loadAll();

    assertThat(dataset.getAssembledIndexes()).containsExactly(2, 3);
    assertThat(dataset.get(0).getState()).isEqualTo(PatternState.LOADING);
  }

  @Test
  void arraysAppendedAfterReloadAreAssembled() throws IOException {
    dataset.reload(source(2, 4, List.of()));
    dataset.startLoading();
    AssembledDiffractionPatternArray first = dataset.appendArray(array("live-0", 0, 2, false));
    AssembledDiffractionPatternArray second = dataset.appendArray(array("live-1", 2, 2, false));
    dataset.finishLoading(true);
    dataset.assemblePatterns();

    assertThat(first.getArrayIndex()).isZero();
    assertThat(second.getFirstRow()).isEqualTo(2);
    assertThat(dataset.getAssembledIndexes()).containsExactly(0, 1, 2, 3);
  }

  @Test
  void settingsChangedAfterReloadAreRejected() throws IOException {
    dataset.reload(threeArraysOfTwo());
    settings.setBinningEnabled(true);
    settings.setBinSizeX(2);
    settings.setBinSizeY(2);

    assertThatThrownBy(dataset::startLoading)
        .isInstanceOf(PatternConfigurationException.class)
        .hasMessageContaining("reload");
  }

  @Test
  void processedFramesUseSettingsAtReload() throws IOException {
    settings.setBinningEnabled(true);
    settings.setBinSizeX(4);
    settings.setBinSizeY(8);
    dataset.reload(threeArraysOfTwo());
    loadAll();

    DiffractionPatterns patterns = dataset.getAssembledPatterns();
    assertThat(patterns.shape()).containsExactly(6, SIZE / 8, SIZE / 4);
    assertThat(patterns.get(2, 0, 0)).isEqualTo(3 * 32);
  }

  @Test
  void badPixelsAreLeftOutOfCounts() throws IOException {
    boolean[] mask = new boolean[SIZE * SIZE];
    for (int i = 0; i < SIZE; i++) {
      mask[i] = true;
    }
    dataset.setBadPixels(BadPixels.of(new ImageExtent(SIZE, SIZE), mask));
    dataset.reload(threeArraysOfTwo());
    loadAll();

    long goodPixels = (long) SIZE * (SIZE - 1);
    assertThat(dataset.getProcessedBadPixels().countBad()).isEqualTo(SIZE);
    assertThat(dataset.getMaximumPatternCounts()).isEqualTo(6 * goodPixels);
    assertThat(dataset.get(0).getPatternCounts(1)).isEqualTo(2 * goodPixels);
    assertThat(dataset.get(0).getMeanPatternCounts()).isEqualTo(1.5 * goodPixels);
  }

  @Test
  void unsigned32BitCountsStayPositiveThroughFilterAndCounts() throws IOException {
    int large = (int) 3_000_000_000L;
    DiffractionPatterns frames = DiffractionPatterns.zeros(2, SIZE, SIZE);
    Arrays.fill(frames.values(), 0, SIZE * SIZE, large);
    Arrays.fill(frames.values(), SIZE * SIZE, 2 * SIZE * SIZE, 5);
    DiffractionMetadata metadata = DiffractionMetadata.builder(2, 2, PixelType.UINT32).build();
    settings.setValueLowerBoundEnabled(true);
    settings.setValueLowerBound(10);
    dataset.reload(new SimpleDiffractionDataset(metadata, SimpleTreeNode.createRoot(List.of("Name")),
        List.of(new SimpleDiffractionPatternArray("bright", new long[]{0, 1}, frames))));
    loadAll();

    long frameCounts = 3_000_000_000L * SIZE * SIZE;
    assertThat(dataset.getMaximumPatternCounts()).isEqualTo(frameCounts);
    assertThat(dataset.get(0).getPatternCounts(0)).isEqualTo(frameCounts);
    assertThat(dataset.get(0).getPatternCounts(1)).isZero();
    assertThat(dataset.get(0).getMaxPatternCounts()).isEqualTo(frameCounts);
    assertThat(dataset.get(0).getAveragePattern()[0]).isEqualTo(1_500_000_000.0);
  }

  @Test
  void assembledPatternsFollowTheCurrentBuffer() throws IOException {
    dataset.reload(threeArraysOfTwo());
    loadAll();
    assertThat(dataset.getAssembledPatterns().count()).isEqualTo(6);

    dataset.reload(source(2, 2, List.of(array("d", 0, 2, false))));

    assertThat(dataset.getAssembledPatterns().count()).isZero();
    loadAll();
    DiffractionPatterns patterns = dataset.getAssembledPatterns();
    assertThat(patterns.shape()).containsExactly(2, SIZE, SIZE);
    assertThat(patterns.get(1, 0, 0)).isEqualTo(2);
    assertThat(dataset.getMaximumPatternCounts()).isEqualTo(2L * SIZE * SIZE);
  }

  @Test
  void clearEmptiesTheDataset() throws IOException {
    dataset.reload(threeArraysOfTwo());
    loadAll();

    dataset.clear();

    assertThat(dataset.size()).isZero();
    assertThat(dataset.getAssembledIndexes()).isEmpty();
    assertThat(dataset.getMetadata().numberOfPatternsTotal()).isZero();
    assertThat(dataset.getInfoText()).startsWith("None: 0 x");
  }

  @Test
  void infoTextDescribesBuffer() throws IOException {
    dataset.reload(threeArraysOfTwo());

    assertThat(dataset.getInfoText()).isEqualTo("scan42: 6 x 128W x 128H uint16 [0.19MB]");
  }

  @Test
  void memoryMappedBufferIsReleasedOnReload() throws IOException {
    Path scratch = tempDir.resolve("scratch");
    settings.setMemmapEnabled(true);
    settings.setScratchDirectory(scratch);
    dataset.reload(threeArraysOfTwo());
    loadAll();

    assertThat(dataset.getAssembledIndexes()).hasSize(6);
    try (var files = Files.list(scratch)) {
      assertThat(files.count()).isEqualTo(1);
    }

    dataset.clear();
    try (var files = Files.list(scratch)) {
      assertThat(files.count()).isZero();
    }
  }

  @Test
  void exportedPatternsImportAsOneLoadedArray() throws IOException {
    dataset.reload(threeArraysOfTwo());
    loadAll();
    DiffractionPatterns expected = dataset.getAssembledPatterns();
    Path archive = tempDir.resolve("assembled.npz");
    dataset.exportAssembledPatterns(archive);
    dataset.clear();

    assertThat(dataset.importAssembledPatterns(archive)).isTrue();

    assertThat(dataset.size()).isEqualTo(1);
    assertThat(dataset.get(0).getLabel()).isEqualTo("Imported");
    assertThat(dataset.get(0).getState()).isEqualTo(PatternState.LOADED);
    assertThat(dataset.getAssembledIndexes()).containsExactly(0, 1, 2, 3, 4, 5);
    assertThat(dataset.getAssembledPatterns()).isEqualTo(expected);
    assertThat(dataset.getMetadata().patternDataType()).isEqualTo(PixelType.UINT16);
    assertThat(dataset.importAssembledPatterns(tempDir.resolve("missing.npz"))).isFalse();
  }

  @Test
  void partlyLoadedPatternsExportOnlyLoadedRows() throws IOException {
    dataset.reload(source(2, 6, List.of(array("a", 0, 2, false), array("c", 4, 2, false))));
    loadAll();
    Path archive = tempDir.resolve("partial.npz");

    dataset.exportAssembledPatterns(archive);

    Map<String, NpyArray> arrays = NpzArchive.read(archive);
    assertThat(arrays.get("indexes").toLongs()).containsExactly(0L, 1L, 4L, 5L);
    NpyArray patterns = arrays.get("patterns");
    assertThat(patterns.shape()).containsExactly(4, SIZE, SIZE);
    assertThat(patterns.toPatterns().get(2, 0, 0)).isEqualTo(5);
    assertThat(patterns.pixelType()).isEqualTo(PixelType.UINT16);
  }

  @Test
  void importRejectsMismatchedOrMissingArrays() throws IOException {
    Path mismatched = tempDir.resolve("mismatched.npz");
    NpzArchive.write(mismatched, Map.of(
        "indexes", NpyArray.ofLongs(new long[]{0, 1}),
        "patterns", NpyArray.ofPatterns(DiffractionPatterns.zeros(3, 4, 4), PixelType.UINT16)));
    Path indexesOnly = tempDir.resolve("indexes-only.npz");
    NpzArchive.write(indexesOnly, Map.of("indexes", NpyArray.ofLongs(new long[]{0})));

    assertThatThrownBy(() -> dataset.importAssembledPatterns(mismatched))
        .isInstanceOf(IOException.class).hasMessageContaining("2 indexes for 3 patterns");
    assertThatThrownBy(() -> dataset.importAssembledPatterns(indexesOnly))
        .isInstanceOf(IOException.class).hasMessageContaining("patterns");
    assertThat(dataset.size()).isZero();
  }

  @Test
  void observersReceiveEventsInOrder() throws IOException {
    List<DatasetEvent> received = new ArrayList<>();
    dataset.addObserver(received::add);
    dataset.reload(threeArraysOfTwo());
    loadAll();

    dataset.notifyObserversIfChanged();

    assertThat(received).hasSize(7);
    assertThat(received.get(0)).isEqualTo(DatasetEvent.reloaded());
    assertThat(received.subList(1, 4))
        .containsExactly(DatasetEvent.inserted(0), DatasetEvent.inserted(1), DatasetEvent.inserted(2));
    assertThat(received.subList(4, 7))
        .containsExactlyInAnyOrder(DatasetEvent.changed(0), DatasetEvent.changed(1), DatasetEvent.changed(2));

    received.clear();
    dataset.notifyObserversIfChanged();
    assertThat(received).isEmpty();
  }
}
