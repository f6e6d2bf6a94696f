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
import io.ptychotools.api.patterns.DiffractionMetadata;
import io.ptychotools.api.patterns.DiffractionPatterns;
import io.ptychotools.api.patterns.PatternState;
import io.ptychotools.api.patterns.PixelType;
import io.ptychotools.api.patterns.SimpleDiffractionPatternArray;
import io.ptychotools.patterns.dataset.AssembledDiffractionDataset;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

@Timeout(30)
class PatternsStreamingContextTest {

  private PatternsCore core;

  @BeforeEach
  void setUp() {
    core = new PatternsCore();
    core.getDetectorSettings().setImageExtent(new ImageExtent(8, 8));
    core.getPatternSettings().setCropEnabled(false);
    core.getPatternSettings().setNumberOfDataThreads(2);
  }

  @AfterEach
  void tearDown() {
    core.close();
  }

  private static SimpleDiffractionPatternArray frames(String label, long first, int count) {
    DiffractionPatterns patterns = DiffractionPatterns.zeros(count, 8, 8);
    for (int n = 0; n < count; n++) {
      patterns.set(n, 0, 0, (int) (first + n));
    }
    return new SimpleDiffractionPatternArray(label, SimpleDiffractionPatternArray.indexRange(first, count), patterns);
  }

  @Test
  void assemblesArraysAppendedDuringSession() throws IOException {
    DiffractionMetadata metadata = DiffractionMetadata.builder(2, 6, PixelType.UINT32).build();
    PatternsStreamingContext context = core.getPatternsAPI().createStreamingContext(metadata);

    context.start();
    AssembledDiffractionDataset dataset = core.getDataset();
    assertThat(dataset.size()).isZero();
    assertThat(dataset.getContentsTree().getRow()).containsExactly("Name", "Type", "Details");

    context.appendArray(frames("burst-0", 0, 2));
    context.appendArray(frames("burst-1", 2, 2));
    context.appendArray(frames("burst-2", 4, 2));
    context.stop();

    assertThat(context.getQueueSize()).isZero();
    assertThat(dataset.getAssembledIndexes()).containsExactly(0, 1, 2, 3, 4, 5);
    assertThat(dataset.getAssembledPatterns().get(5, 0, 0)).isEqualTo(5);
    assertThat(dataset.get(2).getState()).isEqualTo(PatternState.LOADED);
    assertThat(dataset.getMetadata()).isSameAs(context.getMetadata());
  }

  @Test
  void stopWithoutArraysLeavesEmptyRows() throws IOException {
    PatternsStreamingContext context = core.getPatternsAPI()
        .createStreamingContext(DiffractionMetadata.builder(4, 4, PixelType.UINT16).build());

    context.start();
    context.stop();

    assertThat(core.getDataset().getAssembledIndexes()).isEmpty();
    assertThat(core.getDataset().getInfoText()).contains("4 x 8W x 8H");
  }

  @Test
  void finishAssemblingCollectsArraysQueuedAfterStart() throws IOException {
    PatternsAPI api = core.getPatternsAPI();
    PatternsStreamingContext context = api.createStreamingContext(DiffractionMetadata.builder(1, 2, PixelType.UINT8).build());
    context.start();
    api.finishAssembling(true);

    context.appendArray(frames("late-0", 0, 1));
    context.appendArray(frames("late-1", 1, 1));
    assertThat(context.getQueueSize()).isEqualTo(2);

    api.startAssembling();
    api.finishAssembling(true);

    assertThat(core.getDataset().getAssembledIndexes()).containsExactly(0, 1);
  }
}
