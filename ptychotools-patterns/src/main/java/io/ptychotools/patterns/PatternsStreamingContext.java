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


import io.ptychotools.api.patterns.DiffractionMetadata;
import io.ptychotools.api.patterns.DiffractionPatternArray;
import io.ptychotools.api.patterns.SimpleDiffractionDataset;
import io.ptychotools.api.patterns.SimpleTreeNode;
import io.ptychotools.patterns.dataset.AssembledDiffractionDataset;

import java.io.IOException;
import java.util.List;

/// Feeds arrays from a live acquisition into an [AssembledDiffractionDataset].
///
/// ```
/// PatternsStreamingContext context = api.createStreamingContext(metadata);
/// context.start();
/// for (DiffractionPatternArray array : acquisition) {
///   context.appendArray(array);
/// }
/// context.stop();
/// ```
public class PatternsStreamingContext {

  private final AssembledDiffractionDataset dataset;
  private final DiffractionMetadata metadata;

  public PatternsStreamingContext(AssembledDiffractionDataset dataset, DiffractionMetadata metadata) {
    this.dataset = dataset;
    this.metadata = metadata;
  }

  public DiffractionMetadata getMetadata() {
    return metadata;
  }

  /// Size the dataset for the session and start the loader
  /// @throws IOException if the pattern buffer cannot be allocated
  public void start() throws IOException {
    SimpleTreeNode contentsTree = SimpleTreeNode.createRoot(List.of("Name", "Type", "Details"));
    dataset.reload(new SimpleDiffractionDataset(metadata, contentsTree, List.of()));
    dataset.startLoading();
  }

  /// @param array the next acquired array
  public void appendArray(DiffractionPatternArray array) {
    dataset.appendArray(array);
  }

  /// @return arrays waiting to be processed or assembled
  public int getQueueSize() {
    return dataset.getQueueSize();
  }

  /// Wait until every appended array is processed, then assemble them
  public void stop() {
    dataset.finishLoading(true);
    dataset.assemblePatterns();
  }
}
