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
import io.ptychotools.api.patterns.DiffractionPatterns;

/// One stage of the per-frame processing chain.
///
/// A step maps a rank 3 batch to a new batch, and describes the same geometric change on a
/// frame extent and on a bad pixel mask so the processed shape is known before any frame is seen.
public interface PatternStep {

  /// @param extent the frame extent entering this step
  /// @return the frame extent leaving this step
  /// @throws PatternConfigurationException if the step cannot be applied to frames of this extent
  ImageExtent apply(ImageExtent extent);

  /// @param patterns a rank 3 batch; not modified
  /// @return the processed batch
  DiffractionPatterns apply(DiffractionPatterns patterns);

  /// @param badPixels the mask entering this step
  /// @return the mask leaving this step
  BadPixels apply(BadPixels badPixels);
}
