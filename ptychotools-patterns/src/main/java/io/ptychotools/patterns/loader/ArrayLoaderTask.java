package io.ptychotools.patterns.loader;

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


import io.ptychotools.api.patterns.DiffractionPatternArray;

/// A source array tagged with its position in the assembled dataset.
///
/// The position fixes the buffer rows the array is written to, whichever worker finishes it.
/// @param position zero-based source array position
/// @param array the raw array when queued for processing, the processed array when completed
public record ArrayLoaderTask(int position, DiffractionPatternArray array) {
}
