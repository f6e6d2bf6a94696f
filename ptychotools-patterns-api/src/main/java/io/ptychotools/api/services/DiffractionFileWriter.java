package io.ptychotools.api.services;

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

import io.ptychotools.api.patterns.DiffractionDataset;

import java.io.IOException;
import java.nio.file.Path;

/// Writes a diffraction dataset to a file.
///
/// Implementations are annotated with [FileFormat], have a public no-argument constructor and are
/// listed in `META-INF/services/io.ptychotools.api.services.DiffractionFileWriter`.
public interface DiffractionFileWriter {

  /// @param filePath the file to write
  /// @param dataset the dataset to persist
  /// @throws IOException if the file cannot be written
  void write(Path filePath, DiffractionDataset dataset) throws IOException;
}
