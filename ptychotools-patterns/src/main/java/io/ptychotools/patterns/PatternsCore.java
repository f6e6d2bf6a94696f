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


import io.ptychotools.api.services.DiffractionFileIO;
import io.ptychotools.patterns.dataset.AssembledDiffractionDataset;
import io.ptychotools.patterns.settings.DetectorSettings;
import io.ptychotools.patterns.settings.PatternSettings;
import io.ptychotools.patterns.settings.PatternSettingsFile;
import io.ptychotools.patterns.sizer.PatternSizer;

import java.io.IOException;
import java.nio.file.Path;

/// Wires settings, sizer, assembled dataset and file plugins together.
public class PatternsCore implements AutoCloseable {

  private final DetectorSettings detectorSettings = new DetectorSettings();
  private final PatternSettings patternSettings = new PatternSettings();
  private final PatternSettingsFile settingsFile = new PatternSettingsFile(detectorSettings, patternSettings);
  private final PatternSizer sizer = new PatternSizer(detectorSettings, patternSettings);
  private final AssembledDiffractionDataset dataset = new AssembledDiffractionDataset(patternSettings, sizer);
  private final PatternsAPI patternsAPI;

  /// Create a core with the readers and writers found on the class path
  public PatternsCore() {
    this(DiffractionFileIO.load());
  }

  public PatternsCore(DiffractionFileIO fileIO) {
    this.patternsAPI = new PatternsAPI(patternSettings, detectorSettings, dataset, fileIO);
  }

  public DetectorSettings getDetectorSettings() {
    return detectorSettings;
  }

  public PatternSettings getPatternSettings() {
    return patternSettings;
  }

  public PatternSizer getSizer() {
    return sizer;
  }

  public AssembledDiffractionDataset getDataset() {
    return dataset;
  }

  public PatternsAPI getPatternsAPI() {
    return patternsAPI;
  }

  /// @param path a YAML settings file
  /// @throws IOException if the file cannot be read
  public void loadSettings(Path path) throws IOException {
    settingsFile.load(path);
  }

  /// @param path the YAML settings file to write
  /// @throws IOException if the file cannot be written
  public void saveSettings(Path path) throws IOException {
    settingsFile.save(path);
  }

  @Override
  public void close() {
    dataset.close();
  }
}
