package io.ptychotools.patterns.settings;

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


import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Dump;
import org.snakeyaml.engine.v2.api.DumpSettings;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.common.FlowStyle;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/// Reads and writes [DetectorSettings] and [PatternSettings] as a YAML document.
///
/// The document has two mappings, `Detector` and `Patterns`, whose keys match the setting
/// names:
///
/// ```yaml
/// Detector:
///   WidthInPixels: 1024
///   HeightInPixels: 1024
/// Patterns:
///   CropEnabled: true
///   CropWidthInPixels: 128
/// ```
///
/// Keys that are missing keep their current value. Unknown keys are logged and ignored.
public class PatternSettingsFile {
  private static final Logger logger = LogManager.getLogger(PatternSettingsFile.class);

  public static final String DETECTOR_GROUP = "Detector";
  public static final String PATTERNS_GROUP = "Patterns";

  private final DetectorSettings detectorSettings;
  private final PatternSettings patternSettings;

  public PatternSettingsFile(DetectorSettings detectorSettings, PatternSettings patternSettings) {
    this.detectorSettings = detectorSettings;
    this.patternSettings = patternSettings;
  }

  /// Apply the values of a settings file
  /// @param path the YAML file
  /// @throws IOException if the file cannot be read
  /// @throws PatternSettingsException if the file is not a valid settings document
  public void load(Path path) throws IOException {
    loadFromString(Files.readString(path), path.toString());
  }

  /// Apply the values of a settings document
  /// @param yamlText the YAML text
  /// @param sourceName name used in messages
  public void loadFromString(String yamlText, String sourceName) {
    LoadSettings loadSettings = LoadSettings.builder().setLabel(sourceName).build();
    Load yaml = new Load(loadSettings);
    Object document;
    try {
      document = yaml.loadFromString(yamlText);
    } catch (YamlEngineException e) {
      throw new PatternSettingsException("unable to parse settings file " + sourceName, e);
    }
    if (document == null) {
      logger.warn("Settings file {} is empty", sourceName);
      return;
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new PatternSettingsException(sourceName + " must contain a mapping of settings groups");
    }
    for (Map.Entry<?, ?> group : root.entrySet()) {
      String groupName = String.valueOf(group.getKey());
      if (!(group.getValue() instanceof Map<?, ?> values)) {
        throw new PatternSettingsException(sourceName + ": group " + groupName + " must be a mapping");
      }
      switch (groupName) {
        case DETECTOR_GROUP -> values.forEach((k, v) -> applyDetector(sourceName, String.valueOf(k), v));
        case PATTERNS_GROUP -> values.forEach((k, v) -> applyPatterns(sourceName, String.valueOf(k), v));
        default -> logger.warn("Ignoring unknown settings group '{}' in {}", groupName, sourceName);
      }
    }
  }

  /// Write the current values
  /// @param path the YAML file to write
  /// @throws IOException if the file cannot be written
  public void save(Path path) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(path, dumpToString());
    logger.info("Saved settings to {}", path);
  }

  /// @return the current values as a YAML document
  public String dumpToString() {
    DumpSettings dumpSettings = DumpSettings.builder().setDefaultFlowStyle(FlowStyle.BLOCK).build();
    Dump yaml = new Dump(dumpSettings);
    Map<String, Object> root = new LinkedHashMap<>();
    root.put(DETECTOR_GROUP, detectorValues());
    root.put(PATTERNS_GROUP, patternValues());
    return yaml.dumpToString(root);
  }

  private Map<String, Object> detectorValues() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("WidthInPixels", detectorSettings.getWidthInPixels());
    map.put("HeightInPixels", detectorSettings.getHeightInPixels());
    map.put("PixelWidthInMeters", detectorSettings.getPixelWidthInMeters());
    map.put("PixelHeightInMeters", detectorSettings.getPixelHeightInMeters());
    map.put("BitDepth", detectorSettings.getBitDepth());
    return map;
  }

  private Map<String, Object> patternValues() {
    PatternSettings s = patternSettings;
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("FileType", s.getFileType());
    map.put("FilePath", s.getFilePath().toString());
    map.put("MemmapEnabled", s.isMemmapEnabled());
    map.put("ScratchDirectory", s.getScratchDirectory().toString());
    map.put("NumberOfDataThreads", s.getNumberOfDataThreads());
    map.put("ProcessingQueueCapacity", s.getProcessingQueueCapacity());
    map.put("CropEnabled", s.isCropEnabled());
    map.put("CropCenterXInPixels", s.getCropCenterXInPixels());
    map.put("CropCenterYInPixels", s.getCropCenterYInPixels());
    map.put("CropWidthInPixels", s.getCropWidthInPixels());
    map.put("CropHeightInPixels", s.getCropHeightInPixels());
    map.put("BinningEnabled", s.isBinningEnabled());
    map.put("BinSizeX", s.getBinSizeX());
    map.put("BinSizeY", s.getBinSizeY());
    map.put("PaddingEnabled", s.isPaddingEnabled());
    map.put("PadX", s.getPadX());
    map.put("PadY", s.getPadY());
    map.put("FlipXEnabled", s.isFlipXEnabled());
    map.put("FlipYEnabled", s.isFlipYEnabled());
    map.put("ValueLowerBoundEnabled", s.isValueLowerBoundEnabled());
    map.put("ValueLowerBound", s.getValueLowerBound());
    map.put("ValueUpperBoundEnabled", s.isValueUpperBoundEnabled());
    map.put("ValueUpperBound", s.getValueUpperBound());
    return map;
  }

  private void applyDetector(String source, String key, Object value) {
    DetectorSettings d = detectorSettings;
    switch (key) {
      case "WidthInPixels" -> d.setWidthInPixels(asInt(source, key, value));
      case "HeightInPixels" -> d.setHeightInPixels(asInt(source, key, value));
      case "PixelWidthInMeters" -> d.setPixelWidthInMeters(asDouble(source, key, value));
      case "PixelHeightInMeters" -> d.setPixelHeightInMeters(asDouble(source, key, value));
      case "BitDepth" -> d.setBitDepth(asInt(source, key, value));
      default -> logger.warn("Ignoring unknown setting {}.{} in {}", DETECTOR_GROUP, key, source);
    }
  }

  private void applyPatterns(String source, String key, Object value) {
    PatternSettings s = patternSettings;
    switch (key) {
      case "FileType" -> s.setFileType(asString(source, key, value));
      case "FilePath" -> s.setFilePath(Path.of(asString(source, key, value)));
      case "MemmapEnabled" -> s.setMemmapEnabled(asBoolean(source, key, value));
      case "ScratchDirectory" -> s.setScratchDirectory(expandHome(asString(source, key, value)));
      case "NumberOfDataThreads" -> s.setNumberOfDataThreads(asInt(source, key, value));
      case "ProcessingQueueCapacity" -> s.setProcessingQueueCapacity(asInt(source, key, value));
      case "CropEnabled" -> s.setCropEnabled(asBoolean(source, key, value));
      case "CropCenterXInPixels" -> s.setCropCenterXInPixels(asInt(source, key, value));
      case "CropCenterYInPixels" -> s.setCropCenterYInPixels(asInt(source, key, value));
      case "CropWidthInPixels" -> s.setCropWidthInPixels(asInt(source, key, value));
      case "CropHeightInPixels" -> s.setCropHeightInPixels(asInt(source, key, value));
      case "BinningEnabled" -> s.setBinningEnabled(asBoolean(source, key, value));
      case "BinSizeX" -> s.setBinSizeX(asInt(source, key, value));
      case "BinSizeY" -> s.setBinSizeY(asInt(source, key, value));
      case "PaddingEnabled" -> s.setPaddingEnabled(asBoolean(source, key, value));
      case "PadX" -> s.setPadX(asInt(source, key, value));
      case "PadY" -> s.setPadY(asInt(source, key, value));
      case "FlipXEnabled" -> s.setFlipXEnabled(asBoolean(source, key, value));
      case "FlipYEnabled" -> s.setFlipYEnabled(asBoolean(source, key, value));
      case "ValueLowerBoundEnabled" -> s.setValueLowerBoundEnabled(asBoolean(source, key, value));
      case "ValueLowerBound" -> s.setValueLowerBound(asInt(source, key, value));
      case "ValueUpperBoundEnabled" -> s.setValueUpperBoundEnabled(asBoolean(source, key, value));
      case "ValueUpperBound" -> s.setValueUpperBound(asInt(source, key, value));
      default -> logger.warn("Ignoring unknown setting {}.{} in {}", PATTERNS_GROUP, key, source);
    }
  }

  static Path expandHome(String path) {
    if (path.equals("~") || path.startsWith("~/")) {
      return Path.of(System.getProperty("user.home") + path.substring(1));
    }
    return Path.of(path);
  }

  private static int asInt(String source, String key, Object value) {
    if (value instanceof Integer i) {
      return i;
    }
    if (value instanceof Long l && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
      return l.intValue();
    }
    throw mismatch(source, key, value, "an integer");
  }

  private static double asDouble(String source, String key, Object value) {
    if (value instanceof Number n) {
      return n.doubleValue();
    }
    throw mismatch(source, key, value, "a number");
  }

  private static boolean asBoolean(String source, String key, Object value) {
    if (value instanceof Boolean b) {
      return b;
    }
    throw mismatch(source, key, value, "true or false");
  }

  private static String asString(String source, String key, Object value) {
    if (value == null) {
      throw mismatch(source, key, null, "a string");
    }
    return String.valueOf(value);
  }

  private static PatternSettingsException mismatch(String source, String key, Object value, String expected) {
    return new PatternSettingsException(
        source + ": setting " + key + " must be " + expected + ", got '" + value + "'");
  }
}
