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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.function.Supplier;

/// Registry of diffraction file readers and writers, keyed by their [FileFormat] simple name.
///
/// The registry is resolved once, typically at startup through [#load()], and then answers
/// lookups by name or file extension without touching the service loader again. Names are
/// matched case-insensitively.
///
/// ```
/// DiffractionFileIO io = DiffractionFileIO.load();
/// DiffractionDataset dataset = io.getReader("NPZ").orElseThrow().create().read(path);
/// ```
public final class DiffractionFileIO {
  private static final Logger logger = LogManager.getLogger(DiffractionFileIO.class);

  /// A named format implementation.
  /// @param simpleName short name from [FileFormat#simpleName()]
  /// @param displayName display name from [FileFormat#displayName()]
  /// @param extensions file extensions, lower case with leading dot
  /// @param factory creates a fresh instance of the implementation
  /// @param <T> reader or writer type
  public record Plugin<T>(String simpleName, String displayName, List<String> extensions, Supplier<T> factory) {

    /// @return a new instance of the plugin implementation
    public T create() {
      return factory.get();
    }

    /// @param path a file path
    /// @return true if the file name ends with one of this plugin's extensions
    public boolean accepts(Path path) {
      String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
      return extensions.stream().anyMatch(name::endsWith);
    }
  }

  private final Map<String, Plugin<DiffractionFileReader>> readers;
  private final Map<String, Plugin<DiffractionFileWriter>> writers;

  /// Create a registry over explicit plugin lists
  /// @param readers reader plugins
  /// @param writers writer plugins
  public DiffractionFileIO(List<Plugin<DiffractionFileReader>> readers, List<Plugin<DiffractionFileWriter>> writers) {
    this.readers = index(readers);
    this.writers = index(writers);
  }

  /// Discover all readers and writers on the class path
  /// @return a registry of every annotated provider
  public static DiffractionFileIO load() {
    List<Plugin<DiffractionFileReader>> readers = discover(DiffractionFileReader.class);
    List<Plugin<DiffractionFileWriter>> writers = discover(DiffractionFileWriter.class);
    logger.debug("Discovered {} diffraction file readers and {} writers", readers.size(), writers.size());
    return new DiffractionFileIO(readers, writers);
  }

  /// Wrap an annotated implementation class as a plugin
  /// @param type the implementation class, which must carry [FileFormat]
  /// @param factory creates instances of the implementation
  /// @param <T> reader or writer type
  /// @return the plugin descriptor
  public static <T> Plugin<T> plugin(Class<? extends T> type, Supplier<T> factory) {
    FileFormat format = type.getAnnotation(FileFormat.class);
    if (format == null) {
      throw new IllegalArgumentException(type.getName() + " is missing the @FileFormat annotation");
    }
    List<String> extensions = Arrays.stream(format.extensions())
        .map(e -> e.toLowerCase(Locale.ROOT))
        .toList();
    return new Plugin<>(format.simpleName(), format.displayName(), extensions, factory);
  }

  public Optional<Plugin<DiffractionFileReader>> getReader(String simpleName) {
    return Optional.ofNullable(readers.get(key(simpleName)));
  }

  public Optional<Plugin<DiffractionFileWriter>> getWriter(String simpleName) {
    return Optional.ofNullable(writers.get(key(simpleName)));
  }

  /// Find a reader by file name extension
  /// @param path the file to read
  /// @return the first reader that accepts the extension
  public Optional<Plugin<DiffractionFileReader>> getReaderFor(Path path) {
    return readers.values().stream().filter(p -> p.accepts(path)).findFirst();
  }

  /// Find a writer by file name extension
  /// @param path the file to write
  /// @return the first writer that accepts the extension
  public Optional<Plugin<DiffractionFileWriter>> getWriterFor(Path path) {
    return writers.values().stream().filter(p -> p.accepts(path)).findFirst();
  }

  public List<Plugin<DiffractionFileReader>> getReaders() {
    return List.copyOf(readers.values());
  }

  public List<Plugin<DiffractionFileWriter>> getWriters() {
    return List.copyOf(writers.values());
  }

  public List<String> getReaderNames() {
    return readers.values().stream().map(Plugin::simpleName).toList();
  }

  public List<String> getWriterNames() {
    return writers.values().stream().map(Plugin::simpleName).toList();
  }

  private static <T> Map<String, Plugin<T>> index(List<Plugin<T>> plugins) {
    Map<String, Plugin<T>> map = new LinkedHashMap<>();
    for (Plugin<T> plugin : plugins) {
      Plugin<T> previous = map.putIfAbsent(key(plugin.simpleName()), plugin);
      if (previous != null) {
        logger.warn("Ignoring duplicate file format '{}' ({}), keeping '{}'",
            plugin.simpleName(), plugin.displayName(), previous.displayName());
      }
    }
    return Collections.unmodifiableMap(map);
  }

  private static <T> List<Plugin<T>> discover(Class<T> service) {
    List<Plugin<T>> plugins = new ArrayList<>();
    for (ServiceLoader.Provider<T> provider : ServiceLoader.load(service).stream().toList()) {
      Class<? extends T> type = provider.type();
      if (type.getAnnotation(FileFormat.class) == null) {
        logger.warn("Skipping {} provider {} without @FileFormat", service.getSimpleName(), type.getName());
        continue;
      }
      plugins.add(plugin(type, provider::get));
    }
    return plugins;
  }

  private static String key(String simpleName) {
    return simpleName.toLowerCase(Locale.ROOT);
  }
}
