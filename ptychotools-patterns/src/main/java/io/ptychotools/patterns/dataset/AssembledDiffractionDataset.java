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
import io.ptychotools.api.patterns.DiffractionDataset;
import io.ptychotools.api.patterns.DiffractionMetadata;
import io.ptychotools.api.patterns.DiffractionPatternArray;
import io.ptychotools.api.patterns.DiffractionPatterns;
import io.ptychotools.api.patterns.PatternState;
import io.ptychotools.api.patterns.PixelType;
import io.ptychotools.api.patterns.SimpleTreeNode;
import io.ptychotools.patterns.loader.ArrayLoaderTask;
import io.ptychotools.patterns.loader.PatternLoader;
import io.ptychotools.patterns.npz.NpyArray;
import io.ptychotools.patterns.npz.NpyFormat;
import io.ptychotools.patterns.npz.NpzArchive;
import io.ptychotools.patterns.npz.NpzDiffractionFileReader;
import io.ptychotools.patterns.processor.PatternConfigurationException;
import io.ptychotools.patterns.processor.PatternProcessor;
import io.ptychotools.patterns.settings.PatternSettings;
import io.ptychotools.patterns.sizer.PatternSizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.IntStream;

/// The processed patterns of one dataset, assembled into a single buffer.
///
/// [#reload(DiffractionDataset)] sizes a buffer for every pattern the metadata announces and
/// queues the source arrays. Source array `k` owns buffer rows
/// `[k * patternsPerArray, (k + 1) * patternsPerArray)`, so processed arrays can be written as
/// they complete, in any order, without coordinating with each other. [#assemblePatterns()]
/// moves completed arrays into their rows and records their pattern indexes. Rows not yet
/// written carry the index -1.
///
/// Typical use from one owning thread:
/// ```
/// dataset.reload(source);
/// dataset.startLoading();
/// dataset.finishLoading(true);
/// dataset.assemblePatterns();
/// dataset.notifyObserversIfChanged();
/// ```
///
/// The reload, clear, import and close operations are meant to be called from the owning
/// thread. Source arrays may be appended and assembled views read from any thread.
public class AssembledDiffractionDataset implements DiffractionDataset, AutoCloseable {
  private static final Logger logger = LogManager.getLogger(AssembledDiffractionDataset.class);

  public static final long UNLOADED_INDEX = -1L;
  private static final double BYTES_PER_MEGABYTE = 1024.0 * 1024.0;

  private final PatternSettings settings;
  private final PatternSizer sizer;
  private final PatternLoader loader;

  private final ReentrantLock lock = new ReentrantLock();
  private final List<AssembledDiffractionPatternArray> arrays = new ArrayList<>();
  private final List<DiffractionDatasetObserver> observers = new CopyOnWriteArrayList<>();
  private final ConcurrentLinkedQueue<DatasetEvent> events = new ConcurrentLinkedQueue<>();
  private final AtomicBoolean changed = new AtomicBoolean(false);

  private volatile DiffractionMetadata metadata = DiffractionMetadata.createNull();
  private volatile SimpleTreeNode contentsTree = emptyTree();
  private volatile long[] indexes = new long[0];
  private volatile PatternBuffer buffer = PatternBuffer.empty();
  private volatile BadPixels badPixels;
  private volatile boolean[] goodPixels = new boolean[0];
  private int arrayCounter = 0;

  public AssembledDiffractionDataset(PatternSettings settings, PatternSizer sizer) {
    this.settings = settings;
    this.sizer = sizer;
    this.loader = new PatternLoader(settings);
  }

  private static SimpleTreeNode emptyTree() {
    return SimpleTreeNode.createRoot(List.of());
  }

  public PatternLoader getLoader() {
    return loader;
  }

  @Override
  public DiffractionMetadata getMetadata() {
    return metadata;
  }

  @Override
  public SimpleTreeNode getContentsTree() {
    return contentsTree;
  }

  /// Replace the dataset with a new source
  ///
  /// Loading in progress is stopped without finishing. The previous buffer is released, a
  /// zeroed buffer of `(total patterns, processed height, processed width)` is allocated and
  /// every source array is appended. Observers receive [DatasetEvent.Kind#RELOADED] followed by
  /// one [DatasetEvent.Kind#INSERTED] per array.
  /// @param dataset the source
  /// @throws IOException if the buffer cannot be allocated; the dataset is then left empty
  public void reload(DiffractionDataset dataset) throws IOException {
    stopAndDiscard();
    DiffractionMetadata newMetadata = dataset.getMetadata();
    ImageExtent extent = sizer.getProcessedImageExtent();
    int total = newMetadata.numberOfPatternsTotal();

    PatternBuffer newBuffer;
    try {
      newBuffer = allocateBuffer(total, extent, newMetadata.patternDataType());
    } catch (IOException | RuntimeException e) {
      logger.error("Unable to allocate {} patterns of {} for {}", total, extent,
          newMetadata.getFilePath().map(Path::toString).orElse("dataset"));
      resetToEmpty();
      emit(DatasetEvent.reloaded());
      throw e instanceof IOException io ? io : new IOException("unable to allocate pattern buffer", e);
    }

    long[] newIndexes = new long[total];
    Arrays.fill(newIndexes, UNLOADED_INDEX);
    lock.lock();
    try {
      replaceBuffer(newBuffer);
      indexes = newIndexes;
      metadata = newMetadata;
      contentsTree = dataset.getContentsTree();
      arrays.clear();
      arrayCounter = 0;
      badPixelsChanged();
    } finally {
      lock.unlock();
    }
    emit(DatasetEvent.reloaded());

    for (DiffractionPatternArray array : dataset) {
      appendArray(array);
    }
  }

  private PatternBuffer allocateBuffer(int rows, ImageExtent extent, PixelType pixelType) throws IOException {
    if (settings.isMemmapEnabled()) {
      return PatternBuffer.map(rows, extent, pixelType, settings.getScratchDirectory());
    }
    logger.info("Scratch memory is {} x {} {}", rows, extent, pixelType);
    return PatternBuffer.allocate(rows, extent, pixelType);
  }

  /// Start processing queued source arrays
  ///
  /// The processor is built from the current settings and kept for the whole run.
  /// @throws PatternConfigurationException if the settings cannot be applied to the detector,
  ///     or produce frames of a different extent than the buffer was sized for
  public void startLoading() {
    PatternProcessor processor = sizer.buildProcessor(badPixels, metadata.patternDataType());
    ImageExtent bufferExtent = buffer.frameExtent();
    if (buffer.rows() > 0 && !processor.getProcessedExtent().equals(bufferExtent)) {
      throw new PatternConfigurationException(
          "processed frames of " + processor.getProcessedExtent() + " do not fit the buffer frames of "
              + bufferExtent + "; reload after changing the pattern settings");
    }
    loader.start(processor);
  }

  /// Stop processing
  /// @param block wait until every queued array has been processed
  public void finishLoading(boolean block) {
    loader.stop(block);
  }

  /// Queue a source array for processing
  ///
  /// The array gets the next position, which fixes its buffer rows.
  /// @param array the source array
  /// @return the assembled view of the array's rows
  public AssembledDiffractionPatternArray appendArray(DiffractionPatternArray array) {
    AssembledDiffractionPatternArray view;
    lock.lock();
    try {
      int position = arrayCounter++;
      int perArray = metadata.numberOfPatternsPerArray();
      int rows = buffer.rows();
      int first = (int) Math.min((long) position * perArray, rows);
      int last = (int) Math.min((long) (position + 1) * perArray, rows);
      view = new AssembledDiffractionPatternArray(array.getLabel(), position, first, last - first, indexes,
          buffer, lock, this::getGoodPixels, PatternState.LOADING);
      arrays.add(view);
    } finally {
      lock.unlock();
    }
    loader.submit(new ArrayLoaderTask(view.getArrayIndex(), array));
    emit(DatasetEvent.inserted(view.getArrayIndex()));
    return view;
  }

  /// Write every completed array into its buffer rows, without waiting
  /// @return the number of arrays assembled
  public int assemblePatterns() {
    int assembled = 0;
    for (ArrayLoaderTask task : loader.completedTasks()) {
      if (assemble(task)) {
        assembled++;
      }
    }
    return assembled;
  }

  private boolean assemble(ArrayLoaderTask task) {
    int position = task.position();
    DiffractionPatternArray processed = task.array();
    DiffractionPatterns data;
    try {
      data = processed.getData();
    } catch (IOException e) {
      logger.error("Unable to read processed array {}: {}", processed.getLabel(), e.getMessage());
      return false;
    }

    PatternBuffer target = buffer;
    long perArray = metadata.numberOfPatternsPerArray();
    long first = position * perArray;
    int count = data.count();
    if (count > perArray || first + count > target.rows()) {
      logger.warn("Dropping array {} at position {}: {} patterns do not fit rows [{}, {}) of {}",
          processed.getLabel(), position, count, first, first + perArray, target.rows());
      return false;
    }
    if (data.width() != target.frameExtent().widthInPixels()
        || data.height() != target.frameExtent().heightInPixels()) {
      logger.warn("Dropping array {} at position {}: frames of {}W x {}H do not match buffer frames of {}",
          processed.getLabel(), position, data.width(), data.height(), target.frameExtent());
      return false;
    }

    int firstRow = (int) first;
    target.writeRows(firstRow, data);

    long[] arrayIndexes = processed.getIndexes();
    if (arrayIndexes.length != count) {
      logger.warn("Array {} has {} indexes for {} patterns", processed.getLabel(), arrayIndexes.length, count);
    }
    lock.lock();
    try {
      if (target != buffer) {
        logger.debug("Discarding array {} assembled into a replaced buffer", processed.getLabel());
        return false;
      }
      System.arraycopy(arrayIndexes, 0, indexes, firstRow, Math.min(arrayIndexes.length, count));
      if (position < arrays.size()) {
        arrays.get(position).markLoaded();
      }
    } finally {
      lock.unlock();
    }
    emit(DatasetEvent.changed(position));
    return true;
  }

  /// @return pattern indexes of the loaded rows, in row order
  public long[] getAssembledIndexes() {
    lock.lock();
    try {
      return Arrays.stream(indexes).filter(i -> i >= 0).toArray();
    } finally {
      lock.unlock();
    }
  }

  /// @return the loaded rows as a `(loaded, height, width)` batch, in row order
  /// @throws IllegalArgumentException if the loaded rows do not fit in one Java array; use
  ///     [#exportAssembledPatterns(Path)] for such datasets
  public DiffractionPatterns getAssembledPatterns() {
    lock.lock();
    try {
      return buffer.readRows(loadedRows(indexes));
    } finally {
      lock.unlock();
    }
  }

  private LoadedRows snapshotLoadedRows() {
    lock.lock();
    try {
      long[] current = indexes;
      int[] rows = loadedRows(current);
      long[] rowIndexes = Arrays.stream(rows).mapToLong(row -> current[row]).toArray();
      return new LoadedRows(buffer, rows, rowIndexes, goodPixelsFor(buffer));
    } finally {
      lock.unlock();
    }
  }

  private static int[] loadedRows(long[] current) {
    return IntStream.range(0, current.length).filter(i -> current[i] >= 0).toArray();
  }

  /// Loaded rows of one buffer, read under one lock.
  private record LoadedRows(PatternBuffer buffer, int[] rows, long[] indexes, boolean[] goodPixels) {
  }

  /// Stop loading and reset to an empty dataset
  public void clear() {
    stopAndDiscard();
    resetToEmpty();
    emit(DatasetEvent.reloaded());
  }

  private void stopAndDiscard() {
    loader.stop(false);
    int discarded = loader.discardQueuedTasks() + loader.completedTasks().size();
    if (discarded > 0) {
      logger.debug("Discarded {} queued pattern arrays", discarded);
    }
  }

  private void resetToEmpty() {
    lock.lock();
    try {
      replaceBuffer(PatternBuffer.empty());
      indexes = new long[0];
      metadata = DiffractionMetadata.createNull();
      contentsTree = emptyTree();
      arrays.clear();
      arrayCounter = 0;
      goodPixels = new boolean[0];
    } finally {
      lock.unlock();
    }
  }

  private void replaceBuffer(PatternBuffer replacement) {
    PatternBuffer previous = buffer;
    buffer = replacement;
    try {
      previous.close();
    } catch (IOException e) {
      logger.warn("Unable to release pattern buffer {}: {}", previous, e.getMessage());
    }
  }

  @Override
  public AssembledDiffractionPatternArray get(int index) {
    lock.lock();
    try {
      return arrays.get(index);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int size() {
    lock.lock();
    try {
      return arrays.size();
    } finally {
      lock.unlock();
    }
  }

  /// @return processing plus assembly queue depth
  public int getQueueSize() {
    return loader.getProcessingQueueSize() + loader.getAssemblyQueueSize();
  }

  public BadPixels getBadPixels() {
    return badPixels;
  }

  /// @param badPixels the detector bad pixel mask, or null for none; used from the next
  ///     [#startLoading()] on
  public void setBadPixels(BadPixels badPixels) {
    this.badPixels = badPixels;
    badPixelsChanged();
  }

  /// @return the bad pixel mask of processed frames
  public BadPixels getProcessedBadPixels() {
    ImageExtent extent = buffer.frameExtent();
    BadPixels detectorMask = badPixels;
    if (detectorMask == null) {
      return BadPixels.none(extent);
    }
    try {
      BadPixels processed = sizer.getProcessedBadPixels(detectorMask);
      if (processed.extent().equals(extent)) {
        return processed;
      }
      logger.warn("Processed bad pixel mask {} does not match buffer frames of {}", processed.extent(), extent);
    } catch (PatternConfigurationException e) {
      logger.warn("Unable to process bad pixel mask: {}", e.getMessage());
    }
    return BadPixels.none(extent);
  }

  private void badPixelsChanged() {
    goodPixels = getProcessedBadPixels().goodPixels();
  }

  /// @return good pixel flags of processed frames, or null when every pixel counts
  boolean[] getGoodPixels() {
    return goodPixelsFor(buffer);
  }

  private boolean[] goodPixelsFor(PatternBuffer target) {
    boolean[] good = goodPixels;
    return good.length == target.frameExtent().size() ? good : null;
  }

  /// Frames are read one at a time, so this works for buffers of any size.
  /// @return the largest summed counts of any loaded frame, ignoring bad pixels, or 0
  public long getMaximumPatternCounts() {
    LoadedRows loaded = snapshotLoadedRows();
    PixelType pixelType = loaded.buffer().pixelType();
    long maximum = 0L;
    for (int row : loaded.rows()) {
      DiffractionPatterns frame = loaded.buffer().readRows(row, 1);
      maximum = Math.max(maximum, frame.frameCounts(0, loaded.goodPixels(), pixelType));
    }
    return maximum;
  }

  /// @return a one-line summary such as `scan42: 6 x 128W x 128H uint16 [0.19MB]`
  public String getInfoText() {
    PatternBuffer current = buffer;
    String label = metadata.getFileStem().orElse("None");
    ImageExtent extent = current.frameExtent();
    return String.format(Locale.ROOT, "%s: %d x %dW x %dH %s [%.2fMB]", label, current.rows(), extent.widthInPixels(),
        extent.heightInPixels(), current.pixelType().name().toLowerCase(Locale.ROOT),
        current.sizeInBytes() / BYTES_PER_MEGABYTE);
  }

  /// Write the loaded rows and their indexes as an NPZ archive
  /// @param filePath the archive to write
  /// @throws IOException if the archive cannot be written
  public void exportAssembledPatterns(Path filePath) throws IOException {
    logger.debug("Writing processed patterns to {}", filePath);
    LoadedRows loaded = snapshotLoadedRows();
    PatternBuffer source = loaded.buffer();
    int[] shape = source.shape();
    shape[0] = loaded.rows().length;
    try (NpzArchive.Writer writer = NpzArchive.create(filePath)) {
      writer.putArray(NpzDiffractionFileReader.INDEXES, NpyArray.ofLongs(loaded.indexes()));
      NpyFormat.Header header = new NpyFormat.Header(source.pixelType().descr(), shape);
      writer.putArray(NpzDiffractionFileReader.PATTERNS, header, out -> {
        for (int row : loaded.rows()) {
          source.copyRowTo(row, out);
        }
      });
    }
  }

  /// Replace the dataset with processed patterns written by [#exportAssembledPatterns(Path)]
  ///
  /// The patterns are taken as already processed. The dataset holds a single array labelled
  /// `Imported`.
  /// @param filePath the archive to read
  /// @return false if the path is not a regular file
  /// @throws IOException if the archive cannot be read or is malformed
  public boolean importAssembledPatterns(Path filePath) throws IOException {
    if (!Files.isRegularFile(filePath)) {
      logger.warn("Refusing to read invalid file path {}", filePath);
      return false;
    }
    clear();
    logger.debug("Reading processed patterns from {}", filePath);
    long[] importedIndexes = NpzArchive.readArray(filePath, NpzDiffractionFileReader.INDEXES, (header, in) -> {
      try {
        return NpyFormat.readData(header, in).toLongs();
      } catch (IllegalArgumentException e) {
        throw new IOException(e.getMessage(), e);
      }
    }).orElseThrow(() -> missingAssembledArrays(filePath));
    PatternBuffer imported = NpzArchive.readArray(filePath, NpzDiffractionFileReader.PATTERNS,
        (header, in) -> readAssembledBuffer(header, in, importedIndexes.length))
        .orElseThrow(() -> missingAssembledArrays(filePath));
    int count = imported.rows();
    ImageExtent extent = imported.frameExtent();
    PixelType pixelType = imported.pixelType();

    lock.lock();
    try {
      replaceBuffer(imported);
      indexes = importedIndexes;
      metadata = DiffractionMetadata.builder(count, count, pixelType)
          .detectorExtent(extent)
          .filePath(filePath)
          .build();
      contentsTree = SimpleTreeNode.createRoot(List.of("Name", "Type", "Details"));
      arrays.clear();
      arrays.add(new AssembledDiffractionPatternArray("Imported", 0, 0, count, indexes, imported, lock,
          this::getGoodPixels, PatternState.LOADED));
      arrayCounter = 1;
      goodPixels = BadPixels.none(extent).goodPixels();
    } finally {
      lock.unlock();
    }
    emit(DatasetEvent.reloaded());
    return true;
  }

  private PatternBuffer readAssembledBuffer(NpyFormat.Header header, InputStream in, int expectedRows)
      throws IOException {
    int[] shape = header.shape();
    if (shape.length != 3) {
      throw new IOException("'" + NpzDiffractionFileReader.PATTERNS + "' must have rank 3, shape is "
          + Arrays.toString(shape));
    }
    if (shape[0] != expectedRows) {
      throw new IOException(expectedRows + " indexes for " + shape[0] + " patterns");
    }
    PixelType pixelType;
    try {
      pixelType = PixelType.fromDescr(header.descr());
    } catch (IllegalArgumentException e) {
      throw new IOException(e.getMessage(), e);
    }
    PatternBuffer target = allocateBuffer(shape[0], new ImageExtent(shape[2], shape[1]), pixelType);
    try {
      for (int row = 0; row < shape[0]; row++) {
        target.copyRowFrom(row, in);
      }
    } catch (IOException | RuntimeException e) {
      target.close();
      throw e;
    }
    return target;
  }

  private static IOException missingAssembledArrays(Path filePath) {
    return new IOException(filePath + " does not hold assembled '" + NpzDiffractionFileReader.INDEXES + "' and '"
        + NpzDiffractionFileReader.PATTERNS + "' arrays");
  }

  public void addObserver(DiffractionDatasetObserver observer) {
    if (!observers.contains(observer)) {
      observers.add(observer);
    }
  }

  public void removeObserver(DiffractionDatasetObserver observer) {
    observers.remove(observer);
  }

  private void emit(DatasetEvent event) {
    events.add(event);
    changed.set(true);
  }

  /// Deliver queued events to the observers, in the order they were raised
  ///
  /// Does nothing when no event was raised since the last call.
  public void notifyObserversIfChanged() {
    if (!changed.getAndSet(false)) {
      return;
    }
    DatasetEvent event;
    while ((event = events.poll()) != null) {
      for (DiffractionDatasetObserver observer : observers) {
        observer.handleDatasetEvent(event);
      }
    }
  }

  /// Take the queued events instead of delivering them
  /// @return the events in the order they were raised
  public List<DatasetEvent> drainEvents() {
    changed.set(false);
    List<DatasetEvent> drained = new ArrayList<>();
    DatasetEvent event;
    while ((event = events.poll()) != null) {
      drained.add(event);
    }
    return drained;
  }

  /// Stop loading and release the buffer
  @Override
  public void close() {
    stopAndDiscard();
    resetToEmpty();
  }

  @Override
  public String toString() {
    return "AssembledDiffractionDataset{" + getInfoText() + "}";
  }
}
