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


import io.ptychotools.patterns.processor.PatternProcessor;
import io.ptychotools.patterns.settings.PatternSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/// A pool of worker threads that turns raw source arrays into processed arrays.
///
/// Tasks go into a processing queue through [#submit(ArrayLoaderTask)]. While the loader is
/// [LoaderState#RUNNING], each worker polls that queue, runs the processor snapshot given to
/// [#start(PatternProcessor)] and puts the result on the assembly queue, which the owner drains
/// with [#completedTasks()]. A task that fails is logged and dropped; the worker carries on.
///
/// When `ProcessingQueueCapacity` is positive, [#submit(ArrayLoaderTask)] blocks while that many
/// tasks are waiting and the loader is running. Tasks submitted while the loader is stopped are
/// held without a bound until the next start.
public class PatternLoader {
  private static final Logger logger = LogManager.getLogger(PatternLoader.class);

  static final long POLL_TIMEOUT_MILLIS = 250L;

  /// @param permit the capacity permit the submitter acquired, released when the task leaves the
  ///     queue; null if none was taken
  private record QueuedTask(ArrayLoaderTask task, Semaphore permit) {

    void releasePermit() {
      if (permit != null) {
        permit.release();
      }
    }
  }

  private final PatternSettings settings;
  private final BlockingQueue<QueuedTask> processingQueue = new LinkedBlockingQueue<>();
  private final ConcurrentLinkedQueue<ArrayLoaderTask> assemblyQueue = new ConcurrentLinkedQueue<>();
  private ExecutorService workers;

  private final ReentrantLock pendingLock = new ReentrantLock();
  private final Condition idle = pendingLock.newCondition();
  private int pendingTasks = 0;

  private volatile LoaderState state = LoaderState.STOPPED;
  private volatile PatternProcessor processor;
  private volatile Semaphore capacity;

  public PatternLoader(PatternSettings settings) {
    this.settings = settings;
  }

  public LoaderState getState() {
    return state;
  }

  /// Start worker threads with a fixed processor
  ///
  /// A running loader is stopped first without finishing its queue. Results left on the
  /// assembly queue from an earlier run are discarded.
  /// @param processor the processor every worker of this run uses
  public synchronized void start(PatternProcessor processor) {
    Objects.requireNonNull(processor, "processor cannot be null");
    if (state == LoaderState.RUNNING) {
      stop(false);
    }
    int discarded = 0;
    while (assemblyQueue.poll() != null) {
      discarded++;
    }
    if (discarded > 0) {
      logger.debug("Discarded {} stale completed tasks", discarded);
    }

    int bound = settings.getProcessingQueueCapacity();
    this.capacity = bound > 0 ? new Semaphore(bound) : null;
    this.processor = processor;
    this.state = LoaderState.RUNNING;

    int threadCount = Math.max(PatternSettings.MIN_THREADS,
        Math.min(settings.getNumberOfDataThreads(), PatternSettings.MAX_THREADS));
    workers = Executors.newFixedThreadPool(threadCount, workerThreads());
    for (int i = 0; i < threadCount; i++) {
      workers.submit(this::runWorker);
    }
    logger.info("Started {} pattern loader threads, {} tasks queued", threadCount, processingQueue.size());
  }

  /// Stop all worker threads
  ///
  /// Stopping a stopped loader does nothing.
  /// @param finishLoading wait until every submitted task has been processed, without a
  ///     deadline; otherwise discard the tasks still queued
  public synchronized void stop(boolean finishLoading) {
    if (state == LoaderState.STOPPED) {
      return;
    }
    if (finishLoading) {
      logger.debug("Waiting for {} pattern loader tasks", getPendingTaskCount());
      awaitIdle();
    } else {
      discardQueuedTasks();
    }

    state = LoaderState.STOPPING;
    workers.shutdown();
    try {
      if (!workers.awaitTermination(1, TimeUnit.HOURS)) {
        logger.warn("Pattern loader threads did not finish, interrupting them");
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warn("Interrupted while waiting for pattern loader threads");
      workers.shutdownNow();
    }
    workers = null;
    state = LoaderState.STOPPED;
    logger.info("Stopped pattern loader, {} tasks left queued", processingQueue.size());
  }

  /// Queue a raw array for processing
  /// @param task the array and its position
  public void submit(ArrayLoaderTask task) {
    Objects.requireNonNull(task, "task cannot be null");
    Semaphore permit = acquirePermit();
    pendingLock.lock();
    try {
      pendingTasks++;
    } finally {
      pendingLock.unlock();
    }
    processingQueue.add(new QueuedTask(task, permit));
  }

  /// Take every processed array that is ready, without waiting
  /// @return the completed tasks in completion order
  public List<ArrayLoaderTask> completedTasks() {
    List<ArrayLoaderTask> completed = new ArrayList<>();
    ArrayLoaderTask task;
    while ((task = assemblyQueue.poll()) != null) {
      completed.add(task);
    }
    return completed;
  }

  public int getProcessingQueueSize() {
    return processingQueue.size();
  }

  public int getAssemblyQueueSize() {
    return assemblyQueue.size();
  }

  /// @return tasks submitted and not yet completed or discarded
  public int getPendingTaskCount() {
    pendingLock.lock();
    try {
      return pendingTasks;
    } finally {
      pendingLock.unlock();
    }
  }

  private static ThreadFactory workerThreads() {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread worker = new Thread(runnable, "pattern-loader-" + counter.getAndIncrement());
      worker.setDaemon(true);
      return worker;
    };
  }

  private Semaphore acquirePermit() {
    Semaphore permits = capacity;
    if (permits == null) {
      return null;
    }
    try {
      while (state == LoaderState.RUNNING && capacity == permits) {
        if (permits.tryAcquire(POLL_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
          return permits;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warn("Interrupted while waiting for processing queue capacity");
    }
    return null;
  }

  private void runWorker() {
    PatternProcessor runProcessor = processor;
    while (state == LoaderState.RUNNING) {
      QueuedTask queued;
      try {
        queued = processingQueue.poll(POLL_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        logger.warn("{} interrupted", Thread.currentThread().getName());
        return;
      }
      if (queued == null) {
        continue;
      }
      queued.releasePermit();
      try {
        process(runProcessor, queued.task());
      } finally {
        taskDone(1);
      }
    }
  }

  private void process(PatternProcessor runProcessor, ArrayLoaderTask task) {
    String label = task.array().getLabel();
    try {
      assemblyQueue.add(new ArrayLoaderTask(task.position(), runProcessor.process(task.array())));
      logger.debug("Processed array {} at position {}", label, task.position());
    } catch (FileNotFoundException e) {
      logger.warn("Unable to load array {}: file not found: {}", label, e.getMessage());
    } catch (IOException e) {
      logger.error("Unable to load array {}: {}", label, e.getMessage());
    } catch (RuntimeException e) {
      logger.error("Unable to process array {}", label, e);
    }
  }

  /// Drop every task waiting in the processing queue, whatever the loader state
  /// @return the number of tasks dropped
  public int discardQueuedTasks() {
    List<QueuedTask> discarded = new ArrayList<>();
    processingQueue.drainTo(discarded);
    discarded.forEach(QueuedTask::releasePermit);
    if (!discarded.isEmpty()) {
      logger.info("Discarded {} queued pattern arrays", discarded.size());
      taskDone(discarded.size());
    }
    return discarded.size();
  }

  private void taskDone(int count) {
    pendingLock.lock();
    try {
      pendingTasks -= count;
      if (pendingTasks <= 0) {
        pendingTasks = 0;
        idle.signalAll();
      }
    } finally {
      pendingLock.unlock();
    }
  }

  private void awaitIdle() {
    pendingLock.lock();
    try {
      while (pendingTasks > 0) {
        idle.await();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warn("Interrupted while waiting for pattern loader tasks to finish");
    } finally {
      pendingLock.unlock();
    }
  }
}
