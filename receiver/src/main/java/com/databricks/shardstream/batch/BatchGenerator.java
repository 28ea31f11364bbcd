package com.databricks.shardstream.batch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A batching engine that seals the open batch at a fixed interval.
 *
 * <p>Items move through three stages:
 *
 * <ul>
 *   <li>Producer threads calling {@link #addAllWithMetadata} append to the open batch
 *   <li>A timer thread seals the open batch every {@code batchIntervalMs} and queues it
 *   <li>A push thread takes sealed batches off the queue and calls {@link
 *       BatchListener#onPushBlock}
 * </ul>
 *
 * <p>Adding and sealing hold the lock passed at construction. Backpressure comes from the bounded
 * push queue (the timer blocks when it is full, and the open batch keeps growing) and from the
 * optional records-per-second limit applied to adds.
 *
 * @param <T> The type of items in a batch
 * @param <M> The type of metadata accompanying an add
 */
public final class BatchGenerator<T, M> implements BatchingEngine<T, M> {
  private static final Logger logger = LoggerFactory.getLogger(BatchGenerator.class);

  private static final long PUSH_POLL_MS = 10;
  private static final long STOP_TIMEOUT_MS = 30000;

  private enum GeneratorState {
    CREATED,
    ACTIVE,
    STOPPED
  }

  private final String receiverId;
  private final BatchListener<T, M> listener;
  private final ReentrantLock lock;
  private final long batchIntervalMs;
  private final IngestionRateLimiter rateLimiter;
  private final ArrayBlockingQueue<SealedBatch<T>> pushQueue;

  private final ScheduledExecutorService sealTimer;
  private final ExecutorService pushExecutor;
  private final BackgroundTask pushTask;

  // Guarded by lock.
  private List<T> currentBuffer = new ArrayList<>();
  private long nextUniqueId = 0;

  private volatile GeneratorState state = GeneratorState.CREATED;
  private volatile boolean draining = false;

  /**
   * Creates a new batch generator.
   *
   * @param receiverId Identifier used in the batch ids this generator assigns
   * @param listener Receives the callbacks
   * @param lock Lock shared with the listener's accounting state
   * @param batchIntervalMs Interval between seals in milliseconds
   * @param pushQueueCapacity Maximum number of sealed batches waiting to be pushed
   * @param maxRecordsPerSecond Ingestion limit, or {@link Integer#MAX_VALUE} for none
   */
  public BatchGenerator(
      @Nonnull String receiverId,
      @Nonnull BatchListener<T, M> listener,
      @Nonnull ReentrantLock lock,
      long batchIntervalMs,
      int pushQueueCapacity,
      int maxRecordsPerSecond) {
    if (batchIntervalMs <= 0) {
      throw new IllegalArgumentException(
          "batchIntervalMs must be positive, got " + batchIntervalMs);
    }
    this.receiverId = Objects.requireNonNull(receiverId, "receiverId");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.lock = Objects.requireNonNull(lock, "lock");
    this.batchIntervalMs = batchIntervalMs;
    this.rateLimiter = new IngestionRateLimiter(maxRecordsPerSecond);
    this.pushQueue = new ArrayBlockingQueue<>(pushQueueCapacity);
    this.sealTimer =
        Executors.newSingleThreadScheduledExecutor(daemonThreads("batch-seal-" + receiverId));
    this.pushExecutor =
        Executors.newSingleThreadExecutor(daemonThreads("batch-push-" + receiverId));
    this.pushTask =
        new BackgroundTask(
            "Batch push loop for " + receiverId,
            this::pushNext,
            error -> listener.onError("Error while pushing batches", error),
            pushExecutor);
  }

  /**
   * Returns a factory creating generators with the given settings.
   *
   * @param batchIntervalMs Interval between seals in milliseconds
   * @param pushQueueCapacity Maximum number of sealed batches waiting to be pushed
   * @param maxRecordsPerSecond Ingestion limit, or {@link Integer#MAX_VALUE} for none
   */
  public static <T, M> BatchingEngineFactory<T, M> factory(
      long batchIntervalMs, int pushQueueCapacity, int maxRecordsPerSecond) {
    return (receiverId, listener, lock) ->
        new BatchGenerator<>(
            receiverId, listener, lock, batchIntervalMs, pushQueueCapacity, maxRecordsPerSecond);
  }

  @Override
  public void start() {
    if (state != GeneratorState.CREATED) {
      throw new IllegalStateException("Cannot start a batch generator in state " + state);
    }
    state = GeneratorState.ACTIVE;
    sealTimer.scheduleAtFixedRate(
        this::sealCurrentBatch, batchIntervalMs, batchIntervalMs, TimeUnit.MILLISECONDS);
    pushTask.start();
    logger.info("Started batch generator for {}", receiverId);
  }

  @Override
  public void addAllWithMetadata(@Nonnull List<T> items, @Nonnull M metadata) {
    if (state != GeneratorState.ACTIVE) {
      throw new IllegalStateException(
          "Cannot add data as the batch generator for " + receiverId + " is " + state);
    }
    try {
      rateLimiter.acquire(items.size());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for the ingestion limit", e);
    }
    lock.lock();
    try {
      currentBuffer.addAll(items);
      listener.onAddData(items, metadata);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int getCurrentLimit() {
    return rateLimiter.getLimit();
  }

  @Override
  public void stop() {
    if (state != GeneratorState.ACTIVE) {
      state = GeneratorState.STOPPED;
      shutdownExecutors();
      return;
    }
    state = GeneratorState.STOPPED;
    logger.info("Stopping batch generator for {}", receiverId);

    sealTimer.shutdown();
    awaitTermination(sealTimer, "seal timer");

    // Seal whatever was added after the last tick, then let the push loop drain the queue.
    sealCurrentBatch();
    draining = true;
    pushTask.waitUntilStopped();
    shutdownExecutors();
    logger.info("Stopped batch generator for {}", receiverId);
  }

  /** Returns the number of sealed batches waiting to be pushed. */
  int queuedBatchCount() {
    return pushQueue.size();
  }

  void sealCurrentBatch() {
    SealedBatch<T> sealed = null;
    lock.lock();
    try {
      if (!currentBuffer.isEmpty()) {
        BatchId batchId = new BatchId(receiverId, nextUniqueId++);
        List<T> items = currentBuffer;
        currentBuffer = new ArrayList<>();
        listener.onGenerateBlock(batchId);
        sealed = new SealedBatch<>(batchId, items);
      }
    } catch (Throwable t) {
      listener.onError("Error while sealing a batch", t);
    } finally {
      lock.unlock();
    }

    if (sealed != null) {
      try {
        pushQueue.put(sealed);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        listener.onError("Interrupted while queueing " + sealed.batchId, e);
      }
    }
  }

  private void pushNext(CompletableFuture<Void> token) {
    SealedBatch<T> batch;
    try {
      batch = pushQueue.poll(PUSH_POLL_MS, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      token.complete(null);
      return;
    }
    if (batch != null) {
      logger.debug("Pushing {} with {} items", batch.batchId, batch.items.size());
      listener.onPushBlock(batch.batchId, batch.items);
    } else if (draining) {
      token.complete(null);
    }
  }

  private void shutdownExecutors() {
    pushTask.cancel();
    sealTimer.shutdownNow();
    pushExecutor.shutdown();
    awaitTermination(pushExecutor, "push executor");
  }

  private void awaitTermination(ExecutorService executor, String name) {
    try {
      if (!executor.awaitTermination(STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
        logger.warn("Batch generator {} for {} did not terminate in time", name, receiverId);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static ThreadFactory daemonThreads(String name) {
    return runnable -> {
      Thread thread = new Thread(runnable, name);
      thread.setDaemon(true);
      return thread;
    };
  }

  private static final class SealedBatch<T> {
    final BatchId batchId;
    final List<T> items;

    SealedBatch(BatchId batchId, List<T> items) {
      this.batchId = batchId;
      this.items = items;
    }
  }
}
