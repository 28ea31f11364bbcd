package com.databricks.shardstream.checkpoint;

import com.databricks.shardstream.common.remote.RemoteCallResult;
import com.databricks.shardstream.range.SequenceNumbers;
import com.databricks.shardstream.store.LatestStoredSequences;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically checkpoints every tracked shard up to its latest stored sequence number.
 *
 * <p>The only values ever passed to a {@link Checkpointer} are read from {@link
 * LatestStoredSequences}, and a shard is only checkpointed when that value is newer than the last
 * one checkpointed for it. Failed checkpoints are logged and retried on the next cycle.
 *
 * <p>Checkpointing a shard, whether from a cycle or from {@link #removeCheckpointer}, happens under
 * one lock, so a value is never passed twice and a removed shard stays removed.
 */
public final class CheckpointTracker {
  private static final Logger logger = LoggerFactory.getLogger(CheckpointTracker.class);

  private static final long SHUTDOWN_TIMEOUT_MS = 10000;

  private final LatestStoredSequences latestStoredSequences;
  private final long checkpointIntervalMs;
  private final ConcurrentHashMap<String, Checkpointer> checkpointers = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, String> lastCheckpointed = new ConcurrentHashMap<>();
  private final ReentrantLock checkpointLock = new ReentrantLock();

  private ScheduledExecutorService timer;
  private volatile boolean aborted = false;

  /**
   * Creates a new tracker.
   *
   * @param latestStoredSequences Source of the sequence numbers safe to checkpoint
   * @param checkpointIntervalMs Interval between checkpoint cycles once started
   */
  public CheckpointTracker(
      @Nonnull LatestStoredSequences latestStoredSequences, long checkpointIntervalMs) {
    if (checkpointIntervalMs <= 0) {
      throw new IllegalArgumentException(
          "checkpointIntervalMs must be positive, got " + checkpointIntervalMs);
    }
    this.latestStoredSequences =
        Objects.requireNonNull(latestStoredSequences, "latestStoredSequences");
    this.checkpointIntervalMs = checkpointIntervalMs;
  }

  /** Registers {@code checkpointer} for {@code shardId}, replacing any previous handle. */
  public void setCheckpointer(@Nonnull String shardId, @Nonnull Checkpointer checkpointer) {
    Objects.requireNonNull(shardId, "shardId");
    Objects.requireNonNull(checkpointer, "checkpointer");
    checkpointers.put(shardId, checkpointer);
  }

  /**
   * Stops tracking {@code shardId}.
   *
   * <p>When {@code checkpointer} is given, one final checkpoint is attempted first, so progress
   * stored since the last cycle is not lost. Pass null when the shard's lease is already gone.
   *
   * @param shardId The shard
   * @param checkpointer Handle for the final checkpoint, or null to skip it
   */
  public void removeCheckpointer(@Nonnull String shardId, @Nullable Checkpointer checkpointer) {
    Objects.requireNonNull(shardId, "shardId");
    checkpointLock.lock();
    try {
      if (checkpointer != null) {
        checkpointShard(shardId, checkpointer);
      }
    } finally {
      checkpointers.remove(shardId);
      lastCheckpointed.remove(shardId);
      checkpointLock.unlock();
    }
  }

  /** Runs one checkpoint cycle over all tracked shards. */
  public void checkpointAll() {
    for (String shardId : checkpointers.keySet()) {
      checkpointLock.lock();
      try {
        // The shard may have been removed or given a new handle since the cycle began.
        Checkpointer checkpointer = checkpointers.get(shardId);
        if (checkpointer != null) {
          checkpointShard(shardId, checkpointer);
        }
      } catch (RuntimeException e) {
        logger.warn("Failed to checkpoint shard {}", shardId, e);
      } finally {
        checkpointLock.unlock();
      }
    }
  }

  /** Starts running {@link #checkpointAll()} every {@code checkpointIntervalMs}. */
  public synchronized void start() {
    if (aborted) {
      throw new IllegalStateException("Checkpoint tracker was aborted");
    }
    if (timer != null) {
      throw new IllegalStateException("Checkpoint tracker already started");
    }
    timer =
        Executors.newSingleThreadScheduledExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, "checkpoint-tracker");
              thread.setDaemon(true);
              return thread;
            });
    timer.scheduleAtFixedRate(
        this::checkpointAll, checkpointIntervalMs, checkpointIntervalMs, TimeUnit.MILLISECONDS);
    logger.info("Started checkpoint tracker with interval {} ms", checkpointIntervalMs);
  }

  /** Stops the timer and runs one last checkpoint cycle. Does nothing more after {@link #abort}. */
  public synchronized void shutdown() {
    stopTimer();
    if (aborted) {
      return;
    }
    checkpointAll();
    logger.info("Stopped checkpoint tracker");
  }

  /**
   * Stops checkpointing for good, without a final cycle. Once this returns, no checkpoint is
   * started, including from {@link #removeCheckpointer}, and the tracker cannot be started again.
   */
  public void abort() {
    aborted = true;
    // Waits for a checkpoint in flight.
    checkpointLock.lock();
    checkpointLock.unlock();
    synchronized (this) {
      stopTimer();
    }
    logger.warn("Aborted checkpoint tracker");
  }

  /** Returns whether {@link #abort} was called. */
  public boolean isAborted() {
    return aborted;
  }

  /** Returns the last sequence number successfully checkpointed for {@code shardId}. */
  @Nonnull
  public Optional<String> getLastCheckpointed(@Nonnull String shardId) {
    return Optional.ofNullable(lastCheckpointed.get(shardId));
  }

  /** Returns whether a checkpointer is registered for {@code shardId}. */
  public boolean isTracking(@Nonnull String shardId) {
    return checkpointers.containsKey(shardId);
  }

  private void stopTimer() {
    if (timer == null) {
      return;
    }
    timer.shutdown();
    try {
      if (!timer.awaitTermination(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
        logger.warn("Checkpoint timer did not terminate in time");
        timer.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      timer.shutdownNow();
    }
    timer = null;
  }

  private void checkpointShard(String shardId, Checkpointer checkpointer) {
    if (aborted) {
      return;
    }
    Optional<String> latest = latestStoredSequences.get(shardId);
    if (!latest.isPresent()) {
      return;
    }
    String sequenceNumber = latest.get();
    String previous = lastCheckpointed.get(shardId);
    if (previous != null && !SequenceNumbers.isNewer(sequenceNumber, previous)) {
      return;
    }

    RemoteCallResult<Void> result = checkpointer.checkpointAt(sequenceNumber);
    if (result.isSuccess()) {
      lastCheckpointed.put(shardId, sequenceNumber);
      logger.debug("Checkpointed shard {} at {}", shardId, sequenceNumber);
    } else {
      logger.warn(
          "Failed to checkpoint shard {} at {} ({}), will retry",
          shardId,
          sequenceNumber,
          result.getKind(),
          result.getError());
    }
  }
}
