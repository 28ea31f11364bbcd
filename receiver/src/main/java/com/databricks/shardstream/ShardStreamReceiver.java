package com.databricks.shardstream;

import com.databricks.shardstream.batch.BatchId;
import com.databricks.shardstream.batch.BatchListener;
import com.databricks.shardstream.batch.BatchingEngine;
import com.databricks.shardstream.batch.BatchingEngineFactory;
import com.databricks.shardstream.checkpoint.CheckpointTracker;
import com.databricks.shardstream.checkpoint.Checkpointer;
import com.databricks.shardstream.common.ShardStreamException;
import com.databricks.shardstream.range.RangeAccumulator;
import com.databricks.shardstream.range.SequenceRange;
import com.databricks.shardstream.record.StreamRecord;
import com.databricks.shardstream.store.BatchStore;
import com.databricks.shardstream.store.BatchStoreCoordinator;
import com.databricks.shardstream.store.LatestStoredSequences;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives records from the shards of one stream, groups them into batches, stores the batches,
 * and checkpoints every shard only up to what has been stored.
 *
 * <p>Shard processors call {@link #addRecords} and register their {@link Checkpointer}s. The
 * receiver records the sequence-number range of every add, stores each sealed batch together with
 * its ranges, and a {@link CheckpointTracker} periodically checkpoints the latest stored sequence
 * number of each shard. Ranges stored with a batch allow {@link
 * com.databricks.shardstream.replay.BatchReader} to regenerate it from the stream.
 *
 * <p>Errors that make further progress unsafe (a missing range set, a batch that cannot be stored)
 * move the receiver to {@link ReceiverState#FAILED} and are passed to {@link
 * ReceiverSupervisor#stop}. A failed receiver stores no further batches and checkpoints nothing
 * more, so no shard is checkpointed past a batch that was lost.
 *
 * @param <T> The type of items stored in a batch
 */
public class ShardStreamReceiver<T> {
  private static final Logger logger = LoggerFactory.getLogger(ShardStreamReceiver.class);

  private final String receiverId;
  private final ReceiverConfigurationOptions options;
  private final BatchingEngineFactory<T, SequenceRange> engineFactory;
  private final ReceiverSupervisor supervisor;

  private final RangeAccumulator<T> accumulator;
  private final LatestStoredSequences latestStoredSequences = new LatestStoredSequences();
  private final BatchStoreCoordinator<T> storeCoordinator;
  private final CheckpointTracker checkpointTracker;
  private final Object failureLock = new Object();

  private volatile ReceiverState state = ReceiverState.CREATED;
  private BatchingEngine<T, SequenceRange> engine;
  private boolean engineStopped = false;

  /**
   * Creates a receiver batching with the built-in {@link
   * com.databricks.shardstream.batch.BatchGenerator}.
   *
   * @param receiverId Identifier of this receiver, part of every batch id
   * @param options Receiver settings
   * @param recordHandler Converts a source record into a batch item
   * @param store Durable storage for batches
   * @param supervisor The host's supervision
   */
  public ShardStreamReceiver(
      @Nonnull String receiverId,
      @Nonnull ReceiverConfigurationOptions options,
      @Nonnull Function<StreamRecord, T> recordHandler,
      @Nonnull BatchStore<T> store,
      @Nonnull ReceiverSupervisor supervisor) {
    this(
        receiverId,
        options,
        recordHandler,
        options.<T, SequenceRange>batchGeneratorFactory(),
        store,
        supervisor);
  }

  /**
   * Creates a receiver batching with a custom engine.
   *
   * @param receiverId Identifier of this receiver, part of every batch id
   * @param options Receiver settings
   * @param recordHandler Converts a source record into a batch item
   * @param engineFactory Creates the batching engine on every start
   * @param store Durable storage for batches
   * @param supervisor The host's supervision
   */
  public ShardStreamReceiver(
      @Nonnull String receiverId,
      @Nonnull ReceiverConfigurationOptions options,
      @Nonnull Function<StreamRecord, T> recordHandler,
      @Nonnull BatchingEngineFactory<T, SequenceRange> engineFactory,
      @Nonnull BatchStore<T> store,
      @Nonnull ReceiverSupervisor supervisor) {
    this.receiverId = Objects.requireNonNull(receiverId, "receiverId");
    this.options = Objects.requireNonNull(options, "options");
    this.engineFactory = Objects.requireNonNull(engineFactory, "engineFactory");
    this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
    this.accumulator = new RangeAccumulator<>(options.streamName(), recordHandler);
    this.storeCoordinator =
        new BatchStoreCoordinator<>(
            accumulator, store, latestStoredSequences, options.storeMaxAttempts());
    this.checkpointTracker =
        new CheckpointTracker(latestStoredSequences, options.checkpointIntervalMs());
  }

  /**
   * Starts batching and checkpointing. A stopped receiver may be started again; ranges of batches
   * that were never stored are dropped.
   *
   * @throws IllegalStateException if the receiver is already started or has failed
   */
  public synchronized void start() {
    if (state == ReceiverState.STARTED || state == ReceiverState.FAILED) {
      throw new IllegalStateException("Cannot start receiver " + receiverId + " in state " + state);
    }
    accumulator.clear();
    engine = engineFactory.create(receiverId, new Listener(), accumulator.lock());
    accumulator.bind(engine);
    engineStopped = false;
    synchronized (failureLock) {
      state = ReceiverState.STARTED;
    }
    engine.start();
    checkpointTracker.start();
    logger.info("Started receiver {} for stream {}", receiverId, options.streamName());
  }

  /**
   * Stops the receiver. The open batch is sealed and stored, then a final checkpoint cycle runs.
   * A failed receiver only has its engine stopped and stays {@link ReceiverState#FAILED}. Does
   * nothing for a receiver that was never started or is already stopped.
   */
  public synchronized void stop() {
    if (engine == null || engineStopped) {
      return;
    }
    engineStopped = true;
    synchronized (failureLock) {
      if (state == ReceiverState.STARTED) {
        state = ReceiverState.STOPPED;
      }
    }
    logger.info("Stopping receiver {}", receiverId);
    try {
      engine.stop();
    } finally {
      checkpointTracker.shutdown();
    }
    logger.info("Stopped receiver {} in state {}", receiverId, state);
  }

  /**
   * Adds records read from one shard. Does nothing for an empty list.
   *
   * @param shardId Shard the records were read from
   * @param records Records in shard order
   * @throws IllegalStateException if the receiver is not started
   */
  public void addRecords(@Nonnull String shardId, @Nonnull List<StreamRecord> records) {
    if (records.isEmpty()) {
      return;
    }
    if (state != ReceiverState.STARTED) {
      throw new IllegalStateException(
          "Cannot add records to receiver " + receiverId + " in state " + state);
    }
    accumulator.addRecords(shardId, records);
  }

  /** Returns the ingestion limit in records per second, {@link Integer#MAX_VALUE} if none. */
  public int getCurrentIngestionLimit() {
    BatchingEngine<T, SequenceRange> current = engine;
    return current != null ? current.getCurrentLimit() : options.maxRecordsPerSecond();
  }

  /**
   * Returns the sequence number up to which {@code shardId} may be checkpointed.
   *
   * @param shardId The shard
   * @return the latest stored sequence number, or empty if nothing of the shard is stored yet
   */
  @Nonnull
  public Optional<String> getLatestSequenceToCheckpoint(@Nonnull String shardId) {
    return latestStoredSequences.get(shardId);
  }

  /** Registers the checkpoint handle of {@code shardId}, replacing any previous one. */
  public void setCheckpointer(@Nonnull String shardId, @Nonnull Checkpointer checkpointer) {
    checkpointTracker.setCheckpointer(shardId, checkpointer);
  }

  /**
   * Stops checkpointing {@code shardId}, after a final checkpoint through {@code checkpointer}
   * when one is given.
   */
  public void removeCheckpointer(@Nonnull String shardId, @Nullable Checkpointer checkpointer) {
    checkpointTracker.removeCheckpointer(shardId, checkpointer);
  }

  @Nonnull
  public ReceiverState getState() {
    return state;
  }

  public boolean isStarted() {
    return state == ReceiverState.STARTED;
  }

  @Nonnull
  public String getReceiverId() {
    return receiverId;
  }

  @Nonnull
  public ReceiverConfigurationOptions getOptions() {
    return options;
  }

  /**
   * Moves the receiver to {@link ReceiverState#FAILED}, aborts checkpointing and asks the
   * supervisor to stop. Only the first failure is passed on.
   */
  private void fail(String message, ShardStreamException error) {
    synchronized (failureLock) {
      if (state == ReceiverState.FAILED) {
        logger.warn("Receiver {} already failed, ignoring: {}", receiverId, message);
        return;
      }
      state = ReceiverState.FAILED;
    }
    checkpointTracker.abort();
    supervisor.stop(message, error);
  }

  /** Connects the batching engine's callbacks to the range accounting and the store step. */
  private final class Listener implements BatchListener<T, SequenceRange> {

    @Override
    public void onAddData(List<T> items, SequenceRange range) {
      accumulator.rememberAddedRange(range);
    }

    @Override
    public void onGenerateBlock(BatchId batchId) {
      try {
        accumulator.finalizeRangesForCurrentBatch(batchId);
      } catch (ConsistencyViolationException e) {
        logger.error("Receiver {} lost track of {}", receiverId, batchId, e);
        fail(e.getMessage(), e);
      }
    }

    @Override
    public void onPushBlock(BatchId batchId, List<T> items) {
      if (state == ReceiverState.FAILED) {
        logger.warn("Receiver {} has failed, not storing {}", receiverId, batchId);
        return;
      }
      try {
        storeCoordinator.storeBatch(batchId, items);
      } catch (ShardStreamException e) {
        logger.error("Receiver {} failed to store {}", receiverId, batchId, e);
        fail(e.getMessage(), e);
      }
    }

    @Override
    public void onError(String message, Throwable error) {
      logger.error("Error in receiver {}: {}", receiverId, message, error);
      supervisor.reportError(message, error);
    }
  }
}
