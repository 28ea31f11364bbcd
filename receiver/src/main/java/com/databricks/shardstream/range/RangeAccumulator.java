package com.databricks.shardstream.range;

import com.databricks.shardstream.ConsistencyViolationException;
import com.databricks.shardstream.batch.BatchId;
import com.databricks.shardstream.batch.BatchingEngine;
import com.databricks.shardstream.record.StreamRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks which sequence-number ranges went into which batch.
 *
 * <p>This class provides the accounting between:
 *
 * <ul>
 *   <li>Shard processors calling {@link #addRecords} to hand records to the batching engine
 *   <li>The batching engine calling {@link #rememberAddedRange} after each add and {@link
 *       #finalizeRangesForCurrentBatch} when it seals a batch
 *   <li>The store step calling {@link #takeFinalizedRanges} exactly once per sealed batch
 * </ul>
 *
 * <p>The open-batch buffer and the insertion into the finalized map are guarded by {@link #lock()}.
 * The same lock must be given to the batching engine, so that adding data, sealing a batch, and the
 * two callbacks form a single critical section: a range can never be attributed to the wrong batch.
 *
 * @param <T> The type of the transformed records handed to the batching engine
 */
public final class RangeAccumulator<T> {
  private static final Logger logger = LoggerFactory.getLogger(RangeAccumulator.class);

  private final String streamName;
  private final Function<StreamRecord, T> recordHandler;

  private final ReentrantLock lock = new ReentrantLock();

  // Guarded by lock.
  private final List<SequenceRange> rangesInCurrentBatch = new ArrayList<>();

  // Inserted under lock, removed exactly once by the store step.
  private final ConcurrentHashMap<BatchId, SequenceRanges> finalizedRanges =
      new ConcurrentHashMap<>();

  private volatile BatchingEngine<T, SequenceRange> engine;

  /**
   * Creates a new accumulator.
   *
   * @param streamName Name of the stream, recorded in every derived range
   * @param recordHandler Transforms a source record into the item stored in a batch
   */
  public RangeAccumulator(
      @Nonnull String streamName, @Nonnull Function<StreamRecord, T> recordHandler) {
    this.streamName = Objects.requireNonNull(streamName, "streamName");
    this.recordHandler = Objects.requireNonNull(recordHandler, "recordHandler");
  }

  /**
   * Returns the lock guarding the accounting state. Batching engines must run their add and seal
   * operations, and the listener callbacks, while holding it.
   */
  @Nonnull
  public ReentrantLock lock() {
    return lock;
  }

  /**
   * Binds the batching engine that {@link #addRecords} forwards to.
   *
   * @param engine An engine built with {@link #lock()}
   */
  public void bind(@Nonnull BatchingEngine<T, SequenceRange> engine) {
    this.engine = Objects.requireNonNull(engine, "engine");
  }

  /**
   * Adds the records of one shard to the batch currently being built.
   *
   * <p>Does nothing for an empty list. Otherwise one range spanning the first and last record is
   * derived and handed to the engine, together with all transformed records, in a single add.
   *
   * @param shardId Shard the records were read from
   * @param records Records in shard order
   * @throws IllegalStateException if no engine is bound
   */
  public void addRecords(@Nonnull String shardId, @Nonnull List<StreamRecord> records) {
    SequenceRange range = deriveRange(streamName, shardId, records);
    if (range == null) {
      return;
    }
    BatchingEngine<T, SequenceRange> target = engine;
    if (target == null) {
      throw new IllegalStateException("No batching engine bound to the range accumulator");
    }
    List<T> items = new ArrayList<>(records.size());
    for (StreamRecord record : records) {
      items.add(recordHandler.apply(record));
    }
    target.addAllWithMetadata(items, range);
  }

  /**
   * Derives the range covered by {@code records}.
   *
   * @return the range, or null if {@code records} is empty
   */
  @Nullable static SequenceRange deriveRange(
      String streamName, String shardId, List<StreamRecord> records) {
    if (records.isEmpty()) {
      return null;
    }
    return new SequenceRange(
        streamName,
        shardId,
        records.get(0).getSequenceNumber(),
        records.get(records.size() - 1).getSequenceNumber(),
        records.size());
  }

  /**
   * Remembers a range added to the currently open batch.
   *
   * @param range The range passed as metadata of the add
   */
  public void rememberAddedRange(@Nonnull SequenceRange range) {
    lock.lock();
    try {
      rangesInCurrentBatch.add(range);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Moves the ranges of the open batch into the finalized map under {@code batchId} and starts an
   * empty buffer for the next batch.
   *
   * @param batchId Identifier of the batch that was just sealed
   * @throws ConsistencyViolationException if ranges were already finalized for {@code batchId}
   */
  public void finalizeRangesForCurrentBatch(@Nonnull BatchId batchId) {
    lock.lock();
    try {
      SequenceRanges ranges = new SequenceRanges(rangesInCurrentBatch);
      if (finalizedRanges.putIfAbsent(batchId, ranges) != null) {
        throw new ConsistencyViolationException(
            "Sequence number ranges for " + batchId + " were already finalized");
      }
      rangesInCurrentBatch.clear();
      logger.debug("Generated {} has {}", batchId, ranges);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes and returns the finalized ranges of {@code batchId}.
   *
   * <p>At most one call per batch id returns a value.
   *
   * @param batchId Identifier of a sealed batch
   * @return the ranges, or empty if none are (or are no longer) recorded
   */
  @Nonnull
  public Optional<SequenceRanges> takeFinalizedRanges(@Nonnull BatchId batchId) {
    return Optional.ofNullable(finalizedRanges.remove(batchId));
  }

  /** Drops all buffered and finalized ranges. Used when a receiver restarts. */
  public void clear() {
    lock.lock();
    try {
      rangesInCurrentBatch.clear();
      finalizedRanges.clear();
    } finally {
      lock.unlock();
    }
  }

  @Nonnull
  public String getStreamName() {
    return streamName;
  }

  /** Returns the number of ranges in the open batch. */
  int pendingRangeCount() {
    lock.lock();
    try {
      return rangesInCurrentBatch.size();
    } finally {
      lock.unlock();
    }
  }

  /** Returns the number of sealed batches whose ranges have not been taken yet. */
  int finalizedBatchCount() {
    return finalizedRanges.size();
  }
}
