package com.databricks.shardstream.store;

import com.databricks.shardstream.ConsistencyViolationException;
import com.databricks.shardstream.StoreFailureException;
import com.databricks.shardstream.batch.BatchId;
import com.databricks.shardstream.common.remote.RemoteCallResult;
import com.databricks.shardstream.range.RangeAccumulator;
import com.databricks.shardstream.range.SequenceRanges;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores sealed batches together with their ranges and publishes what became durable.
 *
 * <p>For each batch this coordinator:
 *
 * <ol>
 *   <li>takes the batch's finalized ranges from the {@link RangeAccumulator}; a missing entry is an
 *       accounting bug and raises {@link ConsistencyViolationException}
 *   <li>calls the {@link BatchStore} up to {@code maxAttempts} times without backoff; a fatal
 *       result ends the attempts early, and running out raises {@link StoreFailureException}
 *   <li>on success, advances {@link LatestStoredSequences} with every range of the batch
 * </ol>
 *
 * @param <T> The type of items in a batch
 */
public final class BatchStoreCoordinator<T> {
  private static final Logger logger = LoggerFactory.getLogger(BatchStoreCoordinator.class);

  /** One initial attempt plus three retries. */
  public static final int DEFAULT_MAX_ATTEMPTS = 4;

  private final RangeAccumulator<T> accumulator;
  private final BatchStore<T> store;
  private final LatestStoredSequences latestStoredSequences;
  private final int maxAttempts;

  /**
   * Creates a new coordinator.
   *
   * @param accumulator Source of the finalized ranges
   * @param store Durable storage for batches
   * @param latestStoredSequences Updated after every successful store
   * @param maxAttempts Total number of store attempts per batch, at least 1
   */
  public BatchStoreCoordinator(
      @Nonnull RangeAccumulator<T> accumulator,
      @Nonnull BatchStore<T> store,
      @Nonnull LatestStoredSequences latestStoredSequences,
      int maxAttempts) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
    }
    this.accumulator = Objects.requireNonNull(accumulator, "accumulator");
    this.store = Objects.requireNonNull(store, "store");
    this.latestStoredSequences =
        Objects.requireNonNull(latestStoredSequences, "latestStoredSequences");
    this.maxAttempts = maxAttempts;
  }

  /**
   * Stores a sealed batch.
   *
   * @param batchId Identifier of the sealed batch
   * @param payload Items of the batch
   * @throws ConsistencyViolationException if no finalized ranges exist for {@code batchId}
   * @throws StoreFailureException if every store attempt failed
   */
  public void storeBatch(@Nonnull BatchId batchId, @Nonnull List<T> payload) {
    SequenceRanges ranges =
        accumulator
            .takeFinalizedRanges(batchId)
            .orElseThrow(
                () ->
                    new ConsistencyViolationException(
                        "Error while storing "
                            + batchId
                            + ", could not find sequence number ranges for it"));

    int attempt = 0;
    Throwable lastError = null;
    while (attempt < maxAttempts) {
      attempt++;
      RemoteCallResult<Void> result;
      try {
        result = Objects.requireNonNull(store.store(batchId, payload, ranges), "store result");
      } catch (RuntimeException e) {
        result = RemoteCallResult.retryable(e);
      }

      if (result.isSuccess()) {
        latestStoredSequences.update(ranges);
        logger.debug("Stored {} with {} on attempt {}", batchId, ranges, attempt);
        return;
      }

      lastError = result.getError();
      if (result.getKind() == RemoteCallResult.Kind.FATAL) {
        logger.error("Non-retriable error while storing {}", batchId, lastError);
        break;
      }
      logger.warn("Error while storing {} [attempt = {}]", batchId, attempt, lastError);
    }

    throw new StoreFailureException(
        "Error while storing " + batchId + " after " + attempt + " attempts", attempt, lastError);
  }

  /** Returns the total number of store attempts per batch. */
  public int getMaxAttempts() {
    return maxAttempts;
  }
}
