package com.databricks.shardstream.replay;

import com.databricks.shardstream.batch.BatchId;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * Locally kept copies of stored batches.
 *
 * @param <T> The type of items in a batch
 */
@FunctionalInterface
public interface LocalBatchSource<T> {

  /**
   * Looks up a batch.
   *
   * @param batchId The batch
   * @return the batch's items, or empty when no local copy exists
   */
  @Nonnull
  Optional<List<T>> get(@Nonnull BatchId batchId);

  /** Returns a source that never has a local copy. */
  @Nonnull
  static <T> LocalBatchSource<T> none() {
    return batchId -> Optional.empty();
  }
}
