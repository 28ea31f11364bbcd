package com.databricks.shardstream.store;

import com.databricks.shardstream.batch.BatchId;
import com.databricks.shardstream.common.remote.RemoteCallResult;
import com.databricks.shardstream.range.SequenceRanges;
import java.util.List;
import javax.annotation.Nonnull;

/**
 * Durable storage for batch payloads.
 *
 * <p>The layout of the stored payload belongs to the implementation. The ranges are passed along so
 * that a store can persist them next to the payload, which lets a lost batch be regenerated from
 * the source later.
 *
 * @param <T> The type of items in a batch
 */
@FunctionalInterface
public interface BatchStore<T> {

  /**
   * Stores one batch.
   *
   * @param batchId Identifier of the batch
   * @param payload Items of the batch, in order
   * @param ranges Sequence-number ranges the items were read from
   * @return success once the batch is durable, retryable or fatal otherwise
   */
  @Nonnull
  RemoteCallResult<Void> store(
      @Nonnull BatchId batchId, @Nonnull List<T> payload, @Nonnull SequenceRanges ranges);
}
