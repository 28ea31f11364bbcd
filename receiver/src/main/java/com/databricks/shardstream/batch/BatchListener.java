package com.databricks.shardstream.batch;

import java.util.List;

/**
 * Callbacks from a {@link BatchingEngine}.
 *
 * <p>{@link #onAddData} and {@link #onGenerateBlock} run under the engine's lock and never
 * interleave with each other. {@link #onPushBlock} runs outside the lock, one batch at a time, in
 * the order batches were sealed.
 *
 * @param <T> The type of items in a batch
 * @param <M> The type of metadata accompanying an add
 */
public interface BatchListener<T, M> {

  /** Called after {@code items} were added to the open batch. */
  void onAddData(List<T> items, M metadata);

  /** Called after the open batch was sealed as {@code batchId}. */
  void onGenerateBlock(BatchId batchId);

  /** Called when the sealed batch {@code batchId} is ready to be stored. */
  void onPushBlock(BatchId batchId, List<T> items);

  /** Called when the engine hits an error it cannot handle itself. */
  void onError(String message, Throwable error);
}
