package com.databricks.shardstream.batch;

import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nonnull;

/**
 * Creates the batching engine of a receiver.
 *
 * @param <T> The type of items in a batch
 * @param <M> The type of metadata accompanying an add
 */
@FunctionalInterface
public interface BatchingEngineFactory<T, M> {

  /**
   * Creates an engine.
   *
   * @param receiverId Identifier used in the {@link BatchId}s the engine assigns
   * @param listener Receives the engine's callbacks
   * @param lock Lock shared with the receiver's accounting state
   * @return a new engine, not yet started
   */
  @Nonnull
  BatchingEngine<T, M> create(
      @Nonnull String receiverId,
      @Nonnull BatchListener<T, M> listener,
      @Nonnull ReentrantLock lock);
}
