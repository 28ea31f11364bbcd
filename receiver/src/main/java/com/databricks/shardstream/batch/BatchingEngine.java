package com.databricks.shardstream.batch;

import java.util.List;
import javax.annotation.Nonnull;

/**
 * Groups added items into batches and hands sealed batches to a {@link BatchListener}.
 *
 * <p>Implementations decide batch boundaries (by time, size, or both). They must run {@link
 * #addAllWithMetadata} together with {@link BatchListener#onAddData}, and the sealing of a batch
 * together with {@link BatchListener#onGenerateBlock}, under the lock they were created with.
 *
 * @param <T> The type of items in a batch
 * @param <M> The type of metadata accompanying an add
 */
public interface BatchingEngine<T, M> {

  /**
   * Adds {@code items} to the open batch and reports {@code metadata} once via {@link
   * BatchListener#onAddData}.
   *
   * @param items Items to add, in order
   * @param metadata Metadata describing the items
   * @throws IllegalStateException if the engine is not running
   */
  void addAllWithMetadata(@Nonnull List<T> items, @Nonnull M metadata);

  /** Returns the current ingestion limit in records per second. */
  int getCurrentLimit();

  /** Starts sealing and pushing batches. */
  void start();

  /** Seals the open batch, pushes every sealed batch, and stops. */
  void stop();
}
