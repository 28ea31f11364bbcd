package com.databricks.shardstream.replay;

import java.util.concurrent.CompletableFuture;
import javax.annotation.Nonnull;

/**
 * Asynchronous client for reading a shard of the source stream.
 *
 * <p>Futures complete exceptionally with the client's own errors; throttling should surface as a
 * {@link com.databricks.shardstream.common.remote.ThrottledException} (anywhere in the cause chain)
 * unless the reader is configured with a different classifier.
 */
public interface StreamClient extends AutoCloseable {

  /**
   * Opens a cursor into a shard.
   *
   * @param streamName The stream
   * @param shardId The shard
   * @param position Where the cursor starts
   * @return the opaque cursor
   */
  @Nonnull
  CompletableFuture<String> openCursor(
      @Nonnull String streamName, @Nonnull String shardId, @Nonnull CursorPosition position);

  /**
   * Fetches the next page through {@code cursor}.
   *
   * @param cursor A cursor returned by {@link #openCursor}
   * @param maxCount Maximum number of records in the page
   * @return the page
   */
  @Nonnull
  CompletableFuture<RecordPage> getPage(@Nonnull String cursor, int maxCount);

  /** Releases the client's connections. */
  @Override
  void close();
}
