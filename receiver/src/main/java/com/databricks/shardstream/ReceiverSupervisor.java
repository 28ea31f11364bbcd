package com.databricks.shardstream;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The host's supervision of a receiver.
 *
 * <p>Both methods may be called from the batching engine's threads, so implementations must not
 * stop the receiver synchronously on the calling thread.
 */
public interface ReceiverSupervisor {

  /**
   * Requests that the receiver be stopped because it can no longer make progress safely.
   *
   * @param message What went wrong
   * @param cause The error, if any
   */
  void stop(@Nonnull String message, @Nullable Throwable cause);

  /**
   * Reports an error the receiver keeps running through.
   *
   * @param message What went wrong
   * @param cause The error, if any
   */
  void reportError(@Nonnull String message, @Nullable Throwable cause);
}
