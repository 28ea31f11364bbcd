package com.databricks.shardstream;

import com.databricks.shardstream.common.ShardStreamException;

/**
 * Thrown when a batch could not be stored within the allowed number of attempts.
 *
 * <p>The cause is the error of the last attempt. The receiver that observes it is stopped.
 */
public class StoreFailureException extends ShardStreamException {

  private final int attempts;

  public StoreFailureException(String message, int attempts, Throwable lastError) {
    super(message, lastError);
    this.attempts = attempts;
  }

  /** Returns the number of store attempts that were made. */
  public int getAttempts() {
    return attempts;
  }
}
