package com.databricks.shardstream.common.retry;

import com.databricks.shardstream.common.ShardStreamException;
import javax.annotation.Nullable;

/**
 * Thrown when a retriable remote call did not succeed before its retry budget ran out.
 *
 * <p>{@link #getReason()} tells which bound was hit. The last transient error, if any, is the
 * cause.
 */
public class RetryAbortedException extends ShardStreamException {

  /** Which bound of the {@link RetryPolicy} stopped the retries. */
  public enum Reason {
    /** The elapsed-time budget was used up. */
    TIMED_OUT,

    /** The maximum number of attempts was made. */
    RETRIES_EXHAUSTED,

    /** The caller's cancellation signal was raised between attempts. */
    CANCELLED
  }

  private final Reason reason;
  private final int attempts;

  public RetryAbortedException(
      Reason reason, int attempts, String message, @Nullable Throwable lastError) {
    super(message, lastError);
    this.reason = reason;
    this.attempts = attempts;
  }

  /** Returns which bound stopped the retries. */
  public Reason getReason() {
    return reason;
  }

  /** Returns the number of attempts made before giving up. */
  public int getAttempts() {
    return attempts;
  }
}
