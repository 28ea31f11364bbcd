package com.databricks.shardstream.common.remote;

import javax.annotation.Nonnull;

/** Decides whether an error raised by a remote call may be retried. */
@FunctionalInterface
public interface RemoteErrorClassifier {

  /**
   * Returns true if the call that failed with {@code error} may be retried.
   *
   * @param error the failure, already unwrapped from any {@code ExecutionException}
   * @return true for transient (throttling) errors, false for fatal ones
   */
  boolean isRetryable(@Nonnull Throwable error);

  /**
   * Returns the default classifier: only {@link ThrottledException} (anywhere in the cause chain)
   * is retryable.
   */
  static RemoteErrorClassifier throttlingOnly() {
    return error -> {
      for (Throwable t = error; t != null; t = t.getCause()) {
        if (t instanceof ThrottledException) {
          return true;
        }
        if (t.getCause() == t) {
          break;
        }
      }
      return false;
    };
  }
}
