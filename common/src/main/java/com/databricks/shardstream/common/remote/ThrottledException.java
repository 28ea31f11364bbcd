package com.databricks.shardstream.common.remote;

/**
 * Thrown by remote clients when the source rejects a call because a throughput limit was exceeded.
 *
 * <p>This is the throttling error class recognized by {@link
 * RemoteErrorClassifier#throttlingOnly()}: calls failing with it are retried with backoff and never
 * surfaced directly.
 */
public class ThrottledException extends RuntimeException {

  public ThrottledException(String message) {
    super(message);
  }

  public ThrottledException(String message, Throwable cause) {
    super(message, cause);
  }
}
