package com.databricks.shardstream.common;

/**
 * Base exception class for all shard stream errors.
 *
 * <p>This is an unchecked exception (extends {@link RuntimeException}). Callers can catch this
 * exception or let it propagate up the call stack, where the host's supervisor is expected to
 * restart the owning receiver or task.
 *
 * <p>Subclasses distinguish the failure kinds:
 *
 * <ul>
 *   <li>{@link com.databricks.shardstream.common.remote.FatalRemoteException} - a remote call
 *       failed with a non-retriable error
 *   <li>{@link com.databricks.shardstream.common.retry.RetryAbortedException} - a retriable remote
 *       call did not succeed within its retry budget
 * </ul>
 *
 * <p>The receiver module adds the accounting failures (consistency violation, store failure, range
 * exhaustion).
 */
public class ShardStreamException extends RuntimeException {

  /**
   * Constructs a new ShardStreamException with the specified detail message.
   *
   * @param message the detail message
   */
  public ShardStreamException(String message) {
    super(message);
  }

  /**
   * Constructs a new ShardStreamException with the specified detail message and cause.
   *
   * @param message the detail message
   * @param cause the cause of the exception
   */
  public ShardStreamException(String message, Throwable cause) {
    super(message, cause);
  }
}
