package com.databricks.shardstream.common.remote;

import com.databricks.shardstream.common.ShardStreamException;

/**
 * Indicates that a remote call failed with an error that must not be retried.
 *
 * <p>Any remote failure that is not classified as throttling ends up here: the current operation
 * aborts immediately, without consuming the remaining retries.
 */
public class FatalRemoteException extends ShardStreamException {

  public FatalRemoteException(String message) {
    super(message);
  }

  public FatalRemoteException(String message, Throwable cause) {
    super(message, cause);
  }
}
