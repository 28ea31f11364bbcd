package com.databricks.shardstream;

import com.databricks.shardstream.common.ShardStreamException;

/**
 * Indicates an accounting bug: a batch reached the store step without a finalized range set.
 *
 * <p>This is never a normal condition. The receiver that observes it is stopped.
 */
public class ConsistencyViolationException extends ShardStreamException {

  public ConsistencyViolationException(String message) {
    super(message);
  }
}
