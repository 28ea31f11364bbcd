package com.databricks.shardstream;

import com.databricks.shardstream.common.ShardStreamException;
import com.databricks.shardstream.range.SequenceRange;

/**
 * Thrown by replay when the source cannot deliver records up to the end of a requested range.
 *
 * <p>The replay iterator does not retry this itself. The caller decides whether to issue a fresh
 * replay request.
 */
public class RangeExhaustedException extends ShardStreamException {

  private final SequenceRange range;

  public RangeExhaustedException(String message, SequenceRange range) {
    super(message);
    this.range = range;
  }

  /** Returns the range that could not be read completely. */
  public SequenceRange getRange() {
    return range;
  }
}
