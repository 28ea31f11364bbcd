package com.databricks.shardstream.checkpoint;

import com.databricks.shardstream.common.remote.RemoteCallResult;
import javax.annotation.Nonnull;

/** Per-shard handle through which progress is persisted in the source stream's lease table. */
@FunctionalInterface
public interface Checkpointer {

  /**
   * Marks every record up to and including {@code sequenceNumber} as processed.
   *
   * @param sequenceNumber A sequence number whose batch has been stored
   * @return success, or the classified failure
   */
  @Nonnull
  RemoteCallResult<Void> checkpointAt(@Nonnull String sequenceNumber);
}
