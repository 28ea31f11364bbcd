package com.databricks.shardstream.store;

import com.databricks.shardstream.range.SequenceRange;
import com.databricks.shardstream.range.SequenceRanges;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.Nonnull;

/**
 * Latest sequence number per shard whose batch has been stored successfully.
 *
 * <p>This is the only source the checkpoint tracker may checkpoint from. Values are overwritten in
 * store-completion order; per shard this is also sequence order because each shard's processor
 * hands over one record list at a time.
 */
public final class LatestStoredSequences {

  private final ConcurrentHashMap<String, String> shardIdToLatestStored = new ConcurrentHashMap<>();

  /**
   * Records the end of every range of a stored batch, in range order.
   *
   * <p>When a batch holds several ranges of one shard, the last one wins.
   *
   * @param ranges Ranges of a batch whose store call succeeded
   */
  public void update(@Nonnull SequenceRanges ranges) {
    for (SequenceRange range : ranges) {
      shardIdToLatestStored.put(range.getShardId(), range.getToSequenceNumber());
    }
  }

  /**
   * Returns the latest stored sequence number of {@code shardId}.
   *
   * @param shardId The shard
   * @return the sequence number, or empty if nothing of this shard has been stored yet
   */
  @Nonnull
  public Optional<String> get(@Nonnull String shardId) {
    return Optional.ofNullable(shardIdToLatestStored.get(shardId));
  }

  /** Returns a point-in-time copy of the whole mapping. */
  @Nonnull
  public Map<String, String> snapshot() {
    return Collections.unmodifiableMap(new HashMap<>(shardIdToLatestStored));
  }
}
