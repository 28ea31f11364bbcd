package com.databricks.shardstream.batch;

import java.util.Objects;
import javax.annotation.Nonnull;

/** Identifies a sealed batch: the receiver that produced it and a per-receiver unique number. */
public final class BatchId {

  private final String receiverId;
  private final long uniqueId;

  public BatchId(@Nonnull String receiverId, long uniqueId) {
    this.receiverId = Objects.requireNonNull(receiverId, "receiverId");
    this.uniqueId = uniqueId;
  }

  @Nonnull
  public String getReceiverId() {
    return receiverId;
  }

  public long getUniqueId() {
    return uniqueId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BatchId)) {
      return false;
    }
    BatchId that = (BatchId) o;
    return uniqueId == that.uniqueId && receiverId.equals(that.receiverId);
  }

  @Override
  public int hashCode() {
    return 31 * receiverId.hashCode() + Long.hashCode(uniqueId);
  }

  @Override
  public String toString() {
    return "batch-" + receiverId + "-" + uniqueId;
  }
}
