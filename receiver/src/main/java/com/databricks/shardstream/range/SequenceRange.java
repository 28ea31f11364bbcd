package com.databricks.shardstream.range;

import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * A contiguous slice of one shard, consumed for one batch. Both sequence numbers are inclusive.
 *
 * <p>One range is derived per ingestion call from the first and last record handed over by the
 * shard's processor.
 */
public final class SequenceRange {

  private final String streamName;
  private final String shardId;
  private final String fromSequenceNumber;
  private final String toSequenceNumber;
  private final int recordCount;

  /**
   * Creates a new range.
   *
   * @param streamName Name of the stream the shard belongs to
   * @param shardId Shard the records were read from
   * @param fromSequenceNumber Sequence number of the first record (inclusive)
   * @param toSequenceNumber Sequence number of the last record (inclusive)
   * @param recordCount Number of records in the range, at least 1
   */
  public SequenceRange(
      @Nonnull String streamName,
      @Nonnull String shardId,
      @Nonnull String fromSequenceNumber,
      @Nonnull String toSequenceNumber,
      int recordCount) {
    if (recordCount < 1) {
      throw new IllegalArgumentException("recordCount must be at least 1, got " + recordCount);
    }
    this.streamName = Objects.requireNonNull(streamName, "streamName");
    this.shardId = Objects.requireNonNull(shardId, "shardId");
    this.fromSequenceNumber = Objects.requireNonNull(fromSequenceNumber, "fromSequenceNumber");
    this.toSequenceNumber = Objects.requireNonNull(toSequenceNumber, "toSequenceNumber");
    this.recordCount = recordCount;
  }

  @Nonnull
  public String getStreamName() {
    return streamName;
  }

  @Nonnull
  public String getShardId() {
    return shardId;
  }

  @Nonnull
  public String getFromSequenceNumber() {
    return fromSequenceNumber;
  }

  @Nonnull
  public String getToSequenceNumber() {
    return toSequenceNumber;
  }

  public int getRecordCount() {
    return recordCount;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SequenceRange)) {
      return false;
    }
    SequenceRange that = (SequenceRange) o;
    return recordCount == that.recordCount
        && streamName.equals(that.streamName)
        && shardId.equals(that.shardId)
        && fromSequenceNumber.equals(that.fromSequenceNumber)
        && toSequenceNumber.equals(that.toSequenceNumber);
  }

  @Override
  public int hashCode() {
    return Objects.hash(streamName, shardId, fromSequenceNumber, toSequenceNumber, recordCount);
  }

  @Override
  public String toString() {
    return "SequenceRange("
        + streamName
        + ", "
        + shardId
        + ", "
        + fromSequenceNumber
        + ", "
        + toSequenceNumber
        + ", "
        + recordCount
        + ")";
  }
}
