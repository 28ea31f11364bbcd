package com.databricks.shardstream.record;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A record as delivered by the source stream.
 *
 * <p>Instances are immutable: the payload is copied on the way in and on the way out.
 */
public final class StreamRecord {

  private final String sequenceNumber;
  @Nullable private final String partitionKey;
  private final byte[] data;
  @Nullable private final Instant approximateArrivalTimestamp;

  /**
   * Creates a new record.
   *
   * @param sequenceNumber Source-assigned position within the shard
   * @param partitionKey Key the producer used to route the record, if known
   * @param data Record payload
   * @param approximateArrivalTimestamp When the source accepted the record, if known
   */
  public StreamRecord(
      @Nonnull String sequenceNumber,
      @Nullable String partitionKey,
      @Nonnull byte[] data,
      @Nullable Instant approximateArrivalTimestamp) {
    this.sequenceNumber = Objects.requireNonNull(sequenceNumber, "sequenceNumber");
    this.partitionKey = partitionKey;
    this.data = Objects.requireNonNull(data, "data").clone();
    this.approximateArrivalTimestamp = approximateArrivalTimestamp;
  }

  /** Creates a record with only a sequence number and payload. */
  public static StreamRecord of(@Nonnull String sequenceNumber, @Nonnull byte[] data) {
    return new StreamRecord(sequenceNumber, null, data, null);
  }

  @Nonnull
  public String getSequenceNumber() {
    return sequenceNumber;
  }

  @Nullable public String getPartitionKey() {
    return partitionKey;
  }

  /** Returns a copy of the payload. */
  @Nonnull
  public byte[] getData() {
    return data.clone();
  }

  @Nullable public Instant getApproximateArrivalTimestamp() {
    return approximateArrivalTimestamp;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StreamRecord)) {
      return false;
    }
    StreamRecord that = (StreamRecord) o;
    return sequenceNumber.equals(that.sequenceNumber)
        && Objects.equals(partitionKey, that.partitionKey)
        && Arrays.equals(data, that.data)
        && Objects.equals(approximateArrivalTimestamp, that.approximateArrivalTimestamp);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(sequenceNumber, partitionKey, approximateArrivalTimestamp)
        + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return "StreamRecord(sequenceNumber="
        + sequenceNumber
        + ", partitionKey="
        + partitionKey
        + ", bytes="
        + data.length
        + ")";
  }
}
