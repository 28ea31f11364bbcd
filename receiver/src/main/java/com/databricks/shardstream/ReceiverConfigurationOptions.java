package com.databricks.shardstream;

import com.databricks.shardstream.batch.BatchGenerator;
import com.databricks.shardstream.batch.BatchingEngineFactory;
import com.databricks.shardstream.store.BatchStoreCoordinator;
import java.util.Objects;

/**
 * Configuration options for a {@link ShardStreamReceiver}.
 *
 * <p>Use the builder pattern to create instances:
 *
 * <pre>{@code
 * ReceiverConfigurationOptions options = ReceiverConfigurationOptions.builder()
 *     .setStreamName("clicks")
 *     .setBatchIntervalMs(500)
 *     .setCheckpointIntervalMs(30000)
 *     .build();
 * }</pre>
 */
public final class ReceiverConfigurationOptions {

  public static final long DEFAULT_BATCH_INTERVAL_MS = 200;
  public static final int DEFAULT_PUSH_QUEUE_CAPACITY = 10;
  public static final int DEFAULT_MAX_RECORDS_PER_SECOND = Integer.MAX_VALUE;
  public static final long DEFAULT_CHECKPOINT_INTERVAL_MS = 10000;
  public static final int DEFAULT_STORE_MAX_ATTEMPTS = BatchStoreCoordinator.DEFAULT_MAX_ATTEMPTS;
  public static final int DEFAULT_ADD_MAX_ATTEMPTS = 4;
  public static final long DEFAULT_ADD_RETRY_WAIT_MS = 100;

  private final String streamName;
  private final long batchIntervalMs;
  private final int pushQueueCapacity;
  private final int maxRecordsPerSecond;
  private final long checkpointIntervalMs;
  private final int storeMaxAttempts;
  private final int addMaxAttempts;
  private final long addRetryWaitMs;

  private ReceiverConfigurationOptions(Builder builder) {
    this.streamName = builder.streamName;
    this.batchIntervalMs = builder.batchIntervalMs;
    this.pushQueueCapacity = builder.pushQueueCapacity;
    this.maxRecordsPerSecond = builder.maxRecordsPerSecond;
    this.checkpointIntervalMs = builder.checkpointIntervalMs;
    this.storeMaxAttempts = builder.storeMaxAttempts;
    this.addMaxAttempts = builder.addMaxAttempts;
    this.addRetryWaitMs = builder.addRetryWaitMs;
  }

  /** Returns the name of the stream the receiver consumes. */
  public String streamName() {
    return streamName;
  }

  /** Returns the interval at which the built-in batch generator seals batches. */
  public long batchIntervalMs() {
    return batchIntervalMs;
  }

  /** Returns how many sealed batches may wait to be stored before sealing blocks. */
  public int pushQueueCapacity() {
    return pushQueueCapacity;
  }

  /**
   * Returns the ingestion limit in records per second.
   *
   * @return the limit, or {@link Integer#MAX_VALUE} when ingestion is not limited
   */
  public int maxRecordsPerSecond() {
    return maxRecordsPerSecond;
  }

  /** Returns the interval between checkpoint cycles. */
  public long checkpointIntervalMs() {
    return checkpointIntervalMs;
  }

  /** Returns the total number of attempts to store one batch. */
  public int storeMaxAttempts() {
    return storeMaxAttempts;
  }

  /** Returns the total number of attempts a shard processor makes to add one record list. */
  public int addMaxAttempts() {
    return addMaxAttempts;
  }

  /** Returns the wait between a shard processor's add attempts. */
  public long addRetryWaitMs() {
    return addRetryWaitMs;
  }

  /**
   * Returns a factory for the built-in {@link BatchGenerator} configured from these options.
   *
   * @param <T> The type of items in a batch
   * @param <M> The type of metadata accompanying an add
   */
  public <T, M> BatchingEngineFactory<T, M> batchGeneratorFactory() {
    return BatchGenerator.factory(batchIntervalMs, pushQueueCapacity, maxRecordsPerSecond);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .setStreamName(streamName)
        .setBatchIntervalMs(batchIntervalMs)
        .setPushQueueCapacity(pushQueueCapacity)
        .setMaxRecordsPerSecond(maxRecordsPerSecond)
        .setCheckpointIntervalMs(checkpointIntervalMs)
        .setStoreMaxAttempts(storeMaxAttempts)
        .setAddMaxAttempts(addMaxAttempts)
        .setAddRetryWaitMs(addRetryWaitMs);
  }

  @Override
  public String toString() {
    return "ReceiverConfigurationOptions(streamName="
        + streamName
        + ", batchIntervalMs="
        + batchIntervalMs
        + ", pushQueueCapacity="
        + pushQueueCapacity
        + ", maxRecordsPerSecond="
        + maxRecordsPerSecond
        + ", checkpointIntervalMs="
        + checkpointIntervalMs
        + ", storeMaxAttempts="
        + storeMaxAttempts
        + ", addMaxAttempts="
        + addMaxAttempts
        + ", addRetryWaitMs="
        + addRetryWaitMs
        + ")";
  }

  /** Builder for {@link ReceiverConfigurationOptions}. */
  public static final class Builder {
    private String streamName;
    private long batchIntervalMs = DEFAULT_BATCH_INTERVAL_MS;
    private int pushQueueCapacity = DEFAULT_PUSH_QUEUE_CAPACITY;
    private int maxRecordsPerSecond = DEFAULT_MAX_RECORDS_PER_SECOND;
    private long checkpointIntervalMs = DEFAULT_CHECKPOINT_INTERVAL_MS;
    private int storeMaxAttempts = DEFAULT_STORE_MAX_ATTEMPTS;
    private int addMaxAttempts = DEFAULT_ADD_MAX_ATTEMPTS;
    private long addRetryWaitMs = DEFAULT_ADD_RETRY_WAIT_MS;

    private Builder() {}

    /**
     * Sets the stream name. Required.
     *
     * @param streamName the name of the consumed stream
     * @return this builder for method chaining
     */
    public Builder setStreamName(String streamName) {
      this.streamName = streamName;
      return this;
    }

    public Builder setBatchIntervalMs(long batchIntervalMs) {
      this.batchIntervalMs = batchIntervalMs;
      return this;
    }

    public Builder setPushQueueCapacity(int pushQueueCapacity) {
      this.pushQueueCapacity = pushQueueCapacity;
      return this;
    }

    /**
     * Sets the ingestion limit.
     *
     * @param maxRecordsPerSecond records per second, or {@link Integer#MAX_VALUE} for no limit
     * @return this builder for method chaining
     */
    public Builder setMaxRecordsPerSecond(int maxRecordsPerSecond) {
      this.maxRecordsPerSecond = maxRecordsPerSecond;
      return this;
    }

    public Builder setCheckpointIntervalMs(long checkpointIntervalMs) {
      this.checkpointIntervalMs = checkpointIntervalMs;
      return this;
    }

    public Builder setStoreMaxAttempts(int storeMaxAttempts) {
      this.storeMaxAttempts = storeMaxAttempts;
      return this;
    }

    public Builder setAddMaxAttempts(int addMaxAttempts) {
      this.addMaxAttempts = addMaxAttempts;
      return this;
    }

    public Builder setAddRetryWaitMs(long addRetryWaitMs) {
      this.addRetryWaitMs = addRetryWaitMs;
      return this;
    }

    /**
     * Builds the options.
     *
     * @return new options
     * @throws NullPointerException if no stream name was set
     * @throws IllegalArgumentException if a value is out of range
     */
    public ReceiverConfigurationOptions build() {
      Objects.requireNonNull(streamName, "streamName");
      if (streamName.isEmpty()) {
        throw new IllegalArgumentException("streamName must not be empty");
      }
      requirePositive("batchIntervalMs", batchIntervalMs);
      requirePositive("pushQueueCapacity", pushQueueCapacity);
      requirePositive("maxRecordsPerSecond", maxRecordsPerSecond);
      requirePositive("checkpointIntervalMs", checkpointIntervalMs);
      requirePositive("storeMaxAttempts", storeMaxAttempts);
      requirePositive("addMaxAttempts", addMaxAttempts);
      if (addRetryWaitMs < 0) {
        throw new IllegalArgumentException(
            "addRetryWaitMs must not be negative, got " + addRetryWaitMs);
      }
      return new ReceiverConfigurationOptions(this);
    }

    private static void requirePositive(String name, long value) {
      if (value <= 0) {
        throw new IllegalArgumentException(name + " must be positive, got " + value);
      }
    }
  }
}
