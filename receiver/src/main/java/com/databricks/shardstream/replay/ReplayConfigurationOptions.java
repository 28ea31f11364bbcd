package com.databricks.shardstream.replay;

import com.databricks.shardstream.common.remote.RemoteErrorClassifier;
import com.databricks.shardstream.common.retry.RetryPolicy;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Configuration options for replaying sequence ranges from the source stream.
 *
 * <pre>{@code
 * ReplayConfigurationOptions options = ReplayConfigurationOptions.builder()
 *     .setRetryPolicy(RetryPolicy.builder().setMaxRetries(5).build())
 *     .setCallTimeoutMs(2000)
 *     .build();
 * }</pre>
 */
public final class ReplayConfigurationOptions {

  public static final long DEFAULT_CALL_TIMEOUT_MS = 5000;
  public static final int DEFAULT_MAX_RECORDS_PER_PAGE = 10000;

  private final RetryPolicy retryPolicy;
  private final long callTimeoutMs;
  private final int maxRecordsPerPage;
  private final RemoteErrorClassifier errorClassifier;
  private final BooleanSupplier cancellation;

  private ReplayConfigurationOptions(Builder builder) {
    this.retryPolicy = builder.retryPolicy;
    this.callTimeoutMs = builder.callTimeoutMs;
    this.maxRecordsPerPage = builder.maxRecordsPerPage;
    this.errorClassifier = builder.errorClassifier;
    this.cancellation = builder.cancellation;
  }

  /** Returns the retry policy applied to every cursor-open and page-fetch call. */
  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  /** Returns how long a single remote call may take, in milliseconds. */
  public long callTimeoutMs() {
    return callTimeoutMs;
  }

  /** Returns the upper bound on the records requested per page. */
  public int maxRecordsPerPage() {
    return maxRecordsPerPage;
  }

  /** Returns the classifier deciding which remote failures are retried. */
  public RemoteErrorClassifier errorClassifier() {
    return errorClassifier;
  }

  /** Returns the signal checked between retries; true aborts the replay. */
  public BooleanSupplier cancellation() {
    return cancellation;
  }

  public static ReplayConfigurationOptions getDefault() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .setRetryPolicy(retryPolicy)
        .setCallTimeoutMs(callTimeoutMs)
        .setMaxRecordsPerPage(maxRecordsPerPage)
        .setErrorClassifier(errorClassifier)
        .setCancellation(cancellation);
  }

  /** Builder for {@link ReplayConfigurationOptions}. */
  public static final class Builder {
    private RetryPolicy retryPolicy = RetryPolicy.getDefault();
    private long callTimeoutMs = DEFAULT_CALL_TIMEOUT_MS;
    private int maxRecordsPerPage = DEFAULT_MAX_RECORDS_PER_PAGE;
    private RemoteErrorClassifier errorClassifier = RemoteErrorClassifier.throttlingOnly();
    private BooleanSupplier cancellation = () -> false;

    private Builder() {}

    public Builder setRetryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
      return this;
    }

    public Builder setCallTimeoutMs(long callTimeoutMs) {
      this.callTimeoutMs = callTimeoutMs;
      return this;
    }

    public Builder setMaxRecordsPerPage(int maxRecordsPerPage) {
      this.maxRecordsPerPage = maxRecordsPerPage;
      return this;
    }

    public Builder setErrorClassifier(RemoteErrorClassifier errorClassifier) {
      this.errorClassifier = Objects.requireNonNull(errorClassifier, "errorClassifier");
      return this;
    }

    /**
     * Sets a cancellation signal, for example one bound to the consuming task.
     *
     * @param cancellation returns true once the replay should stop retrying
     * @return this builder for method chaining
     */
    public Builder setCancellation(BooleanSupplier cancellation) {
      this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
      return this;
    }

    /**
     * Builds the options.
     *
     * @return new options
     * @throws IllegalArgumentException if a value is out of range
     */
    public ReplayConfigurationOptions build() {
      if (callTimeoutMs <= 0) {
        throw new IllegalArgumentException(
            "callTimeoutMs must be positive, got " + callTimeoutMs);
      }
      if (maxRecordsPerPage < 1) {
        throw new IllegalArgumentException(
            "maxRecordsPerPage must be at least 1, got " + maxRecordsPerPage);
      }
      return new ReplayConfigurationOptions(this);
    }
  }
}
