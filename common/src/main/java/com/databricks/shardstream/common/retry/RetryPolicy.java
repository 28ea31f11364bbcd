package com.databricks.shardstream.common.retry;

/**
 * Bounds for retrying a remote call: exponential backoff limited by both an attempt count and an
 * elapsed-time budget, whichever is reached first.
 *
 * <p>Use the builder pattern to create instances:
 *
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.builder()
 *     .setMaxRetries(5)
 *     .setRetryWaitTimeMs(200)
 *     .setRetryTimeoutMs(30000)
 *     .build();
 * }</pre>
 */
public final class RetryPolicy {

  public static final int DEFAULT_MAX_RETRIES = 3;
  public static final long DEFAULT_RETRY_WAIT_TIME_MS = 100;
  public static final long DEFAULT_RETRY_TIMEOUT_MS = 10000;

  private final int maxRetries;
  private final long retryWaitTimeMs;
  private final long retryTimeoutMs;

  private RetryPolicy(int maxRetries, long retryWaitTimeMs, long retryTimeoutMs) {
    this.maxRetries = maxRetries;
    this.retryWaitTimeMs = retryWaitTimeMs;
    this.retryTimeoutMs = retryTimeoutMs;
  }

  /**
   * Returns the maximum number of attempts.
   *
   * <p>The driver stops once this many attempts have been made, counting the first one.
   *
   * @return the maximum number of attempts
   */
  public int maxRetries() {
    return maxRetries;
  }

  /**
   * Returns the wait before the first retry. The wait doubles after every retry.
   *
   * @return the initial backoff in milliseconds
   */
  public long retryWaitTimeMs() {
    return retryWaitTimeMs;
  }

  /**
   * Returns the elapsed-time budget measured from the first attempt.
   *
   * @return the retry timeout in milliseconds
   */
  public long retryTimeoutMs() {
    return retryTimeoutMs;
  }

  /**
   * Returns the default policy: 3 attempts, 100 ms initial backoff, 10 s timeout.
   *
   * @return the default retry policy
   */
  public static RetryPolicy getDefault() {
    return new RetryPolicy(
        DEFAULT_MAX_RETRIES, DEFAULT_RETRY_WAIT_TIME_MS, DEFAULT_RETRY_TIMEOUT_MS);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .setMaxRetries(maxRetries)
        .setRetryWaitTimeMs(retryWaitTimeMs)
        .setRetryTimeoutMs(retryTimeoutMs);
  }

  @Override
  public String toString() {
    return "RetryPolicy(maxRetries="
        + maxRetries
        + ", retryWaitTimeMs="
        + retryWaitTimeMs
        + ", retryTimeoutMs="
        + retryTimeoutMs
        + ")";
  }

  /** Builder for {@link RetryPolicy}. */
  public static final class Builder {
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private long retryWaitTimeMs = DEFAULT_RETRY_WAIT_TIME_MS;
    private long retryTimeoutMs = DEFAULT_RETRY_TIMEOUT_MS;

    private Builder() {}

    /**
     * Sets the maximum number of attempts.
     *
     * @param maxRetries the maximum number of attempts, at least 1
     * @return this builder for method chaining
     */
    public Builder setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Sets the wait before the first retry.
     *
     * @param retryWaitTimeMs the initial backoff in milliseconds, not negative
     * @return this builder for method chaining
     */
    public Builder setRetryWaitTimeMs(long retryWaitTimeMs) {
      this.retryWaitTimeMs = retryWaitTimeMs;
      return this;
    }

    /**
     * Sets the elapsed-time budget.
     *
     * @param retryTimeoutMs the retry timeout in milliseconds, positive
     * @return this builder for method chaining
     */
    public Builder setRetryTimeoutMs(long retryTimeoutMs) {
      this.retryTimeoutMs = retryTimeoutMs;
      return this;
    }

    /**
     * Builds the policy.
     *
     * @return a new RetryPolicy
     * @throws IllegalArgumentException if any value is out of range
     */
    public RetryPolicy build() {
      if (maxRetries < 1) {
        throw new IllegalArgumentException("maxRetries must be at least 1, got " + maxRetries);
      }
      if (retryWaitTimeMs < 0) {
        throw new IllegalArgumentException(
            "retryWaitTimeMs must not be negative, got " + retryWaitTimeMs);
      }
      if (retryTimeoutMs <= 0) {
        throw new IllegalArgumentException(
            "retryTimeoutMs must be positive, got " + retryTimeoutMs);
      }
      return new RetryPolicy(maxRetries, retryWaitTimeMs, retryTimeoutMs);
    }
  }
}
