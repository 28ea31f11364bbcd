package com.databricks.shardstream.replay;

import static org.junit.jupiter.api.Assertions.*;

import com.databricks.shardstream.common.remote.ThrottledException;
import com.databricks.shardstream.common.retry.RetryPolicy;
import org.junit.jupiter.api.Test;

class ReplayConfigurationOptionsTest {

  @Test
  void testDefaults() {
    ReplayConfigurationOptions options = ReplayConfigurationOptions.getDefault();

    assertEquals(5000, options.callTimeoutMs());
    assertEquals(10000, options.maxRecordsPerPage());
    assertEquals(3, options.retryPolicy().maxRetries());
    assertEquals(100, options.retryPolicy().retryWaitTimeMs());
    assertEquals(10000, options.retryPolicy().retryTimeoutMs());
    assertFalse(options.cancellation().getAsBoolean());
    assertTrue(options.errorClassifier().isRetryable(new ThrottledException("slow down")));
    assertFalse(options.errorClassifier().isRetryable(new IllegalStateException("broken")));
  }

  @Test
  void testToBuilderKeepsValues() {
    ReplayConfigurationOptions options =
        ReplayConfigurationOptions.builder()
            .setCallTimeoutMs(1000)
            .setMaxRecordsPerPage(50)
            .setRetryPolicy(RetryPolicy.builder().setMaxRetries(7).build())
            .build();

    ReplayConfigurationOptions copy = options.toBuilder().build();

    assertEquals(1000, copy.callTimeoutMs());
    assertEquals(50, copy.maxRecordsPerPage());
    assertEquals(7, copy.retryPolicy().maxRetries());
  }

  @Test
  void testInvalidValuesRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ReplayConfigurationOptions.builder().setCallTimeoutMs(0).build());
    assertThrows(
        IllegalArgumentException.class,
        () -> ReplayConfigurationOptions.builder().setMaxRecordsPerPage(0).build());
    assertThrows(
        NullPointerException.class,
        () -> ReplayConfigurationOptions.builder().setRetryPolicy(null));
  }
}
