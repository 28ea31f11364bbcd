package com.databricks.shardstream;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ReceiverConfigurationOptionsTest {

  @Test
  void testDefaults() {
    ReceiverConfigurationOptions options =
        ReceiverConfigurationOptions.builder().setStreamName("clicks").build();

    assertEquals("clicks", options.streamName());
    assertEquals(200, options.batchIntervalMs());
    assertEquals(10, options.pushQueueCapacity());
    assertEquals(Integer.MAX_VALUE, options.maxRecordsPerSecond());
    assertEquals(10000, options.checkpointIntervalMs());
    assertEquals(4, options.storeMaxAttempts());
    assertEquals(4, options.addMaxAttempts());
    assertEquals(100, options.addRetryWaitMs());
  }

  @Test
  void testToBuilderKeepsValues() {
    ReceiverConfigurationOptions options =
        ReceiverConfigurationOptions.builder()
            .setStreamName("clicks")
            .setBatchIntervalMs(500)
            .setPushQueueCapacity(3)
            .setMaxRecordsPerSecond(1000)
            .setCheckpointIntervalMs(30000)
            .setStoreMaxAttempts(2)
            .setAddMaxAttempts(1)
            .setAddRetryWaitMs(0)
            .build();

    ReceiverConfigurationOptions copy = options.toBuilder().setStreamName("views").build();

    assertEquals("views", copy.streamName());
    assertEquals(500, copy.batchIntervalMs());
    assertEquals(3, copy.pushQueueCapacity());
    assertEquals(1000, copy.maxRecordsPerSecond());
    assertEquals(30000, copy.checkpointIntervalMs());
    assertEquals(2, copy.storeMaxAttempts());
    assertEquals(1, copy.addMaxAttempts());
    assertEquals(0, copy.addRetryWaitMs());
  }

  @Test
  void testStreamNameIsRequired() {
    assertThrows(NullPointerException.class, () -> ReceiverConfigurationOptions.builder().build());
    assertThrows(
        IllegalArgumentException.class,
        () -> ReceiverConfigurationOptions.builder().setStreamName("").build());
  }

  @Test
  void testInvalidValuesRejected() {
    ReceiverConfigurationOptions.Builder valid =
        ReceiverConfigurationOptions.builder().setStreamName("clicks");

    assertThrows(
        IllegalArgumentException.class, () -> copy(valid).setBatchIntervalMs(0).build());
    assertThrows(
        IllegalArgumentException.class, () -> copy(valid).setPushQueueCapacity(0).build());
    assertThrows(
        IllegalArgumentException.class, () -> copy(valid).setMaxRecordsPerSecond(-1).build());
    assertThrows(
        IllegalArgumentException.class, () -> copy(valid).setCheckpointIntervalMs(0).build());
    assertThrows(IllegalArgumentException.class, () -> copy(valid).setStoreMaxAttempts(0).build());
    assertThrows(IllegalArgumentException.class, () -> copy(valid).setAddMaxAttempts(0).build());
    assertThrows(
        IllegalArgumentException.class, () -> copy(valid).setAddRetryWaitMs(-1).build());
  }

  private static ReceiverConfigurationOptions.Builder copy(ReceiverConfigurationOptions.Builder b) {
    return b.build().toBuilder();
  }
}
