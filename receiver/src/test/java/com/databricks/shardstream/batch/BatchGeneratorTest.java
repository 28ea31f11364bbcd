package com.databricks.shardstream.batch;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/** Tests for BatchGenerator. */
@Timeout(value = 30, unit = TimeUnit.SECONDS)
class BatchGeneratorTest {

  // Long enough that only explicit seals happen during a test.
  private static final long MANUAL_SEAL_INTERVAL_MS = 60000;

  private final ReentrantLock lock = new ReentrantLock();
  private final RecordingListener listener = new RecordingListener(lock);
  private BatchGenerator<String, String> generator;

  @AfterEach
  void tearDown() {
    if (generator != null) {
      generator.stop();
    }
  }

  private BatchGenerator<String, String> newGenerator(long intervalMs) {
    generator =
        new BatchGenerator<>(
            "receiver-1", listener, lock, intervalMs, 10, IngestionRateLimiter.UNLIMITED);
    return generator;
  }

  // ==================== Lifecycle ====================

  @Test
  void testAddBeforeStartFails() {
    newGenerator(MANUAL_SEAL_INTERVAL_MS);

    assertThrows(
        IllegalStateException.class,
        () -> generator.addAllWithMetadata(Collections.singletonList("a"), "m"));
  }

  @Test
  void testAddAfterStopFails() {
    newGenerator(MANUAL_SEAL_INTERVAL_MS).start();
    generator.stop();

    assertThrows(
        IllegalStateException.class,
        () -> generator.addAllWithMetadata(Collections.singletonList("a"), "m"));
  }

  @Test
  void testStartTwiceFails() {
    newGenerator(MANUAL_SEAL_INTERVAL_MS).start();

    assertThrows(IllegalStateException.class, generator::start);
  }

  @Test
  void testInvalidIntervalRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new BatchGenerator<String, String>("r", listener, lock, 0, 10, 100));
  }

  // ==================== Sealing and pushing ====================

  @Test
  void testAddCallsOnAddDataOncePerCallUnderLock() {
    newGenerator(MANUAL_SEAL_INTERVAL_MS).start();

    generator.addAllWithMetadata(Arrays.asList("a", "b", "c"), "range-1");

    assertEquals(Collections.singletonList("range-1"), listener.addedMetadata);
    assertTrue(listener.callbacksHeldLock);
  }

  @Test
  void testSealingEmptyBufferProducesNoBatch() {
    newGenerator(MANUAL_SEAL_INTERVAL_MS).start();

    generator.sealCurrentBatch();
    generator.stop();

    assertTrue(listener.generated.isEmpty());
    assertTrue(listener.pushed.isEmpty());
  }

  @Test
  void testBatchesArePushedInSealOrder() {
    newGenerator(MANUAL_SEAL_INTERVAL_MS).start();

    generator.addAllWithMetadata(Arrays.asList("a", "b"), "m1");
    generator.sealCurrentBatch();
    generator.addAllWithMetadata(Collections.singletonList("c"), "m2");
    generator.sealCurrentBatch();
    generator.stop();

    assertEquals(
        Arrays.asList(new BatchId("receiver-1", 0), new BatchId("receiver-1", 1)),
        listener.generated);
    assertEquals(listener.generated, listener.pushedIds);
    assertEquals(
        Arrays.asList(Arrays.asList("a", "b"), Collections.singletonList("c")), listener.pushed);
    assertTrue(listener.callbacksHeldLock);
  }

  @Test
  void testStopSealsAndPushesOpenBatch() {
    newGenerator(MANUAL_SEAL_INTERVAL_MS).start();

    generator.addAllWithMetadata(Arrays.asList("x", "y"), "m");
    generator.stop();

    assertEquals(1, listener.pushed.size());
    assertEquals(Arrays.asList("x", "y"), listener.pushed.get(0));
    assertEquals(0, generator.queuedBatchCount());
  }

  @Test
  void testTimerSealsPeriodically() throws Exception {
    newGenerator(20).start();

    generator.addAllWithMetadata(Collections.singletonList("a"), "m");
    long deadline = System.currentTimeMillis() + 5000;
    while (listener.pushedCount() == 0 && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }

    assertEquals(1, listener.pushedCount());
  }

  @Test
  void testPushFailureIsReportedAndLoopContinues() {
    listener.failPushes = 1;
    newGenerator(MANUAL_SEAL_INTERVAL_MS).start();

    generator.addAllWithMetadata(Collections.singletonList("a"), "m1");
    generator.sealCurrentBatch();
    generator.addAllWithMetadata(Collections.singletonList("b"), "m2");
    generator.stop();

    assertEquals(1, listener.errors.size());
    assertEquals(Collections.singletonList(Collections.singletonList("b")), listener.pushed);
  }

  @Test
  void testCurrentLimit() {
    BatchGenerator<String, String> limited =
        new BatchGenerator<>("receiver-2", listener, lock, MANUAL_SEAL_INTERVAL_MS, 10, 500);

    assertEquals(500, limited.getCurrentLimit());
    assertEquals(
        IngestionRateLimiter.UNLIMITED,
        newGenerator(MANUAL_SEAL_INTERVAL_MS).getCurrentLimit());
    limited.stop();
  }

  /** Records every callback. */
  private static final class RecordingListener implements BatchListener<String, String> {
    private final ReentrantLock lock;
    final List<String> addedMetadata = Collections.synchronizedList(new ArrayList<>());
    final List<BatchId> generated = Collections.synchronizedList(new ArrayList<>());
    final List<BatchId> pushedIds = Collections.synchronizedList(new ArrayList<>());
    final List<List<String>> pushed = Collections.synchronizedList(new ArrayList<>());
    final List<Throwable> errors = Collections.synchronizedList(new ArrayList<>());
    volatile boolean callbacksHeldLock = true;
    volatile int failPushes = 0;

    RecordingListener(ReentrantLock lock) {
      this.lock = lock;
    }

    int pushedCount() {
      return pushed.size();
    }

    @Override
    public void onAddData(List<String> items, String metadata) {
      callbacksHeldLock &= lock.isHeldByCurrentThread();
      addedMetadata.add(metadata);
    }

    @Override
    public void onGenerateBlock(BatchId batchId) {
      callbacksHeldLock &= lock.isHeldByCurrentThread();
      generated.add(batchId);
    }

    @Override
    public void onPushBlock(BatchId batchId, List<String> items) {
      if (failPushes > 0) {
        failPushes--;
        throw new IllegalStateException("store unavailable");
      }
      pushedIds.add(batchId);
      pushed.add(new ArrayList<>(items));
    }

    @Override
    public void onError(String message, Throwable error) {
      errors.add(error);
    }
  }
}
