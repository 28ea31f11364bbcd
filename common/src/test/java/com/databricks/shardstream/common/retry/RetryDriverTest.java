package com.databricks.shardstream.common.retry;

import static org.junit.jupiter.api.Assertions.*;

import com.databricks.shardstream.common.remote.FatalRemoteException;
import com.databricks.shardstream.common.remote.RemoteCallResult;
import com.databricks.shardstream.common.remote.ThrottledException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;

/** Tests for RetryDriver. */
class RetryDriverTest {

  private static RetryPolicy policy(int maxRetries, long waitMs, long timeoutMs) {
    return RetryPolicy.builder()
        .setMaxRetries(maxRetries)
        .setRetryWaitTimeMs(waitMs)
        .setRetryTimeoutMs(timeoutMs)
        .build();
  }

  @Test
  void testSuccessOnFirstAttempt() {
    MockCall<String> call = new MockCall<>(RemoteCallResult.success("cursor-1"));
    FakeClock clock = new FakeClock();
    RetryDriver driver = new RetryDriver(policy(3, 10, 1000), () -> false, clock, clock);

    assertEquals("cursor-1", driver.execute("opening cursor", call));
    assertEquals(1, call.getCallCount());
    assertTrue(clock.sleeps.isEmpty());
  }

  @Test
  void testThrottlingRetriedWithDoublingBackoff() {
    MockCall<String> call =
        new MockCall<>(
            RemoteCallResult.<String>retryable(new ThrottledException("slow down")),
            RemoteCallResult.<String>retryable(new ThrottledException("slow down")),
            RemoteCallResult.success("page"));
    FakeClock clock = new FakeClock();
    RetryDriver driver = new RetryDriver(policy(5, 100, 60000), () -> false, clock, clock);

    assertEquals("page", driver.execute("getting records", call));
    assertEquals(3, call.getCallCount());
    assertEquals(Arrays.asList(100L, 200L), clock.sleeps);
  }

  @Test
  void testRetriesExhausted() {
    MockCall<String> call =
        new MockCall<>(RemoteCallResult.<String>retryable(new ThrottledException("throttled")));
    FakeClock clock = new FakeClock();
    RetryDriver driver = new RetryDriver(policy(3, 1, 60000), () -> false, clock, clock);

    RetryAbortedException thrown =
        assertThrows(RetryAbortedException.class, () -> driver.execute("getting records", call));

    assertEquals(RetryAbortedException.Reason.RETRIES_EXHAUSTED, thrown.getReason());
    assertEquals(3, thrown.getAttempts());
    assertEquals(3, call.getCallCount());
    assertTrue(thrown.getCause() instanceof ThrottledException);
    assertTrue(thrown.getMessage().startsWith("Gave up after 3 retries while getting records"));
  }

  @Test
  void testTimedOutBeforeRetriesExhausted() {
    MockCall<String> call =
        new MockCall<>(RemoteCallResult.<String>retryable(new ThrottledException("throttled")));
    FakeClock clock = new FakeClock();
    // Each backoff advances the clock; 100 + 200 + 400 >= 500 after the fourth attempt.
    RetryDriver driver = new RetryDriver(policy(100, 100, 500), () -> false, clock, clock);

    RetryAbortedException thrown =
        assertThrows(RetryAbortedException.class, () -> driver.execute("getting records", call));

    assertEquals(RetryAbortedException.Reason.TIMED_OUT, thrown.getReason());
    assertEquals(4, call.getCallCount());
    assertTrue(thrown.getMessage().startsWith("Timed out after 500 ms while getting records"));
  }

  @Test
  void testFatalErrorNotRetried() {
    IllegalStateException failure = new IllegalStateException("resource not found");
    MockCall<String> call =
        new MockCall<>(
            RemoteCallResult.<String>retryable(new ThrottledException("throttled")),
            RemoteCallResult.<String>fatal(failure),
            RemoteCallResult.success("never"));
    FakeClock clock = new FakeClock();
    RetryDriver driver = new RetryDriver(policy(10, 1, 60000), () -> false, clock, clock);

    FatalRemoteException thrown =
        assertThrows(FatalRemoteException.class, () -> driver.execute("opening cursor", call));

    assertSame(failure, thrown.getCause());
    assertEquals(2, call.getCallCount());
  }

  @Test
  void testCancelledBetweenRetries() {
    AtomicBoolean cancelled = new AtomicBoolean(false);
    MockCall<String> call =
        new MockCall<>(RemoteCallResult.<String>retryable(new ThrottledException("throttled")));
    call.onCall(() -> cancelled.set(true));
    FakeClock clock = new FakeClock();
    RetryDriver driver = new RetryDriver(policy(10, 1, 60000), cancelled::get, clock, clock);

    RetryAbortedException thrown =
        assertThrows(RetryAbortedException.class, () -> driver.execute("getting records", call));

    assertEquals(RetryAbortedException.Reason.CANCELLED, thrown.getReason());
    assertEquals(1, call.getCallCount());
    assertTrue(clock.sleeps.isEmpty());
  }

  @Test
  void testInterruptDuringBackoffCancels() {
    MockCall<String> call =
        new MockCall<>(RemoteCallResult.<String>retryable(new ThrottledException("throttled")));
    RetryDriver driver =
        new RetryDriver(
            policy(10, 1, 60000),
            () -> false,
            System::currentTimeMillis,
            millis -> {
              throw new InterruptedException("stop");
            });

    try {
      RetryAbortedException thrown =
          assertThrows(
              RetryAbortedException.class, () -> driver.execute("getting records", call));
      assertEquals(RetryAbortedException.Reason.CANCELLED, thrown.getReason());
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void testRealSleepSmallBackoff() {
    MockCall<Void> call =
        new MockCall<>(
            RemoteCallResult.<Void>retryable(new ThrottledException("throttled")),
            RemoteCallResult.success());
    RetryDriver driver = new RetryDriver(policy(3, 1, 5000));

    assertNull(driver.execute("checkpointing", call));
    assertEquals(2, call.getCallCount());
  }

  @Test
  void testPolicyValidation() {
    assertThrows(IllegalArgumentException.class, () -> policy(0, 1, 1));
    assertThrows(IllegalArgumentException.class, () -> policy(1, -1, 1));
    assertThrows(IllegalArgumentException.class, () -> policy(1, 1, 0));

    RetryPolicy defaults = RetryPolicy.getDefault();
    assertEquals(3, defaults.maxRetries());
    assertEquals(100, defaults.retryWaitTimeMs());
    assertEquals(10000, defaults.retryTimeoutMs());

    RetryPolicy copy = defaults.toBuilder().setMaxRetries(7).build();
    assertEquals(7, copy.maxRetries());
    assertEquals(defaults.retryTimeoutMs(), copy.retryTimeoutMs());
  }

  // Mock remote call that returns results in order, repeating the last one.
  private static class MockCall<T> implements Supplier<RemoteCallResult<T>> {
    private final LinkedList<RemoteCallResult<T>> results;
    private int callCount = 0;
    private Runnable sideEffect = () -> {};

    @SafeVarargs
    MockCall(RemoteCallResult<T>... results) {
      this.results = new LinkedList<>(Arrays.asList(results));
    }

    void onCall(Runnable sideEffect) {
      this.sideEffect = sideEffect;
    }

    int getCallCount() {
      return callCount;
    }

    @Override
    public RemoteCallResult<T> get() {
      callCount++;
      sideEffect.run();
      return results.size() > 1 ? results.removeFirst() : results.getFirst();
    }
  }

  // Clock that only advances when the driver sleeps.
  private static class FakeClock implements java.util.function.LongSupplier, RetryDriver.Sleeper {
    private long now = 1_000_000L;
    private final List<Long> sleeps = new ArrayList<>();

    @Override
    public long getAsLong() {
      return now;
    }

    @Override
    public void sleep(long millis) {
      sleeps.add(millis);
      now += millis;
    }
  }
}
