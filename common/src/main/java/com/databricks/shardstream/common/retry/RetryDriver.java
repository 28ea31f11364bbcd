package com.databricks.shardstream.common.retry;

import com.databricks.shardstream.common.remote.FatalRemoteException;
import com.databricks.shardstream.common.remote.RemoteCallResult;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a remote call under a {@link RetryPolicy}, inspecting each {@link RemoteCallResult}.
 *
 * <p>Outcomes are handled as follows:
 *
 * <ul>
 *   <li>{@code SUCCESS} - the value is returned
 *   <li>{@code RETRYABLE} - logged and retried after a backoff that starts at {@link
 *       RetryPolicy#retryWaitTimeMs()} and doubles after each retry (e.g., 100ms, 200ms, 400ms)
 *   <li>{@code FATAL} - a {@link FatalRemoteException} is thrown at once, without consuming the
 *       remaining retries
 * </ul>
 *
 * <p>Retrying stops when the attempt count reaches {@link RetryPolicy#maxRetries()} or the elapsed
 * time reaches {@link RetryPolicy#retryTimeoutMs()}, whichever comes first, with a {@link
 * RetryAbortedException} whose reason tells the two apart. A cancellation signal, if given, is
 * checked between attempts; interrupting the calling thread during a backoff also cancels.
 */
public class RetryDriver {
  private static final Logger logger = LoggerFactory.getLogger(RetryDriver.class);

  private static final BooleanSupplier NEVER_CANCELLED = () -> false;

  private final RetryPolicy policy;
  private final BooleanSupplier cancelled;
  private final LongSupplier clockMs;
  private final Sleeper sleeper;

  /**
   * Creates a driver that is never cancelled.
   *
   * @param policy The retry bounds
   */
  public RetryDriver(@Nonnull RetryPolicy policy) {
    this(policy, NEVER_CANCELLED);
  }

  /**
   * Creates a driver that stops when {@code cancelled} returns true.
   *
   * @param policy The retry bounds
   * @param cancelled Cancellation signal, checked before every retry
   */
  public RetryDriver(@Nonnull RetryPolicy policy, @Nonnull BooleanSupplier cancelled) {
    this(policy, cancelled, System::currentTimeMillis, Thread::sleep);
  }

  RetryDriver(
      RetryPolicy policy, BooleanSupplier cancelled, LongSupplier clockMs, Sleeper sleeper) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.cancelled = Objects.requireNonNull(cancelled, "cancelled");
    this.clockMs = clockMs;
    this.sleeper = sleeper;
  }

  /** Returns the policy this driver enforces. */
  public RetryPolicy getPolicy() {
    return policy;
  }

  /**
   * Executes {@code call} until it succeeds, fails fatally, or the retry budget is used up.
   *
   * @param description What the call does, used in log and error messages (e.g. "getting records")
   * @param call Performs one attempt of the remote call
   * @param <T> The type of the call's value
   * @return the value of the first successful attempt
   * @throws FatalRemoteException if an attempt fails with a non-retriable error
   * @throws RetryAbortedException if the attempts or the time budget ran out, or on cancellation
   */
  @Nullable public <T> T execute(
      @Nonnull String description, @Nonnull Supplier<RemoteCallResult<T>> call) {
    long startTimeMs = clockMs.getAsLong();
    long waitTimeMs = policy.retryWaitTimeMs();
    int attempts = 0;
    Throwable lastError = null;

    while (!isTimedOut(startTimeMs) && attempts < policy.maxRetries()) {
      if (attempts > 0) {
        if (cancelled.getAsBoolean()) {
          throw new RetryAbortedException(
              RetryAbortedException.Reason.CANCELLED,
              attempts,
              "Cancelled after " + attempts + " attempts while " + description,
              lastError);
        }
        backOff(waitTimeMs, attempts, description, lastError);
        waitTimeMs *= 2;
      }

      RemoteCallResult<T> result = call.get();
      attempts++;

      switch (result.getKind()) {
        case SUCCESS:
          if (attempts > 1) {
            logger.debug("Succeeded while {} after {} attempts", description, attempts);
          }
          return result.getValue();
        case RETRYABLE:
          lastError = result.getError();
          logger.warn("Error while {} [attempt = {}]", description, attempts, lastError);
          break;
        case FATAL:
        default:
          throw new FatalRemoteException("Error while " + description, result.getError());
      }
    }

    if (isTimedOut(startTimeMs)) {
      throw new RetryAbortedException(
          RetryAbortedException.Reason.TIMED_OUT,
          attempts,
          "Timed out after "
              + policy.retryTimeoutMs()
              + " ms while "
              + description
              + ", last exception: "
              + lastError,
          lastError);
    }
    throw new RetryAbortedException(
        RetryAbortedException.Reason.RETRIES_EXHAUSTED,
        attempts,
        "Gave up after " + attempts + " retries while " + description + ", last exception: "
            + lastError,
        lastError);
  }

  private boolean isTimedOut(long startTimeMs) {
    return clockMs.getAsLong() - startTimeMs >= policy.retryTimeoutMs();
  }

  private void backOff(long waitTimeMs, int attempts, String description, Throwable lastError) {
    try {
      sleeper.sleep(waitTimeMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      RetryAbortedException aborted =
          new RetryAbortedException(
              RetryAbortedException.Reason.CANCELLED,
              attempts,
              "Interrupted after " + attempts + " attempts while " + description,
              lastError);
      aborted.addSuppressed(e);
      throw aborted;
    }
  }

  /** Waits between attempts. */
  @FunctionalInterface
  interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }
}
