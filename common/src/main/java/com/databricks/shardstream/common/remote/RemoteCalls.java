package com.databricks.shardstream.common.remote;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.annotation.Nonnull;

/**
 * Converts asynchronous remote calls into {@link RemoteCallResult}s.
 *
 * <p>This is the client boundary where thrown errors are classified exactly once. Everything above
 * it inspects tagged results.
 */
public final class RemoteCalls {

  private RemoteCalls() {}

  /**
   * Waits for {@code call} to complete and classifies its outcome.
   *
   * <p>A call that does not complete within {@code timeoutMs} is cancelled and reported as fatal,
   * as is an interrupt of the waiting thread (the interrupt flag is restored). Failures of the call
   * itself are classified by {@code classifier}.
   *
   * @param call The pending remote call
   * @param timeoutMs Maximum time to wait for the call, in milliseconds
   * @param classifier Decides which failures are retryable
   * @param <T> The type of the call's value
   * @return the classified outcome, never null
   */
  @Nonnull
  public static <T> RemoteCallResult<T> await(
      @Nonnull CompletableFuture<T> call,
      long timeoutMs,
      @Nonnull RemoteErrorClassifier classifier) {
    try {
      return RemoteCallResult.success(call.get(timeoutMs, TimeUnit.MILLISECONDS));
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      return classify(cause, classifier);
    } catch (TimeoutException e) {
      call.cancel(true);
      return RemoteCallResult.fatal(e);
    } catch (CancellationException e) {
      return RemoteCallResult.fatal(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      call.cancel(true);
      return RemoteCallResult.fatal(e);
    }
  }

  /**
   * Classifies an error thrown by a remote call.
   *
   * @param error The failure
   * @param classifier Decides which failures are retryable
   * @param <T> The type of the call's value
   * @return a retryable or fatal result wrapping {@code error}
   */
  @Nonnull
  public static <T> RemoteCallResult<T> classify(
      @Nonnull Throwable error, @Nonnull RemoteErrorClassifier classifier) {
    return classifier.isRetryable(error)
        ? RemoteCallResult.retryable(error)
        : RemoteCallResult.fatal(error);
  }
}
