package com.databricks.shardstream.common.remote;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;

/** Tests for RemoteCalls and RemoteCallResult. */
class RemoteCallsTest {

  private final RemoteErrorClassifier classifier = RemoteErrorClassifier.throttlingOnly();

  @Test
  void testCompletedCallIsSuccess() {
    RemoteCallResult<String> result =
        RemoteCalls.await(CompletableFuture.completedFuture("cursor"), 1000, classifier);

    assertTrue(result.isSuccess());
    assertEquals(RemoteCallResult.Kind.SUCCESS, result.getKind());
    assertEquals("cursor", result.getValue());
    assertNull(result.getError());
  }

  @Test
  void testThrottlingIsRetryable() {
    CompletableFuture<String> call = new CompletableFuture<>();
    call.completeExceptionally(new ThrottledException("rate exceeded"));

    RemoteCallResult<String> result = RemoteCalls.await(call, 1000, classifier);

    assertEquals(RemoteCallResult.Kind.RETRYABLE, result.getKind());
    assertTrue(result.getError() instanceof ThrottledException);
  }

  @Test
  void testWrappedThrottlingIsRetryable() {
    CompletableFuture<String> call = new CompletableFuture<>();
    call.completeExceptionally(
        new IllegalStateException("sdk failure", new ThrottledException("rate exceeded")));

    assertEquals(
        RemoteCallResult.Kind.RETRYABLE, RemoteCalls.await(call, 1000, classifier).getKind());
  }

  @Test
  void testOtherErrorsAreFatal() {
    CompletableFuture<String> call = new CompletableFuture<>();
    call.completeExceptionally(new IOException("connection reset"));

    RemoteCallResult<String> result = RemoteCalls.await(call, 1000, classifier);

    assertEquals(RemoteCallResult.Kind.FATAL, result.getKind());
    assertTrue(result.getError() instanceof IOException);
    assertThrows(IllegalStateException.class, result::getValue);
  }

  @Test
  void testTimeoutIsFatalAndCancelsCall() {
    CompletableFuture<String> call = new CompletableFuture<>();

    RemoteCallResult<String> result = RemoteCalls.await(call, 10, classifier);

    assertEquals(RemoteCallResult.Kind.FATAL, result.getKind());
    assertTrue(result.getError() instanceof TimeoutException);
    assertTrue(call.isCancelled());
  }

  @Test
  void testCustomClassifier() {
    RemoteErrorClassifier ioRetryable = error -> error instanceof IOException;

    assertEquals(
        RemoteCallResult.Kind.RETRYABLE,
        RemoteCalls.classify(new IOException("reset"), ioRetryable).getKind());
    assertEquals(
        RemoteCallResult.Kind.FATAL,
        RemoteCalls.classify(new ThrottledException("throttled"), ioRetryable).getKind());
  }

  @Test
  void testFactoriesRejectNullErrors() {
    assertThrows(NullPointerException.class, () -> RemoteCallResult.retryable(null));
    assertThrows(NullPointerException.class, () -> RemoteCallResult.fatal(null));
    assertSame(RemoteCallResult.success(), RemoteCallResult.success());
  }
}
