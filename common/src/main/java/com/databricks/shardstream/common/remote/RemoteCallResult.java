package com.databricks.shardstream.common.remote;

import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Outcome of a single remote call: {@code success | retryable | fatal}.
 *
 * <p>Remote collaborators (stream clients, batch stores, checkpointers) report their outcome with
 * this type instead of throwing, so that retry decisions are made in one place by inspecting
 * {@link #getKind()} rather than by catching and classifying exceptions.
 *
 * <pre>{@code
 * RemoteCallResult<String> result = RemoteCalls.await(client.openCursor(...), 5000, classifier);
 * switch (result.getKind()) {
 *   case SUCCESS:   use(result.getValue()); break;
 *   case RETRYABLE: backOffAndRetry(); break;
 *   case FATAL:     abort(result.getError()); break;
 * }
 * }</pre>
 *
 * @param <T> The type of the value produced by a successful call
 */
public final class RemoteCallResult<T> {

  /** Classification of a remote call outcome. */
  public enum Kind {
    /** The call completed and produced a value. */
    SUCCESS,

    /** The call failed transiently (e.g. throttling) and may be retried. */
    RETRYABLE,

    /** The call failed permanently and must not be retried. */
    FATAL
  }

  private static final RemoteCallResult<Void> SUCCESS_VOID =
      new RemoteCallResult<>(Kind.SUCCESS, null, null);

  private final Kind kind;
  @Nullable private final T value;
  @Nullable private final Throwable error;

  private RemoteCallResult(Kind kind, @Nullable T value, @Nullable Throwable error) {
    this.kind = kind;
    this.value = value;
    this.error = error;
  }

  /** Returns a successful result carrying {@code value}. */
  public static <T> RemoteCallResult<T> success(@Nullable T value) {
    return new RemoteCallResult<>(Kind.SUCCESS, value, null);
  }

  /** Returns a successful result for calls that produce no value. */
  public static RemoteCallResult<Void> success() {
    return SUCCESS_VOID;
  }

  /** Returns a transient failure caused by {@code error}. */
  public static <T> RemoteCallResult<T> retryable(@Nonnull Throwable error) {
    return new RemoteCallResult<>(Kind.RETRYABLE, null, Objects.requireNonNull(error, "error"));
  }

  /** Returns a permanent failure caused by {@code error}. */
  public static <T> RemoteCallResult<T> fatal(@Nonnull Throwable error) {
    return new RemoteCallResult<>(Kind.FATAL, null, Objects.requireNonNull(error, "error"));
  }

  @Nonnull
  public Kind getKind() {
    return kind;
  }

  public boolean isSuccess() {
    return kind == Kind.SUCCESS;
  }

  /**
   * Returns the value of a successful call.
   *
   * @throws IllegalStateException if this result is not a success
   */
  @Nullable public T getValue() {
    if (kind != Kind.SUCCESS) {
      throw new IllegalStateException("No value for a " + kind + " result", error);
    }
    return value;
  }

  /** Returns the failure cause, or null for a successful call. */
  @Nullable public Throwable getError() {
    return error;
  }

  @Override
  public String toString() {
    return kind == Kind.SUCCESS
        ? "RemoteCallResult(SUCCESS)"
        : "RemoteCallResult(" + kind + ", " + error + ")";
  }
}
