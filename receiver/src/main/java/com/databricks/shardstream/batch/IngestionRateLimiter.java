package com.databricks.shardstream.batch;

/**
 * Blocks callers so that at most {@code limit} records are admitted per one-second window.
 *
 * <p>An add larger than the limit is admitted alone in a fresh window.
 */
final class IngestionRateLimiter {

  static final int UNLIMITED = Integer.MAX_VALUE;

  private static final long WINDOW_MS = 1000;

  private final int limit;
  private long windowStartMs = -1;
  private long admittedInWindow = 0;

  IngestionRateLimiter(int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive, got " + limit);
    }
    this.limit = limit;
  }

  int getLimit() {
    return limit;
  }

  /**
   * Waits until {@code count} records may be admitted.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  synchronized void acquire(int count) throws InterruptedException {
    if (limit == UNLIMITED) {
      return;
    }
    long now = System.currentTimeMillis();
    if (windowStartMs < 0 || now - windowStartMs >= WINDOW_MS) {
      windowStartMs = now;
      admittedInWindow = 0;
    }
    if (admittedInWindow > 0 && admittedInWindow + count > limit) {
      long waitMs = windowStartMs + WINDOW_MS - now;
      while (waitMs > 0) {
        Thread.sleep(waitMs);
        waitMs = windowStartMs + WINDOW_MS - System.currentTimeMillis();
      }
      windowStartMs = System.currentTimeMillis();
      admittedInWindow = 0;
    }
    admittedInWindow += count;
  }
}
