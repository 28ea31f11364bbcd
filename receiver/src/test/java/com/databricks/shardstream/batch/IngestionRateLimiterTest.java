package com.databricks.shardstream.batch;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(value = 10, unit = TimeUnit.SECONDS)
class IngestionRateLimiterTest {

  @Test
  void testUnlimitedNeverBlocks() throws Exception {
    IngestionRateLimiter limiter = new IngestionRateLimiter(IngestionRateLimiter.UNLIMITED);

    long start = System.currentTimeMillis();
    for (int i = 0; i < 1000; i++) {
      limiter.acquire(1000000);
    }
    assertTrue(System.currentTimeMillis() - start < 1000);
  }

  @Test
  void testAddsWithinLimitAreAdmittedImmediately() throws Exception {
    IngestionRateLimiter limiter = new IngestionRateLimiter(100);

    long start = System.currentTimeMillis();
    limiter.acquire(40);
    limiter.acquire(60);
    assertTrue(System.currentTimeMillis() - start < 500);
  }

  @Test
  void testExceedingLimitWaitsForNextWindow() throws Exception {
    IngestionRateLimiter limiter = new IngestionRateLimiter(10);

    long start = System.currentTimeMillis();
    limiter.acquire(10);
    limiter.acquire(1);
    assertTrue(System.currentTimeMillis() - start >= 900);
  }

  @Test
  void testOversizedAddIsAdmittedAlone() throws Exception {
    IngestionRateLimiter limiter = new IngestionRateLimiter(10);

    long start = System.currentTimeMillis();
    limiter.acquire(50);
    assertTrue(System.currentTimeMillis() - start < 500);
  }

  @Test
  void testInvalidLimitRejected() {
    assertThrows(IllegalArgumentException.class, () -> new IngestionRateLimiter(0));
  }
}
