package com.databricks.shardstream.batch;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A named loop that runs one step repeatedly on an executor until its cancellation token
 * completes. A step may complete the token itself to end the loop.
 */
class BackgroundTask {
  private static final Logger logger = LoggerFactory.getLogger(BackgroundTask.class);

  private final String name;
  private final Consumer<CompletableFuture<Void>> step;
  private final Consumer<Throwable> failureHandler;
  private final ExecutorService executor;

  private final AtomicBoolean isActive = new AtomicBoolean(false);
  private volatile CompletableFuture<Void> cancellationToken;

  /**
   * Creates a new background task.
   *
   * @param name Name used in log messages
   * @param step One iteration of the loop. Takes the cancellation token as parameter.
   * @param failureHandler Receives exceptions thrown by a step; the loop continues afterwards
   * @param executor The executor to run the loop on
   */
  BackgroundTask(
      String name,
      Consumer<CompletableFuture<Void>> step,
      Consumer<Throwable> failureHandler,
      ExecutorService executor) {
    this.name = name;
    this.step = step;
    this.failureHandler = failureHandler;
    this.executor = executor;
  }

  /**
   * Starts the loop.
   *
   * @throws IllegalStateException if the loop is already running
   */
  void start() {
    if (!isActive.compareAndSet(false, true)) {
      throw new IllegalStateException(name + " is already running");
    }

    CompletableFuture<Void> token = new CompletableFuture<>();
    cancellationToken = token;

    CompletableFuture.runAsync(
        () -> {
          try {
            while (!token.isDone()) {
              try {
                step.accept(token);
              } catch (Throwable e) {
                failureHandler.accept(e);
              }
            }
          } catch (Throwable e) {
            logger.error("{} failed", name, e);
          } finally {
            synchronized (this) {
              isActive.set(false);
              this.notifyAll();
            }
            logger.debug("{} stopped", name);
          }
        },
        executor);
  }

  /** Requests the loop to stop after the current step. */
  void cancel() {
    CompletableFuture<Void> token = cancellationToken;
    if (token != null) {
      token.complete(null);
    }
  }

  /** Returns whether the loop is running. */
  boolean isRunning() {
    return isActive.get();
  }

  /** Waits until the loop has stopped. */
  void waitUntilStopped() {
    synchronized (this) {
      while (isActive.get()) {
        try {
          this.wait();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          break;
        }
      }
    }
  }
}
