package com.databricks.shardstream.replay;

import com.databricks.shardstream.record.StreamRecord;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/** Stream client that serves scripted cursors and pages and records every call. */
class MockStreamClient implements StreamClient {

  private final LinkedList<Object> cursorResponses = new LinkedList<>();
  private final LinkedList<Object> pageResponses = new LinkedList<>();

  final List<CursorPosition> openedPositions = new ArrayList<>();
  final List<String> pageCursors = new ArrayList<>();
  final List<Integer> pageLimits = new ArrayList<>();
  int closeCount = 0;
  private int cursorCounter = 0;

  /** Queues a page of records. */
  MockStreamClient page(List<StreamRecord> records) {
    pageResponses.add(new RecordPage(records));
    return this;
  }

  /** Queues a failed page fetch. */
  MockStreamClient pageError(Throwable error) {
    pageResponses.add(error);
    return this;
  }

  /** Queues a failed cursor open. Cursor opens succeed by default. */
  MockStreamClient cursorError(Throwable error) {
    cursorResponses.add(error);
    return this;
  }

  int pageCallCount() {
    return pageLimits.size();
  }

  @Override
  public CompletableFuture<String> openCursor(
      String streamName, String shardId, CursorPosition position) {
    openedPositions.add(position);
    Object response = cursorResponses.poll();
    if (response instanceof Throwable) {
      return failed((Throwable) response);
    }
    return CompletableFuture.completedFuture("cursor-" + cursorCounter++);
  }

  @Override
  public CompletableFuture<RecordPage> getPage(String cursor, int maxCount) {
    pageCursors.add(cursor);
    pageLimits.add(maxCount);
    Object response = pageResponses.poll();
    if (response == null) {
      return CompletableFuture.completedFuture(new RecordPage(new ArrayList<>()));
    }
    if (response instanceof Throwable) {
      return failed((Throwable) response);
    }
    return CompletableFuture.completedFuture((RecordPage) response);
  }

  @Override
  public void close() {
    closeCount++;
  }

  private static <T> CompletableFuture<T> failed(Throwable error) {
    CompletableFuture<T> future = new CompletableFuture<>();
    future.completeExceptionally(error);
    return future;
  }
}
