package com.databricks.shardstream.replay;

import com.databricks.shardstream.RangeExhaustedException;
import com.databricks.shardstream.common.remote.RemoteCalls;
import com.databricks.shardstream.common.retry.RetryDriver;
import com.databricks.shardstream.range.SequenceNumbers;
import com.databricks.shardstream.range.SequenceRange;
import com.databricks.shardstream.record.StreamRecord;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays exactly the records of one {@link SequenceRange} from the source stream.
 *
 * <p>The iterator is lazy: nothing is fetched before the first {@link #hasNext()}. It opens a
 * cursor at the range's first sequence number, fetches pages of at most {@code
 * min(remaining, maxRecordsPerPage)} records, and reopens a cursor after the last yielded record
 * whenever a page runs out before the range's last record. Every remote call goes through a {@link
 * RetryDriver}.
 *
 * <p>The iterator owns its {@link StreamClient} and closes it when the range is done, when replay
 * fails, or on {@link #close()}.
 */
public final class SequenceRangeIterator implements CloseableIterator<StreamRecord> {
  private static final Logger logger = LoggerFactory.getLogger(SequenceRangeIterator.class);

  private final SequenceRange range;
  private final StreamClient client;
  private final ReplayConfigurationOptions options;
  private final RetryDriver retryDriver;

  private ReplayState state = ReplayState.START;
  private Iterator<StreamRecord> page;
  private StreamRecord nextRecord;
  private String lastSequenceNumber;
  private int yieldedCount = 0;
  private boolean boundaryReached = false;
  private boolean closed = false;

  /**
   * Creates an iterator over {@code range}.
   *
   * @param range The range to replay
   * @param client Client used for all remote calls, closed by this iterator
   * @param options Retry and paging settings
   */
  public SequenceRangeIterator(
      @Nonnull SequenceRange range,
      @Nonnull StreamClient client,
      @Nonnull ReplayConfigurationOptions options) {
    this(range, client, options, new RetryDriver(options.retryPolicy(), options.cancellation()));
  }

  SequenceRangeIterator(
      SequenceRange range,
      StreamClient client,
      ReplayConfigurationOptions options,
      RetryDriver retryDriver) {
    this.range = Objects.requireNonNull(range, "range");
    this.client = Objects.requireNonNull(client, "client");
    this.options = Objects.requireNonNull(options, "options");
    this.retryDriver = Objects.requireNonNull(retryDriver, "retryDriver");
  }

  @Override
  public boolean hasNext() {
    if (nextRecord != null) {
      return true;
    }
    if (state == ReplayState.DONE || state == ReplayState.FAILED || closed) {
      return false;
    }
    try {
      nextRecord = advance();
    } catch (RuntimeException e) {
      state = ReplayState.FAILED;
      close();
      throw e;
    }
    if (nextRecord == null) {
      state = ReplayState.DONE;
      logger.debug("Finished replaying {} with {} records", range, yieldedCount);
      close();
      return false;
    }
    return true;
  }

  @Override
  public StreamRecord next() {
    if (!hasNext()) {
      throw new NoSuchElementException("No more records in " + range);
    }
    StreamRecord record = nextRecord;
    nextRecord = null;
    return record;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      client.close();
    } catch (RuntimeException e) {
      logger.warn("Error while closing stream client for {}", range, e);
    }
  }

  /** Returns the current state of the replay. */
  @Nonnull
  public ReplayState getState() {
    return state;
  }

  private StreamRecord advance() {
    if (boundaryReached) {
      return null;
    }

    while (page == null || !page.hasNext()) {
      CursorPosition position =
          lastSequenceNumber == null
              ? CursorPosition.at(range.getFromSequenceNumber())
              : CursorPosition.after(lastSequenceNumber);
      String cursor = openCursor(position);
      state = ReplayState.FETCHING;
      page = fetchPage(cursor).getRecords().iterator();
    }

    StreamRecord record = page.next();
    int order = SequenceNumbers.compare(record.getSequenceNumber(), range.getToSequenceNumber());
    if (order > 0) {
      throw new RangeExhaustedException(
          "Received record "
              + record.getSequenceNumber()
              + " past the end of "
              + range
              + " without seeing its last record",
          range);
    }
    yieldedCount++;
    lastSequenceNumber = record.getSequenceNumber();
    if (order == 0) {
      boundaryReached = true;
    }
    state = ReplayState.HAS_PAGE;
    return record;
  }

  private String openCursor(CursorPosition position) {
    return retryDriver.execute(
        "opening cursor " + position + " in shard " + range.getShardId(),
        () ->
            RemoteCalls.await(
                client.openCursor(range.getStreamName(), range.getShardId(), position),
                options.callTimeoutMs(),
                options.errorClassifier()));
  }

  private RecordPage fetchPage(String cursor) {
    int remaining = range.getRecordCount() - yieldedCount;
    if (remaining <= 0) {
      throw new RangeExhaustedException(
          "Read " + yieldedCount + " records without reaching the end of " + range, range);
    }
    int limit = Math.min(remaining, options.maxRecordsPerPage());
    RecordPage result =
        retryDriver.execute(
            "getting records from shard " + range.getShardId(),
            () ->
                RemoteCalls.await(
                    client.getPage(cursor, limit),
                    options.callTimeoutMs(),
                    options.errorClassifier()));
    if (result == null || result.isEmpty()) {
      throw new RangeExhaustedException(
          "Could not read sequence number range "
              + range
              + ", no more records after "
              + (lastSequenceNumber == null ? range.getFromSequenceNumber() : lastSequenceNumber),
          range);
    }
    return result;
  }
}
