package com.databricks.shardstream.replay;

import com.databricks.shardstream.batch.BatchId;
import com.databricks.shardstream.range.SequenceRange;
import com.databricks.shardstream.range.SequenceRanges;
import com.databricks.shardstream.record.StreamRecord;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads back a stored batch, preferring the local copy and falling back to replaying its ranges
 * from the source stream.
 *
 * <p>Replayed records are passed through the same record handler used at ingestion, so both paths
 * yield the same items.
 *
 * @param <T> The type of items in a batch
 */
public final class BatchReader<T> {
  private static final Logger logger = LoggerFactory.getLogger(BatchReader.class);

  private final LocalBatchSource<T> localSource;
  private final StreamClientFactory clientFactory;
  private final Function<StreamRecord, T> recordHandler;
  private final ReplayConfigurationOptions options;

  /**
   * Creates a new reader.
   *
   * @param localSource Local copies of batches
   * @param clientFactory Creates one client per replayed range
   * @param recordHandler Converts replayed records into batch items
   * @param options Replay settings
   */
  public BatchReader(
      @Nonnull LocalBatchSource<T> localSource,
      @Nonnull StreamClientFactory clientFactory,
      @Nonnull Function<StreamRecord, T> recordHandler,
      @Nonnull ReplayConfigurationOptions options) {
    this.localSource = Objects.requireNonNull(localSource, "localSource");
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    this.recordHandler = Objects.requireNonNull(recordHandler, "recordHandler");
    this.options = Objects.requireNonNull(options, "options");
  }

  /**
   * Reads a batch.
   *
   * @param batchId The batch
   * @param ranges The batch's ranges, as saved when it was stored
   * @param localValid Whether the local copy of the batch may be used
   * @return the batch's items; close it to release any open stream client
   */
  @Nonnull
  public CloseableIterator<T> read(
      @Nonnull BatchId batchId, @Nonnull SequenceRanges ranges, boolean localValid) {
    if (localValid) {
      Optional<List<T>> local = localSource.get(batchId);
      if (local.isPresent()) {
        logger.debug("Reading {} from its local copy", batchId);
        return new LocalIterator<>(local.get().iterator());
      }
      logger.warn("Could not find {} locally, replaying {} from the stream", batchId, ranges);
    } else {
      logger.info("Local copy of {} is not valid, replaying {} from the stream", batchId, ranges);
    }
    return new ReplayingIterator(ranges.getRanges().iterator());
  }

  private static final class LocalIterator<T> implements CloseableIterator<T> {
    private final Iterator<T> delegate;

    LocalIterator(Iterator<T> delegate) {
      this.delegate = delegate;
    }

    @Override
    public boolean hasNext() {
      return delegate.hasNext();
    }

    @Override
    public T next() {
      return delegate.next();
    }

    @Override
    public void close() {}
  }

  /** Concatenates one {@link SequenceRangeIterator} per range, opening each only when needed. */
  private final class ReplayingIterator implements CloseableIterator<T> {
    private final Iterator<SequenceRange> remainingRanges;
    private SequenceRangeIterator current;
    private boolean closed = false;

    ReplayingIterator(Iterator<SequenceRange> remainingRanges) {
      this.remainingRanges = remainingRanges;
    }

    @Override
    public boolean hasNext() {
      if (closed) {
        return false;
      }
      while (current == null || !current.hasNext()) {
        if (current != null) {
          current.close();
          current = null;
        }
        if (!remainingRanges.hasNext()) {
          return false;
        }
        current =
            new SequenceRangeIterator(remainingRanges.next(), clientFactory.create(), options);
      }
      return true;
    }

    @Override
    public T next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return recordHandler.apply(current.next());
    }

    @Override
    public void close() {
      closed = true;
      if (current != null) {
        current.close();
        current = null;
      }
    }
  }
}
