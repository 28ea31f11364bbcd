package com.databricks.shardstream.processor;

import com.databricks.shardstream.ShardStreamReceiver;
import com.databricks.shardstream.checkpoint.Checkpointer;
import com.databricks.shardstream.record.StreamRecord;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridges one leased shard to a {@link ShardStreamReceiver}.
 *
 * <p>The host's lease worker creates one processor per shard assignment and calls it on assignment
 * start, for every fetched record list, and when the assignment ends.
 */
public class ShardRecordProcessor {
  private static final Logger logger = LoggerFactory.getLogger(ShardRecordProcessor.class);

  private final ShardStreamReceiver<?> receiver;
  private final int maxAddAttempts;
  private final long addRetryWaitMs;

  private volatile String shardId;

  public ShardRecordProcessor(@Nonnull ShardStreamReceiver<?> receiver) {
    this(receiver, receiver.getOptions().addMaxAttempts(), receiver.getOptions().addRetryWaitMs());
  }

  ShardRecordProcessor(ShardStreamReceiver<?> receiver, int maxAddAttempts, long addRetryWaitMs) {
    this.receiver = Objects.requireNonNull(receiver, "receiver");
    this.maxAddAttempts = maxAddAttempts;
    this.addRetryWaitMs = addRetryWaitMs;
  }

  /** Called once when the lease on {@code shardId} has been acquired. */
  public void initialize(@Nonnull String shardId) {
    this.shardId = Objects.requireNonNull(shardId, "shardId");
    logger.info(
        "Initialized processor of receiver {} for shard {}", receiver.getReceiverId(), shardId);
  }

  /**
   * Hands a fetched record list to the receiver and registers {@code checkpointer}.
   *
   * <p>A failing add is retried while the receiver is started, up to the configured number of
   * attempts. Records fetched after the receiver stopped are dropped; they will be fetched again
   * from the last checkpoint.
   *
   * @param records Records in shard order
   * @param checkpointer The shard's checkpoint handle
   */
  public void processRecords(
      @Nonnull List<StreamRecord> records, @Nonnull Checkpointer checkpointer) {
    String shard = requireInitialized();
    if (!receiver.isStarted()) {
      logger.debug(
          "Receiver {} is not started, dropping {} records of shard {}",
          receiver.getReceiverId(),
          records.size(),
          shard);
      return;
    }
    addWithRetries(shard, records);
    receiver.setCheckpointer(shard, checkpointer);
  }

  /** Called when the shard has been read to its end; checkpoints what was stored and stops. */
  public void shardEnded(@Nonnull Checkpointer checkpointer) {
    String shard = requireInitialized();
    logger.info("Shard {} ended", shard);
    receiver.removeCheckpointer(shard, checkpointer);
  }

  /** Called when the lease was taken by another worker; nothing can be checkpointed anymore. */
  public void leaseLost() {
    String shard = requireInitialized();
    logger.info("Lost lease on shard {}", shard);
    receiver.removeCheckpointer(shard, null);
  }

  /** Called when the host shuts down; checkpoints what was stored and stops. */
  public void shutdownRequested(@Nonnull Checkpointer checkpointer) {
    String shard = requireInitialized();
    logger.info("Shutdown requested for shard {}", shard);
    receiver.removeCheckpointer(shard, checkpointer);
  }

  private void addWithRetries(String shard, List<StreamRecord> records) {
    int attempt = 0;
    while (true) {
      attempt++;
      try {
        receiver.addRecords(shard, records);
        return;
      } catch (RuntimeException e) {
        if (attempt >= maxAddAttempts || !receiver.isStarted()) {
          logger.error(
              "Failed to add {} records of shard {} after {} attempts",
              records.size(),
              shard,
              attempt,
              e);
          throw e;
        }
        logger.warn("Error while adding records of shard {} [attempt = {}]", shard, attempt, e);
      }
      try {
        Thread.sleep(addRetryWaitMs);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException(
            "Interrupted while retrying to add records of shard " + shard, e);
      }
    }
  }

  private String requireInitialized() {
    String shard = shardId;
    if (shard == null) {
      throw new IllegalStateException("Shard record processor has not been initialized");
    }
    return shard;
  }
}
