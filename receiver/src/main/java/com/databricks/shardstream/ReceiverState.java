package com.databricks.shardstream;

/** Lifecycle states of a {@link ShardStreamReceiver}. */
public enum ReceiverState {
  CREATED,
  STARTED,
  STOPPED,
  /** Hit an error that makes further progress unsafe. Terminal. */
  FAILED
}
