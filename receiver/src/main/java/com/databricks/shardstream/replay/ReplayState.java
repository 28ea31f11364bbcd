package com.databricks.shardstream.replay;

/** States of a {@link SequenceRangeIterator}. */
public enum ReplayState {
  /** No cursor opened yet. */
  START,
  /** A cursor is open and the next page must be fetched. */
  FETCHING,
  /** Records of a fetched page are being yielded. */
  HAS_PAGE,
  /** The last record of the range has been yielded. */
  DONE,
  /** Replay aborted with an error. */
  FAILED
}
