package com.databricks.shardstream.replay;

import java.util.Iterator;

/**
 * An iterator holding resources that must be released when iteration stops early.
 *
 * @param <T> The type of elements
 */
public interface CloseableIterator<T> extends Iterator<T>, AutoCloseable {

  /** Releases the iterator's resources. Calling it more than once has no effect. */
  @Override
  void close();
}
