package com.databricks.shardstream.replay;

import javax.annotation.Nonnull;

/** Creates a new {@link StreamClient} for every range that has to be replayed. */
@FunctionalInterface
public interface StreamClientFactory {

  @Nonnull
  StreamClient create();
}
