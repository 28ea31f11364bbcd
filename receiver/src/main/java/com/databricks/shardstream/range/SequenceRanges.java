package com.databricks.shardstream.range;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import javax.annotation.Nonnull;

/**
 * The ordered ranges that went into one batch.
 *
 * <p>A batch may aggregate ranges from several shards and several ranges from the same shard. The
 * order is the order in which the ranges were added to the batch.
 */
public final class SequenceRanges implements Iterable<SequenceRange> {

  private static final SequenceRanges EMPTY = new SequenceRanges(Collections.emptyList());

  private final List<SequenceRange> ranges;

  /**
   * Creates a range set holding a copy of {@code ranges}.
   *
   * @param ranges The ranges, in batch order
   */
  public SequenceRanges(@Nonnull List<SequenceRange> ranges) {
    this.ranges = Collections.unmodifiableList(new ArrayList<>(ranges));
  }

  /** Returns a range set with a single range. */
  public static SequenceRanges of(@Nonnull SequenceRange range) {
    return new SequenceRanges(Collections.singletonList(range));
  }

  /** Returns the empty range set. */
  public static SequenceRanges empty() {
    return EMPTY;
  }

  /** Returns the ranges in batch order. The list is unmodifiable. */
  @Nonnull
  public List<SequenceRange> getRanges() {
    return ranges;
  }

  public boolean isEmpty() {
    return ranges.isEmpty();
  }

  public int size() {
    return ranges.size();
  }

  /** Returns the total number of records over all ranges. */
  public long totalRecordCount() {
    long total = 0;
    for (SequenceRange range : ranges) {
      total += range.getRecordCount();
    }
    return total;
  }

  @Override
  @Nonnull
  public Iterator<SequenceRange> iterator() {
    return ranges.iterator();
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof SequenceRanges && ranges.equals(((SequenceRanges) o).ranges));
  }

  @Override
  public int hashCode() {
    return ranges.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("SequenceRanges(");
    for (int i = 0; i < ranges.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(ranges.get(i));
    }
    return sb.append(")").toString();
  }
}
