package com.databricks.shardstream.range;

import java.util.Comparator;
import javax.annotation.Nonnull;

/**
 * Ordering of source-assigned sequence numbers.
 *
 * <p>Sequence numbers are opaque strings. Streams that use decimal sequence numbers (which may
 * exceed the range of {@code long}) are ordered numerically; anything else falls back to string
 * order.
 */
public final class SequenceNumbers {

  /** Orders sequence numbers from oldest to newest. */
  public static final Comparator<String> ORDER = SequenceNumbers::compare;

  private SequenceNumbers() {}

  /**
   * Compares two sequence numbers of the same shard.
   *
   * @return a negative number, zero, or a positive number as {@code a} is older than, equal to, or
   *     newer than {@code b}
   */
  public static int compare(@Nonnull String a, @Nonnull String b) {
    if (isDecimal(a) && isDecimal(b)) {
      String x = stripLeadingZeros(a);
      String y = stripLeadingZeros(b);
      if (x.length() != y.length()) {
        return x.length() < y.length() ? -1 : 1;
      }
      return x.compareTo(y);
    }
    return a.compareTo(b);
  }

  /** Returns true if {@code candidate} is strictly newer than {@code reference}. */
  public static boolean isNewer(@Nonnull String candidate, @Nonnull String reference) {
    return compare(candidate, reference) > 0;
  }

  private static boolean isDecimal(String s) {
    if (s.isEmpty()) {
      return false;
    }
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c < '0' || c > '9') {
        return false;
      }
    }
    return true;
  }

  private static String stripLeadingZeros(String s) {
    int i = 0;
    while (i < s.length() - 1 && s.charAt(i) == '0') {
      i++;
    }
    return s.substring(i);
  }
}
