package com.databricks.shardstream.replay;

import java.util.Objects;
import javax.annotation.Nonnull;

/** Where a new cursor into a shard starts, relative to a sequence number. */
public final class CursorPosition {

  /** How the cursor relates to its sequence number. */
  public enum Type {
    /** The first record returned is the one with the sequence number. */
    AT_SEQUENCE_NUMBER,
    /** The first record returned is the one following the sequence number. */
    AFTER_SEQUENCE_NUMBER
  }

  private final Type type;
  private final String sequenceNumber;

  private CursorPosition(Type type, String sequenceNumber) {
    this.type = type;
    this.sequenceNumber = Objects.requireNonNull(sequenceNumber, "sequenceNumber");
  }

  /** Returns a position at {@code sequenceNumber}, inclusive. */
  @Nonnull
  public static CursorPosition at(@Nonnull String sequenceNumber) {
    return new CursorPosition(Type.AT_SEQUENCE_NUMBER, sequenceNumber);
  }

  /** Returns a position right after {@code sequenceNumber}. */
  @Nonnull
  public static CursorPosition after(@Nonnull String sequenceNumber) {
    return new CursorPosition(Type.AFTER_SEQUENCE_NUMBER, sequenceNumber);
  }

  @Nonnull
  public Type getType() {
    return type;
  }

  @Nonnull
  public String getSequenceNumber() {
    return sequenceNumber;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CursorPosition)) {
      return false;
    }
    CursorPosition that = (CursorPosition) o;
    return type == that.type && sequenceNumber.equals(that.sequenceNumber);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, sequenceNumber);
  }

  @Override
  public String toString() {
    return type + "(" + sequenceNumber + ")";
  }
}
