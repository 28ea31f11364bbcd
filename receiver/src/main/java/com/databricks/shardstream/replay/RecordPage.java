package com.databricks.shardstream.replay;

import com.databricks.shardstream.record.StreamRecord;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nonnull;

/**
 * One page of records fetched through a cursor. Replay opens a new cursor after the last record it
 * yielded instead of continuing a page's cursor.
 */
public final class RecordPage {
  private final List<StreamRecord> records;

  public RecordPage(@Nonnull List<StreamRecord> records) {
    this.records = Collections.unmodifiableList(new ArrayList<>(records));
  }

  @Nonnull
  public List<StreamRecord> getRecords() {
    return records;
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }
}
