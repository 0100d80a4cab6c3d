package com.consullo.sorter.engine;

import com.consullo.sorter.core.RecordStatus;
import com.consullo.sorter.session.PagedSession;
import java.util.List;

/**
 * A classification applied locally whose durable write has not completed yet.
 *
 * <p>Mutable flags are only touched under the engine lock.
 */
final class PendingAction {

  private final PagedSession session;
  private final long sequence;
  private final UndoEntry undoEntry;
  private final int combo;
  private final boolean batch;

  private boolean undone;
  private boolean failed;

  PendingAction(PagedSession session, long sequence, UndoEntry undoEntry, int combo, boolean batch) {
    this.session = session;
    this.sequence = sequence;
    this.undoEntry = undoEntry;
    this.combo = combo;
    this.batch = batch;
  }

  PagedSession session() {
    return session;
  }

  long sequence() {
    return sequence;
  }

  UndoEntry undoEntry() {
    return undoEntry;
  }

  List<String> recordIds() {
    return undoEntry.recordIds();
  }

  RecordStatus newStatus() {
    return undoEntry.newStatus();
  }

  int combo() {
    return combo;
  }

  boolean isBatch() {
    return batch;
  }

  boolean isUndone() {
    return undone;
  }

  void markUndone(boolean value) {
    this.undone = value;
  }

  boolean isFailed() {
    return failed;
  }

  void markFailed() {
    this.failed = true;
  }
}
