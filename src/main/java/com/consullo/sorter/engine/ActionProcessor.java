package com.consullo.sorter.engine;

import com.consullo.sorter.core.PhotoRecord;
import com.consullo.sorter.core.RecordStatus;
import com.consullo.sorter.core.RecordStore;
import com.consullo.sorter.session.PagedSession;
import com.consullo.sorter.session.RemovalTracker;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies classifications and undos optimistically and settles them once the store answers.
 *
 * <p>
 * Every action is split in a local step, run under the engine lock, which hides the records,
 * bumps the counters and pushes the undo entry, and a durable step, run on the writer thread
 * without the lock. A failed durable step is reverted under the lock again. Reverts never undo
 * the local effect of a later action on the same record, and never touch the counters of a
 * session that has since been replaced.
 * </p>
 *
 * <p>
 * Not thread-safe; every method except {@link #write} and {@link #writeUndo} must be called with
 * the engine lock held.
 * </p>
 */
final class ActionProcessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(ActionProcessor.class);

  private final RecordStore store;
  private final StreakTracker streak;
  private final UndoStack undoStack;

  private final Map<Long, PendingAction> inFlight = new HashMap<>();
  private long nextSequence = 1;
  private SessionCounters counters = SessionCounters.EMPTY;
  private int immediateClassifiedCount;

  ActionProcessor(RecordStore store, StreakTracker streak, UndoStack undoStack) {
    if (store == null || streak == null || undoStack == null) {
      throw new IllegalArgumentException("store/streak/undoStack must not be null.");
    }
    this.store = store;
    this.streak = streak;
    this.undoStack = undoStack;
  }

  /**
   * Local step of a single classification.
   *
   * @param session current session
   * @param recordId record id
   * @param status new status
   * @param nowMillis action time
   * @return pending action carrying the combo count
   */
  PendingAction apply(PagedSession session, String recordId, RecordStatus status, long nowMillis) {
    int combo = streak.registerAction(nowMillis);
    return register(session, List.of(recordId), status, nowMillis, combo, false);
  }

  /**
   * Local step of a batch classification. Batches do not extend the streak.
   *
   * @param session current session
   * @param recordIds distinct record ids
   * @param status new status
   * @param nowMillis action time
   * @return pending action
   */
  PendingAction applyBatch(PagedSession session, List<String> recordIds, RecordStatus status, long nowMillis) {
    return register(session, recordIds, status, nowMillis, streak.state().count(), true);
  }

  private PendingAction register(PagedSession session, List<String> recordIds, RecordStatus status,
          long nowMillis, int combo, boolean batch) {
    long sequence = nextSequence++;
    RemovalTracker tracker = session.removalTracker();
    Map<String, RecordStatus> previous = new LinkedHashMap<>();
    Map<String, Long> replaced = new HashMap<>();
    for (String id : recordIds) {
      RemovalTracker.Mark prior = tracker.track(id, sequence, status);
      if (prior == null) {
        previous.put(id, loadedStatus(session, id));
        immediateClassifiedCount++;
      } else {
        // Already classified in this session: the count moves, it is not added twice.
        previous.put(id, prior.status());
        replaced.put(id, prior.actionSequence());
        counters = counters.decrement(prior.status(), 1);
      }
      counters = counters.increment(status, 1);
    }
    UndoEntry entry = new UndoEntry(previous, status, nowMillis, sequence, replaced);
    undoStack.push(entry);

    PendingAction action = new PendingAction(session, sequence, entry, combo, batch);
    inFlight.put(sequence, action);
    releaseSettled(session);
    return action;
  }

  private static RecordStatus loadedStatus(PagedSession session, String recordId) {
    PhotoRecord loaded = session.loadedRecord(recordId);
    return loaded == null ? RecordStatus.UNCLASSIFIED : loaded.status();
  }

  /**
   * Durable step. Called on the writer thread without the lock.
   *
   * @param action pending action
   * @throws Exception if the store rejects the write
   */
  void write(PendingAction action) throws Exception {
    if (action.isBatch()) {
      store.setStatusBatch(action.recordIds(), action.newStatus());
    } else {
      store.setStatus(action.recordIds().get(0), action.newStatus());
    }
  }

  /**
   * Settle a successful write.
   *
   * @param action pending action
   */
  void complete(PendingAction action) {
    inFlight.remove(action.sequence());
    releaseSettled(action.session());
  }

  /**
   * Revert the local step of a failed write.
   *
   * @param action failed action
   * @param currentSession session installed now
   */
  void rollback(PendingAction action, PagedSession currentSession) {
    inFlight.remove(action.sequence());
    action.markFailed();
    if (action.isUndone()) {
      // The user already undid it locally; the undo write restores the store.
      return;
    }
    undoStack.remove(action.sequence());
    boolean current = action.session() == currentSession;
    if (!current) {
      LOGGER.debug("rollback: action {} belongs to a replaced session, counters untouched", action.sequence());
    }
    RemovalTracker tracker = action.session().removalTracker();
    for (String id : action.recordIds()) {
      revert(tracker, action.undoEntry(), id, current);
    }
    releaseSettled(action.session());
  }

  /**
   * Local step of an undo.
   *
   * @param session current session
   * @return pending undo, or null if nothing can be undone
   */
  PendingUndo beginUndo(PagedSession session) {
    UndoEntry entry = undoStack.pop();
    if (entry == null) {
      return null;
    }
    PendingAction action = inFlight.get(entry.actionSequence());
    if (action != null) {
      action.markUndone(true);
    }
    RemovalTracker tracker = session.removalTracker();
    Map<String, RecordStatus> restored = new LinkedHashMap<>();
    for (String id : entry.recordIds()) {
      RecordStatus status = revert(tracker, entry, id, true);
      if (status != null) {
        restored.put(id, status);
      }
    }
    releaseSettled(session);
    return new PendingUndo(session, entry, action, restored);
  }

  /**
   * Put one record of an entry back to where it was before the action: visible again if the
   * action classified it first, otherwise hidden under the classification it replaced.
   *
   * @return restored status, or null if a later action owns the record
   */
  private RecordStatus revert(RemovalTracker tracker, UndoEntry entry, String id, boolean adjustCounters) {
    if (!tracker.isOwnedBy(id, entry.actionSequence())) {
      return null;
    }
    RecordStatus previous = entry.previousStatuses().get(id);
    Long replacedSequence = entry.replacedSequences().get(id);
    if (replacedSequence == null) {
      tracker.untrack(id);
      if (adjustCounters) {
        decrement(entry.newStatus(), 1);
      }
    } else {
      tracker.restore(id, new RemovalTracker.Mark(replacedSequence, previous));
      if (adjustCounters) {
        counters = counters.decrement(entry.newStatus(), 1).increment(previous, 1);
      }
    }
    return previous;
  }

  /**
   * Durable step of an undo: restore every previous status. Called on the writer thread.
   *
   * @param undo pending undo
   * @throws Exception if the store rejects the write
   */
  void writeUndo(PendingUndo undo) throws Exception {
    Map<String, RecordStatus> restored = undo.restored();
    if (restored.isEmpty()) {
      return;
    }
    if (restored.size() == 1) {
      Map.Entry<String, RecordStatus> only = restored.entrySet().iterator().next();
      store.setStatus(only.getKey(), only.getValue());
      return;
    }
    for (Map.Entry<RecordStatus, List<String>> group : UndoEntry.groupByStatus(restored).entrySet()) {
      store.setStatusBatch(group.getValue(), group.getKey());
    }
  }

  /**
   * Re-apply the local effect of an undo whose write failed and make it undoable again.
   *
   * @param undo failed undo
   * @param currentSession session installed now
   */
  void rollbackUndo(PendingUndo undo, PagedSession currentSession) {
    if (undo.session() != currentSession) {
      LOGGER.debug("rollbackUndo: session replaced, nothing to re-apply");
      return;
    }
    UndoEntry entry = undo.entry();
    if (undo.action() != null) {
      if (undo.action().isFailed()) {
        // The classification itself never landed; nothing left to re-apply.
        return;
      }
      undo.action().markUndone(false);
    }
    RemovalTracker tracker = currentSession.removalTracker();
    for (Map.Entry<String, RecordStatus> e : undo.restored().entrySet()) {
      String id = e.getKey();
      Long replacedSequence = entry.replacedSequences().get(id);
      RemovalTracker.Mark mark = tracker.mark(id);
      boolean unchanged = replacedSequence == null
              ? mark == null
              : mark != null && mark.actionSequence() == replacedSequence;
      if (!unchanged) {
        // Classified again since the undo; that action owns the record now.
        continue;
      }
      tracker.track(id, entry.actionSequence(), entry.newStatus());
      if (replacedSequence == null) {
        immediateClassifiedCount++;
      } else {
        counters = counters.decrement(e.getValue(), 1);
      }
      counters = counters.increment(entry.newStatus(), 1);
    }
    undoStack.push(entry);
    releaseSettled(currentSession);
  }

  /**
   * Drop from memory the hidden records whose write has landed and which no undo entry refers to.
   */
  private void releaseSettled(PagedSession session) {
    if (!session.releasesSettledRecords()) {
      return;
    }
    RemovalTracker tracker = session.removalTracker();
    for (String id : tracker.trackedIds()) {
      long owner = tracker.mark(id).actionSequence();
      if (!inFlight.containsKey(owner) && !undoStack.contains(owner)) {
        session.releaseSettled(id);
      }
    }
  }

  private void decrement(RecordStatus status, int n) {
    counters = counters.decrement(status, n);
    immediateClassifiedCount = Math.max(0, immediateClassifiedCount - n);
  }

  /** Forget session-scoped state on rebuild. In-flight writes still settle against their own session. */
  void resetSession() {
    counters = SessionCounters.EMPTY;
    immediateClassifiedCount = 0;
    undoStack.clear();
  }

  SessionCounters counters() {
    return counters;
  }

  int immediateClassifiedCount() {
    return immediateClassifiedCount;
  }

  boolean canUndo() {
    return undoStack.canUndo();
  }
}
