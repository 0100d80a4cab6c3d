package com.consullo.sorter.engine;

import com.consullo.sorter.core.PhotoRecord;
import com.consullo.sorter.core.SortOrder;
import com.consullo.sorter.session.PaginationStrategy;
import java.util.List;

/**
 * Immutable UI-facing aggregate published by the engine after every change.
 *
 * @param visibleRecords loaded records not hidden by local classification, in session order
 * @param stableTotal total shown for the session, constant once latched
 * @param counters per-status counts for this session
 * @param immediateClassifiedCount optimistic count of records classified in this session
 * @param combo streak snapshot
 * @param canUndo whether an undoable action exists
 * @param loading true until the first session has been built
 * @param reloading true while a session rebuild is in flight
 * @param loadingMore true while a page fetch is in flight
 * @param hasMorePages whether further pages may exist
 * @param strategy pagination strategy of the current session, null before the first build
 * @param sortOrder sort order of the current session
 * @param generation generation of the current session
 * @param lastError last user-facing error, null if none
 * @since 1.0
 */
public record SorterEngineState(
    List<PhotoRecord> visibleRecords,
    int stableTotal,
    SessionCounters counters,
    int immediateClassifiedCount,
    ComboState combo,
    boolean canUndo,
    boolean loading,
    boolean reloading,
    boolean loadingMore,
    boolean hasMorePages,
    PaginationStrategy strategy,
    SortOrder sortOrder,
    long generation,
    String lastError) {

  public SorterEngineState {
    visibleRecords = visibleRecords == null ? List.of() : List.copyOf(visibleRecords);
  }

  /**
   * Fraction of the session total classified so far.
   *
   * @return progress in [0, 1]
   */
  public float progress() {
    if (stableTotal <= 0) {
      return 0f;
    }
    return Math.min(1f, (float) immediateClassifiedCount / stableTotal);
  }

  public int remaining() {
    return Math.max(0, stableTotal - immediateClassifiedCount);
  }
}
