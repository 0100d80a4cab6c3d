package com.consullo.sorter.engine;

import com.consullo.sorter.core.RecordStatus;

/**
 * Per-status classification counts for the current session only.
 *
 * <p>Reset whenever the session reloads. Counts never go below zero.
 *
 * @param keep records kept
 * @param trash records trashed
 * @param maybe records marked maybe
 * @since 1.0
 */
public record SessionCounters(int keep, int trash, int maybe) {

  public static final SessionCounters EMPTY = new SessionCounters(0, 0, 0);

  public int total() {
    return keep + trash + maybe;
  }

  public SessionCounters increment(RecordStatus status, int n) {
    return adjust(status, n);
  }

  public SessionCounters decrement(RecordStatus status, int n) {
    return adjust(status, -n);
  }

  private SessionCounters adjust(RecordStatus status, int delta) {
    switch (status) {
      case KEEP:
        return new SessionCounters(Math.max(0, keep + delta), trash, maybe);
      case TRASH:
        return new SessionCounters(keep, Math.max(0, trash + delta), maybe);
      case MAYBE:
        return new SessionCounters(keep, trash, Math.max(0, maybe + delta));
      default:
        return this;
    }
  }
}
