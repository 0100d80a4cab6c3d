package com.consullo.sorter.session;

import com.consullo.sorter.core.RecordStatus;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ids the user has classified locally during a session, hidden from the visible projection
 * whether or not the store has confirmed the write yet.
 *
 * <p>
 * Each id remembers the status it was given locally and the sequence number of the action that
 * gave it, so that a late completion of an older action cannot make visible again an id that a
 * newer action hid, and so that classifying an id twice knows what it is replacing.
 * </p>
 *
 * <p>
 * Not thread-safe; owned by the engine and only touched under its state lock.
 * </p>
 */
public final class RemovalTracker {

  /**
   * Local classification of one id.
   *
   * @param actionSequence sequence number of the action that set it
   * @param status status set locally
   */
  public record Mark(long actionSequence, RecordStatus status) {

    public Mark {
      if (status == null) {
        throw new IllegalArgumentException("status must not be null.");
      }
    }
  }

  private final Map<String, Mark> removed = new LinkedHashMap<>();

  /**
   * Hide an id on behalf of an action, replacing any earlier local classification.
   *
   * @param id record id
   * @param actionSequence sequence number of the hiding action
   * @param status status set by the action
   * @return the mark replaced, or null if the id was not hidden before
   */
  public Mark track(String id, long actionSequence, RecordStatus status) {
    return removed.put(id, new Mark(actionSequence, status));
  }

  /**
   * Put back a mark that a reverted action had replaced.
   *
   * @param id record id
   * @param mark earlier mark
   */
  public void restore(String id, Mark mark) {
    if (mark == null) {
      throw new IllegalArgumentException("mark must not be null.");
    }
    removed.put(id, mark);
  }

  public boolean isTracked(String id) {
    return removed.containsKey(id);
  }

  /**
   * Local classification of an id.
   *
   * @param id record id
   * @return mark, or null if the id is visible
   */
  public Mark mark(String id) {
    return removed.get(id);
  }

  /**
   * Whether an id is currently hidden by the given action.
   *
   * @param id record id
   * @param actionSequence sequence number
   * @return true if the action owns the id
   */
  public boolean isOwnedBy(String id, long actionSequence) {
    Mark mark = removed.get(id);
    return mark != null && mark.actionSequence() == actionSequence;
  }

  /**
   * Make an id visible again, regardless of which action hid it.
   *
   * @param id record id
   * @return true if the id was hidden
   */
  public boolean untrack(String id) {
    return removed.remove(id) != null;
  }

  /**
   * Make an id visible again only if it is still hidden by the given action.
   *
   * @param id record id
   * @param actionSequence sequence number of the action being rolled back
   * @return true if the id was released
   */
  public boolean untrackIfOwnedBy(String id, long actionSequence) {
    if (!isOwnedBy(id, actionSequence)) {
      return false;
    }
    removed.remove(id);
    return true;
  }

  public int size() {
    return removed.size();
  }

  public List<String> trackedIds() {
    return new ArrayList<>(removed.keySet());
  }
}
