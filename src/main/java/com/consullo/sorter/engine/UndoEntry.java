package com.consullo.sorter.engine;

import com.consullo.sorter.core.RecordStatus;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One undoable classification, covering a single record or a whole batch.
 *
 * @param previousStatuses status of each record before the action, in action order
 * @param newStatus status the action applied
 * @param timestampMillis time of the action
 * @param actionSequence sequence number of the action
 * @param replacedSequences for records already classified earlier in the session, the sequence
 *     number of the action whose classification this one replaced
 * @since 1.0
 */
public record UndoEntry(
    Map<String, RecordStatus> previousStatuses,
    RecordStatus newStatus,
    long timestampMillis,
    long actionSequence,
    Map<String, Long> replacedSequences) {

  public UndoEntry {
    if (previousStatuses == null || previousStatuses.isEmpty()) {
      throw new IllegalArgumentException("previousStatuses must not be empty.");
    }
    if (newStatus == null) {
      throw new IllegalArgumentException("newStatus must not be null.");
    }
    previousStatuses = Collections.unmodifiableMap(new LinkedHashMap<>(previousStatuses));
    replacedSequences = replacedSequences == null ? Map.of() : Map.copyOf(replacedSequences);
  }

  public UndoEntry(Map<String, RecordStatus> previousStatuses, RecordStatus newStatus, long timestampMillis,
          long actionSequence) {
    this(previousStatuses, newStatus, timestampMillis, actionSequence, Map.of());
  }

  public List<String> recordIds() {
    return List.copyOf(previousStatuses.keySet());
  }

  public int size() {
    return previousStatuses.size();
  }

  /**
   * Ids grouped by the status they must be restored to, in action order.
   *
   * @return restore groups
   */
  public Map<RecordStatus, List<String>> restoreGroups() {
    return groupByStatus(previousStatuses);
  }

  /**
   * Ids grouped by status, in iteration order.
   *
   * @param statuses status per id
   * @return groups
   */
  static Map<RecordStatus, List<String>> groupByStatus(Map<String, RecordStatus> statuses) {
    Map<RecordStatus, List<String>> groups = new LinkedHashMap<>();
    for (Map.Entry<String, RecordStatus> e : statuses.entrySet()) {
      groups.computeIfAbsent(e.getValue(), k -> new ArrayList<>()).add(e.getKey());
    }
    return groups;
  }
}
