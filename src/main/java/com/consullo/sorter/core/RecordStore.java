package com.consullo.sorter.core;

import java.util.List;

/**
 * Backing store of classifiable records.
 *
 * <p>Every query method works on the set of {@link RecordStatus#UNCLASSIFIED} records that match
 * the given {@link Criteria}. The store's native order is newest first. Calls may block; the engine
 * only invokes them from background executors.
 *
 * @since 1.0
 */
public interface RecordStore {

  /**
   * Counts unclassified records matching the criteria.
   *
   * @param criteria resolved criteria
   * @return number of matching records
   * @throws Exception if the query fails
   */
  int count(final Criteria criteria) throws Exception;

  /**
   * Returns the ids of all unclassified records matching the criteria, newest first.
   *
   * @param criteria resolved criteria
   * @return ordered id list
   * @throws Exception if the query fails
   */
  List<String> ids(final Criteria criteria) throws Exception;

  /**
   * Returns one window of unclassified records matching the criteria in the requested order.
   *
   * <p>{@link SortOrder.Kind#RANDOM} windows must be stable for a fixed seed so that consecutive
   * windows of the same query do not overlap.
   *
   * @param criteria resolved criteria
   * @param sortOrder order of the underlying sequence
   * @param limit maximum number of records
   * @param offset number of records to skip
   * @return records of the window, in order
   * @throws Exception if the query fails
   */
  List<PhotoRecord> page(final Criteria criteria, final SortOrder sortOrder, final int limit, final int offset)
      throws Exception;

  /**
   * Loads records by id regardless of their status. Unknown ids are skipped; the result order is
   * unspecified.
   *
   * @param ids record ids
   * @return records found
   * @throws Exception if the query fails
   */
  List<PhotoRecord> byIds(final List<String> ids) throws Exception;

  /**
   * Persists the status of one record.
   *
   * @param id record id
   * @param status new status
   * @throws Exception if the write fails
   */
  void setStatus(final String id, final RecordStatus status) throws Exception;

  /**
   * Persists the same status for several records. Implementations must apply all updates or none.
   *
   * @param ids record ids
   * @param status new status
   * @throws Exception if the write fails; no record has been updated in that case
   */
  void setStatusBatch(final List<String> ids, final RecordStatus status) throws Exception;
}
