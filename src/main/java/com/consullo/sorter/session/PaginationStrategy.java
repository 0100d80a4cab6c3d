package com.consullo.sorter.session;

/**
 * Pagination strategy of a session, chosen once when the session is built.
 *
 * @since 1.0
 */
public enum PaginationStrategy {

  /** Full id list materialized in memory, pages are slices of it. */
  SNAPSHOT,

  /** Pages are limit/offset queries issued directly to the store. */
  WINDOWED
}
