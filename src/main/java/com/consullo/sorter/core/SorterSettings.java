package com.consullo.sorter.core;

import java.util.List;
import java.util.Optional;

/**
 * User settings the engine reads when it resolves a session.
 *
 * <p>Injected at construction so the engine never reads ambient global state.
 *
 * @since 1.0
 */
public interface SorterSettings {

  /**
   * Returns the global filter mode.
   *
   * @return filter mode
   */
  FilterMode filterMode();

  /**
   * Returns the bucket ids of the device camera albums, used by the camera filter modes.
   *
   * @return camera bucket ids, possibly empty
   */
  List<String> cameraBucketIds();

  /**
   * Returns the preferred sort order for new sessions.
   *
   * @return sort order
   */
  SortOrder sortOrder();

  /**
   * Stores the preferred sort order.
   *
   * @param sortOrder sort order
   */
  void setSortOrder(final SortOrder sortOrder);

  /**
   * Returns the session-scoped filter, if any.
   *
   * @return session filter
   */
  Optional<SessionFilter> sessionFilter();

  /**
   * Replaces the session-scoped filter.
   *
   * @param filter new filter
   */
  void setSessionFilter(final SessionFilter filter);

  /** Removes the session-scoped filter. */
  void clearSessionFilter();
}
