package com.consullo.sorter.session;

import com.consullo.sorter.core.Criteria;
import com.consullo.sorter.core.RecordStore;
import com.consullo.sorter.core.SortOrder;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the pagination strategy for a new session and builds it.
 *
 * <p>The decision is made once per session from a single count query. Collections larger than the
 * threshold are paged with {@link WindowedSession} to bound memory; the rest are materialized as a
 * {@link SnapshotSession}. A session never switches strategy.
 *
 * @since 1.0
 */
public final class StrategySelector {

  private static final Logger LOGGER = LoggerFactory.getLogger(StrategySelector.class);

  private final int windowedThreshold;

  /**
   * Creates a selector.
   *
   * @param windowedThreshold counts strictly above this value select the windowed strategy
   */
  public StrategySelector(final int windowedThreshold) {
    Validate.isTrue(windowedThreshold >= 0, "windowedThreshold must not be negative");
    this.windowedThreshold = windowedThreshold;
  }

  /**
   * Strategy for a given count.
   *
   * @param count number of matching records
   * @return chosen strategy
   */
  public PaginationStrategy choose(final int count) {
    return count > windowedThreshold ? PaginationStrategy.WINDOWED : PaginationStrategy.SNAPSHOT;
  }

  /**
   * Count matching records, choose a strategy and build the session.
   *
   * @param store record store
   * @param criteria resolved criteria
   * @param sortOrder session order
   * @param pageSize page size
   * @param generation generation of the new session
   * @return opened session together with the count it was chosen from
   * @throws Exception if the count or the snapshot id query fails
   */
  public Selection open(final RecordStore store, final Criteria criteria, final SortOrder sortOrder,
      final int pageSize, final long generation) throws Exception {
    Validate.notNull(store, "store must not be null");
    Validate.notNull(criteria, "criteria must not be null");
    Validate.notNull(sortOrder, "sortOrder must not be null");

    final int count = criteria.isUnsatisfiable() ? 0 : store.count(criteria);
    final PaginationStrategy strategy = choose(count);
    LOGGER.info("Opening {} session generation={} count={} criteria={}", strategy, generation, count, criteria);

    final PagedSession session;
    if (strategy == PaginationStrategy.WINDOWED) {
      session = new WindowedSession(generation, criteria, sortOrder, pageSize);
    } else {
      session = SnapshotSession.build(store, criteria, sortOrder, pageSize, generation);
    }
    return new Selection(session, count);
  }

  /**
   * Result of {@link #open}.
   *
   * @param session new session
   * @param count unclassified count observed when the session was opened
   */
  public record Selection(PagedSession session, int count) {
  }
}
