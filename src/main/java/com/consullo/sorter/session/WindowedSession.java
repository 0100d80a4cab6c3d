package com.consullo.sorter.session;

import com.consullo.sorter.core.Criteria;
import com.consullo.sorter.core.PhotoRecord;
import com.consullo.sorter.core.RecordStore;
import com.consullo.sorter.core.SortOrder;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Session that pages with limit/offset queries straight against the store.
 *
 * <p>
 * Classified records drop out of the store's unclassified set, which shifts every later row
 * towards the start. The offset of page {@code n} is therefore
 * {@code n * pageSize - removedSinceSessionStart}, clamped at zero. Rows that still come back
 * twice are dropped when the page is appended.
 * </p>
 *
 * <p>
 * Records whose classification is confirmed and out of undo reach are released from memory, so a
 * long session holds roughly the prefetched pages plus the undoable actions.
 * </p>
 */
public final class WindowedSession extends PagedSession {

  private static final Logger LOGGER = LoggerFactory.getLogger(WindowedSession.class);

  public WindowedSession(long generation, Criteria criteria, SortOrder sortOrder, int pageSize) {
    super(generation, criteria, sortOrder, pageSize);
  }

  @Override
  public PaginationStrategy strategy() {
    return PaginationStrategy.WINDOWED;
  }

  /**
   * Compensated store offset for a page index.
   *
   * @param pageIndex page index
   * @return offset before clamping, may be negative
   */
  public long rawOffset(int pageIndex) {
    return (long) pageIndex * pageSize() - removedCount();
  }

  @Override
  public boolean releasesSettledRecords() {
    return true;
  }

  @Override
  protected PageRequest createRequest(int pageIndex) {
    long raw = rawOffset(pageIndex);
    boolean clamped = raw < 0;
    if (clamped) {
      LOGGER.warn("createRequest: offset drift, page={} removed={} raw offset={} clamped to 0",
              pageIndex, removedCount(), raw);
    }
    int offset = clamped ? 0 : (int) Math.min(raw, Integer.MAX_VALUE);
    return new PageRequest(pageIndex, pageSize(), offset, List.of(), clamped);
  }

  @Override
  public List<PhotoRecord> fetch(RecordStore store, PageRequest request) throws Exception {
    if (criteria().isUnsatisfiable()) {
      return List.of();
    }
    LOGGER.debug("fetch: page={} limit={} offset={}", request.pageIndex(), request.limit(), request.offset());
    return store.page(criteria(), sortOrder(), request.limit(), request.offset());
  }

  @Override
  protected boolean hasMoreAfter(PageRequest request, int fetchedCount) {
    return fetchedCount >= request.limit();
  }
}
