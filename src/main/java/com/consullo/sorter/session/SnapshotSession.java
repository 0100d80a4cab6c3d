package com.consullo.sorter.session;

import com.consullo.sorter.core.Criteria;
import com.consullo.sorter.core.PhotoRecord;
import com.consullo.sorter.core.RecordStatus;
import com.consullo.sorter.core.RecordStore;
import com.consullo.sorter.core.SortOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Session that materializes every matching id once and pages by slicing that list.
 *
 * <p>
 * The id list has a fixed length for the lifetime of the session. Classification hides ids through
 * the removal tracker but never removes them from the list, so page boundaries stay stable. For a
 * given criteria, sort order and seed the id sequence is always the same.
 * </p>
 */
public final class SnapshotSession extends PagedSession {

  private static final Logger LOGGER = LoggerFactory.getLogger(SnapshotSession.class);

  private final List<String> orderedIds;

  SnapshotSession(long generation, Criteria criteria, SortOrder sortOrder, int pageSize, List<String> orderedIds) {
    super(generation, criteria, sortOrder, pageSize);
    this.orderedIds = Collections.unmodifiableList(new ArrayList<>(orderedIds));
  }

  /**
   * Build a snapshot session by fetching every matching id.
   *
   * @param store record store
   * @param criteria resolved criteria
   * @param sortOrder session order
   * @param pageSize page size
   * @param generation session generation
   * @return new session
   * @throws Exception if the id query fails
   */
  public static SnapshotSession build(RecordStore store, Criteria criteria, SortOrder sortOrder, int pageSize,
          long generation) throws Exception {
    if (store == null) {
      throw new IllegalArgumentException("store must not be null.");
    }
    List<String> storeOrder = criteria.isUnsatisfiable() ? List.of() : store.ids(criteria);
    List<String> ordered = order(storeOrder, sortOrder);
    LOGGER.debug("build: generation={} ids={} order={}", generation, ordered.size(), sortOrder.kind());
    return new SnapshotSession(generation, criteria, sortOrder, pageSize, ordered);
  }

  /**
   * Apply a sort order to ids given newest first.
   *
   * @param newestFirst ids in store order
   * @param sortOrder order to apply
   * @return new ordered list
   */
  static List<String> order(List<String> newestFirst, SortOrder sortOrder) {
    List<String> ids = new ArrayList<>(newestFirst);
    switch (sortOrder.kind()) {
      case DATE_ASCENDING:
        Collections.reverse(ids);
        break;
      case RANDOM:
        Collections.shuffle(ids, new Random(sortOrder.seed()));
        break;
      default:
        break;
    }
    return ids;
  }

  @Override
  public PaginationStrategy strategy() {
    return PaginationStrategy.SNAPSHOT;
  }

  public List<String> orderedIds() {
    return orderedIds;
  }

  @Override
  protected PageRequest createRequest(int pageIndex) {
    int from = Math.min(pageIndex * pageSize(), orderedIds.size());
    int to = Math.min(from + pageSize(), orderedIds.size());
    return new PageRequest(pageIndex, pageSize(), 0, orderedIds.subList(from, to), false);
  }

  @Override
  public List<PhotoRecord> fetch(RecordStore store, PageRequest request) throws Exception {
    if (request.ids().isEmpty()) {
      return List.of();
    }
    Map<String, PhotoRecord> byId = new HashMap<>();
    for (PhotoRecord r : store.byIds(request.ids())) {
      byId.put(r.id(), r);
    }

    // Rebuild in slice order; ids deleted or classified elsewhere since the build are dropped.
    List<PhotoRecord> out = new ArrayList<>(request.ids().size());
    for (String id : request.ids()) {
      PhotoRecord r = byId.get(id);
      if (r != null && r.status() == RecordStatus.UNCLASSIFIED) {
        out.add(r);
      }
    }
    return out;
  }

  @Override
  protected boolean hasMoreAfter(PageRequest request, int fetchedCount) {
    return (long) (request.pageIndex() + 1) * pageSize() < orderedIds.size();
  }

  @Override
  public List<String> remainingIdsFrom(String recordId) {
    int start = orderedIds.indexOf(recordId);
    if (start < 0) {
      return List.of();
    }
    List<String> out = new ArrayList<>();
    for (int i = start; i < orderedIds.size(); i++) {
      String id = orderedIds.get(i);
      if (!removalTracker().isTracked(id)) {
        out.add(id);
      }
    }
    return out;
  }
}
