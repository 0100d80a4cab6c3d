package com.consullo.sorter.core.memory;

import com.consullo.sorter.core.Criteria;
import com.consullo.sorter.core.PhotoRecord;
import com.consullo.sorter.core.RecordStatus;
import com.consullo.sorter.core.RecordStore;
import com.consullo.sorter.core.SortOrder;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.Validate;

/**
 * Simple in-memory record store used by the demo and by tests.
 *
 * <p>All methods are synchronized on the store. Random windows are ordered by a seeded hash of the
 * record id, which keeps consecutive windows of the same query disjoint.</p>
 *
 * @since 1.0
 */
public final class InMemoryRecordStore implements RecordStore {

  private static final Comparator<PhotoRecord> NEWEST_FIRST =
      Comparator.comparingLong(PhotoRecord::dateTakenMillis).reversed().thenComparing(PhotoRecord::id);

  private final Map<String, PhotoRecord> records = new LinkedHashMap<>();

  public InMemoryRecordStore() {
  }

  /**
   * Creates a store pre-filled with the given records.
   *
   * @param initial initial records
   */
  public InMemoryRecordStore(final Collection<PhotoRecord> initial) {
    Validate.notNull(initial, "initial must not be null");
    for (PhotoRecord r : initial) {
      put(r);
    }
  }

  /**
   * Inserts or replaces a record.
   *
   * @param record record to store
   */
  public synchronized void put(final PhotoRecord record) {
    Validate.notNull(record, "record must not be null");
    records.put(record.id(), record);
  }

  /**
   * Returns the stored status of a record.
   *
   * @param id record id
   * @return status, or null for an unknown id
   */
  public synchronized RecordStatus statusOf(final String id) {
    PhotoRecord r = records.get(id);
    return r == null ? null : r.status();
  }

  public synchronized int size() {
    return records.size();
  }

  public synchronized int countByStatus(final RecordStatus status) {
    int n = 0;
    for (PhotoRecord r : records.values()) {
      if (r.status() == status) {
        n++;
      }
    }
    return n;
  }

  @Override
  public synchronized int count(final Criteria criteria) {
    return matching(criteria).size();
  }

  @Override
  public synchronized List<String> ids(final Criteria criteria) {
    List<PhotoRecord> matches = matching(criteria);
    matches.sort(NEWEST_FIRST);
    List<String> out = new ArrayList<>(matches.size());
    for (PhotoRecord r : matches) {
      out.add(r.id());
    }
    return out;
  }

  @Override
  public synchronized List<PhotoRecord> page(final Criteria criteria, final SortOrder sortOrder, final int limit,
      final int offset) {
    Validate.notNull(sortOrder, "sortOrder must not be null");
    Validate.isTrue(limit > 0, "limit must be positive");
    Validate.isTrue(offset >= 0, "offset must not be negative");

    List<PhotoRecord> matches = matching(criteria);
    matches.sort(comparatorFor(sortOrder));
    if (offset >= matches.size()) {
      return Collections.emptyList();
    }
    int end = Math.min(matches.size(), offset + limit);
    return new ArrayList<>(matches.subList(offset, end));
  }

  @Override
  public synchronized List<PhotoRecord> byIds(final List<String> ids) {
    Validate.notNull(ids, "ids must not be null");
    List<PhotoRecord> out = new ArrayList<>(ids.size());
    for (String id : ids) {
      PhotoRecord r = records.get(id);
      if (r != null) {
        out.add(r);
      }
    }
    return out;
  }

  @Override
  public synchronized void setStatus(final String id, final RecordStatus status) {
    Validate.notNull(status, "status must not be null");
    PhotoRecord r = records.get(id);
    if (r == null) {
      throw new IllegalArgumentException("Unknown record: " + id);
    }
    records.put(id, r.withStatus(status));
  }

  @Override
  public synchronized void setStatusBatch(final List<String> ids, final RecordStatus status) {
    Validate.notNull(ids, "ids must not be null");
    Validate.notNull(status, "status must not be null");
    // Validate everything first so the batch is applied entirely or not at all.
    for (String id : ids) {
      if (!records.containsKey(id)) {
        throw new IllegalArgumentException("Unknown record: " + id);
      }
    }
    for (String id : ids) {
      records.put(id, records.get(id).withStatus(status));
    }
  }

  private List<PhotoRecord> matching(final Criteria criteria) {
    Validate.notNull(criteria, "criteria must not be null");
    List<PhotoRecord> out = new ArrayList<>();
    if (criteria.isUnsatisfiable()) {
      return out;
    }
    for (PhotoRecord r : records.values()) {
      if (r.status() == RecordStatus.UNCLASSIFIED && criteria.matches(r)) {
        out.add(r);
      }
    }
    return out;
  }

  private static Comparator<PhotoRecord> comparatorFor(final SortOrder sortOrder) {
    switch (sortOrder.kind()) {
      case DATE_ASCENDING:
        return Comparator.comparingLong(PhotoRecord::dateTakenMillis).thenComparing(PhotoRecord::id);
      case RANDOM:
        final long seed = sortOrder.seed();
        return Comparator.comparingLong((PhotoRecord r) -> mix(seed, r.id())).thenComparing(PhotoRecord::id);
      default:
        return NEWEST_FIRST;
    }
  }

  private static long mix(final long seed, final String id) {
    long h = seed ^ (id.hashCode() * 0x9E3779B97F4A7C15L);
    h = (h ^ (h >>> 30)) * 0xBF58476D1CE4E5B9L;
    h = (h ^ (h >>> 27)) * 0x94D049BB133111EBL;
    return h ^ (h >>> 31);
  }
}
