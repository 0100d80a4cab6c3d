package com.consullo.sorter.session;

import com.consullo.sorter.core.Criteria;
import com.consullo.sorter.core.PhotoRecord;
import com.consullo.sorter.core.RecordStore;
import com.consullo.sorter.core.SortOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One classification session: a resolved query, the records loaded so far, and the ids hidden
 * by local classification.
 *
 * <p>
 * A session is never patched across a criteria or sort order change; the engine builds a new
 * one and swaps the reference. Paging is split in three steps so that the store is never queried
 * while the engine holds its lock:
 * <ul>
 * <li>{@link #beginPage()} under the lock: advance the cursor and describe the fetch;</li>
 * <li>{@link #fetch(RecordStore, PageRequest)} on a background thread;</li>
 * <li>{@link #completePage(PageRequest, List)} or {@link #failPage(PageRequest)} under the lock.</li>
 * </ul>
 * </p>
 */
public abstract class PagedSession {

  private final long generation;
  private final Criteria criteria;
  private final SortOrder sortOrder;
  private final int pageSize;
  private final RemovalTracker removalTracker = new RemovalTracker();

  private final List<PhotoRecord> loaded = new ArrayList<>();
  private final Map<String, PhotoRecord> loadedById = new HashMap<>();
  private final Set<String> releasedIds = new HashSet<>();

  private int nextPage;
  private boolean hasMorePages = true;
  private boolean fetchInFlight;
  private int consecutiveFailures;

  protected PagedSession(long generation, Criteria criteria, SortOrder sortOrder, int pageSize) {
    if (criteria == null || sortOrder == null) {
      throw new IllegalArgumentException("criteria/sortOrder must not be null.");
    }
    if (pageSize <= 0) {
      throw new IllegalArgumentException("pageSize must be positive.");
    }
    this.generation = generation;
    this.criteria = criteria;
    this.sortOrder = sortOrder;
    this.pageSize = pageSize;
  }

  public abstract PaginationStrategy strategy();

  /**
   * Describe the fetch for a page index. Called under the engine lock.
   *
   * @param pageIndex page index
   * @return page request
   */
  protected abstract PageRequest createRequest(int pageIndex);

  /**
   * Load the records of a prepared page. Called without the engine lock.
   *
   * @param store record store
   * @param request prepared request
   * @return records in session order
   * @throws Exception if the store query fails
   */
  public abstract List<PhotoRecord> fetch(RecordStore store, PageRequest request) throws Exception;

  /**
   * Whether another page may exist after a completed one.
   *
   * @param request completed request
   * @param fetchedCount number of records the store returned
   * @return true if more pages may follow
   */
  protected abstract boolean hasMoreAfter(PageRequest request, int fetchedCount);

  /**
   * Whether records whose classification can no longer change may be dropped from memory.
   *
   * @return true if {@link #releaseSettled(String)} frees records
   */
  public boolean releasesSettledRecords() {
    return false;
  }

  /**
   * Advance the cursor and prepare the next page.
   *
   * @return prepared request
   */
  public PageRequest beginPage() {
    if (fetchInFlight) {
      throw new IllegalStateException("A page fetch is already in flight.");
    }
    PageRequest request = createRequest(nextPage);
    nextPage++;
    fetchInFlight = true;
    return request;
  }

  /**
   * Append a fetched page, dropping records that are already loaded.
   *
   * @param request completed request
   * @param records fetched records
   * @return append outcome
   */
  public PageResult completePage(PageRequest request, List<PhotoRecord> records) {
    fetchInFlight = false;
    consecutiveFailures = 0;

    int appended = 0;
    int duplicates = 0;
    for (PhotoRecord r : records) {
      if (r == null) {
        continue;
      }
      if (loadedById.containsKey(r.id()) || releasedIds.contains(r.id())) {
        duplicates++;
        continue;
      }
      loaded.add(r);
      loadedById.put(r.id(), r);
      appended++;
    }
    hasMorePages = hasMoreAfter(request, records.size());

    boolean rebuild = request.offsetClamped() && appended == 0 && duplicates > 0;
    return new PageResult(appended, duplicates, rebuild);
  }

  /**
   * Revert the cursor after a failed fetch so the same page is retried.
   *
   * @param request failed request
   * @return number of consecutive failures so far
   */
  public int failPage(PageRequest request) {
    fetchInFlight = false;
    nextPage = request.pageIndex();
    consecutiveFailures++;
    return consecutiveFailures;
  }

  /**
   * Records of this session that are not hidden by the removal tracker, in session order.
   *
   * @return visible projection
   */
  public List<PhotoRecord> visibleRecords() {
    List<PhotoRecord> out = new ArrayList<>(loaded.size());
    for (PhotoRecord r : loaded) {
      if (!removalTracker.isTracked(r.id())) {
        out.add(r);
      }
    }
    return Collections.unmodifiableList(out);
  }

  public int visibleCount() {
    int n = 0;
    for (PhotoRecord r : loaded) {
      if (!removalTracker.isTracked(r.id())) {
        n++;
      }
    }
    return n;
  }

  /**
   * Ids still to classify from the given record onward, in session order.
   *
   * @param recordId first id
   * @return remaining ids, empty if the record is not part of the session
   */
  public List<String> remainingIdsFrom(String recordId) {
    List<String> out = new ArrayList<>();
    boolean found = false;
    for (PhotoRecord r : loaded) {
      if (r.id().equals(recordId)) {
        found = true;
      }
      if (found && !removalTracker.isTracked(r.id())) {
        out.add(r.id());
      }
    }
    return out;
  }

  /**
   * Drop a hidden record whose write is confirmed and which can no longer be undone. Only its id
   * is kept, to reject the record if a later page returns it again.
   *
   * @param recordId record id
   * @return true if the record was released
   */
  public boolean releaseSettled(String recordId) {
    if (!releasesSettledRecords() || !removalTracker.untrack(recordId)) {
      return false;
    }
    PhotoRecord record = loadedById.remove(recordId);
    if (record != null) {
      loaded.remove(record);
    }
    releasedIds.add(recordId);
    return true;
  }

  /**
   * Records classified during this session, whether still tracked or already released.
   *
   * @return removed count
   */
  public int removedCount() {
    return removalTracker.size() + releasedIds.size();
  }

  public PhotoRecord loadedRecord(String recordId) {
    return loadedById.get(recordId);
  }

  public long generation() {
    return generation;
  }

  public Criteria criteria() {
    return criteria;
  }

  public SortOrder sortOrder() {
    return sortOrder;
  }

  public int pageSize() {
    return pageSize;
  }

  public RemovalTracker removalTracker() {
    return removalTracker;
  }

  public int nextPageIndex() {
    return nextPage;
  }

  public int loadedCount() {
    return loaded.size();
  }

  public boolean hasMorePages() {
    return hasMorePages;
  }

  public boolean isFetchInFlight() {
    return fetchInFlight;
  }

  public int consecutiveFailures() {
    return consecutiveFailures;
  }
}
