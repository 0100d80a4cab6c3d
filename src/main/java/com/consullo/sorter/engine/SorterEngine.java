package com.consullo.sorter.engine;

import com.consullo.sorter.core.Criteria;
import com.consullo.sorter.core.InPageFilter;
import com.consullo.sorter.core.PhotoRecord;
import com.consullo.sorter.core.RecordStatus;
import com.consullo.sorter.core.RecordStore;
import com.consullo.sorter.core.SessionFilter;
import com.consullo.sorter.core.SortOrder;
import com.consullo.sorter.core.SorterSettings;
import com.consullo.sorter.core.TaskScheduler;
import com.consullo.sorter.core.events.ClassificationSideEffects;
import com.consullo.sorter.core.events.SorterStateListener;
import com.consullo.sorter.criteria.CriteriaResolver;
import com.consullo.sorter.session.PageRequest;
import com.consullo.sorter.session.PageResult;
import com.consullo.sorter.session.PagedSession;
import com.consullo.sorter.session.StrategySelector;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadLocalRandom;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classification engine: walks a filtered, sorted collection of unclassified records page by page
 * and applies Keep / Trash / Maybe decisions optimistically.
 *
 * <p>
 * Threading model:
 * <ul>
 * <li>All mutable state is guarded by one lock. Every public call takes it, applies its in-memory
 * change, publishes a new {@link SorterEngineState} and releases it.</li>
 * <li>Store queries run on the reader executor and durable writes on the single writer executor,
 * both outside the lock. Their results are applied under the lock again.</li>
 * <li>A rebuild bumps the session generation; results of older sessions are discarded.</li>
 * </ul>
 * </p>
 */
public final class SorterEngine implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(SorterEngine.class);

  private final RecordStore store;
  private final SorterSettings settings;
  private final ClassificationSideEffects sideEffects;
  private final SorterEngineConfig config;
  private final SorterExecutors executors;
  private final TaskScheduler scheduler;

  private final Object lock = new Object();
  private final List<SorterStateListener> listeners = new CopyOnWriteArrayList<>();

  private final StrategySelector selector;
  private final StreakTracker streak;
  private final CountStabilizer stabilizer = new CountStabilizer();
  private final ActionProcessor processor;

  private PagedSession session;
  private InPageFilter inPageFilter;
  private long generation;
  private boolean loading = true;
  private boolean reloading;
  private boolean prefetchSuspended;
  private int stableTotal;
  private String lastError;
  private TaskScheduler.ScheduledTask loadMoreTask;
  private boolean closed;
  private volatile SorterEngineState state;

  public SorterEngine(RecordStore store, SorterSettings settings, ClassificationSideEffects sideEffects,
          SorterEngineConfig config, SorterExecutors executors) {
    if (store == null || settings == null || config == null || executors == null) {
      throw new IllegalArgumentException("store/settings/config/executors must not be null.");
    }
    this.store = store;
    this.settings = settings;
    this.sideEffects = sideEffects == null ? ClassificationSideEffects.NO_OP : sideEffects;
    this.config = config;
    this.executors = executors;
    this.scheduler = executors.scheduler();
    this.selector = new StrategySelector(config.windowedThreshold());
    this.streak = new StreakTracker(scheduler, config.comboWindowMillis(), config.comboResetDelayMillis(), lock,
            this::publish);
    this.processor = new ActionProcessor(store, streak, new UndoStack(config.undoDepth()));
    synchronized (lock) {
      this.state = snapshot();
    }
  }

  public SorterEngineState state() {
    return state;
  }

  public void addStateListener(SorterStateListener listener) {
    Validate.notNull(listener, "listener must not be null");
    listeners.add(listener);
  }

  public void removeStateListener(SorterStateListener listener) {
    listeners.remove(listener);
  }

  /**
   * Current session, for diagnostics and tests.
   *
   * @return session, empty before the first build
   */
  public Optional<PagedSession> currentSession() {
    synchronized (lock) {
      return Optional.ofNullable(session);
    }
  }

  /**
   * Rebuild the session from the current settings and filters. Counters, undo history and the
   * stable total start over; results of the previous session still in flight are discarded.
   */
  public void reload() {
    final long gen;
    final Criteria criteria;
    final SortOrder order;
    synchronized (lock) {
      if (closed) {
        return;
      }
      gen = ++generation;
      cancelLoadMore();
      reloading = true;
      prefetchSuspended = false;
      processor.resetSession();
      stabilizer.reset();
      stableTotal = 0;
      criteria = resolveCriteria();
      order = settings.sortOrder();
      LOGGER.debug("reload: generation={} order={} criteria={}", gen, order, criteria);
      publish();
    }
    executors.reader().execute(() -> build(gen, criteria, order));
  }

  private Criteria resolveCriteria() {
    SessionFilter sessionFilter = settings.sessionFilter().orElse(null);
    return CriteriaResolver.resolve(inPageFilter, sessionFilter, settings.filterMode(), settings.cameraBucketIds());
  }

  private void build(long gen, Criteria criteria, SortOrder order) {
    final StrategySelector.Selection selection;
    final PageRequest first;
    final List<PhotoRecord> records;
    try {
      selection = selector.open(store, criteria, order, config.pageSize(), gen);
      first = selection.session().beginPage();
      records = selection.session().fetch(store, first);
    } catch (Exception e) {
      synchronized (lock) {
        if (gen != generation) {
          LOGGER.debug("build: generation {} superseded, dropping failure", gen);
          return;
        }
        LOGGER.warn("Session build failed: {}", e.getMessage(), e);
        reloading = false;
        loading = false;
        lastError = "Failed to load photos: " + e.getMessage();
        publish();
      }
      return;
    }

    synchronized (lock) {
      if (gen != generation || closed) {
        LOGGER.debug("build: generation {} superseded by {}, discarding", gen, generation);
        return;
      }
      session = selection.session();
      session.completePage(first, records);
      stableTotal = stabilizer.observe(selection.count(), processor.immediateClassifiedCount());
      reloading = false;
      loading = false;
      LOGGER.info("Session {} ready: strategy={} total={} loaded={}", gen, session.strategy(), stableTotal,
              session.loadedCount());
      publish();
      schedulePrefetchIfNeeded();
    }
  }

  /**
   * Re-query the unclassified count of the current session and feed it to the stabilizer.
   * Has no visible effect once the total has latched.
   */
  public void refreshTotal() {
    final PagedSession target;
    synchronized (lock) {
      target = session;
    }
    if (target == null) {
      return;
    }
    executors.reader().execute(() -> {
      try {
        int count = target.criteria().isUnsatisfiable() ? 0 : store.count(target.criteria());
        synchronized (lock) {
          if (target != session) {
            return;
          }
          stableTotal = stabilizer.observe(count, processor.immediateClassifiedCount());
          publish();
        }
      } catch (Exception e) {
        LOGGER.warn("Count refresh failed: {}", e.getMessage(), e);
      }
    });
  }

  /**
   * Request the next page now. Also resumes automatic prefetch after repeated failures.
   */
  public void loadMore() {
    synchronized (lock) {
      prefetchSuspended = false;
      cancelLoadMore();
    }
    requestPage();
  }

  private void requestPage() {
    final PagedSession target;
    final PageRequest request;
    synchronized (lock) {
      if (closed || reloading || session == null || !session.hasMorePages() || session.isFetchInFlight()) {
        return;
      }
      target = session;
      request = target.beginPage();
      publish();
    }
    executors.reader().execute(() -> fetchPage(target, request));
  }

  private void fetchPage(PagedSession target, PageRequest request) {
    List<PhotoRecord> records;
    try {
      records = target.fetch(store, request);
    } catch (Exception e) {
      synchronized (lock) {
        if (target != session) {
          return;
        }
        int failures = target.failPage(request);
        if (failures >= config.maxPageFetchRetries()) {
          LOGGER.warn("Page {} failed {} times in a row, pausing prefetch: {}", request.pageIndex(), failures,
                  e.getMessage(), e);
          prefetchSuspended = true;
          lastError = "Failed to load more photos: " + e.getMessage();
        } else {
          LOGGER.debug("fetchPage: page {} failed ({}), will retry", request.pageIndex(), e.getMessage());
        }
        publish();
        schedulePrefetchIfNeeded();
      }
      return;
    }

    boolean rebuild;
    synchronized (lock) {
      if (target != session) {
        LOGGER.debug("fetchPage: session replaced, discarding page {}", request.pageIndex());
        return;
      }
      PageResult result = target.completePage(request, records);
      rebuild = result.rebuildSuggested();
      if (result.duplicates() > 0) {
        LOGGER.debug("fetchPage: page {} appended={} duplicates={}", request.pageIndex(), result.appended(),
                result.duplicates());
      }
      if (!rebuild) {
        publish();
        schedulePrefetchIfNeeded();
      }
    }
    if (rebuild) {
      LOGGER.warn("Clamped page {} returned only known records, rebuilding session", request.pageIndex());
      reload();
    }
  }

  private void schedulePrefetchIfNeeded() {
    if (closed || prefetchSuspended || reloading || session == null || loadMoreTask != null) {
      return;
    }
    if (!session.hasMorePages() || session.isFetchInFlight()) {
      return;
    }
    if (session.visibleCount() >= config.preloadThreshold()) {
      return;
    }
    loadMoreTask = scheduler.schedule(() -> {
      synchronized (lock) {
        loadMoreTask = null;
      }
      requestPage();
    }, config.loadMoreDebounceMillis());
  }

  private void cancelLoadMore() {
    if (loadMoreTask != null) {
      loadMoreTask.cancel();
      loadMoreTask = null;
    }
  }

  public int keep(String recordId) {
    return classify(recordId, RecordStatus.KEEP);
  }

  public int trash(String recordId) {
    return classify(recordId, RecordStatus.TRASH);
  }

  public int maybe(String recordId) {
    return classify(recordId, RecordStatus.MAYBE);
  }

  /**
   * Classify one record. The record leaves the visible list immediately; the store write happens
   * in the background and is rolled back if it fails.
   *
   * @param recordId record id; a blank id is ignored
   * @param status new status
   * @return combo count after this action, 0 if the action was ignored
   */
  public int classify(String recordId, RecordStatus status) {
    Validate.notNull(status, "status must not be null");
    Validate.isTrue(status != RecordStatus.UNCLASSIFIED, "status must be KEEP, TRASH or MAYBE");
    if (StringUtils.isBlank(recordId)) {
      return 0;
    }
    final PendingAction action;
    synchronized (lock) {
      if (!acceptsActions()) {
        LOGGER.debug("classify: no ready session, ignoring {}", recordId);
        return 0;
      }
      action = processor.apply(session, recordId, status, scheduler.nowMillis());
      publish();
      schedulePrefetchIfNeeded();
    }
    executors.writer().execute(() -> persist(action));
    return action.combo();
  }

  /**
   * Classify several records as one action with one undo entry. Either every record is written or
   * none is; on failure all of them become visible again.
   *
   * @param recordIds record ids; blanks and duplicates are ignored
   * @param status new status
   * @return number of records the action covers
   */
  public int classifyBatch(List<String> recordIds, RecordStatus status) {
    Validate.notNull(recordIds, "recordIds must not be null");
    Validate.notNull(status, "status must not be null");
    Validate.isTrue(status != RecordStatus.UNCLASSIFIED, "status must be KEEP, TRASH or MAYBE");
    LinkedHashSet<String> distinct = new LinkedHashSet<>();
    for (String id : recordIds) {
      if (StringUtils.isNotBlank(id)) {
        distinct.add(id);
      }
    }
    if (distinct.isEmpty()) {
      return 0;
    }
    final PendingAction action;
    synchronized (lock) {
      if (!acceptsActions()) {
        return 0;
      }
      action = processor.applyBatch(session, new ArrayList<>(distinct), status, scheduler.nowMillis());
      publish();
      schedulePrefetchIfNeeded();
    }
    executors.writer().execute(() -> persist(action));
    return distinct.size();
  }

  private boolean acceptsActions() {
    return !closed && !reloading && session != null;
  }

  private void persist(PendingAction action) {
    try {
      processor.write(action);
    } catch (Exception e) {
      synchronized (lock) {
        LOGGER.warn("Write of {} record(s) as {} failed, rolling back: {}", action.recordIds().size(),
                action.newStatus(), e.getMessage(), e);
        processor.rollback(action, session);
        lastError = "Failed to save " + describe(action.recordIds().size()) + ": " + e.getMessage();
        publish();
      }
      return;
    }
    final int maxCombo;
    synchronized (lock) {
      processor.complete(action);
      maxCombo = streak.state().maxCount();
    }
    executors.sideEffects().execute(() -> notifySideEffects(action, maxCombo));
  }

  private void notifySideEffects(PendingAction action, int maxCombo) {
    int n = action.recordIds().size();
    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("status", action.newStatus().name());
    attributes.put("count", n);
    attributes.put("combo", action.combo());
    try {
      sideEffects.incrementLifetimeCounters(action.newStatus(), n);
      sideEffects.recordTelemetry(action.isBatch() ? "batch_classified" : "photo_classified", attributes);
      sideEffects.refreshWidgets();
      sideEffects.updateMaxCombo(maxCombo);
    } catch (Exception e) {
      LOGGER.warn("Side effects after classification failed: {}", e.getMessage(), e);
    }
  }

  /**
   * Undo the most recent classification. Its records become visible again immediately and their
   * previous statuses are written in the background.
   *
   * @return false if there was nothing to undo
   */
  public boolean undo() {
    final PendingUndo pending;
    synchronized (lock) {
      if (closed || session == null) {
        return false;
      }
      pending = processor.beginUndo(session);
      if (pending == null) {
        return false;
      }
      publish();
    }
    executors.writer().execute(() -> persistUndo(pending));
    return true;
  }

  private void persistUndo(PendingUndo pending) {
    try {
      processor.writeUndo(pending);
    } catch (Exception e) {
      synchronized (lock) {
        LOGGER.warn("Undo write failed, re-applying classification: {}", e.getMessage(), e);
        processor.rollbackUndo(pending, session);
        lastError = "Failed to undo: " + e.getMessage();
        publish();
      }
    }
  }

  public void setSortOrder(SortOrder sortOrder) {
    Validate.notNull(sortOrder, "sortOrder must not be null");
    settings.setSortOrder(sortOrder);
    reload();
  }

  /**
   * Move to the next sort order: newest first, oldest first, random with a fresh seed.
   *
   * @return new order
   */
  public SortOrder cycleSortOrder() {
    SortOrder next = settings.sortOrder().next(ThreadLocalRandom.current().nextLong());
    setSortOrder(next);
    return next;
  }

  public void setInPageFilter(InPageFilter filter) {
    synchronized (lock) {
      inPageFilter = filter == null || filter.isEmpty() ? null : filter;
    }
    reload();
  }

  public void clearInPageFilter() {
    setInPageFilter(null);
  }

  public void setSessionFilter(SessionFilter filter) {
    Validate.notNull(filter, "filter must not be null");
    settings.setSessionFilter(filter);
    reload();
  }

  public void clearSessionFilter() {
    settings.clearSessionFilter();
    reload();
  }

  /** Rebuild after the global filter mode or the camera buckets changed. */
  public void onFilterSettingsChanged() {
    reload();
  }

  /**
   * Restart the session from a record, keeping only it and the records after it that are still
   * unclassified.
   *
   * @param recordId first record of the new session
   * @return false if the record is not part of the current session
   */
  public boolean startFrom(String recordId) {
    Validate.notBlank(recordId, "recordId must not be blank");
    final List<String> remaining;
    synchronized (lock) {
      if (session == null) {
        return false;
      }
      remaining = session.remainingIdsFrom(recordId);
    }
    if (remaining.isEmpty()) {
      return false;
    }
    settings.setSessionFilter(SessionFilter.preciseIds(remaining));
    reload();
    return true;
  }

  public void resetCombo() {
    synchronized (lock) {
      streak.reset();
      publish();
    }
  }

  public void clearError() {
    synchronized (lock) {
      lastError = null;
      publish();
    }
  }

  /**
   * Stop the engine. A precise session filter only lives as long as the screen that set it and is
   * cleared here. Pending writes already handed to the writer may still complete.
   */
  @Override
  public void close() {
    synchronized (lock) {
      if (closed) {
        return;
      }
      closed = true;
      generation++;
      cancelLoadMore();
      streak.cancelDecay();
    }
    Optional<SessionFilter> filter = settings.sessionFilter();
    if (filter.isPresent() && filter.get().precise()) {
      settings.clearSessionFilter();
    }
    listeners.clear();
    executors.close();
    LOGGER.info("Sorter engine closed");
  }

  private void publish() {
    SorterEngineState next = snapshot();
    state = next;
    for (SorterStateListener l : listeners) {
      try {
        l.onStateChanged(next);
      } catch (RuntimeException e) {
        LOGGER.warn("State listener failed: {}", e.getMessage(), e);
      }
    }
  }

  private SorterEngineState snapshot() {
    return new SorterEngineState(
            session == null ? List.of() : session.visibleRecords(),
            stableTotal,
            processor.counters(),
            processor.immediateClassifiedCount(),
            streak.state(),
            processor.canUndo(),
            loading,
            reloading,
            session != null && session.isFetchInFlight(),
            session != null && session.hasMorePages(),
            session == null ? null : session.strategy(),
            session == null ? settings.sortOrder() : session.sortOrder(),
            generation,
            lastError);
  }

  private static String describe(int n) {
    return n == 1 ? "photo" : n + " photos";
  }
}
