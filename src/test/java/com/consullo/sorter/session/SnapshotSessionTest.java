package com.consullo.sorter.session;

import com.consullo.sorter.core.Criteria;
import com.consullo.sorter.core.PhotoRecord;
import com.consullo.sorter.core.RecordStatus;
import com.consullo.sorter.core.SortOrder;
import com.consullo.sorter.core.memory.InMemoryRecordStore;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SnapshotSession}.
 *
 * @since 1.0
 */
public class SnapshotSessionTest {

  private static InMemoryRecordStore storeOf(int n) {
    InMemoryRecordStore store = new InMemoryRecordStore();
    for (int i = 0; i < n; i++) {
      store.put(new PhotoRecord(String.format("p%03d", i), 10_000L + i, "b", RecordStatus.UNCLASSIFIED));
    }
    return store;
  }

  private static List<PhotoRecord> loadAll(SnapshotSession session, InMemoryRecordStore store) throws Exception {
    while (session.hasMorePages()) {
      PageRequest req = session.beginPage();
      session.completePage(req, session.fetch(store, req));
    }
    return session.visibleRecords();
  }

  @Test
  @DisplayName("Paging a snapshot never yields the same id twice")
  void pages_NoDuplicateIdsAcrossPages() throws Exception {
    InMemoryRecordStore store = storeOf(95);
    SnapshotSession session = SnapshotSession.build(store, Criteria.all(), SortOrder.dateDescending(), 20, 1L);

    List<PhotoRecord> all = loadAll(session, store);

    Set<String> ids = new HashSet<>();
    for (PhotoRecord r : all) {
      assertThat(ids.add(r.id())).isTrue();
    }
    assertThat(all).hasSize(95);
    assertThat(session.nextPageIndex()).isEqualTo(5);
  }

  @Test
  @DisplayName("Same criteria, order and seed give the same sequence")
  void build_SameSeed_IdenticalOrder() throws Exception {
    InMemoryRecordStore store = storeOf(200);

    SnapshotSession a = SnapshotSession.build(store, Criteria.all(), SortOrder.random(42L), 50, 1L);
    SnapshotSession b = SnapshotSession.build(store, Criteria.all(), SortOrder.random(42L), 50, 2L);
    SnapshotSession c = SnapshotSession.build(store, Criteria.all(), SortOrder.random(43L), 50, 3L);

    assertThat(a.orderedIds()).isEqualTo(b.orderedIds());
    assertThat(a.orderedIds()).isNotEqualTo(c.orderedIds());
    assertThat(a.orderedIds()).containsExactlyInAnyOrderElementsOf(c.orderedIds());
  }

  @Test
  @DisplayName("Ascending order reverses the store's newest-first order")
  void build_Ascending_OldestFirst() throws Exception {
    SnapshotSession session = SnapshotSession.build(storeOf(3), Criteria.all(), SortOrder.dateAscending(), 10, 1L);

    assertThat(session.orderedIds()).containsExactly("p000", "p001", "p002");
    assertThat(session.strategy()).isEqualTo(PaginationStrategy.SNAPSHOT);
  }

  @Test
  @DisplayName("Records classified elsewhere after the build are dropped from their page")
  void fetch_RecordClassifiedSinceBuild_Dropped() throws Exception {
    InMemoryRecordStore store = storeOf(5);
    SnapshotSession session = SnapshotSession.build(store, Criteria.all(), SortOrder.dateDescending(), 10, 1L);
    store.setStatus("p002", RecordStatus.KEEP);

    PageRequest req = session.beginPage();
    List<PhotoRecord> page = session.fetch(store, req);

    assertThat(page).extracting(PhotoRecord::id).containsExactly("p004", "p003", "p001", "p000");
  }

  @Test
  @DisplayName("The id list keeps its length; tracked ids are only hidden")
  void track_HidesWithoutShrinkingIdList() throws Exception {
    InMemoryRecordStore store = storeOf(4);
    SnapshotSession session = SnapshotSession.build(store, Criteria.all(), SortOrder.dateDescending(), 10, 1L);
    loadAll(session, store);

    session.removalTracker().track("p003", 1L, RecordStatus.KEEP);

    assertThat(session.orderedIds()).hasSize(4);
    assertThat(session.visibleRecords()).extracting(PhotoRecord::id).containsExactly("p002", "p001", "p000");
    assertThat(session.visibleCount()).isEqualTo(3);
    assertThat(session.remainingIdsFrom("p002")).containsExactly("p002", "p001", "p000");
    assertThat(session.releaseSettled("p003")).isFalse();
    assertThat(session.loadedCount()).isEqualTo(4);
    assertThat(session.remainingIdsFrom("unknown")).isEmpty();
  }

  @Test
  @DisplayName("A failed page is retried from the same index")
  void failPage_RevertsCursor() throws Exception {
    SnapshotSession session = SnapshotSession.build(storeOf(30), Criteria.all(), SortOrder.dateDescending(), 10, 1L);
    PageRequest first = session.beginPage();

    assertThatThrownBy(session::beginPage).isInstanceOf(IllegalStateException.class);
    assertThat(session.failPage(first)).isEqualTo(1);
    assertThat(session.nextPageIndex()).isZero();

    PageRequest retry = session.beginPage();
    assertThat(retry.ids()).isEqualTo(first.ids());
  }

  @Test
  @DisplayName("Unsatisfiable criteria build an empty session without touching the store")
  void build_Nothing_Empty() throws Exception {
    SnapshotSession session = SnapshotSession.build(storeOf(3), Criteria.nothing(), SortOrder.dateDescending(), 10, 1L);
    PageRequest req = session.beginPage();
    session.completePage(req, new ArrayList<>());

    assertThat(session.orderedIds()).isEmpty();
    assertThat(session.hasMorePages()).isFalse();
  }
}
