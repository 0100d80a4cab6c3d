package com.consullo.sorter.session;

import com.consullo.sorter.core.Criteria;
import com.consullo.sorter.core.PhotoRecord;
import com.consullo.sorter.core.RecordStatus;
import com.consullo.sorter.core.RecordStore;
import com.consullo.sorter.core.SortOrder;
import com.consullo.sorter.core.memory.InMemoryRecordStore;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link WindowedSession} offset compensation.
 *
 * @since 1.0
 */
public class WindowedSessionTest {

  private static PhotoRecord rec(String id) {
    return new PhotoRecord(id, 1L, "b", RecordStatus.UNCLASSIFIED);
  }

  @Test
  @DisplayName("Page 1 after 5 removals with page size 20 uses offset 15")
  void createRequest_FiveRemovals_OffsetFifteen() throws Exception {
    RecordStore store = mock(RecordStore.class);
    when(store.page(any(), any(), eq(20), eq(15))).thenReturn(List.of());
    WindowedSession session = new WindowedSession(1L, Criteria.all(), SortOrder.dateDescending(), 20);
    PageRequest first = session.beginPage();
    session.completePage(first, List.of(rec("x")));
    for (int i = 0; i < 5; i++) {
      session.removalTracker().track("r" + i, i + 1L, RecordStatus.KEEP);
    }

    PageRequest second = session.beginPage();
    session.fetch(store, second);

    assertThat(second.offset()).isEqualTo(15);
    assertThat(second.offsetClamped()).isFalse();
    verify(store).page(Criteria.all(), SortOrder.dateDescending(), 20, 15);
  }

  @Test
  @DisplayName("A negative offset is clamped to zero and flagged")
  void createRequest_MoreRemovalsThanOffset_Clamped() {
    WindowedSession session = new WindowedSession(1L, Criteria.all(), SortOrder.dateDescending(), 10);
    for (int i = 0; i < 25; i++) {
      session.removalTracker().track("r" + i, i + 1L, RecordStatus.KEEP);
    }

    PageRequest req = session.createRequest(2);

    assertThat(session.rawOffset(2)).isEqualTo(-5L);
    assertThat(req.offset()).isZero();
    assertThat(req.offsetClamped()).isTrue();
  }

  @Test
  @DisplayName("A clamped page that only repeats loaded records suggests a rebuild")
  void completePage_ClampedAllDuplicates_SuggestsRebuild() {
    WindowedSession session = new WindowedSession(1L, Criteria.all(), SortOrder.dateDescending(), 2);
    session.completePage(session.beginPage(), List.of(rec("a"), rec("b")));
    session.removalTracker().track("a", 1L, RecordStatus.KEEP);
    session.removalTracker().track("b", 2L, RecordStatus.KEEP);
    session.removalTracker().track("z", 3L, RecordStatus.KEEP);

    PageRequest req = session.beginPage();
    PageResult result = session.completePage(req, List.of(rec("a"), rec("b")));

    assertThat(req.offsetClamped()).isTrue();
    assertThat(result.appended()).isZero();
    assertThat(result.duplicates()).isEqualTo(2);
    assertThat(result.rebuildSuggested()).isTrue();
  }

  @Test
  @DisplayName("Classifying while paging through a live store neither skips nor repeats records")
  void paging_WithClassificationInBetween_CoversEveryRecordOnce() throws Exception {
    InMemoryRecordStore store = new InMemoryRecordStore();
    for (int i = 0; i < 50; i++) {
      store.put(new PhotoRecord(String.format("p%02d", i), 1_000L - i, "b", RecordStatus.UNCLASSIFIED));
    }
    WindowedSession session = new WindowedSession(1L, Criteria.all(), SortOrder.dateDescending(), 10);
    long seq = 0;
    while (session.hasMorePages()) {
      PageRequest req = session.beginPage();
      session.completePage(req, session.fetch(store, req));
      // Classify the first three visible records of each page before loading the next.
      List<PhotoRecord> visible = session.visibleRecords();
      for (int i = 0; i < 3 && i < visible.size(); i++) {
        String id = visible.get(i).id();
        session.removalTracker().track(id, ++seq, RecordStatus.KEEP);
        store.setStatus(id, RecordStatus.KEEP);
      }
    }

    assertThat(session.loadedCount()).isEqualTo(50);
    assertThat(session.visibleCount() + session.removalTracker().size()).isEqualTo(50);
    assertThat(session.strategy()).isEqualTo(PaginationStrategy.WINDOWED);
  }

  @Test
  @DisplayName("Releasing a settled record frees it but keeps the offset and still rejects it as a duplicate")
  void releaseSettled_DropsRecordKeepsOffsetAndDedup() {
    WindowedSession session = new WindowedSession(1L, Criteria.all(), SortOrder.dateDescending(), 2);
    session.completePage(session.beginPage(), List.of(rec("a"), rec("b")));
    session.removalTracker().track("a", 1L, RecordStatus.TRASH);

    assertThat(session.releaseSettled("a")).isTrue();
    assertThat(session.releaseSettled("b")).isFalse();

    assertThat(session.loadedCount()).isEqualTo(1);
    assertThat(session.loadedRecord("a")).isNull();
    assertThat(session.removalTracker().isTracked("a")).isFalse();
    assertThat(session.removedCount()).isEqualTo(1);
    assertThat(session.rawOffset(1)).isEqualTo(1L);

    PageResult result = session.completePage(session.beginPage(), List.of(rec("a"), rec("c")));
    assertThat(result.appended()).isEqualTo(1);
    assertThat(result.duplicates()).isEqualTo(1);
    assertThat(session.visibleRecords()).extracting(PhotoRecord::id).containsExactly("b", "c");
  }
}
