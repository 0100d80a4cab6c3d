package com.consullo.sorter.session;

import com.consullo.sorter.core.Criteria;
import com.consullo.sorter.core.RecordStore;
import com.consullo.sorter.core.SortOrder;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link StrategySelector}.
 *
 * @since 1.0
 */
public class StrategySelectorTest {

  @Test
  @DisplayName("Counts above the threshold page through the store, the rest are snapshotted")
  void choose_Threshold() {
    StrategySelector selector = new StrategySelector(5000);

    assertThat(selector.choose(5000)).isEqualTo(PaginationStrategy.SNAPSHOT);
    assertThat(selector.choose(5001)).isEqualTo(PaginationStrategy.WINDOWED);
    assertThat(selector.choose(0)).isEqualTo(PaginationStrategy.SNAPSHOT);
  }

  @Test
  @DisplayName("A large collection opens a windowed session without materializing ids")
  void open_LargeCount_WindowedWithoutIdQuery() throws Exception {
    RecordStore store = mock(RecordStore.class);
    when(store.count(any())).thenReturn(12_000);

    StrategySelector.Selection sel = new StrategySelector(5000)
        .open(store, Criteria.all(), SortOrder.dateDescending(), 500, 3L);

    assertThat(sel.session()).isInstanceOf(WindowedSession.class);
    assertThat(sel.count()).isEqualTo(12_000);
    assertThat(sel.session().generation()).isEqualTo(3L);
    verify(store, never()).ids(any());
  }

  @Test
  @DisplayName("A small collection opens a snapshot session")
  void open_SmallCount_Snapshot() throws Exception {
    RecordStore store = mock(RecordStore.class);
    when(store.count(any())).thenReturn(2);
    when(store.ids(any())).thenReturn(List.of("a", "b"));

    StrategySelector.Selection sel = new StrategySelector(5000)
        .open(store, Criteria.all(), SortOrder.dateAscending(), 500, 1L);

    assertThat(sel.session()).isInstanceOf(SnapshotSession.class);
    assertThat(((SnapshotSession) sel.session()).orderedIds()).containsExactly("b", "a");
  }

  @Test
  @DisplayName("A failing count propagates")
  void open_CountFails_Throws() throws Exception {
    RecordStore store = mock(RecordStore.class);
    when(store.count(any())).thenThrow(new IllegalStateException("db closed"));

    assertThatThrownBy(() -> new StrategySelector(10).open(store, Criteria.all(), SortOrder.dateDescending(), 5, 1L))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("db closed");
  }
}
