package com.consullo.sorter.driver;

import com.consullo.sorter.core.ManualTaskScheduler;
import com.consullo.sorter.core.PhotoRecord;
import com.consullo.sorter.core.RecordStatus;
import com.consullo.sorter.core.memory.InMemoryRecordStore;
import com.consullo.sorter.core.memory.InMemorySorterSettings;
import com.consullo.sorter.engine.SorterEngine;
import com.consullo.sorter.engine.SorterEngineConfig;
import com.consullo.sorter.engine.SorterExecutors;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for engine wiring.
 *
 * @since 1.0
 */
public class SorterEngineFactoryTest {

  @Test
  @DisplayName("Configuration is read from the bundled properties file")
  void loadConfig_BundledResource_MatchesDefaults() {
    assertThat(SorterEngineFactory.loadConfig()).isEqualTo(SorterEngineConfig.defaults());
  }

  @Test
  @DisplayName("A created engine has already built its first session")
  void createEngine_StartsFirstSession() {
    InMemoryRecordStore store = new InMemoryRecordStore(List.of(
        new PhotoRecord("a", 2L, "b", RecordStatus.UNCLASSIFIED),
        new PhotoRecord("b", 1L, "b", RecordStatus.UNCLASSIFIED)));

    try (SorterEngine engine = SorterEngineFactory.createEngine(store, new InMemorySorterSettings(), null,
        SorterEngineConfig.defaults(), SorterExecutors.direct(new ManualTaskScheduler(0L)))) {
      assertThat(engine.state().loading()).isFalse();
      assertThat(engine.state().visibleRecords()).extracting(PhotoRecord::id).containsExactly("a", "b");
      assertThat(engine.state().stableTotal()).isEqualTo(2);
    }
  }

  @Test
  @DisplayName("Missing collaborators are rejected")
  void createEngine_NullStore_Throws() {
    assertThatThrownBy(() -> SorterEngineFactory.createEngine(null, new InMemorySorterSettings(), null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
