package com.consullo.sorter.demo;

import com.consullo.sorter.core.PhotoRecord;
import com.consullo.sorter.core.RecordStatus;
import com.consullo.sorter.core.events.ClassificationSideEffects;
import com.consullo.sorter.core.memory.InMemoryRecordStore;
import com.consullo.sorter.core.memory.InMemorySorterSettings;
import com.consullo.sorter.driver.SorterEngineFactory;
import com.consullo.sorter.engine.SorterEngine;
import com.consullo.sorter.engine.SorterEngineState;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal demo that sorts a generated in-memory collection and prints the engine state.
 *
 * <p>
 * Runs a burst of classifications, an undo, a batch action and a sort-order change against
 * {@link InMemoryRecordStore}.
 *
 * @since 1.0
 */
public final class SorterDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(SorterDemo.class);

  private static final int RECORD_COUNT = 1_200;
  private static final long DAY_MILLIS = 86_400_000L;

  private SorterDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args args
   * @throws Exception if demo fails
   */
  public static void main(final String[] args) throws Exception {
    final InMemoryRecordStore store = new InMemoryRecordStore();
    final long base = 1_700_000_000_000L;
    for (int i = 0; i < RECORD_COUNT; i++) {
      String bucket = i % 3 == 0 ? "camera" : "screenshots";
      store.put(new PhotoRecord("photo-" + i, base + i * DAY_MILLIS / 24, bucket, RecordStatus.UNCLASSIFIED));
    }
    final InMemorySorterSettings settings = new InMemorySorterSettings();
    settings.setCameraBucketIds(List.of("camera"));

    final ClassificationSideEffects sideEffects = new ClassificationSideEffects() {
      @Override
      public void updateMaxCombo(final int maxCombo) {
        LOGGER.debug("max combo {}", maxCombo);
      }
    };

    try (SorterEngine engine = SorterEngineFactory.createEngine(store, settings, sideEffects)) {
      awaitReady(engine);
      print("ready", engine.state());

      // A quick burst through the first cards.
      int combo = 0;
      for (int i = 0; i < 12; i++) {
        List<PhotoRecord> visible = engine.state().visibleRecords();
        if (visible.isEmpty()) {
          break;
        }
        String id = visible.get(0).id();
        combo = i % 4 == 3 ? engine.trash(id) : engine.keep(id);
      }
      System.out.println("combo after burst: " + combo + " (" + engine.state().combo().level() + ")");
      print("after burst", engine.state());

      engine.undo();
      print("after undo", engine.state());

      List<PhotoRecord> visible = engine.state().visibleRecords();
      engine.classifyBatch(List.of(visible.get(0).id(), visible.get(1).id(), visible.get(2).id()), RecordStatus.MAYBE);
      print("after batch", engine.state());

      engine.cycleSortOrder();
      awaitReady(engine);
      print("after sort change", engine.state());
    }

    System.out.println("unclassified left in store: " + store.countByStatus(RecordStatus.UNCLASSIFIED));
    LOGGER.info("Demo completed");
  }

  private static void awaitReady(final SorterEngine engine) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (System.nanoTime() < deadline) {
      SorterEngineState s = engine.state();
      if (!s.loading() && !s.reloading()) {
        return;
      }
      TimeUnit.MILLISECONDS.sleep(10);
    }
    throw new IllegalStateException("Engine did not become ready in time");
  }

  private static void print(final String label, final SorterEngineState s) {
    System.out.printf("%-18s order=%s strategy=%s visible=%d total=%d keep=%d trash=%d maybe=%d progress=%.1f%%%n",
        label, s.sortOrder().kind(), s.strategy(), s.visibleRecords().size(), s.stableTotal(),
        s.counters().keep(), s.counters().trash(), s.counters().maybe(), s.progress() * 100f);
  }
}
