package com.consullo.sorter.engine;

import com.consullo.sorter.core.ManualTaskScheduler;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for combo tracking and decay.
 *
 * @since 1.0
 */
public class StreakTrackerTest {

  private ManualTaskScheduler scheduler;
  private AtomicInteger decays;
  private StreakTracker tracker;

  @BeforeEach
  void setUp() {
    scheduler = new ManualTaskScheduler(10_000L);
    decays = new AtomicInteger();
    tracker = new StreakTracker(scheduler, 1500L, 300L, new Object(), decays::incrementAndGet);
  }

  @Test
  @DisplayName("Actions inside the window extend the combo")
  void registerAction_InsideWindow_Increments() {
    assertThat(tracker.registerAction(scheduler.nowMillis())).isEqualTo(1);
    scheduler.advance(1500);
    assertThat(tracker.registerAction(scheduler.nowMillis())).isEqualTo(2);
    scheduler.advance(200);
    assertThat(tracker.registerAction(scheduler.nowMillis())).isEqualTo(3);

    assertThat(tracker.state().active()).isTrue();
    assertThat(tracker.state().level()).isEqualTo(ComboLevel.NORMAL);
  }

  @Test
  @DisplayName("An action after the window restarts at one but keeps the max")
  void registerAction_AfterWindow_Restarts() {
    tracker.registerAction(scheduler.nowMillis());
    tracker.registerAction(scheduler.nowMillis() + 10);
    tracker.registerAction(scheduler.nowMillis() + 20);

    assertThat(tracker.registerAction(scheduler.nowMillis() + 20 + 1501)).isEqualTo(1);
    assertThat(tracker.state().maxCount()).isEqualTo(3);
  }

  @Test
  @DisplayName("The combo goes inactive after the window and drops to zero after the reset delay")
  void decay_InactiveThenCleared() {
    tracker.registerAction(scheduler.nowMillis());
    scheduler.advance(100);
    tracker.registerAction(scheduler.nowMillis());

    scheduler.advance(1499);
    assertThat(tracker.state().active()).isTrue();

    scheduler.advance(1);
    assertThat(tracker.state().active()).isFalse();
    assertThat(tracker.state().count()).isEqualTo(2);

    scheduler.advance(300);
    assertThat(tracker.state().count()).isZero();
    assertThat(tracker.state().maxCount()).isEqualTo(2);
    assertThat(decays.get()).isEqualTo(2);
  }

  @Test
  @DisplayName("A new action cancels pending decay")
  void registerAction_CancelsPendingDecay() {
    tracker.registerAction(scheduler.nowMillis());
    scheduler.advance(1000);
    tracker.registerAction(scheduler.nowMillis());
    scheduler.advance(1000);

    assertThat(tracker.state().active()).isTrue();
    assertThat(tracker.state().count()).isEqualTo(2);
    assertThat(scheduler.pendingCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("reset clears count, max and timers")
  void reset_ClearsEverything() {
    tracker.registerAction(scheduler.nowMillis());
    tracker.reset();
    scheduler.advance(5_000);

    assertThat(tracker.state()).isEqualTo(ComboState.INITIAL);
    assertThat(decays.get()).isZero();
  }

  @Test
  @DisplayName("Combo levels follow the count thresholds")
  void level_Thresholds() {
    assertThat(ComboLevel.of(0)).isEqualTo(ComboLevel.NONE);
    assertThat(ComboLevel.of(4)).isEqualTo(ComboLevel.NORMAL);
    assertThat(ComboLevel.of(5)).isEqualTo(ComboLevel.WARM);
    assertThat(ComboLevel.of(10)).isEqualTo(ComboLevel.HOT);
    assertThat(ComboLevel.of(20)).isEqualTo(ComboLevel.FIRE);
  }
}
