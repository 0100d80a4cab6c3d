package com.consullo.sorter.engine;

import com.consullo.sorter.core.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks rapid consecutive classifications.
 *
 * <p>
 * An action within {@code windowMillis} of the previous one extends the streak; otherwise the
 * streak restarts at one. When no action arrives for {@code windowMillis} the streak goes
 * inactive, and after a further {@code resetDelayMillis} the count drops to zero. The best count
 * survives decay and is cleared only by {@link #reset()}.
 * </p>
 *
 * <p>
 * Decay callbacks run on the scheduler thread and take the shared lock before touching state;
 * {@code onDecay} is invoked with the lock held.
 * </p>
 */
public final class StreakTracker {

  private static final Logger LOGGER = LoggerFactory.getLogger(StreakTracker.class);

  private final TaskScheduler scheduler;
  private final long windowMillis;
  private final long resetDelayMillis;
  private final Object lock;
  private final Runnable onDecay;

  private ComboState state = ComboState.INITIAL;
  private TaskScheduler.ScheduledTask pendingDecay;
  // Bumped by every action so a decay task that escaped cancellation does nothing.
  private long decayToken;

  public StreakTracker(TaskScheduler scheduler, long windowMillis, long resetDelayMillis, Object lock,
          Runnable onDecay) {
    if (scheduler == null || lock == null || onDecay == null) {
      throw new IllegalArgumentException("scheduler/lock/onDecay must not be null.");
    }
    if (windowMillis <= 0 || resetDelayMillis < 0) {
      throw new IllegalArgumentException("windowMillis must be positive and resetDelayMillis not negative.");
    }
    this.scheduler = scheduler;
    this.windowMillis = windowMillis;
    this.resetDelayMillis = resetDelayMillis;
    this.lock = lock;
    this.onDecay = onDecay;
  }

  /**
   * Register one action. Caller holds the lock.
   *
   * @param nowMillis time of the action
   * @return combo count after the action
   */
  public int registerAction(long nowMillis) {
    boolean continues = state.count() > 0
            && nowMillis - state.lastActionMillis() <= windowMillis;
    int count = continues ? state.count() + 1 : 1;
    state = new ComboState(count, Math.max(state.maxCount(), count), nowMillis, true);
    scheduleDecay();
    return count;
  }

  /** Clear the streak, its best count and any pending decay. Caller holds the lock. */
  public void reset() {
    cancelDecay();
    state = ComboState.INITIAL;
  }

  public ComboState state() {
    return state;
  }

  /** Cancel pending decay without touching the state. Caller holds the lock. */
  public void cancelDecay() {
    decayToken++;
    if (pendingDecay != null) {
      pendingDecay.cancel();
      pendingDecay = null;
    }
  }

  private void scheduleDecay() {
    cancelDecay();
    final long token = decayToken;
    pendingDecay = scheduler.schedule(() -> deactivate(token), windowMillis);
  }

  private void deactivate(long token) {
    synchronized (lock) {
      if (token != decayToken) {
        return;
      }
      state = new ComboState(state.count(), state.maxCount(), state.lastActionMillis(), false);
      pendingDecay = scheduler.schedule(() -> clearCount(token), resetDelayMillis);
      LOGGER.debug("deactivate: combo={} max={}", state.count(), state.maxCount());
      onDecay.run();
    }
  }

  private void clearCount(long token) {
    synchronized (lock) {
      if (token != decayToken) {
        return;
      }
      pendingDecay = null;
      state = new ComboState(0, state.maxCount(), state.lastActionMillis(), false);
      onDecay.run();
    }
  }
}
