package com.consullo.sorter.core;

/**
 * Clock and delayed-task source used for combo decay and load-more debouncing.
 *
 * <p>Kept behind an interface so that time can be driven manually in tests.
 *
 * @since 1.0
 */
public interface TaskScheduler {

  /**
   * Current time in epoch milliseconds.
   *
   * @return now
   */
  long nowMillis();

  /**
   * Runs a task once after a delay.
   *
   * @param task task to run
   * @param delayMillis delay in milliseconds
   * @return handle that cancels the task if it has not started yet
   */
  ScheduledTask schedule(final Runnable task, final long delayMillis);

  /**
   * Handle of a scheduled task.
   */
  interface ScheduledTask {

    void cancel();
  }
}
