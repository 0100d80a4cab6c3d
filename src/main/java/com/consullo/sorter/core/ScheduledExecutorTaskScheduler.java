package com.consullo.sorter.core;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TaskScheduler} backed by a single daemon scheduler thread and the system clock.
 *
 * @since 1.0
 */
public final class ScheduledExecutorTaskScheduler implements TaskScheduler, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScheduledExecutorTaskScheduler.class);

  private final ScheduledExecutorService scheduler;

  /**
   * Creates a scheduler with its own daemon thread.
   *
   * @param threadName name of the scheduler thread
   */
  public ScheduledExecutorTaskScheduler(final String threadName) {
    Validate.notBlank(threadName, "threadName must not be blank");
    this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, threadName);
      t.setDaemon(true);
      return t;
    });
  }

  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }

  @Override
  public ScheduledTask schedule(final Runnable task, final long delayMillis) {
    Validate.notNull(task, "task must not be null");
    final ScheduledFuture<?> future = scheduler.schedule(() -> {
      try {
        task.run();
      } catch (RuntimeException e) {
        LOGGER.warn("Scheduled task failed: {}", e.getMessage(), e);
      }
    }, Math.max(0L, delayMillis), TimeUnit.MILLISECONDS);
    return () -> future.cancel(false);
  }

  @Override
  public void close() {
    scheduler.shutdownNow();
    LOGGER.debug("Task scheduler stopped");
  }
}
