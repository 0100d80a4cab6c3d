package com.consullo.sorter.engine;

import com.consullo.sorter.core.ScheduledExecutorTaskScheduler;
import com.consullo.sorter.core.TaskScheduler;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.commons.lang3.Validate;

/**
 * Threads the engine hands its I/O to.
 *
 * @param reader session builds, page fetches and count refreshes
 * @param writer durable writes; must be single-threaded so writes land in user order
 * @param sideEffects post-write notifications
 * @param scheduler clock and delayed tasks
 * @param owned resources closed together with this instance
 * @since 1.0
 */
public record SorterExecutors(
    Executor reader,
    Executor writer,
    Executor sideEffects,
    TaskScheduler scheduler,
    List<AutoCloseable> owned) implements AutoCloseable {

  public SorterExecutors {
    Validate.notNull(reader, "reader must not be null");
    Validate.notNull(writer, "writer must not be null");
    Validate.notNull(sideEffects, "sideEffects must not be null");
    Validate.notNull(scheduler, "scheduler must not be null");
    owned = owned == null ? List.of() : List.copyOf(owned);
  }

  /**
   * Daemon thread pools suitable for production use.
   *
   * @return executors owning their threads
   */
  public static SorterExecutors createDefault() {
    final ExecutorService reader = Executors.newFixedThreadPool(2, daemon("sorter-reader"));
    final ExecutorService writer = Executors.newSingleThreadExecutor(daemon("sorter-writer"));
    final ExecutorService sideEffects = Executors.newSingleThreadExecutor(daemon("sorter-side-effects"));
    final ScheduledExecutorTaskScheduler scheduler = new ScheduledExecutorTaskScheduler("sorter-scheduler");
    return new SorterExecutors(reader, writer, sideEffects, scheduler, List.<AutoCloseable>of(
        reader::shutdownNow, writer::shutdown, sideEffects::shutdown, scheduler));
  }

  /**
   * Runs every task on the calling thread; delayed tasks go to the given scheduler.
   *
   * @param scheduler scheduler
   * @return direct executors
   */
  public static SorterExecutors direct(final TaskScheduler scheduler) {
    final Executor direct = Runnable::run;
    return new SorterExecutors(direct, direct, direct, scheduler, null);
  }

  @Override
  public void close() {
    for (AutoCloseable c : owned) {
      try {
        c.close();
      } catch (Exception e) {
        throw new IllegalStateException("Failed to close engine executor.", e);
      }
    }
  }

  private static ThreadFactory daemon(final String prefix) {
    final AtomicInteger n = new AtomicInteger();
    return r -> {
      final Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
