package ca.gc.cra.warden.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the engine's long-lived worker threads: capture, processing and the sweep timer.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Builds a thread factory producing named non-daemon threads with an uncaught exception handler.
   *
   * @param prefix thread-name prefix used to tag threads
   * @param handler uncaught exception handler installed on each thread
   * @return thread factory
   */
  public static ThreadFactory newThreadFactory(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "warden-worker" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(
        handler, (t, ex) -> log.error("Uncaught failure on {}", t.getName(), ex));
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(false);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }

  /**
   * Builds a fixed-size executor for long-running worker loops.
   *
   * @param size number of worker threads to allocate
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newWorkerPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(size),
        newThreadFactory(prefix, handler),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds a single-threaded scheduler for periodic maintenance tasks.
   *
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on the scheduler thread
   * @return scheduler that drops pending periodic tasks on shutdown
   */
  public static ScheduledExecutorService newScheduler(String prefix, UncaughtExceptionHandler handler) {
    ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, newThreadFactory(prefix, handler));
    scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    scheduler.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    scheduler.setRemoveOnCancelPolicy(true);
    return scheduler;
  }
}
