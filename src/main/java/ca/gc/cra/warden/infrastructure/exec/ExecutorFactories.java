package ca.gc.cra.warden.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the executors running moderation tasks.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Builds the bounded event pool. Submissions beyond {@code queueCapacity} pending tasks are rejected with
   * {@link java.util.concurrent.RejectedExecutionException} instead of blocking the caller.
   *
   * @param size number of worker threads to allocate
   * @param queueCapacity pending task bound
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newEventPool(
      int size, int queueCapacity, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be positive");
    }
    ThreadFactory factory = threadFactory(prefix, "warden-event", false, handler);
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(queueCapacity),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds a single-threaded daemon scheduler for housekeeping tasks.
   *
   * @param prefix thread-name prefix
   * @return scheduler that drops pending periodic runs on shutdown
   */
  public static ScheduledExecutorService newHousekeepingScheduler(String prefix) {
    ScheduledThreadPoolExecutor scheduler =
        new ScheduledThreadPoolExecutor(1, threadFactory(prefix, "warden-sweep", true, null));
    scheduler.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    return scheduler;
  }

  /**
   * Stops an executor, waiting up to {@code timeout} for running tasks before forcing termination.
   *
   * @param executor executor to stop; {@code null} is ignored
   * @param timeout graceful wait
   * @return {@code true} when the executor terminated within the timeout
   */
  public static boolean shutdownGracefully(ExecutorService executor, Duration timeout) {
    if (executor == null) {
      return true;
    }
    executor.shutdown();
    try {
      if (executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        return true;
      }
      int dropped = executor.shutdownNow().size();
      log.warn("Executor did not stop within {}; cancelled {} pending tasks", timeout, dropped);
      return false;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
      return false;
    }
  }

  private static ThreadFactory threadFactory(
      String prefix, String defaultPrefix, boolean daemon, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? defaultPrefix : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler,
        (t, ex) -> log.error("Uncaught exception on {}", t.getName(), ex));
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
