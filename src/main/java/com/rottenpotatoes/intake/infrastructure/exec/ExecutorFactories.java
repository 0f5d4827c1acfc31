package com.rottenpotatoes.intake.infrastructure.exec;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for executors that run remote event delivery off the request path.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Builds a small daemon pool for HTTP client callbacks.
   *
   * <p>Daemon threads keep a pending remote delivery from holding the JVM open after the CLI finishes.
   * Uncaught exceptions are logged at DEBUG since sink failures are non-critical.</p>
   *
   * @param size number of worker threads; must be positive
   * @param prefix thread-name prefix; defaults to {@code intake-sink}
   * @return configured executor service
   */
  public static ExecutorService newSinkPool(int size, String prefix) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "intake-sink" : prefix;
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(true);
          thread.setUncaughtExceptionHandler(
              (t, ex) -> log.debug("Uncaught exception on {}", t.getName(), ex));
          return thread;
        };
    ThreadPoolExecutor executor = new ThreadPoolExecutor(
        size, size, 30L, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), factory);
    executor.allowCoreThreadTimeOut(true);
    return executor;
  }
}
