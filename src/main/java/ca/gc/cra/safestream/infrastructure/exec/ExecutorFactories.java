package ca.gc.cra.safestream.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the threads that run pipeline stages.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);
  private static final String DEFAULT_PREFIX = "safestream-stage";
  private static final AtomicInteger STAGE_SEQUENCE = new AtomicInteger();

  private ExecutorFactories() {}

  /**
   * Builds a thread factory for stage threads. Every thread gets a process-wide unique name.
   *
   * @param prefix thread-name prefix; blank values fall back to {@code safestream-stage}
   * @param daemon whether created threads are daemon threads
   * @param handler uncaught exception handler; {@code null} installs one that logs at ERROR
   * @return thread factory producing unstarted threads
   */
  public static ThreadFactory newStageThreadFactory(
      String prefix, boolean daemon, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? DEFAULT_PREFIX : prefix;
    UncaughtExceptionHandler effectiveHandler = handler != null ? handler : ExecutorFactories::logUncaught;
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + STAGE_SEQUENCE.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }

  private static void logUncaught(Thread thread, Throwable ex) {
    log.error("Uncaught failure escaped stage thread {}", thread.getName(), ex);
  }
}
