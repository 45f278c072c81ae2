package ca.gc.cra.safestream.application.pipeline;

import ca.gc.cra.safestream.application.port.MetricsPort;
import ca.gc.cra.safestream.domain.stream.ErrorChannel;
import java.time.Duration;
import java.util.Objects;

/**
 * Tuning shared by the stages of a pipeline.
 *
 * @param errorCapacity capacity of the error channel built by a producer stage; transform stages derive theirs
 *     from upstream
 * @param errorPollInterval longest wait of a single error-channel check while draining
 * @param threadPrefix name prefix for stage threads
 * @param daemonThreads whether stage threads are daemon threads
 * @param metrics metrics sink for stage counters
 * @since 0.1.0
 */
public record StageSettings(
    int errorCapacity,
    Duration errorPollInterval,
    String threadPrefix,
    boolean daemonThreads,
    MetricsPort metrics) {
  public static final String DEFAULT_THREAD_PREFIX = "safestream-stage";

  /**
   * Validates and normalizes settings.
   *
   * @throws IllegalArgumentException when the capacity or poll interval is not positive
   */
  public StageSettings {
    if (errorCapacity <= 0) {
      throw new IllegalArgumentException("errorCapacity must be positive");
    }
    errorPollInterval = Objects.requireNonNullElse(errorPollInterval, ErrorChannel.DEFAULT_POLL_INTERVAL);
    if (errorPollInterval.isZero() || errorPollInterval.isNegative()) {
      throw new IllegalArgumentException("errorPollInterval must be positive");
    }
    threadPrefix = (threadPrefix == null || threadPrefix.isBlank()) ? DEFAULT_THREAD_PREFIX : threadPrefix.trim();
    metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Derives settings using the library defaults.
   *
   * @return default settings with no-op metrics
   */
  public static StageSettings defaults() {
    return new StageSettings(
        ErrorChannel.DEFAULT_CAPACITY, ErrorChannel.DEFAULT_POLL_INTERVAL, DEFAULT_THREAD_PREFIX, false, MetricsPort.NO_OP);
  }

  public StageSettings withErrorCapacity(int capacity) {
    return new StageSettings(capacity, errorPollInterval, threadPrefix, daemonThreads, metrics);
  }

  public StageSettings withThreadPrefix(String prefix) {
    return new StageSettings(errorCapacity, errorPollInterval, prefix, daemonThreads, metrics);
  }

  public StageSettings withMetrics(MetricsPort metricsPort) {
    return new StageSettings(errorCapacity, errorPollInterval, threadPrefix, daemonThreads, metricsPort);
  }
}
