package ca.gc.cra.safestream.config;

import ca.gc.cra.safestream.application.pipeline.StageSettings;
import ca.gc.cra.safestream.application.port.MetricsPort;
import ca.gc.cra.safestream.domain.stream.ErrorChannel;
import ca.gc.cra.safestream.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Operator-facing configuration for pipeline stages.
 * <p><strong>Why:</strong> Lets deployments size error channels, name stage threads, and enable metrics export
 * without code changes.</p>
 * <p><strong>Role:</strong> Composition helper; {@link #toStageSettings()} produces the {@link StageSettings} passed
 * to stages.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * <p>Recognized keys (flattened YAML):</p>
 * <ul>
 *   <li>{@code errorCapacity} - producer error channel capacity (positive integer)</li>
 *   <li>{@code errorPollMillis} - longest wait of one error-channel check (positive integer)</li>
 *   <li>{@code threadPrefix} - stage thread name prefix</li>
 *   <li>{@code daemonThreads} - {@code true} or {@code false}</li>
 *   <li>{@code metrics.exporter} - {@code none} or {@code otlp}</li>
 *   <li>{@code metrics.endpoint} - OTLP collector endpoint</li>
 *   <li>{@code metrics.intervalSeconds} - export interval (positive integer)</li>
 * </ul>
 *
 * @since 0.1.0
 */
public record StreamConfig(
    int errorCapacity,
    Duration errorPollInterval,
    String threadPrefix,
    boolean daemonThreads,
    String metricsExporter,
    String metricsEndpoint,
    Duration metricsInterval) {
  static final String DEFAULT_EXPORTER = "none";
  static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  static final Duration DEFAULT_METRICS_INTERVAL = Duration.ofSeconds(30);
  private static final Set<String> EXPORTERS = Set.of("none", "otlp");

  /**
   * Validates the configuration.
   *
   * @throws IllegalArgumentException when a numeric value is not positive or the exporter is unknown
   */
  public StreamConfig {
    if (errorCapacity <= 0) {
      throw new IllegalArgumentException("errorCapacity must be positive");
    }
    requirePositive(errorPollInterval, "errorPollInterval");
    requirePositive(metricsInterval, "metricsInterval");
    threadPrefix = Objects.requireNonNullElse(threadPrefix, StageSettings.DEFAULT_THREAD_PREFIX);
    metricsExporter = Objects.requireNonNullElse(metricsExporter, DEFAULT_EXPORTER).trim().toLowerCase(Locale.ROOT);
    if (!EXPORTERS.contains(metricsExporter)) {
      throw new IllegalArgumentException("metrics.exporter must be one of " + EXPORTERS + " but was " + metricsExporter);
    }
    metricsEndpoint = Objects.requireNonNullElse(metricsEndpoint, DEFAULT_ENDPOINT);
  }

  public static StreamConfig defaults() {
    return new StreamConfig(
        ErrorChannel.DEFAULT_CAPACITY,
        ErrorChannel.DEFAULT_POLL_INTERVAL,
        StageSettings.DEFAULT_THREAD_PREFIX,
        false,
        DEFAULT_EXPORTER,
        DEFAULT_ENDPOINT,
        DEFAULT_METRICS_INTERVAL);
  }

  /**
   * Builds a configuration from flattened key/value pairs; absent or blank keys keep their defaults.
   *
   * @param values flattened configuration
   * @return validated configuration
   * @throws IllegalArgumentException when a value cannot be parsed or is out of range
   */
  public static StreamConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    StreamConfig d = defaults();
    return new StreamConfig(
        parseInt(values, "errorCapacity", d.errorCapacity()),
        Duration.ofMillis(parseInt(values, "errorPollMillis", (int) d.errorPollInterval().toMillis())),
        text(values, "threadPrefix", d.threadPrefix()),
        parseBoolean(values, "daemonThreads", d.daemonThreads()),
        text(values, "metrics.exporter", d.metricsExporter()),
        text(values, "metrics.endpoint", d.metricsEndpoint()),
        Duration.ofSeconds(parseInt(values, "metrics.intervalSeconds", (int) d.metricsInterval().toSeconds())));
  }

  /**
   * Loads {@code section} (merged over {@code common}) from a YAML file; a missing file yields defaults.
   *
   * @param path YAML file
   * @param section section name
   * @return validated configuration
   * @throws IOException when the file exists but cannot be read
   */
  public static StreamConfig load(Path path, String section) throws IOException {
    return YamlConfigLoader.load(path, section).map(StreamConfig::fromMap).orElseGet(StreamConfig::defaults);
  }

  /** Classpath variant of {@link #load(Path, String)}, e.g. for the bundled {@code safestream.yaml}. */
  public static StreamConfig loadResource(String resource, String section) throws IOException {
    return YamlConfigLoader.loadResource(resource, section)
        .map(StreamConfig::fromMap)
        .orElseGet(StreamConfig::defaults);
  }

  /**
   * Creates the metrics sink selected by {@link #metricsExporter()}.
   *
   * @return no-op metrics for {@code none}; otherwise an OpenTelemetry adapter the caller should close on shutdown
   */
  public MetricsPort createMetrics() {
    if (DEFAULT_EXPORTER.equals(metricsExporter)) {
      return MetricsPort.NO_OP;
    }
    return OpenTelemetryMetricsAdapter.create(metricsExporter, metricsEndpoint, metricsInterval);
  }

  /** Stage settings using {@link #createMetrics()}. */
  public StageSettings toStageSettings() {
    return toStageSettings(createMetrics());
  }

  public StageSettings toStageSettings(MetricsPort metrics) {
    return new StageSettings(errorCapacity, errorPollInterval, threadPrefix, daemonThreads, metrics);
  }

  private static void requirePositive(Duration value, String name) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
  }

  private static String text(Map<String, String> values, String key, String fallback) {
    String raw = values.get(key);
    return raw == null || raw.isBlank() ? fallback : raw.trim();
  }

  private static int parseInt(Map<String, String> values, String key, int fallback) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer but was '" + raw + "'", ex);
    }
  }

  private static boolean parseBoolean(Map<String, String> values, String key, boolean fallback) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new IllegalArgumentException(key + " must be a boolean but was '" + raw + "'");
    };
  }
}
