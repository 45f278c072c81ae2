package ca.gc.cra.safestream.application.port;

/**
 * <strong>What:</strong> Port abstracting stage metrics emission.
 * <p><strong>Why:</strong> Lets stages count items, errors, and faults without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from every stage thread.</p>
 * <p><strong>Performance:</strong> Calls happen per item and must not block.</p>
 *
 * @implNote Metric keys use dotted names such as {@code stream.transform.items}; keys must not be {@code null}.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier; must not be {@code null}
   * @param value observed value, for example nanoseconds
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
