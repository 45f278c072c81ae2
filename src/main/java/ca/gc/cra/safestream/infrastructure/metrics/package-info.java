/**
 * Metrics adapter bridging {@link ca.gc.cra.safestream.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> The adapter is thread-safe and shared by all stages of a pipeline.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code stream.*} namespace; payload contents are never exported.</p>
 */
package ca.gc.cra.safestream.infrastructure.metrics;
