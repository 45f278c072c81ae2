/**
 * <strong>Purpose:</strong> Logging utilities that keep stage diagnostics bounded and single-line.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe when invoked from concurrent stages.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.safestream.logging;
