/**
 * <strong>Purpose:</strong> YAML-backed configuration for pipeline stages and metrics export.
 * <p><strong>Concurrency:</strong> Loaders are stateless; loaded configuration is immutable.
 * <p><strong>Validation:</strong> Malformed documents and out-of-range values raise
 * {@link java.lang.IllegalArgumentException}; missing files fall back to defaults.
 *
 * @since 0.1.0
 */
package ca.gc.cra.safestream.config;
