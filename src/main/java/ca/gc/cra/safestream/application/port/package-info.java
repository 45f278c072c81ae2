/**
 * <strong>Purpose:</strong> Ports through which applications plug producers, handlers, and metrics into stages.
 * <p><strong>Pipeline role:</strong> Application layer; adapters and user code implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Producers, handlers, and mappers are invoked from a single stage thread;
 * {@link ca.gc.cra.safestream.application.port.MetricsPort} implementations are shared by all stages.</p>
 * <p><strong>Failure contract:</strong> checked exceptions are reported errors, unchecked ones are runtime faults.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.safestream.application.port;
