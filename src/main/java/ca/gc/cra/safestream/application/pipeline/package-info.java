/**
 * <strong>Purpose:</strong> Fault-isolated pipeline stages and their composition.
 * <p><strong>Pipeline role:</strong> Application layer; {@link ca.gc.cra.safestream.application.pipeline.SafeProducerStage}
 * feeds a chain of {@link ca.gc.cra.safestream.application.pipeline.SafeTransformStage}s, each on its own thread.</p>
 * <p><strong>Concurrency:</strong> Stages share nothing but the channel pair at their boundary. Each stage is the
 * only writer of the pair it builds and closes it exactly once.</p>
 * <p><strong>Failure handling:</strong> Reported errors and captured runtime faults travel through error channels;
 * nothing thrown inside a stage escapes its thread.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code stream.producer.*}, {@code stream.transform.*}, and
 * {@code stream.stage.*} namespaces.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.safestream.application.pipeline;
