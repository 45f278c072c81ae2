/**
 * <strong>Purpose:</strong> Transport values and channel primitives that connect pipeline stages.
 * <p><strong>Pipeline role:</strong> Domain layer; {@link ca.gc.cra.safestream.domain.stream.DataChannel} and
 * {@link ca.gc.cra.safestream.domain.stream.ErrorChannel} are the only shared objects between stages.
 * <p><strong>Concurrency:</strong> Channels assume exactly one writer and one reader; {@code close()} is the only
 * operation either side may call.
 * <p><strong>Observability:</strong> No logging here; stages log around channel operations.
 *
 * @since 0.1.0
 */
package ca.gc.cra.safestream.domain.stream;
