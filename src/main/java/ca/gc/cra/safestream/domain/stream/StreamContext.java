package ca.gc.cra.safestream.domain.stream;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * <strong>What:</strong> Immutable context carried alongside every {@link Datapack}.
 * <p><strong>Why:</strong> Lets producers hand cancellation, deadlines, and request metadata to handlers without
 * the pipeline core interpreting them.</p>
 * <p><strong>Role:</strong> Domain value; each derived context points at its parent so lookups walk the chain.</p>
 * <p><strong>Thread-safety:</strong> Immutable apart from the cancellation flag, which is atomic.</p>
 *
 * @implNote The pipeline stages never cancel a context; cancellation is owned by the application.
 * @since 0.1.0
 */
public final class StreamContext {
  private static final StreamContext BACKGROUND = new StreamContext(null, null, null, null, null);

  private final StreamContext parent;
  private final Object key;
  private final Object value;
  private final Instant deadline;
  private final AtomicBoolean cancelled;

  private StreamContext(
      StreamContext parent, Object key, Object value, Instant deadline, AtomicBoolean cancelled) {
    this.parent = parent;
    this.key = key;
    this.value = value;
    this.deadline = deadline;
    this.cancelled = cancelled;
  }

  /**
   * Returns the empty root context: no values, no deadline, never cancelled.
   *
   * @return shared root context
   */
  public static StreamContext background() {
    return BACKGROUND;
  }

  /**
   * Derives a context that additionally maps {@code key} to {@code value}.
   *
   * @param key lookup key; must not be {@code null}
   * @param value associated value; must not be {@code null}
   * @return child context
   */
  public StreamContext withValue(Object key, Object value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    return new StreamContext(this, key, value, deadline, null);
  }

  /**
   * Derives a context whose deadline is the earlier of {@code deadline} and the inherited one.
   *
   * @param deadline absolute deadline; must not be {@code null}
   * @return child context
   */
  public StreamContext withDeadline(Instant deadline) {
    Objects.requireNonNull(deadline, "deadline");
    Instant effective = this.deadline == null || deadline.isBefore(this.deadline) ? deadline : this.deadline;
    return new StreamContext(this, null, null, effective, null);
  }

  /**
   * Derives a cancellable context. Cancelling it does not affect the parent.
   *
   * @return child context owning a fresh cancellation flag
   */
  public StreamContext withCancellation() {
    return new StreamContext(this, null, null, deadline, new AtomicBoolean());
  }

  /**
   * Looks up the value bound to {@code key}, searching from this context towards the root.
   *
   * @param key lookup key
   * @return bound value when present
   */
  public Optional<Object> value(Object key) {
    for (StreamContext current = this; current != null; current = current.parent) {
      if (current.key != null && current.key.equals(key)) {
        return Optional.of(current.value);
      }
    }
    return Optional.empty();
  }

  /**
   * Typed variant of {@link #value(Object)}.
   *
   * @param key lookup key
   * @param type expected value type
   * @param <T> value type
   * @return bound value when present and assignable to {@code type}
   */
  public <T> Optional<T> value(Object key, Class<T> type) {
    Objects.requireNonNull(type, "type");
    return value(key).filter(type::isInstance).map(type::cast);
  }

  public Optional<Instant> deadline() {
    return Optional.ofNullable(deadline);
  }

  /**
   * Indicates whether the deadline has passed according to {@code clock}.
   *
   * @param clock time source
   * @return {@code true} when a deadline exists and is not after {@code clock.instant()}
   */
  public boolean isExpired(Clock clock) {
    Objects.requireNonNull(clock, "clock");
    return deadline != null && !deadline.isAfter(clock.instant());
  }

  /**
   * Cancels the nearest cancellable context in the chain.
   *
   * @return {@code true} if a cancellation flag was found and set; {@code false} for non-cancellable chains
   */
  public boolean cancel() {
    for (StreamContext current = this; current != null; current = current.parent) {
      if (current.cancelled != null) {
        current.cancelled.set(true);
        return true;
      }
    }
    return false;
  }

  /**
   * Reports whether this context or any ancestor has been cancelled.
   *
   * @return {@code true} once cancelled
   */
  public boolean isCancelled() {
    for (StreamContext current = this; current != null; current = current.parent) {
      if (current.cancelled != null && current.cancelled.get()) {
        return true;
      }
    }
    return false;
  }
}
