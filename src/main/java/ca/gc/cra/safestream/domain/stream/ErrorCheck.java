package ca.gc.cra.safestream.domain.stream;

import java.util.Objects;

/**
 * Result of a single {@link ErrorChannel#check()} call.
 *
 * <p>Exactly one of three shapes: an error was dequeued, the channel is empty but still open ("pending"), or the
 * channel is closed and fully drained ("done").</p>
 *
 * @param error dequeued error, or {@code null} when none was available
 * @param done {@code true} once the channel is closed and no buffered error remains
 * @since 0.1.0
 */
public record ErrorCheck(Throwable error, boolean done) {
  private static final ErrorCheck PENDING = new ErrorCheck(null, false);
  private static final ErrorCheck DONE = new ErrorCheck(null, true);

  public ErrorCheck {
    if (error != null && done) {
      throw new IllegalArgumentException("an error result cannot also be done");
    }
  }

  static ErrorCheck of(Throwable error) {
    return new ErrorCheck(Objects.requireNonNull(error, "error"), false);
  }

  static ErrorCheck pending() {
    return PENDING;
  }

  static ErrorCheck finished() {
    return DONE;
  }

  public boolean hasError() {
    return error != null;
  }

  public boolean isPending() {
    return error == null && !done;
  }
}
