package ca.gc.cra.safestream.domain.stream;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * <strong>What:</strong> Closable, bounded, FIFO queue of errors between one writer and one reader.
 * <p><strong>Why:</strong> Carries producer, handler, fault, and relayed errors alongside the data stream without
 * ever dropping one, while bounding how many can pile up.</p>
 * <p><strong>Role:</strong> Error half of a {@link StreamPair}.</p>
 * <p><strong>Thread-safety:</strong> One writer calls {@link #put(Throwable)} and {@link #close()}; one reader calls
 * {@link #check()}. {@link #close()} is idempotent.</p>
 * <p><strong>Performance:</strong> {@link #check()} waits at most the poll interval when the queue is empty and
 * open, so drain loops never busy-spin.</p>
 *
 * @implNote The writer enqueues before it closes, so a reader that observes the closed flag also sees every
 *     buffered error.
 * @since 0.1.0
 */
public final class ErrorChannel {
  /** Capacity used when none is configured. */
  public static final int DEFAULT_CAPACITY = 8;
  /** Longest time {@link #check()} waits on an empty open channel. */
  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(10);

  private final BlockingQueue<Throwable> queue;
  private final int capacity;
  private final long pollNanos;
  private volatile boolean closed;

  public ErrorChannel() {
    this(DEFAULT_CAPACITY, DEFAULT_POLL_INTERVAL);
  }

  public ErrorChannel(int capacity) {
    this(capacity, DEFAULT_POLL_INTERVAL);
  }

  /**
   * Creates an error channel.
   *
   * @param capacity number of errors buffered before {@link #put(Throwable)} blocks; must be positive
   * @param pollInterval longest wait inside {@link #check()}; must be positive
   */
  public ErrorChannel(int capacity, Duration pollInterval) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    Objects.requireNonNull(pollInterval, "pollInterval");
    if (pollInterval.isZero() || pollInterval.isNegative()) {
      throw new IllegalArgumentException("pollInterval must be positive");
    }
    this.capacity = capacity;
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.pollNanos = pollInterval.toNanos();
  }

  /**
   * Appends an error, blocking while the channel is full.
   *
   * @param error error to enqueue; must not be {@code null}
   * @throws InterruptedException if interrupted while waiting for space
   * @throws IllegalStateException if the channel has already been closed
   */
  public void put(Throwable error) throws InterruptedException {
    Objects.requireNonNull(error, "error");
    if (closed) {
      throw new IllegalStateException("error channel already closed", error);
    }
    queue.put(error);
  }

  /**
   * Dequeues the next error or reports whether the channel is finished.
   *
   * @return an error when one is buffered; {@code done} when closed and drained; otherwise pending
   * @throws InterruptedException if interrupted while polling
   */
  public ErrorCheck check() throws InterruptedException {
    Throwable error = queue.poll();
    if (error != null) {
      return ErrorCheck.of(error);
    }
    if (closed) {
      return drainedOrNext();
    }
    error = queue.poll(pollNanos, TimeUnit.NANOSECONDS);
    if (error != null) {
      return ErrorCheck.of(error);
    }
    return closed ? drainedOrNext() : ErrorCheck.pending();
  }

  /** Marks that no further errors will be appended. Buffered errors remain readable. */
  public void close() {
    closed = true;
  }

  public boolean isClosed() {
    return closed;
  }

  public int capacity() {
    return capacity;
  }

  /** Number of errors currently buffered. */
  public int size() {
    return queue.size();
  }

  private ErrorCheck drainedOrNext() {
    Throwable error = queue.poll();
    return error != null ? ErrorCheck.of(error) : ErrorCheck.finished();
  }
}
