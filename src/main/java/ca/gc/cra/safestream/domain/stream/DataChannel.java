package ca.gc.cra.safestream.domain.stream;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <strong>What:</strong> Closable single-slot hand-off between one writer thread and one reader thread.
 * <p><strong>Why:</strong> Gives stages strict FIFO delivery with backpressure, and a single close signal that
 * either side can raise to stop the other.</p>
 * <p><strong>Role:</strong> Data half of a {@link StreamPair}.</p>
 * <ul>
 *   <li>{@link #write(Object)} returns only once the reader has taken the item or the channel is closed.</li>
 *   <li>{@link #read()} returns an empty {@link Optional} once the channel is closed, even if an item was pending.</li>
 *   <li>{@link #close()} is idempotent and may be called concurrently from both sides.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for one writer and one reader; fan-in or fan-out is not supported.</p>
 *
 * @param <T> item type
 * @since 0.1.0
 */
public final class DataChannel<T> {
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition slotFree = lock.newCondition();
  private final Condition itemReady = lock.newCondition();
  private final Condition itemTaken = lock.newCondition();

  private T slot;
  private long written;
  private long taken;
  private boolean closed;

  /**
   * Offers {@code item} to the reader and waits until it is taken or the channel closes.
   *
   * @param item item to deliver; must not be {@code null}
   * @return {@code true} when the channel was closed before or during the attempt, in which case delivery is not
   *     guaranteed and the caller must stop writing; {@code false} once the reader has taken the item
   * @throws InterruptedException if the writer is interrupted while waiting
   */
  public boolean write(T item) throws InterruptedException {
    Objects.requireNonNull(item, "item");
    lock.lockInterruptibly();
    try {
      while (slot != null && !closed) {
        slotFree.await();
      }
      if (closed) {
        return true;
      }
      slot = item;
      long ticket = ++written;
      itemReady.signal();
      try {
        while (taken < ticket && !closed) {
          itemTaken.await();
        }
      } catch (InterruptedException ex) {
        withdraw(ticket);
        throw ex;
      }
      if (taken >= ticket) {
        return false;
      }
      withdraw(ticket);
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Takes the next item, waiting until one is offered or the channel closes.
   *
   * @return the next item, or empty once the channel is closed; no item follows an empty result
   * @throws InterruptedException if the reader is interrupted while waiting
   */
  public Optional<T> read() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (slot == null && !closed) {
        itemReady.await();
      }
      if (closed) {
        return Optional.empty();
      }
      T item = slot;
      slot = null;
      taken++;
      itemTaken.signalAll();
      slotFree.signal();
      return Optional.of(item);
    } finally {
      lock.unlock();
    }
  }

  /** Closes the channel and wakes any blocked writer or reader. Further calls have no effect. */
  public void close() {
    lock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      slotFree.signalAll();
      itemReady.signalAll();
      itemTaken.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  // Caller holds the lock.
  private void withdraw(long ticket) {
    if (taken < ticket) {
      slot = null;
      slotFree.signal();
    }
  }
}
