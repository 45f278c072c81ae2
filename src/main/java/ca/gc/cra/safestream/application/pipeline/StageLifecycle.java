package ca.gc.cra.safestream.application.pipeline;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/** State holder shared by both stage kinds. */
final class StageLifecycle {
  private final AtomicReference<StageState> state = new AtomicReference<>(StageState.NOT_STARTED);
  private final CountDownLatch closed = new CountDownLatch(1);
  private volatile boolean faulted;

  void markRunning(String stageKind) {
    if (!state.compareAndSet(StageState.NOT_STARTED, StageState.RUNNING)) {
      throw new IllegalStateException(stageKind + " instances can only be started once");
    }
  }

  void markFinished(boolean fault) {
    faulted = fault;
    state.set(fault ? StageState.FAULTED : StageState.COMPLETED);
  }

  void markClosed() {
    state.set(StageState.CLOSED);
    closed.countDown();
  }

  StageState state() {
    return state.get();
  }

  boolean isFaulted() {
    return faulted;
  }

  boolean awaitClosed(Duration timeout) throws InterruptedException {
    Objects.requireNonNull(timeout, "timeout");
    return closed.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }
}
