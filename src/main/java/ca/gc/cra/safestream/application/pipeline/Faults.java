package ca.gc.cra.safestream.application.pipeline;

import ca.gc.cra.safestream.domain.stream.ErrorChannel;
import ca.gc.cra.safestream.logging.Logs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Puts fault errors on an error channel even when the stage thread carries an interrupt. */
final class Faults {
  private static final Logger log = LoggerFactory.getLogger(Faults.class);

  private Faults() {}

  /**
   * Enqueues {@code fault}, clearing the interrupt flag for the duration of the put and restoring it afterwards.
   * Output channels are sized so the put never waits on a reader during shutdown.
   */
  static void report(ErrorChannel errors, StageFaultException fault) {
    boolean interrupted = Thread.interrupted();
    try {
      errors.put(fault);
    } catch (InterruptedException ex) {
      interrupted = true;
      log.error("{} could not report fault {}; interrupted while the error channel was full",
          fault.stage(), Logs.describe(fault.getCause()), fault);
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }
}
