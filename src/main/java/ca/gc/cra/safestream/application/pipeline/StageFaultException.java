package ca.gc.cra.safestream.application.pipeline;

import ca.gc.cra.safestream.logging.Logs;
import java.util.Objects;

/**
 * Runtime fault captured at a stage's task boundary and reported through its error channel.
 *
 * <p>The original failure is kept as the cause; the message names the stage that faulted.</p>
 *
 * @since 0.1.0
 */
public final class StageFaultException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String stage;

  /**
   * Wraps a runtime fault.
   *
   * @param stage name of the faulting stage
   * @param cause captured failure; must not be {@code null}
   */
  public StageFaultException(String stage, Throwable cause) {
    super(stage + " faulted: " + Logs.describe(Objects.requireNonNull(cause, "cause")), cause);
    this.stage = stage;
  }

  public String stage() {
    return stage;
  }
}
