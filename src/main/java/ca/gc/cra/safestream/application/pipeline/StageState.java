package ca.gc.cra.safestream.application.pipeline;

/**
 * Lifecycle of a single stage instance: {@code NOT_STARTED -> RUNNING -> (COMPLETED | FAULTED) -> CLOSED}.
 *
 * <p>A stage never leaves {@link #CLOSED} and is never restarted.</p>
 *
 * @since 0.1.0
 */
public enum StageState {
  NOT_STARTED,
  RUNNING,
  /** Main loop ended without a runtime fault; cleanup in progress. */
  COMPLETED,
  /** A runtime fault was captured and reported; cleanup in progress. */
  FAULTED,
  /** Both output channels are closed and the finalizer, if any, has run. */
  CLOSED
}
