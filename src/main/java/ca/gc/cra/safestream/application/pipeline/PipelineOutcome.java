package ca.gc.cra.safestream.application.pipeline;

import java.util.List;
import java.util.Optional;

/**
 * Result of draining a pipeline's terminal pair.
 *
 * @param items number of datapacks handed to the terminal consumer
 * @param errors every error observed, in the order drained
 * @since 0.1.0
 */
public record PipelineOutcome(long items, List<Throwable> errors) {
  public PipelineOutcome {
    errors = List.copyOf(errors);
  }

  /** {@code true} when the pipeline completed exhaustively without any error. */
  public boolean isClean() {
    return errors.isEmpty();
  }

  public Optional<Throwable> firstError() {
    return errors.stream().findFirst();
  }
}
