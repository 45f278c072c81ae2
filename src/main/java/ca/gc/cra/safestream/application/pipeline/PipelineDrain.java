package ca.gc.cra.safestream.application.pipeline;

import ca.gc.cra.safestream.domain.stream.Datapack;
import ca.gc.cra.safestream.domain.stream.ErrorChannel;
import ca.gc.cra.safestream.domain.stream.ErrorCheck;
import ca.gc.cra.safestream.domain.stream.StreamPair;
import ca.gc.cra.safestream.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Terminal consumption of a pipeline's last {@link StreamPair}.
 * <p><strong>Why:</strong> A closed data channel alone does not say whether the pipeline succeeded; the error
 * channel must be drained as well. This helper does both in the right order.</p>
 * <p><strong>Thread-safety:</strong> Runs on the calling thread, which becomes the pair's single reader.</p>
 *
 * @since 0.1.0
 */
public final class PipelineDrain {
  private static final Logger log = LoggerFactory.getLogger(PipelineDrain.class);

  private PipelineDrain() {}

  /**
   * Reads every datapack until the data channel closes, then drains the error channel to completion.
   * <p>If {@code consumer} throws, the data channel is closed so upstream stages stop, and the exception is
   * recorded as the first error of the outcome. An interrupt or an {@link Error} also closes the data channel
   * before it propagates.</p>
   *
   * @param terminal pair to consume
   * @param consumer receives each datapack in order
   * @return item count and every observed error
   * @throws InterruptedException if interrupted while waiting on either channel
   */
  public static PipelineOutcome drain(StreamPair terminal, Consumer<? super Datapack> consumer)
      throws InterruptedException {
    Objects.requireNonNull(terminal, "terminal");
    Objects.requireNonNull(consumer, "consumer");
    long items = 0;
    List<Throwable> errors = new ArrayList<>();
    boolean exhausted = false;
    try {
      for (Optional<Datapack> next = terminal.data().read(); next.isPresent(); next = terminal.data().read()) {
        consumer.accept(next.get());
        items++;
      }
      exhausted = true;
    } catch (RuntimeException ex) {
      log.debug("Terminal consumer failed after {} items: {}", items, Logs.describe(ex));
      errors.add(ex);
    } finally {
      if (!exhausted) {
        // Any early exit abandons the stream so upstream writers are released.
        terminal.data().close();
      }
    }
    errors.addAll(drainErrors(terminal.errors()));
    return new PipelineOutcome(items, errors);
  }

  /**
   * Drains an error channel until it reports done.
   *
   * @param errors channel to drain
   * @return drained errors in queue order
   * @throws InterruptedException if interrupted while polling
   */
  public static List<Throwable> drainErrors(ErrorChannel errors) throws InterruptedException {
    Objects.requireNonNull(errors, "errors");
    List<Throwable> drained = new ArrayList<>();
    while (true) {
      ErrorCheck check = errors.check();
      if (check.done()) {
        return drained;
      }
      if (check.hasError()) {
        drained.add(check.error());
      }
    }
  }
}
