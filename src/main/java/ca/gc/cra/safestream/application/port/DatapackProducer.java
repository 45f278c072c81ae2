package ca.gc.cra.safestream.application.port;

import ca.gc.cra.safestream.domain.stream.Datapack;
import java.util.Iterator;
import java.util.Objects;

/**
 * <strong>What:</strong> Port that yields the datapacks feeding a pipeline.
 * <p><strong>Why:</strong> Keeps the producer stage agnostic of where data comes from.</p>
 * <p><strong>Role:</strong> Driven by {@code SafeProducerStage} on its own thread until exhaustion or failure.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return a {@link Production} per call; a {@code null} datapack means nothing is ready this round.</li>
 *   <li>Signal exhaustion with {@code hasNext = false}; the stage stops calling afterwards.</li>
 *   <li>Report anticipated failures by throwing a checked exception; the stage forwards it unchanged.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Called from a single stage thread; implementations may be stateful.</p>
 *
 * @implNote Unchecked exceptions and errors are treated as runtime faults and wrapped before reporting.
 * @since 0.1.0
 */
@FunctionalInterface
public interface DatapackProducer {
  /**
   * Produces the next unit.
   *
   * @return production result; never {@code null}
   * @throws Exception to report a producer failure; the stage stops after forwarding it
   */
  Production next() throws Exception;

  /**
   * Adapts an iterator: each element is produced with {@code hasNext} mirroring the iterator, and an empty
   * iterator yields a single empty, final production.
   *
   * @param iterator source elements; {@code null} elements are produced as skipped rounds
   * @return producer backed by {@code iterator}
   */
  static DatapackProducer fromIterator(Iterator<? extends Datapack> iterator) {
    Objects.requireNonNull(iterator, "iterator");
    return () -> {
      if (!iterator.hasNext()) {
        return Production.exhausted();
      }
      Datapack datapack = iterator.next();
      return new Production(datapack, iterator.hasNext());
    };
  }

  /**
   * One result of {@link #next()}.
   *
   * @param datapack produced unit, or {@code null} to skip this round
   * @param hasNext {@code false} when this is the final result
   */
  record Production(Datapack datapack, boolean hasNext) {
    private static final Production EXHAUSTED = new Production(null, false);

    /** More units follow. */
    public static Production of(Datapack datapack) {
      return new Production(datapack, true);
    }

    /** Final unit. */
    public static Production last(Datapack datapack) {
      return new Production(datapack, false);
    }

    /** Nothing this round; keep polling. */
    public static Production skip() {
      return new Production(null, true);
    }

    /** Nothing this round and nothing ever again. */
    public static Production exhausted() {
      return EXHAUSTED;
    }
  }
}
