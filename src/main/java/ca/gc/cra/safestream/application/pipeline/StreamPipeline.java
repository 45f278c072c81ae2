package ca.gc.cra.safestream.application.pipeline;

import ca.gc.cra.safestream.application.port.DatapackHandler;
import ca.gc.cra.safestream.application.port.DatapackMapper;
import ca.gc.cra.safestream.application.port.DatapackProducer;
import ca.gc.cra.safestream.domain.stream.Datapack;
import ca.gc.cra.safestream.domain.stream.StreamPair;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fluent composition of one {@link SafeProducerStage} followed by any number of {@link SafeTransformStage}s.
 * <p>Stages are constructed and started by {@link #start()}, producer first, each transform consuming the pair
 * returned by its predecessor. A pipeline is started at most once.</p>
 *
 * <pre>{@code
 * PipelineOutcome outcome = StreamPipeline.from(producer, settings)
 *     .map(decompress)
 *     .then(store, store::release)
 *     .run(datapack -> {});
 * }</pre>
 *
 * @since 0.1.0
 */
public final class StreamPipeline {
  private static final Logger log = LoggerFactory.getLogger(StreamPipeline.class);

  private final DatapackProducer producer;
  private final StageSettings settings;
  private final List<Function<StreamPair, SafeTransformStage>> transformFactories = new ArrayList<>();
  private final List<SafeTransformStage> transformStages = new ArrayList<>();
  private SafeProducerStage producerStage;

  private StreamPipeline(DatapackProducer producer, StageSettings settings) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  public static StreamPipeline from(DatapackProducer producer) {
    return new StreamPipeline(producer, StageSettings.defaults());
  }

  public static StreamPipeline from(DatapackProducer producer, StageSettings settings) {
    return new StreamPipeline(producer, settings);
  }

  /** Appends a consuming stage; see {@link #then(DatapackHandler, Runnable)}. */
  public StreamPipeline then(DatapackHandler handler) {
    return then(handler, null);
  }

  /**
   * Appends a transform stage running {@code handler}. A {@code null} handler appends a pass-through.
   *
   * @param handler per-item handler
   * @param finalizer callback run once after the stage's cleanup; may be {@code null}
   * @return this pipeline
   */
  public synchronized StreamPipeline then(DatapackHandler handler, Runnable finalizer) {
    ensureNotStarted();
    transformFactories.add(upstream -> new SafeTransformStage(upstream, handler, finalizer, settings));
    return this;
  }

  /** Appends a mapping stage; see {@link #map(DatapackMapper, Runnable)}. */
  public StreamPipeline map(DatapackMapper mapper) {
    return map(mapper, null);
  }

  /**
   * Appends a transform stage that emits the result of {@code mapper} for each item.
   *
   * @param mapper per-item mapping
   * @param finalizer callback run once after the stage's cleanup; may be {@code null}
   * @return this pipeline
   */
  public synchronized StreamPipeline map(DatapackMapper mapper, Runnable finalizer) {
    Objects.requireNonNull(mapper, "mapper");
    ensureNotStarted();
    transformFactories.add(upstream -> SafeTransformStage.mapping(upstream, mapper, finalizer, settings));
    return this;
  }

  /**
   * Builds and starts every stage.
   *
   * @return terminal pair for the application to consume
   * @throws IllegalStateException if the pipeline was already started
   */
  public synchronized StreamPair start() {
    ensureNotStarted();
    producerStage = new SafeProducerStage(producer, settings);
    StreamPair current = producerStage.start();
    for (Function<StreamPair, SafeTransformStage> factory : transformFactories) {
      SafeTransformStage stage = factory.apply(current);
      transformStages.add(stage);
      current = stage.start();
    }
    log.debug("Started pipeline with {} transform stages", transformStages.size());
    return current;
  }

  /**
   * Starts the pipeline and drains its terminal pair on the calling thread.
   *
   * @param consumer receives every datapack leaving the last stage
   * @return outcome of the run
   * @throws InterruptedException if interrupted while draining
   */
  public PipelineOutcome run(Consumer<? super Datapack> consumer) throws InterruptedException {
    return PipelineDrain.drain(start(), consumer);
  }

  public synchronized Optional<SafeProducerStage> producerStage() {
    return Optional.ofNullable(producerStage);
  }

  public synchronized List<SafeTransformStage> transformStages() {
    return List.copyOf(transformStages);
  }

  /**
   * Waits for every started stage to terminate.
   *
   * @param timeout total time budget shared by all stages
   * @return {@code true} if every stage terminated in time; {@code false} if not started or timed out
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    Objects.requireNonNull(timeout, "timeout");
    SafeProducerStage first;
    List<SafeTransformStage> rest;
    synchronized (this) {
      first = producerStage;
      rest = List.copyOf(transformStages);
    }
    if (first == null) {
      return false;
    }
    long deadline = System.nanoTime() + timeout.toNanos();
    if (!first.awaitTermination(remaining(deadline))) {
      return false;
    }
    for (SafeTransformStage stage : rest) {
      if (!stage.awaitTermination(remaining(deadline))) {
        return false;
      }
    }
    return true;
  }

  private void ensureNotStarted() {
    if (producerStage != null) {
      throw new IllegalStateException("pipeline already started");
    }
  }

  private static Duration remaining(long deadlineNanos) {
    return Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime()));
  }
}
