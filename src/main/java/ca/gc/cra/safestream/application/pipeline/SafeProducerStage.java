package ca.gc.cra.safestream.application.pipeline;

import ca.gc.cra.safestream.application.port.DatapackProducer;
import ca.gc.cra.safestream.application.port.DatapackProducer.Production;
import ca.gc.cra.safestream.application.port.MetricsPort;
import ca.gc.cra.safestream.domain.stream.DataChannel;
import ca.gc.cra.safestream.domain.stream.Datapack;
import ca.gc.cra.safestream.domain.stream.ErrorChannel;
import ca.gc.cra.safestream.domain.stream.StreamPair;
import ca.gc.cra.safestream.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.safestream.logging.Logs;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a {@link DatapackProducer} on its own thread and exposes its output as a {@link StreamPair}.
 * <p>The stage writes every non-null datapack to the output data channel and stops when the producer is
 * exhausted, reports an error, or the reader closes the data channel. A runtime fault is wrapped in
 * {@link StageFaultException} and reported like any other error. However the loop ends, the error channel is
 * closed before the data channel, exactly once, so a reader that sees the data channel close can drain errors
 * to completion without waiting.</p>
 * <p>Instances are not reusable; invoke {@link #start()} at most once.</p>
 *
 * @since 0.1.0
 */
public final class SafeProducerStage {
  private static final Logger log = LoggerFactory.getLogger(SafeProducerStage.class);
  private static final String STAGE_KIND = "SafeProducerStage";

  private final DatapackProducer producer;
  private final StageSettings settings;
  private final MetricsPort metrics;
  private final StageLifecycle lifecycle = new StageLifecycle();

  private volatile String name = STAGE_KIND;

  public SafeProducerStage(DatapackProducer producer) {
    this(producer, StageSettings.defaults());
  }

  /**
   * Creates a producer stage.
   *
   * @param producer source of datapacks
   * @param settings stage tuning; the error capacity sizes this stage's error channel
   */
  public SafeProducerStage(DatapackProducer producer, StageSettings settings) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = settings.metrics();
  }

  /**
   * Builds the output pair and launches the producing thread. Callers may read from the pair immediately.
   *
   * @return output pair owned by this stage; the caller holds the read side
   * @throws IllegalStateException if the stage was already started
   */
  public StreamPair start() {
    lifecycle.markRunning(STAGE_KIND);
    StreamPair output = new StreamPair(
        new DataChannel<>(), new ErrorChannel(settings.errorCapacity(), settings.errorPollInterval()));
    Thread thread = ExecutorFactories
        .newStageThreadFactory(settings.threadPrefix(), settings.daemonThreads(), null)
        .newThread(() -> run(output));
    name = STAGE_KIND + "[" + thread.getName() + "]";
    thread.start();
    log.debug("{} started", name);
    return output;
  }

  public StageState state() {
    return lifecycle.state();
  }

  /** Whether a runtime fault was captured. Meaningful once the stage has finished. */
  public boolean isFaulted() {
    return lifecycle.isFaulted();
  }

  /**
   * Waits for the stage to close both output channels.
   *
   * @param timeout maximum wait
   * @return {@code true} if the stage reached {@link StageState#CLOSED} in time
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return lifecycle.awaitClosed(timeout);
  }

  private void run(StreamPair output) {
    boolean faulted = false;
    try {
      produce(output);
    } catch (Throwable ex) {
      faulted = true;
      if (ex instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      metrics.increment("stream.stage.faults");
      log.warn("{} faulted; reporting {}", name, Logs.describe(ex), ex);
      Faults.report(output.errors(), new StageFaultException(name, ex));
    } finally {
      lifecycle.markFinished(faulted);
      try {
        output.errors().close();
        output.data().close();
      } finally {
        lifecycle.markClosed();
        log.debug("{} closed (faulted={})", name, faulted);
      }
    }
  }

  private void produce(StreamPair output) throws InterruptedException {
    while (true) {
      Production production;
      try {
        production = producer.next();
      } catch (InterruptedException | RuntimeException ex) {
        throw ex;
      } catch (Exception ex) {
        metrics.increment("stream.producer.errors");
        log.debug("{} producer reported {}", name, Logs.describe(ex));
        output.errors().put(ex);
        return;
      }
      if (production == null) {
        throw new IllegalStateException("producer returned a null production");
      }

      Datapack datapack = production.datapack();
      if (datapack == null) {
        metrics.increment("stream.producer.skipped");
        if (!production.hasNext()) {
          return;
        }
        continue;
      }

      if (output.data().write(datapack)) {
        log.debug("{} output closed by its reader; stopping", name);
        return;
      }
      metrics.increment("stream.producer.items");
      if (!production.hasNext()) {
        return;
      }
    }
  }
}
