package ca.gc.cra.safestream.application.pipeline;

import ca.gc.cra.safestream.application.port.DatapackHandler;
import ca.gc.cra.safestream.application.port.DatapackMapper;
import ca.gc.cra.safestream.application.port.MetricsPort;
import ca.gc.cra.safestream.domain.stream.DataChannel;
import ca.gc.cra.safestream.domain.stream.Datapack;
import ca.gc.cra.safestream.domain.stream.ErrorChannel;
import ca.gc.cra.safestream.domain.stream.ErrorCheck;
import ca.gc.cra.safestream.domain.stream.StreamPair;
import ca.gc.cra.safestream.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.safestream.logging.Logs;
import java.io.InputStream;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumes an upstream {@link StreamPair} on its own thread, applying a {@link DatapackHandler} to every item.
 * <p>Without a handler the stage is a pass-through: {@link #buildStream()} and {@link #start()} return the
 * upstream pair and no thread is started. With a handler the stage owns a new output pair whose error channel
 * holds two more errors than upstream's, room for one handler error and one fault on top of everything relayed
 * from upstream, so relaying never blocks against an unread output during shutdown.</p>
 * <p>The stage thread runs three phases:</p>
 * <ol>
 *   <li>Read items until upstream closes. Items without a body are skipped. A handler error is put on the
 *   output, the upstream data channel is closed and reading stops. A reader closing the output data channel
 *   also closes upstream and stops reading.</li>
 *   <li>Relay every upstream error to the output until the upstream error channel reports done.</li>
 *   <li>Close the output error channel, then the output data channel, then run the finalizer. The stage is
 *   marked closed even when the finalizer throws; an {@link Error} from it then reaches the thread's uncaught
 *   exception handler.</li>
 * </ol>
 * <p>A runtime fault in either phase closes the upstream data channel at once, so an upstream writer blocked on
 * it is released, and one {@link StageFaultException} is put on the output.</p>
 * <p>Instances are not reusable; invoke {@link #start()} at most once.</p>
 *
 * @since 0.1.0
 */
public final class SafeTransformStage {
  private static final Logger log = LoggerFactory.getLogger(SafeTransformStage.class);
  private static final String STAGE_KIND = "SafeTransformStage";
  /** Extra error slots reserved beyond upstream's capacity: one handler error plus one fault. */
  static final int LOCAL_ERROR_SLOTS = 2;

  private final StreamPair upstream;
  private final DatapackHandler handler;
  private final Runnable finalizer;
  private final StageSettings settings;
  private final MetricsPort metrics;
  private final StageLifecycle lifecycle = new StageLifecycle();

  private StreamPair output;
  private volatile String name = STAGE_KIND;

  public SafeTransformStage(StreamPair upstream, DatapackHandler handler, Runnable finalizer) {
    this(upstream, handler, finalizer, StageSettings.defaults());
  }

  /**
   * Creates a transform stage.
   *
   * @param upstream pair to consume; {@code null} leaves the stage unbuildable
   * @param handler per-item handler; {@code null} makes the stage a pass-through
   * @param finalizer callback run once after the stage's cleanup; may be {@code null}
   * @param settings stage tuning
   */
  public SafeTransformStage(
      StreamPair upstream, DatapackHandler handler, Runnable finalizer, StageSettings settings) {
    this.upstream = upstream;
    this.handler = handler;
    this.finalizer = finalizer;
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = settings.metrics();
  }

  /**
   * Creates a stage that writes each mapped datapack to its own output data channel.
   *
   * @param upstream pair to consume
   * @param mapper per-item mapping; a {@code null} result emits nothing
   * @param finalizer callback run once after cleanup; may be {@code null}
   * @param settings stage tuning
   * @return stage whose output is already built
   */
  public static SafeTransformStage mapping(
      StreamPair upstream, DatapackMapper mapper, Runnable finalizer, StageSettings settings) {
    MappingHandler mappingHandler = new MappingHandler(mapper);
    SafeTransformStage stage = new SafeTransformStage(upstream, mappingHandler, finalizer, settings);
    stage.buildStream().ifPresent(pair -> mappingHandler.bind(pair.data()));
    return stage;
  }

  /**
   * Returns the pair downstream consumers should read, building it on first use.
   *
   * @return empty when no upstream was supplied; the upstream pair itself for a pass-through stage; otherwise
   *     this stage's output pair
   */
  public synchronized Optional<StreamPair> buildStream() {
    if (upstream == null) {
      return Optional.empty();
    }
    if (handler == null) {
      return Optional.of(upstream);
    }
    if (output == null) {
      int capacity = upstream.errors().capacity() + LOCAL_ERROR_SLOTS;
      output = new StreamPair(new DataChannel<>(), new ErrorChannel(capacity, settings.errorPollInterval()));
    }
    return Optional.of(output);
  }

  /**
   * Ensures the output pair exists and launches the stage thread.
   *
   * @return the pair downstream consumers should read
   * @throws IllegalStateException if no upstream was supplied or the stage was already started
   */
  public StreamPair start() {
    StreamPair pair = buildStream()
        .orElseThrow(() -> new IllegalStateException(STAGE_KIND + " has no upstream stream"));
    if (handler == null) {
      log.debug("{} has no handler; passing upstream through", STAGE_KIND);
      return pair;
    }
    lifecycle.markRunning(STAGE_KIND);
    Thread thread = ExecutorFactories
        .newStageThreadFactory(settings.threadPrefix(), settings.daemonThreads(), null)
        .newThread(() -> run(pair));
    name = STAGE_KIND + "[" + thread.getName() + "]";
    thread.start();
    log.debug("{} started", name);
    return pair;
  }

  public boolean isPassThrough() {
    return handler == null;
  }

  public StageState state() {
    return lifecycle.state();
  }

  /** Whether a runtime fault was captured. Meaningful once the stage has finished. */
  public boolean isFaulted() {
    return lifecycle.isFaulted();
  }

  /**
   * Waits for the stage to close its output and run its finalizer. A pass-through stage has nothing to wait for.
   *
   * @param timeout maximum wait
   * @return {@code true} if the stage is closed (or is a pass-through)
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return isPassThrough() || lifecycle.awaitClosed(timeout);
  }

  private void run(StreamPair out) {
    boolean faulted = false;
    try {
      try {
        consume(out);
      } catch (Throwable ex) {
        faulted = true;
        abandonUpstream(out.errors(), ex);
      }
      try {
        relayUpstreamErrors(out.errors());
      } catch (Throwable ex) {
        if (faulted) {
          log.warn("{} failed again while relaying upstream errors after a fault", name, ex);
        } else {
          faulted = true;
          abandonUpstream(out.errors(), ex);
        }
      }
    } finally {
      lifecycle.markFinished(faulted);
      out.errors().close();
      out.data().close();
      try {
        runFinalizer();
      } finally {
        lifecycle.markClosed();
        log.debug("{} closed (faulted={})", name, faulted);
      }
    }
  }

  private void consume(StreamPair out) throws InterruptedException {
    DataChannel<Datapack> input = upstream.data();
    while (true) {
      Optional<Datapack> next = input.read();
      if (next.isEmpty()) {
        return;
      }
      Datapack datapack = next.get();
      InputStream body = datapack.body();
      if (body == null) {
        metrics.increment("stream.transform.skipped");
        continue;
      }

      long started = System.nanoTime();
      try {
        handler.handle(datapack.context(), body);
      } catch (InterruptedException | RuntimeException ex) {
        throw ex;
      } catch (Exception ex) {
        metrics.increment("stream.transform.errors");
        log.debug("{} handler reported {}", name, Logs.describe(ex));
        out.errors().put(ex);
        input.close();
        return;
      }
      metrics.observe("stream.transform.handleNanos", System.nanoTime() - started);
      metrics.increment("stream.transform.items");

      if (out.data().isClosed()) {
        log.debug("{} output closed by its reader; abandoning upstream", name);
        input.close();
        return;
      }
    }
  }

  private void relayUpstreamErrors(ErrorChannel out) throws InterruptedException {
    ErrorChannel input = upstream.errors();
    while (true) {
      ErrorCheck check = input.check();
      if (check.done()) {
        return;
      }
      if (check.hasError()) {
        metrics.increment("stream.transform.relayed");
        out.put(check.error());
      }
    }
  }

  private void abandonUpstream(ErrorChannel out, Throwable ex) {
    upstream.data().close();
    if (ex instanceof InterruptedException) {
      Thread.currentThread().interrupt();
    }
    metrics.increment("stream.stage.faults");
    log.warn("{} faulted; closed upstream and reporting {}", name, Logs.describe(ex), ex);
    Faults.report(out, new StageFaultException(name, ex));
  }

  private void runFinalizer() {
    if (finalizer == null) {
      return;
    }
    try {
      finalizer.run();
    } catch (RuntimeException ex) {
      log.warn("{} finalizer failed", name, ex);
    }
  }
}
