package ca.gc.cra.safestream.application.pipeline;

import static ca.gc.cra.safestream.testutil.TestDatapacks.bodyText;
import static ca.gc.cra.safestream.testutil.TestDatapacks.read;
import static ca.gc.cra.safestream.testutil.TestDatapacks.text;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.safestream.application.port.DatapackHandler;
import ca.gc.cra.safestream.application.port.DatapackMapper;
import ca.gc.cra.safestream.domain.stream.Datapack;
import ca.gc.cra.safestream.domain.stream.StreamContext;
import ca.gc.cra.safestream.domain.stream.StreamPair;
import ca.gc.cra.safestream.testutil.RecordingMetrics;
import ca.gc.cra.safestream.testutil.TestDatapacks;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class SafeTransformStageTest {
  private static final Duration TIMEOUT = Duration.ofSeconds(5);

  private final ExecutorService executor = Executors.newCachedThreadPool();

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void withoutHandlerPassesUpstreamThroughAndStartsNothing() throws Exception {
    StreamPair upstream = newUpstream(3);
    AtomicInteger finalized = new AtomicInteger();
    SafeTransformStage stage = new SafeTransformStage(upstream, null, finalized::incrementAndGet);

    assertSame(upstream, stage.buildStream().orElseThrow());
    assertSame(upstream, stage.start());
    assertTrue(stage.isPassThrough());
    assertEquals(StageState.NOT_STARTED, stage.state());
    assertTrue(stage.awaitTermination(Duration.ZERO));
    assertEquals(0, finalized.get());
    assertFalse(upstream.data().isClosed());
  }

  @Test
  void withoutUpstreamBuildsNothingAndRefusesToStart() {
    SafeTransformStage stage = new SafeTransformStage(null, (ctx, body) -> {}, null);

    assertEquals(Optional.empty(), stage.buildStream());
    assertThrows(IllegalStateException.class, stage::start);
  }

  @Test
  void outputErrorCapacityIsUpstreamPlusTwo() {
    SafeTransformStage stage = new SafeTransformStage(newUpstream(5), (ctx, body) -> {}, null);

    StreamPair output = stage.buildStream().orElseThrow();

    assertEquals(7, output.errors().capacity());
    assertSame(output, stage.buildStream().orElseThrow(), "output is built once");
  }

  @Test
  void identityMappingForwardsItemsAndRelaysUpstreamErrorsInOrder() {
    StreamPair upstream = newUpstream(3);
    IOException first = new IOException("first");
    IOException second = new IOException("second");
    AtomicInteger finalized = new AtomicInteger();

    assertTimeoutPreemptively(TIMEOUT, () -> {
      feed(upstream, TestDatapacks.texts("a", "b", "c"), List.of(first, second));
      SafeTransformStage stage = SafeTransformStage.mapping(
          upstream, DatapackMapper.identity(), finalized::incrementAndGet, StageSettings.defaults());

      StreamPair output = stage.start();

      assertEquals(List.of("a", "b", "c"), readAll(output));
      assertSame(first, output.errors().check().error());
      assertSame(second, output.errors().check().error());
      assertTrue(output.errors().check().done());
      assertTrue(stage.awaitTermination(TIMEOUT));
      assertEquals(StageState.CLOSED, stage.state());
    });
    assertEquals(1, finalized.get());
  }

  @Test
  void consumingHandlerSeesEveryBodyAndSkipsEmptyItems() {
    StreamPair upstream = newUpstream(2);
    List<String> seen = new CopyOnWriteArrayList<>();
    List<Datapack> items = new ArrayList<>(TestDatapacks.texts("one", "two"));
    items.add(1, Datapack.of(null, StreamContext.background()));
    RecordingMetrics metrics = new RecordingMetrics();

    assertTimeoutPreemptively(TIMEOUT, () -> {
      feed(upstream, items, List.of());
      SafeTransformStage stage = new SafeTransformStage(
          upstream, (ctx, body) -> seen.add(read(body)), null, StageSettings.defaults().withMetrics(metrics));

      StreamPair output = stage.start();

      assertEquals(List.of(), readAll(output));
      assertTrue(output.errors().check().done());
      assertTrue(stage.awaitTermination(TIMEOUT));
    });
    assertEquals(List.of("one", "two"), seen);
    assertEquals(2, metrics.counter("stream.transform.items"));
    assertEquals(1, metrics.counter("stream.transform.skipped"));
    assertEquals(2, metrics.observationCount("stream.transform.handleNanos"));
  }

  @Test
  void handlerFaultClosesUpstreamAndReportsOneFault() {
    StreamPair upstream = newUpstream(3);
    List<String> handled = new CopyOnWriteArrayList<>();
    DatapackHandler handler = (ctx, body) -> {
      String value = read(body);
      handled.add(value);
      if (value.equals("2")) {
        throw new IllegalStateException("corrupt record " + value);
      }
    };

    assertTimeoutPreemptively(TIMEOUT, () -> {
      Future<List<Boolean>> writes = feed(upstream, TestDatapacks.texts("1", "2", "3", "4", "5"), List.of());
      SafeTransformStage stage = new SafeTransformStage(upstream, handler, null);

      StreamPair output = stage.start();

      assertEquals(List.of(false, false, true), writes.get(5, TimeUnit.SECONDS));
      assertTrue(upstream.data().isClosed());
      assertEquals(List.of(), readAll(output));
      StageFaultException fault = assertInstanceOf(StageFaultException.class, output.errors().check().error());
      assertTrue(fault.getMessage().contains("corrupt record 2"));
      assertTrue(output.errors().check().done());
      assertTrue(stage.awaitTermination(TIMEOUT));
      assertTrue(stage.isFaulted());
    });
    assertEquals(List.of("1", "2"), handled);
  }

  @Test
  void handlerErrorIsForwardedUnchangedAndUpstreamErrorsStillRelayed() {
    StreamPair upstream = newUpstream(3);
    IOException rejected = new IOException("rejected");
    IOException upstreamFailure = new IOException("upstream");
    AtomicInteger calls = new AtomicInteger();
    DatapackHandler handler = (ctx, body) -> {
      body.close();
      if (calls.incrementAndGet() == 2) {
        throw rejected;
      }
    };

    assertTimeoutPreemptively(TIMEOUT, () -> {
      Future<List<Boolean>> writes =
          feed(upstream, TestDatapacks.texts("1", "2", "3"), List.of(upstreamFailure));
      SafeTransformStage stage = new SafeTransformStage(upstream, handler, null);

      StreamPair output = stage.start();

      assertEquals(List.of(), readAll(output));
      assertSame(rejected, output.errors().check().error());
      assertSame(upstreamFailure, output.errors().check().error());
      assertTrue(output.errors().check().done());
      assertEquals(List.of(false, false, true), writes.get(5, TimeUnit.SECONDS));
      assertFalse(stage.isFaulted());
    });
    assertEquals(2, calls.get());
  }

  @Test
  void localFaultPlusFullUpstreamBufferNeverBlocksWithoutAReader() {
    int upstreamCapacity = 3;
    StreamPair upstream = newUpstream(upstreamCapacity);

    assertTimeoutPreemptively(TIMEOUT, () -> {
      executor.submit(() -> {
        for (int i = 0; i < upstreamCapacity; i++) {
          upstream.errors().put(new IOException("upstream-" + i));
        }
        upstream.data().write(text("poison"));
        upstream.errors().close();
        upstream.data().close();
        return null;
      });
      SafeTransformStage stage = new SafeTransformStage(upstream, (ctx, body) -> {
        throw new IllegalStateException("boom");
      }, null);

      StreamPair output = stage.start();

      assertTrue(stage.awaitTermination(TIMEOUT), "stage blocked on its own error buffer");
      assertInstanceOf(StageFaultException.class, output.errors().check().error());
      for (int i = 0; i < upstreamCapacity; i++) {
        assertEquals("upstream-" + i, output.errors().check().error().getMessage());
      }
      assertTrue(output.errors().check().done());
    });
  }

  @Test
  void readerClosingOutputAbandonsUpstream() {
    StreamPair upstream = newUpstream(2);
    AtomicBoolean upstreamSawClose = new AtomicBoolean();

    assertTimeoutPreemptively(TIMEOUT, () -> {
      Future<?> writer = executor.submit(() -> {
        for (int i = 0; ; i++) {
          if (upstream.data().write(text("n" + i))) {
            upstreamSawClose.set(true);
            break;
          }
        }
        upstream.errors().close();
        upstream.data().close();
        return null;
      });
      SafeTransformStage stage =
          SafeTransformStage.mapping(upstream, DatapackMapper.identity(), null, StageSettings.defaults());
      StreamPair output = stage.start();

      assertEquals("n0", bodyText(output.data().read().orElseThrow()));
      output.data().close();

      writer.get(5, TimeUnit.SECONDS);
      assertTrue(upstreamSawClose.get());
      assertTrue(stage.awaitTermination(TIMEOUT));
      assertTrue(output.errors().check().done());
    });
  }

  @Test
  void finalizerRunsOnceAfterBothOutputsClose() {
    StreamPair upstream = newUpstream(1);
    List<Boolean> closedAtFinalize = new CopyOnWriteArrayList<>();
    AtomicInteger runs = new AtomicInteger();
    SafeTransformStage[] holder = new SafeTransformStage[1];
    Runnable finalizer = () -> {
      runs.incrementAndGet();
      StreamPair out = holder[0].buildStream().orElseThrow();
      closedAtFinalize.add(out.errors().isClosed());
      closedAtFinalize.add(out.data().isClosed());
      throw new IllegalStateException("finalizer failure is logged, not propagated");
    };

    assertTimeoutPreemptively(TIMEOUT, () -> {
      feed(upstream, TestDatapacks.texts("x"), List.of());
      holder[0] = new SafeTransformStage(upstream, (ctx, body) -> body.close(), finalizer);

      holder[0].start();

      assertTrue(holder[0].awaitTermination(TIMEOUT));
      assertEquals(StageState.CLOSED, holder[0].state());
    });
    assertEquals(1, runs.get());
    assertEquals(List.of(true, true), closedAtFinalize);
  }

  @Test
  void finalizerErrorStillLetsTheStageTerminate() {
    StreamPair upstream = newUpstream(1);
    upstream.errors().close();
    upstream.data().close();
    AtomicInteger runs = new AtomicInteger();

    assertTimeoutPreemptively(TIMEOUT, () -> {
      SafeTransformStage stage = new SafeTransformStage(upstream, (ctx, body) -> body.close(), () -> {
        runs.incrementAndGet();
        throw new Error("release failed");
      });

      StreamPair output = stage.start();

      assertTrue(stage.awaitTermination(TIMEOUT));
      assertEquals(StageState.CLOSED, stage.state());
      assertTrue(output.errors().isClosed());
      assertTrue(output.data().isClosed());
    });
    assertEquals(1, runs.get());
  }

  @Test
  void faultIsLoggedAtWarn() {
    Logger logger = (Logger) LoggerFactory.getLogger(SafeTransformStage.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    Level originalLevel = logger.getLevel();
    boolean originalAdditive = logger.isAdditive();
    logger.setLevel(Level.WARN);
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);

    try {
      StreamPair upstream = newUpstream(1);
      assertTimeoutPreemptively(TIMEOUT, () -> {
        feed(upstream, TestDatapacks.texts("x"), List.of());
        SafeTransformStage stage = new SafeTransformStage(upstream, (ctx, body) -> {
          throw new UnsupportedOperationException("not yet");
        }, null);
        stage.start();
        assertTrue(stage.awaitTermination(TIMEOUT));
      });
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      logger.setLevel(originalLevel);
      appender.stop();
    }

    List<ILoggingEvent> events = appender.list;
    assertEquals(1, events.size());
    ILoggingEvent event = events.get(0);
    assertEquals(Level.WARN, event.getLevel());
    assertTrue(event.getFormattedMessage().contains("faulted"));
    assertTrue(event.getFormattedMessage().contains("UnsupportedOperationException: not yet"));
  }

  @Test
  void startCanOnlyBeCalledOnce() {
    StreamPair upstream = newUpstream(1);
    SafeTransformStage stage = new SafeTransformStage(upstream, (ctx, body) -> {}, null);
    stage.start();

    assertThrows(IllegalStateException.class, stage::start);
    upstream.errors().close();
    upstream.data().close();
  }

  private static StreamPair newUpstream(int errorCapacity) {
    return StreamPair.open(errorCapacity);
  }

  /**
   * Writes {@code items} until the channel reports closed, puts {@code errors}, then closes errors and data the
   * way a producer stage does. Returns each write's closed flag.
   */
  private Future<List<Boolean>> feed(StreamPair upstream, List<Datapack> items, List<Throwable> errors) {
    return executor.submit(() -> {
      List<Boolean> results = new ArrayList<>();
      for (Datapack item : items) {
        boolean closed = upstream.data().write(item);
        results.add(closed);
        if (closed) {
          break;
        }
      }
      for (Throwable error : errors) {
        upstream.errors().put(error);
      }
      upstream.errors().close();
      upstream.data().close();
      return results;
    });
  }

  private static List<String> readAll(StreamPair pair) throws InterruptedException {
    List<String> values = new ArrayList<>();
    for (Optional<Datapack> next = pair.data().read(); next.isPresent(); next = pair.data().read()) {
      values.add(bodyText(next.get()));
    }
    return values;
  }
}
