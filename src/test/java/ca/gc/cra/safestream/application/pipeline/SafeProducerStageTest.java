package ca.gc.cra.safestream.application.pipeline;

import static ca.gc.cra.safestream.testutil.TestDatapacks.bodyText;
import static ca.gc.cra.safestream.testutil.TestDatapacks.text;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.safestream.application.port.DatapackProducer;
import ca.gc.cra.safestream.application.port.DatapackProducer.Production;
import ca.gc.cra.safestream.domain.stream.Datapack;
import ca.gc.cra.safestream.domain.stream.StreamPair;
import ca.gc.cra.safestream.testutil.RecordingMetrics;
import ca.gc.cra.safestream.testutil.TestDatapacks;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class SafeProducerStageTest {
  private static final Duration TIMEOUT = Duration.ofSeconds(5);

  @Test
  void deliversAllItemsInOrderThenClosesCleanly() {
    assertTimeoutPreemptively(TIMEOUT, () -> {
      SafeProducerStage stage = new SafeProducerStage(
          DatapackProducer.fromIterator(TestDatapacks.texts("a", "b", "c", "d").iterator()));

      StreamPair output = stage.start();

      assertEquals(List.of("a", "b", "c", "d"), readAll(output));
      assertTrue(output.errors().check().done());
      assertTrue(stage.awaitTermination(TIMEOUT));
      assertEquals(StageState.CLOSED, stage.state());
      assertFalse(stage.isFaulted());
    });
  }

  @Test
  void producerErrorStopsAfterPrecedingItems() {
    IOException failure = new IOException("disk gone");
    AtomicInteger calls = new AtomicInteger();
    DatapackProducer producer = () -> {
      int call = calls.incrementAndGet();
      if (call == 3) {
        throw failure;
      }
      return Production.of(text("item-" + call));
    };

    assertTimeoutPreemptively(TIMEOUT, () -> {
      StreamPair output = new SafeProducerStage(producer).start();

      assertEquals(List.of("item-1", "item-2"), readAll(output));
      assertSame(failure, output.errors().check().error());
      assertTrue(output.errors().check().done());
      assertEquals(3, calls.get());
    });
  }

  @Test
  void readerClosingEarlyStopsProduction() {
    AtomicInteger calls = new AtomicInteger();
    DatapackProducer endless = () -> Production.of(text("n" + calls.incrementAndGet()));

    assertTimeoutPreemptively(TIMEOUT, () -> {
      SafeProducerStage stage = new SafeProducerStage(endless);
      StreamPair output = stage.start();

      assertEquals("n1", bodyText(output.data().read().orElseThrow()));
      assertEquals("n2", bodyText(output.data().read().orElseThrow()));
      output.data().close();

      assertTrue(stage.awaitTermination(TIMEOUT));
      int callsAtClose = calls.get();
      assertTrue(callsAtClose <= 3, "producer called " + callsAtClose + " times");
      assertTrue(output.errors().isClosed());
      assertTrue(output.errors().check().done());
      Thread.sleep(50);
      assertEquals(callsAtClose, calls.get());
    });
  }

  @Test
  void lastProductionEndsTheStream() {
    AtomicInteger calls = new AtomicInteger();
    DatapackProducer producer = () -> calls.incrementAndGet() < 2
        ? Production.of(text("first"))
        : Production.last(text("final"));

    assertTimeoutPreemptively(TIMEOUT, () -> {
      SafeProducerStage stage = new SafeProducerStage(producer);
      StreamPair output = stage.start();

      assertEquals(List.of("first", "final"), readAll(output));
      assertTrue(output.errors().check().done());
      assertTrue(stage.awaitTermination(TIMEOUT));
    });
    assertEquals(2, calls.get());
  }

  @Test
  void skipsNullItemsAndHonoursFinalSkip() {
    List<Production> script = List.of(
        Production.skip(),
        Production.of(text("x")),
        Production.skip(),
        Production.of(text("y")),
        Production.exhausted());
    AtomicInteger index = new AtomicInteger();
    RecordingMetrics metrics = new RecordingMetrics();

    assertTimeoutPreemptively(TIMEOUT, () -> {
      SafeProducerStage stage = new SafeProducerStage(
          () -> script.get(index.getAndIncrement()), StageSettings.defaults().withMetrics(metrics));
      StreamPair output = stage.start();

      assertEquals(List.of("x", "y"), readAll(output));
      assertTrue(output.errors().check().done());
      assertTrue(stage.awaitTermination(TIMEOUT));
    });
    assertEquals(5, index.get());
    assertEquals(2, metrics.counter("stream.producer.items"));
    assertEquals(3, metrics.counter("stream.producer.skipped"));
  }

  @Test
  void runtimeFaultIsWrappedAndReported() {
    IllegalArgumentException bug = new IllegalArgumentException("bad index");
    AtomicInteger calls = new AtomicInteger();
    DatapackProducer producer = () -> {
      if (calls.incrementAndGet() == 2) {
        throw bug;
      }
      return Production.of(text("ok"));
    };
    RecordingMetrics metrics = new RecordingMetrics();

    assertTimeoutPreemptively(TIMEOUT, () -> {
      SafeProducerStage stage = new SafeProducerStage(producer, StageSettings.defaults().withMetrics(metrics));
      StreamPair output = stage.start();

      assertEquals(List.of("ok"), readAll(output));
      Throwable reported = output.errors().check().error();
      StageFaultException fault = assertInstanceOf(StageFaultException.class, reported);
      assertSame(bug, fault.getCause());
      assertTrue(fault.getMessage().contains("SafeProducerStage"));
      assertTrue(fault.getMessage().contains("bad index"));
      assertTrue(output.errors().check().done());
      assertTrue(stage.awaitTermination(TIMEOUT));
      assertTrue(stage.isFaulted());
    });
    assertEquals(1, metrics.counter("stream.stage.faults"));
  }

  @Test
  void nullProductionIsTreatedAsFault() {
    assertTimeoutPreemptively(TIMEOUT, () -> {
      StreamPair output = new SafeProducerStage(() -> null).start();

      assertEquals(List.of(), readAll(output));
      assertInstanceOf(StageFaultException.class, output.errors().check().error());
    });
  }

  @Test
  void errorChannelIsClosedBeforeDataChannel() {
    assertTimeoutPreemptively(TIMEOUT, () -> {
      StreamPair output = new SafeProducerStage(
          DatapackProducer.fromIterator(List.<Datapack>of().iterator())).start();

      assertEquals(Optional.empty(), output.data().read());
      assertTrue(output.errors().isClosed(), "errors must already be closed when data reports closed");
    });
  }

  @Test
  void startCanOnlyBeCalledOnce() {
    SafeProducerStage stage = new SafeProducerStage(() -> Production.exhausted());
    assertEquals(StageState.NOT_STARTED, stage.state());
    stage.start();

    assertThrows(IllegalStateException.class, stage::start);
  }

  private static List<String> readAll(StreamPair pair) throws InterruptedException {
    List<String> values = new ArrayList<>();
    for (Optional<Datapack> next = pair.data().read(); next.isPresent(); next = pair.data().read()) {
      values.add(bodyText(next.get()));
    }
    return values;
  }
}
