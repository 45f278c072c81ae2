package ca.gc.cra.safestream.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.safestream.application.port.MetricsPort;
import ca.gc.cra.safestream.domain.stream.ErrorChannel;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class StageSettingsTest {

  @Test
  void nullsNormalizeToDefaults() {
    StageSettings settings = new StageSettings(2, null, "  ", false, null);

    assertEquals(ErrorChannel.DEFAULT_POLL_INTERVAL, settings.errorPollInterval());
    assertEquals(StageSettings.DEFAULT_THREAD_PREFIX, settings.threadPrefix());
    assertSame(MetricsPort.NO_OP, settings.metrics());
  }

  @Test
  void rejectsNonPositiveValues() {
    assertThrows(IllegalArgumentException.class, () -> StageSettings.defaults().withErrorCapacity(0));
    assertThrows(IllegalArgumentException.class,
        () -> new StageSettings(1, Duration.ofMillis(-5), "x", false, null));
  }

  @Test
  void withersReplaceSingleField() {
    StageSettings base = StageSettings.defaults();

    StageSettings renamed = base.withThreadPrefix("ingest ").withErrorCapacity(3);

    assertEquals("ingest", renamed.threadPrefix());
    assertEquals(3, renamed.errorCapacity());
    assertEquals(base.errorPollInterval(), renamed.errorPollInterval());
  }
}
