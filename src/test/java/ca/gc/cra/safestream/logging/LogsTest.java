package ca.gc.cra.safestream.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateKeepsShortValuesAndMarksLongOnes() {
    assertEquals("short", Logs.truncate("short", 16));
    assertEquals("<null>", Logs.truncate(null, 16));
    assertEquals("abcd... (truncated, 4 of 10)", Logs.truncate("abcdefghij", 4));
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void truncateDropsSplitCodepoint() {
    String truncated = Logs.truncate("éé", 3);
    assertTrue(truncated.startsWith("é..."), truncated);
  }

  @Test
  void describeIsSingleLineAndBounded() {
    assertEquals("IOException: disk\ngone".replace('\n', ' '), Logs.describe(new IOException("disk\ngone")));
    assertEquals("IllegalStateException", Logs.describe(new IllegalStateException()));
    assertEquals("<null>", Logs.describe(null));

    String described = Logs.describe(new IOException("x".repeat(2_000)));
    assertTrue(described.contains("truncated, " + Logs.MAX_MESSAGE_BYTES + " of 2000"), described);
  }
}
