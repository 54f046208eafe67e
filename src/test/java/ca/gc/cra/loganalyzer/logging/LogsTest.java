package ca.gc.cra.loganalyzer.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesPassThrough() {
    assertEquals("ERROR", Logs.truncate("ERROR"));
    assertEquals("<null>", Logs.truncate(null));
  }

  @Test
  void longValuesAreCutWithByteCounts() {
    String truncated = Logs.truncate("a".repeat(200));
    assertTrue(truncated.startsWith("a".repeat(128)));
    assertTrue(truncated.endsWith("... (truncated, 128 of 200 bytes)"));
  }

  @Test
  void multiByteCharactersAreNotSplit() {
    String truncated = Logs.truncate("é".repeat(10), 5);
    assertEquals("éé... (truncated, 5 of 20 bytes)", truncated);
  }

  @Test
  void rejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
