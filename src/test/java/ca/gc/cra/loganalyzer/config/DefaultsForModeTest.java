package ca.gc.cra.loganalyzer.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void searchDefaultsIncludeCommonAndSearchKeys() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap(" Search ");

    assertEquals("none", defaults.get("metricsExporter"));
    assertEquals("64", defaults.get("capacity"));
    assertEquals("0", defaults.get("produceDelayMs"));
    assertEquals("false", defaults.get("ignoreCase"));
    assertEquals(Integer.toString(SearchConfig.defaultWorkers()), defaults.get("workers"));
    assertEquals("", defaults.get("in"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
