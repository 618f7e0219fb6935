package ca.gc.cra.calsync.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void syncDefaultsCoverWindowAndFilters() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("SYNC");

    assertEquals("7", defaults.get("days"));
    assertEquals("false", defaults.get("excludeDeclined"));
    assertEquals("false", defaults.get("dryRun"));
    assertEquals("", defaults.get("metricsExporter"));
    assertTrue(defaults.get("store").endsWith("calendars.json"));
    assertFalse(defaults.containsKey("source"));
  }

  @Test
  void calendarsDefaultsOnlyCarryCommonKeys() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("calendars");

    assertTrue(defaults.containsKey("store"));
    assertFalse(defaults.containsKey("days"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
