package ca.gc.cra.calsync.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = Map.of("days", "7", "excludeDeclined", "false");
    Map<String, String> yaml = Map.of("source", "Work", "days", "14");
    Map<String, String> cli = Map.of("source", "Team", "destination", "Mirror");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "sync", Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("Team", merged.get("source"));
    assertEquals("14", merged.get("days"));
    assertEquals("Mirror", merged.get("destination"));
    assertEquals("false", merged.get("excludeDeclined"));
    assertEquals(List.of("CLI overrides YAML for key: source"), warnings);
  }

  @Test
  void syncRequiresSource() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "sync", Optional.empty(), Map.of("destination", "Mirror"), Map.of(), msg -> {}));
  }

  @Test
  void syncRejectsOutOfRangeDays() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "sync", Optional.empty(), Map.of("source", "Work", "days", "-1"), Map.of(), msg -> {}));

    assertTrue(ex.getMessage().contains("days"));
  }

  @Test
  void destinationMustDifferFromSource() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "sync", Optional.empty(), Map.of("source", "Work", "destination", " Work "), Map.of(), msg -> {}));
  }

  @Test
  void unknownMetricsExporterIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "calendars", Optional.empty(), Map.of("metricsExporter", "prometheus"), Map.of(), msg -> {}));
  }

  @Test
  void calendarsModeNeedsNoSource() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "calendars", Optional.empty(), Map.of("store", "/tmp/cal.json"), DefaultsForMode.asFlatMap("calendars"),
        msg -> {});

    assertEquals("/tmp/cal.json", merged.get("store"));
  }
}
