package ca.gc.cra.calsync.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each calsync command.
 *
 * <p>The defaults are the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param mode command name ({@code sync} or {@code calendars})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException if the command is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "sync" -> buildSyncDefaults();
      case "calendars" -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("store", SyncConfig.defaultStorePath().toString());
    map.put("metricsExporter", "");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildSyncDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("destination", "");
    map.put("days", Integer.toString(SyncConfig.DEFAULT_DAYS));
    map.put("zone", "");
    map.put("account", "");
    map.put("excludeTitle", "");
    map.put("excludeDeclined", "false");
    map.put("excludeAllDay", "false");
    map.put("forceRefresh", "false");
    map.put("forceRecreate", "false");
    map.put("dryRun", "false");
    return map;
  }
}
