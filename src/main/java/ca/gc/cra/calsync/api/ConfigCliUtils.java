package ca.gc.cra.calsync.api;

import ca.gc.cra.calsync.config.ConfigMerger;
import ca.gc.cra.calsync.config.DefaultsForMode;
import ca.gc.cra.calsync.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Shared helpers mixing CLI flag semantics with YAML and map based configuration sources.
 */
final class ConfigCliUtils {
  private static final Set<String> GLOBAL_FLAGS = Set.of("--help", "--verbose");

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Records each supplied boolean flag as {@code key=true} in {@code kv}.
   *
   * @param input parsed CLI input
   * @param flagKeys flag to configuration key mapping, e.g. {@code --dry-run -> dryRun}
   * @param kv CLI key/value map to update
   * @throws IllegalArgumentException if an unknown flag was supplied
   */
  static void applyFlags(CliInput input, Map<String, String> flagKeys, Map<String, String> kv) {
    for (String flag : input.flags()) {
      if (GLOBAL_FLAGS.contains(flag)) {
        continue;
      }
      String key = flagKeys.get(flag);
      if (key == null) {
        throw new IllegalArgumentException("unknown flag: " + flag);
      }
      kv.put(key, "true");
    }
  }

  /**
   * Loads the optional YAML file and merges it with defaults and CLI values.
   *
   * @param mode command name
   * @param kv CLI key/value map; the {@code config} entry is consumed
   * @param warn receives override warnings
   * @return effective configuration
   * @throws IllegalArgumentException if the YAML file is missing or invalid, or the merged values fail validation
   * @throws IOException if the YAML file cannot be read
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> kv, Consumer<String> warn)
      throws IOException {
    String configPath = extractConfigPath(kv);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
    }
    Map<String, String> defaults = DefaultsForMode.asFlatMap(mode);
    return new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(mode, yaml, kv, defaults, warn));
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && !value.isBlank() && Boolean.parseBoolean(value.trim());
  }
}
