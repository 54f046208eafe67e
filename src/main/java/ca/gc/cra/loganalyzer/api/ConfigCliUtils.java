package ca.gc.cra.loganalyzer.api;

import java.util.Locale;
import java.util.Map;

/**
 * Helpers shared by the CLI for mixing flag semantics with YAML/map based configuration.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} option.
   *
   * @param args mutable option map
   * @return trimmed config path, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    if (value != null && !value.isBlank()) {
      return value.trim();
    }
    return null;
  }

  /**
   * Reads a boolean option; only {@code true} and {@code false} are accepted.
   *
   * @throws IllegalArgumentException on any other non-blank value
   */
  static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    if (map == null) {
      return defaultValue;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true" -> true;
      case "false" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was '" + value + "')");
    };
  }
}
