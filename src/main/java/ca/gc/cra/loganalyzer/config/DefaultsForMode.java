package ca.gc.cra.loganalyzer.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CLI mode.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys and CLI arguments.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode; only {@code search} is supported
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for unknown modes
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "search" -> buildSearchDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildSearchDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("in", "");
    map.put("term", "");
    map.put("workers", Integer.toString(SearchConfig.defaultWorkers()));
    map.put("capacity", Integer.toString(SearchConfig.DEFAULT_QUEUE_CAPACITY));
    map.put("produceDelayMs", "0");
    map.put("ignoreCase", "false");
    map.put("printWorkerCounts", "false");
    map.put("dryRun", "false");
    return map;
  }
}
