package ca.gc.cra.loganalyzer.config;

import ca.gc.cra.loganalyzer.application.pipeline.SearchSettings;
import ca.gc.cra.loganalyzer.validation.Numbers;
import ca.gc.cra.loganalyzer.validation.Paths;
import ca.gc.cra.loganalyzer.validation.Strings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Validated configuration for one search run.
 * <p><strong>Why:</strong> Turns the merged CLI/YAML/default map into typed values once, so the use case
 * never sees an out-of-range worker count or a missing input file.</p>
 * <p><strong>Role:</strong> Configuration record consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param input readable log file to search
 * @param term literal search term
 * @param workers number of search workers
 * @param queueCapacity hand-off queue capacity
 * @param produceDelay pause after each produced record
 * @param ignoreCase whether matching ignores case
 * @param printWorkerCounts whether per-worker counts are printed after the total
 * @since 0.1.0
 */
public record SearchConfig(
    Path input,
    String term,
    int workers,
    int queueCapacity,
    Duration produceDelay,
    boolean ignoreCase,
    boolean printWorkerCounts) {

  /** Upper bound on the search term length, in characters. */
  public static final int MAX_TERM_LENGTH = 4_096;
  /** Upper bound on the worker count. */
  public static final int MAX_WORKERS = 256;
  /** Upper bound on the queue capacity. */
  public static final int MAX_QUEUE_CAPACITY = 65_536;
  /** Upper bound on the per-record producer delay, in milliseconds. */
  public static final int MAX_PRODUCE_DELAY_MS = 60_000;
  static final int DEFAULT_QUEUE_CAPACITY = 64;

  /**
   * Validates the configuration values.
   */
  public SearchConfig {
    Objects.requireNonNull(input, "input");
    term = Strings.requireSearchTerm("term", Objects.requireNonNull(term, "term"), MAX_TERM_LENGTH);
    Numbers.requireRange("workers", workers, 1, MAX_WORKERS);
    Numbers.requireRange("capacity", queueCapacity, 1, MAX_QUEUE_CAPACITY);
    produceDelay = Objects.requireNonNullElse(produceDelay, Duration.ZERO);
    Numbers.requireRange("produceDelayMs", produceDelay.toMillis(), 0, MAX_PRODUCE_DELAY_MS);
  }

  /**
   * Builds a configuration from a flat key/value map.
   *
   * @param options merged options; {@code in} and {@code term} are required
   * @return validated configuration
   * @throws IllegalArgumentException if a value is missing, malformed, or out of range, or the input file
   *     is not a readable regular file
   */
  public static SearchConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String inRaw = options.get("in");
    if (inRaw == null || inRaw.isBlank()) {
      throw new IllegalArgumentException("in is required");
    }
    Path input = Paths.validateReadableFile(Paths.parse("in", inRaw));
    String term = options.get("term");
    if (term == null || term.isEmpty()) {
      throw new IllegalArgumentException("term is required");
    }
    int workers = parseBoundedInt(options, "workers", defaultWorkers(), 1, MAX_WORKERS);
    int capacity = parseBoundedInt(options, "capacity", DEFAULT_QUEUE_CAPACITY, 1, MAX_QUEUE_CAPACITY);
    int delayMs = parseBoundedInt(options, "produceDelayMs", 0, 0, MAX_PRODUCE_DELAY_MS);
    return new SearchConfig(
        input,
        term,
        workers,
        capacity,
        Duration.ofMillis(delayMs),
        parseBoolean(options.get("ignoreCase"), false),
        parseBoolean(options.get("printWorkerCounts"), false));
  }

  /**
   * Returns the pipeline sizing derived from this configuration.
   *
   * @return search settings
   */
  public SearchSettings settings() {
    return new SearchSettings(workers, queueCapacity, produceDelay);
  }

  static int defaultWorkers() {
    return Math.min(MAX_WORKERS, Math.max(1, Runtime.getRuntime().availableProcessors()));
  }

  private static int parseBoundedInt(Map<String, String> options, String key, int defaultValue, int min, int max) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return Numbers.parseIntInRange(key, raw, min, max);
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String trimmed = value.trim();
    if (trimmed.equalsIgnoreCase("true")) {
      return true;
    }
    if (trimmed.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException("expected true or false (was '" + trimmed + "')");
  }
}
