package ca.gc.cra.loganalyzer.application.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Sizing for one search run.
 *
 * <p>Values are validated by the caller ({@code SearchConfig}) before construction; nothing is clamped
 * here, non-positive sizes are rejected outright.</p>
 *
 * @param workers number of search workers (N); must be positive
 * @param queueCapacity hand-off queue capacity (C); must be positive
 * @param produceDelay pause after each produced record; zero disables pacing
 * @since 0.1.0
 */
public record SearchSettings(int workers, int queueCapacity, Duration produceDelay) {
  /**
   * Validates the settings.
   */
  public SearchSettings {
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive (was " + workers + ")");
    }
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be positive (was " + queueCapacity + ")");
    }
    produceDelay = Objects.requireNonNullElse(produceDelay, Duration.ZERO);
    if (produceDelay.isNegative()) {
      throw new IllegalArgumentException("produceDelay must not be negative");
    }
  }

  /**
   * Creates settings without producer pacing.
   *
   * @param workers number of search workers
   * @param queueCapacity hand-off queue capacity
   * @return settings
   */
  public static SearchSettings of(int workers, int queueCapacity) {
    return new SearchSettings(workers, queueCapacity, Duration.ZERO);
  }
}
