package ca.gc.cra.loganalyzer.infrastructure.metrics;

import ca.gc.cra.loganalyzer.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations. Selected when metrics export is disabled.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
