package ca.gc.cra.loganalyzer.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for search runs.
 * <p><strong>Why:</strong> Lets the producer, workers and orchestrator record counters and observations
 * without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Port implemented by {@code OpenTelemetryMetricsAdapter} and
 * {@code NoOpMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for events such as records produced or rejected pushes.</li>
 *   <li>Record numeric observations for per-worker totals, queue depth and run duration.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from the producer
 * and every worker thread.</p>
 * <p><strong>Performance:</strong> Calls should be non-blocking and amortized O(1).</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code search.records.produced}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code search.push.rejected}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., matches, milliseconds); semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
