/**
 * Metrics adapters that bridge the {@code MetricsPort} to OpenTelemetry or a no-op implementation.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe and support concurrent updates from
 * every worker.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code search.*} namespace.</p>
 */
package ca.gc.cra.loganalyzer.infrastructure.metrics;
