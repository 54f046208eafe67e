package ca.gc.cra.loganalyzer.config;

import ca.gc.cra.loganalyzer.application.pipeline.SearchUseCase;
import ca.gc.cra.loganalyzer.application.port.MetricsPort;
import ca.gc.cra.loganalyzer.domain.search.SubstringMatcher;
import ca.gc.cra.loganalyzer.infrastructure.exec.ShutdownController;
import ca.gc.cra.loganalyzer.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.loganalyzer.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.loganalyzer.infrastructure.source.FileRecordSource;
import java.io.IOException;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires search use cases to their concrete adapters.
 * <p><strong>Why:</strong> Keeps adapter selection (metrics backend, record source, matcher) in one place
 * so the CLI deals only in configuration.</p>
 * <p><strong>Thread-safety:</strong> Intended for the CLI bootstrap thread.</p>
 * <p><strong>Observability:</strong> Owns the metrics adapter and flushes it on {@link #close()}.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.loganalyzer.application.pipeline.SearchUseCase
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final MetricsPort metrics;

  /**
   * Creates a composition root using an explicit metrics port.
   *
   * @param metrics metrics sink shared by every use case built here
   */
  public CompositionRoot(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Creates a composition root for the named metrics exporter.
   *
   * @param metricsExporter {@code otlp} selects OpenTelemetry; anything else disables metrics
   * @return composition root
   */
  public static CompositionRoot forExporter(String metricsExporter) {
    String normalized = metricsExporter == null ? "" : metricsExporter.trim().toLowerCase(Locale.ROOT);
    if (normalized.equals("otlp")) {
      return new CompositionRoot(new OpenTelemetryMetricsAdapter());
    }
    return new CompositionRoot(new NoOpMetricsAdapter());
  }

  /**
   * Builds a search over the configured input file.
   *
   * @param config validated search configuration
   * @param shutdown shutdown flag shared with the interrupt handler
   * @return single-use search run
   * @throws IOException if the input file cannot be opened
   */
  public SearchUseCase<String> searchUseCase(SearchConfig config, ShutdownController shutdown)
      throws IOException {
    Objects.requireNonNull(config, "config");
    FileRecordSource source = FileRecordSource.open(config.input());
    SubstringMatcher matcher = new SubstringMatcher(config.term(), config.ignoreCase());
    return new SearchUseCase<>(config.settings(), source, matcher, shutdown, metrics);
  }

  /**
   * Returns the metrics sink used by use cases built here.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Flushes and releases the metrics backend when it holds resources.
   */
  @Override
  public void close() {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter cleanly", ex);
      }
    }
  }
}
