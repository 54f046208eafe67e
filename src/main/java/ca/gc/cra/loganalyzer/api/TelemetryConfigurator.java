package ca.gc.cra.loganalyzer.api;

import ca.gc.cra.loganalyzer.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves the telemetry options out of the search options and into the {@code otel.*} system properties
 * read by the metrics bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  static final String EXPORTER_PROPERTY = "otel.metrics.exporter";
  static final String ENDPOINT_PROPERTY = "otel.exporter.otlp.endpoint";
  static final String RESOURCE_PROPERTY = "otel.resource.attributes";

  private TelemetryConfigurator() {}

  /**
   * Consumes {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes} from
   * {@code args}. Blank values leave the corresponding property untouched.
   *
   * @param args mutable option map
   * @return normalized exporter name, {@code none} when unset
   * @throws IllegalArgumentException when a value is malformed
   */
  static String configureMetrics(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return "none";
    }
    String exporter = "none";
    String rawExporter = args.remove("metricsExporter");
    if (rawExporter != null && !rawExporter.isBlank()) {
      exporter = rawExporter.trim().toLowerCase(Locale.ROOT);
      if (!exporter.equals("otlp") && !exporter.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      log.debug("Configuring OpenTelemetry metrics exporter: {}", exporter);
      System.setProperty(EXPORTER_PROPERTY, exporter);
    }

    String endpoint = args.remove("otelEndpoint");
    if (endpoint != null && !endpoint.isBlank()) {
      String trimmed = endpoint.trim();
      validateEndpoint(trimmed);
      log.debug("Configuring OTLP endpoint: {}", trimmed);
      System.setProperty(ENDPOINT_PROPERTY, trimmed);
    }

    String resourceAttributes = args.remove("otelResourceAttributes");
    if (resourceAttributes != null && !resourceAttributes.isBlank()) {
      String trimmed = resourceAttributes.trim();
      Strings.requirePrintableAscii("otelResourceAttributes", trimmed, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      log.debug("Configuring OTEL resource attributes override");
      System.setProperty(RESOURCE_PROPERTY, trimmed);
    }
    return exporter;
  }

  private static void validateEndpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
  }
}
