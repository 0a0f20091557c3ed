package ca.gc.cra.harness.api;

import ca.gc.cra.harness.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites the short telemetry arguments into the {@code otel.*} keys read by
 * {@link ca.gc.cra.harness.config.TelemetrySettings}.
 *
 * <p>{@code metricsExporter=none}, {@code otelEndpoint=http://collector:4317} and
 * {@code otelResourceAttributes=k=v} are accepted on the command line; {@code --no-telemetry} forces
 * {@code none}.</p>
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Moves the short keys to their {@code otel.*} names, validating them.
   *
   * @param args mutable CLI map
   * @param disable whether {@code --no-telemetry} was given
   * @throws IllegalArgumentException for an unknown exporter, a non-http endpoint or non-ASCII attributes
   */
  static void configureMetrics(Map<String, String> args, boolean disable) {
    String exporter = args.remove("metricsExporter");
    if (exporter != null && !exporter.isBlank()) {
      String normalized = exporter.trim().toLowerCase(Locale.ROOT);
      if (!normalized.equals("otlp") && !normalized.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      args.put("otel.metrics.exporter", normalized);
    }
    if (disable) {
      args.put("otel.metrics.exporter", "none");
    }

    String endpoint = args.remove("otelEndpoint");
    if (endpoint != null && !endpoint.isBlank()) {
      String trimmed = endpoint.trim();
      validateEndpoint(trimmed);
      args.put("otel.exporter.otlp.endpoint", trimmed);
    }

    String attributes = args.remove("otelResourceAttributes");
    if (attributes != null && !attributes.isBlank()) {
      args.put("otel.resource.attributes",
          Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH));
    }
    log.debug("Telemetry arguments: exporter={}, endpoint={}",
        args.getOrDefault("otel.metrics.exporter", "<default>"),
        args.getOrDefault("otel.exporter.otlp.endpoint", "<default>"));
  }

  static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
