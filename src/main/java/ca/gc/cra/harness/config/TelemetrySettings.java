package ca.gc.cra.harness.config;

import ca.gc.cra.harness.validation.Numbers;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * OpenTelemetry export settings.
 *
 * <p>{@link #fromMap(Map)} falls back to the standard {@code OTEL_*} environment variables when a key is absent,
 * so the CLI honours an exporter configured for the surrounding CI job.</p>
 *
 * @param exporter {@code otlp} or {@code none}
 * @param endpoint OTLP gRPC endpoint
 * @param exportInterval periodic export interval
 * @param resourceAttributes extra resource attributes as {@code k=v,k2=v2}
 * @since 0.1.0
 */
public record TelemetrySettings(
    String exporter,
    String endpoint,
    Duration exportInterval,
    String resourceAttributes) {

  public TelemetrySettings {
    exporter = Objects.requireNonNullElse(exporter, "otlp").trim().toLowerCase(Locale.ROOT);
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("otel.metrics.exporter must be otlp or none (was '" + exporter + "')");
    }
    endpoint = Objects.requireNonNullElse(endpoint, "http://localhost:4317").trim();
    Numbers.requirePositive("otel.export.interval", exportInterval);
    resourceAttributes = Objects.requireNonNullElse(resourceAttributes, "");
  }

  public static TelemetrySettings defaults() {
    return new TelemetrySettings("otlp", "http://localhost:4317", Duration.ofSeconds(30), "");
  }

  /**
   * Exporter disabled; used by tests and by {@code --no-telemetry}.
   *
   * @return settings with exporter {@code none}
   */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings("none", "http://localhost:4317", Duration.ofSeconds(30), "");
  }

  public static TelemetrySettings fromMap(Map<String, String> options) {
    return fromMap(options, System.getenv());
  }

  static TelemetrySettings fromMap(Map<String, String> options, Map<String, String> environment) {
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(environment, "environment");
    TelemetrySettings defaults = defaults();
    return new TelemetrySettings(
        firstNonBlank(options.get("otel.metrics.exporter"), environment.get("OTEL_METRICS_EXPORTER"),
            defaults.exporter()),
        firstNonBlank(options.get("otel.exporter.otlp.endpoint"), environment.get("OTEL_EXPORTER_OTLP_ENDPOINT"),
            defaults.endpoint()),
        ConfigValues.durationValue(options, "otel.export.interval", defaults.exportInterval()),
        firstNonBlank(options.get("otel.resource.attributes"), environment.get("OTEL_RESOURCE_ATTRIBUTES"), ""));
  }

  public boolean enabled() {
    return exporter.equals("otlp");
  }

  private static String firstNonBlank(String first, String second, String fallback) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return fallback;
  }
}
