package ca.gc.cra.harness.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Flattened defaults for each CLI command.
 *
 * <p>Telemetry keys default to blank so {@link TelemetrySettings#fromMap(Map)} can still fall back to the
 * {@code OTEL_*} environment.</p>
 */
public final class DefaultsForCommand {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForCommand() {}

  /**
   * Returns common defaults merged with the command's own keys.
   *
   * @param command {@code exec}, {@code await} or {@code stats}
   * @return unmodifiable map of default values as strings
   * @throws IllegalArgumentException for an unknown command
   */
  public static Map<String, String> asFlatMap(String command) {
    Objects.requireNonNull(command, "command");
    String normalized = command.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "exec" -> Map.of(
          "command", "",
          "args", "",
          "cwd", "",
          "timeout", "30s",
          "expect", "");
      case "await" -> Map.of(
          "file", "",
          "pid", "");
      case "stats" -> Map.of(
          "sessions", "1",
          "shell", "/bin/sh",
          "pretty", "true");
      default -> throw new IllegalArgumentException("Unsupported command: " + command);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    PoolSettings pool = PoolSettings.defaults();
    MemorySettings memory = MemorySettings.defaults();
    BufferSettings buffer = BufferSettings.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("pool.maxSize", Integer.toString(pool.maxPoolSize()));
    map.put("pool.idleTimeout", millis(pool.idleTimeout()));
    map.put("pool.maxAge", millis(pool.maxAge()));
    map.put("pool.acquisitionTimeout", millis(pool.acquisitionTimeout()));
    map.put("pool.idleSweepInterval", millis(pool.idleSweepInterval()));
    map.put("metrics.enabled", Boolean.toString(pool.enableMetrics()));
    map.put("memory.maxHeapUsed", Long.toString(memory.maxHeapUsed()));
    map.put("memory.maxRss", Long.toString(memory.maxRss()));
    map.put("memory.gcThreshold", Integer.toString(memory.gcThresholdPercent()));
    map.put("memory.monitorInterval", millis(memory.monitorInterval()));
    map.put("memory.enableGc", Boolean.toString(memory.enableGarbageCollection()));
    map.put("buffer.maxBufferSize", Integer.toString(buffer.maxBufferSize()));
    map.put("buffer.maxTotalBuffers", Integer.toString(buffer.maxTotalBuffers()));
    map.put("buffer.compressionThreshold", Integer.toString(buffer.compressionThreshold()));
    map.put("buffer.rotationInterval", millis(buffer.rotationInterval()));
    map.put("otel.metrics.exporter", "");
    map.put("otel.exporter.otlp.endpoint", "");
    map.put("otel.resource.attributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static String millis(Duration duration) {
    return duration.toMillis() + "ms";
  }
}
