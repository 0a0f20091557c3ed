package ca.gc.cra.harness.config;

import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Effective configuration for one CLI run.
 * <p><strong>Why:</strong> Groups the per-concern settings so the composition root receives a single
 * validated value.</p>
 * <p><strong>Role:</strong> Built from the merged flat map produced by {@link ConfigMerger}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param pool resource pool sizing and timing
 * @param memory memory monitor thresholds
 * @param buffer buffer cache limits
 * @param telemetry OpenTelemetry export
 * @param waits polling defaults
 * @since 0.1.0
 */
public record HarnessConfig(
    PoolSettings pool,
    MemorySettings memory,
    BufferSettings buffer,
    TelemetrySettings telemetry,
    WaitSettings waits) {

  public HarnessConfig {
    Objects.requireNonNull(pool, "pool");
    Objects.requireNonNull(memory, "memory");
    Objects.requireNonNull(buffer, "buffer");
    Objects.requireNonNull(telemetry, "telemetry");
    Objects.requireNonNull(waits, "waits");
  }

  /**
   * Library defaults with telemetry disabled.
   *
   * @return defaults
   */
  public static HarnessConfig defaults() {
    return new HarnessConfig(PoolSettings.defaults(), MemorySettings.defaults(), BufferSettings.defaults(),
        TelemetrySettings.disabled(), WaitSettings.defaults());
  }

  /**
   * Builds every section from one flat map.
   *
   * @param options merged configuration
   * @return configuration
   * @throws IllegalArgumentException when any section rejects its values
   */
  public static HarnessConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    return new HarnessConfig(
        PoolSettings.fromMap(options),
        MemorySettings.fromMap(options),
        BufferSettings.fromMap(options),
        TelemetrySettings.fromMap(options),
        WaitSettings.fromMap(options));
  }

  public HarnessConfig withTelemetry(TelemetrySettings value) {
    return new HarnessConfig(pool, memory, buffer, value, waits);
  }
}
