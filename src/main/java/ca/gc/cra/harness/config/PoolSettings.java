package ca.gc.cra.harness.config;

import ca.gc.cra.harness.validation.Numbers;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Sizing and timing of the resource pool.
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param maxPoolSize maximum resources per configuration key
 * @param idleTimeout idle time after which an unused resource is destroyed
 * @param maxAge age after which an idle resource is destroyed
 * @param acquisitionTimeout how long a queued acquisition waits before failing
 * @param idleSweepInterval period of the background idle sweep; zero disables it
 * @param enableMetrics whether {@code onMetricsUpdated} events are published
 * @since 0.1.0
 */
public record PoolSettings(
    int maxPoolSize,
    Duration idleTimeout,
    Duration maxAge,
    Duration acquisitionTimeout,
    Duration idleSweepInterval,
    boolean enableMetrics) {

  public PoolSettings {
    Numbers.requireRange("pool.maxSize", maxPoolSize, 1, 10_000);
    Numbers.requireNonNegative("pool.idleTimeout", idleTimeout);
    Numbers.requireNonNegative("pool.maxAge", maxAge);
    Numbers.requireNonNegative("pool.acquisitionTimeout", acquisitionTimeout);
    Numbers.requireNonNegative("pool.idleSweepInterval", idleSweepInterval);
  }

  /**
   * Ten resources per key, five minute idle timeout, thirty minute max age, thirty second acquisition
   * timeout, one minute sweep, metrics on.
   *
   * @return defaults
   */
  public static PoolSettings defaults() {
    return new PoolSettings(
        10, Duration.ofMinutes(5), Duration.ofMinutes(30), Duration.ofSeconds(30), Duration.ofMinutes(1), true);
  }

  /**
   * Reads {@code pool.*} keys, falling back to {@link #defaults()}.
   *
   * @param options flat configuration map
   * @return settings
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static PoolSettings fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    PoolSettings defaults = defaults();
    return new PoolSettings(
        ConfigValues.intValue(options, "pool.maxSize", defaults.maxPoolSize()),
        ConfigValues.durationValue(options, "pool.idleTimeout", defaults.idleTimeout()),
        ConfigValues.durationValue(options, "pool.maxAge", defaults.maxAge()),
        ConfigValues.durationValue(options, "pool.acquisitionTimeout", defaults.acquisitionTimeout()),
        ConfigValues.durationValue(options, "pool.idleSweepInterval", defaults.idleSweepInterval()),
        ConfigValues.booleanValue(options, "metrics.enabled", defaults.enableMetrics()));
  }

  public PoolSettings withMaxPoolSize(int size) {
    return new PoolSettings(size, idleTimeout, maxAge, acquisitionTimeout, idleSweepInterval, enableMetrics);
  }

  public PoolSettings withAcquisitionTimeout(Duration timeout) {
    return new PoolSettings(maxPoolSize, idleTimeout, maxAge, timeout, idleSweepInterval, enableMetrics);
  }

  public PoolSettings withIdleTimeout(Duration timeout) {
    return new PoolSettings(maxPoolSize, timeout, maxAge, acquisitionTimeout, idleSweepInterval, enableMetrics);
  }

  public PoolSettings withMaxAge(Duration age) {
    return new PoolSettings(maxPoolSize, idleTimeout, age, acquisitionTimeout, idleSweepInterval, enableMetrics);
  }

  public PoolSettings withIdleSweepInterval(Duration interval) {
    return new PoolSettings(maxPoolSize, idleTimeout, maxAge, acquisitionTimeout, interval, enableMetrics);
  }
}
