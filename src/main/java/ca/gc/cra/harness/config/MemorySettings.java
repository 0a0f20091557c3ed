package ca.gc.cra.harness.config;

import ca.gc.cra.harness.validation.Numbers;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Memory monitor thresholds.
 *
 * @param maxHeapUsed heap bytes above which the monitor raises an alert and evicts idle resources
 * @param maxRss resident set bytes above which the monitor evicts aggressively
 * @param gcThresholdPercent percentage of {@code maxHeapUsed} above which a GC hint is issued
 * @param monitorInterval sampling period; zero disables the periodic monitor
 * @param enableGarbageCollection whether GC hints are issued at all
 * @since 0.1.0
 */
public record MemorySettings(
    long maxHeapUsed,
    long maxRss,
    int gcThresholdPercent,
    Duration monitorInterval,
    boolean enableGarbageCollection) {

  public MemorySettings {
    Numbers.requireRange("memory.maxHeapUsed", maxHeapUsed, 1, Long.MAX_VALUE);
    Numbers.requireRange("memory.maxRss", maxRss, 1, Long.MAX_VALUE);
    Numbers.requireRange("memory.gcThreshold", gcThresholdPercent, 1, 100);
    Numbers.requireNonNegative("memory.monitorInterval", monitorInterval);
  }

  /**
   * 512 MB heap, 1 GB RSS, 70 percent GC threshold, ten second sampling, GC hints on.
   *
   * @return defaults
   */
  public static MemorySettings defaults() {
    return new MemorySettings(512L * 1024 * 1024, 1024L * 1024 * 1024, 70, Duration.ofSeconds(10), true);
  }

  public static MemorySettings fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    MemorySettings defaults = defaults();
    return new MemorySettings(
        ConfigValues.sizeValue(options, "memory.maxHeapUsed", defaults.maxHeapUsed()),
        ConfigValues.sizeValue(options, "memory.maxRss", defaults.maxRss()),
        ConfigValues.intValue(options, "memory.gcThreshold", defaults.gcThresholdPercent()),
        ConfigValues.durationValue(options, "memory.monitorInterval", defaults.monitorInterval()),
        ConfigValues.booleanValue(options, "memory.enableGc", defaults.enableGarbageCollection()));
  }

  /**
   * Heap level that triggers the soft warning.
   *
   * @return {@code maxHeapUsed * gcThresholdPercent / 100}
   */
  public long softHeapLimit() {
    // split so large limits do not overflow
    return maxHeapUsed / 100 * gcThresholdPercent + maxHeapUsed % 100 * gcThresholdPercent / 100;
  }
}
