package ca.gc.cra.harness.config;

import ca.gc.cra.harness.validation.Numbers;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Buffer cache limits.
 *
 * @param maxBufferSize largest payload accepted in bytes
 * @param maxTotalBuffers entries kept before a forced rotation
 * @param compressionThreshold payload size at or above which entries are compressed
 * @param rotationInterval rotation period and idle age for periodic rotation; zero disables it
 * @since 0.1.0
 */
public record BufferSettings(
    int maxBufferSize,
    int maxTotalBuffers,
    int compressionThreshold,
    Duration rotationInterval) {

  public BufferSettings {
    Numbers.requireRange("buffer.maxBufferSize", maxBufferSize, 1, Integer.MAX_VALUE);
    Numbers.requireRange("buffer.maxTotalBuffers", maxTotalBuffers, 1, 1_000_000);
    Numbers.requireRange("buffer.compressionThreshold", compressionThreshold, 0, Integer.MAX_VALUE);
    Numbers.requireNonNegative("buffer.rotationInterval", rotationInterval);
  }

  /**
   * 1 MB payloads, 50 entries, compression from 64 KB, one minute rotation.
   *
   * @return defaults
   */
  public static BufferSettings defaults() {
    return new BufferSettings(1024 * 1024, 50, 64 * 1024, Duration.ofMinutes(1));
  }

  public static BufferSettings fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    BufferSettings defaults = defaults();
    return new BufferSettings(
        Math.toIntExact(ConfigValues.sizeValue(options, "buffer.maxBufferSize", defaults.maxBufferSize())),
        ConfigValues.intValue(options, "buffer.maxTotalBuffers", defaults.maxTotalBuffers()),
        Math.toIntExact(
            ConfigValues.sizeValue(options, "buffer.compressionThreshold", defaults.compressionThreshold())),
        ConfigValues.durationValue(options, "buffer.rotationInterval", defaults.rotationInterval()));
  }
}
