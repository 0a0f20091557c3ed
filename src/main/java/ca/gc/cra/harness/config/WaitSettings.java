package ca.gc.cra.harness.config;

import ca.gc.cra.harness.domain.wait.BackoffStrategy;
import ca.gc.cra.harness.domain.wait.WaitOptions;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Polling defaults applied by the CLI when it waits on files, processes or output.
 *
 * @param options validated wait options
 * @since 0.1.0
 */
public record WaitSettings(WaitOptions options) {

  public WaitSettings {
    Objects.requireNonNull(options, "options");
  }

  public static WaitSettings defaults() {
    return new WaitSettings(WaitOptions.defaults());
  }

  /**
   * Reads {@code wait.*} keys on top of {@link WaitOptions#defaults()}.
   *
   * @param options flat configuration map
   * @return settings
   * @throws IllegalArgumentException when a value is malformed or rejected by {@link WaitOptions}
   */
  public static WaitSettings fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    WaitOptions defaults = WaitOptions.defaults();
    WaitOptions.Builder builder = defaults.toBuilder()
        .initialDelay(ConfigValues.durationValue(options, "wait.initialDelay", defaults.initialDelay()))
        .maxDelay(ConfigValues.durationValue(options, "wait.maxDelay", defaults.maxDelay()))
        .timeout(ConfigValues.durationValue(options, "wait.timeout", defaults.timeout()))
        .backoffMultiplier(ConfigValues.doubleValue(options, "wait.backoffMultiplier", defaults.backoffMultiplier()))
        .jitter(ConfigValues.doubleValue(options, "wait.jitter", defaults.jitter()))
        .failFastAfterIdenticalErrors(
            ConfigValues.intValue(options, "wait.failFastAfter", defaults.failFastAfterIdenticalErrors()));
    String strategy = options.get("wait.strategy");
    if (strategy != null && !strategy.isBlank()) {
      builder.strategy(parseStrategy(strategy));
    }
    return new WaitSettings(builder.build());
  }

  /**
   * Copies these options with a different deadline.
   *
   * @param timeout new deadline
   * @return adjusted options
   */
  public WaitOptions withTimeout(Duration timeout) {
    return options.toBuilder().timeout(timeout).build();
  }

  private static BackoffStrategy parseStrategy(String raw) {
    try {
      return BackoffStrategy.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "wait.strategy must be one of linear, exponential, fibonacci, quadratic, multiplier (was '" + raw + "')",
          ex);
    }
  }
}
