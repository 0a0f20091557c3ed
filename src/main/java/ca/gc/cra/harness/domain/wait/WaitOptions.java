package ca.gc.cra.harness.domain.wait;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable tuning for a polling wait.
 * <p><strong>Why:</strong> Keeps the backoff curve, deadline and jitter together so callers can share presets.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * <p>Defaults: initial delay 10 ms, max delay 2 000 ms, timeout 30 s, multiplier 1.5, jitter 0.1,
 * {@link BackoffStrategy#MULTIPLIER}, fail-fast disabled.</p>
 *
 * @since 0.1.0
 */
public final class WaitOptions {
  private static final WaitOptions DEFAULTS = builder().build();

  private final Duration initialDelay;
  private final Duration maxDelay;
  private final Duration timeout;
  private final double backoffMultiplier;
  private final double jitter;
  private final BackoffStrategy strategy;
  private final IntervalFunction intervalFunction;
  private final int failFastAfterIdenticalErrors;

  private WaitOptions(Builder builder) {
    this.initialDelay = requireNonNegative("initialDelay", builder.initialDelay);
    this.maxDelay = requireNonNegative("maxDelay", builder.maxDelay);
    this.timeout = requireNonNegative("timeout", builder.timeout);
    if (!(builder.backoffMultiplier > 0) || Double.isInfinite(builder.backoffMultiplier)) {
      throw new IllegalArgumentException("backoffMultiplier must be a positive finite number");
    }
    if (!(builder.jitter >= 0 && builder.jitter <= 1)) {
      throw new IllegalArgumentException("jitter must be between 0 and 1 (was " + builder.jitter + ")");
    }
    if (builder.failFastAfterIdenticalErrors < 0) {
      throw new IllegalArgumentException("failFastAfterIdenticalErrors must be non-negative");
    }
    this.backoffMultiplier = builder.backoffMultiplier;
    this.jitter = builder.jitter;
    this.strategy = Objects.requireNonNull(builder.strategy, "strategy");
    this.intervalFunction = builder.intervalFunction;
    this.failFastAfterIdenticalErrors = builder.failFastAfterIdenticalErrors;
  }

  /**
   * Returns the library defaults.
   *
   * @return default options
   */
  public static WaitOptions defaults() {
    return DEFAULTS;
  }

  /**
   * Preset for prompt detection: 50 ms initial, 1 s max, 10 s timeout.
   *
   * @return prompt preset
   */
  public static WaitOptions promptDefaults() {
    return preset(50, 1_000, 10_000);
  }

  /**
   * Preset for observing a new process id: 10 ms initial, 500 ms max, 5 s timeout.
   *
   * @return process start preset
   */
  public static WaitOptions processStartDefaults() {
    return preset(10, 500, 5_000);
  }

  /**
   * Preset for observing process exit: 100 ms initial, 2 s max, 30 s timeout.
   *
   * @return process exit preset
   */
  public static WaitOptions processExitDefaults() {
    return preset(100, 2_000, 30_000);
  }

  /**
   * Preset for file appearance: 100 ms initial, 1 s max, 10 s timeout.
   *
   * @return file preset
   */
  public static WaitOptions fileDefaults() {
    return preset(100, 1_000, 10_000);
  }

  private static WaitOptions preset(long initialMillis, long maxMillis, long timeoutMillis) {
    return builder()
        .initialDelay(Duration.ofMillis(initialMillis))
        .maxDelay(Duration.ofMillis(maxMillis))
        .timeout(Duration.ofMillis(timeoutMillis))
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a builder pre-populated with these options.
   *
   * @return builder copy
   */
  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.initialDelay = initialDelay;
    builder.maxDelay = maxDelay;
    builder.timeout = timeout;
    builder.backoffMultiplier = backoffMultiplier;
    builder.jitter = jitter;
    builder.strategy = strategy;
    builder.intervalFunction = intervalFunction;
    builder.failFastAfterIdenticalErrors = failFastAfterIdenticalErrors;
    return builder;
  }

  /**
   * Computes the sleep before the next attempt.
   *
   * <p>The raw delay comes from the custom interval function when present, otherwise from the strategy.
   * It is capped at {@code maxDelay}, perturbed by {@code ±(jitter * delay) / 2} and floored at 1 ms.</p>
   *
   * @param attempt one-based number of the attempt that just failed
   * @param random uniform sample in {@code [0, 1)}; {@code 0.5} yields no jitter
   * @return delay in milliseconds, at least 1
   */
  public long nextDelayMillis(int attempt, double random) {
    long base = initialDelay.toMillis();
    double raw = intervalFunction != null
        ? intervalFunction.delayMillis(attempt, base)
        : strategy.delayMillis(attempt, base, backoffMultiplier);
    double max = maxDelay.toMillis();
    double capped = Double.isNaN(raw) ? max : Math.min(raw, max);
    double jittered = capped + (random - 0.5) * jitter * capped;
    return Math.max(1L, Math.round(jittered));
  }

  public Duration initialDelay() {
    return initialDelay;
  }

  public Duration maxDelay() {
    return maxDelay;
  }

  public Duration timeout() {
    return timeout;
  }

  public double backoffMultiplier() {
    return backoffMultiplier;
  }

  public double jitter() {
    return jitter;
  }

  public BackoffStrategy strategy() {
    return strategy;
  }

  public Optional<IntervalFunction> intervalFunction() {
    return Optional.ofNullable(intervalFunction);
  }

  /**
   * Number of consecutive identical condition errors after which the wait gives up early.
   *
   * @return threshold, {@code 0} when disabled
   */
  public int failFastAfterIdenticalErrors() {
    return failFastAfterIdenticalErrors;
  }

  @Override
  public String toString() {
    return "WaitOptions{initialDelay=" + initialDelay.toMillis() + "ms, maxDelay=" + maxDelay.toMillis()
        + "ms, timeout=" + timeout.toMillis() + "ms, multiplier=" + backoffMultiplier + ", jitter=" + jitter
        + ", strategy=" + strategy + (intervalFunction != null ? ", custom" : "") + '}';
  }

  private static Duration requireNonNegative(String name, Duration value) {
    Objects.requireNonNull(value, name);
    if (value.isNegative()) {
      throw new IllegalArgumentException(name + " must be non-negative");
    }
    return value;
  }

  /** Mutable builder for {@link WaitOptions}. */
  public static final class Builder {
    private Duration initialDelay = Duration.ofMillis(10);
    private Duration maxDelay = Duration.ofMillis(2_000);
    private Duration timeout = Duration.ofMillis(30_000);
    private double backoffMultiplier = 1.5;
    private double jitter = 0.1;
    private BackoffStrategy strategy = BackoffStrategy.MULTIPLIER;
    private IntervalFunction intervalFunction;
    private int failFastAfterIdenticalErrors;

    private Builder() {}

    public Builder initialDelay(Duration initialDelay) {
      this.initialDelay = initialDelay;
      return this;
    }

    public Builder maxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
      return this;
    }

    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public Builder backoffMultiplier(double backoffMultiplier) {
      this.backoffMultiplier = backoffMultiplier;
      return this;
    }

    public Builder jitter(double jitter) {
      this.jitter = jitter;
      return this;
    }

    public Builder strategy(BackoffStrategy strategy) {
      this.strategy = strategy;
      return this;
    }

    /**
     * Overrides the strategy with a custom curve; {@code null} restores the strategy.
     *
     * @param intervalFunction custom delay function
     * @return this builder
     */
    public Builder intervalFunction(IntervalFunction intervalFunction) {
      this.intervalFunction = intervalFunction;
      return this;
    }

    /**
     * Gives up after this many consecutive condition errors with the same type and message.
     *
     * @param threshold error count, {@code 0} disables
     * @return this builder
     */
    public Builder failFastAfterIdenticalErrors(int threshold) {
      this.failFastAfterIdenticalErrors = threshold;
      return this;
    }

    public WaitOptions build() {
      return new WaitOptions(this);
    }
  }
}
