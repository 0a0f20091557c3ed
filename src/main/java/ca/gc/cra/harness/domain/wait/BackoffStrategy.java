package ca.gc.cra.harness.domain.wait;

/**
 * Named backoff growth curves.
 *
 * <p>Each strategy is a pure function of the attempt number and the base delay. Capping, jitter and
 * the one millisecond floor are applied by {@link WaitOptions#nextDelayMillis(int, double)}.</p>
 *
 * @since 0.1.0
 */
public enum BackoffStrategy {
  /** {@code base * attempt}. */
  LINEAR {
    @Override
    public double delayMillis(int attempt, long baseDelayMillis, double multiplier) {
      return (double) baseDelayMillis * attempt;
    }
  },
  /** {@code base * 2^(attempt-1)}. */
  EXPONENTIAL {
    @Override
    public double delayMillis(int attempt, long baseDelayMillis, double multiplier) {
      return baseDelayMillis * Math.pow(2, attempt - 1);
    }
  },
  /** {@code base * fib(attempt)} with {@code fib(1) = fib(2) = 1}. */
  FIBONACCI {
    @Override
    public double delayMillis(int attempt, long baseDelayMillis, double multiplier) {
      return (double) baseDelayMillis * fibonacci(attempt);
    }
  },
  /** {@code base * attempt^2}. */
  QUADRATIC {
    @Override
    public double delayMillis(int attempt, long baseDelayMillis, double multiplier) {
      return (double) baseDelayMillis * attempt * attempt;
    }
  },
  /** Default curve: {@code base * multiplier^attempt}. */
  MULTIPLIER {
    @Override
    public double delayMillis(int attempt, long baseDelayMillis, double multiplier) {
      return baseDelayMillis * Math.pow(multiplier, attempt);
    }
  };

  /**
   * Computes the raw delay for this curve.
   *
   * @param attempt one-based attempt number
   * @param baseDelayMillis configured initial delay
   * @param multiplier growth factor, used only by {@link #MULTIPLIER}
   * @return un-capped delay in milliseconds
   */
  public abstract double delayMillis(int attempt, long baseDelayMillis, double multiplier);

  static double fibonacci(int n) {
    if (n <= 2) {
      return 1;
    }
    double a = 1;
    double b = 1;
    // Terms beyond ~80 exceed any realistic maxDelay; stop growing once past it.
    for (int i = 3; i <= n && b < 1e18; i++) {
      double next = a + b;
      a = b;
      b = next;
    }
    return b;
  }
}
