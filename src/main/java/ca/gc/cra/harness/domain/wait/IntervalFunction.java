package ca.gc.cra.harness.domain.wait;

/**
 * Computes the raw delay before the next attempt from the attempt number and base delay.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface IntervalFunction {
  /**
   * Returns the un-capped delay in milliseconds.
   *
   * @param attempt one-based number of the attempt that just failed
   * @param baseDelayMillis configured initial delay
   * @return delay in milliseconds before capping and jitter
   */
  double delayMillis(int attempt, long baseDelayMillis);
}
