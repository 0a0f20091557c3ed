package ca.gc.cra.harness.application.port;

/**
 * <strong>What:</strong> Port supplying time to waiters, supervisors and pools.
 * <p><strong>Why:</strong> Lets backoff loops and idle eviction run against a manual clock in tests.</p>
 * <p><strong>Role:</strong> Application port consumed by {@code Waiter}, {@code ProcessSupervisor} and
 * {@code ResourcePool}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose wall-clock epoch milliseconds for timestamps such as {@code createdAt}/{@code lastUsed}.</li>
 *   <li>Expose a monotonic millisecond reading for measuring elapsed wait time.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 * <p><strong>Performance:</strong> Expected to be constant-time.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.harness.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z; subject to system clock adjustments
   */
  long nowMillis();

  /**
   * Returns a monotonic reading in milliseconds with an arbitrary origin.
   *
   * <p>Only differences between two readings are meaningful.</p>
   *
   * @return monotonic milliseconds
   */
  default long monotonicMillis() {
    return System.nanoTime() / 1_000_000L;
  }

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()} and {@link System#nanoTime()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
