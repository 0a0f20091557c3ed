package ca.gc.cra.harness.application.port;

/**
 * Port for suspending the calling thread between polling attempts.
 *
 * <p>Tests substitute an implementation that advances a manual clock instead of blocking.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Sleeper {
  /**
   * Blocks the calling thread for roughly {@code millis} milliseconds.
   *
   * @param millis non-negative sleep duration
   * @throws InterruptedException when the thread is interrupted while sleeping
   */
  void sleep(long millis) throws InterruptedException;

  /** Sleeper backed by {@link Thread#sleep(long)}. */
  Sleeper SYSTEM = Thread::sleep;
}
