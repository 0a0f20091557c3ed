package ca.gc.cra.harness.domain.process;

/**
 * Lifecycle state of a supervised process.
 *
 * <p>{@link #KILLED} means a signal was delivered but the exit has not been observed yet.</p>
 *
 * @since 0.1.0
 */
public enum ProcessStatus {
  RUNNING,
  TERMINATED,
  KILLED,
  EXITED;

  /**
   * Whether the process is known to be gone.
   *
   * @return {@code true} for {@link #TERMINATED} and {@link #EXITED}
   */
  public boolean isTerminal() {
    return this == TERMINATED || this == EXITED;
  }
}
