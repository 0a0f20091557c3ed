package ca.gc.cra.harness.api;

/**
 * <strong>What:</strong> Exit statuses shared by the harness commands.
 * <p><strong>Why:</strong> CI scripts branch on these values, so they stay stable across releases.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** A file could not be read or a process could not be launched. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure, or the supervised command exited non-zero. */
  RUNTIME_FAILURE(5),
  /** A wait or acquisition ran out of time; matches {@code timeout(1)}. */
  TIMEOUT(124),
  /** Interrupted (e.g. SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
