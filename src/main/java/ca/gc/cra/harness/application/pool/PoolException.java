package ca.gc.cra.harness.application.pool;

/**
 * Checked failure surfaced to callers of {@link ResourcePool}.
 *
 * @since 0.1.0
 */
public class PoolException extends Exception {
  private static final long serialVersionUID = 1L;

  public PoolException(String message) {
    super(message);
  }

  public PoolException(String message, Throwable cause) {
    super(message, cause);
  }
}
