package ca.gc.cra.harness.application.pool;

/**
 * Raised for acquisitions that are pending when, or requested after, the pool is destroyed.
 *
 * @since 0.1.0
 */
public final class PoolShutdownException extends PoolException {
  private static final long serialVersionUID = 1L;

  public PoolShutdownException() {
    super("pool is shutting down");
  }
}
