package ca.gc.cra.harness.application.pool;

/**
 * Wraps a failure thrown by {@code ResourceFactory.create}.
 *
 * @since 0.1.0
 */
public final class ResourceCreationException extends PoolException {
  private static final long serialVersionUID = 1L;

  public ResourceCreationException(String resourceType, Throwable cause) {
    super("failed to create " + resourceType + ": " + cause.getMessage(), cause);
  }
}
