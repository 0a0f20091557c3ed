package ca.gc.cra.harness.application.port;

import ca.gc.cra.harness.domain.pool.PoolableConfig;

/**
 * <strong>What:</strong> Creates, resets and destroys the resources a {@code ResourcePool} manages.
 * <p><strong>Role:</strong> Application port; {@code ShellSessionFactory} is the bundled implementation.</p>
 * <p><strong>Thread-safety:</strong> Called from caller threads and the pool's maintenance thread, never
 * while the pool holds its lock; implementations must be thread-safe.</p>
 *
 * @param <C> configuration type
 * @param <R> resource type
 * @since 0.1.0
 */
public interface ResourceFactory<C extends PoolableConfig, R> {
  /**
   * Creates a resource for {@code config}.
   *
   * @param config resource configuration
   * @return new resource
   * @throws Exception when the resource cannot be created
   */
  R create(C config) throws Exception;

  /**
   * Returns a released resource to a clean state.
   *
   * @param resource resource being released
   * @return {@code false} when the resource is no longer usable and must be destroyed
   * @throws Exception when the reset fails; the resource is then destroyed
   */
  boolean reset(R resource) throws Exception;

  /**
   * Releases everything the resource holds.
   *
   * @param resource resource to destroy
   * @throws Exception when cleanup fails; the pool logs and moves on
   */
  void destroy(R resource) throws Exception;

  /**
   * Label used in events and logs, e.g. {@code shell-session}.
   *
   * @return resource type name
   */
  default String resourceType() {
    return "resource";
  }
}
