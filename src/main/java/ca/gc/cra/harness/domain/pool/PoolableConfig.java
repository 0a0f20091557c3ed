package ca.gc.cra.harness.domain.pool;

/**
 * Resource configuration that can be matched against pooled resources.
 *
 * @since 0.1.0
 */
public interface PoolableConfig {
  /**
   * Canonical key; equal keys may share a pooled resource.
   *
   * @return pool key
   */
  ConfigKey poolKey();
}
