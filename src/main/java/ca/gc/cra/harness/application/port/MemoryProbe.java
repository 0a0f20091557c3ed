package ca.gc.cra.harness.application.port;

import ca.gc.cra.harness.domain.pool.MemorySample;

/**
 * Port reading process memory and hinting garbage collection.
 *
 * @since 0.1.0
 */
public interface MemoryProbe {
  /**
   * Reads current memory usage.
   *
   * @return memory sample
   */
  MemorySample sample();

  /**
   * Asks the runtime to collect garbage.
   *
   * @return {@code true} when a hint was issued
   */
  boolean requestGc();
}
