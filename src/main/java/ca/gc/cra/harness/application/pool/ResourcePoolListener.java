package ca.gc.cra.harness.application.pool;

import ca.gc.cra.harness.domain.pool.DestroyReason;
import ca.gc.cra.harness.domain.pool.MemorySample;
import ca.gc.cra.harness.domain.pool.ResourceMetrics;

/**
 * <strong>What:</strong> Observer of {@link ResourcePool} events.
 * <p><strong>Thread-safety:</strong> Callbacks arrive on caller threads and on the pool's maintenance thread,
 * never while a pool lock is held. Exceptions thrown by a listener are logged and ignored.</p>
 *
 * @since 0.1.0
 */
public interface ResourcePoolListener {
  /** Heap use crossed the soft GC threshold. */
  default void onMemoryWarning(MemorySample sample) {}

  /** Heap use exceeded {@code maxHeapUsed} or RSS exceeded {@code maxRss}. */
  default void onMemoryAlert(MemorySample sample) {}

  default void onResourceCreated(String resourceType, String resourceId) {}

  default void onResourceDestroyed(String resourceType, String resourceId, DestroyReason reason) {}

  /**
   * A rotation removed buffers.
   *
   * @param removed number of buffers removed
   */
  default void onBufferRotated(int removed) {}

  /**
   * A GC hint was issued.
   *
   * @param reason {@code high_memory}, {@code memory_pressure}, {@code shutdown} or {@code manual}
   */
  default void onGcTriggered(String reason) {}

  default void onMetricsUpdated(ResourceMetrics metrics) {}

  /** Fired once when {@link ResourcePool#destroy()} completes. */
  default void onDestroyed() {}
}
