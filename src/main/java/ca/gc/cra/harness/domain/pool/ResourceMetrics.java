package ca.gc.cra.harness.domain.pool;

import java.util.Objects;

/**
 * Point-in-time snapshot of pool, memory and buffer state.
 *
 * @param pool pool counters
 * @param memory memory counters
 * @param buffers buffer cache counters
 * @since 0.1.0
 */
public record ResourceMetrics(PoolMetrics pool, MemoryMetrics memory, BufferMetrics buffers) {
  public ResourceMetrics {
    Objects.requireNonNull(pool, "pool");
    Objects.requireNonNull(memory, "memory");
    Objects.requireNonNull(buffers, "buffers");
  }
}
