package ca.gc.cra.harness.domain.pool;

/**
 * Pool occupancy and lifetime counters.
 *
 * @param total pooled resources, idle plus in use
 * @param active resources currently in use
 * @param idle resources available for reuse
 * @param pending queued acquisitions
 * @param totalCreated resources created since start
 * @param totalDestroyed resources destroyed since start, for any reason
 * @param resetFailures destroys caused by a failed reset; also counted in {@code totalDestroyed}
 * @param acquisition latency summary
 * @since 0.1.0
 */
public record PoolMetrics(
    int total,
    int active,
    int idle,
    int pending,
    long totalCreated,
    long totalDestroyed,
    long resetFailures,
    AcquisitionStats acquisition) {}
