package ca.gc.cra.harness.domain.pool;

/**
 * Acquisition latency summary over the most recent successful acquisitions.
 *
 * @param samples number of latencies in the window
 * @param averageMillis mean latency
 * @param p95Millis 95th percentile latency
 * @param p99Millis 99th percentile latency
 * @since 0.1.0
 */
public record AcquisitionStats(int samples, double averageMillis, long p95Millis, long p99Millis) {
  public static final AcquisitionStats EMPTY = new AcquisitionStats(0, 0.0, 0L, 0L);
}
