package ca.gc.cra.harness.domain.pool;

/**
 * One reading of process memory.
 *
 * @param heapUsed heap bytes in use
 * @param heapCommitted heap bytes committed
 * @param rss resident set size in bytes, {@code -1} when the platform does not expose it
 * @since 0.1.0
 */
public record MemorySample(long heapUsed, long heapCommitted, long rss) {
  public boolean rssKnown() {
    return rss >= 0;
  }
}
