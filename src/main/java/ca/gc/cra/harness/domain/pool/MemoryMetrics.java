package ca.gc.cra.harness.domain.pool;

/**
 * Most recent memory sample plus garbage-collection hint counters.
 *
 * @param heapUsed heap bytes in use
 * @param heapCommitted heap bytes committed by the JVM
 * @param rss resident set size in bytes, {@code -1} when unknown
 * @param gcRuns GC hints issued
 * @param lastGcTime epoch millis of the last hint, {@code 0} when none
 * @since 0.1.0
 */
public record MemoryMetrics(long heapUsed, long heapCommitted, long rss, long gcRuns, long lastGcTime) {}
