package ca.gc.cra.harness.application.pool;

import ca.gc.cra.harness.domain.pool.AcquisitionStats;
import java.util.Arrays;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ring of the most recent acquisition latencies.
 *
 * <p>Percentiles index the sorted window at {@code floor(n * 0.95)} and {@code floor(n * 0.99)}, clamped to the
 * last element.</p>
 */
final class LatencyWindow {
  private final long[] samples;
  private final ReentrantLock lock = new ReentrantLock();
  private int next;
  private int count;

  LatencyWindow(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.samples = new long[capacity];
  }

  void record(long latencyMillis) {
    lock.lock();
    try {
      samples[next] = Math.max(0L, latencyMillis);
      next = (next + 1) % samples.length;
      if (count < samples.length) {
        count++;
      }
    } finally {
      lock.unlock();
    }
  }

  AcquisitionStats stats() {
    long[] sorted;
    lock.lock();
    try {
      if (count == 0) {
        return AcquisitionStats.EMPTY;
      }
      sorted = Arrays.copyOf(samples, count);
    } finally {
      lock.unlock();
    }
    Arrays.sort(sorted);
    long sum = 0L;
    for (long sample : sorted) {
      sum += sample;
    }
    int n = sorted.length;
    return new AcquisitionStats(
        n,
        (double) sum / n,
        sorted[Math.min(n - 1, (int) Math.floor(n * 0.95))],
        sorted[Math.min(n - 1, (int) Math.floor(n * 0.99))]);
  }

  void clear() {
    lock.lock();
    try {
      next = 0;
      count = 0;
    } finally {
      lock.unlock();
    }
  }
}
