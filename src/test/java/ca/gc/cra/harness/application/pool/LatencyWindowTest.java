package ca.gc.cra.harness.application.pool;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.harness.domain.pool.AcquisitionStats;
import org.junit.jupiter.api.Test;

class LatencyWindowTest {
  @Test
  void emptyWindowReportsZeroes() {
    assertEquals(AcquisitionStats.EMPTY, new LatencyWindow(100).stats());
  }

  @Test
  void percentilesIndexSortedSamples() {
    LatencyWindow window = new LatencyWindow(100);
    for (int i = 100; i >= 1; i--) {
      window.record(i);
    }

    AcquisitionStats stats = window.stats();

    assertEquals(100, stats.samples());
    assertEquals(50.5, stats.averageMillis(), 1e-9);
    assertEquals(96L, stats.p95Millis());
    assertEquals(100L, stats.p99Millis());
  }

  @Test
  void keepsOnlyMostRecentSamples() {
    LatencyWindow window = new LatencyWindow(3);
    window.record(1_000);
    window.record(1);
    window.record(2);
    window.record(3);

    AcquisitionStats stats = window.stats();

    assertEquals(3, stats.samples());
    assertEquals(2.0, stats.averageMillis(), 1e-9);
    assertEquals(3L, stats.p99Millis());
  }

  @Test
  void smallWindowClampsPercentileIndex() {
    LatencyWindow window = new LatencyWindow(100);
    window.record(7);

    assertEquals(7L, window.stats().p95Millis());
    assertEquals(7L, window.stats().p99Millis());
  }
}
