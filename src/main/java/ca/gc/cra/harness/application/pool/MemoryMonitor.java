package ca.gc.cra.harness.application.pool;

import ca.gc.cra.harness.application.port.ClockPort;
import ca.gc.cra.harness.application.port.MemoryProbe;
import ca.gc.cra.harness.application.port.MetricsPort;
import ca.gc.cra.harness.config.MemorySettings;
import ca.gc.cra.harness.domain.pool.MemoryMetrics;
import ca.gc.cra.harness.domain.pool.MemorySample;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Compares memory samples against the soft, heap and RSS limits.
 * <p><strong>Why:</strong> Long suites that pool many shells need to shed idle resources before the JVM or
 * the host runs out of memory.</p>
 * <p><strong>Responsibilities:</strong> Each check is evaluated independently, so one sample above every limit
 * triggers all three responses in order: soft warning with a GC hint, heap alert, RSS alert.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; counters are atomic.</p>
 * <p><strong>Observability:</strong> Emits {@code memory.warning}, {@code memory.alert} and {@code memory.gc}.</p>
 *
 * @since 0.1.0
 */
public final class MemoryMonitor {
  private static final Logger log = LoggerFactory.getLogger(MemoryMonitor.class);

  /** Reactions the owning pool performs when a limit is crossed. */
  public interface PressureResponse {
    void onWarning(MemorySample sample);

    void onHeapExceeded(MemorySample sample);

    void onRssExceeded(MemorySample sample);

    void onGcTriggered(String reason);
  }

  private final MemoryProbe probe;
  private final MemorySettings settings;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final PressureResponse response;
  private final AtomicLong gcRuns = new AtomicLong();
  private final AtomicLong lastGcTime = new AtomicLong();

  public MemoryMonitor(
      MemoryProbe probe,
      MemorySettings settings,
      ClockPort clock,
      MetricsPort metrics,
      PressureResponse response) {
    this.probe = Objects.requireNonNull(probe, "probe");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.response = Objects.requireNonNull(response, "response");
  }

  /**
   * Takes one sample and applies every threshold it crosses.
   *
   * @return the sample evaluated
   */
  public MemorySample sampleOnce() {
    MemorySample sample = probe.sample();

    if (sample.heapUsed() > settings.softHeapLimit()) {
      log.debug("Heap {} above soft limit {}", sample.heapUsed(), settings.softHeapLimit());
      metrics.increment("memory.warning");
      response.onWarning(sample);
      requestGc("high_memory");
    }
    if (sample.heapUsed() > settings.maxHeapUsed()) {
      log.warn("Heap {} exceeds maxHeapUsed {}; evicting idle resources", sample.heapUsed(),
          settings.maxHeapUsed());
      metrics.increment("memory.alert");
      response.onHeapExceeded(sample);
    }
    if (sample.rssKnown() && sample.rss() > settings.maxRss()) {
      log.warn("RSS {} exceeds maxRss {}; running aggressive cleanup", sample.rss(), settings.maxRss());
      metrics.increment("memory.alert");
      response.onRssExceeded(sample);
    }
    return sample;
  }

  /**
   * Issues a GC hint unless disabled.
   *
   * @param reason label passed to listeners
   * @return {@code true} when a hint was issued
   */
  public boolean requestGc(String reason) {
    if (!settings.enableGarbageCollection()) {
      return false;
    }
    if (!probe.requestGc()) {
      return false;
    }
    gcRuns.incrementAndGet();
    lastGcTime.set(clock.nowMillis());
    metrics.increment("memory.gc");
    log.debug("GC hint issued ({})", reason);
    response.onGcTriggered(reason);
    return true;
  }

  /**
   * Reads current memory and combines it with the GC hint counters.
   *
   * @return memory metrics
   */
  public MemoryMetrics metrics() {
    MemorySample sample = probe.sample();
    return new MemoryMetrics(sample.heapUsed(), sample.heapCommitted(), sample.rss(), gcRuns.get(),
        lastGcTime.get());
  }
}
