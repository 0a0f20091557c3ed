package ca.gc.cra.harness.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.harness.domain.wait.BackoffStrategy;
import ca.gc.cra.harness.domain.wait.WaitOptions;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SettingsFromMapTest {

  @Test
  void emptyMapYieldsDefaults() {
    HarnessConfig config = HarnessConfig.fromMap(Map.of("otel.metrics.exporter", "none"));

    assertEquals(PoolSettings.defaults(), config.pool());
    assertEquals(MemorySettings.defaults(), config.memory());
    assertEquals(BufferSettings.defaults(), config.buffer());
    assertEquals(WaitOptions.defaults().timeout(), config.waits().options().timeout());
    assertFalse(config.telemetry().enabled());
  }

  @Test
  void poolKeysAcceptDurationSuffixes() {
    PoolSettings settings = PoolSettings.fromMap(Map.of(
        "pool.maxSize", "4",
        "pool.idleTimeout", "90s",
        "pool.maxAge", "2h",
        "pool.acquisitionTimeout", "250",
        "pool.idleSweepInterval", "0",
        "metrics.enabled", "off"));

    assertEquals(4, settings.maxPoolSize());
    assertEquals(Duration.ofSeconds(90), settings.idleTimeout());
    assertEquals(Duration.ofHours(2), settings.maxAge());
    assertEquals(Duration.ofMillis(250), settings.acquisitionTimeout());
    assertEquals(Duration.ZERO, settings.idleSweepInterval());
    assertFalse(settings.enableMetrics());
  }

  @Test
  void poolRejectsOutOfRangeSize() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> PoolSettings.fromMap(Map.of("pool.maxSize", "0")));
    assertTrue(ex.getMessage().contains("pool.maxSize"));
  }

  @Test
  void malformedDurationNamesTheKey() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> PoolSettings.fromMap(Map.of("pool.idleTimeout", "soon")));
    assertTrue(ex.getMessage().startsWith("pool.idleTimeout"));
  }

  @Test
  void memorySizesUseBinaryUnits() {
    MemorySettings settings = MemorySettings.fromMap(Map.of(
        "memory.maxHeapUsed", "256MB",
        "memory.maxRss", "2gb",
        "memory.gcThreshold", "80",
        "memory.enableGc", "no"));

    assertEquals(256L * 1024 * 1024, settings.maxHeapUsed());
    assertEquals(2L * 1024 * 1024 * 1024, settings.maxRss());
    assertEquals(80, settings.gcThresholdPercent());
    assertFalse(settings.enableGarbageCollection());
  }

  @Test
  void softHeapLimitIsExactPercentage() {
    MemorySettings settings = new MemorySettings(1_000, 2_000, 70, Duration.ZERO, true);
    assertEquals(700, settings.softHeapLimit());

    MemorySettings huge = new MemorySettings(Long.MAX_VALUE, Long.MAX_VALUE, 100, Duration.ZERO, true);
    assertEquals(Long.MAX_VALUE, huge.softHeapLimit());
  }

  @Test
  void memoryThresholdMustBePercentage() {
    assertThrows(IllegalArgumentException.class,
        () -> MemorySettings.fromMap(Map.of("memory.gcThreshold", "101")));
  }

  @Test
  void bufferKeysParse() {
    BufferSettings settings = BufferSettings.fromMap(Map.of(
        "buffer.maxBufferSize", "2MB",
        "buffer.maxTotalBuffers", "8",
        "buffer.compressionThreshold", "1kb",
        "buffer.rotationInterval", "5m"));

    assertEquals(2 * 1024 * 1024, settings.maxBufferSize());
    assertEquals(8, settings.maxTotalBuffers());
    assertEquals(1024, settings.compressionThreshold());
    assertEquals(Duration.ofMinutes(5), settings.rotationInterval());
  }

  @Test
  void bufferSizeBeyondIntRangeFails() {
    assertThrows(ArithmeticException.class,
        () -> BufferSettings.fromMap(Map.of("buffer.maxBufferSize", "4GB")));
  }

  @Test
  void waitKeysBuildOptions() {
    WaitOptions options = WaitSettings.fromMap(Map.of(
        "wait.initialDelay", "20ms",
        "wait.maxDelay", "1s",
        "wait.timeout", "5s",
        "wait.backoffMultiplier", "2.0",
        "wait.jitter", "0",
        "wait.strategy", "fibonacci",
        "wait.failFastAfter", "3")).options();

    assertEquals(Duration.ofMillis(20), options.initialDelay());
    assertEquals(Duration.ofSeconds(1), options.maxDelay());
    assertEquals(Duration.ofSeconds(5), options.timeout());
    assertEquals(2.0, options.backoffMultiplier());
    assertEquals(0.0, options.jitter());
    assertEquals(BackoffStrategy.FIBONACCI, options.strategy());
    assertEquals(3, options.failFastAfterIdenticalErrors());
  }

  @Test
  void unknownWaitStrategyListsChoices() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> WaitSettings.fromMap(Map.of("wait.strategy", "random")));
    assertTrue(ex.getMessage().contains("fibonacci"));
  }

  @Test
  void waitJitterOutsideRangeIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> WaitSettings.fromMap(Map.of("wait.jitter", "1.5")));
  }

  @Test
  void withTimeoutKeepsOtherTuning() {
    WaitSettings settings = WaitSettings.fromMap(Map.of("wait.strategy", "linear"));

    WaitOptions adjusted = settings.withTimeout(Duration.ofMillis(300));

    assertEquals(Duration.ofMillis(300), adjusted.timeout());
    assertEquals(BackoffStrategy.LINEAR, adjusted.strategy());
  }

  @Test
  void telemetryFallsBackToEnvironment() {
    TelemetrySettings settings = TelemetrySettings.fromMap(Map.of(), Map.of(
        "OTEL_METRICS_EXPORTER", "none",
        "OTEL_EXPORTER_OTLP_ENDPOINT", "http://collector:4317"));

    assertEquals("none", settings.exporter());
    assertEquals("http://collector:4317", settings.endpoint());
  }

  @Test
  void telemetryKeysBeatEnvironment() {
    TelemetrySettings settings = TelemetrySettings.fromMap(
        Map.of("otel.metrics.exporter", "OTLP", "otel.export.interval", "5s"),
        Map.of("OTEL_METRICS_EXPORTER", "none"));

    assertEquals("otlp", settings.exporter());
    assertTrue(settings.enabled());
    assertEquals(Duration.ofSeconds(5), settings.exportInterval());
  }

  @Test
  void blankTelemetryKeysDoNotMaskEnvironment() {
    TelemetrySettings settings = TelemetrySettings.fromMap(
        Map.of("otel.metrics.exporter", ""), Map.of("OTEL_METRICS_EXPORTER", "none"));

    assertFalse(settings.enabled());
  }

  @Test
  void telemetryRejectsUnknownExporter() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetrySettings.fromMap(Map.of("otel.metrics.exporter", "prometheus"), Map.of()));
  }
}
