package ca.gc.cra.harness.infrastructure.time;

import ca.gc.cra.harness.application.port.ClockPort;
import java.time.Clock;
import java.util.Objects;

/**
 * {@link ClockPort} backed by a {@link java.time.Clock} for wall time and {@link System#nanoTime()} for
 * elapsed-time measurement.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  private final Clock wallClock;

  public SystemClockAdapter() {
    this(Clock.systemUTC());
  }

  public SystemClockAdapter(Clock wallClock) {
    this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
  }

  @Override
  public long nowMillis() {
    return wallClock.millis();
  }

  @Override
  public long monotonicMillis() {
    return System.nanoTime() / 1_000_000L;
  }
}
