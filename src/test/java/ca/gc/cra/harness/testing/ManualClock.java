package ca.gc.cra.harness.testing;

import ca.gc.cra.harness.application.port.ClockPort;
import ca.gc.cra.harness.application.port.Sleeper;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Test clock whose sleeps advance time instantly.
 */
public final class ManualClock implements ClockPort, Sleeper {
  private final AtomicLong now;
  private final List<Long> sleeps = new CopyOnWriteArrayList<>();

  public ManualClock() {
    this(1_700_000_000_000L);
  }

  public ManualClock(long startMillis) {
    this.now = new AtomicLong(startMillis);
  }

  @Override
  public long nowMillis() {
    return now.get();
  }

  @Override
  public long monotonicMillis() {
    return now.get();
  }

  @Override
  public void sleep(long millis) throws InterruptedException {
    if (Thread.currentThread().isInterrupted()) {
      throw new InterruptedException("sleep interrupted");
    }
    sleeps.add(millis);
    now.addAndGet(millis);
  }

  public void advance(long millis) {
    now.addAndGet(millis);
  }

  public List<Long> sleeps() {
    return List.copyOf(sleeps);
  }
}
