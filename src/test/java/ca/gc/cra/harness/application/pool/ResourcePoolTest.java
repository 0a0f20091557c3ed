package ca.gc.cra.harness.application.pool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.harness.application.pool.FakeResources.Handle;
import ca.gc.cra.harness.application.pool.FakeResources.Spec;
import ca.gc.cra.harness.application.port.ClockPort;
import ca.gc.cra.harness.application.port.MetricsPort;
import ca.gc.cra.harness.config.BufferSettings;
import ca.gc.cra.harness.config.MemorySettings;
import ca.gc.cra.harness.config.PoolSettings;
import ca.gc.cra.harness.domain.pool.PoolMetrics;
import ca.gc.cra.harness.infrastructure.compress.GzipCompressionCodec;
import ca.gc.cra.harness.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.harness.testing.ManualClock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ResourcePoolTest {
  private static final PoolSettings NO_SWEEP = PoolSettings.defaults()
      .withMaxPoolSize(2)
      .withAcquisitionTimeout(Duration.ofMillis(100))
      .withIdleSweepInterval(Duration.ZERO);
  private static final MemorySettings NO_MONITOR = new MemorySettings(1_000L, 2_000L, 70, Duration.ZERO, true);
  private static final BufferSettings NO_ROTATION = new BufferSettings(1_024, 10, 512, Duration.ZERO);

  private FakeResources factory;
  private FakeMemoryProbe probe;
  private RecordingPoolListener listener;
  private ManualClock clock;
  private ResourcePool<Spec, Handle> pool;

  @BeforeEach
  void setUp() {
    factory = new FakeResources();
    probe = new FakeMemoryProbe();
    listener = new RecordingPoolListener();
    clock = new ManualClock();
  }

  @AfterEach
  void tearDown() {
    if (pool != null) {
      pool.destroy();
    }
  }

  private ResourcePool<Spec, Handle> newPool(PoolSettings settings, ClockPort clockPort) {
    return newPool(settings, clockPort, MetricsPort.NO_OP,
        ExecutorFactories.newMaintenanceScheduler("pool-test"));
  }

  private ResourcePool<Spec, Handle> newPool(
      PoolSettings settings, ClockPort clockPort, MetricsPort metrics, ScheduledExecutorService scheduler) {
    pool = ResourcePool.builder(factory)
        .poolSettings(settings)
        .memorySettings(NO_MONITOR)
        .bufferSettings(NO_ROTATION)
        .memoryProbe(probe)
        .compressionCodec(new GzipCompressionCodec())
        .clock(clockPort)
        .metrics(metrics)
        .scheduler(scheduler)
        .build();
    pool.addListener(listener);
    return pool;
  }

  @Test
  void releasedResourceIsResetAndReusedForSameKey() throws Exception {
    newPool(NO_SWEEP, clock);

    Handle first = pool.acquire(new Spec("bash", "one"));
    assertTrue(pool.release(first));
    Handle second = pool.acquire(new Spec("bash", "two"));

    assertSame(first, second);
    assertEquals(1, first.resets);
    assertEquals(1, factory.created.size());
  }

  @Test
  void differentKeyGetsItsOwnResource() throws Exception {
    newPool(NO_SWEEP, clock);

    Handle bash = pool.acquire(Spec.of("bash"));
    pool.release(bash);
    Handle zsh = pool.acquire(Spec.of("zsh"));

    assertNotSame(bash, zsh);
    assertEquals("zsh", zsh.flavour);
    PoolMetrics metrics = pool.getMetrics().pool();
    assertEquals(2, metrics.total());
    assertEquals(1, metrics.active());
    assertEquals(1, metrics.idle());
  }

  @Test
  void queuedAcquisitionTimesOutWhenNothingIsReleased() throws Exception {
    newPool(NO_SWEEP, ClockPort.SYSTEM);
    pool.acquire(Spec.of("bash"));
    pool.acquire(Spec.of("bash"));

    long started = System.nanoTime();
    AcquisitionTimeoutException ex =
        assertThrows(AcquisitionTimeoutException.class, () -> pool.acquire(Spec.of("bash")));

    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
    assertTrue(elapsedMillis >= 90, "timed out after " + elapsedMillis + " ms");
    assertEquals(Duration.ofMillis(100), ex.timeout());
    assertEquals(0, pool.getMetrics().pool().pending());
    assertEquals(2, factory.created.size());
  }

  @Test
  void releaseResolvesQueuedAcquisitionWithResetResource() throws Exception {
    newPool(NO_SWEEP, ClockPort.SYSTEM);
    Handle a = pool.acquire(Spec.of("bash"));
    pool.acquire(Spec.of("bash"));

    CompletableFuture<Handle> third = pool.acquireAsync(Spec.of("bash"));
    assertFalse(third.isDone());
    assertEquals(1, pool.getMetrics().pool().pending());

    pool.release(a);

    assertSame(a, third.get(1, TimeUnit.SECONDS));
    assertEquals(1, a.resets);
    assertEquals(0, pool.getMetrics().pool().pending());
  }

  @Test
  void blockingAcquireWakesWhenAnotherThreadReleases() throws Exception {
    newPool(NO_SWEEP.withAcquisitionTimeout(Duration.ofSeconds(5)), ClockPort.SYSTEM);
    Handle a = pool.acquire(Spec.of("bash"));
    pool.acquire(Spec.of("bash"));

    ScheduledExecutorService releaser = Executors.newSingleThreadScheduledExecutor();
    try {
      releaser.schedule(() -> pool.release(a), 50, TimeUnit.MILLISECONDS);
      assertSame(a, pool.acquire(Spec.of("bash")));
    } finally {
      releaser.shutdownNow();
    }
  }

  @Test
  void queuedRequestsAreServedInArrivalOrder() throws Exception {
    newPool(NO_SWEEP.withMaxPoolSize(1).withAcquisitionTimeout(Duration.ofSeconds(5)), ClockPort.SYSTEM);
    Handle only = pool.acquire(Spec.of("bash"));

    CompletableFuture<Handle> first = pool.acquireAsync(Spec.of("bash"));
    CompletableFuture<Handle> second = pool.acquireAsync(Spec.of("bash"));

    pool.release(only);
    assertTrue(first.isDone());
    assertFalse(second.isDone());

    pool.release(first.get());
    assertSame(only, second.get(1, TimeUnit.SECONDS));
  }

  @Test
  void releaseSkipsWaitersWhoseKeyDoesNotMatch() throws Exception {
    newPool(NO_SWEEP.withMaxPoolSize(1).withAcquisitionTimeout(Duration.ofSeconds(5)), ClockPort.SYSTEM);
    Handle bash = pool.acquire(Spec.of("bash"));

    CompletableFuture<Handle> zsh = pool.acquireAsync(Spec.of("zsh"));
    CompletableFuture<Handle> moreBash = pool.acquireAsync(Spec.of("bash"));

    pool.release(bash);

    assertFalse(zsh.isDone());
    assertSame(bash, moreBash.get(1, TimeUnit.SECONDS));
    zsh.cancel(false);
  }

  @Test
  void cancelledQueuedRequestIsSkipped() throws Exception {
    newPool(NO_SWEEP.withMaxPoolSize(1).withAcquisitionTimeout(Duration.ofSeconds(5)), ClockPort.SYSTEM);
    Handle only = pool.acquire(Spec.of("bash"));
    CompletableFuture<Handle> abandoned = pool.acquireAsync(Spec.of("bash"));
    CompletableFuture<Handle> waiting = pool.acquireAsync(Spec.of("bash"));

    abandoned.cancel(false);
    pool.release(only);

    assertSame(only, waiting.get(1, TimeUnit.SECONDS));
    assertEquals(0, pool.getMetrics().pool().pending());
  }

  @Test
  void failedResetDestroysResourceAndCountsIt() throws Exception {
    newPool(NO_SWEEP, clock);
    Handle handle = pool.acquire(Spec.of("bash"));
    factory.failReset = true;

    assertTrue(pool.release(handle));

    assertTrue(handle.destroyed);
    PoolMetrics metrics = pool.getMetrics().pool();
    assertEquals(0, metrics.total());
    assertEquals(1, metrics.totalDestroyed());
    assertEquals(1, metrics.resetFailures());
    assertTrue(listener.events.contains("destroyed:fake-1:RESET_FAILED"));
  }

  @Test
  void resetReportingUnusableFreesCapacityForWaiter() throws Exception {
    newPool(NO_SWEEP.withMaxPoolSize(1).withAcquisitionTimeout(Duration.ofSeconds(5)), ClockPort.SYSTEM);
    Handle bash = pool.acquire(Spec.of("bash"));
    CompletableFuture<Handle> zsh = pool.acquireAsync(Spec.of("zsh"));
    factory.resetReturnsFalse = true;

    pool.release(bash);

    Handle replacement = zsh.get(1, TimeUnit.SECONDS);
    assertEquals("zsh", replacement.flavour);
    assertTrue(bash.destroyed);
    assertEquals(1, pool.getMetrics().pool().total());
  }

  @Test
  void cleanupIdleDestroysOnlyStaleIdleResources() throws Exception {
    newPool(NO_SWEEP, clock);
    Handle idle = pool.acquire(Spec.of("bash"));
    Handle busy = pool.acquire(Spec.of("bash"));
    pool.release(idle);

    clock.advance(Duration.ofMinutes(4).toMillis());
    assertEquals(0, pool.cleanupIdle());

    clock.advance(Duration.ofMinutes(1).toMillis());
    assertEquals(1, pool.cleanupIdle());

    assertTrue(idle.destroyed);
    assertFalse(busy.destroyed);
    assertTrue(listener.events.contains("destroyed:fake-1:IDLE_TIMEOUT"));
    assertEquals(1, pool.getMetrics().pool().active());
  }

  @Test
  void cleanupIdleDestroysResourcesPastMaxAge() throws Exception {
    newPool(NO_SWEEP, clock);
    Handle old = pool.acquire(Spec.of("bash"));
    clock.advance(Duration.ofMinutes(30).toMillis());
    pool.release(old);

    assertEquals(1, pool.cleanupIdle());
    assertTrue(listener.events.contains("destroyed:fake-1:MAX_AGE"));
  }

  @Test
  void evictAllIdleIgnoresAge() throws Exception {
    newPool(NO_SWEEP, clock);
    Handle idle = pool.acquire(Spec.of("bash"));
    Handle busy = pool.acquire(Spec.of("zsh"));
    pool.release(idle);

    assertEquals(1, pool.evictAllIdle());
    assertTrue(idle.destroyed);
    assertFalse(busy.destroyed);
    assertTrue(listener.events.contains("destroyed:fake-1:MEMORY_PRESSURE"));
  }

  @Test
  void creationFailureReleasesReservedSlot() throws Exception {
    newPool(NO_SWEEP.withMaxPoolSize(1), clock);
    factory.failCreate = true;

    ResourceCreationException ex =
        assertThrows(ResourceCreationException.class, () -> pool.acquire(Spec.of("bash")));
    assertInstanceOf(IllegalStateException.class, ex.getCause());

    factory.failCreate = false;
    Handle handle = pool.acquire(Spec.of("bash"));
    assertEquals("bash", handle.flavour);
    assertEquals(1, pool.getMetrics().pool().totalCreated());
  }

  @Test
  void releasingUnknownOrIdleResourceIsIgnored() throws Exception {
    newPool(NO_SWEEP, clock);
    Handle handle = pool.acquire(Spec.of("bash"));
    pool.release(handle);

    assertFalse(pool.release(handle));
    assertFalse(pool.release(new Handle(99, "bash")));
    assertEquals(1, handle.resets);
  }

  @Test
  void destroyRejectsPendingAndIsIdempotent() throws Exception {
    newPool(NO_SWEEP.withMaxPoolSize(1).withAcquisitionTimeout(Duration.ofSeconds(5)), ClockPort.SYSTEM);
    Handle busy = pool.acquire(Spec.of("bash"));
    CompletableFuture<Handle> pending = pool.acquireAsync(Spec.of("bash"));
    pool.createBuffer("kept for now");

    pool.destroy();
    pool.destroy();

    ExecutionException ex = assertThrows(ExecutionException.class, () -> pending.get(1, TimeUnit.SECONDS));
    assertInstanceOf(PoolShutdownException.class, ex.getCause());
    assertEquals("pool is shutting down", ex.getCause().getMessage());
    assertTrue(busy.destroyed);
    assertEquals(1, listener.count("destroyed-pool"));
    assertEquals(1, listener.count("gc:shutdown"));
    assertEquals(0, pool.getMetrics().pool().total());
    assertEquals(0, pool.getMetrics().buffers().totalBuffers());
    assertThrows(PoolShutdownException.class, () -> pool.acquire(Spec.of("bash")));
    assertThrows(IllegalStateException.class, () -> pool.createBuffer("late"));
    assertFalse(pool.release(busy));
  }

  @Test
  void destroyToleratesFailingResourceCleanup() throws Exception {
    newPool(NO_SWEEP, clock);
    pool.acquire(Spec.of("bash"));
    pool.acquire(Spec.of("zsh"));
    factory.failDestroy = true;

    pool.destroy();

    assertEquals(2, factory.destroyed.size());
    assertEquals(2, pool.getMetrics().pool().totalDestroyed());
  }

  @Test
  void interruptedAcquireWithdrawsItsRequest() throws Exception {
    newPool(NO_SWEEP.withMaxPoolSize(1).withAcquisitionTimeout(Duration.ofSeconds(30)), ClockPort.SYSTEM);
    Handle only = pool.acquire(Spec.of("bash"));
    AtomicReference<Throwable> failure = new AtomicReference<>();
    Thread waiter = new Thread(() -> {
      try {
        pool.acquire(Spec.of("bash"));
      } catch (Throwable t) {
        failure.set(t);
      }
    });
    waiter.start();
    long deadline = System.currentTimeMillis() + 2_000;
    while (pool.getMetrics().pool().pending() == 0 && System.currentTimeMillis() < deadline) {
      Thread.sleep(5);
    }

    waiter.interrupt();
    waiter.join(2_000);

    assertInstanceOf(InterruptedException.class, failure.get());
    assertEquals(0, pool.getMetrics().pool().pending());
    pool.release(only);
    assertEquals(1, pool.getMetrics().pool().idle());
  }

  @Test
  void activeResourcesNeverExceedMaxPoolSize() throws Exception {
    newPool(NO_SWEEP.withMaxPoolSize(3).withAcquisitionTimeout(Duration.ofSeconds(10)), ClockPort.SYSTEM);
    AtomicInteger inUse = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    ExecutorService workers = Executors.newFixedThreadPool(8);
    try {
      List<Future<?>> results = new ArrayList<>();
      for (int worker = 0; worker < 8; worker++) {
        results.add(workers.submit(() -> {
          for (int i = 0; i < 50; i++) {
            Handle handle = pool.acquire(Spec.of("bash"));
            peak.accumulateAndGet(inUse.incrementAndGet(), Math::max);
            assertTrue(pool.getMetrics().pool().total() <= 3);
            inUse.decrementAndGet();
            pool.release(handle);
          }
          return null;
        }));
      }
      for (Future<?> result : results) {
        result.get(30, TimeUnit.SECONDS);
      }
    } finally {
      workers.shutdownNow();
    }

    assertTrue(peak.get() <= 3, "peak " + peak.get());
    assertTrue(factory.created.size() <= 3);
    PoolMetrics metrics = pool.getMetrics().pool();
    assertEquals(0, metrics.active());
    assertEquals(100, metrics.acquisition().samples());
  }

  @Test
  void metricsUpdatesFollowAcquireAndRelease() throws Exception {
    newPool(NO_SWEEP, clock);

    Handle handle = pool.acquire(Spec.of("bash"));
    int afterAcquire = listener.snapshots.size();
    pool.release(handle);

    assertTrue(afterAcquire >= 1);
    assertTrue(listener.snapshots.size() > afterAcquire);
    assertEquals(1, listener.snapshots.get(listener.snapshots.size() - 1).pool().idle());
  }

  @Test
  void metricsUpdatesCanBeDisabled() throws Exception {
    PoolSettings quiet = new PoolSettings(2, Duration.ofMinutes(5), Duration.ofMinutes(30),
        Duration.ofMillis(100), Duration.ZERO, false);
    newPool(quiet, clock);

    pool.release(pool.acquire(Spec.of("bash")));

    assertTrue(listener.snapshots.isEmpty());
    assertTrue(listener.events.contains("created:fake-1"));
  }

  @Test
  void evictingSeveralIdleResourcesServesEveryQueuedRequest() throws Exception {
    newPool(NO_SWEEP.withAcquisitionTimeout(Duration.ofSeconds(5)), clock);
    Handle first = pool.acquire(Spec.of("bash"));
    Handle second = pool.acquire(Spec.of("bash"));
    pool.release(first);
    pool.release(second);

    CompletableFuture<Handle> zshOne = pool.acquireAsync(Spec.of("zsh"));
    CompletableFuture<Handle> zshTwo = pool.acquireAsync(Spec.of("zsh"));
    assertEquals(2, pool.getMetrics().pool().pending());

    assertEquals(2, pool.evictAllIdle());

    assertEquals("zsh", zshOne.get(1, TimeUnit.SECONDS).flavour);
    assertEquals("zsh", zshTwo.get(1, TimeUnit.SECONDS).flavour);
    PoolMetrics metrics = pool.getMetrics().pool();
    assertEquals(2, metrics.total());
    assertEquals(2, metrics.active());
    assertEquals(0, metrics.pending());
  }

  @Test
  void stoppedSchedulerRejectsQueuedAcquisitionAsShutdown() throws Exception {
    ScheduledExecutorService scheduler = ExecutorFactories.newMaintenanceScheduler("pool-test");
    newPool(NO_SWEEP.withMaxPoolSize(1), clock, MetricsPort.NO_OP, scheduler);
    pool.acquire(Spec.of("bash"));
    scheduler.shutdown();

    CompletableFuture<Handle> late = pool.acquireAsync(Spec.of("bash"));

    ExecutionException ex = assertThrows(ExecutionException.class, () -> late.get(1, TimeUnit.SECONDS));
    assertInstanceOf(PoolShutdownException.class, ex.getCause());
    assertEquals(0, pool.getMetrics().pool().pending());
  }

  @Test
  void cancelledQueuedRequestNeverReportsTimeout() throws Exception {
    CountingMetrics metrics = new CountingMetrics();
    newPool(NO_SWEEP.withMaxPoolSize(1).withAcquisitionTimeout(Duration.ofMillis(50)), ClockPort.SYSTEM,
        metrics, ExecutorFactories.newMaintenanceScheduler("pool-test"));
    pool.acquire(Spec.of("bash"));
    CompletableFuture<Handle> abandoned = pool.acquireAsync(Spec.of("bash"));

    assertTrue(abandoned.cancel(false));
    Thread.sleep(200);

    assertEquals(1, metrics.count("pool.acquire.queued"));
    assertEquals(1, metrics.count("pool.acquire.cancelled"));
    assertEquals(0, metrics.count("pool.acquire.timeout"));
    assertEquals(0, pool.getMetrics().pool().pending());
  }

  private static final class CountingMetrics implements MetricsPort {
    private final Map<String, Integer> counters = new HashMap<>();

    @Override
    public synchronized void increment(String key) {
      counters.merge(key, 1, Integer::sum);
    }

    @Override
    public void observe(String key, long value) {}

    synchronized int count(String key) {
      return counters.getOrDefault(key, 0);
    }
  }
}
