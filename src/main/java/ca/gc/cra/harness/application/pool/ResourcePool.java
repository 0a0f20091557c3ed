package ca.gc.cra.harness.application.pool;

import ca.gc.cra.harness.application.port.ClockPort;
import ca.gc.cra.harness.application.port.CompressionCodec;
import ca.gc.cra.harness.application.port.MemoryProbe;
import ca.gc.cra.harness.application.port.MetricsPort;
import ca.gc.cra.harness.application.port.ResourceFactory;
import ca.gc.cra.harness.config.BufferSettings;
import ca.gc.cra.harness.config.MemorySettings;
import ca.gc.cra.harness.config.PoolSettings;
import ca.gc.cra.harness.domain.pool.DestroyReason;
import ca.gc.cra.harness.domain.pool.MemorySample;
import ca.gc.cra.harness.domain.pool.PoolableConfig;
import ca.gc.cra.harness.domain.pool.ResourceMetrics;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Bounded pool of expensive, reusable resources with a buffer cache and a memory
 * monitor.
 * <p><strong>Why:</strong> Starting a shell or session per test step is slow; reusing reset instances keeps
 * suites fast while the limits keep them from exhausting the host.</p>
 * <p><strong>Role:</strong> Application facade composing {@link AcquisitionCoordinator}, {@link BufferCache},
 * {@link MemoryMonitor} and a latency window. Resources come from an injected {@link ResourceFactory}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Serve acquisitions fairly, queueing when the pool is full and expiring queued requests.</li>
 *   <li>Reset on release; evict idle and aged resources on a timer.</li>
 *   <li>Cache byte payloads under a count budget with rotation.</li>
 *   <li>Shed resources and buffers under memory pressure.</li>
 *   <li>Publish {@link ResourcePoolListener} events and {@link ResourceMetrics} snapshots.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use. Listeners are notified outside every pool lock.
 * The pool owns its maintenance scheduler and shuts it down in {@link #destroy()}.</p>
 * <p><strong>Observability:</strong> Emits {@code pool.*}, {@code buffer.rotated} and {@code memory.*}
 * metrics through {@link MetricsPort}.</p>
 *
 * @param <C> resource configuration type
 * @param <R> resource type
 * @since 0.1.0
 */
public final class ResourcePool<C extends PoolableConfig, R> implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ResourcePool.class);
  private static final int LATENCY_WINDOW = 100;

  private final PoolSettings poolSettings;
  private final MetricsPort metrics;
  private final ScheduledExecutorService scheduler;
  private final AcquisitionCoordinator<C, R> coordinator;
  private final BufferCache buffers;
  private final MemoryMonitor monitor;
  private final List<ResourcePoolListener> listeners = new CopyOnWriteArrayList<>();
  private final List<ScheduledFuture<?>> timers = new ArrayList<>();
  private final AtomicBoolean destroyed = new AtomicBoolean();

  private ResourcePool(Builder<C, R> builder) {
    this.poolSettings = builder.poolSettings;
    this.metrics = builder.metrics;
    this.scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");
    this.coordinator = new AcquisitionCoordinator<>(
        builder.factory,
        builder.poolSettings,
        builder.clock,
        builder.metrics,
        scheduler,
        new CoordinatorEvents(),
        new LatencyWindow(LATENCY_WINDOW));
    this.buffers = new BufferCache(builder.bufferSettings, builder.codec, builder.clock, this::bufferRotated);
    this.monitor = new MemoryMonitor(
        builder.memoryProbe, builder.memorySettings, builder.clock, builder.metrics, new PressureHandler());
  }

  /**
   * Starts a builder.
   *
   * @param factory factory for pooled resources
   * @param <C> configuration type
   * @param <R> resource type
   * @return builder
   */
  public static <C extends PoolableConfig, R> Builder<C, R> builder(ResourceFactory<C, R> factory) {
    return new Builder<>(factory);
  }

  public void addListener(ResourcePoolListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void removeListener(ResourcePoolListener listener) {
    listeners.remove(listener);
  }

  /**
   * Acquires a resource, waiting in FIFO order while the pool is full.
   *
   * @param config requested configuration
   * @return resource owned by the caller until {@link #release(Object)}
   * @throws AcquisitionTimeoutException when no resource frees up within the acquisition timeout
   * @throws PoolShutdownException when the pool is or becomes destroyed
   * @throws ResourceCreationException when the factory fails
   * @throws InterruptedException when interrupted while queued; the request is withdrawn
   */
  public R acquire(C config) throws PoolException, InterruptedException {
    CompletableFuture<R> future = acquireAsync(config);
    try {
      return future.get();
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof PoolException) {
        throw (PoolException) cause;
      }
      throw new PoolException("acquisition failed: " + cause, cause);
    } catch (InterruptedException ex) {
      if (!future.cancel(false) && !future.isCompletedExceptionally()) {
        release(future.join());
      }
      throw ex;
    }
  }

  /**
   * Non-blocking variant of {@link #acquire(PoolableConfig)}. When the pool has room the resource is created on
   * the calling thread before this method returns. Cancelling the returned future withdraws a queued request.
   *
   * @param config requested configuration
   * @return future completed with the resource or a {@link PoolException}
   */
  public CompletableFuture<R> acquireAsync(C config) {
    CompletableFuture<R> future = coordinator.acquireAsync(config);
    future.whenComplete((resource, error) -> {
      if (error == null) {
        publishMetrics();
      }
    });
    return future;
  }

  /**
   * Returns a resource to the pool. Unknown or already released resources are ignored.
   *
   * @param resource resource obtained from this pool
   * @return {@code true} when the resource belonged to the pool and was in use
   */
  public boolean release(R resource) {
    boolean known = coordinator.release(resource);
    if (known) {
      publishMetrics();
    }
    return known;
  }

  /**
   * Destroys idle resources past the idle timeout or maximum age. In-use resources are never touched.
   *
   * @return resources destroyed
   */
  public int cleanupIdle() {
    return coordinator.cleanupIdle();
  }

  /**
   * Destroys every idle resource regardless of age.
   *
   * @return resources destroyed
   */
  public int evictAllIdle() {
    return coordinator.evictAllIdle();
  }

  /**
   * Caches a payload, compressing it when requested or when it reaches the compression threshold.
   *
   * @param data payload; copied
   * @param compress request compression below the threshold
   * @return buffer id
   * @throws IllegalArgumentException when the payload exceeds {@code maxBufferSize}
   * @throws IllegalStateException after {@link #destroy()}
   */
  public String createBuffer(byte[] data, boolean compress) {
    ensureOpen();
    String id = buffers.create(data, compress);
    publishMetrics();
    return id;
  }

  public String createBuffer(byte[] data) {
    return createBuffer(data, false);
  }

  public String createBuffer(String text) {
    return createBuffer(text, false);
  }

  public String createBuffer(String text, boolean compress) {
    return createBuffer(Objects.requireNonNull(text, "text").getBytes(StandardCharsets.UTF_8), compress);
  }

  public Optional<byte[]> getBuffer(String id) {
    return buffers.get(id);
  }

  public boolean destroyBuffer(String id) {
    boolean removed = buffers.destroy(id);
    if (removed) {
      publishMetrics();
    }
    return removed;
  }

  /**
   * Rotates the buffer cache now.
   *
   * @param force rotate regardless of entry age
   * @return buffers removed
   */
  public int rotateBuffers(boolean force) {
    return buffers.rotate(force);
  }

  /**
   * Samples memory once and applies the thresholds, as the periodic monitor does.
   *
   * @return the sample evaluated
   */
  public MemorySample checkMemory() {
    return monitor.sampleOnce();
  }

  public boolean triggerGarbageCollection(String reason) {
    return monitor.requestGc(reason);
  }

  public ResourceMetrics getMetrics() {
    return new ResourceMetrics(coordinator.metrics(), monitor.metrics(), buffers.metrics());
  }

  public String resourceType() {
    return coordinator.resourceType();
  }

  public boolean isDestroyed() {
    return destroyed.get();
  }

  /**
   * Stops the timers, rejects pending acquisitions, destroys every resource, clears the buffer cache and
   * issues a final GC hint. Later calls do nothing.
   */
  public void destroy() {
    if (!destroyed.compareAndSet(false, true)) {
      return;
    }
    synchronized (timers) {
      for (ScheduledFuture<?> timer : timers) {
        timer.cancel(false);
      }
      timers.clear();
    }
    int resources = coordinator.shutdown();
    scheduler.shutdown();
    int cleared = buffers.clear();
    monitor.requestGc("shutdown");
    log.info("Resource pool destroyed: {} {} resources and {} buffers released", resources,
        coordinator.resourceType(), cleared);
    ResourceMetrics snapshot = getMetrics();
    notifyListeners(l -> l.onMetricsUpdated(snapshot));
    notifyListeners(ResourcePoolListener::onDestroyed);
  }

  @Override
  public void close() {
    destroy();
  }

  private void start(Duration idleSweep, Duration rotation, Duration monitorInterval) {
    schedule("idle-sweep", idleSweep, this::cleanupIdle);
    schedule("buffer-rotation", rotation, () -> buffers.rotate(false));
    schedule("memory-monitor", monitorInterval, monitor::sampleOnce);
  }

  private void schedule(String name, Duration period, Runnable task) {
    if (period.isZero()) {
      log.debug("Pool {} timer disabled", name);
      return;
    }
    long millis = period.toMillis();
    Runnable guarded = () -> {
      try {
        task.run();
      } catch (RuntimeException ex) {
        log.warn("Pool {} run failed", name, ex);
      }
    };
    synchronized (timers) {
      timers.add(scheduler.scheduleAtFixedRate(guarded, millis, millis, TimeUnit.MILLISECONDS));
    }
  }

  private void ensureOpen() {
    if (destroyed.get()) {
      throw new IllegalStateException("pool is shutting down");
    }
  }

  private void bufferRotated(int removed) {
    metrics.observe("buffer.rotated", removed);
    notifyListeners(l -> l.onBufferRotated(removed));
    publishMetrics();
  }

  private void publishMetrics() {
    if (!poolSettings.enableMetrics() || destroyed.get() || listeners.isEmpty()) {
      return;
    }
    ResourceMetrics snapshot = getMetrics();
    notifyListeners(l -> l.onMetricsUpdated(snapshot));
  }

  private void notifyListeners(Consumer<ResourcePoolListener> event) {
    for (ResourcePoolListener listener : listeners) {
      try {
        event.accept(listener);
      } catch (RuntimeException ex) {
        log.warn("Resource pool listener {} failed", listener, ex);
      }
    }
  }

  private final class CoordinatorEvents implements AcquisitionCoordinator.Events {
    @Override
    public void created(String resourceId) {
      String type = coordinator.resourceType();
      notifyListeners(l -> l.onResourceCreated(type, resourceId));
      publishMetrics();
    }

    @Override
    public void destroyed(String resourceId, DestroyReason reason) {
      String type = coordinator.resourceType();
      notifyListeners(l -> l.onResourceDestroyed(type, resourceId, reason));
      publishMetrics();
    }
  }

  private final class PressureHandler implements MemoryMonitor.PressureResponse {
    @Override
    public void onWarning(MemorySample sample) {
      notifyListeners(l -> l.onMemoryWarning(sample));
    }

    @Override
    public void onHeapExceeded(MemorySample sample) {
      notifyListeners(l -> l.onMemoryAlert(sample));
      coordinator.cleanupIdle();
      buffers.rotate(true);
    }

    @Override
    public void onRssExceeded(MemorySample sample) {
      notifyListeners(l -> l.onMemoryAlert(sample));
      coordinator.evictAllIdle();
      buffers.keepMostRecent(BufferCache.AGGRESSIVE_KEEP);
      monitor.requestGc("memory_pressure");
    }

    @Override
    public void onGcTriggered(String reason) {
      notifyListeners(l -> l.onGcTriggered(reason));
    }
  }

  /**
   * Builder for {@link ResourcePool}. The memory probe, compression codec and scheduler are required; the
   * settings default to their {@code defaults()}.
   *
   * @param <C> configuration type
   * @param <R> resource type
   */
  public static final class Builder<C extends PoolableConfig, R> {
    private final ResourceFactory<C, R> factory;
    private PoolSettings poolSettings = PoolSettings.defaults();
    private MemorySettings memorySettings = MemorySettings.defaults();
    private BufferSettings bufferSettings = BufferSettings.defaults();
    private MemoryProbe memoryProbe;
    private CompressionCodec codec;
    private ClockPort clock = ClockPort.SYSTEM;
    private MetricsPort metrics = MetricsPort.NO_OP;
    private ScheduledExecutorService scheduler;

    private Builder(ResourceFactory<C, R> factory) {
      this.factory = Objects.requireNonNull(factory, "factory");
    }

    public Builder<C, R> poolSettings(PoolSettings value) {
      this.poolSettings = Objects.requireNonNull(value, "poolSettings");
      return this;
    }

    public Builder<C, R> memorySettings(MemorySettings value) {
      this.memorySettings = Objects.requireNonNull(value, "memorySettings");
      return this;
    }

    public Builder<C, R> bufferSettings(BufferSettings value) {
      this.bufferSettings = Objects.requireNonNull(value, "bufferSettings");
      return this;
    }

    public Builder<C, R> memoryProbe(MemoryProbe value) {
      this.memoryProbe = Objects.requireNonNull(value, "memoryProbe");
      return this;
    }

    public Builder<C, R> compressionCodec(CompressionCodec value) {
      this.codec = Objects.requireNonNull(value, "codec");
      return this;
    }

    public Builder<C, R> clock(ClockPort value) {
      this.clock = Objects.requireNonNull(value, "clock");
      return this;
    }

    public Builder<C, R> metrics(MetricsPort value) {
      this.metrics = Objects.requireNonNull(value, "metrics");
      return this;
    }

    /**
     * Scheduler for timers and acquisition timeouts; the pool shuts it down on destroy.
     *
     * @param value scheduler
     * @return this builder
     */
    public Builder<C, R> scheduler(ScheduledExecutorService value) {
      this.scheduler = Objects.requireNonNull(value, "scheduler");
      return this;
    }

    /**
     * Builds the pool and starts its idle sweep, buffer rotation and memory monitor timers.
     *
     * @return running pool
     */
    public ResourcePool<C, R> build() {
      Objects.requireNonNull(memoryProbe, "memoryProbe");
      Objects.requireNonNull(codec, "codec");
      Objects.requireNonNull(scheduler, "scheduler");
      ResourcePool<C, R> pool = new ResourcePool<>(this);
      pool.start(poolSettings.idleSweepInterval(), bufferSettings.rotationInterval(),
          memorySettings.monitorInterval());
      return pool;
    }
  }
}
