package ca.gc.cra.harness.application.pool;

import ca.gc.cra.harness.application.port.ClockPort;
import ca.gc.cra.harness.application.port.MetricsPort;
import ca.gc.cra.harness.application.port.ResourceFactory;
import ca.gc.cra.harness.config.PoolSettings;
import ca.gc.cra.harness.domain.pool.ConfigKey;
import ca.gc.cra.harness.domain.pool.DestroyReason;
import ca.gc.cra.harness.domain.pool.PoolMetrics;
import ca.gc.cra.harness.domain.pool.PoolableConfig;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Owns the pooled-resource table and the FIFO queue of pending acquisitions.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reuse an idle resource with a matching key, else reserve a slot and create one, else queue.</li>
 *   <li>Reset released resources and hand them to the earliest matching waiter.</li>
 *   <li>Expire queued acquisitions after the acquisition timeout, exactly once per request.</li>
 *   <li>Evict idle or aged resources and tear everything down on shutdown.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> One lock guards the table, the queue and the counters. Factory calls,
 * future completion and event callbacks all run after the lock is released. Pool size plus slots reserved for
 * in-flight creations never exceeds {@code maxPoolSize}.</p>
 *
 * @param <C> configuration type
 * @param <R> resource type
 */
final class AcquisitionCoordinator<C extends PoolableConfig, R> {
  private static final Logger log = LoggerFactory.getLogger(AcquisitionCoordinator.class);

  /** Callbacks for resource lifecycle events, invoked outside the lock. */
  interface Events {
    void created(String resourceId);

    void destroyed(String resourceId, DestroyReason reason);
  }

  private final ResourceFactory<C, R> factory;
  private final PoolSettings settings;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final ScheduledExecutorService scheduler;
  private final Events events;
  private final LatencyWindow latency;
  private final String resourceType;
  private final AtomicLong idSequence = new AtomicLong();

  private final ReentrantLock lock = new ReentrantLock();
  private final List<PooledResource<R>> resources = new ArrayList<>();
  private final Map<R, PooledResource<R>> byResource = new IdentityHashMap<>();
  private final ArrayDeque<Pending<C, R>> pending = new ArrayDeque<>();
  private int reserved;
  private boolean shutdown;
  private long totalCreated;
  private long totalDestroyed;
  private long resetFailures;

  AcquisitionCoordinator(
      ResourceFactory<C, R> factory,
      PoolSettings settings,
      ClockPort clock,
      MetricsPort metrics,
      ScheduledExecutorService scheduler,
      Events events,
      LatencyWindow latency) {
    this.factory = Objects.requireNonNull(factory, "factory");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.events = Objects.requireNonNull(events, "events");
    this.latency = Objects.requireNonNull(latency, "latency");
    this.resourceType = Objects.requireNonNullElse(factory.resourceType(), "resource");
  }

  String resourceType() {
    return resourceType;
  }

  CompletableFuture<R> acquireAsync(C config) {
    Objects.requireNonNull(config, "config");
    ConfigKey key = Objects.requireNonNull(config.poolKey(), "poolKey");
    long started = clock.monotonicMillis();
    PooledResource<R> reused = null;
    Pending<C, R> queued = null;
    lock.lock();
    try {
      if (shutdown) {
        return CompletableFuture.failedFuture(new PoolShutdownException());
      }
      reused = findIdle(key);
      if (reused != null) {
        reused.markInUse(clock.nowMillis());
      } else if (resources.size() + reserved < settings.maxPoolSize()) {
        reserved++;
      } else {
        Pending<C, R> request = new Pending<>(config, key, started);
        try {
          request.timer = scheduler.schedule(
              () -> expire(request), settings.acquisitionTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException ex) {
          log.debug("Maintenance scheduler stopped; rejecting acquisition for [{}]", key);
          return CompletableFuture.failedFuture(new PoolShutdownException());
        }
        pending.addLast(request);
        queued = request;
      }
    } finally {
      lock.unlock();
    }

    if (reused != null) {
      log.debug("Reusing {} {} for [{}]", resourceType, reused.id(), key);
      recordLatency(started);
      return CompletableFuture.completedFuture(reused.resource());
    }
    if (queued != null) {
      log.debug("Pool full; queued acquisition for [{}]", key);
      metrics.increment("pool.acquire.queued");
      Pending<C, R> request = queued;
      request.future.whenComplete((resource, error) -> {
        if (request.future.isCancelled()) {
          withdraw(request);
        }
      });
      return request.future;
    }
    try {
      R resource = createReserved(config, key);
      recordLatency(started);
      return CompletableFuture.completedFuture(resource);
    } catch (PoolException ex) {
      dispatchPending();
      return CompletableFuture.failedFuture(ex);
    }
  }

  /**
   * Resets and re-pools a resource, or destroys it when the reset fails.
   *
   * @param resource resource previously returned by an acquisition
   * @return {@code false} when the resource is not an in-use member of this pool
   */
  boolean release(R resource) {
    Objects.requireNonNull(resource, "resource");
    PooledResource<R> pooled;
    lock.lock();
    try {
      pooled = byResource.get(resource);
      if (pooled == null || pooled.state() != PooledResource.State.IN_USE) {
        pooled = null;
      } else {
        pooled.beginReset();
      }
    } finally {
      lock.unlock();
    }
    if (pooled == null) {
      log.debug("Ignoring release of a {} not in use by this pool", resourceType);
      return false;
    }

    boolean reusable;
    try {
      reusable = factory.reset(resource);
    } catch (Exception ex) {
      if (ex instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      log.warn("Reset of {} {} failed; destroying it", resourceType, pooled.id(), ex);
      reusable = false;
    }

    if (!reusable) {
      boolean detached;
      lock.lock();
      try {
        detached = detach(pooled);
        if (detached) {
          totalDestroyed++;
          resetFailures++;
        }
      } finally {
        lock.unlock();
      }
      if (detached) {
        metrics.increment("pool.resource.reset_failed");
        destroyDetached(pooled, DestroyReason.RESET_FAILED);
        dispatchPending();
      }
      return true;
    }

    boolean stillPooled;
    lock.lock();
    try {
      stillPooled = byResource.get(resource) == pooled;
      if (stillPooled) {
        pooled.markIdle(clock.nowMillis());
      }
    } finally {
      lock.unlock();
    }
    if (stillPooled) {
      dispatchPending();
    }
    return true;
  }

  /**
   * Destroys idle resources past the idle timeout or the maximum age.
   *
   * @return resources destroyed
   */
  int cleanupIdle() {
    return evict(false);
  }

  /**
   * Destroys every idle resource regardless of age.
   *
   * @return resources destroyed
   */
  int evictAllIdle() {
    return evict(true);
  }

  /**
   * Rejects pending acquisitions and destroys every pooled resource, in use or not.
   *
   * @return resources destroyed; {@code 0} when already shut down
   */
  int shutdown() {
    List<Pending<C, R>> rejected;
    List<PooledResource<R>> doomed;
    lock.lock();
    try {
      if (shutdown) {
        return 0;
      }
      shutdown = true;
      rejected = new ArrayList<>(pending);
      pending.clear();
      doomed = new ArrayList<>(resources);
      resources.clear();
      byResource.clear();
      totalDestroyed += doomed.size();
    } finally {
      lock.unlock();
    }
    for (Pending<C, R> request : rejected) {
      request.cancelTimer();
      request.future.completeExceptionally(new PoolShutdownException());
    }
    for (PooledResource<R> pooled : doomed) {
      destroyDetached(pooled, DestroyReason.SHUTDOWN);
    }
    if (!rejected.isEmpty()) {
      log.debug("Rejected {} pending acquisitions on shutdown", rejected.size());
    }
    return doomed.size();
  }

  boolean isShutdown() {
    lock.lock();
    try {
      return shutdown;
    } finally {
      lock.unlock();
    }
  }

  PoolMetrics metrics() {
    int total;
    int active = 0;
    int idle = 0;
    int waiting = 0;
    long created;
    long destroyed;
    long failures;
    lock.lock();
    try {
      total = resources.size();
      for (PooledResource<R> pooled : resources) {
        if (pooled.idle()) {
          idle++;
        } else {
          active++;
        }
      }
      for (Pending<C, R> request : pending) {
        if (!request.future.isDone()) {
          waiting++;
        }
      }
      created = totalCreated;
      destroyed = totalDestroyed;
      failures = resetFailures;
    } finally {
      lock.unlock();
    }
    return new PoolMetrics(total, active, idle, waiting, created, destroyed, failures, latency.stats());
  }

  private int evict(boolean allIdle) {
    List<PooledResource<R>> evicted = new ArrayList<>();
    List<DestroyReason> reasons = new ArrayList<>();
    lock.lock();
    try {
      long now = clock.nowMillis();
      long idleLimit = settings.idleTimeout().toMillis();
      long ageLimit = settings.maxAge().toMillis();
      Iterator<PooledResource<R>> it = resources.iterator();
      while (it.hasNext()) {
        PooledResource<R> pooled = it.next();
        if (!pooled.idle()) {
          continue;
        }
        DestroyReason reason = null;
        if (allIdle) {
          reason = DestroyReason.MEMORY_PRESSURE;
        } else if (pooled.ageMillis(now) >= ageLimit) {
          reason = DestroyReason.MAX_AGE;
        } else if (pooled.idleMillis(now) >= idleLimit) {
          reason = DestroyReason.IDLE_TIMEOUT;
        }
        if (reason != null) {
          it.remove();
          byResource.remove(pooled.resource());
          evicted.add(pooled);
          reasons.add(reason);
        }
      }
      totalDestroyed += evicted.size();
    } finally {
      lock.unlock();
    }
    for (int i = 0; i < evicted.size(); i++) {
      destroyDetached(evicted.get(i), reasons.get(i));
    }
    if (!evicted.isEmpty()) {
      log.debug("Evicted {} idle {} resources", evicted.size(), resourceType);
      dispatchPending();
    }
    return evicted.size();
  }

  /**
   * Serves waiters in arrival order until none can be served: a waiter whose key matches an idle resource
   * takes it, and any waiter takes a free slot. A single released resource goes to at most one waiter.
   */
  private void dispatchPending() {
    while (true) {
      Pending<C, R> request = null;
      PooledResource<R> handoff = null;
      lock.lock();
      try {
        if (shutdown) {
          return;
        }
        Iterator<Pending<C, R>> it = pending.iterator();
        while (it.hasNext()) {
          Pending<C, R> candidate = it.next();
          if (candidate.future.isDone()) {
            it.remove();
            candidate.cancelTimer();
            continue;
          }
          PooledResource<R> idle = findIdle(candidate.key);
          if (idle != null) {
            it.remove();
            idle.markInUse(clock.nowMillis());
            request = candidate;
            handoff = idle;
            break;
          }
          if (resources.size() + reserved < settings.maxPoolSize()) {
            it.remove();
            reserved++;
            request = candidate;
            break;
          }
        }
      } finally {
        lock.unlock();
      }
      if (request == null) {
        return;
      }
      request.cancelTimer();

      if (handoff != null) {
        if (request.future.complete(handoff.resource())) {
          log.debug("Handed {} {} to queued acquisition for [{}]", resourceType, handoff.id(), request.key);
          recordLatency(request.started);
        } else {
          returnToIdle(handoff);
        }
        continue;
      }

      try {
        R created = createReserved(request.config, request.key);
        recordLatency(request.started);
        if (!request.future.complete(created)) {
          returnToIdle(byResourceLocked(created));
        }
      } catch (PoolException ex) {
        request.future.completeExceptionally(ex);
      }
    }
  }

  private R createReserved(C config, ConfigKey key) throws PoolException {
    R resource;
    try {
      resource = factory.create(config);
      if (resource == null) {
        throw new IllegalStateException(resourceType + " factory returned null");
      }
    } catch (Exception ex) {
      if (ex instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      lock.lock();
      try {
        reserved--;
      } finally {
        lock.unlock();
      }
      log.warn("Failed to create {} for [{}]", resourceType, key, ex);
      throw new ResourceCreationException(resourceType, ex);
    }

    String id = resourceType + "-" + idSequence.incrementAndGet();
    boolean accepted;
    lock.lock();
    try {
      reserved--;
      accepted = !shutdown;
      if (accepted) {
        PooledResource<R> pooled = new PooledResource<>(id, key, resource, clock.nowMillis());
        resources.add(pooled);
        byResource.put(resource, pooled);
        totalCreated++;
      }
    } finally {
      lock.unlock();
    }
    if (!accepted) {
      destroyQuietly(id, resource, DestroyReason.SHUTDOWN);
      throw new PoolShutdownException();
    }
    log.debug("Created {} {} for [{}]", resourceType, id, key);
    metrics.increment("pool.resource.created");
    events.created(id);
    return resource;
  }

  private PooledResource<R> byResourceLocked(R resource) {
    lock.lock();
    try {
      return byResource.get(resource);
    } finally {
      lock.unlock();
    }
  }

  private void returnToIdle(PooledResource<R> pooled) {
    if (pooled == null) {
      return;
    }
    lock.lock();
    try {
      if (byResource.get(pooled.resource()) == pooled) {
        pooled.markIdle(clock.nowMillis());
      }
    } finally {
      lock.unlock();
    }
  }

  private void expire(Pending<C, R> request) {
    boolean removed;
    lock.lock();
    try {
      removed = pending.remove(request);
    } finally {
      lock.unlock();
    }
    if (!removed) {
      return;
    }
    metrics.increment("pool.acquire.timeout");
    log.debug("Acquisition for [{}] timed out", request.key);
    request.future.completeExceptionally(
        new AcquisitionTimeoutException(request.key.canonical(), settings.acquisitionTimeout()));
  }

  private void withdraw(Pending<C, R> request) {
    boolean removed;
    lock.lock();
    try {
      removed = pending.remove(request);
    } finally {
      lock.unlock();
    }
    request.cancelTimer();
    if (removed) {
      metrics.increment("pool.acquire.cancelled");
      log.debug("Queued acquisition for [{}] cancelled", request.key);
    }
  }

  private PooledResource<R> findIdle(ConfigKey key) {
    for (PooledResource<R> pooled : resources) {
      if (pooled.idle() && pooled.key().equals(key)) {
        return pooled;
      }
    }
    return null;
  }

  private boolean detach(PooledResource<R> pooled) {
    if (byResource.remove(pooled.resource()) == null) {
      return false;
    }
    resources.remove(pooled);
    return true;
  }

  private void destroyDetached(PooledResource<R> pooled, DestroyReason reason) {
    destroyQuietly(pooled.id(), pooled.resource(), reason);
    metrics.increment("pool.resource.destroyed");
    events.destroyed(pooled.id(), reason);
  }

  private void destroyQuietly(String id, R resource, DestroyReason reason) {
    try {
      factory.destroy(resource);
    } catch (Exception ex) {
      if (ex instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      log.warn("Failed to destroy {} {} ({})", resourceType, id, reason, ex);
    }
  }

  private void recordLatency(long started) {
    long elapsed = clock.monotonicMillis() - started;
    latency.record(elapsed);
    metrics.observe("pool.acquire.latencyMillis", elapsed);
  }

  private static final class Pending<C, R> {
    private final C config;
    private final ConfigKey key;
    private final long started;
    private final CompletableFuture<R> future = new CompletableFuture<>();
    private ScheduledFuture<?> timer;

    private Pending(C config, ConfigKey key, long started) {
      this.config = config;
      this.key = key;
      this.started = started;
    }

    private void cancelTimer() {
      if (timer != null) {
        timer.cancel(false);
      }
    }
  }
}
