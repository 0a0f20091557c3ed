package ca.gc.cra.harness.config;

import ca.gc.cra.harness.application.port.ClockPort;
import ca.gc.cra.harness.application.port.ExitHookRegistry;
import ca.gc.cra.harness.application.port.MetricsPort;
import ca.gc.cra.harness.application.pool.ResourcePool;
import ca.gc.cra.harness.application.process.ProcessSupervisor;
import ca.gc.cra.harness.application.wait.Waiter;
import ca.gc.cra.harness.infrastructure.buffer.PumpingOutputDrainer;
import ca.gc.cra.harness.infrastructure.compress.GzipCompressionCodec;
import ca.gc.cra.harness.infrastructure.events.LoggingPoolListener;
import ca.gc.cra.harness.infrastructure.events.LoggingSupervisorListener;
import ca.gc.cra.harness.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.harness.infrastructure.exec.PosixSignalSender;
import ca.gc.cra.harness.infrastructure.exec.ProcessBuilderLauncher;
import ca.gc.cra.harness.infrastructure.exec.ShutdownHookRegistry;
import ca.gc.cra.harness.infrastructure.memory.JvmMemoryProbe;
import ca.gc.cra.harness.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.harness.infrastructure.session.SessionConfig;
import ca.gc.cra.harness.infrastructure.session.ShellSession;
import ca.gc.cra.harness.infrastructure.session.ShellSessionFactory;
import ca.gc.cra.harness.infrastructure.time.SystemClockAdapter;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the waiter, process supervisor and shell-session pool to their JVM adapters.
 * <p><strong>Why:</strong> Keeps adapter selection in one place so CLI commands only see application services.</p>
 * <p><strong>Role:</strong> Composition root for {@code exec}, {@code await} and {@code stats}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create the single exit-hook registry shared by the supervisor and the pool.</li>
 *   <li>Choose OpenTelemetry or no-op metrics from {@link TelemetrySettings}.</li>
 *   <li>Build the session pool on first use and tear everything down in {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Lazy pool creation is guarded by a lock; other members are final.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

  private final HarnessConfig config;
  private final ExitHookRegistry exitHooks;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final OpenTelemetryMetricsAdapter telemetry;
  private final Waiter waiter;
  private final ProcessSupervisor supervisor;
  private final ReentrantLock poolLock = new ReentrantLock();
  private ResourcePool<SessionConfig, ShellSession> sessionPool;
  private ExitHookRegistry.Registration poolRegistration;
  private boolean closed;

  /**
   * Builds the graph with a JVM shutdown hook registry.
   *
   * @param config effective configuration
   */
  public CompositionRoot(HarnessConfig config) {
    this(config, new ShutdownHookRegistry());
  }

  /**
   * Builds the graph with a caller-supplied exit registry.
   *
   * @param config effective configuration
   * @param exitHooks registry shared by every component that needs exit cleanup
   */
  public CompositionRoot(HarnessConfig config, ExitHookRegistry exitHooks) {
    this.config = Objects.requireNonNull(config, "config");
    this.exitHooks = Objects.requireNonNull(exitHooks, "exitHooks");
    this.clock = new SystemClockAdapter();
    if (config.telemetry().enabled()) {
      this.telemetry = new OpenTelemetryMetricsAdapter(config.telemetry());
      this.metrics = telemetry;
    } else {
      this.telemetry = null;
      this.metrics = MetricsPort.NO_OP;
    }
    this.waiter = new Waiter();
    this.supervisor = new ProcessSupervisor(
        new ProcessBuilderLauncher(),
        new PosixSignalSender(),
        new PumpingOutputDrainer(),
        exitHooks,
        waiter,
        clock,
        metrics);
    supervisor.addListener(new LoggingSupervisorListener());
  }

  public HarnessConfig config() {
    return config;
  }

  public Waiter waiter() {
    return waiter;
  }

  public ProcessSupervisor supervisor() {
    return supervisor;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Returns the shell-session pool, creating it on first call.
   *
   * @return pool configured from {@link HarnessConfig#pool()}, {@link HarnessConfig#memory()} and
   *     {@link HarnessConfig#buffer()}
   * @throws IllegalStateException after {@link #close()}
   */
  public ResourcePool<SessionConfig, ShellSession> sessionPool() {
    poolLock.lock();
    try {
      if (closed) {
        throw new IllegalStateException("composition root is closed");
      }
      if (sessionPool == null) {
        sessionPool = ResourcePool.builder(new ShellSessionFactory(supervisor, waiter))
            .poolSettings(config.pool())
            .memorySettings(config.memory())
            .bufferSettings(config.buffer())
            .memoryProbe(new JvmMemoryProbe())
            .compressionCodec(new GzipCompressionCodec())
            .clock(clock)
            .metrics(metrics)
            .scheduler(ExecutorFactories.newMaintenanceScheduler("harness-pool"))
            .build();
        sessionPool.addListener(new LoggingPoolListener());
        ResourcePool<SessionConfig, ShellSession> pool = sessionPool;
        poolRegistration = exitHooks.register("session-pool", pool::destroy);
      }
      return sessionPool;
    } finally {
      poolLock.unlock();
    }
  }

  /**
   * Destroys the pool, stops every supervised process and flushes metrics. Idempotent.
   */
  @Override
  public void close() {
    ResourcePool<SessionConfig, ShellSession> pool;
    ExitHookRegistry.Registration registration;
    poolLock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      pool = sessionPool;
      registration = poolRegistration;
    } finally {
      poolLock.unlock();
    }
    if (pool != null) {
      pool.destroy();
    }
    if (registration != null) {
      registration.close();
    }
    try {
      supervisor.shutdown(SHUTDOWN_GRACE);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while stopping supervised processes");
    } finally {
      supervisor.destroy();
    }
    if (telemetry != null) {
      telemetry.close();
    }
  }
}
