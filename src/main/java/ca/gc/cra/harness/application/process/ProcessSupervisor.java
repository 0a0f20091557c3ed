package ca.gc.cra.harness.application.process;

import ca.gc.cra.harness.application.port.ClockPort;
import ca.gc.cra.harness.application.port.ExitHookRegistry;
import ca.gc.cra.harness.application.port.MetricsPort;
import ca.gc.cra.harness.application.port.OutputDrainer;
import ca.gc.cra.harness.application.port.ProcessLauncher;
import ca.gc.cra.harness.application.port.ProcessLauncher.LaunchedProcess;
import ca.gc.cra.harness.application.port.SignalSender;
import ca.gc.cra.harness.application.wait.Waiter;
import ca.gc.cra.harness.domain.process.ManagedProcess;
import ca.gc.cra.harness.domain.process.ProcessOptions;
import ca.gc.cra.harness.domain.process.ProcessStatus;
import ca.gc.cra.harness.domain.process.Signal;
import ca.gc.cra.harness.domain.wait.WaitOptions;
import java.io.IOException;
import java.io.OutputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Tracks spawned processes and guarantees their termination.
 * <p><strong>Why:</strong> Test runs must not leak shells or child processes, even when a test fails or the
 * JVM is stopped.</p>
 * <p><strong>Role:</strong> Application service; launches through {@link ProcessLauncher}, signals through
 * {@link SignalSender} and registers one cleanup action with the shared {@link ExitHookRegistry}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Record every started process with an immutable {@link ManagedProcess} snapshot.</li>
 *   <li>Signal whole process groups, falling back to the single process and its descendants.</li>
 *   <li>Observe exits, publish them and drop exited entries.</li>
 *   <li>Run the two-phase TERM then KILL shutdown exactly once.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use. The process table is a concurrent map; each
 * entry's snapshot is swapped atomically. Listeners are notified outside any lock.</p>
 * <p><strong>Observability:</strong> Emits {@code process.started}, {@code process.exited},
 * {@code process.killed}, {@code process.kill.failed} and {@code process.start.failed} counters.</p>
 *
 * @since 0.1.0
 */
public final class ProcessSupervisor implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);
  private static final Duration SHUTDOWN_POLL = Duration.ofMillis(100);

  private final ProcessLauncher launcher;
  private final SignalSender signals;
  private final OutputDrainer drainer;
  private final ExitHookRegistry exitHooks;
  private final Waiter waiter;
  private final ClockPort clock;
  private final MetricsPort metrics;

  private final ConcurrentMap<Long, Entry> table = new ConcurrentHashMap<>();
  private final List<ProcessSupervisorListener> listeners = new CopyOnWriteArrayList<>();
  private final ReentrantLock lifecycleLock = new ReentrantLock();

  private boolean accepting = true;
  private boolean shutdownStarted;
  private volatile boolean destroyed;
  private ExitHookRegistry.Registration exitRegistration;

  /**
   * Creates a supervisor.
   *
   * @param launcher process spawner
   * @param signals signal delivery
   * @param drainer background output reader used when a start supplies an output consumer
   * @param exitHooks shared JVM exit registry
   * @param waiter waiter used during shutdown
   * @param clock time source for start timestamps
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public ProcessSupervisor(
      ProcessLauncher launcher,
      SignalSender signals,
      OutputDrainer drainer,
      ExitHookRegistry exitHooks,
      Waiter waiter,
      ClockPort clock,
      MetricsPort metrics) {
    this.launcher = Objects.requireNonNull(launcher, "launcher");
    this.signals = Objects.requireNonNull(signals, "signals");
    this.drainer = Objects.requireNonNull(drainer, "drainer");
    this.exitHooks = Objects.requireNonNull(exitHooks, "exitHooks");
    this.waiter = Objects.requireNonNull(waiter, "waiter");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  public void addListener(ProcessSupervisorListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void removeListener(ProcessSupervisorListener listener) {
    listeners.remove(listener);
  }

  /**
   * Spawns and begins supervising a process.
   *
   * @param command executable
   * @param args arguments
   * @param options launch options
   * @return running snapshot
   * @throws ProcessStartException when the process cannot be spawned
   * @throws IllegalStateException after {@link #shutdown(Duration)} or {@link #destroy()} began
   */
  public ManagedProcess start(String command, List<String> args, ProcessOptions options)
      throws ProcessStartException {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(args, "args");
    Objects.requireNonNull(options, "options");
    ensureAccepting();
    registerExitHookOnce();

    LaunchedProcess launched;
    try {
      launched = launcher.launch(command, args, options);
    } catch (IOException | RuntimeException ex) {
      metrics.increment("process.start.failed");
      log.warn("Failed to start {} {}", command, args, ex);
      notifyListeners(l -> l.onError(OptionalLong.empty(), ex));
      throw new ProcessStartException("Failed to start " + command, ex);
    }

    Process process = launched.process();
    ManagedProcess snapshot = ManagedProcess.running(
        process.pid(), command, args, Instant.ofEpochMilli(clock.nowMillis()), launched.processGroupId());
    Entry entry = new Entry(snapshot, process);

    boolean admitted;
    lifecycleLock.lock();
    try {
      admitted = accepting;
      if (admitted) {
        table.put(snapshot.pid(), entry);
      }
    } finally {
      lifecycleLock.unlock();
    }
    if (!admitted) {
      // Shutdown began while spawning; do not leak the child.
      deliver(entry, Signal.KILL);
      throw new IllegalStateException("ProcessSupervisor is shutting down");
    }

    Optional<Consumer<String>> consumer = options.outputConsumer();
    if (consumer.isPresent()) {
      drainer.drain(snapshot.pid(), process.getInputStream(), consumer.get());
    }
    metrics.increment("process.started");
    log.debug("Started pid {} ({} {})", snapshot.pid(), command, args);
    notifyListeners(l -> l.onProcessStarted(snapshot));
    process.onExit().whenComplete((ignored, error) -> handleExit(entry));
    return snapshot;
  }

  /**
   * Sends {@link Signal#TERM} to {@code pid}.
   *
   * @param pid process id
   * @return {@code true} when a signal was delivered
   */
  public boolean kill(long pid) {
    return kill(pid, Signal.TERM);
  }

  /**
   * Signals a supervised process and its group.
   *
   * <p>Never throws; unknown or already terminated processes yield {@code false}.</p>
   *
   * @param pid process id
   * @param signal signal to send
   * @return {@code true} when a signal was delivered
   */
  public boolean kill(long pid, Signal signal) {
    Objects.requireNonNull(signal, "signal");
    Entry entry = table.get(pid);
    if (entry == null || entry.snapshot().status().isTerminal()) {
      return false;
    }
    if (!deliver(entry, signal)) {
      metrics.increment("process.kill.failed");
      IOException failure = new IOException("Signal " + signal + " could not be delivered to pid " + pid);
      log.warn(failure.getMessage());
      notifyListeners(l -> l.onError(OptionalLong.of(pid), failure));
      return false;
    }
    ManagedProcess killed = entry.update(
        current -> current.status().isTerminal() ? current : current.withStatus(ProcessStatus.KILLED));
    metrics.increment("process.killed");
    log.debug("Sent {} to pid {}", signal, pid);
    notifyListeners(l -> l.onProcessKilled(killed, signal));
    return true;
  }

  /**
   * Signals every supervised process; individual failures do not stop the sweep.
   *
   * @param signal signal to send
   * @return number of processes that were signalled
   */
  public int killAll(Signal signal) {
    int delivered = 0;
    for (Long pid : new ArrayList<>(table.keySet())) {
      try {
        if (kill(pid, signal)) {
          delivered++;
        }
      } catch (RuntimeException ex) {
        log.warn("Unexpected failure signalling pid {}", pid, ex);
      }
    }
    return delivered;
  }

  /**
   * Waits until {@code pid} exits or {@code timeout} elapses.
   *
   * @param pid process id
   * @param timeout maximum wait
   * @return terminal snapshot, or empty on timeout or unknown pid
   * @throws InterruptedException when interrupted while waiting
   */
  public Optional<ManagedProcess> waitForExit(long pid, Duration timeout) throws InterruptedException {
    Objects.requireNonNull(timeout, "timeout");
    Entry entry = table.get(pid);
    if (entry == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(entry.exit.get(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS));
    } catch (TimeoutException ex) {
      return Optional.empty();
    } catch (ExecutionException ex) {
      throw new IllegalStateException("exit observer failed for pid " + pid, ex.getCause());
    }
  }

  /**
   * Terminates everything: TERM, up to half the timeout for exits, KILL, the other half.
   *
   * <p>Idempotent; only the first call does work and fires {@code onCleanupComplete}.</p>
   *
   * @param timeout total time budget for both phases
   * @return processes confirmed gone; {@code 0} on repeated calls
   * @throws InterruptedException when interrupted while waiting for exits
   */
  public int shutdown(Duration timeout) throws InterruptedException {
    Objects.requireNonNull(timeout, "timeout");
    lifecycleLock.lock();
    try {
      if (shutdownStarted) {
        return 0;
      }
      shutdownStarted = true;
      accepting = false;
    } finally {
      lifecycleLock.unlock();
    }

    int initial = livingCount();
    if (initial == 0) {
      log.debug("Shutdown with no running processes");
      notifyListeners(l -> l.onCleanupComplete(0));
      return 0;
    }

    log.info("Shutting down {} supervised process(es)", initial);
    WaitOptions phase = WaitOptions.builder()
        .initialDelay(SHUTDOWN_POLL)
        .maxDelay(SHUTDOWN_POLL)
        .jitter(0)
        .intervalFunction((attempt, base) -> base)
        .timeout(timeout.dividedBy(2))
        .build();

    killAll(Signal.TERM);
    if (!waiter.waitUntil(() -> livingCount() == 0, phase).success()) {
      log.warn("{} process(es) ignored TERM; escalating to KILL", livingCount());
      killAll(Signal.KILL);
      waiter.waitUntil(() -> livingCount() == 0, phase);
    }

    int remaining = livingCount();
    if (remaining > 0) {
      log.error("{} process(es) still alive after shutdown", remaining);
    }
    int exited = Math.max(0, initial - remaining);
    notifyListeners(l -> l.onCleanupComplete(exited));
    return exited;
  }

  /**
   * Stops supervising without signalling anyone.
   *
   * <p>Detaches this instance's listeners and exit observers, clears the table and removes its exit-hook
   * registration. Idempotent.</p>
   */
  public void destroy() {
    ExitHookRegistry.Registration registration;
    lifecycleLock.lock();
    try {
      if (destroyed) {
        return;
      }
      destroyed = true;
      accepting = false;
      shutdownStarted = true;
      registration = exitRegistration;
      exitRegistration = null;
    } finally {
      lifecycleLock.unlock();
    }
    listeners.clear();
    table.clear();
    if (registration != null) {
      registration.close();
    }
  }

  @Override
  public void close() {
    destroy();
  }

  public List<ManagedProcess> processes() {
    List<ManagedProcess> result = new ArrayList<>();
    for (Entry entry : table.values()) {
      result.add(entry.snapshot());
    }
    return List.copyOf(result);
  }

  public List<ManagedProcess> runningProcesses() {
    List<ManagedProcess> result = new ArrayList<>();
    for (Entry entry : table.values()) {
      ManagedProcess snapshot = entry.snapshot();
      if (snapshot.status() == ProcessStatus.RUNNING) {
        result.add(snapshot);
      }
    }
    return List.copyOf(result);
  }

  public Optional<ManagedProcess> find(long pid) {
    Entry entry = table.get(pid);
    return entry == null ? Optional.empty() : Optional.of(entry.snapshot());
  }

  public boolean isRunning(long pid) {
    Entry entry = table.get(pid);
    return entry != null && entry.snapshot().isRunning();
  }

  /**
   * Returns the stdin of a running process, for sending input.
   *
   * @param pid process id
   * @return stdin stream, empty if the pid is unknown or no longer running
   */
  public Optional<OutputStream> stdin(long pid) {
    Entry entry = table.get(pid);
    if (entry == null || !entry.snapshot().isRunning()) {
      return Optional.empty();
    }
    return Optional.of(entry.process.getOutputStream());
  }

  private void ensureAccepting() {
    lifecycleLock.lock();
    try {
      if (!accepting) {
        throw new IllegalStateException("ProcessSupervisor is shutting down");
      }
    } finally {
      lifecycleLock.unlock();
    }
  }

  private void registerExitHookOnce() {
    lifecycleLock.lock();
    try {
      if (exitRegistration == null && !destroyed) {
        exitRegistration = exitHooks.register("process-supervisor", this::killRemainingOnExit);
      }
    } finally {
      lifecycleLock.unlock();
    }
  }

  private void killRemainingOnExit() {
    for (Entry entry : table.values()) {
      if (entry.snapshot().isRunning()) {
        deliver(entry, Signal.KILL);
      }
    }
  }

  private boolean deliver(Entry entry, Signal signal) {
    ManagedProcess snapshot = entry.snapshot();
    OptionalLong group = snapshot.processGroupId();
    if (group.isPresent()) {
      try {
        if (signals.signalGroup(group.getAsLong(), signal)) {
          return true;
        }
      } catch (IOException | RuntimeException ex) {
        log.debug("Group signal {} to {} failed; falling back to pid", signal, group.getAsLong(), ex);
      }
    }
    try {
      return signals.signalProcess(snapshot.pid(), signal);
    } catch (IOException | RuntimeException ex) {
      log.debug("Signal {} to pid {} failed", signal, snapshot.pid(), ex);
      return false;
    }
  }

  private void handleExit(Entry entry) {
    int code = exitCodeOf(entry.process);
    ManagedProcess exited = entry.update(current -> current.exited(code));
    if (!destroyed) {
      metrics.increment("process.exited");
      log.debug("pid {} exited with {}", exited.pid(), code);
      notifyListeners(l -> l.onProcessExited(exited, code));
    }
    entry.exit.complete(exited);
    table.remove(exited.pid(), entry);
  }

  private static int exitCodeOf(Process process) {
    try {
      return process.exitValue();
    } catch (IllegalThreadStateException ex) {
      log.debug("Exit observed before exit value was available", ex);
      return -1;
    }
  }

  private int livingCount() {
    int count = 0;
    for (Entry entry : table.values()) {
      if (entry.snapshot().isRunning()) {
        count++;
      }
    }
    return count;
  }

  private void notifyListeners(Consumer<ProcessSupervisorListener> event) {
    for (ProcessSupervisorListener listener : listeners) {
      try {
        event.accept(listener);
      } catch (RuntimeException ex) {
        log.warn("Process supervisor listener {} failed", listener, ex);
      }
    }
  }

  private static final class Entry {
    private final AtomicReference<ManagedProcess> snapshot;
    private final Process process;
    private final CompletableFuture<ManagedProcess> exit = new CompletableFuture<>();

    private Entry(ManagedProcess snapshot, Process process) {
      this.snapshot = new AtomicReference<>(snapshot);
      this.process = process;
    }

    ManagedProcess snapshot() {
      return snapshot.get();
    }

    ManagedProcess update(UnaryOperator<ManagedProcess> transition) {
      return snapshot.updateAndGet(transition);
    }
  }
}
