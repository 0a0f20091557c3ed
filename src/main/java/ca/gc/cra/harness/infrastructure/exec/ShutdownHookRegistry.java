package ca.gc.cra.harness.infrastructure.exec;

import ca.gc.cra.harness.application.port.ExitHookRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ExitHookRegistry} backed by a single JVM shutdown hook.
 * <p><strong>Why:</strong> SIGINT, SIGTERM and normal exit all run JVM shutdown hooks, so one hook per
 * registry covers every exit path without each supervisor installing its own.</p>
 * <p><strong>Thread-safety:</strong> Registration and the hook body are guarded by one lock; the hook
 * runs actions on a copy so late unregistrations cannot break it.</p>
 *
 * @since 0.1.0
 */
public final class ShutdownHookRegistry implements ExitHookRegistry {
  private static final Logger log = LoggerFactory.getLogger(ShutdownHookRegistry.class);

  private final Consumer<Thread> hookInstaller;
  private final ReentrantLock lock = new ReentrantLock();
  private final Map<Long, Action> actions = new LinkedHashMap<>();
  private final AtomicLong ids = new AtomicLong();
  private boolean installed;

  /**
   * Creates a registry that installs its hook with {@link Runtime#addShutdownHook(Thread)}.
   */
  public ShutdownHookRegistry() {
    this(Runtime.getRuntime()::addShutdownHook);
  }

  /**
   * Creates a registry with a custom hook installer.
   *
   * @param hookInstaller receives the hook thread on first registration
   */
  public ShutdownHookRegistry(Consumer<Thread> hookInstaller) {
    this.hookInstaller = Objects.requireNonNull(hookInstaller, "hookInstaller");
  }

  @Override
  public Registration register(String name, Runnable action) {
    Objects.requireNonNull(action, "action");
    String label = name == null || name.isBlank() ? "exit-action" : name;
    long id = ids.incrementAndGet();
    lock.lock();
    try {
      actions.put(id, new Action(label, action));
      if (!installed) {
        installed = true;
        Thread hook = new Thread(this::runActions, "harness-exit-hook");
        hookInstaller.accept(hook);
        log.debug("Installed JVM exit hook");
      }
    } finally {
      lock.unlock();
    }
    return () -> {
      lock.lock();
      try {
        actions.remove(id);
      } finally {
        lock.unlock();
      }
    };
  }

  /**
   * Number of actions currently registered.
   *
   * @return registered action count
   */
  public int size() {
    lock.lock();
    try {
      return actions.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Runs every registered action once, in registration order; failures are logged and skipped.
   */
  void runActions() {
    List<Action> snapshot;
    lock.lock();
    try {
      snapshot = new ArrayList<>(actions.values());
    } finally {
      lock.unlock();
    }
    for (Action action : snapshot) {
      try {
        action.runnable().run();
      } catch (RuntimeException ex) {
        log.warn("Exit action {} failed", action.name(), ex);
      }
    }
  }

  private record Action(String name, Runnable runnable) {}
}
