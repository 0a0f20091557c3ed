package ca.gc.cra.harness.application.process;

import ca.gc.cra.harness.application.port.ExitHookRegistry;
import ca.gc.cra.harness.application.port.ProcessLauncher;
import ca.gc.cra.harness.application.port.SignalSender;
import ca.gc.cra.harness.domain.process.ProcessOptions;
import ca.gc.cra.harness.domain.process.Signal;
import ca.gc.cra.harness.testing.FakeProcess;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fake launcher and signal sender sharing one table of {@link FakeProcess} instances.
 */
final class FakeProcesses implements ProcessLauncher, SignalSender {
  enum Reaction { EXIT, IGNORE, FAIL }

  private final AtomicLong nextPid = new AtomicLong(1000);
  private final Map<Long, FakeProcess> processes = new ConcurrentHashMap<>();
  private final Map<Long, Reaction> termReactions = new ConcurrentHashMap<>();
  private final Map<Long, Reaction> killReactions = new ConcurrentHashMap<>();
  final List<String> deliveries = new CopyOnWriteArrayList<>();
  final List<ProcessOptions> launches = new CopyOnWriteArrayList<>();
  volatile boolean groupsSupported = true;
  volatile IOException launchFailure;

  @Override
  public LaunchedProcess launch(String command, List<String> args, ProcessOptions options) throws IOException {
    if (launchFailure != null) {
      throw launchFailure;
    }
    launches.add(options);
    long pid = nextPid.incrementAndGet();
    FakeProcess process = new FakeProcess(pid);
    processes.put(pid, process);
    return new LaunchedProcess(process, options.detached() ? OptionalLong.of(pid) : OptionalLong.empty());
  }

  @Override
  public boolean signalGroup(long processGroupId, Signal signal) {
    if (!groupsSupported) {
      return false;
    }
    return react("group", processGroupId, signal);
  }

  @Override
  public boolean signalProcess(long pid, Signal signal) throws IOException {
    return react("pid", pid, signal);
  }

  private boolean react(String kind, long id, Signal signal) {
    FakeProcess process = processes.get(id);
    if (process == null || !process.isAlive()) {
      return false;
    }
    Reaction reaction = (signal == Signal.KILL ? killReactions : termReactions).getOrDefault(id, Reaction.EXIT);
    if (reaction == Reaction.FAIL) {
      return false;
    }
    deliveries.add(kind + ":" + id + ":" + signal);
    if (reaction == Reaction.EXIT) {
      process.exit(signal == Signal.KILL ? 137 : 143);
    }
    return true;
  }

  void onTerm(long pid, Reaction reaction) {
    termReactions.put(pid, reaction);
  }

  void onKill(long pid, Reaction reaction) {
    killReactions.put(pid, reaction);
  }

  FakeProcess process(long pid) {
    return processes.get(pid);
  }

  /** Exit-hook registry that records actions instead of installing a JVM hook. */
  static final class RecordingExitHooks implements ExitHookRegistry {
    final List<Runnable> actions = new CopyOnWriteArrayList<>();
    final List<String> names = new ArrayList<>();

    @Override
    public Registration register(String name, Runnable action) {
      names.add(name);
      actions.add(action);
      return () -> actions.remove(action);
    }

    void runAll() {
      for (Runnable action : List.copyOf(actions)) {
        action.run();
      }
    }
  }
}
