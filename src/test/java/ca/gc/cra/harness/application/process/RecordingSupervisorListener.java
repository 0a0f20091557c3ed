package ca.gc.cra.harness.application.process;

import ca.gc.cra.harness.domain.process.ManagedProcess;
import ca.gc.cra.harness.domain.process.Signal;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Captures supervisor events as readable strings.
 */
final class RecordingSupervisorListener implements ProcessSupervisorListener {
  final List<String> events = new CopyOnWriteArrayList<>();
  final List<Throwable> errors = new CopyOnWriteArrayList<>();

  @Override
  public void onProcessStarted(ManagedProcess process) {
    events.add("started:" + process.pid());
  }

  @Override
  public void onProcessExited(ManagedProcess process, int exitCode) {
    events.add("exited:" + process.pid() + ":" + exitCode);
  }

  @Override
  public void onProcessKilled(ManagedProcess process, Signal signal) {
    events.add("killed:" + process.pid() + ":" + signal);
  }

  @Override
  public void onCleanupComplete(int exitedCount) {
    events.add("cleanup:" + exitedCount);
  }

  @Override
  public void onError(OptionalLong pid, Throwable error) {
    events.add("error:" + (pid.isPresent() ? pid.getAsLong() : "-"));
    errors.add(error);
  }

  long count(String prefix) {
    return events.stream().filter(e -> e.startsWith(prefix)).count();
  }
}
