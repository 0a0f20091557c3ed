package ca.gc.cra.harness.infrastructure.events;

import ca.gc.cra.harness.application.process.ProcessSupervisorListener;
import ca.gc.cra.harness.domain.process.ManagedProcess;
import ca.gc.cra.harness.domain.process.Signal;
import java.util.OptionalLong;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders supervisor events as {@code process.event key=value, ...} log lines.
 *
 * @since 0.1.0
 */
public final class LoggingSupervisorListener implements ProcessSupervisorListener {
  private static final Logger log = LoggerFactory.getLogger(LoggingSupervisorListener.class);

  @Override
  public void onProcessStarted(ManagedProcess process) {
    log.info("process.event {}", describe("started", process).add("args=" + process.args()));
  }

  @Override
  public void onProcessExited(ManagedProcess process, int exitCode) {
    log.info("process.event {}", describe("exited", process).add("code=" + exitCode));
  }

  @Override
  public void onProcessKilled(ManagedProcess process, Signal signal) {
    log.info("process.event {}", describe("killed", process).add("signal=" + signal));
  }

  @Override
  public void onCleanupComplete(int exitedCount) {
    log.info("process.event type=cleanup, exited={}", exitedCount);
  }

  @Override
  public void onError(OptionalLong pid, Throwable error) {
    String target = pid.isPresent() ? String.valueOf(pid.getAsLong()) : "-";
    log.warn("process.event type=error, pid={}, error={}", target, error.toString());
  }

  private static StringJoiner describe(String type, ManagedProcess process) {
    StringJoiner joiner = new StringJoiner(", ");
    joiner.add("type=" + type);
    joiner.add("pid=" + process.pid());
    joiner.add("command=" + process.command());
    process.processGroupId().ifPresent(pgid -> joiner.add("pgid=" + pgid));
    return joiner;
  }
}
