package ca.gc.cra.harness.domain.process;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * Immutable snapshot of a supervised process.
 *
 * <p>The supervisor replaces its stored snapshot on every transition; callers holding an older
 * snapshot keep seeing the state at the time they received it.</p>
 *
 * @param pid operating system process id
 * @param command executable that was launched
 * @param args arguments passed to the executable
 * @param startTime launch timestamp
 * @param processGroupId group id when the process leads its own group
 * @param status lifecycle state
 * @param exitCode exit code once observed
 * @since 0.1.0
 */
public record ManagedProcess(
    long pid,
    String command,
    List<String> args,
    Instant startTime,
    OptionalLong processGroupId,
    ProcessStatus status,
    OptionalInt exitCode) {

  public ManagedProcess {
    if (pid <= 0) {
      throw new IllegalArgumentException("pid must be positive");
    }
    Objects.requireNonNull(command, "command");
    args = List.copyOf(Objects.requireNonNull(args, "args"));
    Objects.requireNonNull(startTime, "startTime");
    Objects.requireNonNull(processGroupId, "processGroupId");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(exitCode, "exitCode");
  }

  /**
   * Creates a running snapshot.
   *
   * @param pid process id
   * @param command executable
   * @param args arguments
   * @param startTime launch time
   * @param processGroupId own group id, if any
   * @return running snapshot
   */
  public static ManagedProcess running(
      long pid, String command, List<String> args, Instant startTime, OptionalLong processGroupId) {
    return new ManagedProcess(pid, command, args, startTime, processGroupId, ProcessStatus.RUNNING,
        OptionalInt.empty());
  }

  public ManagedProcess withStatus(ProcessStatus newStatus) {
    return new ManagedProcess(pid, command, args, startTime, processGroupId, newStatus, exitCode);
  }

  public ManagedProcess exited(int code) {
    return new ManagedProcess(pid, command, args, startTime, processGroupId, ProcessStatus.EXITED,
        OptionalInt.of(code));
  }

  public boolean isRunning() {
    return !status.isTerminal();
  }
}
