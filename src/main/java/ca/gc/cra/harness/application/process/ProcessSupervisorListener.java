package ca.gc.cra.harness.application.process;

import ca.gc.cra.harness.domain.process.ManagedProcess;
import ca.gc.cra.harness.domain.process.Signal;
import java.util.OptionalLong;

/**
 * Receives supervisor lifecycle events.
 *
 * <p>All methods default to no-ops. They run on the thread that caused the event (caller, exit observer
 * or shutdown thread); exceptions are logged by the supervisor and never propagate.</p>
 *
 * @since 0.1.0
 */
public interface ProcessSupervisorListener {
  default void onProcessStarted(ManagedProcess process) {}

  default void onProcessExited(ManagedProcess process, int exitCode) {}

  default void onProcessKilled(ManagedProcess process, Signal signal) {}

  /**
   * Fired once when {@code shutdown} finishes.
   *
   * @param exitedCount processes confirmed gone during shutdown
   */
  default void onCleanupComplete(int exitedCount) {}

  /**
   * Fired for spawn failures and undeliverable signals.
   *
   * @param pid affected process, empty for spawn failures
   * @param error cause
   */
  default void onError(OptionalLong pid, Throwable error) {}
}
