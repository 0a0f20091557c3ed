package ca.gc.cra.harness.application.port;

import ca.gc.cra.harness.domain.process.Signal;
import java.io.IOException;

/**
 * Port delivering signals to processes and process groups.
 *
 * @since 0.1.0
 */
public interface SignalSender {
  /**
   * Signals every member of a process group.
   *
   * @param processGroupId group id (positive)
   * @param signal signal to deliver
   * @return {@code true} when delivered, {@code false} when group signalling is unsupported or the group is gone
   * @throws IOException when the delivery mechanism itself fails
   */
  boolean signalGroup(long processGroupId, Signal signal) throws IOException;

  /**
   * Signals a single process and its descendants.
   *
   * @param pid process id
   * @param signal signal to deliver
   * @return {@code true} when delivered to the process
   * @throws IOException when the delivery mechanism itself fails
   */
  boolean signalProcess(long pid, Signal signal) throws IOException;
}
