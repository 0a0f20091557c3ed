package ca.gc.cra.harness.application.port;

import ca.gc.cra.harness.domain.process.ProcessOptions;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Port that spawns operating system processes for the supervisor.
 * <p><strong>Role:</strong> Implemented by {@code ProcessBuilderLauncher}; replaced by fakes in tests.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent launches.</p>
 *
 * @since 0.1.0
 */
public interface ProcessLauncher {
  /**
   * Spawns {@code command} with {@code args}.
   *
   * <p>Stdout and stderr are merged. When {@code options} carries no output consumer the output is
   * discarded instead of piped.</p>
   *
   * @param command executable name or path
   * @param args arguments
   * @param options working directory, environment overlay, detachment and output handling
   * @return the spawned process and, when it leads its own group, the group id
   * @throws IOException when the process cannot be started
   */
  LaunchedProcess launch(String command, List<String> args, ProcessOptions options) throws IOException;

  /**
   * Result of a launch.
   *
   * @param process JVM handle of the child
   * @param processGroupId group id when the child leads its own process group
   */
  record LaunchedProcess(Process process, OptionalLong processGroupId) {
    public LaunchedProcess {
      Objects.requireNonNull(process, "process");
      Objects.requireNonNull(processGroupId, "processGroupId");
    }
  }
}
