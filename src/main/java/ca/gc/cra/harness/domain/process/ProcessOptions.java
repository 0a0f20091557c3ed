package ca.gc.cra.harness.domain.process;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Launch options for a supervised process.
 *
 * @param workingDirectory directory to start in; empty inherits the JVM's
 * @param environment variables overlaid on the inherited environment
 * @param detached whether the process should lead its own process group
 * @param outputConsumer receiver of decoded stdout/stderr chunks; empty discards output
 * @since 0.1.0
 */
public record ProcessOptions(
    Optional<Path> workingDirectory,
    Map<String, String> environment,
    boolean detached,
    Optional<Consumer<String>> outputConsumer) {

  public ProcessOptions {
    Objects.requireNonNull(workingDirectory, "workingDirectory");
    environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
    Objects.requireNonNull(outputConsumer, "outputConsumer");
  }

  /**
   * Detached, inherited directory and environment, output discarded.
   *
   * @return default options
   */
  public static ProcessOptions defaults() {
    return new ProcessOptions(Optional.empty(), Map.of(), true, Optional.empty());
  }

  public ProcessOptions withWorkingDirectory(Path directory) {
    return new ProcessOptions(Optional.ofNullable(directory), environment, detached, outputConsumer);
  }

  public ProcessOptions withEnvironment(Map<String, String> env) {
    return new ProcessOptions(workingDirectory, env, detached, outputConsumer);
  }

  public ProcessOptions withDetached(boolean value) {
    return new ProcessOptions(workingDirectory, environment, value, outputConsumer);
  }

  public ProcessOptions withOutputConsumer(Consumer<String> consumer) {
    return new ProcessOptions(workingDirectory, environment, detached, Optional.ofNullable(consumer));
  }
}
