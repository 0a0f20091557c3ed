package ca.gc.cra.harness.infrastructure.session;

import ca.gc.cra.harness.domain.pool.ConfigKey;
import ca.gc.cra.harness.domain.pool.PoolableConfig;
import ca.gc.cra.harness.validation.Numbers;
import ca.gc.cra.harness.validation.Strings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration of a pooled shell session.
 *
 * <p>Sessions share a pool key when shell, working directory and environment match; the close timeout does
 * not affect reuse.</p>
 *
 * @param shell shell executable
 * @param workingDirectory directory to start in; empty inherits the JVM's
 * @param environment variables overlaid on the inherited environment
 * @param closeTimeout grace period between {@code TERM} and {@code KILL} on close
 * @since 0.1.0
 */
public record SessionConfig(
    String shell,
    Optional<Path> workingDirectory,
    Map<String, String> environment,
    Duration closeTimeout) implements PoolableConfig {

  public SessionConfig {
    shell = Strings.requireNonBlank("shell", shell);
    Objects.requireNonNull(workingDirectory, "workingDirectory");
    environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
    Numbers.requirePositive("closeTimeout", closeTimeout);
  }

  /**
   * {@code /bin/sh} in the current directory with a five second close grace period.
   *
   * @return default session config
   */
  public static SessionConfig defaults() {
    return new SessionConfig("/bin/sh", Optional.empty(), Map.of(), Duration.ofSeconds(5));
  }

  public static SessionConfig of(String shell) {
    return defaults().withShell(shell);
  }

  public SessionConfig withShell(String value) {
    return new SessionConfig(value, workingDirectory, environment, closeTimeout);
  }

  public SessionConfig withWorkingDirectory(Path value) {
    return new SessionConfig(shell, Optional.ofNullable(value), environment, closeTimeout);
  }

  public SessionConfig withEnvironment(Map<String, String> value) {
    return new SessionConfig(shell, workingDirectory, value, closeTimeout);
  }

  public SessionConfig withCloseTimeout(Duration value) {
    return new SessionConfig(shell, workingDirectory, environment, value);
  }

  @Override
  public ConfigKey poolKey() {
    return ConfigKey.builder()
        .field("shell", shell)
        .field("cwd", workingDirectory.map(Path::toString).orElse(null))
        .field("env", environment)
        .build();
  }
}
