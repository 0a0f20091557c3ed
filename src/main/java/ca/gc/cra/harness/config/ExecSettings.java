package ca.gc.cra.harness.config;

import ca.gc.cra.harness.validation.Numbers;
import ca.gc.cra.harness.validation.Strings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Arguments of {@code harness exec}.
 *
 * @param command executable to launch
 * @param args arguments, given on the command line as a comma-separated list
 * @param workingDirectory directory to start in; empty inherits the CLI's
 * @param timeout budget covering the expected-output wait and the exit wait together
 * @param expect text that must appear in the output before the deadline; empty skips the check
 * @since 0.1.0
 */
public record ExecSettings(
    String command,
    List<String> args,
    Optional<Path> workingDirectory,
    Duration timeout,
    Optional<String> expect) {

  public ExecSettings {
    command = Strings.requireNonBlank("command", command);
    args = List.copyOf(Objects.requireNonNull(args, "args"));
    Objects.requireNonNull(workingDirectory, "workingDirectory");
    Numbers.requirePositive("timeout", timeout);
    Objects.requireNonNull(expect, "expect");
  }

  /**
   * Reads {@code command}, {@code args}, {@code cwd}, {@code timeout} and {@code expect}.
   *
   * @param options effective configuration
   * @return settings
   * @throws IllegalArgumentException when {@code command} is missing or {@code timeout} is malformed
   */
  public static ExecSettings fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String cwd = options.getOrDefault("cwd", "").trim();
    String expect = options.getOrDefault("expect", "");
    return new ExecSettings(
        options.getOrDefault("command", ""),
        splitArgs(options.getOrDefault("args", "")),
        cwd.isEmpty() ? Optional.empty() : Optional.of(Path.of(cwd)),
        ConfigValues.durationValue(options, "timeout", Duration.ofSeconds(30)),
        expect.isEmpty() ? Optional.empty() : Optional.of(expect));
  }

  static List<String> splitArgs(String raw) {
    List<String> parts = new ArrayList<>();
    if (raw == null || raw.isEmpty()) {
      return parts;
    }
    for (String part : raw.split(",", -1)) {
      parts.add(part.trim());
    }
    return parts;
  }
}
