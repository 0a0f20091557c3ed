package ca.gc.cra.harness.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Target of {@code harness await}: a file that must appear or a pid that must exit.
 *
 * @param file path to wait for
 * @param pid process to wait on
 * @since 0.1.0
 */
public record AwaitSettings(Optional<Path> file, OptionalLong pid) {

  public AwaitSettings {
    Objects.requireNonNull(file, "file");
    Objects.requireNonNull(pid, "pid");
    if (file.isPresent() == pid.isPresent()) {
      throw new IllegalArgumentException("await requires exactly one of file or pid");
    }
    if (pid.isPresent() && pid.getAsLong() <= 0) {
      throw new IllegalArgumentException("pid must be positive");
    }
  }

  public static AwaitSettings forFile(Path path) {
    return new AwaitSettings(Optional.of(Objects.requireNonNull(path, "path")), OptionalLong.empty());
  }

  public static AwaitSettings forPid(long pid) {
    return new AwaitSettings(Optional.empty(), OptionalLong.of(pid));
  }

  /**
   * Reads {@code file} or {@code pid}.
   *
   * @param options effective configuration
   * @return settings
   * @throws IllegalArgumentException when neither or both are set, or the pid is not a positive integer
   */
  public static AwaitSettings fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String file = options.getOrDefault("file", "").trim();
    String pid = options.getOrDefault("pid", "").trim();
    OptionalLong parsedPid = OptionalLong.empty();
    if (!pid.isEmpty()) {
      try {
        parsedPid = OptionalLong.of(Long.parseLong(pid));
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("pid must be an integer (was '" + pid + "')", ex);
      }
    }
    return new AwaitSettings(file.isEmpty() ? Optional.empty() : Optional.of(Path.of(file)), parsedPid);
  }
}
