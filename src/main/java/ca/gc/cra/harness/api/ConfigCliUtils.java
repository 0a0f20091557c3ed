package ca.gc.cra.harness.api;

import ca.gc.cra.harness.config.ConfigMerger;
import ca.gc.cra.harness.config.DefaultsForCommand;
import ca.gc.cra.harness.config.PropertiesConfigLoader;
import ca.gc.cra.harness.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Shared steps for turning parsed CLI arguments into an effective configuration map.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Loads {@code config=} (YAML) and {@code properties=} files named in {@code args} and merges them with
   * the remaining arguments and the command defaults.
   *
   * @param command command name
   * @param args mutable CLI map; file keys are removed
   * @param warn receives override warnings
   * @return effective configuration
   * @throws IOException when a named file cannot be read
   * @throws IllegalArgumentException when a named file is missing or malformed, or the merge fails
   */
  static Map<String, String> effectiveConfig(String command, Map<String, String> args, Consumer<String> warn)
      throws IOException {
    Optional<Path> yamlPath = extractPath(args, "config");
    Optional<Path> propertiesPath = extractPath(args, "properties");

    Map<String, String> properties = Map.of();
    if (propertiesPath.isPresent()) {
      properties = PropertiesConfigLoader.load(requireExisting(propertiesPath.get()));
    }
    Optional<Map<String, String>> yaml = Optional.empty();
    if (yamlPath.isPresent()) {
      yaml = YamlConfigLoader.load(requireExisting(yamlPath.get()), command);
    }
    return ConfigMerger.buildEffectiveConfig(
        command, properties, yaml, args, DefaultsForCommand.asFlatMap(command), warn);
  }

  static Optional<Path> extractPath(Map<String, String> args, String key) {
    String value = args.remove(key);
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(Path.of(value.trim()));
  }

  static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  private static Path requireExisting(Path path) {
    if (!Files.exists(path)) {
      throw new IllegalArgumentException("Configuration file does not exist: " + path);
    }
    return path;
  }
}
