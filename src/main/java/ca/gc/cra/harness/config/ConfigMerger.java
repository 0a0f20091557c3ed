package ca.gc.cra.harness.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges defaults, a properties file, YAML and CLI arguments into one flat map.
 *
 * <p>Precedence is CLI &gt; YAML &gt; properties &gt; defaults. Command-level requirements are checked on the
 * merged result so a required key may come from any source.</p>
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration.
   *
   * @param command active command ({@code exec}, {@code await}, {@code stats})
   * @param properties values from a {@code .properties} file; may be empty
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn receives a message when a CLI key overrides a file key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when the merged configuration is incomplete
   */
  public static Map<String, String> buildEffectiveConfig(
      String command,
      Map<String, String> properties,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> propertiesCopy = properties == null ? Map.of() : properties;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(propertiesCopy);
    merged.putAll(yamlCopy);

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (warn != null && (yamlCopy.containsKey(key) || propertiesCopy.containsKey(key))) {
        warn.accept("CLI overrides configuration file for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(command.trim().toLowerCase(Locale.ROOT), merged);
    return Map.copyOf(merged);
  }

  private static void validate(String command, Map<String, String> effective) {
    switch (command) {
      case "exec" -> {
        if (trim(effective.get("command")).isEmpty()) {
          throw new IllegalArgumentException("command is required for exec");
        }
      }
      case "await" -> {
        boolean file = !trim(effective.get("file")).isEmpty();
        boolean pid = !trim(effective.get("pid")).isEmpty();
        if (file == pid) {
          throw new IllegalArgumentException("await requires exactly one of file or pid");
        }
      }
      case "stats" -> {
        // every key is optional
      }
      default -> throw new IllegalArgumentException("Unsupported command: " + command);
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
