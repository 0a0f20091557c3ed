package ca.gc.cra.harness.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.TreeSet;

/**
 * <strong>What:</strong> Loads flat {@code key=value} settings from a {@code .properties} file.
 * <p><strong>Role:</strong> Lowest-precedence file source, below YAML and the command line.</p>
 * <p><strong>Thread-safety:</strong> Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class PropertiesConfigLoader {
  private PropertiesConfigLoader() {}

  /**
   * Reads the file if it exists.
   *
   * @param path properties file; {@code null} or missing yields an empty map
   * @return trimmed keys and values in key order
   * @throws IOException if the file exists but cannot be read
   */
  public static Map<String, String> load(Path path) throws IOException {
    if (path == null || !Files.exists(path)) {
      return Map.of();
    }
    Properties props = new Properties();
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      props.load(reader);
    }
    Map<String, String> values = new LinkedHashMap<>();
    for (String name : new TreeSet<>(props.stringPropertyNames())) {
      values.put(name.trim(), props.getProperty(name).trim());
    }
    return Map.copyOf(values);
  }
}
