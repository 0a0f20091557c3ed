package ca.gc.cra.harness.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigMergerTest {

  @TempDir Path tempDir;

  @Test
  void precedenceIsCliThenYamlThenPropertiesThenDefaults() {
    Map<String, String> defaults = DefaultsForCommand.asFlatMap("stats");
    Map<String, String> properties = Map.of("pool.maxSize", "2", "sessions", "2", "shell", "/bin/bash");
    Optional<Map<String, String>> yaml = Optional.of(Map.of("pool.maxSize", "3", "sessions", "3"));
    Map<String, String> cli = Map.of("pool.maxSize", "4");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged =
        ConfigMerger.buildEffectiveConfig("stats", properties, yaml, cli, defaults, warnings::add);

    assertEquals("4", merged.get("pool.maxSize"));
    assertEquals("3", merged.get("sessions"));
    assertEquals("/bin/bash", merged.get("shell"));
    assertEquals("true", merged.get("pretty"));
    assertEquals(List.of("CLI overrides configuration file for key: pool.maxSize"), warnings);
  }

  @Test
  void execRequiresCommandFromSomeSource() {
    Map<String, String> defaults = DefaultsForCommand.asFlatMap("exec");

    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "exec", Map.of(), Optional.empty(), Map.of(), defaults, null));

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "exec", Map.of("command", "/bin/true"), Optional.empty(), Map.of(), defaults, null);
    assertEquals("/bin/true", merged.get("command"));
  }

  @Test
  void awaitRequiresExactlyOneTarget() {
    Map<String, String> defaults = DefaultsForCommand.asFlatMap("await");

    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "await", Map.of(), Optional.empty(), Map.of(), defaults, null));
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "await", Map.of(), Optional.empty(), Map.of("file", "/tmp/x", "pid", "42"), defaults, null));
  }

  @Test
  void unknownCommandIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "capture", Map.of(), Optional.empty(), Map.of(), Map.of(), null));
  }

  @Test
  void defaultsRoundTripThroughHarnessConfig() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "stats", Map.of(), Optional.empty(), Map.of("otel.metrics.exporter", "none"),
        DefaultsForCommand.asFlatMap("stats"), null);

    HarnessConfig config = HarnessConfig.fromMap(merged);

    assertEquals(PoolSettings.defaults(), config.pool());
    assertEquals(MemorySettings.defaults(), config.memory());
    assertEquals(BufferSettings.defaults(), config.buffer());
  }

  @Test
  void propertiesLoaderTrimsValues() throws IOException {
    Path file = tempDir.resolve("harness.properties");
    Files.writeString(file, "pool.maxSize = 6  \n# comment\nshell=/bin/sh\n");

    Map<String, String> loaded = PropertiesConfigLoader.load(file);

    assertEquals("6", loaded.get("pool.maxSize"));
    assertEquals("/bin/sh", loaded.get("shell"));
    assertEquals(2, loaded.size());
  }

  @Test
  void missingPropertiesFileIsEmpty() throws IOException {
    assertTrue(PropertiesConfigLoader.load(tempDir.resolve("absent.properties")).isEmpty());
    assertTrue(PropertiesConfigLoader.load(null).isEmpty());
  }

  @Test
  void defaultsLeaveTelemetryBlank() {
    Map<String, String> defaults = DefaultsForCommand.asFlatMap("exec");

    assertEquals("", defaults.get("otel.metrics.exporter"));
    assertEquals("30s", defaults.get("timeout"));
    assertThrows(IllegalArgumentException.class, () -> DefaultsForCommand.asFlatMap("poster"));
  }
}
