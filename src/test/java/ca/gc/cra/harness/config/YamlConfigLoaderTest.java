package ca.gc.cra.harness.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void commandSectionOverridesCommon() throws IOException {
    Path yaml = tempDir.resolve("harness.yaml");
    Files.writeString(yaml, """
        common:
          pool:
            maxSize: 4
          wait:
            timeout: 10s
        exec:
          wait:
            timeout: 2s
          command: /bin/echo
        stats:
          sessions: 3
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "exec").orElseThrow();

    assertEquals("4", map.get("pool.maxSize"));
    assertEquals("2s", map.get("wait.timeout"));
    assertEquals("/bin/echo", map.get("command"));
    assertFalse(map.containsKey("sessions"));
  }

  @Test
  void sequencesBecomeCommaLists() throws IOException {
    Path yaml = tempDir.resolve("args.yaml");
    Files.writeString(yaml, """
        exec:
          args: [-c, "echo hi"]
        """);

    assertEquals("-c,echo hi", YamlConfigLoader.load(yaml, "exec").orElseThrow().get("args"));
  }

  @Test
  void nullValuesBecomeBlank() throws IOException {
    Path yaml = tempDir.resolve("null.yaml");
    Files.writeString(yaml, """
        await:
          file:
        """);

    assertEquals("", YamlConfigLoader.load(yaml, "await").orElseThrow().get("file"));
  }

  @Test
  void missingFileReturnsEmpty() throws IOException {
    Optional<Map<String, String>> result = YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "stats");

    assertFalse(result.isPresent());
  }

  @Test
  void emptyDocumentReturnsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertTrue(YamlConfigLoader.load(yaml, "stats").orElseThrow().isEmpty());
  }

  @Test
  void rootSequenceIsRejected() throws IOException {
    Path yaml = tempDir.resolve("list.yaml");
    Files.writeString(yaml, """
        - exec:
            command: ls
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "exec"));
  }

  @Test
  void nestedMappingInSequenceIsRejected() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        exec:
          args:
            - flag: true
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "exec"));
  }

  @Test
  void malformedYamlIsReportedAsIllegalArgument() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "exec: [unterminated\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "exec"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(tempDir.resolve("any.yaml"), "capture"));
  }
}
