package ca.gc.cra.harness.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

class StatsCliTest {

  @Test
  void reportsEmptyPoolAsJson() {
    try (CliOutputCapture out = new CliOutputCapture()) {
      ExitCode code = StatsCli.run(new String[] {"sessions=0", "pretty=false", "--no-telemetry"});

      assertEquals(ExitCode.SUCCESS, code);
      assertTrue(out.text().contains("\"resourceType\":\"shell-session\""));
      assertTrue(out.text().contains("\"totalCreated\":0"));
    }
  }

  @Test
  void rejectsTooManySessions() {
    try (CliOutputCapture ignored = new CliOutputCapture()) {
      assertEquals(ExitCode.INVALID_ARGS, StatsCli.run(new String[] {"sessions=100", "--no-telemetry"}));
    }
  }

  @Test
  void rejectsInvalidPoolSize() {
    try (CliOutputCapture ignored = new CliOutputCapture()) {
      assertEquals(ExitCode.CONFIG_ERROR, StatsCli.run(new String[] {"pool.maxSize=0", "--no-telemetry"}));
    }
  }

  @Test
  @EnabledOnOs(OS.LINUX)
  void acquiredSessionsReturnIdle() {
    try (CliOutputCapture out = new CliOutputCapture()) {
      ExitCode code = StatsCli.run(new String[] {"sessions=2", "pretty=false", "--no-telemetry"});

      assertEquals(ExitCode.SUCCESS, code);
      assertTrue(out.text().contains("\"totalCreated\":2"), out.text());
      assertTrue(out.text().contains("\"idle\":2"), out.text());
    }
  }
}
