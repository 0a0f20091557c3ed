package ca.gc.cra.harness.config;

import ca.gc.cra.harness.validation.Numbers;
import ca.gc.cra.harness.validation.Strings;
import java.util.Map;
import java.util.Objects;

/**
 * Arguments of {@code harness stats}.
 *
 * @param sessions shell sessions to acquire and release before the snapshot is taken
 * @param shell shell executable for those sessions
 * @param pretty whether the JSON report is indented
 * @since 0.1.0
 */
public record StatsSettings(int sessions, String shell, boolean pretty) {

  public StatsSettings {
    Numbers.requireRange("sessions", sessions, 0, 64);
    shell = Strings.requireNonBlank("shell", shell);
  }

  public static StatsSettings fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    return new StatsSettings(
        ConfigValues.intValue(options, "sessions", 1),
        options.getOrDefault("shell", "/bin/sh"),
        ConfigValues.booleanValue(options, "pretty", true));
  }
}
