package ca.gc.cra.harness.api;

import ca.gc.cra.harness.config.HarnessConfig;
import ca.gc.cra.harness.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * Outcome of the argument and configuration steps every command shares.
 *
 * <p>Exactly one of {@code config} and {@code failure} is non-null.</p>
 *
 * @param effective merged configuration map
 * @param config parsed configuration
 * @param failure exit code to return without running the command
 */
record PreparedCommand(Map<String, String> effective, HarnessConfig config, ExitCode failure) {

  boolean failed() {
    return failure != null;
  }

  /**
   * Parses {@code key=value} arguments, applies telemetry shorthands, merges files and defaults and builds
   * {@link HarnessConfig}. Errors are logged and the usage line printed.
   *
   * @param command command name
   * @param input parsed CLI input
   * @param usage one-line usage printed on argument errors
   * @param log command logger
   * @return prepared command or failure
   */
  static PreparedCommand prepare(String command, CliInput input, String usage, Logger log) {
    Objects.requireNonNull(input, "input");
    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      TelemetryConfigurator.configureMetrics(kv, input.hasFlag("--no-telemetry"));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return failure(ExitCode.INVALID_ARGS);
    }

    Map<String, String> effective;
    try {
      effective = ConfigCliUtils.effectiveConfig(command, kv, log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", command, ex.getMessage());
      CliPrinter.println(usage);
      return failure(ExitCode.INVALID_ARGS);
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return failure(ExitCode.IO_ERROR);
    }

    if (!input.verbose() && ConfigCliUtils.parseBoolean(effective, "verbose", false)) {
      LoggingConfigurator.enableVerboseLogging();
    }

    try {
      return new PreparedCommand(effective, HarnessConfig.fromMap(effective), null);
    } catch (IllegalArgumentException | ArithmeticException ex) {
      log.error("Invalid {} configuration: {}", command, ex.getMessage());
      return failure(ExitCode.CONFIG_ERROR);
    }
  }

  private static PreparedCommand failure(ExitCode code) {
    return new PreparedCommand(Map.of(), null, code);
  }
}
