package ca.gc.cra.harness.api;

import ca.gc.cra.harness.application.pool.AcquisitionTimeoutException;
import ca.gc.cra.harness.application.pool.PoolException;
import ca.gc.cra.harness.application.pool.ResourcePool;
import ca.gc.cra.harness.config.CompositionRoot;
import ca.gc.cra.harness.config.StatsSettings;
import ca.gc.cra.harness.infrastructure.session.SessionConfig;
import ca.gc.cra.harness.infrastructure.session.ShellSession;
import ca.gc.cra.harness.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exercises the shell-session pool and prints its metrics snapshot as JSON.
 *
 * <p>Acquires {@code sessions} shells, releases them back to the pool, then reports. Useful as a smoke test of
 * pool sizing and memory thresholds on a CI agent.</p>
 *
 * @since 0.1.0
 */
public final class StatsCli {
  private static final Logger log = LoggerFactory.getLogger(StatsCli.class);
  private static final String SUMMARY_USAGE =
      "usage: harness stats [sessions=1] [shell=/bin/sh] [pretty=true] [pool.*=VALUE] [memory.*=VALUE] "
          + "[config=FILE.yaml] [properties=FILE] [--no-telemetry]";
  private static final String HELP_TEXT = """
      harness stats

      Usage:
        stats [options]

      Options:
        sessions=N              Shell sessions to acquire and release first (0-64, default 1)
        shell=PATH              Shell for those sessions (default /bin/sh)
        pretty=true|false       Indent the JSON report (default true)
        pool.maxSize=N          Pool capacity per configuration key
        pool.acquisitionTimeout=DURATION
        memory.maxHeapUsed=SIZE Heap limit, e.g. 512MB
        memory.maxRss=SIZE      Resident set limit, e.g. 1GB
        config=FILE.yaml        YAML file with common/stats sections
        properties=FILE         Properties file (lowest precedence)
        --no-telemetry          Disable OpenTelemetry export
        --verbose               Enable DEBUG logging
        --help                  Show this message
      """;

  private StatsCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for stats");
    }

    PreparedCommand prepared = PreparedCommand.prepare("stats", input, SUMMARY_USAGE, log);
    if (prepared.failed()) {
      return prepared.failure();
    }
    StatsSettings stats;
    try {
      stats = StatsSettings.fromMap(prepared.effective());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid stats arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = new CompositionRoot(prepared.config())) {
      ResourcePool<SessionConfig, ShellSession> pool = root.sessionPool();
      exercise(pool, stats);
      CliPrinter.println(new MetricsJsonWriter().write(pool.resourceType(), pool.getMetrics(), stats.pretty()));
      return ExitCode.SUCCESS;
    } catch (AcquisitionTimeoutException ex) {
      log.error("Timed out acquiring a session: {}", ex.getMessage());
      return ExitCode.TIMEOUT;
    } catch (PoolException ex) {
      log.error("Session pool failure", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("stats interrupted");
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in stats", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void exercise(ResourcePool<SessionConfig, ShellSession> pool, StatsSettings stats)
      throws PoolException, InterruptedException {
    SessionConfig config = SessionConfig.of(stats.shell());
    List<ShellSession> held = new ArrayList<>(stats.sessions());
    try {
      for (int i = 0; i < stats.sessions(); i++) {
        held.add(pool.acquire(config));
      }
      log.info("Acquired {} {} session(s)", held.size(), pool.resourceType());
    } finally {
      for (ShellSession session : held) {
        pool.release(session);
      }
    }
  }
}
