package ca.gc.cra.harness.api;

import ca.gc.cra.harness.application.wait.Waiter;
import ca.gc.cra.harness.config.AwaitSettings;
import ca.gc.cra.harness.domain.wait.WaitOptions;
import ca.gc.cra.harness.domain.wait.WaitResult;
import ca.gc.cra.harness.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocks until a file appears or a process exits, polling with the configured backoff.
 *
 * @since 0.1.0
 */
public final class AwaitCli {
  private static final Logger log = LoggerFactory.getLogger(AwaitCli.class);
  private static final String SUMMARY_USAGE =
      "usage: harness await (file=PATH | pid=N) [wait.timeout=30s] [wait.strategy=multiplier] "
          + "[config=FILE.yaml] [properties=FILE]";
  private static final String HELP_TEXT = """
      harness await

      Usage:
        await file=PATH [options]
        await pid=N [options]

      Targets (exactly one):
        file=PATH                 Succeed once PATH exists
        pid=N                     Succeed once process N is gone

      Options:
        wait.timeout=DURATION     Deadline (default 30s)
        wait.initialDelay=DURATION
        wait.maxDelay=DURATION
        wait.strategy=NAME        linear|exponential|fibonacci|quadratic|multiplier
        wait.backoffMultiplier=X
        wait.jitter=X             0..1
        config=FILE.yaml          YAML file with common/await sections
        properties=FILE           Properties file (lowest precedence)
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Exit status:
        0 condition met; 124 deadline passed; 130 interrupted
      """;

  private AwaitCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return run(args, new Waiter());
  }

  static ExitCode run(String[] args, Waiter waiter) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for await");
    }

    PreparedCommand prepared = PreparedCommand.prepare("await", input, SUMMARY_USAGE, log);
    if (prepared.failed()) {
      return prepared.failure();
    }
    AwaitSettings target;
    try {
      target = AwaitSettings.fromMap(prepared.effective());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid await arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    WaitOptions options = prepared.config().waits().options();
    try {
      WaitResult<?> result;
      String description;
      if (target.file().isPresent()) {
        description = "file " + target.file().get();
        result = waiter.waitForFile(target.file().get(), options);
      } else {
        long pid = target.pid().getAsLong();
        description = "exit of pid " + pid;
        result = waiter.waitForProcessExit(
            () -> ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false), options);
      }
      if (result.success()) {
        CliPrinter.println("ready: " + description + " after " + result.attempts() + " attempt(s), "
            + result.totalWaitTime().toMillis() + " ms");
        return ExitCode.SUCCESS;
      }
      log.error("Timed out waiting for {} after {} attempt(s), {} ms",
          description, result.attempts(), result.totalWaitTime().toMillis());
      return ExitCode.TIMEOUT;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("await interrupted");
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in await", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
