package ca.gc.cra.harness.api;

import ca.gc.cra.harness.application.process.ProcessStartException;
import ca.gc.cra.harness.application.process.ProcessSupervisorListener;
import ca.gc.cra.harness.config.CompositionRoot;
import ca.gc.cra.harness.config.ExecSettings;
import ca.gc.cra.harness.domain.process.ManagedProcess;
import ca.gc.cra.harness.domain.process.ProcessOptions;
import ca.gc.cra.harness.domain.wait.WaitResult;
import ca.gc.cra.harness.logging.LoggingConfigurator;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one command under the process supervisor, relaying its output, optionally waiting for expected text,
 * and maps its outcome to an {@link ExitCode}.
 *
 * @since 0.1.0
 */
public final class ExecCli {
  private static final Logger log = LoggerFactory.getLogger(ExecCli.class);
  private static final String SUMMARY_USAGE =
      "usage: harness exec command=PATH [args=A,B,...] [cwd=DIR] [timeout=30s] [expect=TEXT] "
          + "[config=FILE.yaml] [properties=FILE] [--no-telemetry]";
  private static final String HELP_TEXT = """
      harness exec

      Usage:
        exec command=PATH [options]

      Options:
        command=PATH           Executable to launch (required)
        args=A,B,...           Comma-separated arguments
        cwd=DIR                Working directory
        timeout=DURATION       Budget for the expect wait and the exit wait (default 30s)
        expect=TEXT            Fail with 124 unless TEXT appears in the output in time
        config=FILE.yaml       YAML file with common/exec sections
        properties=FILE        Properties file (lowest precedence)
        wait.*=VALUE           Backoff tuning for the expect wait
        --no-telemetry         Disable OpenTelemetry export
        --verbose              Enable DEBUG logging
        --help                 Show this message

      Exit status:
        0 command exited 0; 5 non-zero exit; 3 launch failure; 124 timeout; 130 interrupted
      """;

  private ExecCli() {}

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
      log.debug("Verbose logging enabled for exec");
    }

    PreparedCommand prepared = PreparedCommand.prepare("exec", input, SUMMARY_USAGE, log);
    if (prepared.failed()) {
      return prepared.failure();
    }
    ExecSettings exec;
    try {
      exec = ExecSettings.fromMap(prepared.effective());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid exec arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = new CompositionRoot(prepared.config())) {
      return execute(root, exec);
    } catch (ProcessStartException ex) {
      log.error("Unable to launch {}", exec.command(), ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("exec interrupted; stopping {}", exec.command());
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in exec", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExitCode execute(CompositionRoot root, ExecSettings exec)
      throws ProcessStartException, InterruptedException {
    ExitTracker exits = new ExitTracker();
    root.supervisor().addListener(exits);
    StringBuffer transcript = new StringBuffer();
    boolean keepTranscript = exec.expect().isPresent();
    ProcessOptions options = ProcessOptions.defaults()
        .withWorkingDirectory(exec.workingDirectory().orElse(null))
        .withOutputConsumer(chunk -> {
          if (keepTranscript) {
            transcript.append(chunk);
          }
          CliPrinter.print(chunk);
        });

    ManagedProcess process = root.supervisor().start(exec.command(), exec.args(), options);
    log.info("Started {} as pid {}", exec.command(), process.pid());

    Duration remaining = exec.timeout();
    if (exec.expect().isPresent()) {
      WaitResult<String> seen = root.waiter().waitForOutput(
          transcript::toString, exec.expect().get(), root.config().waits().withTimeout(remaining));
      if (!seen.success()) {
        log.error("Expected output '{}' did not appear within {} ms ({} attempts)",
            exec.expect().get(), remaining.toMillis(), seen.attempts());
        return ExitCode.TIMEOUT;
      }
      remaining = remaining.minus(seen.totalWaitTime());
      if (remaining.isNegative()) {
        remaining = Duration.ZERO;
      }
    }

    try {
      int code = exits.forPid(process.pid()).get(remaining.toMillis(), TimeUnit.MILLISECONDS);
      if (code != 0) {
        log.error("{} exited with {}", exec.command(), code);
        return ExitCode.RUNTIME_FAILURE;
      }
      log.info("{} completed", exec.command());
      return ExitCode.SUCCESS;
    } catch (TimeoutException ex) {
      log.error("{} did not exit within {} ms", exec.command(), exec.timeout().toMillis());
      return ExitCode.TIMEOUT;
    } catch (ExecutionException ex) {
      throw new IllegalStateException("exit tracking failed for pid " + process.pid(), ex.getCause());
    }
  }

  /** Records exit codes by pid; registered before start so a fast exit is never missed. */
  private static final class ExitTracker implements ProcessSupervisorListener {
    private final Map<Long, CompletableFuture<Integer>> exits = new ConcurrentHashMap<>();

    CompletableFuture<Integer> forPid(long pid) {
      return exits.computeIfAbsent(pid, ignored -> new CompletableFuture<>());
    }

    @Override
    public void onProcessExited(ManagedProcess process, int exitCode) {
      forPid(process.pid()).complete(exitCode);
    }
  }
}
