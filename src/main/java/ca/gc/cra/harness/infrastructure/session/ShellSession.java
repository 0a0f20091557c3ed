package ca.gc.cra.harness.infrastructure.session;

import ca.gc.cra.harness.application.process.ProcessStartException;
import ca.gc.cra.harness.application.process.ProcessSupervisor;
import ca.gc.cra.harness.application.wait.Waiter;
import ca.gc.cra.harness.domain.process.ManagedProcess;
import ca.gc.cra.harness.domain.process.ProcessOptions;
import ca.gc.cra.harness.domain.process.Signal;
import ca.gc.cra.harness.domain.wait.WaitOptions;
import ca.gc.cra.harness.domain.wait.WaitResult;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> A shell process driven through its stdin with its output captured in memory.
 * <p><strong>Why:</strong> CLI tests send commands and wait for output; a live shell per session avoids paying the
 * start-up cost for every step when sessions are pooled.</p>
 * <p><strong>Role:</strong> Resource managed by {@code ResourcePool} through {@link ShellSessionFactory}.</p>
 * <p><strong>Thread-safety:</strong> The transcript is guarded by a lock; output arrives on the supervisor's pump
 * thread while callers read it.</p>
 *
 * @since 0.1.0
 */
public final class ShellSession implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ShellSession.class);

  /** Characters retained in the transcript; older output is dropped first. */
  static final int MAX_TRANSCRIPT_CHARS = 256 * 1024;

  private final ProcessSupervisor supervisor;
  private final Waiter waiter;
  private final SessionConfig config;
  private final ReentrantLock lock = new ReentrantLock();
  private final StringBuilder transcript = new StringBuilder();
  private ManagedProcess process;

  private ShellSession(ProcessSupervisor supervisor, Waiter waiter, SessionConfig config) {
    this.supervisor = supervisor;
    this.waiter = waiter;
    this.config = config;
  }

  /**
   * Starts a shell under {@code supervisor}.
   *
   * @param supervisor supervisor that owns the process
   * @param waiter waiter used for output and exit polling
   * @param config session configuration
   * @return running session
   * @throws ProcessStartException when the shell cannot be launched
   */
  public static ShellSession start(ProcessSupervisor supervisor, Waiter waiter, SessionConfig config)
      throws ProcessStartException {
    Objects.requireNonNull(supervisor, "supervisor");
    Objects.requireNonNull(waiter, "waiter");
    Objects.requireNonNull(config, "config");
    ShellSession session = new ShellSession(supervisor, waiter, config);
    ProcessOptions options = ProcessOptions.defaults()
        .withEnvironment(config.environment())
        .withOutputConsumer(session::append);
    if (config.workingDirectory().isPresent()) {
      options = options.withWorkingDirectory(config.workingDirectory().get());
    }
    session.process = supervisor.start(config.shell(), List.of(), options);
    log.debug("Shell session {} started with {}", session.pid(), config.shell());
    return session;
  }

  public long pid() {
    return process.pid();
  }

  public SessionConfig config() {
    return config;
  }

  public boolean isAlive() {
    return supervisor.isRunning(process.pid());
  }

  /**
   * Writes raw input to the shell's stdin.
   *
   * @param input text to send
   * @throws IOException when the shell has exited or the pipe is closed
   */
  public void send(String input) throws IOException {
    Objects.requireNonNull(input, "input");
    OutputStream stdin = supervisor.stdin(process.pid())
        .orElseThrow(() -> new IOException("shell session " + process.pid() + " is no longer running"));
    stdin.write(input.getBytes(StandardCharsets.UTF_8));
    stdin.flush();
  }

  public void sendLine(String line) throws IOException {
    send(line + "\n");
  }

  /**
   * Output captured since start or the last {@link #clearOutput()}.
   *
   * @return transcript text
   */
  public String output() {
    lock.lock();
    try {
      return transcript.toString();
    } finally {
      lock.unlock();
    }
  }

  public void clearOutput() {
    lock.lock();
    try {
      transcript.setLength(0);
    } finally {
      lock.unlock();
    }
  }

  public WaitResult<String> waitForOutput(String expected, WaitOptions options) throws InterruptedException {
    return waiter.waitForOutput(this::output, expected, options);
  }

  public WaitResult<String> waitForOutput(Pattern pattern, WaitOptions options) throws InterruptedException {
    return waiter.waitForOutput(this::output, pattern, options);
  }

  public WaitResult<String> waitForPrompt(Pattern prompt, WaitOptions options) throws InterruptedException {
    return waiter.waitForPrompt(this::output, prompt, options);
  }

  /**
   * Stops the shell: {@code TERM}, a polled grace period of {@code closeTimeout}, then {@code KILL}.
   */
  @Override
  public void close() {
    long pid = process.pid();
    if (!isAlive()) {
      return;
    }
    supervisor.kill(pid, Signal.TERM);
    WaitOptions grace = WaitOptions.processExitDefaults().toBuilder()
        .timeout(config.closeTimeout())
        .build();
    try {
      if (waiter.waitForProcessExit(() -> supervisor.isRunning(pid), grace).success()) {
        return;
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.debug("Interrupted while closing shell session {}; forcing kill", pid);
    }
    log.debug("Shell session {} ignored TERM for {} ms; sending KILL", pid, config.closeTimeout().toMillis());
    supervisor.kill(pid, Signal.KILL);
  }

  private void append(String chunk) {
    lock.lock();
    try {
      transcript.append(chunk);
      int excess = transcript.length() - MAX_TRANSCRIPT_CHARS;
      if (excess > 0) {
        transcript.delete(0, excess);
      }
    } finally {
      lock.unlock();
    }
  }
}
