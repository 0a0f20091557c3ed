package ca.gc.cra.harness.application.wait;

import ca.gc.cra.harness.application.port.ClockPort;
import ca.gc.cra.harness.application.port.Sleeper;
import ca.gc.cra.harness.domain.wait.AnyMatch;
import ca.gc.cra.harness.domain.wait.WaitCondition;
import ca.gc.cra.harness.domain.wait.WaitOptions;
import ca.gc.cra.harness.domain.wait.WaitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BooleanSupplier;
import java.util.function.DoubleSupplier;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Polls a readiness condition with adaptive backoff until it succeeds or a deadline passes.
 * <p><strong>Why:</strong> Replaces fixed sleeps in test automation with bounded, jittered polling.</p>
 * <p><strong>Role:</strong> Application service shared by the process supervisor, shell sessions and callers.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Evaluate the condition, count attempts and keep the most recent error.</li>
 *   <li>Sleep for the strategy delay, never past the deadline.</li>
 *   <li>Offer derived waits (output, prompt, process start/exit, files, all/any, retry).</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from injected ports; one instance may serve many
 * concurrent waits, each blocking its own caller thread.</p>
 * <p><strong>Cancellation:</strong> interrupting the waiting thread aborts the wait with
 * {@link InterruptedException}.</p>
 *
 * @since 0.1.0
 */
public final class Waiter {
  private static final Logger log = LoggerFactory.getLogger(Waiter.class);

  /** Prompt pattern matched against the trimmed last line of output. */
  public static final Pattern DEFAULT_PROMPT = Pattern.compile("\\$\\s*$");

  private final ClockPort clock;
  private final Sleeper sleeper;
  private final DoubleSupplier random;

  /**
   * Creates a waiter on the system clock.
   */
  public Waiter() {
    this(ClockPort.SYSTEM, Sleeper.SYSTEM);
  }

  /**
   * Creates a waiter on the supplied clock and sleeper with random jitter.
   *
   * @param clock time source; monotonic readings measure elapsed time
   * @param sleeper sleeping strategy between attempts
   */
  public Waiter(ClockPort clock, Sleeper sleeper) {
    this(clock, sleeper, () -> ThreadLocalRandom.current().nextDouble());
  }

  /**
   * Creates a waiter with an explicit jitter source.
   *
   * @param clock time source
   * @param sleeper sleeping strategy
   * @param random uniform samples in {@code [0, 1)}; a constant {@code 0.5} disables jitter
   */
  public Waiter(ClockPort clock, Sleeper sleeper, DoubleSupplier random) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.random = Objects.requireNonNull(random, "random");
  }

  /**
   * Polls {@code condition} until it yields a value or {@code options.timeout()} elapses.
   *
   * @param condition readiness check
   * @param options backoff and deadline tuning
   * @param <T> produced value type
   * @return outcome including attempts, elapsed time and last error
   * @throws InterruptedException when the calling thread is interrupted
   */
  public <T> WaitResult<T> waitFor(WaitCondition<T> condition, WaitOptions options)
      throws InterruptedException {
    Objects.requireNonNull(condition, "condition");
    Objects.requireNonNull(options, "options");
    long timeoutMillis = options.timeout().toMillis();
    long start = clock.monotonicMillis();
    int attempts = 0;
    Throwable lastError = null;
    int identicalErrors = 0;

    while (clock.monotonicMillis() - start < timeoutMillis) {
      if (Thread.interrupted()) {
        throw new InterruptedException("wait interrupted after " + attempts + " attempts");
      }
      attempts++;
      try {
        Optional<T> value = condition.poll();
        if (value != null && value.isPresent()) {
          return WaitResult.success(attempts, elapsedSince(start), lastError, value.get());
        }
      } catch (InterruptedException ex) {
        throw ex;
      } catch (Exception ex) {
        identicalErrors = sameError(lastError, ex) ? identicalErrors + 1 : 1;
        lastError = ex;
        int threshold = options.failFastAfterIdenticalErrors();
        if (threshold > 0 && identicalErrors >= threshold) {
          log.debug("Giving up after {} identical condition errors: {}", identicalErrors, ex.toString());
          return WaitResult.failure(attempts, elapsedSince(start), lastError);
        }
      }

      long remaining = timeoutMillis - (clock.monotonicMillis() - start);
      if (remaining <= 0) {
        break;
      }
      long delay = options.nextDelayMillis(attempts, random.getAsDouble());
      sleeper.sleep(Math.min(delay, remaining));
    }
    if (log.isTraceEnabled()) {
      log.trace("Wait timed out after {} attempts ({})", attempts, options);
    }
    return WaitResult.failure(attempts, elapsedSince(start), lastError);
  }

  /**
   * Boolean form of {@link #waitFor(WaitCondition, WaitOptions)}.
   *
   * @param condition readiness predicate
   * @param options tuning
   * @return outcome carrying {@code true} on success
   * @throws InterruptedException when interrupted
   */
  public WaitResult<Boolean> waitUntil(BooleanSupplier condition, WaitOptions options)
      throws InterruptedException {
    Objects.requireNonNull(condition, "condition");
    return waitFor(() -> condition.getAsBoolean() ? Optional.of(Boolean.TRUE) : Optional.empty(), options);
  }

  /**
   * Waits until the supplied output contains {@code expected}.
   *
   * @param output output snapshot supplier
   * @param expected substring to look for
   * @param options tuning
   * @return outcome carrying the matching output snapshot
   * @throws InterruptedException when interrupted
   */
  public WaitResult<String> waitForOutput(Supplier<String> output, String expected, WaitOptions options)
      throws InterruptedException {
    Objects.requireNonNull(output, "output");
    Objects.requireNonNull(expected, "expected");
    return waitFor(() -> {
      String snapshot = output.get();
      return snapshot != null && snapshot.contains(expected) ? Optional.of(snapshot) : Optional.empty();
    }, options);
  }

  /**
   * Waits until the supplied output matches {@code pattern} anywhere.
   *
   * @param output output snapshot supplier
   * @param pattern regular expression searched with {@link java.util.regex.Matcher#find()}
   * @param options tuning
   * @return outcome carrying the matching output snapshot
   * @throws InterruptedException when interrupted
   */
  public WaitResult<String> waitForOutput(Supplier<String> output, Pattern pattern, WaitOptions options)
      throws InterruptedException {
    Objects.requireNonNull(output, "output");
    Objects.requireNonNull(pattern, "pattern");
    return waitFor(() -> {
      String snapshot = output.get();
      return snapshot != null && pattern.matcher(snapshot).find() ? Optional.of(snapshot) : Optional.empty();
    }, options);
  }

  /**
   * Waits for a shell prompt using {@link #DEFAULT_PROMPT} and {@link WaitOptions#promptDefaults()}.
   *
   * @param output output snapshot supplier
   * @return outcome carrying the output snapshot ending in a prompt
   * @throws InterruptedException when interrupted
   */
  public WaitResult<String> waitForPrompt(Supplier<String> output) throws InterruptedException {
    return waitForPrompt(output, DEFAULT_PROMPT, WaitOptions.promptDefaults());
  }

  /**
   * Waits until the trimmed last line of the output matches {@code prompt}.
   *
   * @param output output snapshot supplier
   * @param prompt prompt pattern
   * @param options tuning
   * @return outcome carrying the output snapshot
   * @throws InterruptedException when interrupted
   */
  public WaitResult<String> waitForPrompt(Supplier<String> output, Pattern prompt, WaitOptions options)
      throws InterruptedException {
    Objects.requireNonNull(output, "output");
    Objects.requireNonNull(prompt, "prompt");
    return waitFor(() -> {
      String snapshot = output.get();
      if (snapshot == null) {
        return Optional.empty();
      }
      String trimmed = snapshot.strip();
      int newline = trimmed.lastIndexOf('\n');
      String lastLine = newline >= 0 ? trimmed.substring(newline + 1) : trimmed;
      return prompt.matcher(lastLine).find() ? Optional.of(snapshot) : Optional.empty();
    }, options);
  }

  /**
   * Waits until {@code pid} reports a positive process id.
   *
   * @param pid process id supplier; non-positive values mean "not started"
   * @param options tuning, typically {@link WaitOptions#processStartDefaults()}
   * @return outcome carrying the process id
   * @throws InterruptedException when interrupted
   */
  public WaitResult<Long> waitForProcessStart(LongSupplier pid, WaitOptions options)
      throws InterruptedException {
    Objects.requireNonNull(pid, "pid");
    return waitFor(() -> {
      long value = pid.getAsLong();
      return value > 0 ? Optional.of(value) : Optional.empty();
    }, options);
  }

  /**
   * Waits until {@code isRunning} reports {@code false}.
   *
   * @param isRunning liveness probe
   * @param options tuning, typically {@link WaitOptions#processExitDefaults()}
   * @return outcome carrying {@code true} once the process is gone
   * @throws InterruptedException when interrupted
   */
  public WaitResult<Boolean> waitForProcessExit(BooleanSupplier isRunning, WaitOptions options)
      throws InterruptedException {
    Objects.requireNonNull(isRunning, "isRunning");
    return waitUntil(() -> !isRunning.getAsBoolean(), options);
  }

  /**
   * Waits until {@code path} exists.
   *
   * @param path file to look for
   * @param options tuning, typically {@link WaitOptions#fileDefaults()}
   * @return outcome carrying the path
   * @throws InterruptedException when interrupted
   */
  public WaitResult<Path> waitForFile(Path path, WaitOptions options) throws InterruptedException {
    Objects.requireNonNull(path, "path");
    return waitFor(() -> Files.exists(path) ? Optional.of(path) : Optional.empty(), options);
  }

  /**
   * Retries {@code operation} until it returns without throwing.
   *
   * @param operation operation to retry; a {@code null} return also counts as success
   * @param options tuning
   * @param <T> result type
   * @return outcome carrying the operation result wrapped in an {@link Optional}
   * @throws InterruptedException when interrupted
   */
  public <T> WaitResult<Optional<T>> retry(Callable<T> operation, WaitOptions options)
      throws InterruptedException {
    Objects.requireNonNull(operation, "operation");
    return waitFor(() -> Optional.of(Optional.ofNullable(operation.call())), options);
  }

  /**
   * Waits until every condition is satisfied in the same round.
   *
   * <p>A condition that throws counts as not ready for that round.</p>
   *
   * @param conditions conditions to evaluate in order
   * @param options tuning
   * @return outcome carrying the produced values in condition order
   * @throws InterruptedException when interrupted
   */
  public WaitResult<List<Object>> waitForAll(List<? extends WaitCondition<?>> conditions, WaitOptions options)
      throws InterruptedException {
    List<WaitCondition<?>> copy = List.copyOf(Objects.requireNonNull(conditions, "conditions"));
    return waitFor(() -> {
      List<Object> values = new ArrayList<>(copy.size());
      for (WaitCondition<?> condition : copy) {
        Optional<?> value = pollQuietly(condition);
        if (value.isEmpty()) {
          return Optional.empty();
        }
        values.add(value.get());
      }
      return Optional.of(Collections.unmodifiableList(values));
    }, options);
  }

  /**
   * Waits until any condition is satisfied; the lowest index wins within a round.
   *
   * @param conditions conditions to evaluate in order
   * @param options tuning
   * @return outcome carrying the winning index and value
   * @throws InterruptedException when interrupted
   */
  public WaitResult<AnyMatch> waitForAny(List<? extends WaitCondition<?>> conditions, WaitOptions options)
      throws InterruptedException {
    List<WaitCondition<?>> copy = List.copyOf(Objects.requireNonNull(conditions, "conditions"));
    return waitFor(() -> {
      for (int i = 0; i < copy.size(); i++) {
        Optional<?> value = pollQuietly(copy.get(i));
        if (value.isPresent()) {
          return Optional.of(new AnyMatch(i, value.get()));
        }
      }
      return Optional.empty();
    }, options);
  }

  private static Optional<?> pollQuietly(WaitCondition<?> condition) throws InterruptedException {
    try {
      Optional<?> value = condition.poll();
      return value == null ? Optional.empty() : value;
    } catch (InterruptedException ex) {
      throw ex;
    } catch (Exception ex) {
      log.trace("Condition failed during combined wait: {}", ex.toString());
      return Optional.empty();
    }
  }

  private Duration elapsedSince(long start) {
    return Duration.ofMillis(Math.max(0L, clock.monotonicMillis() - start));
  }

  private static boolean sameError(Throwable previous, Throwable current) {
    return previous != null
        && previous.getClass().equals(current.getClass())
        && Objects.equals(previous.getMessage(), current.getMessage());
  }
}
