package ca.gc.cra.harness.domain.wait;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a polling wait.
 *
 * <p>{@code result} is present exactly when {@code success} is {@code true}. {@code lastError} holds the
 * most recent exception thrown by the condition, if any, and is kept on success as well.</p>
 *
 * @param success whether the condition was satisfied before the deadline
 * @param attempts number of times the condition was evaluated
 * @param totalWaitTime elapsed time from the first attempt to the outcome
 * @param lastError most recent exception raised by the condition
 * @param result value produced by the satisfied condition
 * @param <T> value type produced by the condition
 * @since 0.1.0
 */
public record WaitResult<T>(
    boolean success,
    int attempts,
    Duration totalWaitTime,
    Optional<Throwable> lastError,
    Optional<T> result) {

  public WaitResult {
    if (attempts < 0) {
      throw new IllegalArgumentException("attempts must be non-negative");
    }
    totalWaitTime = Objects.requireNonNull(totalWaitTime, "totalWaitTime");
    lastError = Objects.requireNonNull(lastError, "lastError");
    result = Objects.requireNonNull(result, "result");
    if (success != result.isPresent()) {
      throw new IllegalArgumentException("result must be present exactly when success is true");
    }
  }

  /**
   * Builds a successful result.
   *
   * @param attempts attempts taken including the successful one
   * @param totalWaitTime elapsed wait time
   * @param lastError error raised by an earlier attempt, may be {@code null}
   * @param value produced value; must not be {@code null}
   * @param <T> value type
   * @return successful wait result
   */
  public static <T> WaitResult<T> success(int attempts, Duration totalWaitTime, Throwable lastError, T value) {
    return new WaitResult<>(true, attempts, totalWaitTime, Optional.ofNullable(lastError),
        Optional.of(value));
  }

  /**
   * Builds a failed result.
   *
   * @param attempts attempts taken
   * @param totalWaitTime elapsed wait time
   * @param lastError most recent condition error, may be {@code null}
   * @param <T> value type
   * @return failed wait result
   */
  public static <T> WaitResult<T> failure(int attempts, Duration totalWaitTime, Throwable lastError) {
    return new WaitResult<>(false, attempts, totalWaitTime, Optional.ofNullable(lastError), Optional.empty());
  }

  /**
   * Returns the produced value or throws when the wait failed.
   *
   * @return produced value
   * @throws java.util.NoSuchElementException when the wait was unsuccessful
   */
  public T value() {
    return result.orElseThrow();
  }
}
