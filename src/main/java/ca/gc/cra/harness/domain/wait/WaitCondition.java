package ca.gc.cra.harness.domain.wait;

import java.util.Optional;

/**
 * Readiness check polled by the waiter.
 *
 * <p>An empty result means "not ready yet"; a thrown exception is recorded as the last error and also
 * treated as not ready.</p>
 *
 * @param <T> value produced once ready
 * @since 0.1.0
 */
@FunctionalInterface
public interface WaitCondition<T> {
  /**
   * Evaluates the condition once.
   *
   * @return produced value when ready, empty otherwise
   * @throws Exception when the check itself fails
   */
  Optional<T> poll() throws Exception;
}
