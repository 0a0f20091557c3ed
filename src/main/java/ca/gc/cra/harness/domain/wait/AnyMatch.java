package ca.gc.cra.harness.domain.wait;

import java.util.Objects;

/**
 * First satisfied condition of a {@code waitForAny} round.
 *
 * @param index position of the condition in the supplied list
 * @param value value produced by that condition
 * @since 0.1.0
 */
public record AnyMatch(int index, Object value) {
  public AnyMatch {
    if (index < 0) {
      throw new IllegalArgumentException("index must be non-negative");
    }
    Objects.requireNonNull(value, "value");
  }
}
