package ca.gc.cra.harness.validation;

import java.time.Duration;

/**
 * <strong>What:</strong> Numeric validation helpers used by configuration records and CLI parsing.
 * <p><strong>Why:</strong> Rejects nonsensical pool sizes, thresholds and timeouts before any thread or
 * process is started.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value falls within an inclusive range.
   *
   * @param name parameter name used in the message; blank becomes {@code "value"}
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a duration is non-null and not negative.
   *
   * @param name parameter name used in the message
   * @param value candidate duration
   * @return the validated duration
   * @throws IllegalArgumentException when {@code value} is {@code null} or negative
   */
  public static Duration requireNonNegative(String name, Duration value) {
    if (value == null || value.isNegative()) {
      throw new IllegalArgumentException(label(name) + " must be a non-negative duration (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a duration is strictly positive.
   *
   * @param name parameter name used in the message
   * @param value candidate duration
   * @return the validated duration
   * @throws IllegalArgumentException when {@code value} is {@code null}, zero or negative
   */
  public static Duration requirePositive(String name, Duration value) {
    if (value == null || value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(label(name) + " must be a positive duration (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
