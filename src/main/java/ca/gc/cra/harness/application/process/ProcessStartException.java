package ca.gc.cra.harness.application.process;

/**
 * Raised when a supervised process cannot be spawned.
 *
 * @since 0.1.0
 */
public final class ProcessStartException extends Exception {
  private static final long serialVersionUID = 1L;

  public ProcessStartException(String message, Throwable cause) {
    super(message, cause);
  }
}
