package ca.gc.cra.harness.application.pool;

import java.time.Duration;

/**
 * Raised when a queued acquisition is not served within the acquisition timeout.
 *
 * @since 0.1.0
 */
public final class AcquisitionTimeoutException extends PoolException {
  private static final long serialVersionUID = 1L;

  private final String configKey;
  private final Duration timeout;

  public AcquisitionTimeoutException(String configKey, Duration timeout) {
    super("acquisition timed out after " + timeout.toMillis() + " ms for key [" + configKey + "]");
    this.configKey = configKey;
    this.timeout = timeout;
  }

  public String configKey() {
    return configKey;
  }

  public Duration timeout() {
    return timeout;
  }
}
