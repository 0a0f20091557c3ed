package ca.gc.cra.harness.domain.pool;

/**
 * Why a pooled resource was destroyed.
 *
 * @since 0.1.0
 */
public enum DestroyReason {
  /** Reset on release failed or reported the resource unusable. */
  RESET_FAILED,
  /** Idle longer than the idle timeout. */
  IDLE_TIMEOUT,
  /** Older than the maximum age. */
  MAX_AGE,
  /** Evicted while idle because process memory crossed a limit. */
  MEMORY_PRESSURE,
  /** Pool destroyed. */
  SHUTDOWN
}
