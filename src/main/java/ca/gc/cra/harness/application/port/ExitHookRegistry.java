package ca.gc.cra.harness.application.port;

/**
 * Process-wide registry of cleanup actions run when the JVM exits.
 *
 * <p>One registry is created at the composition root and shared; it installs at most one JVM hook no
 * matter how many components register.</p>
 *
 * @since 0.1.0
 */
public interface ExitHookRegistry {
  /**
   * Registers an action to run synchronously on JVM exit.
   *
   * @param name label used in logs
   * @param action cleanup action; must not block for long
   * @return handle that removes the action when closed
   */
  Registration register(String name, Runnable action);

  /** Handle for a registered action. */
  @FunctionalInterface
  interface Registration extends AutoCloseable {
    /** Removes the action; idempotent. */
    @Override
    void close();
  }

  /** Registry that never runs anything; for tests and embedded use. */
  ExitHookRegistry NONE = (name, action) -> () -> {};
}
