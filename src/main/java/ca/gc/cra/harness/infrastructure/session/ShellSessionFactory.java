package ca.gc.cra.harness.infrastructure.session;

import ca.gc.cra.harness.application.port.ResourceFactory;
import ca.gc.cra.harness.application.process.ProcessStartException;
import ca.gc.cra.harness.application.process.ProcessSupervisor;
import ca.gc.cra.harness.application.wait.Waiter;
import java.util.Objects;

/**
 * {@link ResourceFactory} producing {@link ShellSession}s under a shared supervisor.
 *
 * <p>Reset clears the transcript and keeps the session only while its shell is alive.</p>
 *
 * @since 0.1.0
 */
public final class ShellSessionFactory implements ResourceFactory<SessionConfig, ShellSession> {
  private final ProcessSupervisor supervisor;
  private final Waiter waiter;

  public ShellSessionFactory(ProcessSupervisor supervisor, Waiter waiter) {
    this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
    this.waiter = Objects.requireNonNull(waiter, "waiter");
  }

  @Override
  public ShellSession create(SessionConfig config) throws ProcessStartException {
    return ShellSession.start(supervisor, waiter, config);
  }

  @Override
  public boolean reset(ShellSession session) {
    session.clearOutput();
    return session.isAlive();
  }

  @Override
  public void destroy(ShellSession session) {
    session.close();
  }

  @Override
  public String resourceType() {
    return "shell-session";
  }
}
