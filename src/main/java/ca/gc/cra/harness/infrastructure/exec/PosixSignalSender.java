package ca.gc.cra.harness.infrastructure.exec;

import ca.gc.cra.harness.application.port.SignalSender;
import ca.gc.cra.harness.domain.process.Signal;
import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Signal delivery using the {@code kill} utility for process groups and {@link ProcessHandle} for single
 * processes.
 *
 * <p>{@link ProcessHandle} only offers graceful and forcible destruction, so {@link Signal#INT} on a
 * single process goes through {@code kill} as well.</p>
 *
 * @since 0.1.0
 */
public final class PosixSignalSender implements SignalSender {
  private static final Logger log = LoggerFactory.getLogger(PosixSignalSender.class);
  private static final Duration KILL_COMMAND_TIMEOUT = Duration.ofSeconds(2);

  private final boolean posix;

  public PosixSignalSender() {
    this(File.separatorChar == '/');
  }

  PosixSignalSender(boolean posix) {
    this.posix = posix;
  }

  @Override
  public boolean signalGroup(long processGroupId, Signal signal) throws IOException {
    if (!posix || processGroupId <= 0) {
      return false;
    }
    return runKill(signal, "-" + processGroupId);
  }

  @Override
  public boolean signalProcess(long pid, Signal signal) throws IOException {
    Optional<ProcessHandle> handle = ProcessHandle.of(pid);
    if (handle.isEmpty() || !handle.get().isAlive()) {
      return false;
    }
    if (signal == Signal.INT) {
      return posix && runKill(signal, Long.toString(pid));
    }
    boolean force = signal == Signal.KILL;
    handle.get().descendants().forEach(child -> destroy(child, force));
    return destroy(handle.get(), force);
  }

  private static boolean destroy(ProcessHandle handle, boolean force) {
    return force ? handle.destroyForcibly() : handle.destroy();
  }

  private static boolean runKill(Signal signal, String target) throws IOException {
    Process kill = new ProcessBuilder(List.of("kill", "-s", signal.shortName(), "--", target))
        .redirectErrorStream(true)
        .redirectOutput(ProcessBuilder.Redirect.DISCARD)
        .start();
    try {
      if (!kill.waitFor(KILL_COMMAND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        kill.destroyForcibly();
        throw new IOException("kill -s " + signal.shortName() + " " + target + " timed out");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      kill.destroyForcibly();
      throw new IOException("Interrupted while signalling " + target, ex);
    }
    int code = kill.exitValue();
    if (code != 0) {
      log.debug("kill -s {} {} exited with {}", signal.shortName(), target, code);
    }
    return code == 0;
  }
}
