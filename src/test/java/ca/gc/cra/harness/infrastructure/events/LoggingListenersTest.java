package ca.gc.cra.harness.infrastructure.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.harness.domain.pool.DestroyReason;
import ca.gc.cra.harness.domain.pool.MemorySample;
import ca.gc.cra.harness.domain.process.ManagedProcess;
import ca.gc.cra.harness.domain.process.Signal;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingListenersTest {
  private static final ManagedProcess SHELL = ManagedProcess.running(
      4242L, "bash", List.of("--norc"), Instant.parse("2024-01-01T00:00:00Z"), OptionalLong.of(4242L));

  private static List<ILoggingEvent> capture(Class<?> type, Runnable action) {
    Logger logger = (Logger) LoggerFactory.getLogger(type);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = logger.isAdditive();
    Level originalLevel = logger.getLevel();
    logger.setAdditive(false);
    logger.setLevel(Level.DEBUG);
    appender.start();
    logger.addAppender(appender);
    try {
      action.run();
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      logger.setLevel(originalLevel);
      appender.stop();
    }
    return appender.list;
  }

  @Test
  void supervisorEventsRenderAsKeyValueLines() {
    LoggingSupervisorListener listener = new LoggingSupervisorListener();

    List<ILoggingEvent> events = capture(LoggingSupervisorListener.class, () -> {
      listener.onProcessStarted(SHELL);
      listener.onProcessKilled(SHELL, Signal.TERM);
      listener.onProcessExited(SHELL.exited(143), 143);
      listener.onCleanupComplete(1);
      listener.onError(OptionalLong.empty(), new IllegalStateException("boom"));
    });

    assertEquals(5, events.size());
    assertEquals("process.event type=started, pid=4242, command=bash, pgid=4242, args=[--norc]",
        events.get(0).getFormattedMessage());
    assertTrue(events.get(1).getFormattedMessage().endsWith("signal=TERM"));
    assertTrue(events.get(2).getFormattedMessage().endsWith("code=143"));
    assertEquals("process.event type=cleanup, exited=1", events.get(3).getFormattedMessage());
    assertEquals(Level.WARN, events.get(4).getLevel());
    assertTrue(events.get(4).getFormattedMessage().contains("pid=-"));
  }

  @Test
  void poolEventsRenderAsKeyValueLines() {
    LoggingPoolListener listener = new LoggingPoolListener();

    List<ILoggingEvent> events = capture(LoggingPoolListener.class, () -> {
      listener.onResourceCreated("shell-session", "shell-session-1");
      listener.onResourceDestroyed("shell-session", "shell-session-1", DestroyReason.IDLE_TIMEOUT);
      listener.onMemoryAlert(new MemorySample(10L, 20L, 30L));
      listener.onDestroyed();
    });

    assertEquals(4, events.size());
    assertEquals("pool.event type=resourceCreated, resourceType=shell-session, id=shell-session-1",
        events.get(0).getFormattedMessage());
    assertTrue(events.get(1).getFormattedMessage().endsWith("reason=IDLE_TIMEOUT"));
    assertEquals(Level.WARN, events.get(2).getLevel());
    assertEquals("pool.event type=destroyed", events.get(3).getFormattedMessage());
  }
}
