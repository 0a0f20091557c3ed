package ca.gc.cra.harness.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Locale;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts HARNESS runtime logging for CLI-driven runs.
 * <p><strong>Why:</strong> Lets operators raise verbosity while chasing a flaky wait without editing
 * {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings log a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG.
   */
  public static void enableVerboseLogging() {
    setRootLevel("DEBUG");
  }

  /**
   * Sets the root logger level by name.
   *
   * @param levelName {@code TRACE}, {@code DEBUG}, {@code INFO}, {@code WARN}, {@code ERROR} or {@code OFF}
   * @throws IllegalArgumentException when the name is not a known level
   */
  public static void setRootLevel(String levelName) {
    Level level = parseLevel(levelName);
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return;
    }
    log.warn("Log level {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
  }

  static Level parseLevel(String levelName) {
    if (levelName == null || levelName.isBlank()) {
      throw new IllegalArgumentException("log level must not be blank");
    }
    String normalized = levelName.trim().toUpperCase(Locale.ROOT);
    Level level = Level.toLevel(normalized, null);
    if (level == null) {
      throw new IllegalArgumentException("unknown log level: " + levelName);
    }
    return level;
  }
}
