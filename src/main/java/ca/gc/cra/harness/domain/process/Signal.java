package ca.gc.cra.harness.domain.process;

import java.util.Locale;

/**
 * POSIX signals the supervisor delivers.
 *
 * @since 0.1.0
 */
public enum Signal {
  INT(2),
  KILL(9),
  TERM(15);

  private final int number;

  Signal(int number) {
    this.number = number;
  }

  public int number() {
    return number;
  }

  /**
   * Name understood by {@code kill -s}, e.g. {@code TERM}.
   *
   * @return short signal name
   */
  public String shortName() {
    return name();
  }

  /**
   * Parses {@code TERM}, {@code SIGTERM} or {@code 15} style input.
   *
   * @param raw signal text
   * @return matching signal
   * @throws IllegalArgumentException when unknown
   */
  public static Signal parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("signal must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    if (normalized.startsWith("SIG")) {
      normalized = normalized.substring(3);
    }
    for (Signal signal : values()) {
      if (signal.name().equals(normalized) || String.valueOf(signal.number).equals(normalized)) {
        return signal;
      }
    }
    throw new IllegalArgumentException("unsupported signal: " + raw);
  }
}
