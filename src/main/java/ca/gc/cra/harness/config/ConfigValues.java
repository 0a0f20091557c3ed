package ca.gc.cra.harness.config;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing helpers shared by the settings records' {@code fromMap} factories.
 *
 * <p>Durations accept plain milliseconds or a unit suffix ({@code ms}, {@code s}, {@code m}, {@code h});
 * sizes accept plain bytes or {@code KB}, {@code MB}, {@code GB} (binary multiples).</p>
 */
final class ConfigValues {
  private static final Pattern DURATION = Pattern.compile("^(\\d+)\\s*(ms|s|m|h)?$");
  private static final Pattern SIZE = Pattern.compile("^(\\d+)\\s*(b|kb|mb|gb)?$");

  private ConfigValues() {}

  static int intValue(Map<String, String> options, String key, int fallback) {
    String raw = trimmed(options, key);
    if (raw == null) {
      return fallback;
    }
    try {
      return Integer.parseInt(raw);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + raw + "')", ex);
    }
  }

  static double doubleValue(Map<String, String> options, String key, double fallback) {
    String raw = trimmed(options, key);
    if (raw == null) {
      return fallback;
    }
    try {
      return Double.parseDouble(raw);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number (was '" + raw + "')", ex);
    }
  }

  static boolean booleanValue(Map<String, String> options, String key, boolean fallback) {
    String raw = trimmed(options, key);
    if (raw == null) {
      return fallback;
    }
    return switch (raw.toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on", "1" -> true;
      case "false", "no", "off", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was '" + raw + "')");
    };
  }

  static Duration durationValue(Map<String, String> options, String key, Duration fallback) {
    String raw = trimmed(options, key);
    if (raw == null) {
      return fallback;
    }
    Matcher matcher = DURATION.matcher(raw.toLowerCase(Locale.ROOT));
    if (!matcher.matches()) {
      throw new IllegalArgumentException(key + " must be a duration such as 500ms, 30s or 5m (was '" + raw + "')");
    }
    long amount = Long.parseLong(matcher.group(1));
    String unit = matcher.group(2) == null ? "ms" : matcher.group(2);
    return switch (unit) {
      case "s" -> Duration.ofSeconds(amount);
      case "m" -> Duration.ofMinutes(amount);
      case "h" -> Duration.ofHours(amount);
      default -> Duration.ofMillis(amount);
    };
  }

  static long sizeValue(Map<String, String> options, String key, long fallback) {
    String raw = trimmed(options, key);
    if (raw == null) {
      return fallback;
    }
    Matcher matcher = SIZE.matcher(raw.toLowerCase(Locale.ROOT));
    if (!matcher.matches()) {
      throw new IllegalArgumentException(key + " must be a size such as 65536, 64KB or 512MB (was '" + raw + "')");
    }
    long amount = Long.parseLong(matcher.group(1));
    String unit = matcher.group(2) == null ? "b" : matcher.group(2);
    long multiplier = switch (unit) {
      case "kb" -> 1024L;
      case "mb" -> 1024L * 1024L;
      case "gb" -> 1024L * 1024L * 1024L;
      default -> 1L;
    };
    return Math.multiplyExact(amount, multiplier);
  }

  private static String trimmed(Map<String, String> options, String key) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }
}
