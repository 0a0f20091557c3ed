package ca.gc.cra.harness.domain.pool;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Canonical identity of a resource configuration.
 *
 * <p>Two configurations share pooled resources exactly when their keys are equal. Keys are built from an
 * ordered list of named fields; {@code null}, absent and empty values canonicalize identically and map
 * fields are sorted by key, so field insertion order never matters.</p>
 *
 * @param canonical canonical text form
 * @since 0.1.0
 */
public record ConfigKey(String canonical) {
  public ConfigKey {
    Objects.requireNonNull(canonical, "canonical");
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String toString() {
    return canonical;
  }

  /** Builder appending fields in call order. */
  public static final class Builder {
    private final List<String> parts = new ArrayList<>();

    private Builder() {}

    /**
     * Adds a scalar field; {@code null} or empty values are skipped.
     *
     * @param name field name
     * @param value field value
     * @return this builder
     */
    public Builder field(String name, Object value) {
      Objects.requireNonNull(name, "name");
      if (value == null) {
        return this;
      }
      String text = value.toString();
      if (!text.isEmpty()) {
        parts.add(name + '=' + escape(text));
      }
      return this;
    }

    /**
     * Adds a map field sorted by key; {@code null} or empty maps are skipped.
     *
     * @param name field name
     * @param values field entries
     * @return this builder
     */
    public Builder field(String name, Map<String, String> values) {
      Objects.requireNonNull(name, "name");
      if (values == null || values.isEmpty()) {
        return this;
      }
      StringBuilder sb = new StringBuilder(name).append("={");
      boolean first = true;
      for (Map.Entry<String, String> entry : new TreeMap<>(values).entrySet()) {
        if (!first) {
          sb.append(',');
        }
        first = false;
        sb.append(escape(entry.getKey())).append(':').append(escape(String.valueOf(entry.getValue())));
      }
      parts.add(sb.append('}').toString());
      return this;
    }

    public ConfigKey build() {
      return new ConfigKey(String.join(";", parts));
    }

    private static String escape(String text) {
      StringBuilder sb = new StringBuilder(text.length());
      for (int i = 0; i < text.length(); i++) {
        char c = text.charAt(i);
        if (c == '\\' || c == ';' || c == '=' || c == ',' || c == ':' || c == '{' || c == '}') {
          sb.append('\\');
        }
        sb.append(c);
      }
      return sb.toString();
    }
  }
}
