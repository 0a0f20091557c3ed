package ca.gc.cra.harness.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.harness.domain.pool.AcquisitionStats;
import ca.gc.cra.harness.domain.pool.BufferMetrics;
import ca.gc.cra.harness.domain.pool.MemoryMetrics;
import ca.gc.cra.harness.domain.pool.PoolMetrics;
import ca.gc.cra.harness.domain.pool.ResourceMetrics;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MetricsJsonWriterTest {

  private static final ResourceMetrics SNAPSHOT = new ResourceMetrics(
      new PoolMetrics(3, 1, 2, 0, 5, 2, 1, new AcquisitionStats(4, 2.5, 7, 9)),
      new MemoryMetrics(1_000, 2_000, -1, 1, 123),
      new BufferMetrics(2, 512, 1, 0.25));

  @Test
  void writesEverySection() throws IOException {
    String json = new MetricsJsonWriter().write("shell-session", SNAPSHOT, false);

    Map<String, String> fields = flatten(json);
    assertEquals("shell-session", fields.get("resourceType"));
    assertEquals("3", fields.get("total"));
    assertEquals("1", fields.get("resetFailures"));
    assertEquals("9", fields.get("p99Millis"));
    assertEquals("null", fields.get("rss"));
    assertEquals("0.25", fields.get("compressionRatio"));
  }

  @Test
  void prettyOutputIsIndented() {
    String json = new MetricsJsonWriter().write("fake", SNAPSHOT, true);

    assertTrue(json.contains("\n"));
  }

  private static Map<String, String> flatten(String json) throws IOException {
    Map<String, String> fields = new HashMap<>();
    try (JsonParser parser = new JsonFactory().createParser(json)) {
      String name = null;
      JsonToken token;
      while ((token = parser.nextToken()) != null) {
        if (token == JsonToken.FIELD_NAME) {
          name = parser.getCurrentName();
        } else if (token.isScalarValue() && name != null) {
          fields.put(name, token == JsonToken.VALUE_NULL ? "null" : parser.getText());
        }
      }
    }
    return fields;
  }
}
