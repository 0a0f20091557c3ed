package ca.gc.cra.harness.api;

import ca.gc.cra.harness.domain.pool.AcquisitionStats;
import ca.gc.cra.harness.domain.pool.BufferMetrics;
import ca.gc.cra.harness.domain.pool.MemoryMetrics;
import ca.gc.cra.harness.domain.pool.PoolMetrics;
import ca.gc.cra.harness.domain.pool.ResourceMetrics;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Renders a {@link ResourceMetrics} snapshot as JSON with Jackson's streaming generator.
 *
 * <p>Field names follow the snapshot records: {@code pool}, {@code memory} and {@code buffers}, with the
 * resource type at the top level.</p>
 */
final class MetricsJsonWriter {
  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Serializes one snapshot.
   *
   * @param resourceType pool resource type
   * @param metrics snapshot
   * @param pretty whether to indent
   * @return JSON document
   */
  String write(String resourceType, ResourceMetrics metrics, boolean pretty) {
    Objects.requireNonNull(metrics, "metrics");
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      if (pretty) {
        gen.useDefaultPrettyPrinter();
      }
      gen.writeStartObject();
      gen.writeStringField("resourceType", resourceType);
      writePool(gen, metrics.pool());
      writeMemory(gen, metrics.memory());
      writeBuffers(gen, metrics.buffers());
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to render metrics JSON", ex);
    }
    return out.toString();
  }

  private void writePool(JsonGenerator gen, PoolMetrics pool) throws IOException {
    gen.writeObjectFieldStart("pool");
    gen.writeNumberField("total", pool.total());
    gen.writeNumberField("active", pool.active());
    gen.writeNumberField("idle", pool.idle());
    gen.writeNumberField("pending", pool.pending());
    gen.writeNumberField("totalCreated", pool.totalCreated());
    gen.writeNumberField("totalDestroyed", pool.totalDestroyed());
    gen.writeNumberField("resetFailures", pool.resetFailures());
    AcquisitionStats acquisition = pool.acquisition();
    gen.writeObjectFieldStart("acquisition");
    gen.writeNumberField("samples", acquisition.samples());
    gen.writeNumberField("averageMillis", acquisition.averageMillis());
    gen.writeNumberField("p95Millis", acquisition.p95Millis());
    gen.writeNumberField("p99Millis", acquisition.p99Millis());
    gen.writeEndObject();
    gen.writeEndObject();
  }

  private void writeMemory(JsonGenerator gen, MemoryMetrics memory) throws IOException {
    gen.writeObjectFieldStart("memory");
    gen.writeNumberField("heapUsed", memory.heapUsed());
    gen.writeNumberField("heapCommitted", memory.heapCommitted());
    if (memory.rss() >= 0) {
      gen.writeNumberField("rss", memory.rss());
    } else {
      gen.writeNullField("rss");
    }
    gen.writeNumberField("gcRuns", memory.gcRuns());
    gen.writeNumberField("lastGcTime", memory.lastGcTime());
    gen.writeEndObject();
  }

  private void writeBuffers(JsonGenerator gen, BufferMetrics buffers) throws IOException {
    gen.writeObjectFieldStart("buffers");
    gen.writeNumberField("totalBuffers", buffers.totalBuffers());
    gen.writeNumberField("totalSize", buffers.totalSize());
    gen.writeNumberField("compressedBuffers", buffers.compressedBuffers());
    gen.writeNumberField("compressionRatio", buffers.compressionRatio());
    gen.writeEndObject();
  }
}
