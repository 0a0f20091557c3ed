package ca.gc.cra.harness.infrastructure.compress;

import ca.gc.cra.harness.application.port.CompressionCodec;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Objects;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Gzip {@link CompressionCodec} for the buffer cache.
 *
 * @since 0.1.0
 */
public final class GzipCompressionCodec implements CompressionCodec {
  @Override
  public byte[] compress(byte[] data) throws IOException {
    Objects.requireNonNull(data, "data");
    ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(32, data.length / 2));
    try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
      gzip.write(data);
    }
    return out.toByteArray();
  }

  @Override
  public byte[] decompress(byte[] data) throws IOException {
    Objects.requireNonNull(data, "data");
    try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(data))) {
      return gzip.readAllBytes();
    }
  }

  @Override
  public String name() {
    return "gzip";
  }
}
