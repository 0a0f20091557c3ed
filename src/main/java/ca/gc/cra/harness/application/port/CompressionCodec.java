package ca.gc.cra.harness.application.port;

import java.io.IOException;

/**
 * Port compressing cached buffers.
 *
 * @since 0.1.0
 */
public interface CompressionCodec {
  byte[] compress(byte[] data) throws IOException;

  byte[] decompress(byte[] data) throws IOException;

  /**
   * Codec name for logs, e.g. {@code gzip}.
   *
   * @return codec name
   */
  String name();
}
