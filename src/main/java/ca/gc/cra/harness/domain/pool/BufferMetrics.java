package ca.gc.cra.harness.domain.pool;

/**
 * Buffer cache summary.
 *
 * @param totalBuffers cached buffers
 * @param totalSize stored bytes, compressed size for compressed entries
 * @param compressedBuffers entries stored compressed
 * @param compressionRatio {@code compressedBuffers / max(1, totalBuffers)}
 * @since 0.1.0
 */
public record BufferMetrics(int totalBuffers, long totalSize, int compressedBuffers, double compressionRatio) {}
