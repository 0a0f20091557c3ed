package ca.gc.cra.harness.application.pool;

/**
 * Cached payload plus access bookkeeping. Guarded by the owning cache's lock.
 */
final class BufferEntry {
  private final String id;
  private final byte[] data;
  private final boolean compressed;
  private final int originalSize;
  private final long sequence;
  private final long createdAt;
  private long lastAccessed;
  private long accessCount;

  BufferEntry(String id, byte[] data, boolean compressed, int originalSize, long sequence, long createdAt) {
    this.id = id;
    this.data = data;
    this.compressed = compressed;
    this.originalSize = originalSize;
    this.sequence = sequence;
    this.createdAt = createdAt;
    this.lastAccessed = createdAt;
  }

  String id() {
    return id;
  }

  byte[] data() {
    return data;
  }

  boolean compressed() {
    return compressed;
  }

  int originalSize() {
    return originalSize;
  }

  int storedSize() {
    return data.length;
  }

  long sequence() {
    return sequence;
  }

  long createdAt() {
    return createdAt;
  }

  long lastAccessed() {
    return lastAccessed;
  }

  long accessCount() {
    return accessCount;
  }

  void touch(long now) {
    lastAccessed = now;
    accessCount++;
  }
}
