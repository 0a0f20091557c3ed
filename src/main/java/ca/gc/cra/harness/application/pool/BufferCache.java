package ca.gc.cra.harness.application.pool;

import ca.gc.cra.harness.application.port.ClockPort;
import ca.gc.cra.harness.application.port.CompressionCodec;
import ca.gc.cra.harness.config.BufferSettings;
import ca.gc.cra.harness.domain.pool.BufferMetrics;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Bounded cache of byte payloads with optional compression and rotation.
 * <p><strong>Why:</strong> Captured output and fixtures can be parked by id without growing the heap
 * without limit.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Store payloads raw or compressed, compressing automatically at the threshold.</li>
 *   <li>Rotate out the least recently accessed half of the candidates when full, on a timer and under
 *   memory pressure.</li>
 *   <li>Track stored bytes and compression counts for metrics.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All state is guarded by one lock. Compression runs outside it and the
 * rotation callback is invoked after it is released.</p>
 *
 * @since 0.1.0
 */
public final class BufferCache {
  private static final Logger log = LoggerFactory.getLogger(BufferCache.class);

  /** Most recently accessed buffers kept by {@link #keepMostRecent(int)} under RSS pressure. */
  public static final int AGGRESSIVE_KEEP = 5;

  private static final Comparator<BufferEntry> OLDEST_ACCESS_FIRST =
      Comparator.comparingLong(BufferEntry::lastAccessed).thenComparingLong(BufferEntry::sequence);

  private final BufferSettings settings;
  private final CompressionCodec codec;
  private final ClockPort clock;
  private final IntConsumer rotationListener;
  private final Map<String, BufferEntry> entries = new HashMap<>();
  private final ReentrantLock lock = new ReentrantLock();
  private long sequence;
  private long totalSize;

  /**
   * Creates a cache.
   *
   * @param settings size and rotation limits
   * @param codec codec used for compressed entries
   * @param clock source of access timestamps
   * @param rotationListener receives the removed count after every rotation that removed something
   */
  public BufferCache(
      BufferSettings settings, CompressionCodec codec, ClockPort clock, IntConsumer rotationListener) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.rotationListener = Objects.requireNonNull(rotationListener, "rotationListener");
  }

  /**
   * Stores a copy of {@code data}.
   *
   * @param data payload
   * @param compress request compression even below the threshold
   * @return buffer id
   * @throws IllegalArgumentException when the payload exceeds {@code maxBufferSize}
   */
  public String create(byte[] data, boolean compress) {
    Objects.requireNonNull(data, "data");
    if (data.length > settings.maxBufferSize()) {
      throw new IllegalArgumentException(
          "buffer of " + data.length + " bytes exceeds maxBufferSize " + settings.maxBufferSize());
    }
    boolean full;
    lock.lock();
    try {
      full = entries.size() >= settings.maxTotalBuffers();
    } finally {
      lock.unlock();
    }
    if (full) {
      rotate(true);
    }

    boolean shouldCompress = compress || data.length >= settings.compressionThreshold();
    Optional<byte[]> packed = shouldCompress ? compress(data) : Optional.empty();
    boolean compressed = packed.isPresent();
    byte[] stored = packed.orElseGet(() -> Arrays.copyOf(data, data.length));

    int removed = 0;
    String id;
    lock.lock();
    try {
      // a concurrent create may have refilled the cache since the check above
      if (entries.size() >= settings.maxTotalBuffers()) {
        removed = removeOldest(new ArrayList<>(entries.values()));
      }
      long now = clock.nowMillis();
      long seq = ++sequence;
      id = "buffer_" + seq + "_" + now;
      entries.put(id, new BufferEntry(id, stored, compressed, data.length, seq, now));
      totalSize += stored.length;
    } finally {
      lock.unlock();
    }
    if (removed > 0) {
      rotationListener.accept(removed);
    }
    return id;
  }

  /**
   * Returns a copy of the payload, decompressing it when needed, and records the access.
   *
   * @param id buffer id
   * @return payload, or empty when unknown or unreadable
   */
  public Optional<byte[]> get(String id) {
    BufferEntry entry;
    lock.lock();
    try {
      entry = entries.get(id);
      if (entry == null) {
        return Optional.empty();
      }
      entry.touch(clock.nowMillis());
    } finally {
      lock.unlock();
    }
    if (!entry.compressed()) {
      return Optional.of(Arrays.copyOf(entry.data(), entry.storedSize()));
    }
    try {
      return Optional.of(codec.decompress(entry.data()));
    } catch (IOException ex) {
      log.error("Failed to decompress buffer {} with {}", id, codec.name(), ex);
      return Optional.empty();
    }
  }

  /**
   * Removes a buffer.
   *
   * @param id buffer id
   * @return {@code true} when the buffer existed
   */
  public boolean destroy(String id) {
    lock.lock();
    try {
      BufferEntry entry = entries.remove(id);
      if (entry == null) {
        return false;
      }
      totalSize -= entry.storedSize();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes the least recently accessed half of the candidates, at least one.
   *
   * <p>Candidates are every entry when {@code force} is set, otherwise entries not accessed for longer than
   * the rotation interval.</p>
   *
   * @param force treat every entry as a candidate
   * @return buffers removed
   */
  public int rotate(boolean force) {
    int removed;
    lock.lock();
    try {
      long now = clock.nowMillis();
      long maxIdle = settings.rotationInterval().toMillis();
      List<BufferEntry> candidates = new ArrayList<>();
      for (BufferEntry entry : entries.values()) {
        if (force || now - entry.lastAccessed() > maxIdle) {
          candidates.add(entry);
        }
      }
      removed = removeOldest(candidates);
    } finally {
      lock.unlock();
    }
    if (removed > 0) {
      log.debug("Rotated {} buffers (force={})", removed, force);
      rotationListener.accept(removed);
    }
    return removed;
  }

  /**
   * Drops everything except the {@code keep} most recently accessed buffers.
   *
   * @param keep buffers to retain
   * @return buffers removed
   */
  public int keepMostRecent(int keep) {
    int removed = 0;
    lock.lock();
    try {
      List<BufferEntry> ordered = new ArrayList<>(entries.values());
      ordered.sort(OLDEST_ACCESS_FIRST);
      int excess = ordered.size() - Math.max(0, keep);
      for (int i = 0; i < excess; i++) {
        remove(ordered.get(i));
        removed++;
      }
    } finally {
      lock.unlock();
    }
    if (removed > 0) {
      rotationListener.accept(removed);
    }
    return removed;
  }

  /**
   * Removes every buffer without notifying the rotation listener.
   *
   * @return buffers removed
   */
  public int clear() {
    lock.lock();
    try {
      int removed = entries.size();
      entries.clear();
      totalSize = 0L;
      return removed;
    } finally {
      lock.unlock();
    }
  }

  public BufferMetrics metrics() {
    lock.lock();
    try {
      int compressed = 0;
      for (BufferEntry entry : entries.values()) {
        if (entry.compressed()) {
          compressed++;
        }
      }
      int total = entries.size();
      return new BufferMetrics(total, totalSize, compressed, (double) compressed / Math.max(1, total));
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  private int removeOldest(List<BufferEntry> candidates) {
    if (candidates.isEmpty()) {
      return 0;
    }
    candidates.sort(OLDEST_ACCESS_FIRST);
    int count = Math.max(1, candidates.size() / 2);
    for (int i = 0; i < count; i++) {
      remove(candidates.get(i));
    }
    return count;
  }

  private void remove(BufferEntry entry) {
    entries.remove(entry.id());
    totalSize -= entry.storedSize();
  }

  private Optional<byte[]> compress(byte[] data) {
    try {
      return Optional.of(codec.compress(data));
    } catch (IOException ex) {
      log.warn("{} compression failed for {} byte buffer; storing raw", codec.name(), data.length, ex);
      return Optional.empty();
    }
  }
}
