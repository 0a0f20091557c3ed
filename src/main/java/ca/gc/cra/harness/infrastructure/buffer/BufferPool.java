package ca.gc.cra.harness.infrastructure.buffer;

import java.util.ArrayDeque;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded pool of read buffers shared by output pump threads.
 *
 * <p>Each process gets its own pump thread, so a harness running many shells would otherwise allocate a
 * fresh read buffer per process.</p>
 */
public final class BufferPool {
  private final int bufferSize;
  private final int maxRetained;
  private final ArrayDeque<byte[]> free;
  private final ReentrantLock lock = new ReentrantLock();
  private final AtomicLong allocations = new AtomicLong();

  /**
   * Creates a pool.
   *
   * @param bufferSize size of each buffer in bytes
   * @param maxRetained maximum number of idle buffers kept for reuse
   */
  public BufferPool(int bufferSize, int maxRetained) {
    if (bufferSize <= 0) {
      throw new IllegalArgumentException("bufferSize must be positive");
    }
    if (maxRetained <= 0) {
      throw new IllegalArgumentException("maxRetained must be positive");
    }
    this.bufferSize = bufferSize;
    this.maxRetained = maxRetained;
    this.free = new ArrayDeque<>(maxRetained);
  }

  /**
   * Borrows a buffer, allocating when none is idle.
   *
   * @return lease that returns the buffer when closed
   */
  public Lease acquire() {
    byte[] data;
    lock.lock();
    try {
      data = free.pollFirst();
    } finally {
      lock.unlock();
    }
    if (data == null) {
      allocations.incrementAndGet();
      data = new byte[bufferSize];
    }
    return new Lease(this, data);
  }

  public int bufferSize() {
    return bufferSize;
  }

  /**
   * Number of buffers allocated over the pool's lifetime.
   *
   * @return allocation count
   */
  public long allocations() {
    return allocations.get();
  }

  int idleCount() {
    lock.lock();
    try {
      return free.size();
    } finally {
      lock.unlock();
    }
  }

  private void giveBack(byte[] data) {
    lock.lock();
    try {
      if (free.size() < maxRetained) {
        free.addFirst(data);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * A borrowed buffer; not thread-safe, owned by one pump thread at a time.
   */
  public static final class Lease implements AutoCloseable {
    private final BufferPool owner;
    private byte[] data;

    private Lease(BufferPool owner, byte[] data) {
      this.owner = owner;
      this.data = data;
    }

    /**
     * Backing array; must not be retained after {@link #close()}.
     *
     * @return writable buffer
     */
    public byte[] array() {
      if (data == null) {
        throw new IllegalStateException("buffer already released");
      }
      return data;
    }

    @Override
    public void close() {
      if (data == null) {
        return;
      }
      owner.giveBack(data);
      data = null;
    }
  }
}
