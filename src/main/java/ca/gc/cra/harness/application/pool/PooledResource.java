package ca.gc.cra.harness.application.pool;

import ca.gc.cra.harness.domain.pool.ConfigKey;

/**
 * Pool bookkeeping around one resource. Mutable state is guarded by the owning coordinator's lock.
 *
 * <p>A resource moves {@code IN_USE -> RESETTING -> IDLE -> IN_USE}; destruction removes it from the pool
 * from any state and it is never re-entered.</p>
 *
 * @param <R> resource type
 */
final class PooledResource<R> {
  enum State {
    IN_USE,
    RESETTING,
    IDLE
  }

  private final String id;
  private final ConfigKey key;
  private final R resource;
  private final long createdAt;
  private long lastUsed;
  private long useCount;
  private State state;

  PooledResource(String id, ConfigKey key, R resource, long createdAt) {
    this.id = id;
    this.key = key;
    this.resource = resource;
    this.createdAt = createdAt;
    this.lastUsed = createdAt;
    this.useCount = 1;
    this.state = State.IN_USE;
  }

  String id() {
    return id;
  }

  ConfigKey key() {
    return key;
  }

  R resource() {
    return resource;
  }

  State state() {
    return state;
  }

  boolean idle() {
    return state == State.IDLE;
  }

  long useCount() {
    return useCount;
  }

  void markInUse(long now) {
    state = State.IN_USE;
    lastUsed = now;
    useCount++;
  }

  void beginReset() {
    state = State.RESETTING;
  }

  void markIdle(long now) {
    state = State.IDLE;
    lastUsed = now;
  }

  long idleMillis(long now) {
    return now - lastUsed;
  }

  long ageMillis(long now) {
    return now - createdAt;
  }
}
