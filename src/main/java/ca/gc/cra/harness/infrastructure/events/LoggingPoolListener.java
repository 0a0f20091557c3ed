package ca.gc.cra.harness.infrastructure.events;

import ca.gc.cra.harness.application.pool.ResourcePoolListener;
import ca.gc.cra.harness.domain.pool.DestroyReason;
import ca.gc.cra.harness.domain.pool.MemorySample;
import ca.gc.cra.harness.domain.pool.PoolMetrics;
import ca.gc.cra.harness.domain.pool.ResourceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders pool events as {@code pool.event} log lines. Metric snapshots are logged at debug level only.
 *
 * @since 0.1.0
 */
public final class LoggingPoolListener implements ResourcePoolListener {
  private static final Logger log = LoggerFactory.getLogger(LoggingPoolListener.class);

  @Override
  public void onMemoryWarning(MemorySample sample) {
    log.info("pool.event type=memoryWarning, heapUsed={}, rss={}", sample.heapUsed(), sample.rss());
  }

  @Override
  public void onMemoryAlert(MemorySample sample) {
    log.warn("pool.event type=memoryAlert, heapUsed={}, rss={}", sample.heapUsed(), sample.rss());
  }

  @Override
  public void onResourceCreated(String resourceType, String resourceId) {
    log.info("pool.event type=resourceCreated, resourceType={}, id={}", resourceType, resourceId);
  }

  @Override
  public void onResourceDestroyed(String resourceType, String resourceId, DestroyReason reason) {
    log.info("pool.event type=resourceDestroyed, resourceType={}, id={}, reason={}", resourceType, resourceId,
        reason);
  }

  @Override
  public void onBufferRotated(int removed) {
    log.debug("pool.event type=bufferRotated, removed={}", removed);
  }

  @Override
  public void onGcTriggered(String reason) {
    log.debug("pool.event type=gcTriggered, reason={}", reason);
  }

  @Override
  public void onMetricsUpdated(ResourceMetrics metrics) {
    if (!log.isDebugEnabled()) {
      return;
    }
    PoolMetrics pool = metrics.pool();
    log.debug("pool.event type=metrics, total={}, active={}, idle={}, pending={}, buffers={}", pool.total(),
        pool.active(), pool.idle(), pool.pending(), metrics.buffers().totalBuffers());
  }

  @Override
  public void onDestroyed() {
    log.info("pool.event type=destroyed");
  }
}
