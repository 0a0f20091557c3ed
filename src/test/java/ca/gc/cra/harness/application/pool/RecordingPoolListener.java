package ca.gc.cra.harness.application.pool;

import ca.gc.cra.harness.domain.pool.DestroyReason;
import ca.gc.cra.harness.domain.pool.MemorySample;
import ca.gc.cra.harness.domain.pool.ResourceMetrics;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records pool events as compact strings such as {@code destroyed:fake-1:RESET_FAILED}.
 */
final class RecordingPoolListener implements ResourcePoolListener {
  final List<String> events = new CopyOnWriteArrayList<>();
  final List<ResourceMetrics> snapshots = new CopyOnWriteArrayList<>();

  @Override
  public void onMemoryWarning(MemorySample sample) {
    events.add("warning");
  }

  @Override
  public void onMemoryAlert(MemorySample sample) {
    events.add("alert");
  }

  @Override
  public void onResourceCreated(String resourceType, String resourceId) {
    events.add("created:" + resourceId);
  }

  @Override
  public void onResourceDestroyed(String resourceType, String resourceId, DestroyReason reason) {
    events.add("destroyed:" + resourceId + ":" + reason);
  }

  @Override
  public void onBufferRotated(int removed) {
    events.add("rotated:" + removed);
  }

  @Override
  public void onGcTriggered(String reason) {
    events.add("gc:" + reason);
  }

  @Override
  public void onMetricsUpdated(ResourceMetrics metrics) {
    snapshots.add(metrics);
  }

  @Override
  public void onDestroyed() {
    events.add("destroyed-pool");
  }

  long count(String prefix) {
    return events.stream().filter(e -> e.startsWith(prefix)).count();
  }
}
