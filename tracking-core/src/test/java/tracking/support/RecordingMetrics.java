package tracking.support;

import tracking.spi.MetricsExporter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts every metrics call by name so tests can assert on them.
 */
public class RecordingMetrics implements MetricsExporter {
  private final Map<String, AtomicInteger> counts = new ConcurrentHashMap<>();
  public volatile long lastLagMs = -1;
  public volatile int lastHotDepth = -1;
  public volatile int lastColdDepth = -1;
  public volatile int lastArchiveDepth = -1;

  public int count(String name) {
    AtomicInteger counter = counts.get(name);
    return counter == null ? 0 : counter.get();
  }

  private void hit(String name) {
    counts.computeIfAbsent(name, k -> new AtomicInteger()).incrementAndGet();
  }

  @Override
  public void incrementIngestAccepted() {
    hit("ingestAccepted");
  }

  @Override
  public void incrementIngestDuplicate() {
    hit("ingestDuplicate");
  }

  @Override
  public void incrementIngestRejected() {
    hit("ingestRejected");
  }

  @Override
  public void incrementUnclassified() {
    hit("unclassified");
  }

  @Override
  public void incrementTransition() {
    hit("transition");
  }

  @Override
  public void incrementAnomaly() {
    hit("anomaly");
  }

  @Override
  public void incrementStorageConflict() {
    hit("storageConflict");
  }

  @Override
  public void incrementReconcileRequested() {
    hit("reconcileRequested");
  }

  @Override
  public void incrementReconcileCompleted() {
    hit("reconcileCompleted");
  }

  @Override
  public void incrementHotEnqueued() {
    hit("hotEnqueued");
  }

  @Override
  public void incrementHotDropped() {
    hit("hotDropped");
  }

  @Override
  public void incrementColdEnqueued() {
    hit("coldEnqueued");
  }

  @Override
  public void incrementDispatchSuccess() {
    hit("dispatchSuccess");
  }

  @Override
  public void incrementDispatchFailure() {
    hit("dispatchFailure");
  }

  @Override
  public void incrementDispatchDead() {
    hit("dispatchDead");
  }

  @Override
  public void incrementActionFailure() {
    hit("actionFailure");
  }

  @Override
  public void incrementReplayResolved() {
    hit("replayResolved");
  }

  @Override
  public void incrementReplayExpired() {
    hit("replayExpired");
  }

  @Override
  public void incrementArchiveDropped() {
    hit("archiveDropped");
  }

  @Override
  public void recordQueueDepths(int hotDepth, int coldDepth) {
    lastHotDepth = hotDepth;
    lastColdDepth = coldDepth;
  }

  @Override
  public void recordOldestLagMs(long lagMs) {
    lastLagMs = lagMs;
  }

  @Override
  public void recordArchiveQueueDepth(int depth) {
    lastArchiveDepth = depth;
  }
}
