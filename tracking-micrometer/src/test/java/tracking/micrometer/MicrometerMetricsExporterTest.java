package tracking.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  // ── Ingestion and status ──────────────────────────────────────

  @Test
  void ingestOutcomesShareOneTaggedCounter() {
    exporter.incrementIngestAccepted();
    exporter.incrementIngestAccepted();
    exporter.incrementIngestDuplicate();
    exporter.incrementIngestRejected();

    assertEquals(2.0, counter("tracking.ingest", "outcome", "accepted").count());
    assertEquals(1.0, counter("tracking.ingest", "outcome", "duplicate").count());
    assertEquals(1.0, counter("tracking.ingest", "outcome", "rejected").count());
  }

  @Test
  void statusCounters() {
    exporter.incrementUnclassified();
    exporter.incrementTransition();
    exporter.incrementTransition();
    exporter.incrementAnomaly();
    exporter.incrementStorageConflict();

    assertEquals(1.0, registry.get("tracking.ingest.unclassified").counter().count());
    assertEquals(2.0, registry.get("tracking.status.transitions").counter().count());
    assertEquals(1.0, registry.get("tracking.status.anomalies").counter().count());
    assertEquals(1.0, registry.get("tracking.status.conflicts").counter().count());
  }

  @Test
  void reconcileCounters() {
    exporter.incrementReconcileRequested();
    exporter.incrementReconcileRequested();
    exporter.incrementReconcileCompleted();

    assertEquals(2.0, counter("tracking.status.reconcile", "result", "requested").count());
    assertEquals(1.0, counter("tracking.status.reconcile", "result", "completed").count());
  }

  // ── Dispatch ──────────────────────────────────────────────────

  @Test
  void dispatchCounters() {
    exporter.incrementHotEnqueued();
    exporter.incrementColdEnqueued();
    exporter.incrementColdEnqueued();
    exporter.incrementHotDropped();
    exporter.incrementDispatchSuccess();
    exporter.incrementDispatchFailure();
    exporter.incrementDispatchDead();
    exporter.incrementActionFailure();

    assertEquals(1.0, counter("tracking.dispatch.enqueue", "path", "hot").count());
    assertEquals(2.0, counter("tracking.dispatch.enqueue", "path", "cold").count());
    assertEquals(1.0, registry.get("tracking.dispatch.enqueue.dropped").counter().count());
    assertEquals(1.0, counter("tracking.dispatch", "result", "success").count());
    assertEquals(1.0, counter("tracking.dispatch", "result", "failure").count());
    assertEquals(1.0, counter("tracking.dispatch", "result", "dead").count());
    assertEquals(1.0, registry.get("tracking.action.failures").counter().count());
  }

  @Test
  void queueDepthsAndLag() {
    exporter.recordQueueDepths(42, 7);
    exporter.recordOldestLagMs(12345L);

    assertEquals(42.0, gauge("tracking.dispatch.queue.depth", "queue", "hot").value());
    assertEquals(7.0, gauge("tracking.dispatch.queue.depth", "queue", "cold").value());
    assertEquals(12345.0, registry.get("tracking.dispatch.lag.oldest.ms").gauge().value());

    exporter.recordQueueDepths(0, 0);
    assertEquals(0.0, gauge("tracking.dispatch.queue.depth", "queue", "hot").value());
  }

  // ── Replay and archive ────────────────────────────────────────

  @Test
  void replayAndArchiveMeters() {
    exporter.incrementReplayResolved();
    exporter.incrementReplayExpired();
    exporter.incrementReplayExpired();
    exporter.incrementArchiveDropped();
    exporter.recordArchiveQueueDepth(3);

    assertEquals(1.0, counter("tracking.replay", "result", "resolved").count());
    assertEquals(2.0, counter("tracking.replay", "result", "expired").count());
    assertEquals(1.0, registry.get("tracking.archive.dropped").counter().count());
    assertEquals(3.0, registry.get("tracking.archive.queue.depth").gauge().value());
  }

  // ── Prefix and lifecycle ──────────────────────────────────────

  @Test
  void customPrefix() {
    SimpleMeterRegistry other = new SimpleMeterRegistry();
    MicrometerMetricsExporter br = new MicrometerMetricsExporter(other, "br.tracking");

    br.incrementTransition();

    assertEquals(1.0, other.get("br.tracking.status.transitions").counter().count());
    assertNull(other.find("tracking.status.transitions").counter());
  }

  @Test
  void invalidPrefixIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "tracking."));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.incrementTransition();

    exporter.close();
    exporter.incrementTransition();
    exporter.recordQueueDepths(5, 5);

    assertTrue(registry.getMeters().isEmpty());
  }

  private Counter counter(String name, String tagKey, String tagValue) {
    return registry.get(name).tag(tagKey, tagValue).counter();
  }

  private Gauge gauge(String name, String tagKey, String tagValue) {
    return registry.get(name).tag(tagKey, tagValue).gauge();
  }
}
