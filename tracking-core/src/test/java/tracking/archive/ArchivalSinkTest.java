package tracking.archive;

import org.junit.jupiter.api.Test;
import tracking.dispatch.ExponentialBackoffRetryPolicy;
import tracking.model.ArchiveKind;
import tracking.model.ArchiveRecord;
import tracking.model.CanonicalStatus;
import tracking.model.TrackingEvent;
import tracking.support.InMemoryStores;
import tracking.support.RecordingMetrics;
import tracking.timeline.Timeline;
import tracking.timeline.TimelineBuilder;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static tracking.support.TestEvents.at;
import static tracking.support.TestEvents.event;

class ArchivalSinkTest {

  private final InMemoryStores.Archive store = new InMemoryStores.Archive();
  private final RecordingMetrics metrics = new RecordingMetrics();

  private ArchivalSink.Builder sink() {
    return ArchivalSink.builder()
        .archiveStore(store)
        .retryPolicy(new ExponentialBackoffRetryPolicy(1, 10))
        .metrics(metrics);
  }

  private static ArchiveRecord record(String eventId) {
    TrackingEvent e = event(eventId, "S1", CanonicalStatus.COLLECTED, at(0), at(0));
    return ArchiveDocuments.rawEvent(e, Instant.now());
  }

  @Test
  void offeredRecordsAreWrittenAndDrainedOnClose() {
    try (ArchivalSink sink = sink().build()) {
      for (int i = 0; i < 10; i++) {
        assertTrue(sink.offer(record("E" + i)));
      }
    }

    assertEquals(10, store.records.size());
    assertEquals(0, metrics.count("archiveDropped"));
  }

  @Test
  void transientFailureIsRetried() {
    store.failuresToInject.set(2);

    try (ArchivalSink sink = sink().maxRetries(3).build()) {
      sink.offer(record("E1"));
    }

    assertEquals(1, store.records.size());
    assertEquals(3, store.attempts.get());
  }

  @Test
  void persistentFailureDropsRecordAfterRetries() {
    store.failuresToInject.set(100);

    try (ArchivalSink sink = sink().maxRetries(2).build()) {
      sink.offer(record("E1"));
    }

    assertTrue(store.records.isEmpty());
    assertEquals(3, store.attempts.get());
    assertEquals(1, metrics.count("archiveDropped"));
  }

  @Test
  void fullQueueDropsInsteadOfBlocking() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    CountDownLatch writing = new CountDownLatch(1);
    ArchivalSink sink = ArchivalSink.builder()
        .archiveStore(record -> {
          writing.countDown();
          release.await();
        })
        .capacity(1)
        .metrics(metrics)
        .build();
    try {
      assertTrue(sink.offer(record("E1")));
      assertTrue(writing.await(3, TimeUnit.SECONDS));
      assertTrue(sink.offer(record("E2")));

      assertFalse(sink.offer(record("E3")));
      assertEquals(1, metrics.count("archiveDropped"));
      assertEquals(1, sink.queueDepth());
    } finally {
      release.countDown();
      sink.close();
    }
  }

  @Test
  void closedSinkRejectsOffers() {
    ArchivalSink sink = sink().build();
    sink.close();

    assertFalse(sink.offer(record("E1")));
    assertFalse(sink.offer(null));
    assertEquals(1, metrics.count("archiveDropped"));
  }

  // ── Documents ─────────────────────────────────────────────────

  @Test
  void rawEventDocumentCarriesPayloadAndKeys() {
    TrackingEvent e = event("E1", "S1", CanonicalStatus.DELIVERED, at(0), at(1));

    ArchiveRecord record = ArchiveDocuments.rawEvent(e, at(2));

    assertEquals(ArchiveKind.RAW_EVENT, record.kind());
    assertEquals("E1", record.eventId());
    assertEquals(e.dedupKey(), record.document().get("dedup_key"));
    assertEquals("{}", record.document().get("raw_payload"));
    assertFalse(record.document().containsKey("carrier_event_id"));
  }

  @Test
  void timelineSnapshotFlattensEntries() {
    Timeline timeline = TimelineBuilder.defaults().build("S1", List.of(
        event("E1", "S1", CanonicalStatus.COLLECTED, at(0), at(0)),
        event("E2", "S1", CanonicalStatus.IN_TRANSIT, at(10), at(10))));

    ArchiveRecord record = ArchiveDocuments.timelineSnapshot(timeline, "E2", at(11));

    assertEquals(ArchiveKind.TIMELINE_SNAPSHOT, record.kind());
    assertEquals("IN_TRANSIT", record.document().get("status"));
    assertEquals("2", record.document().get("entry_count"));
    assertEquals("E1", record.document().get("entry.0.event_id"));
    assertEquals("APPLIED", record.document().get("entry.1.disposition"));
    assertEquals("IN_TRANSIT", record.document().get("entry.1.status_after"));
  }
}
