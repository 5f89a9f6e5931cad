package tracking;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tracking.automation.InMemoryRuleRepository;
import tracking.automation.TransitionContext;
import tracking.model.ArchiveKind;
import tracking.model.AutomationAction;
import tracking.model.AutomationRule;
import tracking.model.CanonicalStatus;
import tracking.model.InvocationStatus;
import tracking.model.NewShipment;
import tracking.model.Shipment;
import tracking.model.UnresolvedEvent;
import tracking.model.UnresolvedStatus;
import tracking.state.Disposition;
import tracking.state.Reevaluation;
import tracking.support.InMemoryStores;
import tracking.support.RecordingMetrics;
import tracking.timeline.Timeline;
import tracking.timeline.TimelineEntry;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class TrackingEngineTest {

  private static final Instant RECEIVED = Instant.parse("2024-03-02T12:00:00Z");

  private InMemoryStores.Events events;
  private InMemoryStores.Shipments shipments;
  private InMemoryStores.Invocations invocations;
  private InMemoryStores.Unresolved unresolved;
  private InMemoryStores.Archive archive;
  private InMemoryRuleRepository rules;
  private RecordingMetrics metrics;
  private final List<String> notifications = new CopyOnWriteArrayList<>();
  private final List<Reevaluation> transitions = new CopyOnWriteArrayList<>();
  private final List<TimelineEntry> anomalies = new CopyOnWriteArrayList<>();
  private final List<UnresolvedEvent> rejections = new CopyOnWriteArrayList<>();
  private volatile CountDownLatch notified = new CountDownLatch(1);
  private TrackingEngine engine;

  @BeforeEach
  void setUp() {
    events = new InMemoryStores.Events();
    shipments = new InMemoryStores.Shipments();
    invocations = new InMemoryStores.Invocations();
    unresolved = new InMemoryStores.Unresolved();
    archive = new InMemoryStores.Archive();
    rules = new InMemoryRuleRepository();
    metrics = new RecordingMetrics();
    rules.register(new AutomationRule("delivered-email", "Delivered e-mail", Set.of(CanonicalStatus.DELIVERED),
        null, List.of(new AutomationAction.Notify("email", "${email}", "delivered")), true));
    engine = TrackingEngine.builder()
        .connectionProvider(InMemoryStores.connections())
        .eventStore(events)
        .shipmentStore(shipments)
        .invocationStore(invocations)
        .unresolvedStore(unresolved)
        .archiveStore(archive)
        .ruleRepository(rules)
        .notificationSender(this::send)
        .listener(new TrackingListener() {
          @Override
          public void onTransition(Reevaluation transition) {
            transitions.add(transition);
          }

          @Override
          public void onAnomaly(String shipmentId, TimelineEntry entry) {
            anomalies.add(entry);
          }

          @Override
          public void onRejected(UnresolvedEvent parked) {
            rejections.add(parked);
          }
        })
        .metrics(metrics)
        .workerCount(1)
        .autoStart(false)
        .build();
  }

  @AfterEach
  void tearDown() {
    engine.close();
  }

  private void send(AutomationAction.Notify action, String shipmentId, CanonicalStatus status,
      TransitionContext context) {
    notifications.add(shipmentId + ":" + status + ":" + context.invocationId());
    notified.countDown();
  }

  private static String payload(String trackingCode, String code, String occurredAt) {
    return "{\"tracking_code\":\"" + trackingCode + "\",\"occurrence_code\":\"" + code
        + "\",\"occurred_at\":\"" + occurredAt + "\"}";
  }

  private Shipment register(String trackingCode) {
    return engine.registerShipment(new NewShipment(null, trackingCode, "acme", Map.of("email", "a@b.c")));
  }

  // ── Ingestion ─────────────────────────────────────────────────

  @Test
  void ingestAdvancesStatus() {
    Shipment shipment = register("TRK1");

    IngestOutcome outcome = engine.ingestRaw(payload("TRK1", "80", "2024-03-01T08:00:00Z"), "api", RECEIVED);

    assertTrue(outcome.accepted());
    assertTrue(outcome.transitioned());
    assertEquals(CanonicalStatus.CREATED, outcome.previousStatus());
    assertEquals(CanonicalStatus.COLLECTED, outcome.newStatus());
    assertEquals(Disposition.APPLIED, outcome.disposition());
    ShipmentStatusView view = engine.currentStatus(shipment.id()).orElseThrow();
    assertEquals(CanonicalStatus.COLLECTED, view.status());
    assertEquals(1L, view.statusVersion());
    assertEquals(outcome.eventId(), view.lastEventId());
    assertEquals(1, transitions.size());
  }

  @Test
  void redeliveryIsCollapsed() {
    register("TRK1");
    String body = payload("TRK1", "80", "2024-03-01T08:00:00Z");

    engine.ingestRaw(body, "api", RECEIVED);
    IngestOutcome second = engine.ingestRaw(body, "api", RECEIVED.plusSeconds(30));

    assertEquals(IngestOutcome.Kind.DUPLICATE, second.kind());
    assertEquals(1, events.size());
    assertEquals(1, metrics.count("ingestDuplicate"));
  }

  @Test
  void outOfOrderArrivalKeepsLatestStatus() {
    Shipment shipment = register("TRK1");
    engine.ingestRaw(payload("TRK1", "80", "2024-03-01T08:00:00Z"), "api", RECEIVED);
    engine.ingestRaw(payload("TRK1", "85", "2024-03-01T12:00:00Z"), "api", RECEIVED.plusSeconds(10));

    IngestOutcome late = engine.ingestRaw(payload("TRK1", "17", "2024-03-01T10:00:00Z"), "api",
        RECEIVED.plusSeconds(20));

    assertEquals(Disposition.ANOMALY, late.disposition());
    assertFalse(late.transitioned());
    assertEquals(CanonicalStatus.OUT_FOR_DELIVERY, engine.currentStatus(shipment.id()).orElseThrow().status());
    assertEquals(1, anomalies.size());
    Timeline timeline = engine.timeline(shipment.id());
    assertEquals(3, timeline.size());
    assertEquals("17", timeline.entries().get(1).event().occurrenceCode());
  }

  @Test
  void unknownCodeIsStoredButDoesNotMoveStatus() {
    Shipment shipment = register("TRK1");

    IngestOutcome outcome = engine.ingestRaw(payload("TRK1", "777", "2024-03-01T08:00:00Z"), "api", RECEIVED);

    assertTrue(outcome.accepted());
    assertEquals(Disposition.UNCLASSIFIED, outcome.disposition());
    assertEquals(CanonicalStatus.CREATED, engine.currentStatus(shipment.id()).orElseThrow().status());
    assertEquals(1, engine.reviewQueue().unclassified(10).size());
    assertEquals(1, metrics.count("unclassified"));
  }

  @Test
  void deliveredShipmentIgnoresLaterException() {
    Shipment shipment = register("TRK1");
    engine.ingestRaw(payload("TRK1", "1", "2024-03-01T08:00:00Z"), "api", RECEIVED);

    IngestOutcome after = engine.ingestRaw(payload("TRK1", "5", "2024-03-01T09:00:00Z"), "api",
        RECEIVED.plusSeconds(5));

    assertEquals(Disposition.TERMINAL_IGNORED, after.disposition());
    assertEquals(CanonicalStatus.DELIVERED, engine.currentStatus(shipment.id()).orElseThrow().status());
  }

  @Test
  void sswPayloadIsUnderstoodOutOfTheBox() {
    Shipment shipment = register("NF123");

    IngestOutcome outcome = engine.ingestRaw(
        "{\"nro_nf\":\"NF123\",\"codigo\":\"85\",\"data_hora\":\"01/03/2024 09:00\"}",
        TrackingEngine.SSW_SOURCE, RECEIVED);

    assertEquals(CanonicalStatus.OUT_FOR_DELIVERY, outcome.newStatus());
    assertEquals(CanonicalStatus.OUT_FOR_DELIVERY, engine.currentStatus(shipment.id()).orElseThrow().status());
  }

  @Test
  void rawEventAndSnapshotAreArchived() {
    register("TRK1");
    engine.ingestRaw(payload("TRK1", "80", "2024-03-01T08:00:00Z"), "api", RECEIVED);

    engine.close();

    assertEquals(List.of(ArchiveKind.RAW_EVENT, ArchiveKind.TIMELINE_SNAPSHOT),
        archive.snapshot().stream().map(r -> r.kind()).toList());
  }

  // ── Unresolved shipments ──────────────────────────────────────

  @Test
  void eventForUnknownShipmentIsParkedAndReplayedOnRegistration() {
    IngestOutcome outcome = engine.ingestRaw(payload("TRK9", "80", "2024-03-01T08:00:00Z"), "api", RECEIVED);

    assertEquals(IngestOutcome.Kind.REJECTED, outcome.kind());
    assertEquals("UNRESOLVED_SHIPMENT", outcome.reason());
    assertEquals(1, rejections.size());
    assertEquals(1, unresolved.withStatus(UnresolvedStatus.PENDING).size());

    Shipment shipment = register("TRK9");

    assertEquals(CanonicalStatus.COLLECTED, engine.currentStatus(shipment.id()).orElseThrow().status());
    assertEquals(1, unresolved.withStatus(UnresolvedStatus.RESOLVED).size());
    assertEquals(RECEIVED, engine.timeline(shipment.id()).entries().get(0).event().receivedAt());
  }

  @Test
  void malformedPayloadGoesToReview() {
    IngestOutcome outcome = engine.ingestRaw("garbage", "api", "TRK1", RECEIVED);

    assertEquals("MALFORMED_PAYLOAD", outcome.reason());
    assertEquals(1, engine.reviewQueue().count());
  }

  @Test
  void duplicateRegistrationIsRejected() {
    register("TRK1");

    assertThrows(IllegalStateException.class, () -> register("TRK1"));
  }

  // ── Automation ────────────────────────────────────────────────

  @Test
  void deliveryTriggersNotificationExactlyOnce() throws Exception {
    Shipment shipment = register("TRK1");

    engine.ingestRaw(payload("TRK1", "1", "2024-03-01T08:00:00Z"), "api", RECEIVED);
    engine.ingestRaw(payload("TRK1", "1", "2024-03-01T08:00:00Z"), "api", RECEIVED.plusSeconds(1));
    engine.reconcile(shipment.id());

    assertTrue(notified.await(3, TimeUnit.SECONDS));
    engine.pollInvocations();
    engine.close();

    assertEquals(1, notifications.size());
    assertTrue(notifications.get(0).startsWith(shipment.id() + ":DELIVERED:"));
    assertEquals(1, invocations.withStatus(InvocationStatus.DONE).size());
    assertEquals(1, metrics.count("hotEnqueued"));
  }

  @Test
  void nonMatchingTransitionsTriggerNothing() {
    register("TRK1");

    engine.ingestRaw(payload("TRK1", "80", "2024-03-01T08:00:00Z"), "api", RECEIVED);

    assertTrue(invocations.byId.isEmpty());
  }

  // ── Failed status writes ──────────────────────────────────────

  @Test
  void failedStatusWriteIsHealedByReconcileSweep() {
    Shipment shipment = register("TRK1");
    String body = payload("TRK1", "80", "2024-03-01T08:00:00Z");
    shipments.failingStatusWrites.set(1);

    IngestOutcome outcome = engine.ingestRaw(body, "api", RECEIVED);

    assertTrue(outcome.accepted());
    assertNull(outcome.newStatus());
    assertEquals(CanonicalStatus.CREATED, engine.currentStatus(shipment.id()).orElseThrow().status());
    assertEquals(CanonicalStatus.COLLECTED, engine.timeline(shipment.id()).status());
    assertTrue(shipments.reconcileRequests.containsKey(shipment.id()));

    // the carrier's redelivery cannot repair the status itself
    assertEquals(IngestOutcome.Kind.DUPLICATE, engine.ingestRaw(body, "api", RECEIVED.plusSeconds(30)).kind());

    assertEquals(1, engine.reconcileFlagged());

    ShipmentStatusView view = engine.currentStatus(shipment.id()).orElseThrow();
    assertEquals(CanonicalStatus.COLLECTED, view.status());
    assertEquals(outcome.eventId(), view.lastEventId());
    assertTrue(shipments.reconcileRequests.isEmpty());
    assertEquals(1, transitions.size());
    assertEquals(1, metrics.count("reconcileRequested"));
    assertEquals(1, metrics.count("reconcileCompleted"));
  }

  @Test
  void shipmentStaysFlaggedWhileReconcileKeepsFailing() {
    Shipment shipment = register("TRK1");
    shipments.failingStatusWrites.set(2);
    engine.ingestRaw(payload("TRK1", "80", "2024-03-01T08:00:00Z"), "api", RECEIVED);

    assertEquals(0, engine.reconcileFlagged());
    assertTrue(shipments.reconcileRequests.containsKey(shipment.id()));
    assertEquals(CanonicalStatus.CREATED, engine.currentStatus(shipment.id()).orElseThrow().status());

    assertEquals(1, engine.reconcileFlagged());
    assertEquals(CanonicalStatus.COLLECTED, engine.currentStatus(shipment.id()).orElseThrow().status());
  }

  @Test
  void deliveryRecoveredByReconcileStillTriggersAutomation() throws Exception {
    Shipment shipment = register("TRK1");
    shipments.failingStatusWrites.set(1);
    engine.ingestRaw(payload("TRK1", "1", "2024-03-01T08:00:00Z"), "api", RECEIVED);
    assertTrue(notifications.isEmpty());

    engine.reconcileFlagged();

    assertTrue(notified.await(3, TimeUnit.SECONDS));
    assertTrue(notifications.get(0).startsWith(shipment.id() + ":DELIVERED:"));
  }

  @Test
  void persistentVersionConflictFlagsShipment() {
    AtomicBoolean racing = new AtomicBoolean(true);
    InMemoryStores.Shipments contended = new InMemoryStores.Shipments() {
      @Override
      public synchronized boolean compareAndSetStatus(Connection conn, String shipmentId, long expectedVersion,
          CanonicalStatus newStatus, String lastEventId, Instant updatedAt) {
        if (racing.get()) {
          bumpVersion(shipmentId);
        }
        return super.compareAndSetStatus(conn, shipmentId, expectedVersion, newStatus, lastEventId, updatedAt);
      }
    };
    try (TrackingEngine other = engineWith(contended)) {
      Shipment shipment = other.registerShipment(new NewShipment(null, "TRK1", "acme", Map.of()));

      IngestOutcome outcome = other.ingestRaw(payload("TRK1", "80", "2024-03-01T08:00:00Z"), "api", RECEIVED);

      assertTrue(outcome.accepted());
      assertNull(outcome.newStatus());
      assertTrue(contended.reconcileRequests.containsKey(shipment.id()));

      racing.set(false);
      assertEquals(1, other.reconcileFlagged());
      assertEquals(CanonicalStatus.COLLECTED, other.currentStatus(shipment.id()).orElseThrow().status());
    }
  }

  @Test
  void storeFailureSurfacesWhenShipmentCannotBeFlagged() {
    InMemoryStores.Shipments unflaggable = new InMemoryStores.Shipments() {
      @Override
      public int requestReconcile(Connection conn, String shipmentId, Instant requestedAt) {
        throw new IllegalStateException("store down");
      }
    };
    unflaggable.failingStatusWrites.set(1);
    try (TrackingEngine other = engineWith(unflaggable)) {
      other.registerShipment(new NewShipment(null, "TRK1", "acme", Map.of()));

      assertThrows(TrackingStoreException.class,
          () -> other.ingestRaw(payload("TRK1", "80", "2024-03-01T08:00:00Z"), "api", RECEIVED));
    }
  }

  private TrackingEngine engineWith(InMemoryStores.Shipments shipmentStore) {
    return TrackingEngine.builder()
        .connectionProvider(InMemoryStores.connections())
        .eventStore(new InMemoryStores.Events())
        .shipmentStore(shipmentStore)
        .invocationStore(new InMemoryStores.Invocations())
        .unresolvedStore(new InMemoryStores.Unresolved())
        .maxConflictRetries(1)
        .workerCount(0)
        .autoStart(false)
        .build();
  }

  // ── Lifecycle ─────────────────────────────────────────────────

  @Test
  void builderCannotBeReused() {
    TrackingEngine.Builder builder = TrackingEngine.builder()
        .connectionProvider(InMemoryStores.connections())
        .eventStore(events)
        .shipmentStore(shipments)
        .invocationStore(invocations)
        .unresolvedStore(unresolved)
        .workerCount(0)
        .autoStart(false);
    builder.build().close();

    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  void missingStoreFailsBuild() {
    assertThrows(NullPointerException.class, () -> TrackingEngine.builder()
        .connectionProvider(InMemoryStores.connections())
        .eventStore(events)
        .build());
  }

  @Test
  void closeIsIdempotent() {
    engine.close();

    assertDoesNotThrow(engine::close);
  }
}
