package tracking.state;

import tracking.StorageConflictException;
import tracking.TrackingStoreException;
import tracking.automation.RuleRepository;
import tracking.model.AutomationInvocation;
import tracking.model.AutomationRule;
import tracking.model.CanonicalStatus;
import tracking.model.Shipment;
import tracking.model.TrackingEvent;
import tracking.spi.ConnectionProvider;
import tracking.spi.EventStore;
import tracking.spi.InvocationStore;
import tracking.spi.MetricsExporter;
import tracking.spi.ShipmentStore;
import tracking.timeline.Timeline;
import tracking.timeline.TimelineBuilder;
import tracking.timeline.TimelineEntry;
import tracking.util.Ids;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps each shipment's stored status equal to the fold of its full timeline.
 *
 * <p>Per shipment, {@link #reevaluate} runs under an in-process lock stripe. It reads the
 * shipment and its events, folds them, and if the derived status differs from the stored
 * one it commits, in a single transaction, a version-checked status update together with
 * the automation invocation claims for the new status. A version mismatch (another
 * process wrote first) rolls back and starts over, up to {@code maxConflictRetries} times.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class StatusEngine {
  private static final Logger logger = Logger.getLogger(StatusEngine.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ShipmentStore shipmentStore;
  private final EventStore eventStore;
  private final InvocationStore invocationStore;
  private final RuleRepository ruleRepository;
  private final TimelineBuilder timelineBuilder;
  private final KeyedLocks locks;
  private final int maxConflictRetries;
  private final MetricsExporter metrics;

  private StatusEngine(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.shipmentStore = Objects.requireNonNull(builder.shipmentStore, "shipmentStore");
    this.eventStore = Objects.requireNonNull(builder.eventStore, "eventStore");
    this.invocationStore = Objects.requireNonNull(builder.invocationStore, "invocationStore");
    this.ruleRepository = Objects.requireNonNull(builder.ruleRepository, "ruleRepository");
    this.timelineBuilder = builder.timelineBuilder != null ? builder.timelineBuilder : TimelineBuilder.defaults();
    if (builder.maxConflictRetries < 0) {
      throw new IllegalArgumentException("maxConflictRetries must be >= 0");
    }
    this.maxConflictRetries = builder.maxConflictRetries;
    this.locks = new KeyedLocks(builder.lockStripes);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Re-derives and, if needed, stores the status of a shipment.
   *
   * @param shipmentId     the shipment
   * @param triggerEventId event that caused the call, {@code null} for reconciliation
   * @return what was derived and committed
   * @throws IllegalArgumentException  if the shipment does not exist
   * @throws StorageConflictException  if the version kept changing after all retries
   * @throws TrackingStoreException    if the store is unavailable
   */
  public Reevaluation reevaluate(String shipmentId, String triggerEventId) {
    Objects.requireNonNull(shipmentId, "shipmentId");
    ReentrantLock lock = locks.lockFor(shipmentId);
    lock.lock();
    try {
      for (int attempt = 0; attempt <= maxConflictRetries; attempt++) {
        Reevaluation result = attempt(shipmentId, triggerEventId);
        if (result != null) {
          report(result, triggerEventId);
          return result;
        }
        metrics.incrementStorageConflict();
        logger.log(Level.FINE, "Status version conflict for shipment {0}, attempt {1}",
            new Object[] {shipmentId, attempt + 1});
      }
    } finally {
      lock.unlock();
    }
    throw new StorageConflictException(shipmentId, maxConflictRetries + 1);
  }

  /**
   * Builds the current timeline of a shipment without touching stored state.
   *
   * @param shipmentId the shipment
   * @return its timeline, empty if it has no events
   */
  public Timeline timeline(String shipmentId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return timelineBuilder.build(shipmentId, eventStore.findByShipment(conn, shipmentId));
    } catch (SQLException e) {
      throw new TrackingStoreException("Failed to load events of shipment " + shipmentId, e);
    }
  }

  /** Returns {@code null} on a version conflict. */
  private Reevaluation attempt(String shipmentId, String triggerEventId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        Reevaluation result = deriveAndStore(conn, shipmentId, triggerEventId);
        if (result == null) {
          conn.rollback();
        } else {
          conn.commit();
        }
        return result;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException e) {
      throw new TrackingStoreException("Failed to re-derive status of shipment " + shipmentId, e);
    }
  }

  private Reevaluation deriveAndStore(Connection conn, String shipmentId, String triggerEventId) {
    Shipment shipment = shipmentStore.findById(conn, shipmentId)
        .orElseThrow(() -> new IllegalArgumentException("Unknown shipment: " + shipmentId));
    List<TrackingEvent> events = eventStore.findByShipment(conn, shipmentId);
    Timeline timeline = timelineBuilder.build(shipmentId, events);
    TimelineEntry trigger = triggerEventId == null ? null : timeline.entry(triggerEventId).orElse(null);

    CanonicalStatus previous = shipment.currentStatus();
    CanonicalStatus derived = timeline.status();
    if (derived == previous) {
      return new Reevaluation(shipmentId, previous, derived, shipment.currentStatusVersion(), false,
          List.of(), timeline, trigger);
    }

    Instant now = Instant.now();
    long expectedVersion = shipment.currentStatusVersion();
    String lastEventId = lastApplied(timeline, triggerEventId);
    if (!shipmentStore.compareAndSetStatus(conn, shipmentId, expectedVersion, derived, lastEventId, now)) {
      return null;
    }
    long newVersion = expectedVersion + 1;

    List<AutomationInvocation> claims = new ArrayList<>();
    for (AutomationRule rule : ruleRepository.matching(derived, shipment.attributes())) {
      AutomationInvocation invocation = AutomationInvocation.pending(Ids.newId(), shipmentId,
          rule.id(), newVersion, previous, derived, lastEventId, now);
      if (invocationStore.claim(conn, invocation)) {
        claims.add(invocation);
      }
    }
    return new Reevaluation(shipmentId, previous, derived, newVersion, true, claims, timeline, trigger);
  }

  private static String lastApplied(Timeline timeline, String triggerEventId) {
    List<TimelineEntry> entries = timeline.entries();
    for (int i = entries.size() - 1; i >= 0; i--) {
      if (entries.get(i).disposition() == Disposition.APPLIED) {
        return entries.get(i).event().id();
      }
    }
    return triggerEventId;
  }

  private void report(Reevaluation result, String triggerEventId) {
    if (result.changed()) {
      metrics.incrementTransition();
      logger.log(Level.FINE, "Shipment {0}: {1} -> {2} (version {3}, {4} claims)",
          new Object[] {result.shipmentId(), result.previousStatus(), result.newStatus(),
              result.statusVersion(), result.claims().size()});
    }
    if (result.triggerDisposition() == Disposition.ANOMALY) {
      metrics.incrementAnomaly();
      TrackingEvent event = result.triggerEntry().event();
      logger.log(Level.WARNING, "Anomalous event {0} ({1}) for shipment {2} while status is {3}",
          new Object[] {triggerEventId, event.canonicalStatus(), result.shipmentId(), result.newStatus()});
    }
  }

  /** Builder for {@link StatusEngine}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private ShipmentStore shipmentStore;
    private EventStore eventStore;
    private InvocationStore invocationStore;
    private RuleRepository ruleRepository;
    private TimelineBuilder timelineBuilder;
    private int maxConflictRetries = 5;
    private int lockStripes = 64;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the connection provider.
     *
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the shipment store.
     *
     * <p><b>Required.</b>
     */
    public Builder shipmentStore(ShipmentStore shipmentStore) {
      this.shipmentStore = shipmentStore;
      return this;
    }

    /**
     * Sets the event store.
     *
     * <p><b>Required.</b>
     */
    public Builder eventStore(EventStore eventStore) {
      this.eventStore = eventStore;
      return this;
    }

    /**
     * Sets the store receiving invocation claims.
     *
     * <p><b>Required.</b>
     */
    public Builder invocationStore(InvocationStore invocationStore) {
      this.invocationStore = invocationStore;
      return this;
    }

    /**
     * Sets the rules evaluated when a transition commits.
     *
     * <p><b>Required.</b>
     *
     * @param ruleRepository the rules
     * @return this builder
     */
    public Builder ruleRepository(RuleRepository ruleRepository) {
      this.ruleRepository = ruleRepository;
      return this;
    }

    /**
     * Sets how timelines are ordered and folded.
     *
     * <p>Optional. Defaults to {@link TimelineBuilder#defaults()}.
     *
     * @param timelineBuilder the timeline builder
     * @return this builder
     */
    public Builder timelineBuilder(TimelineBuilder timelineBuilder) {
      this.timelineBuilder = timelineBuilder;
      return this;
    }

    /**
     * Sets how many times a version conflict is retried before giving up.
     *
     * <p>Optional. Defaults to {@code 5}.
     *
     * @param maxConflictRetries retries after the first attempt
     * @return this builder
     */
    public Builder maxConflictRetries(int maxConflictRetries) {
      this.maxConflictRetries = maxConflictRetries;
      return this;
    }

    /**
     * Sets the number of lock stripes that serialize work per shipment.
     *
     * <p>Optional. Defaults to {@code 64}.
     *
     * @param lockStripes number of per-shipment lock stripes
     * @return this builder
     */
    public Builder lockStripes(int lockStripes) {
      this.lockStripes = lockStripes;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public StatusEngine build() {
      return new StatusEngine(this);
    }
  }
}
