package tracking;

import tracking.archive.ArchivalSink;
import tracking.archive.ArchiveDocuments;
import tracking.automation.ActionExecutor;
import tracking.automation.AutomationDispatcher;
import tracking.automation.HttpWebhookClient;
import tracking.automation.InMemoryRuleRepository;
import tracking.automation.InvocationPoller;
import tracking.automation.RuleRepository;
import tracking.dispatch.RetryPolicy;
import tracking.ingest.IngestResult;
import tracking.ingest.IngestionService;
import tracking.ingest.ReplayHandler;
import tracking.ingest.ReviewQueue;
import tracking.ingest.UnresolvedEventReplayer;
import tracking.model.ArchiveRecord;
import tracking.model.AutomationInvocation;
import tracking.model.CanonicalStatus;
import tracking.model.NewShipment;
import tracking.model.Shipment;
import tracking.model.TrackingEvent;
import tracking.model.UnresolvedEvent;
import tracking.normalize.EventNormalizer;
import tracking.normalize.NormalizedEvent;
import tracking.normalize.PayloadExtractor;
import tracking.normalize.RejectionReason;
import tracking.normalize.SswPayloadExtractor;
import tracking.registry.ClasspathOccurrenceCodeSource;
import tracking.registry.OccurrenceCodeRegistry;
import tracking.registry.OccurrenceCodeSource;
import tracking.spi.ArchiveStore;
import tracking.spi.ConnectionProvider;
import tracking.spi.EventStore;
import tracking.spi.InvocationStore;
import tracking.spi.MetricsExporter;
import tracking.spi.NotificationSender;
import tracking.spi.ShipmentStore;
import tracking.spi.UnresolvedEventStore;
import tracking.spi.WebhookClient;
import tracking.state.Disposition;
import tracking.state.ReconcileSweeper;
import tracking.state.Reevaluation;
import tracking.state.StatusEngine;
import tracking.timeline.Timeline;
import tracking.timeline.TimelineBuilder;
import tracking.timeline.TimelineEntry;
import tracking.util.Ids;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires normalization, ingestion, status derivation, automation
 * dispatch, replay and archival into a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (TrackingEngine engine = TrackingEngine.builder()
 *     .connectionProvider(connProvider)
 *     .eventStore(stores.eventStore())
 *     .shipmentStore(stores.shipmentStore())
 *     .invocationStore(stores.invocationStore())
 *     .unresolvedStore(stores.unresolvedStore())
 *     .ruleRepository(rules)
 *     .notificationSender(sender)
 *     .build()) {
 *   engine.registerShipment(NewShipment.of("BR123", "ssw"));
 *   IngestOutcome outcome = engine.ingestRaw(payload, "ssw", Instant.now());
 * }
 * }</pre>
 *
 * <p>This class is thread-safe.
 */
public final class TrackingEngine implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(TrackingEngine.class.getName());

  public static final String SSW_SOURCE = "ssw";

  private final ConnectionProvider connectionProvider;
  private final ShipmentStore shipmentStore;
  private final OccurrenceCodeRegistry registry;
  private final EventNormalizer normalizer;
  private final IngestionService ingestion;
  private final StatusEngine statusEngine;
  private final AutomationDispatcher dispatcher;
  private final InvocationPoller poller;
  private final ActionExecutor actionExecutor;
  private final UnresolvedEventReplayer replayer;
  private final ReconcileSweeper reconcileSweeper;
  private final ReviewQueue reviewQueue;
  private final ArchivalSink archivalSink;
  private final TrackingListener listener;
  private final MetricsExporter metrics;

  private TrackingEngine(Builder builder, OccurrenceCodeRegistry registry, ActionExecutor actionExecutor,
      AutomationDispatcher dispatcher, InvocationPoller poller, ArchivalSink archivalSink) {
    this.connectionProvider = builder.connectionProvider;
    this.shipmentStore = builder.shipmentStore;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.listener = builder.listener != null ? builder.listener : TrackingListener.NOOP;
    this.registry = registry;
    this.actionExecutor = actionExecutor;
    this.dispatcher = dispatcher;
    this.poller = poller;
    this.archivalSink = archivalSink;

    Map<String, PayloadExtractor> extractors = new HashMap<>();
    extractors.put(SSW_SOURCE, new SswPayloadExtractor());
    extractors.putAll(builder.extractors);
    this.normalizer = EventNormalizer.builder()
        .registry(registry)
        .shipmentResolver(this::resolveShipment)
        .extractors(extractors)
        .build();
    this.ingestion = new IngestionService(connectionProvider, builder.eventStore,
        builder.unresolvedStore, metrics);
    this.statusEngine = StatusEngine.builder()
        .connectionProvider(connectionProvider)
        .shipmentStore(shipmentStore)
        .eventStore(builder.eventStore)
        .invocationStore(builder.invocationStore)
        .ruleRepository(builder.ruleRepository)
        .timelineBuilder(builder.timelineBuilder)
        .maxConflictRetries(builder.maxConflictRetries)
        .metrics(metrics)
        .build();
    UnresolvedEventReplayer.Builder rb = UnresolvedEventReplayer.builder()
        .connectionProvider(connectionProvider)
        .unresolvedStore(builder.unresolvedStore)
        .handler(this::replay)
        .retryWindow(builder.replayWindow)
        .intervalMs(builder.replayIntervalMs)
        .metrics(metrics);
    if (builder.replayRetryPolicy != null) {
      rb.retryPolicy(builder.replayRetryPolicy);
    }
    this.replayer = rb.build();
    this.reconcileSweeper = ReconcileSweeper.builder()
        .connectionProvider(connectionProvider)
        .shipmentStore(shipmentStore)
        .reconciler(this::reconcile)
        .intervalMs(builder.reconcileIntervalMs)
        .metrics(metrics)
        .build();
    this.reviewQueue = new ReviewQueue(connectionProvider, builder.unresolvedStore, builder.eventStore);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Ingests one raw carrier payload.
   *
   * @see #ingestRaw(String, String, String, Instant)
   */
  public IngestOutcome ingestRaw(String rawPayload, String source, Instant receivedAt) {
    return ingestRaw(rawPayload, source, null, receivedAt);
  }

  /**
   * Ingests one raw carrier payload: normalize, store once, re-derive the shipment status,
   * claim and hand off automations, archive.
   *
   * <p>Carrier data problems are outcomes, not exceptions: a duplicate yields
   * {@link IngestOutcome.Kind#DUPLICATE}; an unresolvable or malformed payload is parked and
   * yields {@link IngestOutcome.Kind#REJECTED}.
   *
   * <p>If the event is stored but the status cannot be re-derived, the shipment is flagged
   * and the outcome is ACCEPTED without a status; the reconcile sweep commits the status
   * later. Only when the flag cannot be written either does the store failure propagate.
   *
   * @param rawPayload   payload exactly as received
   * @param source       carrier integration identifier
   * @param shipmentHint explicit shipment reference, may be {@code null}
   * @param receivedAt   receipt time
   * @return the outcome
   * @throws TrackingStoreException if the store is unavailable
   */
  public IngestOutcome ingestRaw(String rawPayload, String source, String shipmentHint, Instant receivedAt) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(receivedAt, "receivedAt");
    NormalizedEvent normalized = normalizer.normalize(rawPayload, source, shipmentHint, receivedAt);
    if (normalized instanceof NormalizedEvent.Rejected rejected) {
      UnresolvedEvent parked = ingestion.recordRejected(rawPayload, source, rejected, receivedAt);
      notifyListener(() -> listener.onRejected(parked));
      return IngestOutcome.rejected(rejected.reason().name());
    }
    return ingestCanonical(((NormalizedEvent.Canonical) normalized).event());
  }

  private IngestOutcome ingestCanonical(TrackingEvent event) {
    if (ingestion.ingest(event) == IngestResult.DUPLICATE) {
      return IngestOutcome.duplicate(event.shipmentId());
    }
    archive(() -> ArchiveDocuments.rawEvent(event, Instant.now()));

    Reevaluation result;
    try {
      result = statusEngine.reevaluate(event.shipmentId(), event.id());
    } catch (StorageConflictException | TrackingStoreException e) {
      // a redelivery is a DUPLICATE, so the flag is the only way back to this event
      logger.log(Level.SEVERE, "Status of shipment " + event.shipmentId()
          + " not updated after event " + event.id(), e);
      if (!reconcileSweeper.request(event.shipmentId()) && e instanceof TrackingStoreException) {
        throw e;
      }
      return IngestOutcome.accepted(event.id(), event.shipmentId(), null, null, false, null);
    }
    afterReevaluation(result);
    return IngestOutcome.accepted(event.id(), event.shipmentId(), result.previousStatus(),
        result.newStatus(), result.changed(), result.triggerDisposition());
  }

  private void afterReevaluation(Reevaluation result) {
    if (result.changed()) {
      for (AutomationInvocation claim : result.claims()) {
        if (dispatcher.enqueueHot(claim)) {
          metrics.incrementHotEnqueued();
        } else {
          metrics.incrementHotDropped();
          logger.log(Level.FINE, "Hot queue full; invocation {0} left to the poller", claim.id());
        }
      }
      archive(() -> ArchiveDocuments.timelineSnapshot(result.timeline(),
          result.triggerEntry() == null ? null : result.triggerEntry().event().id(), Instant.now()));
      notifyListener(() -> listener.onTransition(result));
    }
    TimelineEntry trigger = result.triggerEntry();
    if (trigger != null && trigger.disposition() == Disposition.ANOMALY) {
      notifyListener(() -> listener.onAnomaly(result.shipmentId(), trigger));
    }
  }

  private ReplayHandler.Outcome replay(UnresolvedEvent entry) {
    NormalizedEvent normalized = normalizer.normalize(entry.rawPayload(), entry.source(),
        entry.shipmentHint(), entry.receivedAt());
    if (normalized instanceof NormalizedEvent.Rejected rejected) {
      return rejected.reason() == RejectionReason.MALFORMED_PAYLOAD
          ? ReplayHandler.Outcome.REJECTED : ReplayHandler.Outcome.UNRESOLVED;
    }
    ingestCanonical(((NormalizedEvent.Canonical) normalized).event());
    return ReplayHandler.Outcome.RESOLVED;
  }

  /**
   * Registers a shipment and immediately replays parked payloads that were waiting for it.
   *
   * @param request the shipment to create
   * @return the stored shipment, in {@link CanonicalStatus#CREATED}
   * @throws IllegalStateException if the id or tracking code is already registered
   */
  public Shipment registerShipment(NewShipment request) {
    Objects.requireNonNull(request, "request");
    Instant now = Instant.now();
    String id = request.id() != null ? request.id() : Ids.newId();
    Shipment shipment = new Shipment(id, request.trackingCode(), request.carrier(),
        CanonicalStatus.CREATED, 0L, null, request.attributes(), now, now);
    boolean inserted;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      inserted = shipmentStore.insert(conn, shipment);
    } catch (SQLException e) {
      throw new TrackingStoreException("Failed to register shipment " + request.trackingCode(), e);
    }
    if (!inserted) {
      throw new IllegalStateException("Shipment already registered: " + request.trackingCode());
    }
    int replayed = replayer.replayFor(List.of(shipment.trackingCode(), shipment.id()));
    if (replayed > 0) {
      logger.log(Level.INFO, "Replayed {0} parked events for shipment {1}",
          new Object[] {replayed, shipment.trackingCode()});
    }
    return shipment;
  }

  /**
   * Returns the stored status of a shipment.
   *
   * @param shipmentId the shipment
   * @return the view, empty if the shipment does not exist
   */
  public Optional<ShipmentStatusView> currentStatus(String shipmentId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return shipmentStore.findById(conn, shipmentId).map(ShipmentStatusView::of);
    } catch (SQLException e) {
      throw new TrackingStoreException("Failed to read shipment " + shipmentId, e);
    }
  }

  /**
   * Builds the ordered timeline of a shipment. Read-only; recomputed on every call.
   *
   * @param shipmentId the shipment
   * @return the timeline
   */
  public Timeline timeline(String shipmentId) {
    return statusEngine.timeline(shipmentId);
  }

  /**
   * Re-derives a shipment's status from scratch and commits it if it differs from the
   * stored one. The reconcile sweep calls this for flagged shipments; callers use it after
   * a manual data fix.
   *
   * @param shipmentId the shipment
   * @return the reevaluation
   */
  public Reevaluation reconcile(String shipmentId) {
    Reevaluation result = statusEngine.reevaluate(shipmentId, null);
    afterReevaluation(result);
    return result;
  }

  /**
   * Reloads the occurrence code taxonomy.
   *
   * @return {@code true} if the new snapshot is in effect, {@code false} if the old one was kept
   */
  public boolean reloadOccurrenceCodes() {
    return registry.reload();
  }

  public OccurrenceCodeRegistry occurrenceCodes() {
    return registry;
  }

  public ReviewQueue reviewQueue() {
    return reviewQueue;
  }

  /**
   * Runs one replay sweep over parked payloads now, outside the schedule.
   *
   * @return number of payloads attached to a shipment
   */
  public int replayUnresolved() {
    return replayer.replayDue();
  }

  /**
   * Runs one reconcile sweep over flagged shipments now, outside the schedule.
   *
   * @return number of shipments whose status was re-derived and unflagged
   */
  public int reconcileFlagged() {
    return reconcileSweeper.sweep();
  }

  /**
   * Runs one invocation poll cycle now, outside the schedule.
   */
  public void pollInvocations() {
    poller.poll();
  }

  private Optional<Shipment> resolveShipment(String reference) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      Optional<Shipment> byCode = shipmentStore.findByTrackingCode(conn, reference);
      return byCode.isPresent() ? byCode : shipmentStore.findById(conn, reference);
    } catch (SQLException e) {
      throw new TrackingStoreException("Failed to resolve shipment " + reference, e);
    }
  }

  private void archive(Supplier<ArchiveRecord> record) {
    if (archivalSink == null) {
      return;
    }
    try {
      archivalSink.offer(record.get());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to build archive record", e);
    }
  }

  private void notifyListener(Runnable callback) {
    try {
      callback.run();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "TrackingListener failed", e);
    }
  }

  /**
   * Shuts down components in order: replayer, reconcile sweeper, poller, dispatcher,
   * action executor, archival sink. Closes the metrics exporter too when it is {@link AutoCloseable}.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    for (AutoCloseable component : new AutoCloseable[] {replayer, reconcileSweeper, poller, dispatcher,
        actionExecutor, archivalSink, metrics instanceof AutoCloseable c ? c : null}) {
      if (component == null) {
        continue;
      }
      try {
        component.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link TrackingEngine}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private EventStore eventStore;
    private ShipmentStore shipmentStore;
    private InvocationStore invocationStore;
    private UnresolvedEventStore unresolvedStore;
    private ArchiveStore archiveStore;
    private OccurrenceCodeRegistry occurrenceCodeRegistry;
    private OccurrenceCodeSource occurrenceCodeSource;
    private RuleRepository ruleRepository;
    private NotificationSender notificationSender;
    private WebhookClient webhookClient;
    private final Map<String, PayloadExtractor> extractors = new HashMap<>();
    private TimelineBuilder timelineBuilder;
    private TrackingListener listener;
    private MetricsExporter metrics;
    private Duration actionTimeout = Duration.ofSeconds(10);
    private int workerCount = 4;
    private int hotQueueCapacity = 1000;
    private int coldQueueCapacity = 1000;
    private int maxAttempts = 10;
    private RetryPolicy retryPolicy;
    private long pollIntervalMs = 5000;
    private int pollBatchSize = 50;
    private Duration pollSkipRecent = Duration.ofSeconds(1);
    private long drainTimeoutMs = 5000;
    private int maxConflictRetries = 5;
    private Duration replayWindow = Duration.ofHours(24);
    private long replayIntervalMs = 60_000;
    private RetryPolicy replayRetryPolicy;
    private long reconcileIntervalMs = 30_000;
    private int archiveCapacity = 10_000;
    private int archiveMaxRetries = 3;
    private boolean autoStart = true;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Sets the connection provider shared by every component.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder eventStore(EventStore eventStore) {
      this.eventStore = eventStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder shipmentStore(ShipmentStore shipmentStore) {
      this.shipmentStore = shipmentStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder invocationStore(InvocationStore invocationStore) {
      this.invocationStore = invocationStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder unresolvedStore(UnresolvedEventStore unresolvedStore) {
      this.unresolvedStore = unresolvedStore;
      return this;
    }

    /**
     * Sets the archive destination.
     *
     * <p>Optional. Without one, nothing is archived.
     *
     * @param archiveStore the archive store
     * @return this builder
     */
    public Builder archiveStore(ArchiveStore archiveStore) {
      this.archiveStore = archiveStore;
      return this;
    }

    /**
     * Supplies a ready registry. Takes precedence over {@link #occurrenceCodeSource}.
     *
     * @param occurrenceCodeRegistry the registry
     * @return this builder
     */
    public Builder occurrenceCodeRegistry(OccurrenceCodeRegistry occurrenceCodeRegistry) {
      this.occurrenceCodeRegistry = occurrenceCodeRegistry;
      return this;
    }

    /**
     * Sets where the occurrence code taxonomy is loaded from.
     *
     * <p>Optional. Defaults to the bundled SSW code set
     * ({@link ClasspathOccurrenceCodeSource}).
     *
     * @param occurrenceCodeSource the source
     * @return this builder
     */
    public Builder occurrenceCodeSource(OccurrenceCodeSource occurrenceCodeSource) {
      this.occurrenceCodeSource = occurrenceCodeSource;
      return this;
    }

    /**
     * Sets the automation rules.
     *
     * <p>Optional. Defaults to an empty {@link InMemoryRuleRepository}.
     *
     * @param ruleRepository the rules
     * @return this builder
     */
    public Builder ruleRepository(RuleRepository ruleRepository) {
      this.ruleRepository = ruleRepository;
      return this;
    }

    public Builder notificationSender(NotificationSender notificationSender) {
      this.notificationSender = notificationSender;
      return this;
    }

    /**
     * Sets the client used for webhook actions.
     *
     * <p>Optional. Defaults to {@link HttpWebhookClient}.
     *
     * @param webhookClient the client
     * @return this builder
     */
    public Builder webhookClient(WebhookClient webhookClient) {
      this.webhookClient = webhookClient;
      return this;
    }

    /**
     * Registers a payload extractor for a source. The {@code "ssw"} source is
     * preregistered with {@link SswPayloadExtractor}; other sources default to flat JSON.
     *
     * @param source    carrier integration identifier
     * @param extractor the extractor
     * @return this builder
     */
    public Builder extractor(String source, PayloadExtractor extractor) {
      this.extractors.put(Objects.requireNonNull(source, "source"),
          Objects.requireNonNull(extractor, "extractor"));
      return this;
    }

    public Builder timelineBuilder(TimelineBuilder timelineBuilder) {
      this.timelineBuilder = timelineBuilder;
      return this;
    }

    public Builder listener(TrackingListener listener) {
      this.listener = listener;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the timeout applied to each automation action.
     *
     * <p>Optional. Defaults to 10 seconds.
     *
     * @param actionTimeout per-action timeout
     * @return this builder
     */
    public Builder actionTimeout(Duration actionTimeout) {
      this.actionTimeout = actionTimeout;
      return this;
    }

    /**
     * Sets the number of dispatcher worker threads.
     *
     * <p>Optional. Defaults to {@code 4}.
     *
     * @param workerCount number of worker threads
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    public Builder hotQueueCapacity(int hotQueueCapacity) {
      this.hotQueueCapacity = hotQueueCapacity;
      return this;
    }

    public Builder coldQueueCapacity(int coldQueueCapacity) {
      this.coldQueueCapacity = coldQueueCapacity;
      return this;
    }

    /**
     * Sets the maximum number of attempts per automation invocation before marking DEAD.
     *
     * <p>Optional. Defaults to {@code 10}.
     *
     * @param maxAttempts maximum attempts
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets the backoff between automation attempts.
     *
     * <p>Optional. Defaults to exponential backoff from 200 ms up to one minute.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder pollIntervalMs(long pollIntervalMs) {
      this.pollIntervalMs = pollIntervalMs;
      return this;
    }

    public Builder pollBatchSize(int pollBatchSize) {
      this.pollBatchSize = pollBatchSize;
      return this;
    }

    /**
     * Sets how long fresh claims are left to the hot path before the poller picks them up.
     *
     * <p>Optional. Defaults to one second.
     *
     * @param pollSkipRecent grace period
     * @return this builder
     */
    public Builder pollSkipRecent(Duration pollSkipRecent) {
      this.pollSkipRecent = pollSkipRecent;
      return this;
    }

    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Sets how often a status version conflict is retried before giving up.
     *
     * <p>Optional. Defaults to {@code 5}.
     *
     * @param maxConflictRetries status version conflict retries
     * @return this builder
     */
    public Builder maxConflictRetries(int maxConflictRetries) {
      this.maxConflictRetries = maxConflictRetries;
      return this;
    }

    /**
     * Sets how long unresolved payloads keep being replayed before going to review.
     *
     * <p>Optional. Defaults to 24 hours.
     *
     * @param replayWindow the retry window
     * @return this builder
     */
    public Builder replayWindow(Duration replayWindow) {
      this.replayWindow = replayWindow;
      return this;
    }

    public Builder replayIntervalMs(long replayIntervalMs) {
      this.replayIntervalMs = replayIntervalMs;
      return this;
    }

    public Builder replayRetryPolicy(RetryPolicy replayRetryPolicy) {
      this.replayRetryPolicy = replayRetryPolicy;
      return this;
    }

    /**
     * Sets how often shipments flagged after a failed status write are reconciled.
     *
     * <p>Optional. Defaults to {@code 30000} ms.
     *
     * @param reconcileIntervalMs sweep interval in milliseconds
     * @return this builder
     */
    public Builder reconcileIntervalMs(long reconcileIntervalMs) {
      this.reconcileIntervalMs = reconcileIntervalMs;
      return this;
    }

    public Builder archiveCapacity(int archiveCapacity) {
      this.archiveCapacity = archiveCapacity;
      return this;
    }

    public Builder archiveMaxRetries(int archiveMaxRetries) {
      this.archiveMaxRetries = archiveMaxRetries;
      return this;
    }

    /**
     * Whether {@link #build()} starts the invocation poller, the replay schedule and the
     * reconcile sweep.
     *
     * <p>Optional. Defaults to {@code true}. With {@code false}, use
     * {@link TrackingEngine#pollInvocations()}, {@link TrackingEngine#replayUnresolved()} and
     * {@link TrackingEngine#reconcileFlagged()}.
     *
     * @param autoStart start schedules on build
     * @return this builder
     */
    public Builder autoStart(boolean autoStart) {
      this.autoStart = autoStart;
      return this;
    }

    /**
     * Builds the engine and, unless disabled, starts its schedules. If a component fails
     * to start, the ones already built are closed before rethrowing.
     *
     * @return a new {@link TrackingEngine}
     * @throws NullPointerException  if a required component is missing
     * @throws IllegalStateException if the occurrence codes cannot be loaded or the builder
     *                               was already used
     */
    public TrackingEngine build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(eventStore, "eventStore");
      Objects.requireNonNull(shipmentStore, "shipmentStore");
      Objects.requireNonNull(invocationStore, "invocationStore");
      Objects.requireNonNull(unresolvedStore, "unresolvedStore");
      if (ruleRepository == null) {
        ruleRepository = new InMemoryRuleRepository();
      }

      OccurrenceCodeRegistry registry = occurrenceCodeRegistry != null
          ? occurrenceCodeRegistry
          : new OccurrenceCodeRegistry(occurrenceCodeSource != null
              ? occurrenceCodeSource : new ClasspathOccurrenceCodeSource());

      ActionExecutor executor = ActionExecutor.builder()
          .notificationSender(notificationSender)
          .webhookClient(webhookClient != null ? webhookClient : new HttpWebhookClient())
          .actionTimeout(actionTimeout)
          .build();
      AutomationDispatcher dispatcher = null;
      InvocationPoller poller = null;
      ArchivalSink sink = null;
      try {
        AutomationDispatcher.Builder db = AutomationDispatcher.builder()
            .connectionProvider(connectionProvider)
            .invocationStore(invocationStore)
            .shipmentStore(shipmentStore)
            .ruleRepository(ruleRepository)
            .actionExecutor(executor)
            .workerCount(workerCount)
            .hotQueueCapacity(hotQueueCapacity)
            .coldQueueCapacity(coldQueueCapacity)
            .maxAttempts(maxAttempts)
            .drainTimeoutMs(drainTimeoutMs)
            .metrics(metrics);
        if (retryPolicy != null) {
          db.retryPolicy(retryPolicy);
        }
        dispatcher = db.build();
        poller = InvocationPoller.builder()
            .connectionProvider(connectionProvider)
            .invocationStore(invocationStore)
            .dispatcher(dispatcher)
            .intervalMs(pollIntervalMs)
            .batchSize(pollBatchSize)
            .skipRecent(pollSkipRecent)
            .metrics(metrics)
            .build();
        if (archiveStore != null) {
          sink = ArchivalSink.builder()
              .archiveStore(archiveStore)
              .capacity(archiveCapacity)
              .maxRetries(archiveMaxRetries)
              .drainTimeoutMs(drainTimeoutMs)
              .metrics(metrics)
              .build();
        }
        TrackingEngine engine = new TrackingEngine(this, registry, executor, dispatcher, poller, sink);
        if (autoStart) {
          try {
            poller.start();
            engine.replayer.start();
            engine.reconcileSweeper.start();
          } catch (RuntimeException e) {
            engine.close();
            throw e;
          }
        }
        return engine;
      } catch (RuntimeException e) {
        closeQuietly(sink);
        closeQuietly(poller);
        closeQuietly(dispatcher);
        closeQuietly(executor);
        throw e;
      }
    }

    private static void closeQuietly(AutoCloseable closeable) {
      if (closeable == null) {
        return;
      }
      try {
        closeable.close();
      } catch (Exception e) {
        logger.log(Level.FINE, "Close after failed build also failed", e);
      }
    }
  }
}
