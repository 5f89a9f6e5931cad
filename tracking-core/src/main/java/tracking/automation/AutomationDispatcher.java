package tracking.automation;

import tracking.dispatch.DefaultInFlightTracker;
import tracking.dispatch.ExponentialBackoffRetryPolicy;
import tracking.dispatch.InFlightTracker;
import tracking.dispatch.RetryPolicy;
import tracking.model.AutomationAction;
import tracking.model.AutomationInvocation;
import tracking.model.AutomationRule;
import tracking.model.Shipment;
import tracking.spi.ConnectionProvider;
import tracking.spi.InvocationStore;
import tracking.spi.MetricsExporter;
import tracking.spi.ShipmentStore;
import tracking.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executes claimed {@link AutomationInvocation}s off the ingestion path.
 *
 * <p>Invocations arrive via two paths: the <em>hot queue</em> (right after the transition
 * commits) and the <em>cold queue</em> ({@link InvocationPoller} fallback). Worker threads
 * drain both queues using a weighted 2:1 round-robin favoring the hot queue. An
 * {@link InFlightTracker} keeps the two paths from running the same invocation concurrently.
 *
 * <p>Every action of the rule is attempted in declared order. If all succeed the invocation
 * is marked DONE; if any fails the whole invocation is rescheduled with backoff, and after
 * {@code maxAttempts} it is marked DEAD. A rule that was removed or disabled since the claim
 * is marked DEAD without running anything.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} for graceful shutdown with a configurable drain timeout.
 */
public final class AutomationDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(AutomationDispatcher.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  private final BlockingQueue<AutomationInvocation> hotQueue;
  private final BlockingQueue<AutomationInvocation> coldQueue;
  private final ExecutorService workers; // null when workerCount is 0
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private final AtomicInteger pollCounter = new AtomicInteger(0);

  private final ConnectionProvider connectionProvider;
  private final InvocationStore invocationStore;
  private final ShipmentStore shipmentStore;
  private final RuleRepository ruleRepository;
  private final ActionExecutor actionExecutor;
  private final InFlightTracker inFlightTracker;
  private final RetryPolicy retryPolicy;
  private final int maxAttempts;
  private final MetricsExporter metrics;
  private final long drainTimeoutMs;

  private AutomationDispatcher(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.invocationStore = Objects.requireNonNull(builder.invocationStore, "invocationStore");
    this.shipmentStore = Objects.requireNonNull(builder.shipmentStore, "shipmentStore");
    this.ruleRepository = Objects.requireNonNull(builder.ruleRepository, "ruleRepository");
    this.actionExecutor = Objects.requireNonNull(builder.actionExecutor, "actionExecutor");
    this.inFlightTracker = builder.inFlightTracker != null
        ? builder.inFlightTracker : new DefaultInFlightTracker();
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(200, 60_000);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.drainTimeoutMs = builder.drainTimeoutMs;

    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (builder.workerCount < 0) {
      throw new IllegalArgumentException("workerCount must be >= 0");
    }
    if (builder.hotQueueCapacity <= 0 || builder.coldQueueCapacity <= 0) {
      throw new IllegalArgumentException("Queue capacities must be > 0");
    }
    this.maxAttempts = builder.maxAttempts;
    this.hotQueue = new ArrayBlockingQueue<>(builder.hotQueueCapacity);
    this.coldQueue = new ArrayBlockingQueue<>(builder.coldQueueCapacity);

    if (builder.workerCount > 0) {
      this.workers = Executors.newFixedThreadPool(builder.workerCount,
          new DaemonThreadFactory("tracking-dispatcher-"));
      for (int i = 0; i < builder.workerCount; i++) {
        workers.submit(this::workerLoop);
      }
    } else {
      // workerCount=0: nothing drains the queues; tests call dispatch() directly
      logger.warning("workerCount=0: no dispatch workers started; invocations will not be processed");
      this.workers = null;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Offers a freshly claimed invocation to the hot queue.
   *
   * @param invocation the invocation
   * @return {@code false} if the queue is full or the dispatcher is closing; the poller
   *     picks the invocation up later
   */
  public boolean enqueueHot(AutomationInvocation invocation) {
    if (!accepting.get()) return false;
    boolean enqueued = hotQueue.offer(invocation);
    metrics.recordQueueDepths(hotQueue.size(), coldQueue.size());
    return enqueued;
  }

  /**
   * Offers a polled invocation to the cold queue.
   *
   * @param invocation the invocation
   * @return {@code false} if the queue is full or the dispatcher is closing
   */
  public boolean enqueueCold(AutomationInvocation invocation) {
    if (!accepting.get()) return false;
    boolean enqueued = coldQueue.offer(invocation);
    metrics.recordQueueDepths(hotQueue.size(), coldQueue.size());
    return enqueued;
  }

  public int coldQueueRemainingCapacity() {
    return coldQueue.remainingCapacity();
  }

  private AutomationInvocation pollFairly() throws InterruptedException {
    int cycle = pollCounter.getAndIncrement();
    BlockingQueue<AutomationInvocation> primary;
    BlockingQueue<AutomationInvocation> secondary;
    // Mask sign bit to stay non-negative after int overflow
    if ((cycle & 0x7FFFFFFF) % 3 == 2) {
      primary = coldQueue;
      secondary = hotQueue;
    } else {
      primary = hotQueue;
      secondary = coldQueue;
    }
    AutomationInvocation invocation = primary.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
    if (invocation == null) {
      invocation = secondary.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
    }
    return invocation;
  }

  private void workerLoop() {
    while (!Thread.currentThread().isInterrupted()) {
      try {
        if (!running.get() && hotQueue.isEmpty() && coldQueue.isEmpty()) {
          break;
        }
        AutomationInvocation invocation = pollFairly();
        if (invocation == null) {
          if (!running.get()) break;
          continue;
        }
        dispatch(invocation);
        metrics.recordQueueDepths(hotQueue.size(), coldQueue.size());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Dispatcher loop error", t);
      }
    }
  }

  /**
   * Executes one invocation on the calling thread. Used by the workers; public so that
   * tests and single-threaded embeddings can drive dispatch synchronously.
   *
   * <p>The stored row is re-read first and only a PENDING or RETRY invocation runs, so a
   * queued copy that another worker already completed is dropped.
   *
   * @param queued the invocation as it was queued
   */
  public void dispatch(AutomationInvocation queued) {
    String invocationId = queued.id();
    if (!inFlightTracker.tryAcquire(invocationId)) {
      return;
    }
    try {
      AutomationInvocation invocation = reloadRunnable(invocationId);
      if (invocation == null) {
        return;
      }
      Optional<AutomationRule> rule = ruleRepository.findById(invocation.ruleId());
      if (rule.isEmpty() || !rule.get().enabled()) {
        markDead(invocationId, "Rule " + invocation.ruleId() + " is missing or disabled");
        metrics.incrementDispatchDead();
        logger.log(Level.WARNING, "Invocation {0} abandoned: rule {1} is missing or disabled",
            new Object[] {invocationId, invocation.ruleId()});
        return;
      }

      List<ActionFailureException> failures = runActions(rule.get(), context(invocation));
      if (failures.isEmpty()) {
        markDone(invocationId);
        metrics.incrementDispatchSuccess();
      } else {
        handleFailure(invocation, failures);
      }
    } finally {
      inFlightTracker.release(invocationId);
    }
  }

  private AutomationInvocation reloadRunnable(String invocationId) {
    Optional<AutomationInvocation> current;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      current = invocationStore.findById(conn, invocationId);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.WARNING, "Failed to reload invocation " + invocationId + "; leaving it for the poller", e);
      return null;
    }
    if (current.isEmpty()) {
      logger.log(Level.WARNING, "Invocation {0} no longer exists; skipping", invocationId);
      return null;
    }
    AutomationInvocation invocation = current.get();
    if (!invocation.status().isRunnable()) {
      logger.log(Level.FINE, "Invocation {0} is already {1}; skipping",
          new Object[] {invocationId, invocation.status()});
      return null;
    }
    return invocation;
  }

  private List<ActionFailureException> runActions(AutomationRule rule, TransitionContext context) {
    List<ActionFailureException> failures = new ArrayList<>();
    for (AutomationAction action : rule.actions()) {
      try {
        actionExecutor.execute(action, context);
      } catch (ActionFailureException e) {
        metrics.incrementActionFailure();
        logger.log(Level.WARNING, "Action " + action.kind() + " of rule " + rule.id()
            + " failed for shipment " + context.shipmentId(), e);
        failures.add(e);
      }
    }
    return failures;
  }

  private TransitionContext context(AutomationInvocation invocation) {
    Shipment shipment = loadShipment(invocation.shipmentId());
    String trackingCode = shipment != null ? shipment.trackingCode() : null;
    Map<String, String> attributes = shipment != null ? shipment.attributes() : Map.of();
    return new TransitionContext(invocation.id(), invocation.shipmentId(), trackingCode,
        invocation.ruleId(), invocation.previousStatus(), invocation.newStatus(),
        invocation.statusVersion(), invocation.triggerEventId(), attributes);
  }

  private Shipment loadShipment(String shipmentId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return shipmentStore.findById(conn, shipmentId).orElse(null);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.WARNING, "Failed to load shipment " + shipmentId + " for dispatch", e);
      return null;
    }
  }

  private void handleFailure(AutomationInvocation invocation, List<ActionFailureException> failures) {
    String invocationId = invocation.id();
    String error = describe(failures);
    int nextAttempt = invocation.attempts() + 1;
    if (nextAttempt >= maxAttempts) {
      markDead(invocationId, error);
      metrics.incrementDispatchDead();
      logger.log(Level.SEVERE, "Invocation moved to DEAD after max attempts: " + invocationId
          + " (" + error + ")");
    } else {
      markRetry(invocationId, retryPolicy.nextAttemptAt(Instant.now(), nextAttempt), error);
      metrics.incrementDispatchFailure();
    }
  }

  private static String describe(List<ActionFailureException> failures) {
    StringBuilder sb = new StringBuilder();
    for (ActionFailureException failure : failures) {
      if (sb.length() > 0) {
        sb.append("; ");
      }
      sb.append(failure.kind()).append(": ").append(failure.getMessage());
    }
    return sb.toString();
  }

  private void markDone(String invocationId) {
    withConnection("mark DONE", invocationId,
        conn -> invocationStore.markDone(conn, invocationId, Instant.now()));
  }

  private void markRetry(String invocationId, Instant nextAt, String error) {
    withConnection("mark RETRY", invocationId,
        conn -> invocationStore.markRetry(conn, invocationId, nextAt, error));
  }

  private void markDead(String invocationId, String error) {
    withConnection("mark DEAD", invocationId,
        conn -> invocationStore.markDead(conn, invocationId, error));
  }

  private void withConnection(String action, String invocationId, SqlAction op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      op.execute(conn);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to " + action + " for invocationId=" + invocationId, e);
    }
  }

  @FunctionalInterface
  private interface SqlAction {
    void execute(Connection conn) throws SQLException;
  }

  /**
   * Initiates graceful shutdown: stops accepting new invocations, drains the queues within
   * the configured drain timeout, then shuts down worker threads. The action executor is
   * not closed here; it belongs to whoever built it.
   */
  @Override
  public void close() {
    accepting.set(false);
    running.set(false);
    if (workers == null) {
      return;
    }
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown. "
            + "Hot remaining: " + hotQueue.size() + ", Cold remaining: " + coldQueue.size());
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link AutomationDispatcher}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private InvocationStore invocationStore;
    private ShipmentStore shipmentStore;
    private RuleRepository ruleRepository;
    private ActionExecutor actionExecutor;
    private InFlightTracker inFlightTracker;
    private RetryPolicy retryPolicy;
    private int maxAttempts = 10;
    private int workerCount = 4;
    private int hotQueueCapacity = 1000;
    private int coldQueueCapacity = 1000;
    private MetricsExporter metrics;
    private long drainTimeoutMs = 5000;

    private Builder() {}

    /**
     * Sets the connection provider used to load shipments and record outcomes.
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

    /**
     * Sets the store used to mark invocations DONE, RETRY or DEAD.
     *
     * <p><b>Required.</b>
     *
     * @param invocationStore the persistence backend
     * @return this builder
     */
    public Builder invocationStore(InvocationStore invocationStore) {
      this.invocationStore = invocationStore;
      return this;
    }

    /**
     * Sets the shipment store that supplies tracking code and attributes to actions.
     *
     * <p><b>Required.</b>
     *
     * @param shipmentStore the shipment store
     * @return this builder
     */
    public Builder shipmentStore(ShipmentStore shipmentStore) {
      this.shipmentStore = shipmentStore;
      return this;
    }

    /**
     * Sets the rule source consulted when an invocation runs.
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
     * Sets the executor that runs individual actions.
     *
     * <p><b>Required.</b>
     *
     * @param actionExecutor the action executor
     * @return this builder
     */
    public Builder actionExecutor(ActionExecutor actionExecutor) {
      this.actionExecutor = actionExecutor;
      return this;
    }

    /**
     * Sets a custom in-flight tracker.
     *
     * <p>Optional. Defaults to {@link DefaultInFlightTracker}.
     *
     * @param inFlightTracker the tracker implementation
     * @return this builder
     */
    public Builder inFlightTracker(InFlightTracker inFlightTracker) {
      this.inFlightTracker = inFlightTracker;
      return this;
    }

    /**
     * Sets the retry policy.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with
     * {@code baseDelayMs=200} and {@code maxDelayMs=60000}.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the maximum number of attempts before an invocation is marked DEAD.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &ge; 1.
     *
     * @param maxAttempts maximum attempts per invocation
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets the number of worker threads.
     *
     * <p>Optional. Defaults to {@code 4}. Setting to {@code 0} disables processing
     * (useful for testing only).
     *
     * @param workerCount number of dispatch worker threads
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets the bounded capacity of the hot queue.
     *
     * <p>Optional. Defaults to {@code 1000}.
     *
     * @param hotQueueCapacity maximum number of invocations in the hot queue
     * @return this builder
     */
    public Builder hotQueueCapacity(int hotQueueCapacity) {
      this.hotQueueCapacity = hotQueueCapacity;
      return this;
    }

    /**
     * Sets the bounded capacity of the cold queue.
     *
     * <p>Optional. Defaults to {@code 1000}.
     *
     * @param coldQueueCapacity maximum number of invocations in the cold queue
     * @return this builder
     */
    public Builder coldQueueCapacity(int coldQueueCapacity) {
      this.coldQueueCapacity = coldQueueCapacity;
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
     * Sets the maximum time in milliseconds to wait for queued invocations during shutdown.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Builds and starts the dispatcher. Worker threads begin draining queues immediately.
     *
     * @return a new {@link AutomationDispatcher}
     */
    public AutomationDispatcher build() {
      return new AutomationDispatcher(this);
    }
  }
}
