package tracking.ingest;

import tracking.dispatch.ExponentialBackoffRetryPolicy;
import tracking.dispatch.RetryPolicy;
import tracking.model.UnresolvedEvent;
import tracking.spi.ConnectionProvider;
import tracking.spi.MetricsExporter;
import tracking.spi.UnresolvedEventStore;
import tracking.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Replays payloads whose shipment could not be resolved when they arrived.
 *
 * <p>Two triggers: a scheduled sweep over due PENDING entries, with exponential backoff
 * between attempts, and {@link #replayFor(Collection)} called when a shipment is
 * registered. Entries older than the retry window (measured from their original receipt)
 * move to REVIEW instead of being retried again.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class UnresolvedEventReplayer implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(UnresolvedEventReplayer.class.getName());

  private final ConnectionProvider connectionProvider;
  private final UnresolvedEventStore unresolvedStore;
  private final ReplayHandler handler;
  private final RetryPolicy retryPolicy;
  private final Duration retryWindow;
  private final int batchSize;
  private final long intervalMs;
  private final MetricsExporter metrics;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> sweepTask;
  private volatile boolean closed;

  private UnresolvedEventReplayer(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.unresolvedStore = Objects.requireNonNull(builder.unresolvedStore, "unresolvedStore");
    this.handler = Objects.requireNonNull(builder.handler, "handler");
    this.retryWindow = Objects.requireNonNull(builder.retryWindow, "retryWindow");
    if (retryWindow.isNegative() || retryWindow.isZero()) {
      throw new IllegalArgumentException("retryWindow must be > 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(30_000, 3_600_000);
    this.batchSize = builder.batchSize;
    this.intervalMs = builder.intervalMs;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("UnresolvedEventReplayer has been closed");
    }
    if (sweepTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("tracking-replayer-"));
    sweepTask = scheduler.scheduleWithFixedDelay(this::sweepSafely, intervalMs, intervalMs,
        TimeUnit.MILLISECONDS);
  }

  private void sweepSafely() {
    try {
      replayDue();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Replay sweep failed", t);
    }
  }

  /**
   * Runs one sweep over due PENDING entries.
   *
   * @return number of entries resolved in this sweep
   */
  public int replayDue() {
    if (closed) {
      return 0;
    }
    Instant now = Instant.now();
    List<UnresolvedEvent> due;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      due = unresolvedStore.findDue(conn, now, batchSize);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to fetch due unresolved events", e);
      return 0;
    }
    int resolved = 0;
    for (UnresolvedEvent entry : due) {
      if (process(entry, now, true)) {
        resolved++;
      }
    }
    return resolved;
  }

  /**
   * Replays PENDING entries waiting for any of the given references, regardless of their
   * backoff schedule. Entries that still do not resolve keep their schedule.
   *
   * @param hints tracking codes or shipment ids of a newly registered shipment
   * @return number of entries resolved
   */
  public int replayFor(Collection<String> hints) {
    List<UnresolvedEvent> waiting;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      waiting = unresolvedStore.findPendingByHints(conn, hints);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to fetch unresolved events for " + hints, e);
      return 0;
    }
    int resolved = 0;
    Instant now = Instant.now();
    for (UnresolvedEvent entry : waiting) {
      if (process(entry, now, false)) {
        resolved++;
      }
    }
    return resolved;
  }

  private boolean process(UnresolvedEvent entry, Instant now, boolean scheduled) {
    ReplayHandler.Outcome outcome;
    try {
      outcome = handler.replay(entry);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Replay of unresolved event " + entry.id() + " failed", e);
      if (scheduled) {
        reschedule(entry, now, "Replay failed: " + e);
      }
      return false;
    }
    switch (outcome) {
      case RESOLVED -> {
        update("mark RESOLVED", entry.id(), conn -> unresolvedStore.markResolved(conn, entry.id()));
        metrics.incrementReplayResolved();
        logger.log(Level.FINE, "Unresolved event {0} attached on replay", entry.id());
        return true;
      }
      case REJECTED -> {
        update("mark REVIEW", entry.id(),
            conn -> unresolvedStore.markReview(conn, entry.id(), "Payload rejected on replay"));
        return false;
      }
      default -> {
        if (scheduled) {
          reschedule(entry, now, "No shipment for " + entry.shipmentHint());
        }
        return false;
      }
    }
  }

  /** Backs the entry off, or moves it to REVIEW once it has outlived the retry window. */
  private void reschedule(UnresolvedEvent entry, Instant now, String error) {
    if (Duration.between(entry.receivedAt(), now).compareTo(retryWindow) >= 0) {
      update("mark REVIEW", entry.id(), conn -> unresolvedStore.markReview(conn, entry.id(),
          error + " (gave up after " + retryWindow + ")"));
      metrics.incrementReplayExpired();
      logger.log(Level.WARNING, "Unresolved event {0} moved to review after {1}",
          new Object[] {entry.id(), retryWindow});
    } else {
      Instant nextAt = retryPolicy.nextAttemptAt(now, entry.attempts() + 1);
      update("mark RETRY", entry.id(), conn -> unresolvedStore.markRetry(conn, entry.id(), nextAt, error));
    }
  }

  private void update(String action, String id, SqlAction op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      op.execute(conn);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to " + action + " for unresolved event " + id, e);
    }
  }

  @FunctionalInterface
  private interface SqlAction {
    void execute(Connection conn) throws SQLException;
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (sweepTask != null) {
      sweepTask.cancel(false);
      sweepTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link UnresolvedEventReplayer}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private UnresolvedEventStore unresolvedStore;
    private ReplayHandler handler;
    private RetryPolicy retryPolicy;
    private Duration retryWindow = Duration.ofHours(24);
    private int batchSize = 100;
    private long intervalMs = 60_000;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the connection provider.
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
     * Sets the store holding parked payloads.
     *
     * <p><b>Required.</b>
     *
     * @param unresolvedStore the store
     * @return this builder
     */
    public Builder unresolvedStore(UnresolvedEventStore unresolvedStore) {
      this.unresolvedStore = unresolvedStore;
      return this;
    }

    /**
     * Sets the callback that re-runs normalization and ingestion.
     *
     * <p><b>Required.</b>
     *
     * @param handler the replay handler
     * @return this builder
     */
    public Builder handler(ReplayHandler handler) {
      this.handler = handler;
      return this;
    }

    /**
     * Sets the backoff between scheduled replay attempts.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} from 30 seconds up to
     * one hour.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets how long after receipt an unresolved payload keeps being retried.
     *
     * <p>Optional. Defaults to 24 hours.
     *
     * @param retryWindow the window
     * @return this builder
     */
    public Builder retryWindow(Duration retryWindow) {
      this.retryWindow = retryWindow;
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the sweep interval.
     *
     * <p>Optional. Defaults to one minute.
     *
     * @param intervalMs sweep interval in milliseconds
     * @return this builder
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public UnresolvedEventReplayer build() {
      return new UnresolvedEventReplayer(this);
    }
  }
}
