package tracking.state;

import tracking.model.ReconcileRequest;
import tracking.spi.ConnectionProvider;
import tracking.spi.MetricsExporter;
import tracking.spi.ShipmentStore;
import tracking.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Re-derives the status of shipments whose events were stored but whose status write
 * failed afterwards.
 *
 * <p>{@link #request(String)} flags the shipment in the store. A scheduled sweep hands each
 * flagged shipment to the {@link Reconciler} and clears the flag once that succeeds; a
 * failing shipment stays flagged for the next sweep. A flag raised again while a sweep is
 * reconciling the shipment survives the clear.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class ReconcileSweeper implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ReconcileSweeper.class.getName());

  /** Re-derives and commits the status of one shipment. */
  @FunctionalInterface
  public interface Reconciler {
    void reconcile(String shipmentId);
  }

  private final ConnectionProvider connectionProvider;
  private final ShipmentStore shipmentStore;
  private final Reconciler reconciler;
  private final int batchSize;
  private final long intervalMs;
  private final MetricsExporter metrics;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> sweepTask;
  private volatile boolean closed;

  private ReconcileSweeper(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.shipmentStore = Objects.requireNonNull(builder.shipmentStore, "shipmentStore");
    this.reconciler = Objects.requireNonNull(builder.reconciler, "reconciler");
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    this.batchSize = builder.batchSize;
    this.intervalMs = builder.intervalMs;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("ReconcileSweeper has been closed");
    }
    if (sweepTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("tracking-reconcile-"));
    sweepTask = scheduler.scheduleWithFixedDelay(this::sweepSafely, intervalMs, intervalMs,
        TimeUnit.MILLISECONDS);
  }

  private void sweepSafely() {
    try {
      sweep();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Reconcile sweep failed", t);
    }
  }

  /**
   * Flags a shipment for re-derivation.
   *
   * @param shipmentId the shipment
   * @return {@code false} if the flag could not be written
   */
  public boolean request(String shipmentId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      if (shipmentStore.requestReconcile(conn, shipmentId, Instant.now()) == 0) {
        logger.log(Level.WARNING, "Cannot flag unknown shipment {0} for reconcile", shipmentId);
        return false;
      }
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to flag shipment " + shipmentId + " for reconcile", e);
      return false;
    }
    metrics.incrementReconcileRequested();
    logger.log(Level.WARNING, "Shipment {0} flagged for reconcile", shipmentId);
    return true;
  }

  /**
   * Runs one sweep over flagged shipments.
   *
   * @return number of shipments reconciled and unflagged
   */
  public int sweep() {
    if (closed) {
      return 0;
    }
    List<ReconcileRequest> requests;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      requests = shipmentStore.findReconcileRequests(conn, Instant.now(), batchSize);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to fetch shipments flagged for reconcile", e);
      return 0;
    }
    int completed = 0;
    for (ReconcileRequest request : requests) {
      try {
        reconciler.reconcile(request.shipmentId());
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Reconcile of shipment " + request.shipmentId()
            + " failed; it stays flagged", e);
        continue;
      }
      if (clear(request)) {
        completed++;
        metrics.incrementReconcileCompleted();
      }
    }
    return completed;
  }

  private boolean clear(ReconcileRequest request) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return shipmentStore.clearReconcileRequest(conn, request.shipmentId(), request.requestedAt()) == 1;
    } catch (SQLException | RuntimeException e) {
      // flag stays set; the next sweep reconciles the shipment again
      logger.log(Level.SEVERE, "Failed to clear reconcile flag of shipment " + request.shipmentId(), e);
      return false;
    }
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

  /** Builder for {@link ReconcileSweeper}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private ShipmentStore shipmentStore;
    private Reconciler reconciler;
    private int batchSize = 50;
    private long intervalMs = 30_000;
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
     * Sets the store holding the reconcile flags.
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

    /** <b>Required.</b> */
    public Builder reconciler(Reconciler reconciler) {
      this.reconciler = reconciler;
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the delay between sweeps.
     *
     * <p>Optional. Defaults to {@code 30000} ms. Must be &gt; 0.
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

    public ReconcileSweeper build() {
      return new ReconcileSweeper(this);
    }
  }
}
