package tracking.automation;

import tracking.model.AutomationInvocation;
import tracking.spi.ConnectionProvider;
import tracking.spi.InvocationStore;
import tracking.spi.MetricsExporter;
import tracking.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
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
 * Scheduled scanner that feeds due PENDING and RETRY invocations to the dispatcher's cold
 * queue. Covers invocations dropped from the hot queue, retries, and claims left behind by
 * a crash between commit and hot enqueue.
 *
 * <p>This class is thread-safe. The {@link #start()} and {@link #close()} methods are
 * synchronized to prevent concurrent lifecycle transitions.
 */
public final class InvocationPoller implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(InvocationPoller.class.getName());

    private final ConnectionProvider connectionProvider;
    private final InvocationStore invocationStore;
    private final AutomationDispatcher dispatcher;
    private final Duration skipRecent;
    private final int batchSize;
    private final long intervalMs;
    private final MetricsExporter metrics;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pollTask;
    private volatile boolean closed;

    private InvocationPoller(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.invocationStore = Objects.requireNonNull(builder.invocationStore, "invocationStore");
        this.dispatcher = Objects.requireNonNull(builder.dispatcher, "dispatcher");

        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        if (builder.skipRecent != null && builder.skipRecent.isNegative()) {
            throw new IllegalArgumentException("skipRecent must be >= 0");
        }
        this.skipRecent = builder.skipRecent == null ? Duration.ZERO : builder.skipRecent;
        this.batchSize = builder.batchSize;
        this.intervalMs = builder.intervalMs;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the scheduled polling loop. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("InvocationPoller has been closed");
        }
        if (pollTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("tracking-poller-"));
        pollTask = scheduler.scheduleWithFixedDelay(this::poll, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Executes a single poll cycle. Called by the scheduler; may also be invoked directly.
     */
    public void poll() {
        if (closed) {
            return;
        }
        try {
            int capacity = dispatcher.coldQueueRemainingCapacity();
            if (capacity <= 0) {
                return;
            }
            Instant now = Instant.now();
            List<AutomationInvocation> rows = fetch(now, Math.min(batchSize, capacity));
            if (rows == null) {
                return; // fetch failed, keep the last lag reading
            }
            if (rows.isEmpty()) {
                metrics.recordOldestLagMs(0);
                return;
            }
            // rows are oldest-first
            long lagMs = Duration.between(rows.get(0).createdAt(), now).toMillis();
            metrics.recordOldestLagMs(Math.max(0L, lagMs));
            for (AutomationInvocation row : rows) {
                if (!dispatcher.enqueueCold(row)) {
                    break; // cold queue full
                }
                metrics.incrementColdEnqueued();
            }
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Poll cycle failed", t);
        }
    }

    private List<AutomationInvocation> fetch(Instant now, int limit) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return invocationStore.pollPending(conn, now, skipRecent, limit);
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to fetch pending invocations", e);
            return null;
        }
    }

    /**
     * Cancels the polling schedule and shuts down the scheduler thread.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
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

    /**
     * Builder for {@link InvocationPoller}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private InvocationStore invocationStore;
        private AutomationDispatcher dispatcher;
        private Duration skipRecent;
        private int batchSize = 50;
        private long intervalMs = 5000;
        private MetricsExporter metrics;

        private Builder() {
        }

        /**
         * Sets the connection provider used for polling.
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
         * Sets the store queried for due invocations.
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
         * Sets the dispatcher whose cold queue receives polled invocations.
         *
         * <p><b>Required.</b>
         *
         * @param dispatcher the dispatcher
         * @return this builder
         */
        public Builder dispatcher(AutomationDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        /**
         * Sets a grace period that leaves freshly claimed invocations to the hot path.
         *
         * <p>Optional. Defaults to {@link Duration#ZERO}.
         *
         * @param skipRecent duration to skip recent invocations
         * @return this builder
         */
        public Builder skipRecent(Duration skipRecent) {
            this.skipRecent = skipRecent;
            return this;
        }

        /**
         * Sets the maximum number of invocations fetched per cycle.
         *
         * <p>Optional. Defaults to {@code 50}. Must be &gt; 0.
         *
         * @param batchSize max invocations per poll
         * @return this builder
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Sets the polling interval.
         *
         * <p>Optional. Defaults to {@code 5000} ms. Must be &gt; 0.
         *
         * @param intervalMs polling interval in milliseconds
         * @return this builder
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        /**
         * Sets the metrics exporter for lag and cold-enqueue counters.
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

        public InvocationPoller build() {
            return new InvocationPoller(this);
        }
    }
}
