package tracking.ingest;

import tracking.TrackingStoreException;
import tracking.model.TrackingEvent;
import tracking.model.UnresolvedEvent;
import tracking.model.UnresolvedStatus;
import tracking.spi.ConnectionProvider;
import tracking.spi.EventStore;
import tracking.spi.UnresolvedEventStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Convenience facade over carrier data that needs human attention: payloads in REVIEW
 * (expired unresolved or malformed) and events stored with an unknown occurrence code.
 *
 * <p>Manages connection lifecycle internally using a {@link ConnectionProvider}.
 *
 * @see UnresolvedEventStore#findByStatus
 * @see UnresolvedEventStore#requeue
 * @see EventStore#findNeedingReview
 */
public final class ReviewQueue {
    private final ConnectionProvider connectionProvider;
    private final UnresolvedEventStore unresolvedStore;
    private final EventStore eventStore;

    public ReviewQueue(ConnectionProvider connectionProvider, UnresolvedEventStore unresolvedStore,
            EventStore eventStore) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.unresolvedStore = Objects.requireNonNull(unresolvedStore, "unresolvedStore");
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
    }

    /**
     * Lists payloads in REVIEW, oldest first.
     *
     * @param limit maximum number of entries to return
     * @return review entries
     */
    public List<UnresolvedEvent> list(int limit) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return unresolvedStore.findByStatus(conn, UnresolvedStatus.REVIEW, limit);
        } catch (SQLException e) {
            throw new TrackingStoreException("Failed to list review entries", e);
        }
    }

    public int count() {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return unresolvedStore.countByStatus(conn, UnresolvedStatus.REVIEW);
        } catch (SQLException e) {
            throw new TrackingStoreException("Failed to count review entries", e);
        }
    }

    /**
     * Sends a REVIEW entry back to replay with a fresh retry window.
     *
     * @param id the entry id
     * @return {@code true} if requeued, {@code false} if not found or not in REVIEW
     */
    public boolean requeue(String id) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return unresolvedStore.requeue(conn, id, Instant.now()) > 0;
        } catch (SQLException e) {
            throw new TrackingStoreException("Failed to requeue review entry: " + id, e);
        }
    }

    /**
     * Requeues every REVIEW entry, processing in batches.
     *
     * @param batchSize number of entries per batch
     * @return total number requeued
     */
    public int requeueAll(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        int total = 0;
        List<UnresolvedEvent> batch;
        do {
            int requeued = 0;
            try (Connection conn = connectionProvider.getConnection()) {
                conn.setAutoCommit(true);
                batch = unresolvedStore.findByStatus(conn, UnresolvedStatus.REVIEW, batchSize);
                Instant now = Instant.now();
                for (UnresolvedEvent entry : batch) {
                    if (unresolvedStore.requeue(conn, entry.id(), now) > 0) {
                        requeued++;
                    }
                }
            } catch (SQLException e) {
                throw new TrackingStoreException("Failed to requeue review batch; requeued "
                        + total + " so far", e);
            }
            total += requeued;
            if (!batch.isEmpty() && requeued == 0) {
                break; // nothing moved; avoid spinning on the same rows
            }
        } while (batch.size() >= batchSize);
        return total;
    }

    /**
     * Lists events stored with an occurrence code the registry did not know.
     *
     * @param limit maximum number of events to return
     * @return unclassified events, oldest first
     */
    public List<TrackingEvent> unclassified(int limit) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return eventStore.findNeedingReview(conn, limit);
        } catch (SQLException e) {
            throw new TrackingStoreException("Failed to list unclassified events", e);
        }
    }
}
