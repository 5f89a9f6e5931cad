package tracking.spi;

import tracking.model.TrackingEvent;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for tracking events. Rows are append-only.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries.
 *
 * @see tracking.jdbc.store.JdbcEventStore
 */
public interface EventStore {

    /**
     * Inserts the event unless another event with the same dedup key exists. Must rely on a
     * storage-level unique constraint, not on a prior read.
     *
     * @param conn  the JDBC connection
     * @param event the normalized event
     * @return {@code true} if inserted, {@code false} if the dedup key was already present
     */
    boolean insertIfAbsent(Connection conn, TrackingEvent event);

    /**
     * Returns every event of a shipment, in no particular order.
     */
    List<TrackingEvent> findByShipment(Connection conn, String shipmentId);

    Optional<TrackingEvent> findById(Connection conn, String eventId);

    /**
     * Returns events flagged for review (unknown occurrence codes), oldest first.
     */
    List<TrackingEvent> findNeedingReview(Connection conn, int limit);
}
