package tracking.spi;

import tracking.model.CanonicalStatus;
import tracking.model.ReconcileRequest;
import tracking.model.Shipment;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for shipments.
 *
 * @see tracking.jdbc.store.JdbcShipmentStore
 */
public interface ShipmentStore {

    /**
     * Inserts a new shipment.
     *
     * @return {@code false} if the id or tracking code is already taken
     */
    boolean insert(Connection conn, Shipment shipment);

    Optional<Shipment> findById(Connection conn, String shipmentId);

    Optional<Shipment> findByTrackingCode(Connection conn, String trackingCode);

    /**
     * Writes a derived status if, and only if, the stored version still equals
     * {@code expectedVersion}. The stored version becomes {@code expectedVersion + 1}.
     *
     * @param conn            the JDBC connection (inside the transition transaction)
     * @param shipmentId      the shipment
     * @param expectedVersion version the status was derived from
     * @param newStatus       the derived status
     * @param lastEventId     event that triggered the change, may be {@code null}
     * @param updatedAt       change time
     * @return {@code true} if the row was updated, {@code false} on a version mismatch
     */
    boolean compareAndSetStatus(Connection conn, String shipmentId, long expectedVersion,
        CanonicalStatus newStatus, String lastEventId, Instant updatedAt);

    /**
     * Flags a shipment whose status could not be re-derived after one of its events was
     * stored. A later request overwrites an earlier one.
     *
     * @return number of rows updated, 0 if the shipment does not exist
     */
    int requestReconcile(Connection conn, String shipmentId, Instant requestedAt);

    /**
     * Returns flagged shipments requested at or before {@code requestedBefore}, oldest first.
     */
    List<ReconcileRequest> findReconcileRequests(Connection conn, Instant requestedBefore, int limit);

    /**
     * Clears the flag unless it was raised again after {@code requestedAt}.
     *
     * @return number of rows updated
     */
    int clearReconcileRequest(Connection conn, String shipmentId, Instant requestedAt);
}
