package tracking.jdbc.store;

import tracking.jdbc.JdbcTemplate;
import tracking.jdbc.TableNames;
import tracking.jdbc.spi.Dialect;
import tracking.model.CanonicalStatus;
import tracking.model.ReconcileRequest;
import tracking.model.Shipment;
import tracking.spi.ShipmentStore;
import tracking.util.JsonCodec;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link ShipmentStore}. Status writes are a single {@code UPDATE} guarded by
 * {@code status_version}; attributes are stored as a flat JSON object. A non-null
 * {@code reconcile_requested_at} flags a shipment whose status still has to be re-derived.
 */
public final class JdbcShipmentStore extends AbstractJdbcStore implements ShipmentStore {
  private static final String COLUMNS = "id, tracking_code, carrier, current_status, status_version, "
      + "last_event_id, attributes, created_at, updated_at";

  private final JsonCodec jsonCodec;
  private final JdbcTemplate.RowMapper<Shipment> rowMapper;
  private final String insertSql;

  public JdbcShipmentStore(Dialect dialect) {
    this(dialect, TableNames.SHIPMENTS, JsonCodec.getDefault());
  }

  public JdbcShipmentStore(Dialect dialect, String tableName, JsonCodec jsonCodec) {
    super(dialect, tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.insertSql = dialect.insertIgnoringDuplicatesSql(tableName(), COLUMNS, 9);
    this.rowMapper = rs -> new Shipment(
        rs.getString("id"),
        rs.getString("tracking_code"),
        rs.getString("carrier"),
        CanonicalStatus.valueOf(rs.getString("current_status")),
        rs.getLong("status_version"),
        rs.getString("last_event_id"),
        this.jsonCodec.parseObject(rs.getString("attributes")),
        JdbcTemplate.instant(rs, "created_at"),
        JdbcTemplate.instant(rs, "updated_at"));
  }

  @Override
  public boolean insert(Connection conn, Shipment shipment) {
    return JdbcTemplate.updateIgnoringDuplicates(conn, insertSql,
        shipment.id(), shipment.trackingCode(), shipment.carrier(), shipment.currentStatus().name(),
        shipment.currentStatusVersion(), shipment.lastEventId(), jsonCodec.toJson(shipment.attributes()),
        shipment.createdAt(), shipment.updatedAt()) == 1;
  }

  @Override
  public Optional<Shipment> findById(Connection conn, String shipmentId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE id=?", rowMapper, shipmentId);
  }

  @Override
  public Optional<Shipment> findByTrackingCode(Connection conn, String trackingCode) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE tracking_code=?", rowMapper, trackingCode);
  }

  @Override
  public boolean compareAndSetStatus(Connection conn, String shipmentId, long expectedVersion,
      CanonicalStatus newStatus, String lastEventId, Instant updatedAt) {
    String sql = "UPDATE " + tableName()
        + " SET current_status=?, status_version=status_version+1, last_event_id=?, updated_at=?"
        + " WHERE id=? AND status_version=?";
    return JdbcTemplate.update(conn, sql,
        newStatus.name(), lastEventId, updatedAt, shipmentId, expectedVersion) == 1;
  }

  @Override
  public int requestReconcile(Connection conn, String shipmentId, Instant requestedAt) {
    return JdbcTemplate.update(conn,
        "UPDATE " + tableName() + " SET reconcile_requested_at=? WHERE id=?", requestedAt, shipmentId);
  }

  @Override
  public List<ReconcileRequest> findReconcileRequests(Connection conn, Instant requestedBefore, int limit) {
    String sql = "SELECT id, reconcile_requested_at FROM " + tableName()
        + " WHERE reconcile_requested_at IS NOT NULL AND reconcile_requested_at <= ?"
        + " ORDER BY reconcile_requested_at LIMIT ?";
    return JdbcTemplate.query(conn, sql,
        rs -> new ReconcileRequest(rs.getString("id"), JdbcTemplate.instant(rs, "reconcile_requested_at")),
        requestedBefore, limit);
  }

  @Override
  public int clearReconcileRequest(Connection conn, String shipmentId, Instant requestedAt) {
    return JdbcTemplate.update(conn, "UPDATE " + tableName()
        + " SET reconcile_requested_at=NULL WHERE id=? AND reconcile_requested_at <= ?", shipmentId, requestedAt);
  }
}
