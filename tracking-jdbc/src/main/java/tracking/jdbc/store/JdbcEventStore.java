package tracking.jdbc.store;

import tracking.jdbc.JdbcTemplate;
import tracking.jdbc.TableNames;
import tracking.jdbc.spi.Dialect;
import tracking.model.CanonicalStatus;
import tracking.model.Severity;
import tracking.model.TrackingEvent;
import tracking.spi.EventStore;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * JDBC {@link EventStore}. Deduplication rests on the unique constraint over
 * {@code dedup_key}; no prior read is made.
 */
public final class JdbcEventStore extends AbstractJdbcStore implements EventStore {
  private static final String COLUMNS = "id, shipment_id, occurrence_code, canonical_status, severity, "
      + "terminal, source, carrier_event_id, occurred_at, received_at, occurred_at_estimated, "
      + "dedup_key, raw_payload, needs_review";

  private static final JdbcTemplate.RowMapper<TrackingEvent> ROW_MAPPER = rs -> new TrackingEvent(
      rs.getString("id"),
      rs.getString("shipment_id"),
      rs.getString("occurrence_code"),
      CanonicalStatus.valueOf(rs.getString("canonical_status")),
      Severity.valueOf(rs.getString("severity")),
      rs.getBoolean("terminal"),
      rs.getString("source"),
      rs.getString("carrier_event_id"),
      JdbcTemplate.instant(rs, "occurred_at"),
      JdbcTemplate.instant(rs, "received_at"),
      rs.getBoolean("occurred_at_estimated"),
      rs.getString("dedup_key"),
      rs.getString("raw_payload"),
      rs.getBoolean("needs_review"));

  private final String insertSql;

  public JdbcEventStore(Dialect dialect) {
    this(dialect, TableNames.EVENTS);
  }

  public JdbcEventStore(Dialect dialect, String tableName) {
    super(dialect, tableName);
    this.insertSql = dialect.insertIgnoringDuplicatesSql(tableName(), COLUMNS, 14);
  }

  @Override
  public boolean insertIfAbsent(Connection conn, TrackingEvent event) {
    return JdbcTemplate.updateIgnoringDuplicates(conn, insertSql,
        event.id(), event.shipmentId(), event.occurrenceCode(), event.canonicalStatus().name(),
        event.severity().name(), event.terminal(), event.source(), event.carrierEventId(),
        event.occurredAt(), event.receivedAt(), event.occurredAtEstimated(), event.dedupKey(),
        event.rawPayload(), event.needsReview()) == 1;
  }

  @Override
  public List<TrackingEvent> findByShipment(Connection conn, String shipmentId) {
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE shipment_id=?",
        ROW_MAPPER, shipmentId);
  }

  @Override
  public Optional<TrackingEvent> findById(Connection conn, String eventId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE id=?",
        ROW_MAPPER, eventId);
  }

  @Override
  public List<TrackingEvent> findNeedingReview(Connection conn, int limit) {
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName()
            + " WHERE needs_review=? ORDER BY received_at, id LIMIT ?",
        ROW_MAPPER, Boolean.TRUE, limit);
  }
}
