package tracking.jdbc.store;

import tracking.jdbc.JdbcTemplate;
import tracking.jdbc.TableNames;
import tracking.jdbc.spi.Dialect;
import tracking.model.UnresolvedEvent;
import tracking.model.UnresolvedStatus;
import tracking.spi.UnresolvedEventStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * JDBC {@link UnresolvedEventStore}.
 */
public final class JdbcUnresolvedEventStore extends AbstractJdbcStore implements UnresolvedEventStore {
  private static final String COLUMNS = "id, source, shipment_hint, raw_payload, reason, received_at, "
      + "status, attempts, next_attempt_at, last_error";

  private static final int PENDING = UnresolvedStatus.PENDING.code();

  private static final JdbcTemplate.RowMapper<UnresolvedEvent> ROW_MAPPER = rs -> new UnresolvedEvent(
      rs.getString("id"),
      rs.getString("source"),
      rs.getString("shipment_hint"),
      rs.getString("raw_payload"),
      rs.getString("reason"),
      JdbcTemplate.instant(rs, "received_at"),
      UnresolvedStatus.fromCode(rs.getInt("status")),
      rs.getInt("attempts"),
      JdbcTemplate.instant(rs, "next_attempt_at"),
      rs.getString("last_error"));

  public JdbcUnresolvedEventStore(Dialect dialect) {
    this(dialect, TableNames.UNRESOLVED);
  }

  public JdbcUnresolvedEventStore(Dialect dialect, String tableName) {
    super(dialect, tableName);
  }

  @Override
  public void insert(Connection conn, UnresolvedEvent event) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ") VALUES (" + placeholders(10) + ")";
    JdbcTemplate.update(conn, sql,
        event.id(), event.source(), event.shipmentHint(), event.rawPayload(), event.reason(),
        event.receivedAt(), event.status().code(), event.attempts(), event.nextAttemptAt(),
        truncateError(event.lastError()));
  }

  @Override
  public List<UnresolvedEvent> findDue(Connection conn, Instant now, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName()
        + " WHERE status=" + PENDING + " AND next_attempt_at <= ? ORDER BY received_at LIMIT ?";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, now, limit);
  }

  @Override
  public List<UnresolvedEvent> findPendingByHints(Connection conn, Collection<String> hints) {
    List<String> distinct = hints.stream().filter(Objects::nonNull).distinct().toList();
    if (distinct.isEmpty()) {
      return List.of();
    }
    String sql = "SELECT " + COLUMNS + " FROM " + tableName()
        + " WHERE status=" + PENDING + " AND shipment_hint IN (" + placeholders(distinct.size()) + ")"
        + " ORDER BY received_at";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, distinct.toArray());
  }

  @Override
  public List<UnresolvedEvent> findByStatus(Connection conn, UnresolvedStatus status, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName()
        + " WHERE status=? ORDER BY received_at LIMIT ?";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, status.code(), limit);
  }

  @Override
  public int countByStatus(Connection conn, UnresolvedStatus status) {
    List<Integer> counts = JdbcTemplate.query(conn,
        "SELECT COUNT(*) FROM " + tableName() + " WHERE status=?",
        rs -> rs.getInt(1), status.code());
    return counts.isEmpty() ? 0 : counts.get(0);
  }

  @Override
  public int markResolved(Connection conn, String id) {
    String sql = "UPDATE " + tableName()
        + " SET status=" + UnresolvedStatus.RESOLVED.code() + ", attempts=attempts+1"
        + " WHERE id=? AND status=" + PENDING;
    return JdbcTemplate.update(conn, sql, id);
  }

  @Override
  public int markRetry(Connection conn, String id, Instant nextAttemptAt, String error) {
    String sql = "UPDATE " + tableName()
        + " SET attempts=attempts+1, next_attempt_at=?, last_error=?"
        + " WHERE id=? AND status=" + PENDING;
    return JdbcTemplate.update(conn, sql, nextAttemptAt, truncateError(error), id);
  }

  @Override
  public int markReview(Connection conn, String id, String error) {
    String sql = "UPDATE " + tableName()
        + " SET status=" + UnresolvedStatus.REVIEW.code() + ", last_error=?"
        + " WHERE id=? AND status<>" + UnresolvedStatus.RESOLVED.code();
    return JdbcTemplate.update(conn, sql, truncateError(error), id);
  }

  @Override
  public int requeue(Connection conn, String id, Instant now) {
    String sql = "UPDATE " + tableName()
        + " SET status=" + PENDING + ", attempts=0, next_attempt_at=?, received_at=?"
        + " WHERE id=? AND status=" + UnresolvedStatus.REVIEW.code();
    return JdbcTemplate.update(conn, sql, now, now, id);
  }
}
