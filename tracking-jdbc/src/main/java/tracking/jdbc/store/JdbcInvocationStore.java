package tracking.jdbc.store;

import tracking.jdbc.JdbcTemplate;
import tracking.jdbc.TableNames;
import tracking.jdbc.spi.Dialect;
import tracking.model.AutomationInvocation;
import tracking.model.CanonicalStatus;
import tracking.model.InvocationStatus;
import tracking.spi.InvocationStore;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC {@link InvocationStore}. At-most-one claim per {@code (shipment_id, rule_id,
 * status_version)} is enforced by a unique constraint.
 */
public final class JdbcInvocationStore extends AbstractJdbcStore implements InvocationStore {
  private static final String COLUMNS = "id, shipment_id, rule_id, status_version, previous_status, "
      + "new_status, trigger_event_id, status, attempts, next_attempt_at, last_error, created_at, completed_at";

  private static final String PENDING_STATUS_IN =
      "(" + InvocationStatus.PENDING.code() + "," + InvocationStatus.RETRY.code() + ")";

  private static final JdbcTemplate.RowMapper<AutomationInvocation> ROW_MAPPER = rs -> {
    String previous = rs.getString("previous_status");
    return new AutomationInvocation(
        rs.getString("id"),
        rs.getString("shipment_id"),
        rs.getString("rule_id"),
        rs.getLong("status_version"),
        previous == null ? null : CanonicalStatus.valueOf(previous),
        CanonicalStatus.valueOf(rs.getString("new_status")),
        rs.getString("trigger_event_id"),
        InvocationStatus.fromCode(rs.getInt("status")),
        rs.getInt("attempts"),
        JdbcTemplate.instant(rs, "next_attempt_at"),
        rs.getString("last_error"),
        JdbcTemplate.instant(rs, "created_at"),
        JdbcTemplate.instant(rs, "completed_at"));
  };

  private final String claimSql;

  public JdbcInvocationStore(Dialect dialect) {
    this(dialect, TableNames.INVOCATIONS);
  }

  public JdbcInvocationStore(Dialect dialect, String tableName) {
    super(dialect, tableName);
    this.claimSql = dialect.insertIgnoringDuplicatesSql(tableName(), COLUMNS, 13);
  }

  @Override
  public boolean claim(Connection conn, AutomationInvocation invocation) {
    return JdbcTemplate.updateIgnoringDuplicates(conn, claimSql,
        invocation.id(), invocation.shipmentId(), invocation.ruleId(), invocation.statusVersion(),
        invocation.previousStatus() == null ? null : invocation.previousStatus().name(),
        invocation.newStatus().name(), invocation.triggerEventId(), invocation.status().code(),
        invocation.attempts(), invocation.nextAttemptAt(), truncateError(invocation.lastError()),
        invocation.createdAt(), invocation.completedAt()) == 1;
  }

  @Override
  public int markDone(Connection conn, String invocationId, Instant completedAt) {
    String sql = "UPDATE " + tableName()
        + " SET status=" + InvocationStatus.DONE.code() + ", completed_at=?"
        + " WHERE id=? AND status IN " + PENDING_STATUS_IN;
    return JdbcTemplate.update(conn, sql, completedAt, invocationId);
  }

  @Override
  public int markRetry(Connection conn, String invocationId, Instant nextAttemptAt, String error) {
    String sql = "UPDATE " + tableName()
        + " SET status=" + InvocationStatus.RETRY.code() + ", attempts=attempts+1, next_attempt_at=?, last_error=?"
        + " WHERE id=? AND status IN " + PENDING_STATUS_IN;
    return JdbcTemplate.update(conn, sql, nextAttemptAt, truncateError(error), invocationId);
  }

  @Override
  public int markDead(Connection conn, String invocationId, String error) {
    String sql = "UPDATE " + tableName()
        + " SET status=" + InvocationStatus.DEAD.code() + ", attempts=attempts+1, last_error=?"
        + " WHERE id=? AND status IN " + PENDING_STATUS_IN;
    return JdbcTemplate.update(conn, sql, truncateError(error), invocationId);
  }

  @Override
  public List<AutomationInvocation> pollPending(Connection conn, Instant now, Duration skipRecent, int limit) {
    Instant recentCutoff = skipRecent == null ? now : now.minus(skipRecent);
    String sql = "SELECT " + COLUMNS + " FROM " + tableName()
        + " WHERE status IN " + PENDING_STATUS_IN + " AND next_attempt_at <= ? AND created_at <= ?"
        + " ORDER BY created_at LIMIT ?";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, now, recentCutoff, limit);
  }

  @Override
  public Optional<AutomationInvocation> findById(Connection conn, String invocationId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE id=?", ROW_MAPPER, invocationId);
  }

  @Override
  public List<AutomationInvocation> findByShipment(Connection conn, String shipmentId) {
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE shipment_id=? ORDER BY status_version, rule_id",
        ROW_MAPPER, shipmentId);
  }
}
