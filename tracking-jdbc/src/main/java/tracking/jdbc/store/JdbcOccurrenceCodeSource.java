package tracking.jdbc.store;

import tracking.jdbc.JdbcTemplate;
import tracking.jdbc.TableNames;
import tracking.jdbc.spi.Dialect;
import tracking.model.CanonicalStatus;
import tracking.model.OccurrenceCode;
import tracking.model.Severity;
import tracking.registry.OccurrenceCodeSource;
import tracking.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Reads the occurrence code taxonomy from the {@code occurrence_code} table, so operators can
 * add or remap codes and trigger a registry reload without a redeploy.
 */
public final class JdbcOccurrenceCodeSource extends AbstractJdbcStore implements OccurrenceCodeSource {
  private static final String COLUMNS =
      "carrier, code, description, code_type, code_process, canonical_status, severity";

  private static final JdbcTemplate.RowMapper<OccurrenceCode> ROW_MAPPER = rs -> new OccurrenceCode(
      rs.getString("carrier"),
      rs.getString("code"),
      rs.getString("description"),
      rs.getString("code_type"),
      rs.getString("code_process"),
      CanonicalStatus.valueOf(rs.getString("canonical_status")),
      Severity.valueOf(rs.getString("severity")));

  private final ConnectionProvider connectionProvider;

  public JdbcOccurrenceCodeSource(Dialect dialect, ConnectionProvider connectionProvider) {
    this(dialect, connectionProvider, TableNames.OCCURRENCE_CODES);
  }

  public JdbcOccurrenceCodeSource(Dialect dialect, ConnectionProvider connectionProvider, String tableName) {
    super(dialect, tableName);
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  @Override
  public List<OccurrenceCode> load() throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return JdbcTemplate.query(conn,
          "SELECT " + COLUMNS + " FROM " + tableName() + " ORDER BY carrier, code", ROW_MAPPER);
    }
  }

  /**
   * Inserts the given codes, leaving rows that already exist for a {@code (carrier, code)}
   * untouched.
   *
   * @param codes codes to insert, typically the bundled classpath seed
   * @return number of rows inserted
   */
  public int seed(Collection<OccurrenceCode> codes) throws SQLException {
    String sql = dialect().insertIgnoringDuplicatesSql(tableName(), COLUMNS, 7);
    int inserted = 0;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      for (OccurrenceCode code : codes) {
        inserted += JdbcTemplate.updateIgnoringDuplicates(conn, sql,
            code.carrier(), code.code(), code.description(), code.type(), code.process(),
            code.canonicalStatus().name(), code.severity().name());
      }
    }
    return inserted;
  }
}
