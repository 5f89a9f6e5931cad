package tracking.jdbc.store;

import tracking.jdbc.JdbcTemplate;
import tracking.jdbc.TableNames;
import tracking.jdbc.spi.Dialect;
import tracking.model.ArchiveRecord;
import tracking.spi.ArchiveStore;
import tracking.spi.ConnectionProvider;
import tracking.util.Ids;
import tracking.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ArchiveStore} that appends each record as a JSON document row keyed by shipment and
 * event id. Uses its own auto-commit connection; the archival sink calls it off the
 * ingestion path.
 */
public final class JdbcArchiveStore extends AbstractJdbcStore implements ArchiveStore {
  private final ConnectionProvider connectionProvider;
  private final JsonCodec jsonCodec;

  public JdbcArchiveStore(Dialect dialect, ConnectionProvider connectionProvider) {
    this(dialect, connectionProvider, TableNames.ARCHIVE, JsonCodec.getDefault());
  }

  public JdbcArchiveStore(Dialect dialect, ConnectionProvider connectionProvider, String tableName,
      JsonCodec jsonCodec) {
    super(dialect, tableName);
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public void write(ArchiveRecord record) throws SQLException {
    String sql = "INSERT INTO " + tableName()
        + " (id, kind, shipment_id, event_id, document, archived_at) VALUES (?,?,?,?,?,?)";
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      JdbcTemplate.update(conn, sql, Ids.newId(), record.kind().name(), record.shipmentId(),
          record.eventId(), jsonCodec.toJson(record.document()), record.archivedAt());
    }
  }
}
