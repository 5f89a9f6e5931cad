package tracking.jdbc.store;

import tracking.jdbc.DataSourceConnectionProvider;
import tracking.jdbc.JdbcSchema;
import tracking.jdbc.dialect.Dialects;
import tracking.jdbc.spi.Dialect;
import tracking.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.util.Objects;

/**
 * The full set of JDBC stores for one {@link DataSource}, with the dialect detected from the
 * connection URL unless given.
 *
 * <pre>{@code
 * JdbcTrackingStores stores = JdbcTrackingStores.create(dataSource);
 * TrackingEngine engine = TrackingEngine.builder()
 *     .connectionProvider(stores.connectionProvider())
 *     .eventStore(stores.eventStore())
 *     .shipmentStore(stores.shipmentStore())
 *     .invocationStore(stores.invocationStore())
 *     .unresolvedStore(stores.unresolvedStore())
 *     .archiveStore(stores.archiveStore())
 *     .build();
 * }</pre>
 */
public final class JdbcTrackingStores {
  private final Dialect dialect;
  private final DataSourceConnectionProvider connectionProvider;
  private final JdbcEventStore eventStore;
  private final JdbcShipmentStore shipmentStore;
  private final JdbcInvocationStore invocationStore;
  private final JdbcUnresolvedEventStore unresolvedStore;
  private final JdbcArchiveStore archiveStore;
  private final JdbcOccurrenceCodeSource occurrenceCodeSource;

  private JdbcTrackingStores(DataSource dataSource, Dialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.connectionProvider = new DataSourceConnectionProvider(dataSource);
    this.eventStore = new JdbcEventStore(dialect);
    this.shipmentStore = new JdbcShipmentStore(dialect);
    this.invocationStore = new JdbcInvocationStore(dialect);
    this.unresolvedStore = new JdbcUnresolvedEventStore(dialect);
    this.archiveStore = new JdbcArchiveStore(dialect, connectionProvider);
    this.occurrenceCodeSource = new JdbcOccurrenceCodeSource(dialect, connectionProvider);
  }

  public static JdbcTrackingStores create(DataSource dataSource) {
    return new JdbcTrackingStores(dataSource, Dialects.detect(dataSource));
  }

  public static JdbcTrackingStores create(DataSource dataSource, Dialect dialect) {
    return new JdbcTrackingStores(dataSource, dialect);
  }

  /**
   * Creates any missing table from the dialect's bundled DDL script.
   *
   * @return this
   */
  public JdbcTrackingStores createSchema() {
    JdbcSchema.create(connectionProvider.dataSource(), dialect);
    return this;
  }

  public Dialect dialect() {
    return dialect;
  }

  public ConnectionProvider connectionProvider() {
    return connectionProvider;
  }

  public JdbcEventStore eventStore() {
    return eventStore;
  }

  public JdbcShipmentStore shipmentStore() {
    return shipmentStore;
  }

  public JdbcInvocationStore invocationStore() {
    return invocationStore;
  }

  public JdbcUnresolvedEventStore unresolvedStore() {
    return unresolvedStore;
  }

  public JdbcArchiveStore archiveStore() {
    return archiveStore;
  }

  public JdbcOccurrenceCodeSource occurrenceCodeSource() {
    return occurrenceCodeSource;
  }
}
