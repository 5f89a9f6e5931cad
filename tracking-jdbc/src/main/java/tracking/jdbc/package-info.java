/**
 * JDBC plumbing shared by the store implementations: {@link tracking.jdbc.JdbcTemplate},
 * the {@link javax.sql.DataSource} backed connection provider and schema bootstrap.
 *
 * <p>SQL differences between databases are isolated in {@link tracking.jdbc.spi.Dialect}
 * implementations; H2, MySQL (and TiDB) and PostgreSQL are built in.
 *
 * @see tracking.jdbc.store.JdbcTrackingStores
 * @see tracking.jdbc.dialect.Dialects
 */
package tracking.jdbc;
