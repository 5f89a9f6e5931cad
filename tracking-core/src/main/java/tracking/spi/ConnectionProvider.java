package tracking.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of JDBC connections for ingestion, status commits, invocation dispatch and replay.
 *
 * <p>Every component opens a fresh connection per unit of work, sets the auto-commit mode
 * it needs and closes it when done.
 *
 * @see tracking.jdbc.DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * @return an open connection owned by the caller
     * @throws SQLException if the store is unreachable
     */
    Connection getConnection() throws SQLException;
}
