package tracking.jdbc.spi;

import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide the database-specific pieces of SQL the stores need: the
 * insert that tolerates an existing unique key, and the schema script.
 * Register custom dialects via {@code META-INF/services/tracking.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: MySQL (+ TiDB), PostgreSQL, H2.
 *
 * @see tracking.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * SQL for an insert that must not fail the surrounding transaction when a unique key is
   * already taken. The statement either skips the row (0 rows affected) or raises an
   * integrity constraint violation that leaves the transaction usable.
   *
   * @param table   table name
   * @param columns comma separated column list
   * @param params  number of bind parameters, one per column
   * @return the SQL
   */
  String insertIgnoringDuplicatesSql(String table, String columns, int params);

  /**
   * Classpath location of the DDL script creating every table the stores use.
   */
  default String schemaResource() {
    return "schema/" + name() + ".sql";
  }
}
