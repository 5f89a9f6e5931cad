package tracking.jdbc.dialect;

import java.util.List;

/**
 * PostgreSQL dialect.
 *
 * <p>A failed statement aborts the whole PostgreSQL transaction, so duplicate-tolerant
 * inserts use {@code ON CONFLICT DO NOTHING} instead of relying on the error.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public String insertIgnoringDuplicatesSql(String table, String columns, int params) {
    return "INSERT INTO " + table + " (" + columns + ") VALUES (" + placeholders(params) + ")"
        + " ON CONFLICT DO NOTHING";
  }
}
