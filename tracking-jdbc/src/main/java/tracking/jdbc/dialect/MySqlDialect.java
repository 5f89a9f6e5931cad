package tracking.jdbc.dialect;

import java.util.List;

/**
 * MySQL dialect. Also compatible with TiDB.
 *
 * <p>Uses {@code INSERT IGNORE}, which downgrades the duplicate-key error to a warning.
 */
public final class MySqlDialect extends AbstractDialect {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public String insertIgnoringDuplicatesSql(String table, String columns, int params) {
    return "INSERT IGNORE INTO " + table + " (" + columns + ") VALUES (" + placeholders(params) + ")";
  }
}
