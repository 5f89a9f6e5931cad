package tracking.jdbc.dialect;

import tracking.jdbc.spi.Dialect;

/**
 * Base dialect with standard SQL implementations.
 *
 * <p>The default duplicate-tolerant insert is a plain {@code INSERT}; the unique-key
 * violation it raises is mapped to "0 rows" by
 * {@link tracking.jdbc.JdbcTemplate#updateIgnoringDuplicates}. Only databases that keep the
 * transaction usable after a failed statement can rely on it.
 */
public abstract class AbstractDialect implements Dialect {

  @Override
  public String insertIgnoringDuplicatesSql(String table, String columns, int params) {
    return "INSERT INTO " + table + " (" + columns + ") VALUES (" + placeholders(params) + ")";
  }

  protected static String placeholders(int count) {
    if (count <= 0) {
      throw new IllegalArgumentException("count must be > 0");
    }
    StringBuilder sb = new StringBuilder(count * 2);
    for (int i = 0; i < count; i++) {
      if (i > 0) {
        sb.append(',');
      }
      sb.append('?');
    }
    return sb.toString();
  }
}
