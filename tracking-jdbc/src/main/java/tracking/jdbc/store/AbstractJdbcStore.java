package tracking.jdbc.store;

import tracking.jdbc.TableNames;
import tracking.jdbc.spi.Dialect;

import java.util.Collections;
import java.util.Objects;

/**
 * Shared state of the JDBC stores: the dialect and a validated table name.
 */
abstract class AbstractJdbcStore {
  private static final int MAX_ERROR_LENGTH = 4000;

  private final Dialect dialect;
  private final String tableName;

  AbstractJdbcStore(Dialect dialect, String tableName) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.tableName = TableNames.validate(tableName);
  }

  protected Dialect dialect() {
    return dialect;
  }

  protected String tableName() {
    return tableName;
  }

  protected static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }

  protected static String placeholders(int count) {
    return String.join(",", Collections.nCopies(count, "?"));
  }
}
