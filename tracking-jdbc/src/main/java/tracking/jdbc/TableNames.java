package tracking.jdbc;

import java.util.Objects;

/**
 * Default table names and shared table name validation for JDBC stores.
 *
 * <p>Table names are concatenated into SQL, so anything outside
 * {@code [a-zA-Z_][a-zA-Z0-9_]*} is refused.
 */
public final class TableNames {
  public static final String EVENTS = "tracking_event";
  public static final String SHIPMENTS = "shipment";
  public static final String INVOCATIONS = "automation_invocation";
  public static final String UNRESOLVED = "unresolved_event";
  public static final String ARCHIVE = "archive_record";
  public static final String OCCURRENCE_CODES = "occurrence_code";

  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
