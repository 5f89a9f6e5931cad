package tracking.jdbc;

import tracking.TrackingStoreException;
import tracking.jdbc.spi.Dialect;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a dialect's bundled DDL script ({@link Dialect#schemaResource()}).
 *
 * <p>Every statement in the bundled scripts is {@code CREATE ... IF NOT EXISTS}, so running
 * the script against an existing schema is harmless.
 */
public final class JdbcSchema {
  private static final Logger logger = Logger.getLogger(JdbcSchema.class.getName());

  private JdbcSchema() {}

  public static void create(DataSource dataSource, Dialect dialect) {
    Objects.requireNonNull(dataSource, "dataSource");
    Objects.requireNonNull(dialect, "dialect");
    List<String> statements = statements(dialect.schemaResource());
    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(true);
      try (Statement st = conn.createStatement()) {
        for (String sql : statements) {
          st.execute(sql);
        }
      }
    } catch (SQLException e) {
      throw new TrackingStoreException("Failed to create schema from " + dialect.schemaResource(), e);
    }
    logger.log(Level.INFO, "Applied {0} schema statements for dialect {1}",
        new Object[] {statements.size(), dialect.name()});
  }

  /**
   * Splits a classpath script into statements on {@code ;}.
   */
  static List<String> statements(String resource) {
    String script;
    try (InputStream in = JdbcSchema.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException("Schema resource not found: " + resource);
      }
      script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read schema resource " + resource, e);
    }
    return Arrays.stream(script.split(";"))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
  }
}
