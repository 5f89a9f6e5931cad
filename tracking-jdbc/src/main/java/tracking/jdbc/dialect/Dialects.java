package tracking.jdbc.dialect;

import tracking.jdbc.spi.Dialect;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Looks up the registered {@link Dialect}s, by name or from a JDBC URL.
 *
 * <p>Dialects are discovered once via {@link ServiceLoader} from
 * {@code META-INF/services/tracking.jdbc.spi.Dialect}.
 *
 * <pre>{@code
 * Dialect dialect = Dialects.detect(dataSource);           // from connection metadata
 * Dialect pg = Dialects.detect("jdbc:postgresql://db/x");  // from a URL
 * Dialect h2 = Dialects.get("h2");                         // by name
 * }</pre>
 */
public final class Dialects {

  private static final List<Dialect> DIALECTS = ServiceLoader.load(Dialect.class)
      .stream()
      .map(ServiceLoader.Provider::get)
      .toList();

  private static final Map<String, Dialect> BY_NAME = DIALECTS.stream()
      .collect(Collectors.toUnmodifiableMap(d -> key(d.name()), Function.identity(), (a, b) -> a));

  private Dialects() {
  }

  public static List<Dialect> all() {
    return DIALECTS;
  }

  public static Set<String> names() {
    return BY_NAME.keySet();
  }

  /**
   * Gets a dialect by name.
   *
   * @param name dialect name (case-insensitive)
   * @return the dialect
   * @throws IllegalArgumentException if no dialect has that name
   */
  public static Dialect get(String name) {
    if (name == null) {
      throw new IllegalArgumentException("Dialect name cannot be null");
    }
    Dialect dialect = BY_NAME.get(key(name));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect: " + name + ". Available: " + names());
    }
    return dialect;
  }

  /**
   * Detects the dialect from the URL reported by a connection of the data source.
   *
   * @throws IllegalStateException if no connection can be obtained
   * @throws IllegalArgumentException if no registered dialect matches the URL
   */
  public static Dialect detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect dialect from DataSource", e);
    }
  }

  /**
   * Detects the dialect from a JDBC URL by prefix.
   *
   * @throws IllegalArgumentException if the URL is empty or no registered dialect matches
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    return DIALECTS.stream()
        .filter(d -> d.jdbcUrlPrefixes().stream().anyMatch(jdbcUrl::startsWith))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("No dialect found for JDBC URL: " + jdbcUrl
            + ". Supported prefixes: " + DIALECTS.stream()
                .flatMap(d -> d.jdbcUrlPrefixes().stream())
                .toList()));
  }

  private static String key(String name) {
    return name.toLowerCase(Locale.ROOT);
  }
}
