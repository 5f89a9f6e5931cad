package tracking.jdbc.dialect;

import java.util.List;

/**
 * Embedded H2, in-memory or file based. A duplicate {@code dedup_key} or invocation claim
 * fails with SQLState 23505 and leaves the transaction usable, so the plain insert of
 * {@link AbstractDialect} is enough.
 */
public final class H2Dialect extends AbstractDialect {
  static final String URL_PREFIX = "jdbc:h2:";

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of(URL_PREFIX);
  }
}
