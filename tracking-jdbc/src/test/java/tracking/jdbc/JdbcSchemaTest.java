package tracking.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;
import tracking.jdbc.dialect.Dialects;

import java.sql.Connection;
import java.sql.ResultSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcSchemaTest {

  @Test
  void bundledScriptsExistForEveryBuiltInDialect() {
    for (String name : List.of("h2", "mysql", "postgresql")) {
      List<String> statements = JdbcSchema.statements(Dialects.get(name).schemaResource());
      assertTrue(statements.size() >= 6, name + " schema has " + statements.size() + " statements");
      assertTrue(statements.stream().allMatch(s -> s.startsWith("CREATE")), name);
    }
  }

  @Test
  void createIsRepeatable() throws Exception {
    JdbcDataSource dataSource = H2.newDataSource();

    JdbcSchema.create(dataSource, Dialects.get("h2"));
    JdbcSchema.create(dataSource, Dialects.get("h2"));

    try (Connection conn = dataSource.getConnection();
         ResultSet rs = conn.getMetaData().getTables(null, null, "TRACKING_EVENT", null)) {
      assertTrue(rs.next());
    }
  }

  @Test
  void missingResourceIsReported() {
    IllegalStateException ex = assertThrows(IllegalStateException.class,
        () -> JdbcSchema.statements("schema/oracle.sql"));
    assertTrue(ex.getMessage().contains("schema/oracle.sql"));
  }
}
