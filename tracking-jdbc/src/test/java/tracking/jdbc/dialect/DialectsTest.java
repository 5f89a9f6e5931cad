package tracking.jdbc.dialect;

import org.junit.jupiter.api.Test;
import tracking.jdbc.H2;
import tracking.jdbc.spi.Dialect;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DialectsTest {

  @Test
  void builtInDialectsAreRegistered() {
    assertTrue(Dialects.names().containsAll(Set.of("h2", "mysql", "postgresql")));
    assertTrue(Dialects.all().size() >= 3);
  }

  @Test
  void getIsCaseInsensitive() {
    assertEquals("postgresql", Dialects.get("PostgreSQL").name());
    assertInstanceOf(H2Dialect.class, Dialects.get("H2"));
  }

  @Test
  void unknownNameListsAvailableDialects() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> Dialects.get("oracle"));
    assertTrue(ex.getMessage().contains("oracle"));
    assertTrue(ex.getMessage().contains("h2"));
  }

  @Test
  void detectsFromUrlPrefix() {
    assertEquals("mysql", Dialects.detect("jdbc:mysql://localhost:3306/tracking").name());
    assertEquals("mysql", Dialects.detect("jdbc:tidb://localhost:4000/tracking").name());
    assertEquals("postgresql", Dialects.detect("jdbc:postgresql://localhost/tracking").name());
    assertEquals("h2", Dialects.detect("jdbc:h2:mem:x").name());
  }

  @Test
  void detectRejectsUnknownOrEmptyUrl() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Dialects.detect("jdbc:oracle:thin:@localhost:1521:xe"));
    assertTrue(ex.getMessage().contains("No dialect found"));
    assertThrows(IllegalArgumentException.class, () -> Dialects.detect(""));
    assertThrows(IllegalArgumentException.class, () -> Dialects.detect((String) null));
  }

  @Test
  void detectsFromDataSource() {
    assertEquals("h2", Dialects.detect(H2.newDataSource()).name());
  }

  // ── Duplicate-tolerant inserts ────────────────────────────────

  @Test
  void h2ReliesOnConstraintViolation() {
    Dialect h2 = Dialects.get("h2");
    assertEquals("INSERT INTO t (a, b) VALUES (?,?)", h2.insertIgnoringDuplicatesSql("t", "a, b", 2));
  }

  @Test
  void mysqlUsesInsertIgnore() {
    assertEquals("INSERT IGNORE INTO t (a) VALUES (?)",
        Dialects.get("mysql").insertIgnoringDuplicatesSql("t", "a", 1));
  }

  @Test
  void postgresUsesOnConflictDoNothing() {
    String sql = Dialects.get("postgresql").insertIgnoringDuplicatesSql("t", "a, b, c", 3);
    assertEquals("INSERT INTO t (a, b, c) VALUES (?,?,?) ON CONFLICT DO NOTHING", sql);
  }

  @Test
  void schemaResourceFollowsDialectName() {
    assertEquals("schema/postgresql.sql", Dialects.get("postgresql").schemaResource());
  }
}
