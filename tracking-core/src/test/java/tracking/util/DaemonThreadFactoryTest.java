package tracking.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DaemonThreadFactoryTest {

  @Test
  void threadsAreNumberedDaemons() {
    DaemonThreadFactory factory = new DaemonThreadFactory("tracking-test-");

    Thread first = factory.newThread(() -> {});
    Thread second = factory.newThread(() -> {});

    assertEquals("tracking-test-1", first.getName());
    assertEquals("tracking-test-2", second.getName());
    assertTrue(first.isDaemon());
    assertNotNull(first.getUncaughtExceptionHandler());
  }

  @Test
  void rejectsNullPrefix() {
    assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
  }
}
