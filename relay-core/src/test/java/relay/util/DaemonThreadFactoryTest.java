package relay.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DaemonThreadFactoryTest {

  @Test
  void createsSequentiallyNamedDaemonThreads() {
    DaemonThreadFactory factory = new DaemonThreadFactory("relay-test-");

    Thread first = factory.newThread(() -> { });
    Thread second = factory.newThread(() -> { });

    assertEquals("relay-test-1", first.getName());
    assertEquals("relay-test-2", second.getName());
    assertTrue(first.isDaemon());
    assertNotNull(first.getUncaughtExceptionHandler());
  }

  @Test
  void rejectsNullPrefix() {
    assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
  }
}
