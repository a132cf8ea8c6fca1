package relay.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import relay.OutboundMessage;
import relay.dead.DeadLetterRecord;

import javax.sql.DataSource;
import java.lang.reflect.Proxy;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcDeadLetterStoreTest {
  private JdbcDataSource dataSource;

  @BeforeEach
  void setUp() {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:dlq_" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1");
  }

  private static DeadLetterRecord record(String content, int retry) {
    OutboundMessage message = OutboundMessage.builder()
        .provider("slack").chatId("C1").senderId("U1").threadId("T1")
        .content(content)
        .metadata("kind", "agent_reply")
        .metadata("dispatch_retry", retry)
        .build();
    return DeadLetterRecord.of("slack", message, "timeout", retry);
  }

  @Test
  void appendThenListRoundTripsAllFields() {
    JdbcDeadLetterStore store = JdbcDeadLetterStore.builder(dataSource).build();
    DeadLetterRecord original = record("hello \"world\"", 3);

    store.append(original);
    List<DeadLetterRecord> listed = store.list(10);

    assertEquals(1, listed.size());
    DeadLetterRecord loaded = listed.get(0);
    assertEquals(original.at().truncatedTo(ChronoUnit.MILLIS), loaded.at().truncatedTo(ChronoUnit.MILLIS));
    assertEquals("slack", loaded.provider());
    assertEquals("C1", loaded.chatId());
    assertEquals(original.messageId(), loaded.messageId());
    assertEquals("U1", loaded.senderId());
    assertEquals("", loaded.replyTo());
    assertEquals("T1", loaded.threadId());
    assertEquals(3, loaded.retryCount());
    assertEquals("timeout", loaded.error());
    assertEquals("hello \"world\"", loaded.content());
    assertEquals("agent_reply", loaded.metadata().get("kind"));
    assertEquals(3L, loaded.metadata().get("dispatch_retry"));
  }

  @Test
  void storesLongProducerSuppliedIds() {
    JdbcDeadLetterStore store = JdbcDeadLetterStore.builder(dataSource).build();
    String longId = "evt-" + "x".repeat(80);
    String longProvider = "provider-" + "p".repeat(100);
    OutboundMessage message = OutboundMessage.builder()
        .id(longId).provider(longProvider).chatId("chat-" + "c".repeat(300))
        .content("payload")
        .build();

    store.append(DeadLetterRecord.of(longProvider, message, "timeout", 3));

    DeadLetterRecord loaded = store.list(1).get(0);
    assertEquals(longId, loaded.messageId());
    assertEquals(longProvider, loaded.provider());
    assertEquals(305, loaded.chatId().length());
  }

  @Test
  void listReturnsNewestFirstUpToLimit() {
    JdbcDeadLetterStore store = JdbcDeadLetterStore.builder(dataSource).build();
    store.append(record("first", 1));
    store.append(record("second", 1));
    store.append(record("third", 1));

    List<String> contents = store.list(2).stream().map(DeadLetterRecord::content).toList();

    assertEquals(List.of("third", "second"), contents);
    assertEquals(3, store.list(0).size());
  }

  @Test
  void listOnFreshDatabaseIsEmpty() {
    JdbcDeadLetterStore store = JdbcDeadLetterStore.builder(dataSource).tableName("custom_dlq").build();

    assertTrue(store.list(5).isEmpty());
    assertEquals("custom_dlq", store.tableName());
    assertTrue(store.location().startsWith("jdbc:h2:mem:"));
  }

  @Test
  void rejectsInvalidTableName() {
    assertThrows(IllegalArgumentException.class, () ->
        JdbcDeadLetterStore.builder(dataSource).tableName("dlq;--").build());
    assertThrows(NullPointerException.class, () -> JdbcDeadLetterStore.builder(null).build());
  }

  @Test
  void connectionFailuresAreWrapped() {
    DataSource broken = (DataSource) Proxy.newProxyInstance(
        DataSource.class.getClassLoader(),
        new Class<?>[]{DataSource.class},
        (proxy, method, args) -> {
          if (method.getName().equals("getConnection")) {
            throw new SQLException("database offline");
          }
          if (method.getName().equals("toString")) {
            return "broken";
          }
          return null;
        });
    JdbcDeadLetterStore store = JdbcDeadLetterStore.builder(broken).build();

    DeadLetterStoreException ex = assertThrows(DeadLetterStoreException.class,
        () -> store.append(record("x", 1)));
    assertInstanceOf(SQLException.class, ex.getCause());
    assertThrows(DeadLetterStoreException.class, () -> store.list(1));
    assertEquals("broken", store.location());
  }

  @Test
  void fileBackedStoreSurvivesReopen(@TempDir Path dir) {
    Path path = dir.resolve("nested").resolve("dlq");

    JdbcDeadLetterStores.fileBacked(path).append(record("persisted", 2));
    List<DeadLetterRecord> reopened = JdbcDeadLetterStores.fileBacked(path).list(10);

    assertEquals(1, reopened.size());
    assertEquals("persisted", reopened.get(0).content());
    assertTrue(dir.resolve("nested").resolve("dlq.mv.db").toFile().exists());
  }

  @Test
  void recordsAtKeepTheirInstant() {
    JdbcDeadLetterStore store = JdbcDeadLetterStore.builder(dataSource).build();
    Instant at = Instant.parse("2024-05-01T10:15:30.123Z");
    store.append(new DeadLetterRecord(at, "discord", "c", "m", "s", "", "", 1, "e", "", null));

    assertEquals(at, store.list(1).get(0).at());
  }
}
