package relay.dead;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import relay.OutboundMessage;
import relay.bus.MessageBus;
import relay.spi.DeadLetterStore;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeadLetterManagerTest {
  private final MessageBus bus = new MessageBus();
  private final InMemoryDeadLetterStore store = new InMemoryDeadLetterStore();

  @AfterEach
  void tearDown() {
    bus.close();
  }

  private static DeadLetterRecord record(String content, int retry) {
    OutboundMessage message = OutboundMessage.builder()
        .provider("slack").chatId("C1").threadId("T1").content(content)
        .metadata(OutboundMessage.DISPATCH_RETRY, retry)
        .metadata(OutboundMessage.DISPATCH_ERROR, "timeout")
        .metadata("request_id", "req-1")
        .build();
    return DeadLetterRecord.of("slack", message, "timeout", retry);
  }

  @Test
  void recentReturnsNewestFirst() {
    store.append(record("old", 3));
    store.append(record("new", 3));
    DeadLetterManager manager = new DeadLetterManager(store, bus);

    List<DeadLetterRecord> recent = manager.recent(10);

    assertEquals(List.of("new", "old"), recent.stream().map(DeadLetterRecord::content).toList());
  }

  @Test
  void recentReturnsEmptyWhenStoreFails() {
    DeadLetterStore broken = new DeadLetterStore() {
      @Override
      public void append(DeadLetterRecord record) {
      }

      @Override
      public List<DeadLetterRecord> list(int limit) {
        throw new IllegalStateException("unreadable");
      }

      @Override
      public String location() {
        return "broken";
      }
    };

    assertTrue(new DeadLetterManager(broken, bus).recent(5).isEmpty());
  }

  @Test
  void replayPublishesFreshMessage() {
    DeadLetterRecord dead = record("retry me", 3);
    DeadLetterManager manager = new DeadLetterManager(store, bus);

    assertTrue(manager.replay(dead));

    OutboundMessage replayed = bus.consumeOutbound(Duration.ofSeconds(1));
    assertNotNull(replayed);
    assertNotEquals(dead.messageId(), replayed.id());
    assertEquals("slack", replayed.provider());
    assertEquals("C1", replayed.chatId());
    assertEquals("T1", replayed.threadId());
    assertNull(replayed.replyTo());
    assertEquals("retry me", replayed.content());
    assertEquals(0, replayed.dispatchRetry());
    assertFalse(replayed.metadata().containsKey(OutboundMessage.DISPATCH_ERROR));
    assertEquals(Boolean.TRUE, replayed.metadata().get(DeadLetterManager.REPLAY_MARKER));
    assertEquals("req-1", replayed.metadataString("request_id"));
  }

  @Test
  void replayRecentCountsPublishedMessages() {
    store.append(record("a", 3));
    store.append(record("b", 3));
    store.append(record("c", 3));
    DeadLetterManager manager = new DeadLetterManager(store, bus);

    assertEquals(2, manager.replayRecent(2));
    assertEquals(2, bus.size());
  }

  @Test
  void replayFailsOnClosedBus() {
    DeadLetterManager manager = new DeadLetterManager(store, bus);
    bus.close();

    assertFalse(manager.replay(record("x", 1)));
  }
}
