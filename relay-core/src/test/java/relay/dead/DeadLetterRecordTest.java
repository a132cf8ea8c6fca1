package relay.dead;

import org.junit.jupiter.api.Test;
import relay.OutboundMessage;

import static org.junit.jupiter.api.Assertions.*;

class DeadLetterRecordTest {

  @Test
  void capturesMessageContext() {
    OutboundMessage message = OutboundMessage.builder()
        .provider("slack").chatId("C1").senderId("U1").replyTo("R1").threadId("T1")
        .content("hello").metadata("kind", "agent_reply")
        .build();

    DeadLetterRecord record = DeadLetterRecord.of("slack", message, "timeout", 3);

    assertEquals("slack", record.provider());
    assertEquals("C1", record.chatId());
    assertEquals(message.id(), record.messageId());
    assertEquals("U1", record.senderId());
    assertEquals("R1", record.replyTo());
    assertEquals("T1", record.threadId());
    assertEquals(3, record.retryCount());
    assertEquals("timeout", record.error());
    assertEquals("agent_reply", record.metadata().get("kind"));
    assertNotNull(record.at());
  }

  @Test
  void truncatesLongContent() {
    OutboundMessage message = OutboundMessage.text("slack", "C1", "x".repeat(5000));

    DeadLetterRecord record = DeadLetterRecord.of("slack", message, "timeout", 1);

    assertEquals(DeadLetterRecord.MAX_CONTENT_LENGTH, record.content().length());
  }

  @Test
  void normalizesMissingFields() {
    DeadLetterRecord record = new DeadLetterRecord(null, null, null, null, null, null, null, -1, " ", null, null);

    assertEquals("", record.provider());
    assertEquals("", record.threadId());
    assertEquals(0, record.retryCount());
    assertEquals("unknown_error", record.error());
    assertTrue(record.metadata().isEmpty());
    assertNotNull(record.at());
  }
}
