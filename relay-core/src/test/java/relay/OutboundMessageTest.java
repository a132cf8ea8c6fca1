package relay;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OutboundMessageTest {

  @Test
  void assignsUniqueIds() {
    OutboundMessage a = OutboundMessage.text("slack", "C1", "hi");
    OutboundMessage b = OutboundMessage.text("slack", "C1", "hi");

    assertNotEquals(a.id(), b.id());
    assertEquals(26, a.id().length());
  }

  @Test
  void nullStringsBecomeEmpty() {
    OutboundMessage message = OutboundMessage.builder().build();

    assertEquals("", message.provider());
    assertEquals("", message.chatId());
    assertEquals("", message.content());
    assertNull(message.threadId());
    assertNull(message.replyTo());
  }

  @Test
  void resolveProviderFallsBackToChannel() {
    assertEquals("slack", OutboundMessage.builder().provider(" Slack ").build().resolveProvider());
    assertEquals("discord", OutboundMessage.builder().channel("DISCORD").build().resolveProvider());
    assertNull(OutboundMessage.builder().build().resolveProvider());
  }

  @Test
  void dispatchRetryParsesNumbersAndStrings() {
    assertEquals(0, OutboundMessage.text("slack", "C1", "x").dispatchRetry());
    assertEquals(2, OutboundMessage.builder().metadata(OutboundMessage.DISPATCH_RETRY, 2).build().dispatchRetry());
    assertEquals(3, OutboundMessage.builder().metadata(OutboundMessage.DISPATCH_RETRY, "3").build().dispatchRetry());
    assertEquals(0, OutboundMessage.builder().metadata(OutboundMessage.DISPATCH_RETRY, "junk").build().dispatchRetry());
  }

  @Test
  void toBuilderKeepsIdAndCopiesMetadata() {
    OutboundMessage original = OutboundMessage.builder()
        .provider("slack")
        .metadata(Map.of("kind", "agent_reply"))
        .build();

    OutboundMessage copy = original.toBuilder().metadata("extra", 1).build();

    assertEquals(original.id(), copy.id());
    assertEquals(original, copy);
    assertFalse(original.metadata().containsKey("extra"));
    assertEquals("agent_reply", copy.metadataString("kind"));
  }

  @Test
  void metadataIsUnmodifiable() {
    OutboundMessage message = OutboundMessage.builder().metadata("k", "v").build();

    assertThrows(UnsupportedOperationException.class, () -> message.metadata().put("x", "y"));
  }

  @Test
  void failureWithoutErrorIsUnknown() {
    assertEquals("unknown_error", SendResult.failure(null).error());
    assertEquals("unknown_error", SendResult.failure("  ").error());
    assertNull(SendResult.success("m1").error());
  }
}
