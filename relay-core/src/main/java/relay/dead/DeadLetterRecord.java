package relay.dead;

import relay.OutboundMessage;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Failure context of a message that exhausted its retry budget.
 *
 * <p>Null strings are normalized to {@code ""}, a blank error to {@code unknown_error},
 * and metadata is copied into an unmodifiable map.
 */
public record DeadLetterRecord(
    Instant at,
    String provider,
    String chatId,
    String messageId,
    String senderId,
    String replyTo,
    String threadId,
    int retryCount,
    String error,
    String content,
    Map<String, Object> metadata) {

  public static final int MAX_CONTENT_LENGTH = 4000;

  public DeadLetterRecord {
    at = at == null ? Instant.now() : at;
    provider = nullToEmpty(provider);
    chatId = nullToEmpty(chatId);
    messageId = nullToEmpty(messageId);
    senderId = nullToEmpty(senderId);
    replyTo = nullToEmpty(replyTo);
    threadId = nullToEmpty(threadId);
    retryCount = Math.max(0, retryCount);
    error = error == null || error.isBlank() ? "unknown_error" : error;
    content = nullToEmpty(content);
    metadata = metadata == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  /**
   * Captures a message's failure context, truncating its content to
   * {@value #MAX_CONTENT_LENGTH} characters.
   */
  public static DeadLetterRecord of(String provider, OutboundMessage message, String error, int retryCount) {
    String content = message.content();
    if (content.length() > MAX_CONTENT_LENGTH) {
      content = content.substring(0, MAX_CONTENT_LENGTH);
    }
    return new DeadLetterRecord(
        Instant.now(),
        provider,
        message.chatId(),
        message.id(),
        message.senderId(),
        message.replyTo(),
        message.threadId(),
        retryCount,
        error,
        content,
        message.metadata());
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
