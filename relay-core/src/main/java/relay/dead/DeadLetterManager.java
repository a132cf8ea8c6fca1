package relay.dead;

import relay.OutboundMessage;
import relay.bus.MessageBus;
import relay.spi.DeadLetterStore;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Convenience facade for inspecting and replaying dead-lettered messages.
 *
 * <p>Replay rebuilds a fresh message (new id, dispatch bookkeeping stripped, tagged with
 * {@value #REPLAY_MARKER}) from the stored record and publishes it on the bus' outbound
 * lane, so it goes through the full dispatch pipeline again with a new retry budget.
 *
 * @see DeadLetterStore
 */
public final class DeadLetterManager {
  private static final Logger logger = Logger.getLogger(DeadLetterManager.class.getName());

  public static final String REPLAY_MARKER = "dlq_replay";

  private final DeadLetterStore store;
  private final MessageBus bus;

  public DeadLetterManager(DeadLetterStore store, MessageBus bus) {
    this.store = Objects.requireNonNull(store, "store");
    this.bus = Objects.requireNonNull(bus, "bus");
  }

  /**
   * Returns the most recent dead letters, newest first.
   *
   * @param limit maximum number of records
   * @return the records, empty if the store could not be read
   */
  public List<DeadLetterRecord> recent(int limit) {
    try {
      return store.list(limit);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to list dead letters from " + store.location(), e);
      return List.of();
    }
  }

  /**
   * Re-publishes a dead-lettered message for delivery.
   *
   * @param record the record to replay
   * @return {@code true} if the message was handed to the bus
   */
  public boolean replay(DeadLetterRecord record) {
    Objects.requireNonNull(record, "record");
    if (bus.isClosed()) {
      logger.warning("Bus closed; cannot replay dead letter messageId=" + record.messageId());
      return false;
    }
    OutboundMessage message = OutboundMessage.builder()
        .provider(record.provider())
        .chatId(record.chatId())
        .senderId(record.senderId())
        .replyTo(emptyToNull(record.replyTo()))
        .threadId(emptyToNull(record.threadId()))
        .content(record.content())
        .metadata(record.metadata())
        .removeMetadata(OutboundMessage.DISPATCH_RETRY)
        .removeMetadata(OutboundMessage.DISPATCH_ERROR)
        .removeMetadata(OutboundMessage.DISPATCH_RETRY_AT)
        .metadata(REPLAY_MARKER, Boolean.TRUE)
        .build();
    bus.publishOutbound(message);
    logger.info("Replayed dead letter messageId=" + record.messageId() + " as " + message.id());
    return true;
  }

  /**
   * Replays up to {@code limit} of the most recent dead letters.
   *
   * @return number of messages re-published
   */
  public int replayRecent(int limit) {
    int replayed = 0;
    for (DeadLetterRecord record : recent(limit)) {
      if (replay(record)) {
        replayed++;
      }
    }
    return replayed;
  }

  private static String emptyToNull(String value) {
    return value == null || value.isEmpty() ? null : value;
  }
}
