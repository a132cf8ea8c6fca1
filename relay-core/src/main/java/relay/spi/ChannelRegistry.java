package relay.spi;

import relay.OutboundMessage;
import relay.SendResult;

/**
 * Transmits messages to external channels on behalf of the dispatch service.
 *
 * <p>The dispatch service never looks at how delivery happens; it only inspects the
 * returned {@link SendResult}. Implementations should report failures as
 * {@code SendResult.failure(error)}; an exception is treated as a failure whose error is
 * the exception message.
 *
 * @see relay.registry.DefaultChannelRegistry
 */
@FunctionalInterface
public interface ChannelRegistry {

  /**
   * Sends a message to the channel its provider resolves to.
   *
   * @param message the message to send
   * @return the delivery outcome
   */
  SendResult send(OutboundMessage message);
}
