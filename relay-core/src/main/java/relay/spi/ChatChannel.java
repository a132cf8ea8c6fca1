package relay.spi;

import relay.OutboundMessage;
import relay.SendResult;

/**
 * A concrete delivery channel (Slack, Discord, Telegram, ...). Wire encoding and
 * transport timeouts are the channel's own business.
 */
public interface ChatChannel {

  /**
   * Provider key this channel serves, matched against
   * {@link OutboundMessage#resolveProvider()}.
   */
  String provider();

  SendResult send(OutboundMessage message);
}
