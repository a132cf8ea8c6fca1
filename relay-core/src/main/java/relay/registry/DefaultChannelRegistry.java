package relay.registry;

import relay.OutboundMessage;
import relay.SendResult;
import relay.spi.ChannelRegistry;
import relay.spi.ChatChannel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry routing outbound messages to {@link ChatChannel}s by provider.
 *
 * <p>A message is routed by {@link OutboundMessage#resolveProvider()}. Messages for a
 * provider with no registered channel fail with {@code channel_not_registered:<provider>}.
 * Registering a second channel for the same provider replaces the first.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * DefaultChannelRegistry registry = new DefaultChannelRegistry()
 *     .register(slackChannel)
 *     .register(telegramChannel);
 *
 * SendResult result = registry.send(OutboundMessage.text("slack", "C123", "hi"));
 * }</pre>
 *
 * @see ChatChannel
 * @see ChannelRegistry
 */
public final class DefaultChannelRegistry implements ChannelRegistry {
  private final Map<String, ChatChannel> channels = new ConcurrentHashMap<>();

  /**
   * Registers a channel under its {@link ChatChannel#provider()} key.
   *
   * @param channel the channel
   * @return this registry for chaining
   */
  public DefaultChannelRegistry register(ChatChannel channel) {
    Objects.requireNonNull(channel, "channel");
    String provider = normalize(channel.provider());
    if (provider.isEmpty()) {
      throw new IllegalArgumentException("channel provider cannot be empty");
    }
    channels.put(provider, channel);
    return this;
  }

  /**
   * Returns the channel registered for {@code provider}, or {@code null}.
   */
  public ChatChannel channelFor(String provider) {
    return provider == null ? null : channels.get(normalize(provider));
  }

  public List<ChatChannel> channels() {
    return Collections.unmodifiableList(new ArrayList<>(channels.values()));
  }

  @Override
  public SendResult send(OutboundMessage message) {
    String provider = message.resolveProvider();
    ChatChannel channel = provider == null ? null : channels.get(provider);
    if (channel == null) {
      return SendResult.failure("channel_not_registered:" + (provider == null ? "" : provider));
    }
    return channel.send(message);
  }

  private static String normalize(String provider) {
    return provider == null ? "" : provider.trim().toLowerCase(Locale.ROOT);
  }
}
