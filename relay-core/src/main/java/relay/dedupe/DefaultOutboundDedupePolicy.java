package relay.dedupe;

import relay.MediaItem;
import relay.OutboundMessage;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Default dedupe key derivation.
 *
 * <p>Terminal agent replies ({@code kind} of {@code agent_reply} or {@code agent_error})
 * that name the message they answer are keyed on
 * {@code (provider, chat, thread, replyTo, kind, trigger)}; content is left out so
 * repeated attempts to answer one trigger collapse to a single delivery.
 *
 * <p>Everything else is keyed on
 * {@code (provider, chat, thread, replyTo, kind, trigger-or-sender, content, media)},
 * with text lower-cased and whitespace-collapsed and media reduced to sorted
 * {@code type:url} pairs.
 *
 * <p>The trigger is read from metadata, first of {@code trigger_message_id},
 * {@code source_message_id}, {@code request_id}.
 */
public final class DefaultOutboundDedupePolicy implements OutboundDedupePolicy {
  public static final String KIND = "kind";
  public static final String TRIGGER_MESSAGE_ID = "trigger_message_id";
  public static final String SOURCE_MESSAGE_ID = "source_message_id";
  public static final String REQUEST_ID = "request_id";

  private static final Set<String> TERMINAL_KINDS = Set.of("agent_reply", "agent_error");
  private static final List<String> TRIGGER_KEYS = List.of(TRIGGER_MESSAGE_ID, SOURCE_MESSAGE_ID, REQUEST_ID);
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final String SEPARATOR = "::";

  @Override
  public String key(String provider, OutboundMessage message) {
    String kind = normalize(message.metadataString(KIND));
    String trigger = trigger(message);
    String chat = normalize(message.chatId());
    String thread = normalize(message.threadId());
    String replyTo = normalize(message.replyTo());
    String p = provider == null ? "" : provider;

    if (TERMINAL_KINDS.contains(kind) && !trigger.isEmpty()) {
      return String.join(SEPARATOR, p, chat, thread, replyTo, kind, trigger);
    }

    String base = trigger.isEmpty() ? normalize(message.senderId()) : trigger;
    return String.join(SEPARATOR, p, chat, thread, replyTo, kind, base,
        normalize(message.content()), mediaSignature(message.media()));
  }

  private static String trigger(OutboundMessage message) {
    for (String key : TRIGGER_KEYS) {
      String value = normalize(message.metadataString(key));
      if (!value.isEmpty()) {
        return value;
      }
    }
    return "";
  }

  static String normalize(String value) {
    if (value == null || value.isEmpty()) {
      return "";
    }
    return WHITESPACE.matcher(value).replaceAll(" ").trim().toLowerCase(Locale.ROOT);
  }

  static String mediaSignature(List<MediaItem> media) {
    if (media.isEmpty()) {
      return "";
    }
    return media.stream()
        .map(item -> item.type() + ":" + normalize(item.url()))
        .sorted()
        .collect(Collectors.joining("|"));
  }
}
