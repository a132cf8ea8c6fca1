package relay;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable message addressed to an external delivery channel.
 *
 * <p>Each message is assigned a ULID-based {@code id} by default. Destination
 * addressing is {@code (provider, channel, chatId, threadId, replyTo)}; the
 * {@code metadata} map carries free-form producer data plus the dispatch
 * bookkeeping keys ({@value #DISPATCH_RETRY}, {@value #DISPATCH_ERROR},
 * {@value #DISPATCH_RETRY_AT}).
 *
 * <p>Use the {@linkplain Builder builder} to create instances and
 * {@link #toBuilder()} to derive a modified copy.
 */
public final class OutboundMessage {
  public static final String DISPATCH_RETRY = "dispatch_retry";
  public static final String DISPATCH_ERROR = "dispatch_error";
  public static final String DISPATCH_RETRY_AT = "dispatch_retry_at";

  private final String id;
  private final String provider;
  private final String channel;
  private final String chatId;
  private final String threadId;
  private final String replyTo;
  private final String senderId;
  private final String content;
  private final List<MediaItem> media;
  private final Map<String, Object> metadata;
  private final Instant createdAt;

  private OutboundMessage(Builder builder) {
    this.id = builder.id == null ? newMessageId() : builder.id;
    if (this.id.isEmpty()) {
      throw new IllegalArgumentException("id cannot be empty");
    }
    this.provider = emptyToDefault(builder.provider);
    this.channel = emptyToDefault(builder.channel);
    this.chatId = emptyToDefault(builder.chatId);
    this.threadId = builder.threadId;
    this.replyTo = builder.replyTo;
    this.senderId = emptyToDefault(builder.senderId);
    this.content = emptyToDefault(builder.content);
    this.createdAt = builder.createdAt == null ? Instant.now() : builder.createdAt;

    List<MediaItem> mediaCopy = new ArrayList<>(builder.media);
    if (mediaCopy.contains(null)) {
      throw new IllegalArgumentException("media cannot contain null items");
    }
    this.media = Collections.unmodifiableList(mediaCopy);

    Map<String, Object> metadataCopy = new LinkedHashMap<>(builder.metadata);
    if (metadataCopy.containsKey(null)) {
      throw new IllegalArgumentException("metadata cannot contain null keys");
    }
    this.metadata = Collections.unmodifiableMap(metadataCopy);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a plain text message for the given provider and chat.
   *
   * @param provider the destination provider (e.g. {@code "slack"})
   * @param chatId   the destination chat
   * @param content  the message text
   * @return a new message
   */
  public static OutboundMessage text(String provider, String chatId, String content) {
    return builder().provider(provider).chatId(chatId).content(content).build();
  }

  /**
   * Returns a builder pre-populated with this message's fields, including its {@code id}.
   * The builder owns independent copies of the media list and metadata map.
   */
  public Builder toBuilder() {
    Builder builder = new Builder()
        .id(id)
        .provider(provider)
        .channel(channel)
        .chatId(chatId)
        .threadId(threadId)
        .replyTo(replyTo)
        .senderId(senderId)
        .content(content)
        .createdAt(createdAt);
    builder.media.addAll(media);
    builder.metadata.putAll(metadata);
    return builder;
  }

  public String id() {
    return id;
  }

  public String provider() {
    return provider;
  }

  public String channel() {
    return channel;
  }

  public String chatId() {
    return chatId;
  }

  public String threadId() {
    return threadId;
  }

  public String replyTo() {
    return replyTo;
  }

  public String senderId() {
    return senderId;
  }

  public String content() {
    return content;
  }

  public List<MediaItem> media() {
    return media;
  }

  public Map<String, Object> metadata() {
    return metadata;
  }

  public Instant createdAt() {
    return createdAt;
  }

  /**
   * Resolves the destination provider key: the lower-cased {@code provider}, falling back
   * to the lower-cased {@code channel}.
   *
   * @return the provider key, or {@code null} if neither field is set
   */
  public String resolveProvider() {
    String raw = !provider.isBlank() ? provider : channel;
    if (raw.isBlank()) {
      return null;
    }
    return raw.trim().toLowerCase(Locale.ROOT);
  }

  /**
   * Returns the number of out-of-band dispatch retries this message has been through,
   * read from the {@value #DISPATCH_RETRY} metadata entry.
   *
   * @return the retry count, {@code 0} when absent or unparsable
   */
  public int dispatchRetry() {
    Object raw = metadata.get(DISPATCH_RETRY);
    if (raw instanceof Number n) {
      return Math.max(0, n.intValue());
    }
    if (raw instanceof String s) {
      try {
        return Math.max(0, Integer.parseInt(s.trim()));
      } catch (NumberFormatException e) {
        return 0;
      }
    }
    return 0;
  }

  /**
   * Returns the metadata value for {@code key} as a string, or {@code ""} when absent.
   */
  public String metadataString(String key) {
    Object value = metadata.get(key);
    return value == null ? "" : String.valueOf(value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof OutboundMessage that)) return false;
    return id.equals(that.id);
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public String toString() {
    return "OutboundMessage{id=" + id + ", provider=" + provider + ", chatId=" + chatId
        + ", dispatchRetry=" + dispatchRetry() + "}";
  }

  private static String emptyToDefault(String value) {
    return value == null ? "" : value;
  }

  private static String newMessageId() {
    return UlidCreator.getMonotonicUlid().toString();
  }

  /**
   * Builder for {@link OutboundMessage}.
   */
  public static final class Builder {
    private String id;
    private String provider;
    private String channel;
    private String chatId;
    private String threadId;
    private String replyTo;
    private String senderId;
    private String content;
    private final List<MediaItem> media = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private Instant createdAt;

    private Builder() {
    }

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder provider(String provider) {
      this.provider = provider;
      return this;
    }

    public Builder channel(String channel) {
      this.channel = channel;
      return this;
    }

    public Builder chatId(String chatId) {
      this.chatId = chatId;
      return this;
    }

    public Builder threadId(String threadId) {
      this.threadId = threadId;
      return this;
    }

    public Builder replyTo(String replyTo) {
      this.replyTo = replyTo;
      return this;
    }

    public Builder senderId(String senderId) {
      this.senderId = senderId;
      return this;
    }

    public Builder content(String content) {
      this.content = content;
      return this;
    }

    public Builder addMedia(MediaItem item) {
      this.media.add(Objects.requireNonNull(item, "item"));
      return this;
    }

    public Builder media(List<MediaItem> media) {
      this.media.clear();
      if (media != null) {
        this.media.addAll(media);
      }
      return this;
    }

    public Builder metadata(String key, Object value) {
      Objects.requireNonNull(key, "key");
      if (value == null) {
        this.metadata.remove(key);
      } else {
        this.metadata.put(key, value);
      }
      return this;
    }

    public Builder metadata(Map<String, ?> metadata) {
      this.metadata.clear();
      if (metadata != null) {
        metadata.forEach((k, v) -> {
          if (v != null) {
            this.metadata.put(k, v);
          }
        });
      }
      return this;
    }

    public Builder removeMetadata(String key) {
      this.metadata.remove(key);
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    /**
     * Builds the message.
     *
     * @return a new {@link OutboundMessage}
     * @throws IllegalArgumentException if {@code id} is empty or metadata has a null key
     */
    public OutboundMessage build() {
      return new OutboundMessage(this);
    }
  }
}
