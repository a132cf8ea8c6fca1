package relay;

import java.util.Objects;

/**
 * Attachment carried by an {@link OutboundMessage}.
 *
 * @param type one of {@code image}, {@code video}, {@code audio}, {@code file}, {@code link}
 * @param url  location of the attachment
 * @param mime optional MIME type
 * @param name optional display name
 * @param size optional size in bytes
 */
public record MediaItem(String type, String url, String mime, String name, Long size) {

  public MediaItem {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(url, "url");
  }

  public static MediaItem of(String type, String url) {
    return new MediaItem(type, url, null, null, null);
  }
}
