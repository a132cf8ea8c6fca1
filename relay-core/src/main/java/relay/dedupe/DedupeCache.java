package relay.dedupe;

import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Insertion-ordered map of recently delivered dedupe keys with time-based expiry.
 *
 * <p>An entry is honored only while {@code now - deliveredAt <= ttlMs}. Expired entries
 * are pruned opportunistically; when the map grows past {@code maxSize + 500}, it is
 * trimmed back to {@code maxSize} by dropping the oldest entries.
 *
 * <p>This class is thread-safe.
 */
public final class DedupeCache {
  static final int TRIM_SLACK = 500;

  private final Map<String, Entry> entries = new LinkedHashMap<>();
  private final long ttlMs;
  private final int maxSize;
  private final Clock clock;

  /** A delivered message id and when it was delivered. */
  public record Entry(long atMs, String messageId) {
  }

  public DedupeCache(long ttlMs, int maxSize) {
    this(ttlMs, maxSize, Clock.systemUTC());
  }

  /**
   * @param ttlMs   how long a delivery suppresses an equivalent message
   * @param maxSize soft bound on cached keys
   * @param clock   time source
   */
  public DedupeCache(long ttlMs, int maxSize, Clock clock) {
    if (ttlMs < 0) {
      throw new IllegalArgumentException("ttlMs must be >= 0, got: " + ttlMs);
    }
    if (maxSize < 1) {
      throw new IllegalArgumentException("maxSize must be >= 1, got: " + maxSize);
    }
    this.ttlMs = ttlMs;
    this.maxSize = maxSize;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns the live entry for {@code key}, or {@code null} if absent or expired.
   */
  public synchronized Entry lookup(String key) {
    Entry entry = entries.get(key);
    if (entry == null || clock.millis() - entry.atMs() > ttlMs) {
      return null;
    }
    return entry;
  }

  public synchronized void record(String key, String messageId) {
    entries.put(key, new Entry(clock.millis(), messageId == null ? "" : messageId));
    if (entries.size() > maxSize + TRIM_SLACK) {
      trim();
    }
  }

  /** Removes expired entries. */
  public synchronized void prune() {
    if (entries.isEmpty()) return;
    long now = clock.millis();
    entries.values().removeIf(e -> now - e.atMs() > ttlMs);
  }

  /** Removes expired entries, then the oldest ones until at most {@code maxSize} remain. */
  public synchronized void trim() {
    prune();
    int overflow = entries.size() - maxSize;
    Iterator<String> keys = entries.keySet().iterator();
    while (overflow-- > 0 && keys.hasNext()) {
      keys.next();
      keys.remove();
    }
  }

  public synchronized int size() {
    return entries.size();
  }

  public long ttlMs() {
    return ttlMs;
  }

  public int maxSize() {
    return maxSize;
  }
}
