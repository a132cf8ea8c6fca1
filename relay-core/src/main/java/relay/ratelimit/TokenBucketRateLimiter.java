package relay.ratelimit;

import java.time.Clock;
import java.util.Objects;

/**
 * Token-bucket throughput governor for outbound sends.
 *
 * <p>The bucket starts full. Refill is computed lazily on each call from elapsed time:
 * {@code refillRate} tokens are added per whole {@code refillIntervalMs} elapsed, capped
 * at {@code capacity}. The last-refill mark only advances by whole intervals, so the
 * sub-interval remainder carries over and frequent polling neither drifts nor
 * over-refills.
 *
 * <p>This class is thread-safe.
 */
public final class TokenBucketRateLimiter {
  private final long capacity;
  private final long refillRate;
  private final long refillIntervalMs;
  private final Clock clock;

  private long tokens;
  private long lastRefillAt;

  private TokenBucketRateLimiter(Builder builder) {
    if (builder.capacity < 1) {
      throw new IllegalArgumentException("capacity must be >= 1, got: " + builder.capacity);
    }
    if (builder.refillRate < 1) {
      throw new IllegalArgumentException("refillRate must be >= 1, got: " + builder.refillRate);
    }
    if (builder.refillIntervalMs < 1) {
      throw new IllegalArgumentException("refillIntervalMs must be >= 1, got: " + builder.refillIntervalMs);
    }
    this.capacity = builder.capacity;
    this.refillRate = builder.refillRate;
    this.refillIntervalMs = builder.refillIntervalMs;
    this.clock = Objects.requireNonNull(builder.clock, "clock");
    this.tokens = capacity;
    this.lastRefillAt = clock.millis();
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean tryConsume() {
    return tryConsume(1);
  }

  /**
   * Takes {@code n} tokens if available. A rejected call leaves the bucket unchanged.
   *
   * @param n tokens to take, must be positive
   * @return {@code true} if the tokens were taken
   */
  public synchronized boolean tryConsume(int n) {
    if (n < 1) {
      throw new IllegalArgumentException("n must be >= 1, got: " + n);
    }
    refill();
    if (tokens >= n) {
      tokens -= n;
      return true;
    }
    return false;
  }

  /**
   * Returns how long until one token is available, {@code 0} if one already is.
   * Meant as a single bounded sleep hint.
   */
  public synchronized long waitTimeMs() {
    refill();
    if (tokens >= 1) {
      return 0L;
    }
    long deficit = 1 - tokens;
    long intervalsNeeded = (deficit + refillRate - 1) / refillRate;
    long elapsed = clock.millis() - lastRefillAt;
    return Math.max(0L, intervalsNeeded * refillIntervalMs - elapsed);
  }

  public synchronized long available() {
    refill();
    return tokens;
  }

  public long capacity() {
    return capacity;
  }

  private void refill() {
    long now = clock.millis();
    long elapsed = now - lastRefillAt;
    if (elapsed < refillIntervalMs) {
      return;
    }
    long intervals = elapsed / refillIntervalMs;
    // Saturate rather than overflow when the bucket sat idle for a very long time.
    long added = intervals > (capacity / refillRate) + 1 ? capacity : intervals * refillRate;
    tokens = Math.min(capacity, tokens + added);
    lastRefillAt = now - (elapsed % refillIntervalMs);
  }

  /** Builder for {@link TokenBucketRateLimiter}. */
  public static final class Builder {
    private long capacity = 30;
    private long refillRate = 1;
    private long refillIntervalMs = 1000;
    private Clock clock = Clock.systemUTC();

    private Builder() {
    }

    /** Maximum tokens held. Optional, defaults to {@code 30}. */
    public Builder capacity(long capacity) {
      this.capacity = capacity;
      return this;
    }

    /** Tokens added per interval. Optional, defaults to {@code 1}. */
    public Builder refillRate(long refillRate) {
      this.refillRate = refillRate;
      return this;
    }

    /** Refill interval. Optional, defaults to {@code 1000} ms. */
    public Builder refillIntervalMs(long refillIntervalMs) {
      this.refillIntervalMs = refillIntervalMs;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public TokenBucketRateLimiter build() {
      return new TokenBucketRateLimiter(this);
    }
  }
}
