package relay.dispatch;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with additive jitter.
 *
 * <p>Delay formula: {@code min(baseDelayMs * 2^(attempt-1), maxDelayMs) + random[0, jitterMs)}.
 * The result therefore never exceeds {@code maxDelayMs + jitterMs}.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final long jitterMs;

  /**
   * @param baseDelayMs delay for the first retry (milliseconds)
   * @param maxDelayMs  cap for the exponential part (milliseconds)
   * @param jitterMs    exclusive upper bound of the random addition; {@code 0} disables jitter
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, long jitterMs) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    if (jitterMs < 0) {
      throw new IllegalArgumentException("jitterMs must be >= 0, got: " + jitterMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitterMs = jitterMs;
  }

  @Override
  public long computeDelayMs(int attempt) {
    if (attempt <= 0) {
      return 0L;
    }
    long capped;
    if (attempt >= 63) {
      capped = maxDelayMs;
    } else {
      long factor = 1L << (attempt - 1);
      // shift overflow guard
      capped = factor > maxDelayMs / baseDelayMs ? maxDelayMs : Math.min(maxDelayMs, baseDelayMs * factor);
    }
    long jitter = jitterMs == 0 ? 0 : ThreadLocalRandom.current().nextLong(jitterMs);
    return capped + jitter;
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }

  public long jitterMs() {
    return jitterMs;
  }
}
