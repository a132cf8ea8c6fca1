package relay.breaker;

import java.time.Clock;
import java.util.Objects;

/**
 * Failure-gating state machine for a single destination.
 *
 * <p>Transitions:
 * <ul>
 *   <li>{@code CLOSED -> OPEN} after {@code failureThreshold} consecutive failures</li>
 *   <li>{@code OPEN -> HALF_OPEN} once {@code resetTimeoutMs} has elapsed since the last
 *       failure, evaluated lazily on the next availability check</li>
 *   <li>{@code HALF_OPEN -> CLOSED} on the next success</li>
 *   <li>{@code HALF_OPEN -> OPEN} on the next failure</li>
 * </ul>
 *
 * <p>While half-open at most {@code halfOpenMax} trial requests are admitted by
 * {@link #tryAcquire()}; {@link #canAcquire()} answers the same question without taking a
 * trial slot.
 *
 * <p>This class is thread-safe.
 */
public final class CircuitBreaker {
  private final int failureThreshold;
  private final long resetTimeoutMs;
  private final int halfOpenMax;
  private final Clock clock;

  private CircuitState state = CircuitState.CLOSED;
  private int failureCount;
  private int halfOpenAttempts;
  private long lastFailureAt;

  private CircuitBreaker(Builder builder) {
    if (builder.failureThreshold < 1) {
      throw new IllegalArgumentException("failureThreshold must be >= 1, got: " + builder.failureThreshold);
    }
    if (builder.resetTimeoutMs < 0) {
      throw new IllegalArgumentException("resetTimeoutMs must be >= 0, got: " + builder.resetTimeoutMs);
    }
    if (builder.halfOpenMax < 1) {
      throw new IllegalArgumentException("halfOpenMax must be >= 1, got: " + builder.halfOpenMax);
    }
    this.failureThreshold = builder.failureThreshold;
    this.resetTimeoutMs = builder.resetTimeoutMs;
    this.halfOpenMax = builder.halfOpenMax;
    this.clock = Objects.requireNonNull(builder.clock, "clock");
  }

  public static Builder builder() {
    return new Builder();
  }

  public synchronized CircuitState state() {
    return state;
  }

  public synchronized int failureCount() {
    return failureCount;
  }

  /**
   * Returns whether a request would currently be admitted. Does not consume a half-open
   * trial slot; intended for health displays.
   */
  public synchronized boolean canAcquire() {
    maybeHalfOpen();
    if (state == CircuitState.CLOSED) return true;
    return state == CircuitState.HALF_OPEN && halfOpenAttempts < halfOpenMax;
  }

  /**
   * Admits a request if the circuit allows it, consuming one half-open trial slot when
   * half-open.
   *
   * @return {@code true} if the caller may proceed
   */
  public synchronized boolean tryAcquire() {
    maybeHalfOpen();
    if (state == CircuitState.CLOSED) return true;
    if (state == CircuitState.HALF_OPEN && halfOpenAttempts < halfOpenMax) {
      halfOpenAttempts++;
      return true;
    }
    return false;
  }

  public synchronized void recordSuccess() {
    state = CircuitState.CLOSED;
    failureCount = 0;
    halfOpenAttempts = 0;
  }

  public synchronized void recordFailure() {
    failureCount++;
    lastFailureAt = clock.millis();
    if (state == CircuitState.HALF_OPEN) {
      state = CircuitState.OPEN;
      halfOpenAttempts = 0;
      return;
    }
    if (failureCount >= failureThreshold) {
      state = CircuitState.OPEN;
    }
  }

  /** Forces the circuit closed with all counters zeroed. */
  public synchronized void reset() {
    state = CircuitState.CLOSED;
    failureCount = 0;
    halfOpenAttempts = 0;
    lastFailureAt = 0;
  }

  private void maybeHalfOpen() {
    if (state == CircuitState.OPEN && clock.millis() - lastFailureAt >= resetTimeoutMs) {
      state = CircuitState.HALF_OPEN;
      halfOpenAttempts = 0;
    }
  }

  /** Builder for {@link CircuitBreaker}. */
  public static final class Builder {
    private int failureThreshold = 5;
    private long resetTimeoutMs = 30_000;
    private int halfOpenMax = 1;
    private Clock clock = Clock.systemUTC();

    private Builder() {
    }

    /**
     * Consecutive failures that open the circuit. Optional, defaults to {@code 5}.
     */
    public Builder failureThreshold(int failureThreshold) {
      this.failureThreshold = failureThreshold;
      return this;
    }

    /**
     * Time after the last failure before an open circuit admits trial requests.
     * Optional, defaults to {@code 30000} ms.
     */
    public Builder resetTimeoutMs(long resetTimeoutMs) {
      this.resetTimeoutMs = resetTimeoutMs;
      return this;
    }

    /**
     * Trial requests admitted while half-open. Optional, defaults to {@code 1}.
     */
    public Builder halfOpenMax(int halfOpenMax) {
      this.halfOpenMax = halfOpenMax;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public CircuitBreaker build() {
      return new CircuitBreaker(this);
    }
  }
}
