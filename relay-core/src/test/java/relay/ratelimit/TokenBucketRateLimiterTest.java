package relay.ratelimit;

import org.junit.jupiter.api.Test;
import relay.ManualClock;

import static org.junit.jupiter.api.Assertions.*;

class TokenBucketRateLimiterTest {
  private final ManualClock clock = new ManualClock();

  private TokenBucketRateLimiter limiter(long capacity, long rate, long intervalMs) {
    return TokenBucketRateLimiter.builder()
        .capacity(capacity)
        .refillRate(rate)
        .refillIntervalMs(intervalMs)
        .clock(clock)
        .build();
  }

  @Test
  void drainsCapacityThenRejects() {
    TokenBucketRateLimiter limiter = limiter(5, 1, 1000);

    for (int i = 0; i < 5; i++) {
      assertTrue(limiter.tryConsume(), "token " + i);
    }
    assertFalse(limiter.tryConsume());
  }

  @Test
  void waitTimeLeadsToNextToken() {
    TokenBucketRateLimiter limiter = limiter(5, 1, 1000);
    for (int i = 0; i < 5; i++) {
      limiter.tryConsume();
    }
    clock.advance(300);

    long wait = limiter.waitTimeMs();

    assertEquals(700, wait);
    clock.advance(wait);
    assertTrue(limiter.tryConsume());
    assertFalse(limiter.tryConsume());
  }

  @Test
  void waitTimeIsZeroWhenTokensRemain() {
    assertEquals(0, limiter(2, 1, 1000).waitTimeMs());
  }

  @Test
  void refillIsCappedAtCapacity() {
    TokenBucketRateLimiter limiter = limiter(3, 2, 100);
    limiter.tryConsume(3);

    clock.advance(10_000_000);

    assertEquals(3, limiter.available());
  }

  @Test
  void partialIntervalsCarryOver() {
    TokenBucketRateLimiter limiter = limiter(10, 1, 1000);
    limiter.tryConsume(10);

    clock.advance(600);
    assertEquals(0, limiter.available());
    clock.advance(600);
    assertEquals(1, limiter.available());
    clock.advance(800);
    assertEquals(2, limiter.available());
  }

  @Test
  void rejectedMultiTokenRequestLeavesBucketUnchanged() {
    TokenBucketRateLimiter limiter = limiter(3, 1, 1000);

    assertFalse(limiter.tryConsume(4));
    assertEquals(3, limiter.available());
  }

  @Test
  void builderRejectsNonPositiveSettings() {
    assertThrows(IllegalArgumentException.class, () -> limiter(0, 1, 1000));
    assertThrows(IllegalArgumentException.class, () -> limiter(1, 0, 1000));
    assertThrows(IllegalArgumentException.class, () -> limiter(1, 1, 0));
  }
}
