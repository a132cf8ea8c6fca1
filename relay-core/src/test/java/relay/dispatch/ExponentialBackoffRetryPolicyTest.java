package relay.dispatch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void firstAttemptIsBasePlusJitter() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(700, 25_000, 250);

    for (int i = 0; i < 200; i++) {
      long delay = policy.computeDelayMs(1);
      assertTrue(delay >= 700 && delay < 950, "got " + delay);
    }
  }

  @Test
  void exponentialPartDoublesUntilCapped() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(700, 25_000, 0);

    assertEquals(700, policy.computeDelayMs(1));
    assertEquals(1400, policy.computeDelayMs(2));
    assertEquals(2800, policy.computeDelayMs(3));
    assertEquals(22_400, policy.computeDelayMs(6));
    assertEquals(25_000, policy.computeDelayMs(7));
  }

  @Test
  void delayIsNonDecreasingAndBounded() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(700, 25_000, 250);

    long previousFloor = 0;
    for (int attempt = 1; attempt <= 40; attempt++) {
      long delay = policy.computeDelayMs(attempt);
      long floor = Math.min(700L << Math.min(attempt - 1, 20), 25_000);
      assertTrue(delay >= floor && delay < floor + 250, "attempt " + attempt + " got " + delay);
      assertTrue(floor >= previousFloor);
      previousFloor = floor;
    }
  }

  @Test
  void handlesOverflowBoundary() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 60_000, 10);

    for (int attempt : new int[] {31, 32, 62, 63, 64, 1000, Integer.MAX_VALUE}) {
      long delay = policy.computeDelayMs(attempt);
      assertTrue(delay >= 60_000 && delay < 60_010, "attempt " + attempt + " got " + delay);
    }
  }

  @Test
  void nonPositiveAttemptHasNoDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(700, 25_000, 250);

    assertEquals(0, policy.computeDelayMs(0));
    assertEquals(0, policy.computeDelayMs(-3));
  }

  @Test
  void rejectsInvalidParameters() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0, 100, 0));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(100, 50, 0));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(100, 100, -1));
  }
}
