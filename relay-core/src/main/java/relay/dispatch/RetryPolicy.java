package relay.dispatch;

/**
 * Strategy for computing the delay before retrying a failed delivery.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next attempt.
     *
     * @param attempt the number of failed attempts so far (1-based)
     * @return delay in milliseconds (non-negative); {@code 0} for {@code attempt <= 0}
     */
    long computeDelayMs(int attempt);
}
