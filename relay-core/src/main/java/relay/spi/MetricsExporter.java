package relay.spi;

/**
 * Observability hook for exporting dispatch counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of messages delivered successfully.
     */
    void incrementDispatchSuccess();

    /**
     * Increments the count of messages answered from the dedupe cache without sending.
     */
    void incrementDispatchDeduplicated();

    /**
     * Increments the count of messages scheduled for an out-of-band retry.
     */
    void incrementDispatchRequeued();

    /**
     * Increments the count of messages written to the dead-letter store.
     */
    void incrementDispatchDead();

    /**
     * Increments the count of sends that failed with a non-retryable error.
     */
    void incrementDispatchRejected();

    /**
     * Increments the count of sends that had to wait for a rate-limit token.
     */
    default void incrementRateLimited() {
    }

    /**
     * Increments the count of transmission attempts refused by an open circuit.
     */
    default void incrementCircuitRejected() {
    }

    /**
     * Records the current depth of the bus lanes.
     *
     * @param inboundDepth  pending inbound messages
     * @param outboundDepth pending outbound messages
     */
    void recordQueueDepths(int inboundDepth, int outboundDepth);

    /**
     * Records the number of scheduled retries not yet fired.
     *
     * @param pending outstanding retry timers
     */
    default void recordPendingRetries(int pending) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementDispatchSuccess() {
        }

        @Override
        public void incrementDispatchDeduplicated() {
        }

        @Override
        public void incrementDispatchRequeued() {
        }

        @Override
        public void incrementDispatchDead() {
        }

        @Override
        public void incrementDispatchRejected() {
        }

        @Override
        public void recordQueueDepths(int inboundDepth, int outboundDepth) {
        }
    }
}
