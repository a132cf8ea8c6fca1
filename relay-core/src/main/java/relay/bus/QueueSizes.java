package relay.bus;

/**
 * Snapshot of pending message counts on the bus.
 */
public record QueueSizes(int inbound, int outbound, int total) {
}
