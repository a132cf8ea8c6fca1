package relay.bus;

/**
 * Number of items discarded from each bus lane by {@link MessageBus#drain(int)}.
 */
public record DrainResult(int inbound, int outbound, int progress) {
}
