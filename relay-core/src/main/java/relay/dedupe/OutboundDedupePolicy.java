package relay.dedupe;

import relay.OutboundMessage;

/**
 * Decides what counts as "the same message" for outbound deduplication.
 *
 * <p>Implementations must be deterministic and side-effect free: two messages with the
 * same key sent within the dedupe TTL are delivered at most once.
 *
 * @see DefaultOutboundDedupePolicy
 */
@FunctionalInterface
public interface OutboundDedupePolicy {

  /**
   * Computes the dedupe key for a message bound for {@code provider}.
   *
   * @param provider resolved destination provider
   * @param message  the outbound message
   * @return a stable key, never {@code null}
   */
  String key(String provider, OutboundMessage message);
}
