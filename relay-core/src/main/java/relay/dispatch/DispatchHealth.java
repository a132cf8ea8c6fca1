package relay.dispatch;

import relay.breaker.CircuitState;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Point-in-time snapshot of a {@link DispatchService}.
 *
 * @param running         whether the consume loop is active
 * @param dedupeCacheSize live entries in the dedupe cache
 * @param pendingRetries  scheduled out-of-band retries not yet fired
 * @param availableTokens tokens left in the rate limiter
 * @param circuitStates   breaker state per provider; empty when circuit gating is off
 */
public record DispatchHealth(
    boolean running,
    int dedupeCacheSize,
    int pendingRetries,
    long availableTokens,
    Map<String, CircuitState> circuitStates) {

  public DispatchHealth {
    circuitStates = circuitStates == null
        ? Map.of()
        : Collections.unmodifiableMap(new TreeMap<>(circuitStates));
  }
}
