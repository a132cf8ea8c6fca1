package relay.breaker;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Lazily creates and holds one {@link CircuitBreaker} per destination key.
 *
 * <p>This class is thread-safe.
 */
public final class CircuitBreakerRegistry {
  private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
  private final Supplier<CircuitBreaker> factory;

  /**
   * @param factory creates a fresh breaker for a destination seen for the first time
   */
  public CircuitBreakerRegistry(Supplier<CircuitBreaker> factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  /**
   * Creates a registry whose breakers share the given settings.
   */
  public static CircuitBreakerRegistry withDefaults(int failureThreshold, long resetTimeoutMs, int halfOpenMax) {
    // Validate eagerly rather than on first use.
    CircuitBreaker.builder()
        .failureThreshold(failureThreshold)
        .resetTimeoutMs(resetTimeoutMs)
        .halfOpenMax(halfOpenMax)
        .build();
    return new CircuitBreakerRegistry(() -> CircuitBreaker.builder()
        .failureThreshold(failureThreshold)
        .resetTimeoutMs(resetTimeoutMs)
        .halfOpenMax(halfOpenMax)
        .build());
  }

  public CircuitBreaker forDestination(String destination) {
    Objects.requireNonNull(destination, "destination");
    return breakers.computeIfAbsent(destination, ignored -> factory.get());
  }

  /**
   * Returns the current state of every known destination, sorted by key.
   */
  public Map<String, CircuitState> states() {
    Map<String, CircuitState> result = new TreeMap<>();
    breakers.forEach((key, breaker) -> {
      // canAcquire() applies the lazy OPEN -> HALF_OPEN transition before reading.
      breaker.canAcquire();
      result.put(key, breaker.state());
    });
    return Collections.unmodifiableMap(result);
  }

  public boolean reset(String destination) {
    CircuitBreaker breaker = breakers.get(destination);
    if (breaker == null) {
      return false;
    }
    breaker.reset();
    return true;
  }

  public void resetAll() {
    breakers.values().forEach(CircuitBreaker::reset);
  }
}
