package relay.breaker;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerRegistryTest {

  @Test
  void createsOneBreakerPerDestination() {
    CircuitBreakerRegistry registry = CircuitBreakerRegistry.withDefaults(2, 30_000, 1);

    CircuitBreaker slack = registry.forDestination("slack");

    assertSame(slack, registry.forDestination("slack"));
    assertNotSame(slack, registry.forDestination("discord"));
  }

  @Test
  void statesAreSortedSnapshot() {
    CircuitBreakerRegistry registry = CircuitBreakerRegistry.withDefaults(1, 30_000, 1);
    registry.forDestination("telegram");
    registry.forDestination("discord").recordFailure();

    Map<String, CircuitState> states = registry.states();

    assertEquals(java.util.List.of("discord", "telegram"), java.util.List.copyOf(states.keySet()));
    assertEquals(CircuitState.OPEN, states.get("discord"));
    assertEquals(CircuitState.CLOSED, states.get("telegram"));
  }

  @Test
  void resetClosesKnownDestinations() {
    CircuitBreakerRegistry registry = CircuitBreakerRegistry.withDefaults(1, 30_000, 1);
    registry.forDestination("slack").recordFailure();
    registry.forDestination("discord").recordFailure();

    assertTrue(registry.reset("slack"));
    assertFalse(registry.reset("unknown"));
    assertEquals(CircuitState.CLOSED, registry.forDestination("slack").state());

    registry.resetAll();
    assertEquals(CircuitState.CLOSED, registry.forDestination("discord").state());
  }

  @Test
  void withDefaultsValidatesEagerly() {
    assertThrows(IllegalArgumentException.class, () -> CircuitBreakerRegistry.withDefaults(0, 1, 1));
  }
}
