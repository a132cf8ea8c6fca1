package relay.breaker;

/**
 * State of a {@link CircuitBreaker}.
 */
public enum CircuitState {
  /** Traffic flows; consecutive failures are counted. */
  CLOSED,
  /** Traffic is rejected until the reset timeout elapses. */
  OPEN,
  /** A bounded number of trial requests probe whether the destination recovered. */
  HALF_OPEN
}
