package msgbus.circuit;

/**
 * Per-type breaker state.
 *
 * <pre>
 * CLOSED --(failures >= threshold)--> OPEN --(timeout elapsed, next attempt)--> HALF_OPEN
 * HALF_OPEN --(successes >= threshold)--> CLOSED
 * HALF_OPEN --(any failure)--> OPEN
 * </pre>
 */
public enum CircuitBreakerState {
  /** Deliveries flow normally; consecutive failures are counted. */
  CLOSED,
  /** Deliveries are rejected until the open timeout elapses. */
  OPEN,
  /** A limited number of trial deliveries check whether the type has recovered. */
  HALF_OPEN
}
