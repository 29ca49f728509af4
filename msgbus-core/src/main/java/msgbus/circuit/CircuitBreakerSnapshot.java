package msgbus.circuit;

import java.time.Instant;

/**
 * Point-in-time view of one breaker.
 *
 * @param typeCode             the message type code
 * @param state                current state
 * @param consecutiveFailures  failures counted while closed
 * @param consecutiveSuccesses successes counted while half-open
 * @param lastTransition       time of the last state change, or of creation
 * @param config               thresholds in effect for this type
 */
public record CircuitBreakerSnapshot(int typeCode, CircuitBreakerState state,
    int consecutiveFailures, int consecutiveSuccesses, Instant lastTransition,
    CircuitBreakerConfig config) {
}
