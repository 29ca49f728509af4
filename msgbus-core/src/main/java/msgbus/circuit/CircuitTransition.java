package msgbus.circuit;

import java.time.Instant;

/**
 * State change of one message type's circuit breaker.
 *
 * @param typeCode     the message type code
 * @param from         the previous state
 * @param to           the new state
 * @param failureCount consecutive failures counted when the transition happened
 * @param timestamp    when the transition happened
 */
public record CircuitTransition(int typeCode, CircuitBreakerState from, CircuitBreakerState to,
    int failureCount, Instant timestamp) {
}
