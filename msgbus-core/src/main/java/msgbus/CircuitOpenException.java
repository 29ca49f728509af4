package msgbus;

import msgbus.circuit.CircuitBreakerState;

/**
 * Signals that delivery for a message type was skipped because its circuit breaker is open.
 *
 * <p>This is an expected operational condition: the breaker half-opens on its own once
 * the open timeout has elapsed.
 */
public class CircuitOpenException extends MessageBusException {

  private final int typeCode;
  private final CircuitBreakerState state;

  public CircuitOpenException(int typeCode, CircuitBreakerState state) {
    super("Circuit breaker " + state + " for message type " + typeCode);
    this.typeCode = typeCode;
    this.state = state;
  }

  public int typeCode() {
    return typeCode;
  }

  public CircuitBreakerState state() {
    return state;
  }
}
