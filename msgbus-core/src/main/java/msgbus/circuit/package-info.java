/**
 * Per-message-type circuit breakers.
 *
 * @see msgbus.circuit.CircuitBreakerRegistry
 */
package msgbus.circuit;
