/**
 * Retry with exponential backoff, coordinated with the circuit breakers.
 *
 * @see msgbus.retry.RetryCoordinator
 * @see msgbus.retry.RetryPolicy
 */
package msgbus.retry;
