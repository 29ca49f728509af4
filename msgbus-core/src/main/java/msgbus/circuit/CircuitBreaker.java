package msgbus.circuit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Circuit breaker for a single message type.
 *
 * <p>All state is guarded by this object's monitor. Mutating methods return the
 * {@link CircuitTransition} they caused, or {@code null}, so that callers can notify
 * listeners after the lock is released.
 */
final class CircuitBreaker {

  private final int typeCode;
  private final CircuitBreakerConfig config;
  private final Clock clock;

  private CircuitBreakerState state = CircuitBreakerState.CLOSED;
  private int consecutiveFailures;
  private int consecutiveSuccesses;
  private int trialsInFlight;
  private Instant lastTransition;

  CircuitBreaker(int typeCode, CircuitBreakerConfig config, Clock clock) {
    this.typeCode = typeCode;
    this.config = config;
    this.clock = clock;
    this.lastTransition = clock.instant();
  }

  /** Performs the lazy OPEN to HALF_OPEN check without taking a trial permit. */
  synchronized CircuitTransition refresh() {
    return halfOpenIfDue();
  }

  synchronized boolean allowsDelivery() {
    return state != CircuitBreakerState.OPEN;
  }

  /**
   * Requests permission for one attempt. In HALF_OPEN this takes one of the limited trial
   * permits, which is returned by the next {@link #onSuccess()} or {@link #onFailure()}.
   */
  synchronized boolean tryAcquire() {
    switch (state) {
      case CLOSED:
        return true;
      case HALF_OPEN:
        if (trialsInFlight >= config.halfOpenMaxTrialCalls()) {
          return false;
        }
        trialsInFlight++;
        return true;
      default:
        return false;
    }
  }

  synchronized CircuitTransition onSuccess() {
    switch (state) {
      case CLOSED:
        consecutiveFailures = 0;
        return null;
      case HALF_OPEN:
        releaseTrial();
        consecutiveSuccesses++;
        if (consecutiveSuccesses >= config.successThreshold()) {
          return transitionTo(CircuitBreakerState.CLOSED);
        }
        return null;
      default:
        return null;
    }
  }

  synchronized CircuitTransition onFailure() {
    switch (state) {
      case CLOSED:
        consecutiveFailures++;
        if (consecutiveFailures >= config.failureThreshold()) {
          return transitionTo(CircuitBreakerState.OPEN);
        }
        return null;
      case HALF_OPEN:
        releaseTrial();
        consecutiveFailures++;
        return transitionTo(CircuitBreakerState.OPEN);
      default:
        return null;
    }
  }

  synchronized CircuitTransition reset() {
    if (state == CircuitBreakerState.CLOSED) {
      consecutiveFailures = 0;
      consecutiveSuccesses = 0;
      return null;
    }
    return transitionTo(CircuitBreakerState.CLOSED);
  }

  synchronized CircuitBreakerState state() {
    return state;
  }

  synchronized CircuitBreakerSnapshot snapshot() {
    return new CircuitBreakerSnapshot(typeCode, state, consecutiveFailures,
        consecutiveSuccesses, lastTransition, config);
  }

  private CircuitTransition halfOpenIfDue() {
    if (state != CircuitBreakerState.OPEN) {
      return null;
    }
    Duration elapsed = Duration.between(lastTransition, clock.instant());
    if (elapsed.compareTo(config.openTimeout()) < 0) {
      return null;
    }
    return transitionTo(CircuitBreakerState.HALF_OPEN);
  }

  private void releaseTrial() {
    if (trialsInFlight > 0) {
      trialsInFlight--;
    }
  }

  private CircuitTransition transitionTo(CircuitBreakerState next) {
    CircuitBreakerState previous = state;
    int failures = consecutiveFailures;
    state = next;
    lastTransition = clock.instant();
    consecutiveSuccesses = 0;
    trialsInFlight = 0;
    if (next != CircuitBreakerState.OPEN) {
      consecutiveFailures = 0;
    }
    return new CircuitTransition(typeCode, previous, next, failures, lastTransition);
  }
}
