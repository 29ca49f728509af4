package msgbus.circuit;

import msgbus.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerRegistryTest {

  private static final int TYPE = 42;
  private static final IllegalStateException BOOM = new IllegalStateException("boom");

  private final MutableClock clock = new MutableClock();
  private final List<CircuitTransition> transitions = new ArrayList<>();

  private CircuitBreakerRegistry registry(int failureThreshold, int successThreshold) {
    CircuitBreakerRegistry registry = CircuitBreakerRegistry.builder()
        .defaultConfig(CircuitBreakerConfig.builder()
            .failureThreshold(failureThreshold)
            .successThreshold(successThreshold)
            .openTimeout(Duration.ofSeconds(10))
            .build())
        .clock(clock)
        .build();
    registry.onTransition(transitions::add);
    return registry;
  }

  @Test
  void unknownTypeIsClosed() {
    CircuitBreakerRegistry registry = registry(3, 2);

    assertEquals(CircuitBreakerState.CLOSED, registry.getState(TYPE));
    assertFalse(registry.isOpen(TYPE));
    assertTrue(registry.snapshot().isEmpty());
  }

  @Test
  void opensAfterConsecutiveFailuresReachThreshold() {
    CircuitBreakerRegistry registry = registry(3, 2);

    registry.recordFailure(TYPE, BOOM);
    registry.recordFailure(TYPE, BOOM);
    assertEquals(CircuitBreakerState.CLOSED, registry.getState(TYPE));

    registry.recordFailure(TYPE, BOOM);

    assertEquals(CircuitBreakerState.OPEN, registry.getState(TYPE));
    assertTrue(registry.isOpen(TYPE));
    assertFalse(registry.tryAcquire(TYPE));
    assertFalse(registry.allowsDelivery(TYPE));
    assertEquals(1, transitions.size());
    CircuitTransition t = transitions.get(0);
    assertEquals(TYPE, t.typeCode());
    assertEquals(CircuitBreakerState.CLOSED, t.from());
    assertEquals(CircuitBreakerState.OPEN, t.to());
    assertEquals(3, t.failureCount());
    assertEquals(clock.instant(), t.timestamp());
  }

  @Test
  void successWhileClosedResetsFailureCount() {
    CircuitBreakerRegistry registry = registry(3, 2);

    registry.recordFailure(TYPE, BOOM);
    registry.recordFailure(TYPE, BOOM);
    registry.recordSuccess(TYPE);
    registry.recordFailure(TYPE, BOOM);
    registry.recordFailure(TYPE, BOOM);

    assertEquals(CircuitBreakerState.CLOSED, registry.getState(TYPE));
    assertEquals(2, registry.snapshot().get(TYPE).consecutiveFailures());
  }

  @Test
  void successWhileOpenHasNoEffect() {
    CircuitBreakerRegistry registry = registry(3, 2);
    for (int i = 0; i < 3; i++) {
      registry.recordFailure(TYPE, BOOM);
    }

    registry.recordSuccess(TYPE);
    registry.recordSuccess(TYPE);
    registry.recordFailure(TYPE, BOOM);

    assertEquals(CircuitBreakerState.OPEN, registry.getState(TYPE));
    assertEquals(1, transitions.size());
  }

  @Test
  void stateReadsDoNotTriggerHalfOpen() {
    CircuitBreakerRegistry registry = registry(1, 1);
    registry.recordFailure(TYPE, BOOM);

    clock.advance(Duration.ofSeconds(11));

    assertTrue(registry.isOpen(TYPE));
    assertEquals(CircuitBreakerState.OPEN, registry.getState(TYPE));
  }

  @Test
  void halfOpensLazilyAfterTimeoutAndClosesAfterSuccesses() {
    CircuitBreakerRegistry registry = registry(3, 2);
    for (int i = 0; i < 3; i++) {
      registry.recordFailure(TYPE, BOOM);
    }

    clock.advance(Duration.ofSeconds(9));
    assertFalse(registry.tryAcquire(TYPE));
    assertEquals(CircuitBreakerState.OPEN, registry.getState(TYPE));

    clock.advance(Duration.ofSeconds(1));
    assertTrue(registry.tryAcquire(TYPE));
    assertEquals(CircuitBreakerState.HALF_OPEN, registry.getState(TYPE));

    registry.recordSuccess(TYPE);
    assertEquals(CircuitBreakerState.HALF_OPEN, registry.getState(TYPE));
    assertTrue(registry.tryAcquire(TYPE));
    registry.recordSuccess(TYPE);

    assertEquals(CircuitBreakerState.CLOSED, registry.getState(TYPE));
    assertEquals(List.of(CircuitBreakerState.OPEN, CircuitBreakerState.HALF_OPEN,
        CircuitBreakerState.CLOSED), transitions.stream().map(CircuitTransition::to).toList());
  }

  @Test
  void failureWhileHalfOpenReopensAndRestartsTimeout() {
    CircuitBreakerRegistry registry = registry(3, 2);
    for (int i = 0; i < 3; i++) {
      registry.recordFailure(TYPE, BOOM);
    }
    clock.advance(Duration.ofSeconds(10));
    assertTrue(registry.tryAcquire(TYPE));

    registry.recordFailure(TYPE, BOOM);

    assertEquals(CircuitBreakerState.OPEN, registry.getState(TYPE));
    clock.advance(Duration.ofSeconds(5));
    assertFalse(registry.tryAcquire(TYPE));
    clock.advance(Duration.ofSeconds(5));
    assertTrue(registry.tryAcquire(TYPE));
    assertEquals(CircuitBreakerState.HALF_OPEN, registry.getState(TYPE));
  }

  @Test
  void halfOpenLimitsConcurrentTrials() {
    CircuitBreakerRegistry registry = registry(1, 2);
    registry.recordFailure(TYPE, BOOM);
    clock.advance(Duration.ofSeconds(10));

    assertTrue(registry.tryAcquire(TYPE));
    assertTrue(registry.tryAcquire(TYPE));
    assertFalse(registry.tryAcquire(TYPE));
    assertTrue(registry.allowsDelivery(TYPE));

    registry.recordSuccess(TYPE);
    assertTrue(registry.tryAcquire(TYPE));
  }

  @Test
  void resetForcesClosedAndEmitsTransition() {
    CircuitBreakerRegistry registry = registry(1, 1);
    registry.recordFailure(TYPE, BOOM);

    registry.reset(TYPE);

    assertEquals(CircuitBreakerState.CLOSED, registry.getState(TYPE));
    assertEquals(0, registry.snapshot().get(TYPE).consecutiveFailures());
    assertEquals(CircuitBreakerState.CLOSED, transitions.get(transitions.size() - 1).to());

    int before = transitions.size();
    registry.reset(TYPE);
    assertEquals(before, transitions.size());
  }

  @Test
  void typesAreIndependentAndConfigurable() {
    CircuitBreakerRegistry registry = CircuitBreakerRegistry.builder()
        .defaultConfig(CircuitBreakerConfig.builder().failureThreshold(1).build())
        .config(7, CircuitBreakerConfig.builder().failureThreshold(5).build())
        .clock(clock)
        .build();

    registry.recordFailure(TYPE, BOOM);
    registry.recordFailure(7, BOOM);

    Map<Integer, CircuitBreakerSnapshot> snapshot = registry.snapshot();
    assertEquals(CircuitBreakerState.OPEN, snapshot.get(TYPE).state());
    assertEquals(CircuitBreakerState.CLOSED, snapshot.get(7).state());
    assertEquals(5, snapshot.get(7).config().failureThreshold());
  }

  @Test
  void failingListenerDoesNotBreakOthers() {
    CircuitBreakerRegistry registry = registry(1, 1);
    List<CircuitTransition> seen = new ArrayList<>();
    registry.onTransition(t -> {
      throw new IllegalStateException("listener failure");
    });
    registry.onTransition(seen::add);

    assertDoesNotThrow(() -> registry.recordFailure(TYPE, BOOM));
    assertEquals(1, seen.size());
  }

  @Test
  void removedListenerIsNotNotified() {
    CircuitBreakerRegistry registry = registry(1, 1);
    List<CircuitTransition> seen = new ArrayList<>();
    Runnable remove = registry.onTransition(seen::add);

    remove.run();
    registry.recordFailure(TYPE, BOOM);

    assertTrue(seen.isEmpty());
  }
}
