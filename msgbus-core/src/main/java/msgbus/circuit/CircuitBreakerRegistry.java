package msgbus.circuit;

import msgbus.spi.MetricNames;
import msgbus.spi.MetricsExporter;
import msgbus.util.TransitionListeners;

import java.time.Clock;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lazily created circuit breakers, one per message type.
 *
 * <p>Each breaker has its own lock; operations on different types never contend.
 * Transition listeners run on the thread that caused the transition, after the breaker's
 * lock has been released.
 *
 * <pre>{@code
 * CircuitBreakerRegistry breakers = CircuitBreakerRegistry.builder()
 *     .defaultConfig(CircuitBreakerConfig.builder().failureThreshold(3).build())
 *     .config(PAYMENT_CAPTURED, CircuitBreakerConfig.builder().failureThreshold(10).build())
 *     .clock(clock)
 *     .build();
 * }</pre>
 */
public final class CircuitBreakerRegistry {
  private static final Logger logger = Logger.getLogger(CircuitBreakerRegistry.class.getName());

  private final CircuitBreakerConfig defaultConfig;
  private final Map<Integer, CircuitBreakerConfig> typeConfigs;
  private final Clock clock;
  private final MetricsExporter metrics;
  private final Map<Integer, CircuitBreaker> breakers = new ConcurrentHashMap<>();
  private final TransitionListeners<CircuitTransition> listeners = new TransitionListeners<>();

  private CircuitBreakerRegistry(Builder builder) {
    this.defaultConfig = Objects.requireNonNull(builder.defaultConfig, "defaultConfig");
    this.typeConfigs = Map.copyOf(builder.typeConfigs);
    this.clock = Objects.requireNonNull(builder.clock, "clock");
    this.metrics = builder.metrics == null ? MetricsExporter.NOOP : builder.metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns whether the type currently admits deliveries, moving an expired OPEN breaker to
   * HALF_OPEN first. Does not take a half-open trial permit.
   *
   * @param typeCode the message type code
   * @return {@code false} if the breaker is open
   */
  public boolean allowsDelivery(int typeCode) {
    CircuitBreaker breaker = breaker(typeCode);
    fire(breaker.refresh());
    return breaker.allowsDelivery();
  }

  /**
   * Requests permission for a single delivery attempt. While half-open, at most
   * {@link CircuitBreakerConfig#halfOpenMaxTrialCalls()} attempts are admitted until their
   * results are recorded.
   *
   * @param typeCode the message type code
   * @return {@code true} if the attempt may proceed
   */
  public boolean tryAcquire(int typeCode) {
    CircuitBreaker breaker = breaker(typeCode);
    fire(breaker.refresh());
    return breaker.tryAcquire();
  }

  public void recordSuccess(int typeCode) {
    fire(breaker(typeCode).onSuccess());
  }

  /**
   * Records a failed attempt. Has no effect while the breaker is open.
   *
   * @param typeCode the message type code
   * @param error    the failure, used for logging; may be {@code null}
   */
  public void recordFailure(int typeCode, Throwable error) {
    CircuitTransition transition = breaker(typeCode).onFailure();
    if (transition != null && error != null) {
      logger.log(Level.FINE, "Failure that opened circuit for type " + typeCode, error);
    }
    fire(transition);
  }

  /** Pure read: does not perform the lazy half-open check. */
  public boolean isOpen(int typeCode) {
    return getState(typeCode) == CircuitBreakerState.OPEN;
  }

  /**
   * Returns the current state without side effects. Types that never recorded an attempt
   * report {@link CircuitBreakerState#CLOSED}.
   *
   * @param typeCode the message type code
   * @return the breaker state
   */
  public CircuitBreakerState getState(int typeCode) {
    CircuitBreaker breaker = breakers.get(typeCode);
    return breaker == null ? CircuitBreakerState.CLOSED : breaker.state();
  }

  /**
   * Forces the breaker to CLOSED and zeroes its counters.
   *
   * @param typeCode the message type code
   */
  public void reset(int typeCode) {
    CircuitBreaker breaker = breakers.get(typeCode);
    if (breaker != null) {
      fire(breaker.reset());
    }
  }

  /**
   * Returns a snapshot of every breaker created so far, ordered by type code.
   *
   * @return type code to snapshot
   */
  public Map<Integer, CircuitBreakerSnapshot> snapshot() {
    Map<Integer, CircuitBreakerSnapshot> result = new TreeMap<>();
    breakers.forEach((code, breaker) -> result.put(code, breaker.snapshot()));
    return Collections.unmodifiableMap(result);
  }

  public CircuitBreakerConfig configFor(int typeCode) {
    return typeConfigs.getOrDefault(typeCode, defaultConfig);
  }

  /**
   * Registers a transition listener.
   *
   * @param listener the callback
   * @return a handle that removes the listener when run
   */
  public Runnable onTransition(Consumer<? super CircuitTransition> listener) {
    return listeners.add(listener);
  }

  private CircuitBreaker breaker(int typeCode) {
    return breakers.computeIfAbsent(typeCode,
        code -> new CircuitBreaker(code, configFor(code), clock));
  }

  private void fire(CircuitTransition transition) {
    if (transition == null) {
      return;
    }
    Level level = transition.to() == CircuitBreakerState.OPEN ? Level.WARNING : Level.INFO;
    logger.log(level, "Circuit for message type {0}: {1} -> {2} (consecutive failures: {3})",
        new Object[]{transition.typeCode(), transition.from(), transition.to(),
            transition.failureCount()});
    metrics.recordCounter(MetricNames.CIRCUIT_TRANSITIONS, 1);
    metrics.recordGauge(MetricNames.CIRCUITS_NOT_CLOSED, notClosedCount());
    listeners.fire(transition);
  }

  private long notClosedCount() {
    return breakers.values().stream()
        .filter(b -> b.state() != CircuitBreakerState.CLOSED)
        .count();
  }

  public static final class Builder {
    private CircuitBreakerConfig defaultConfig = CircuitBreakerConfig.defaults();
    private final Map<Integer, CircuitBreakerConfig> typeConfigs = new HashMap<>();
    private Clock clock = Clock.systemUTC();
    private MetricsExporter metrics;

    private Builder() {
    }

    public Builder defaultConfig(CircuitBreakerConfig defaultConfig) {
      this.defaultConfig = defaultConfig;
      return this;
    }

    /**
     * Overrides the thresholds for one message type.
     *
     * @param typeCode the message type code
     * @param config   the thresholds for that type
     * @return this builder
     */
    public Builder config(int typeCode, CircuitBreakerConfig config) {
      typeConfigs.put(typeCode, Objects.requireNonNull(config, "config"));
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public CircuitBreakerRegistry build() {
      return new CircuitBreakerRegistry(this);
    }
  }
}
