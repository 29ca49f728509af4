package msgbus.circuit;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable circuit breaker thresholds.
 *
 * <pre>{@code
 * CircuitBreakerConfig config = CircuitBreakerConfig.builder()
 *     .failureThreshold(3)
 *     .openTimeout(Duration.ofSeconds(10))
 *     .build();
 * }</pre>
 */
public final class CircuitBreakerConfig {

  public static final int DEFAULT_FAILURE_THRESHOLD = 5;
  public static final int DEFAULT_SUCCESS_THRESHOLD = 2;
  public static final Duration DEFAULT_OPEN_TIMEOUT = Duration.ofSeconds(60);

  private static final CircuitBreakerConfig DEFAULTS = builder().build();

  private final int failureThreshold;
  private final int successThreshold;
  private final int halfOpenMaxTrialCalls;
  private final Duration openTimeout;

  private CircuitBreakerConfig(Builder builder) {
    this.failureThreshold = builder.failureThreshold;
    this.successThreshold = builder.successThreshold;
    this.halfOpenMaxTrialCalls = builder.halfOpenMaxTrialCalls > 0
        ? builder.halfOpenMaxTrialCalls
        : builder.successThreshold;
    this.openTimeout = Objects.requireNonNull(builder.openTimeout, "openTimeout");
    if (failureThreshold < 1) {
      throw new IllegalArgumentException("failureThreshold must be >= 1, got: " + failureThreshold);
    }
    if (successThreshold < 1) {
      throw new IllegalArgumentException("successThreshold must be >= 1, got: " + successThreshold);
    }
    if (halfOpenMaxTrialCalls < successThreshold) {
      throw new IllegalArgumentException("halfOpenMaxTrialCalls must be >= successThreshold ("
          + successThreshold + "), got: " + halfOpenMaxTrialCalls);
    }
    if (openTimeout.isNegative()) {
      throw new IllegalArgumentException("openTimeout must be >= 0, got: " + openTimeout);
    }
  }

  public static CircuitBreakerConfig defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Consecutive failures in {@link CircuitBreakerState#CLOSED} that open the breaker.
   *
   * @return the failure threshold
   */
  public int failureThreshold() {
    return failureThreshold;
  }

  /**
   * Consecutive successes in {@link CircuitBreakerState#HALF_OPEN} that close the breaker.
   *
   * @return the success threshold
   */
  public int successThreshold() {
    return successThreshold;
  }

  public int halfOpenMaxTrialCalls() {
    return halfOpenMaxTrialCalls;
  }

  public Duration openTimeout() {
    return openTimeout;
  }

  public Builder toBuilder() {
    return new Builder()
        .failureThreshold(failureThreshold)
        .successThreshold(successThreshold)
        .halfOpenMaxTrialCalls(halfOpenMaxTrialCalls)
        .openTimeout(openTimeout);
  }

  @Override
  public String toString() {
    return "CircuitBreakerConfig{failureThreshold=" + failureThreshold
        + ", successThreshold=" + successThreshold
        + ", halfOpenMaxTrialCalls=" + halfOpenMaxTrialCalls
        + ", openTimeout=" + openTimeout + '}';
  }

  public static final class Builder {
    private int failureThreshold = DEFAULT_FAILURE_THRESHOLD;
    private int successThreshold = DEFAULT_SUCCESS_THRESHOLD;
    private int halfOpenMaxTrialCalls;
    private Duration openTimeout = DEFAULT_OPEN_TIMEOUT;

    private Builder() {
    }

    public Builder failureThreshold(int failureThreshold) {
      this.failureThreshold = failureThreshold;
      return this;
    }

    public Builder successThreshold(int successThreshold) {
      this.successThreshold = successThreshold;
      return this;
    }

    /**
     * Maximum concurrent trial deliveries while half-open.
     *
     * <p>Optional. Defaults to the success threshold.
     *
     * @param halfOpenMaxTrialCalls the trial limit
     * @return this builder
     */
    public Builder halfOpenMaxTrialCalls(int halfOpenMaxTrialCalls) {
      this.halfOpenMaxTrialCalls = halfOpenMaxTrialCalls;
      return this;
    }

    public Builder openTimeout(Duration openTimeout) {
      this.openTimeout = openTimeout;
      return this;
    }

    public CircuitBreakerConfig build() {
      return new CircuitBreakerConfig(this);
    }
  }
}
