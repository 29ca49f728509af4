package msgbus.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff policy for subscriber delivery.
 *
 * <p>Delay before attempt {@code n + 1}: {@code initialDelay * multiplier^(n-1)}, capped at
 * {@code maxDelay}. With a non-zero {@code jitter} the delay is scaled by a random factor in
 * {@code [1 - jitter, 1 + jitter)} and capped again.
 */
public final class RetryPolicy {

  public static final int DEFAULT_MAX_ATTEMPTS = 3;
  public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(200);
  public static final double DEFAULT_MULTIPLIER = 2.0;
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);

  private static final RetryPolicy DEFAULTS = builder().build();
  private static final RetryPolicy NONE = builder().maxAttempts(1).build();

  private final int maxAttempts;
  private final Duration initialDelay;
  private final double multiplier;
  private final Duration maxDelay;
  private final double jitter;

  private RetryPolicy(Builder builder) {
    this.maxAttempts = builder.maxAttempts;
    this.initialDelay = Objects.requireNonNull(builder.initialDelay, "initialDelay");
    this.multiplier = builder.multiplier;
    this.maxDelay = Objects.requireNonNull(builder.maxDelay, "maxDelay");
    this.jitter = builder.jitter;
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
    }
    if (initialDelay.isNegative()) {
      throw new IllegalArgumentException("initialDelay must be >= 0, got: " + initialDelay);
    }
    if (!(multiplier >= 1.0) || Double.isInfinite(multiplier)) {
      throw new IllegalArgumentException("multiplier must be >= 1.0, got: " + multiplier);
    }
    if (maxDelay.compareTo(initialDelay) < 0) {
      throw new IllegalArgumentException("maxDelay (" + maxDelay
          + ") must be >= initialDelay (" + initialDelay + ")");
    }
    if (!(jitter >= 0.0 && jitter < 1.0)) {
      throw new IllegalArgumentException("jitter must be in [0, 1), got: " + jitter);
    }
  }

  public static RetryPolicy defaults() {
    return DEFAULTS;
  }

  /**
   * Policy with a single attempt and no retries.
   *
   * @return the no-retry policy
   */
  public static RetryPolicy none() {
    return NONE;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Total attempts including the first.
   *
   * @return the attempt limit
   */
  public int maxAttempts() {
    return maxAttempts;
  }

  public Duration initialDelay() {
    return initialDelay;
  }

  public double multiplier() {
    return multiplier;
  }

  public Duration maxDelay() {
    return maxDelay;
  }

  public double jitter() {
    return jitter;
  }

  /**
   * Computes the wait after failed attempt {@code attempt}.
   *
   * @param attempt the 1-based number of the attempt that just failed
   * @return delay in milliseconds, never negative
   */
  public long delayBeforeRetry(int attempt) {
    if (attempt <= 0) {
      return 0L;
    }
    long initialMs = initialDelay.toMillis();
    long maxMs = maxDelay.toMillis();
    double exp = initialMs * Math.pow(multiplier, attempt - 1);
    // Math.pow overflows to Infinity rather than wrapping
    long capped = exp >= maxMs ? maxMs : (long) exp;
    if (jitter == 0.0) {
      return capped;
    }
    double factor = ThreadLocalRandom.current().nextDouble(1.0 - jitter, 1.0 + jitter);
    return Math.min(maxMs, Math.max(0L, (long) (capped * factor)));
  }

  public Builder toBuilder() {
    return new Builder()
        .maxAttempts(maxAttempts)
        .initialDelay(initialDelay)
        .multiplier(multiplier)
        .maxDelay(maxDelay)
        .jitter(jitter);
  }

  @Override
  public String toString() {
    return "RetryPolicy{maxAttempts=" + maxAttempts
        + ", initialDelay=" + initialDelay
        + ", multiplier=" + multiplier
        + ", maxDelay=" + maxDelay
        + ", jitter=" + jitter + '}';
  }

  public static final class Builder {
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private Duration initialDelay = DEFAULT_INITIAL_DELAY;
    private double multiplier = DEFAULT_MULTIPLIER;
    private Duration maxDelay = DEFAULT_MAX_DELAY;
    private double jitter;

    private Builder() {
    }

    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder initialDelay(Duration initialDelay) {
      this.initialDelay = initialDelay;
      return this;
    }

    public Builder multiplier(double multiplier) {
      this.multiplier = multiplier;
      return this;
    }

    public Builder maxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
      return this;
    }

    /**
     * Sets the random spread applied to each delay.
     *
     * <p>Optional. Defaults to {@code 0} (deterministic delays).
     *
     * @param jitter spread in {@code [0, 1)}; {@code 0.2} means plus or minus 20%
     * @return this builder
     */
    public Builder jitter(double jitter) {
      this.jitter = jitter;
      return this;
    }

    public RetryPolicy build() {
      return new RetryPolicy(this);
    }
  }
}
