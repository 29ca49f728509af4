package msgbus.health;

import java.time.Duration;
import java.util.Objects;

/**
 * Limits used by {@link HealthAggregator} to classify an evaluation window.
 *
 * <ul>
 *   <li>error rate above {@code unhealthyErrorRate}: {@link HealthStatus#UNHEALTHY}</li>
 *   <li>error rate above {@code degradedErrorRate}: {@link HealthStatus#DEGRADED}</li>
 *   <li>average latency above {@code degradedLatency}: {@link HealthStatus#DEGRADED}</li>
 *   <li>publishes with no subscriber, if {@code orphanedPublishersDegrade}:
 *       {@link HealthStatus#DEGRADED}</li>
 * </ul>
 *
 * <p>Error-rate rules only apply once the window holds {@code minimumSamples} deliveries.
 */
public final class HealthThresholds {

  public static final double DEFAULT_UNHEALTHY_ERROR_RATE = 0.5;
  public static final double DEFAULT_DEGRADED_ERROR_RATE = 0.1;
  public static final Duration DEFAULT_DEGRADED_LATENCY = Duration.ofSeconds(1);

  private static final HealthThresholds DEFAULTS = builder().build();

  private final double unhealthyErrorRate;
  private final double degradedErrorRate;
  private final Duration degradedLatency;
  private final boolean orphanedPublishersDegrade;
  private final int minimumSamples;

  private HealthThresholds(Builder builder) {
    this.unhealthyErrorRate = builder.unhealthyErrorRate;
    this.degradedErrorRate = builder.degradedErrorRate;
    this.degradedLatency = Objects.requireNonNull(builder.degradedLatency, "degradedLatency");
    this.orphanedPublishersDegrade = builder.orphanedPublishersDegrade;
    this.minimumSamples = builder.minimumSamples;
    if (!(degradedErrorRate >= 0.0 && degradedErrorRate <= 1.0)) {
      throw new IllegalArgumentException("degradedErrorRate must be in [0, 1], got: "
          + degradedErrorRate);
    }
    if (!(unhealthyErrorRate >= degradedErrorRate && unhealthyErrorRate <= 1.0)) {
      throw new IllegalArgumentException("unhealthyErrorRate must be in [degradedErrorRate, 1], got: "
          + unhealthyErrorRate);
    }
    if (degradedLatency.isNegative()) {
      throw new IllegalArgumentException("degradedLatency must be >= 0, got: " + degradedLatency);
    }
    if (minimumSamples < 1) {
      throw new IllegalArgumentException("minimumSamples must be >= 1, got: " + minimumSamples);
    }
  }

  public static HealthThresholds defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  public double unhealthyErrorRate() {
    return unhealthyErrorRate;
  }

  public double degradedErrorRate() {
    return degradedErrorRate;
  }

  public Duration degradedLatency() {
    return degradedLatency;
  }

  public boolean orphanedPublishersDegrade() {
    return orphanedPublishersDegrade;
  }

  public int minimumSamples() {
    return minimumSamples;
  }

  @Override
  public String toString() {
    return "HealthThresholds{unhealthyErrorRate=" + unhealthyErrorRate
        + ", degradedErrorRate=" + degradedErrorRate
        + ", degradedLatency=" + degradedLatency
        + ", orphanedPublishersDegrade=" + orphanedPublishersDegrade
        + ", minimumSamples=" + minimumSamples + '}';
  }

  public static final class Builder {
    private double unhealthyErrorRate = DEFAULT_UNHEALTHY_ERROR_RATE;
    private double degradedErrorRate = DEFAULT_DEGRADED_ERROR_RATE;
    private Duration degradedLatency = DEFAULT_DEGRADED_LATENCY;
    private boolean orphanedPublishersDegrade = true;
    private int minimumSamples = 1;

    private Builder() {
    }

    public Builder unhealthyErrorRate(double unhealthyErrorRate) {
      this.unhealthyErrorRate = unhealthyErrorRate;
      return this;
    }

    public Builder degradedErrorRate(double degradedErrorRate) {
      this.degradedErrorRate = degradedErrorRate;
      return this;
    }

    public Builder degradedLatency(Duration degradedLatency) {
      this.degradedLatency = degradedLatency;
      return this;
    }

    public Builder orphanedPublishersDegrade(boolean orphanedPublishersDegrade) {
      this.orphanedPublishersDegrade = orphanedPublishersDegrade;
      return this;
    }

    /**
     * Deliveries a window needs before error-rate rules apply.
     *
     * <p>Optional. Defaults to {@code 1}.
     *
     * @param minimumSamples minimum delivered plus failed count
     * @return this builder
     */
    public Builder minimumSamples(int minimumSamples) {
      this.minimumSamples = minimumSamples;
      return this;
    }

    public HealthThresholds build() {
      return new HealthThresholds(this);
    }
  }
}
