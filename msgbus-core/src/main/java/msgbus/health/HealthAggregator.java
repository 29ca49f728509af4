package msgbus.health;

import msgbus.spi.MetricNames;
import msgbus.spi.MetricsExporter;
import msgbus.stats.BusStatistics;
import msgbus.util.DaemonThreadFactory;
import msgbus.util.TransitionListeners;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Derives a {@link HealthStatus} from bus statistics.
 *
 * <p>Each evaluation looks only at the activity since the previous evaluation. An empty
 * window is healthy as far as error rate and latency are concerned. A
 * {@link HealthTransition} is fired only when the status changes.
 *
 * <p>Evaluations run either on demand via {@link #checkHealth()} or periodically after
 * {@link #start()} on a single daemon thread. The {@link #start()} and {@link #close()}
 * methods are synchronized.
 */
public final class HealthAggregator implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(HealthAggregator.class.getName());

  private final Supplier<BusStatistics> statistics;
  private final HealthThresholds thresholds;
  private final Clock clock;
  private final MetricsExporter metrics;
  private final Duration interval;
  private final TransitionListeners<HealthTransition> listeners = new TransitionListeners<>();

  private final Object evaluationLock = new Object();
  private BusStatistics previous;
  private volatile HealthReport lastReport;

  private ScheduledExecutorService scheduler;
  private ScheduledFuture<?> checkTask;
  private volatile boolean closed;

  private HealthAggregator(Builder builder) {
    this.statistics = Objects.requireNonNull(builder.statistics, "statistics");
    this.thresholds = Objects.requireNonNull(builder.thresholds, "thresholds");
    this.clock = Objects.requireNonNull(builder.clock, "clock");
    this.metrics = builder.metrics == null ? MetricsExporter.NOOP : builder.metrics;
    this.interval = Objects.requireNonNull(builder.interval, "interval");
    if (interval.isNegative()) {
      throw new IllegalArgumentException("interval must be >= 0, got: " + interval);
    }
    this.lastReport = HealthReport.initial(clock.instant());
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts periodic evaluation. Subsequent calls are no-ops if already started; a zero
   * interval disables scheduling.
   *
   * @throws IllegalStateException if the aggregator has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("HealthAggregator has been closed");
    }
    if (checkTask != null || interval.isZero()) {
      return;
    }
    long intervalMs = interval.toMillis();
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("msgbus-health-"));
    checkTask = scheduler.scheduleWithFixedDelay(this::scheduledCheck, intervalMs, intervalMs,
        TimeUnit.MILLISECONDS);
  }

  private void scheduledCheck() {
    if (closed) {
      return;
    }
    try {
      checkHealth();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Health check failed", t);
    }
  }

  /**
   * Evaluates the window since the previous evaluation.
   *
   * @return the new status
   */
  public HealthStatus checkHealth() {
    HealthTransition transition = null;
    HealthReport report;
    synchronized (evaluationLock) {
      BusStatistics current = statistics.get();
      BusStatistics window = current.since(previous);
      previous = current;
      report = evaluate(window);
      HealthStatus before = lastReport.status();
      lastReport = report;
      if (report.status() != before) {
        transition = new HealthTransition(before, report.status(), report, report.evaluatedAt());
      }
    }
    metrics.recordGauge(MetricNames.HEALTH_STATUS, report.status().ordinal());
    metrics.recordGauge(MetricNames.HEALTH_ERROR_RATE, report.errorRate());
    metrics.recordGauge(MetricNames.HEALTH_LATENCY_MS, report.averageLatencyMs());
    if (transition != null) {
      Level level = transition.to().isWorseThan(transition.from()) ? Level.WARNING : Level.INFO;
      logger.log(level, "Bus health {0} -> {1} {2}",
          new Object[]{transition.from(), transition.to(), report.reasons()});
      listeners.fire(transition);
    }
    return report.status();
  }

  private HealthReport evaluate(BusStatistics window) {
    HealthStatus status = HealthStatus.HEALTHY;
    List<String> reasons = new ArrayList<>();
    long samples = window.delivered() + window.failed();
    double errorRate = window.errorRate();
    double latencyMs = window.averageLatencyMs();

    if (samples >= thresholds.minimumSamples()) {
      if (errorRate > thresholds.unhealthyErrorRate()) {
        status = HealthStatus.UNHEALTHY;
        reasons.add(String.format(Locale.ROOT, "error rate %.3f above %.3f", errorRate,
            thresholds.unhealthyErrorRate()));
      } else if (errorRate > thresholds.degradedErrorRate()) {
        status = HealthStatus.DEGRADED;
        reasons.add(String.format(Locale.ROOT, "error rate %.3f above %.3f", errorRate,
            thresholds.degradedErrorRate()));
      }
    }
    if (window.timedDeliveries() > 0 && latencyMs > thresholds.degradedLatency().toMillis()) {
      status = HealthStatus.worst(status, HealthStatus.DEGRADED);
      reasons.add(String.format(Locale.ROOT, "average latency %.1fms above %dms", latencyMs,
          thresholds.degradedLatency().toMillis()));
    }
    Set<Integer> orphaned = window.orphanedTypes();
    if (thresholds.orphanedPublishersDegrade() && !orphaned.isEmpty()) {
      status = HealthStatus.worst(status, HealthStatus.DEGRADED);
      reasons.add("published with no subscribers: types " + orphaned);
    }
    return new HealthReport(status, reasons, errorRate, latencyMs, samples, orphaned,
        clock.instant());
  }

  /**
   * Runs {@code clearStatistics} and makes the next evaluation start from an empty baseline.
   * No evaluation can run in between, so a window never spans the reset.
   *
   * @param clearStatistics zeroes the statistics this aggregator reads
   */
  public void resetWindow(Runnable clearStatistics) {
    Objects.requireNonNull(clearStatistics, "clearStatistics");
    synchronized (evaluationLock) {
      clearStatistics.run();
      previous = null;
    }
  }

  public HealthStatus currentStatus() {
    return lastReport.status();
  }

  /**
   * Returns the latest evaluation; before the first evaluation this is a healthy report
   * with an empty window.
   *
   * @return the latest report
   */
  public HealthReport lastReport() {
    return lastReport;
  }

  /**
   * Registers a transition listener.
   *
   * @param listener the callback
   * @return a handle that removes the listener when run
   */
  public Runnable onTransition(Consumer<? super HealthTransition> listener) {
    return listeners.add(listener);
  }

  /**
   * Cancels periodic evaluation and shuts down the scheduler thread.
   */
  @Override
  public synchronized void close() {
    closed = true;
    if (checkTask != null) {
      checkTask.cancel(false);
      checkTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      scheduler = null;
    }
  }

  /**
   * Builder for {@link HealthAggregator}.
   */
  public static final class Builder {
    private Supplier<BusStatistics> statistics;
    private HealthThresholds thresholds = HealthThresholds.defaults();
    private Clock clock = Clock.systemUTC();
    private MetricsExporter metrics;
    private Duration interval = Duration.ofSeconds(30);

    private Builder() {
    }

    public Builder statistics(Supplier<BusStatistics> statistics) {
      this.statistics = statistics;
      return this;
    }

    public Builder thresholds(HealthThresholds thresholds) {
      this.thresholds = thresholds;
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

    /**
     * Sets the period of scheduled evaluations.
     *
     * <p>Optional. Defaults to 30 seconds. {@link Duration#ZERO} disables scheduling.
     *
     * @param interval evaluation period
     * @return this builder
     */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    public HealthAggregator build() {
      return new HealthAggregator(this);
    }
  }
}
