package msgbus.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import msgbus.spi.MetricNames;
import msgbus.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and gauges with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends. Every name the bus reports
 * (see {@link MetricNames}) is registered up front under {@code <prefix>.<name>}, so
 * dashboards see zero-valued meters before the first message flows. Names outside
 * {@link MetricNames} are registered on first use.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code msgbus.messages.published} messages handed to the bus</li>
 *   <li>{@code msgbus.messages.delivered} successful subscriber deliveries</li>
 *   <li>{@code msgbus.messages.failed} deliveries that failed after all attempts</li>
 *   <li>{@code msgbus.messages.filtered} subscribers skipped by filter or priority</li>
 *   <li>{@code msgbus.messages.rejected} deliveries skipped by an open circuit</li>
 *   <li>{@code msgbus.messages.unrouted} publishes with no subscribers</li>
 *   <li>{@code msgbus.delivery.retries} retry attempts beyond the first</li>
 *   <li>{@code msgbus.deadletter.added} and {@code msgbus.deadletter.evicted}</li>
 *   <li>{@code msgbus.circuit.transitions} circuit breaker state changes</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code msgbus.deadletter.size} dead-letter entries across all types</li>
 *   <li>{@code msgbus.circuit.not.closed} types whose circuit is not closed</li>
 *   <li>{@code msgbus.health.status} 0 healthy, 1 degraded, 2 unhealthy</li>
 *   <li>{@code msgbus.health.error.rate} and {@code msgbus.health.latency.avg.ms}</li>
 *   <li>{@code msgbus.subscriptions.active} live subscriptions</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private static final Map<String, String> COUNTERS = Map.of(
      MetricNames.PUBLISHED, "Messages handed to the bus",
      MetricNames.DELIVERED, "Successful subscriber deliveries",
      MetricNames.FAILED, "Subscriber deliveries that failed after all attempts",
      MetricNames.FILTERED, "Subscribers skipped by filter, priority or disabled flag",
      MetricNames.REJECTED, "Subscriber deliveries skipped by an open circuit",
      MetricNames.UNROUTED, "Publishes for a type with no subscribers",
      MetricNames.RETRIES, "Retry attempts beyond the first",
      MetricNames.DEAD_LETTERED, "Entries added to the dead-letter store",
      MetricNames.DEAD_LETTER_EVICTED, "Dead-letter entries evicted by a full store",
      MetricNames.CIRCUIT_TRANSITIONS, "Circuit breaker state transitions");

  private static final Map<String, String> GAUGES = Map.of(
      MetricNames.DEAD_LETTER_SIZE, "Dead-letter entries across all types",
      MetricNames.CIRCUITS_NOT_CLOSED, "Message types whose circuit breaker is not closed",
      MetricNames.HEALTH_STATUS, "Health status (0 healthy, 1 degraded, 2 unhealthy)",
      MetricNames.HEALTH_ERROR_RATE, "Error rate of the last health window",
      MetricNames.HEALTH_LATENCY_MS, "Average delivery latency of the last health window",
      MetricNames.ACTIVE_SUBSCRIPTIONS, "Live subscriptions");

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Map<String, Counter> counters = new ConcurrentHashMap<>();
  private final Map<String, GaugeValue> gauges = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "msgbus"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "msgbus");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.bus"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;
    this.namePrefix = namePrefix;
    COUNTERS.keySet().forEach(this::counter);
    GAUGES.keySet().forEach(this::gauge);
  }

  @Override
  public void recordCounter(String name, long delta) {
    if (closed) return;
    counter(name).increment(delta);
  }

  @Override
  public void recordGauge(String name, double value) {
    if (closed) return;
    gauge(name).set(value);
  }

  private Counter counter(String name) {
    return counters.computeIfAbsent(name, n -> Counter.builder(namePrefix + "." + n)
        .description(COUNTERS.get(n))
        .register(registry));
  }

  private GaugeValue gauge(String name) {
    return gauges.computeIfAbsent(name, n -> {
      GaugeValue value = new GaugeValue();
      value.meter = Gauge.builder(namePrefix + "." + n, value, GaugeValue::get)
          .description(GAUGES.get(n))
          .register(registry);
      return value;
    });
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed (e.g. when the
   * {@link msgbus.MessageBus} is closed) to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(counters.values());
    gauges.values().forEach(g -> meters.add(g.meter));
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }

  /** Gauge state holding a double as raw long bits. */
  private static final class GaugeValue {
    private final AtomicLong bits = new AtomicLong(Double.doubleToRawLongBits(0.0));
    private Gauge meter;

    double get() {
      return Double.longBitsToDouble(bits.get());
    }

    void set(double value) {
      bits.set(Double.doubleToRawLongBits(value));
    }
  }
}
