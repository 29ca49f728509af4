package msgbus.spi;

/**
 * Observability hook for exporting bus counters and gauges to a metrics backend.
 *
 * <p>The bus reports under the names declared in {@link MetricNames}. The {@link #NOOP}
 * instance discards everything, and the bus is fully functional with it. Implement this
 * interface to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Adds {@code delta} to the named monotonic counter.
   *
   * @param name  metric name, see {@link MetricNames}
   * @param delta non-negative increment
   */
  void recordCounter(String name, long delta);

  /**
   * Sets the named gauge to {@code value}.
   *
   * @param name  metric name, see {@link MetricNames}
   * @param value current value
   */
  void recordGauge(String name, double value);

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void recordCounter(String name, long delta) {
    }

    @Override
    public void recordGauge(String name, double value) {
    }
  }
}
