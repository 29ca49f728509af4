/**
 * Micrometer bridge for exporting bus metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link msgbus.micrometer.MicrometerMetricsExporter} implements the
 * {@link msgbus.spi.MetricsExporter} SPI using Micrometer counters and gauges.
 *
 * @see msgbus.micrometer.MicrometerMetricsExporter
 */
package msgbus.micrometer;
