/**
 * Extension points implemented outside the core module.
 *
 * @see msgbus.spi.MetricsExporter
 */
package msgbus.spi;
