package msgbus.spi;

/**
 * Metric names reported through {@link MetricsExporter}.
 *
 * <p>Names are relative; exporters typically add a prefix such as {@code msgbus.}.
 */
public final class MetricNames {

  /** Counter: messages handed to the bus. */
  public static final String PUBLISHED = "messages.published";
  /** Counter: successful subscriber deliveries. */
  public static final String DELIVERED = "messages.delivered";
  /** Counter: subscriber deliveries that failed after all attempts. */
  public static final String FAILED = "messages.failed";
  /** Counter: subscribers skipped by filter, minimum priority or disabled flag. */
  public static final String FILTERED = "messages.filtered";
  /** Counter: subscriber deliveries skipped because the circuit breaker was open. */
  public static final String REJECTED = "messages.rejected";
  /** Counter: publishes for a type with no subscribers. */
  public static final String UNROUTED = "messages.unrouted";
  /** Counter: retry attempts beyond the first. */
  public static final String RETRIES = "delivery.retries";
  /** Counter: entries added to the dead-letter store. */
  public static final String DEAD_LETTERED = "deadletter.added";
  /** Counter: dead-letter entries evicted because a type's store was full. */
  public static final String DEAD_LETTER_EVICTED = "deadletter.evicted";
  /** Counter: circuit breaker state transitions. */
  public static final String CIRCUIT_TRANSITIONS = "circuit.transitions";

  /** Gauge: total dead-letter entries across all types. */
  public static final String DEAD_LETTER_SIZE = "deadletter.size";
  /** Gauge: number of message types whose circuit breaker is not closed. */
  public static final String CIRCUITS_NOT_CLOSED = "circuit.not.closed";
  /** Gauge: health status ordinal (0 healthy, 1 degraded, 2 unhealthy). */
  public static final String HEALTH_STATUS = "health.status";
  /** Gauge: error rate of the last health window, 0.0 to 1.0. */
  public static final String HEALTH_ERROR_RATE = "health.error.rate";
  /** Gauge: average delivery latency of the last health window, in milliseconds. */
  public static final String HEALTH_LATENCY_MS = "health.latency.avg.ms";
  /** Gauge: live subscriptions. */
  public static final String ACTIVE_SUBSCRIPTIONS = "subscriptions.active";

  private MetricNames() {
  }
}
