package msgbus.stats;

/**
 * Immutable counters for one message type.
 *
 * <p>{@code timedDeliveries}, {@code totalLatencyMs} and {@code maxLatencyMs} cover every
 * subscriber delivery that made at least one attempt, successful or not. The latency is the
 * handler time of the last attempt; waits between retries are not counted.
 *
 * @param typeCode              the message type code
 * @param published             messages published
 * @param delivered             successful subscriber deliveries
 * @param failed                subscriber deliveries that failed after all attempts
 * @param filtered              subscribers skipped by filter, priority or disabled flag
 * @param deadLettered          entries added to the dead-letter store
 * @param circuitRejected       subscriber deliveries skipped by an open circuit
 * @param noSubscriberPublishes publishes that found no subscriber
 * @param retries               attempts beyond the first
 * @param timedDeliveries       subscriber invocations with a recorded latency
 * @param totalLatencyMs        sum of recorded latencies
 * @param maxLatencyMs          largest recorded latency
 * @param activeSubscribers     live subscriptions when the snapshot was taken
 */
public record TypeStatistics(
    int typeCode,
    long published,
    long delivered,
    long failed,
    long filtered,
    long deadLettered,
    long circuitRejected,
    long noSubscriberPublishes,
    long retries,
    long timedDeliveries,
    long totalLatencyMs,
    long maxLatencyMs,
    int activeSubscribers) {

  /**
   * {@code failed / (failed + delivered)}, or {@code 0.0} when nothing was attempted.
   *
   * @return the error rate in {@code [0, 1]}
   */
  public double errorRate() {
    long attempted = failed + delivered;
    return attempted == 0 ? 0.0 : (double) failed / attempted;
  }

  public double averageLatencyMs() {
    return timedDeliveries == 0 ? 0.0 : (double) totalLatencyMs / timedDeliveries;
  }

  /**
   * Returns the activity between {@code previous} and this snapshot. The maximum latency
   * and subscriber count are taken from this snapshot.
   *
   * @param previous an earlier snapshot of the same type, or {@code null}
   * @return the difference
   */
  public TypeStatistics since(TypeStatistics previous) {
    if (previous == null) {
      return this;
    }
    return new TypeStatistics(
        typeCode,
        published - previous.published,
        delivered - previous.delivered,
        failed - previous.failed,
        filtered - previous.filtered,
        deadLettered - previous.deadLettered,
        circuitRejected - previous.circuitRejected,
        noSubscriberPublishes - previous.noSubscriberPublishes,
        retries - previous.retries,
        timedDeliveries - previous.timedDeliveries,
        totalLatencyMs - previous.totalLatencyMs,
        maxLatencyMs,
        activeSubscribers);
  }
}
