package msgbus.stats;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAccumulator;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.IntSupplier;
import java.util.function.IntUnaryOperator;

/**
 * Lock-free counters updated on the publish path.
 *
 * <p>Snapshots read each counter individually; a snapshot taken while publishes are in
 * flight may be slightly behind but never double-counts.
 */
public final class StatisticsCollector {

  private final Map<Integer, Counters> counters = new ConcurrentHashMap<>();
  private final Clock clock;
  private final IntUnaryOperator subscriberCounts;
  private final IntSupplier totalSubscriptions;

  /**
   * @param clock              timestamp source for snapshots
   * @param subscriberCounts   live subscriber count per type code
   * @param totalSubscriptions live subscriptions across all types
   */
  public StatisticsCollector(Clock clock, IntUnaryOperator subscriberCounts,
      IntSupplier totalSubscriptions) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.subscriberCounts = Objects.requireNonNull(subscriberCounts, "subscriberCounts");
    this.totalSubscriptions = Objects.requireNonNull(totalSubscriptions, "totalSubscriptions");
  }

  public void recordPublished(int typeCode) {
    counters(typeCode).published.increment();
  }

  public void recordDelivered(int typeCode) {
    counters(typeCode).delivered.increment();
  }

  public void recordFailed(int typeCode) {
    counters(typeCode).failed.increment();
  }

  public void recordFiltered(int typeCode) {
    counters(typeCode).filtered.increment();
  }

  public void recordDeadLettered(int typeCode) {
    counters(typeCode).deadLettered.increment();
  }

  public void recordCircuitRejected(int typeCode, int subscribers) {
    counters(typeCode).circuitRejected.add(subscribers);
  }

  public void recordNoSubscribers(int typeCode) {
    counters(typeCode).noSubscribers.increment();
  }

  public void recordRetries(int typeCode, int retries) {
    if (retries > 0) {
      counters(typeCode).retries.add(retries);
    }
  }

  public void recordLatency(int typeCode, long latencyMs) {
    Counters c = counters(typeCode);
    long value = Math.max(0L, latencyMs);
    c.timed.increment();
    c.latencyTotal.add(value);
    c.latencyMax.accumulate(value);
  }

  /**
   * Drops every counter. Updates racing with the reset may land on the discarded counters
   * and be lost.
   */
  public void reset() {
    counters.clear();
  }

  public BusStatistics snapshot() {
    Map<Integer, TypeStatistics> byType = new HashMap<>();
    counters.forEach((code, c) -> byType.put(code, c.snapshot(code,
        subscriberCounts.applyAsInt(code))));
    return new BusStatistics(clock.instant(), byType, totalSubscriptions.getAsInt());
  }

  private Counters counters(int typeCode) {
    return counters.computeIfAbsent(typeCode, ignored -> new Counters());
  }

  private static final class Counters {
    final LongAdder published = new LongAdder();
    final LongAdder delivered = new LongAdder();
    final LongAdder failed = new LongAdder();
    final LongAdder filtered = new LongAdder();
    final LongAdder deadLettered = new LongAdder();
    final LongAdder circuitRejected = new LongAdder();
    final LongAdder noSubscribers = new LongAdder();
    final LongAdder retries = new LongAdder();
    final LongAdder timed = new LongAdder();
    final LongAdder latencyTotal = new LongAdder();
    final LongAccumulator latencyMax = new LongAccumulator(Math::max, 0L);

    TypeStatistics snapshot(int typeCode, int activeSubscribers) {
      // Outcomes are recorded after the publish, so read them first.
      long deliveredSum = delivered.sum();
      long failedSum = failed.sum();
      long filteredSum = filtered.sum();
      long rejectedSum = circuitRejected.sum();
      return new TypeStatistics(typeCode,
          published.sum(),
          deliveredSum,
          failedSum,
          filteredSum,
          deadLettered.sum(),
          rejectedSum,
          noSubscribers.sum(),
          retries.sum(),
          timed.sum(),
          latencyTotal.sum(),
          latencyMax.get(),
          activeSubscribers);
    }
  }
}
