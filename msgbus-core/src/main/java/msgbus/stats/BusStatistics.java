package msgbus.stats;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable snapshot of bus-wide counters with a per-type breakdown.
 *
 * <p>Totals are the sums of the per-type values, except {@code maxLatencyMs} which is the
 * largest per-type maximum.
 */
public final class BusStatistics {

  private final Instant capturedAt;
  private final Map<Integer, TypeStatistics> byType;
  private final int activeSubscriptions;
  private final long published;
  private final long delivered;
  private final long failed;
  private final long filtered;
  private final long deadLettered;
  private final long circuitRejected;
  private final long noSubscriberPublishes;
  private final long retries;
  private final long timedDeliveries;
  private final long totalLatencyMs;
  private final long maxLatencyMs;

  public BusStatistics(Instant capturedAt, Map<Integer, TypeStatistics> byType,
      int activeSubscriptions) {
    this.capturedAt = capturedAt;
    this.byType = Collections.unmodifiableMap(new TreeMap<>(byType));
    this.activeSubscriptions = activeSubscriptions;
    long p = 0, d = 0, f = 0, fl = 0, dl = 0, cr = 0, ns = 0, r = 0, td = 0, tl = 0, max = 0;
    for (TypeStatistics t : byType.values()) {
      p += t.published();
      d += t.delivered();
      f += t.failed();
      fl += t.filtered();
      dl += t.deadLettered();
      cr += t.circuitRejected();
      ns += t.noSubscriberPublishes();
      r += t.retries();
      td += t.timedDeliveries();
      tl += t.totalLatencyMs();
      max = Math.max(max, t.maxLatencyMs());
    }
    this.published = p;
    this.delivered = d;
    this.failed = f;
    this.filtered = fl;
    this.deadLettered = dl;
    this.circuitRejected = cr;
    this.noSubscriberPublishes = ns;
    this.retries = r;
    this.timedDeliveries = td;
    this.totalLatencyMs = tl;
    this.maxLatencyMs = max;
  }

  public static BusStatistics empty(Instant capturedAt) {
    return new BusStatistics(capturedAt, Map.of(), 0);
  }

  public Instant capturedAt() {
    return capturedAt;
  }

  public Map<Integer, TypeStatistics> byType() {
    return byType;
  }

  /**
   * Returns the counters for one type, or {@code null} if the type has no activity.
   *
   * @param typeCode the message type code
   * @return the per-type counters, or {@code null}
   */
  public TypeStatistics forType(int typeCode) {
    return byType.get(typeCode);
  }

  public int activeSubscriptions() {
    return activeSubscriptions;
  }

  public long published() {
    return published;
  }

  public long delivered() {
    return delivered;
  }

  public long failed() {
    return failed;
  }

  public long filtered() {
    return filtered;
  }

  public long deadLettered() {
    return deadLettered;
  }

  public long circuitRejected() {
    return circuitRejected;
  }

  public long noSubscriberPublishes() {
    return noSubscriberPublishes;
  }

  public long retries() {
    return retries;
  }

  public long timedDeliveries() {
    return timedDeliveries;
  }

  public long totalLatencyMs() {
    return totalLatencyMs;
  }

  public long maxLatencyMs() {
    return maxLatencyMs;
  }

  public double errorRate() {
    long attempted = failed + delivered;
    return attempted == 0 ? 0.0 : (double) failed / attempted;
  }

  public double averageLatencyMs() {
    return timedDeliveries == 0 ? 0.0 : (double) totalLatencyMs / timedDeliveries;
  }

  /**
   * Types that were published to while nobody subscribed.
   *
   * @return type codes with at least one no-subscriber publish
   */
  public Set<Integer> orphanedTypes() {
    Set<Integer> result = new TreeSet<>();
    byType.forEach((code, stats) -> {
      if (stats.noSubscriberPublishes() > 0) {
        result.add(code);
      }
    });
    return Collections.unmodifiableSet(result);
  }

  /**
   * Returns the activity between {@code previous} and this snapshot.
   *
   * @param previous an earlier snapshot, or {@code null} to return this snapshot
   * @return the window statistics
   */
  public BusStatistics since(BusStatistics previous) {
    if (previous == null) {
      return this;
    }
    Map<Integer, TypeStatistics> window = new TreeMap<>();
    byType.forEach((code, stats) -> window.put(code, stats.since(previous.byType.get(code))));
    return new BusStatistics(capturedAt, window, activeSubscriptions);
  }

  @Override
  public String toString() {
    return "BusStatistics{published=" + published
        + ", delivered=" + delivered
        + ", failed=" + failed
        + ", filtered=" + filtered
        + ", deadLettered=" + deadLettered
        + ", circuitRejected=" + circuitRejected
        + ", noSubscriberPublishes=" + noSubscriberPublishes
        + ", retries=" + retries
        + ", avgLatencyMs=" + averageLatencyMs()
        + ", activeSubscriptions=" + activeSubscriptions
        + '}';
  }
}
