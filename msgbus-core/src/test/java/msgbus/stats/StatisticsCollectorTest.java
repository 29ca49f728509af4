package msgbus.stats;

import msgbus.MutableClock;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StatisticsCollectorTest {

  private final MutableClock clock = new MutableClock();

  @Test
  void aggregatesPerTypeAndTotals() {
    StatisticsCollector collector = new StatisticsCollector(clock, code -> code == 1 ? 2 : 0,
        () -> 2);

    collector.recordPublished(1);
    collector.recordPublished(1);
    collector.recordDelivered(1);
    collector.recordDelivered(1);
    collector.recordFailed(1);
    collector.recordFiltered(1);
    collector.recordLatency(1, 10);
    collector.recordLatency(1, 30);
    collector.recordRetries(1, 2);
    collector.recordPublished(2);
    collector.recordNoSubscribers(2);

    BusStatistics stats = collector.snapshot();

    assertEquals(3, stats.published());
    assertEquals(2, stats.delivered());
    assertEquals(1, stats.failed());
    assertEquals(1, stats.filtered());
    assertEquals(2, stats.retries());
    assertEquals(1, stats.noSubscriberPublishes());
    assertEquals(20.0, stats.averageLatencyMs());
    assertEquals(30, stats.maxLatencyMs());
    assertEquals(1.0 / 3.0, stats.errorRate(), 1e-9);
    assertEquals(2, stats.forType(1).activeSubscribers());
    assertEquals(2, stats.activeSubscriptions());
    assertEquals(Set.of(2), stats.orphanedTypes());
    assertEquals(clock.instant(), stats.capturedAt());
    assertNull(stats.forType(3));
  }

  @Test
  void sinceReturnsWindowDelta() {
    StatisticsCollector collector = new StatisticsCollector(clock, code -> 1, () -> 1);
    collector.recordPublished(1);
    collector.recordFailed(1);
    BusStatistics first = collector.snapshot();

    collector.recordPublished(1);
    collector.recordDelivered(1);
    collector.recordPublished(2);
    BusStatistics window = collector.snapshot().since(first);

    assertEquals(2, window.published());
    assertEquals(1, window.delivered());
    assertEquals(0, window.failed());
    assertEquals(0.0, window.errorRate());
    assertEquals(1, window.forType(2).published());
  }

  @Test
  void emptyStatisticsHaveZeroRates() {
    BusStatistics stats = BusStatistics.empty(clock.instant());

    assertEquals(0.0, stats.errorRate());
    assertEquals(0.0, stats.averageLatencyMs());
    assertTrue(stats.byType().isEmpty());
  }

  @Test
  void negativeLatencyIsClampedAndZeroRetriesIgnored() {
    StatisticsCollector collector = new StatisticsCollector(clock, code -> 0, () -> 0);

    collector.recordLatency(1, -5);
    collector.recordRetries(1, 0);

    TypeStatistics stats = collector.snapshot().forType(1);
    assertEquals(0, stats.totalLatencyMs());
    assertEquals(1, stats.timedDeliveries());
    assertEquals(0, stats.retries());
  }
}
