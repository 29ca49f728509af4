package msgbus.health;

import msgbus.MutableClock;
import msgbus.stats.StatisticsCollector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HealthAggregatorTest {

  private static final int TYPE = 42;

  private final MutableClock clock = new MutableClock();
  private final StatisticsCollector stats = new StatisticsCollector(clock, code -> 1, () -> 1);
  private final List<HealthTransition> transitions = new ArrayList<>();
  private HealthAggregator aggregator;

  private HealthAggregator aggregator(HealthThresholds thresholds) {
    aggregator = HealthAggregator.builder()
        .statistics(stats::snapshot)
        .thresholds(thresholds)
        .clock(clock)
        .interval(Duration.ZERO)
        .build();
    aggregator.onTransition(transitions::add);
    return aggregator;
  }

  @AfterEach
  void tearDown() {
    if (aggregator != null) {
      aggregator.close();
    }
  }

  private void deliveries(int delivered, int failed) {
    for (int i = 0; i < delivered; i++) {
      stats.recordPublished(TYPE);
      stats.recordDelivered(TYPE);
    }
    for (int i = 0; i < failed; i++) {
      stats.recordPublished(TYPE);
      stats.recordFailed(TYPE);
    }
  }

  @Test
  void emptyWindowIsHealthy() {
    HealthAggregator health = aggregator(HealthThresholds.defaults());

    assertEquals(HealthStatus.HEALTHY, health.checkHealth());
    assertTrue(health.lastReport().reasons().isEmpty());
    assertTrue(transitions.isEmpty());
  }

  @Test
  void highErrorRateIsUnhealthy() {
    HealthAggregator health = aggregator(HealthThresholds.defaults());
    deliveries(4, 6);

    assertEquals(HealthStatus.UNHEALTHY, health.checkHealth());
    assertEquals(0.6, health.lastReport().errorRate(), 1e-9);
    assertEquals(10, health.lastReport().samples());
    assertEquals(1, transitions.size());
    assertEquals(HealthStatus.HEALTHY, transitions.get(0).from());
    assertEquals(HealthStatus.UNHEALTHY, transitions.get(0).to());
  }

  @Test
  void resetWindowStartsFromClearedStatistics() {
    HealthAggregator health = aggregator(HealthThresholds.defaults());
    deliveries(10, 0);
    assertEquals(HealthStatus.HEALTHY, health.checkHealth());

    health.resetWindow(stats::reset);
    deliveries(1, 2);

    assertEquals(HealthStatus.UNHEALTHY, health.checkHealth());
    assertEquals(3, health.lastReport().samples());
    assertEquals(2.0 / 3.0, health.lastReport().errorRate(), 1e-9);
  }

  @Test
  void moderateErrorRateIsDegraded() {
    HealthAggregator health = aggregator(HealthThresholds.defaults());
    deliveries(8, 2);

    assertEquals(HealthStatus.DEGRADED, health.checkHealth());
    assertTrue(health.lastReport().reasons().get(0).startsWith("error rate 0.200"));
  }

  @Test
  void errorRateAtThresholdIsNotDegraded() {
    HealthAggregator health = aggregator(HealthThresholds.defaults());
    deliveries(9, 1);

    assertEquals(HealthStatus.HEALTHY, health.checkHealth());
  }

  @Test
  void slowDeliveriesAreDegraded() {
    HealthAggregator health = aggregator(HealthThresholds.defaults());
    deliveries(2, 0);
    stats.recordLatency(TYPE, 1500);
    stats.recordLatency(TYPE, 1700);

    assertEquals(HealthStatus.DEGRADED, health.checkHealth());
    assertEquals(1600.0, health.lastReport().averageLatencyMs());
  }

  @Test
  void orphanedPublishersDegradeWhenEnabled() {
    HealthAggregator health = aggregator(HealthThresholds.defaults());
    stats.recordPublished(7);
    stats.recordNoSubscribers(7);

    assertEquals(HealthStatus.DEGRADED, health.checkHealth());
    assertEquals(Set.of(7), health.lastReport().orphanedTypes());
  }

  @Test
  void orphanedPublishersIgnoredWhenDisabled() {
    HealthAggregator health = aggregator(HealthThresholds.builder()
        .orphanedPublishersDegrade(false)
        .build());
    stats.recordPublished(7);
    stats.recordNoSubscribers(7);

    assertEquals(HealthStatus.HEALTHY, health.checkHealth());
  }

  @Test
  void smallWindowsBelowMinimumSamplesIgnoreErrorRate() {
    HealthAggregator health = aggregator(HealthThresholds.builder().minimumSamples(5).build());
    deliveries(0, 3);

    assertEquals(HealthStatus.HEALTHY, health.checkHealth());
  }

  @Test
  void windowOnlyCoversActivitySincePreviousCheck() {
    HealthAggregator health = aggregator(HealthThresholds.defaults());
    deliveries(0, 5);
    assertEquals(HealthStatus.UNHEALTHY, health.checkHealth());

    deliveries(10, 0);
    assertEquals(HealthStatus.HEALTHY, health.checkHealth());

    assertEquals(HealthStatus.HEALTHY, health.checkHealth());
    assertEquals(2, transitions.size());
    assertEquals(HealthStatus.UNHEALTHY, transitions.get(1).from());
    assertEquals(HealthStatus.HEALTHY, transitions.get(1).to());
  }

  @Test
  void noTransitionWhenStatusUnchanged() {
    HealthAggregator health = aggregator(HealthThresholds.defaults());
    deliveries(0, 5);
    health.checkHealth();
    deliveries(0, 5);
    health.checkHealth();

    assertEquals(1, transitions.size());
    assertEquals(HealthStatus.UNHEALTHY, health.currentStatus());
  }

  @Test
  void scheduledChecksRunAfterStart() throws Exception {
    CountDownLatch evaluated = new CountDownLatch(2);
    aggregator = HealthAggregator.builder()
        .statistics(() -> {
          evaluated.countDown();
          return stats.snapshot();
        })
        .clock(clock)
        .interval(Duration.ofMillis(10))
        .build();

    aggregator.start();
    aggregator.start();

    assertTrue(evaluated.await(5, TimeUnit.SECONDS));
    aggregator.close();
    assertThrows(IllegalStateException.class, aggregator::start);
  }

  @Test
  void thresholdsValidation() {
    assertThrows(IllegalArgumentException.class,
        () -> HealthThresholds.builder().degradedErrorRate(0.6).build());
    assertThrows(IllegalArgumentException.class,
        () -> HealthThresholds.builder().unhealthyErrorRate(1.5).build());
    assertThrows(IllegalArgumentException.class,
        () -> HealthThresholds.builder().minimumSamples(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> HealthThresholds.builder().degradedLatency(Duration.ofMillis(-1)).build());
  }
}
