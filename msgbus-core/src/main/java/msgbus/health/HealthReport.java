package msgbus.health;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Result of one health evaluation.
 *
 * @param status           the computed status
 * @param reasons          why the status is not healthy; empty when healthy
 * @param errorRate        failed / (failed + delivered) in the window
 * @param averageLatencyMs average delivery latency in the window
 * @param samples          delivered plus failed in the window
 * @param orphanedTypes    types published to with no subscriber in the window
 * @param evaluatedAt      evaluation time
 */
public record HealthReport(HealthStatus status, List<String> reasons, double errorRate,
    double averageLatencyMs, long samples, Set<Integer> orphanedTypes, Instant evaluatedAt) {

  public HealthReport {
    reasons = List.copyOf(reasons);
    orphanedTypes = Set.copyOf(orphanedTypes);
  }

  static HealthReport initial(Instant now) {
    return new HealthReport(HealthStatus.HEALTHY, List.of(), 0.0, 0.0, 0L, Set.of(), now);
  }
}
