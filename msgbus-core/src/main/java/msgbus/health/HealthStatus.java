package msgbus.health;

/**
 * Aggregated bus health, ordered from best to worst.
 */
public enum HealthStatus {
  HEALTHY,
  DEGRADED,
  UNHEALTHY;

  public boolean isWorseThan(HealthStatus other) {
    return compareTo(other) > 0;
  }

  static HealthStatus worst(HealthStatus a, HealthStatus b) {
    return a.isWorseThan(b) ? a : b;
  }
}
