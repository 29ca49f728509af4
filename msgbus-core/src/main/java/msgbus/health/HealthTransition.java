package msgbus.health;

import java.time.Instant;

/**
 * Change of the aggregated health status.
 *
 * @param from      the previous status
 * @param to        the new status
 * @param report    the evaluation that caused the change
 * @param timestamp when the change was detected
 */
public record HealthTransition(HealthStatus from, HealthStatus to, HealthReport report,
    Instant timestamp) {
}
