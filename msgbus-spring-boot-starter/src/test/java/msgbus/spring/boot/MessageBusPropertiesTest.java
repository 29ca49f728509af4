package msgbus.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageBusPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(MessageBusProperties.class);
            assertTrue(props.isRequireRegisteredTypes());
            assertTrue(props.getTypes().isEmpty());
            assertEquals(4, props.getAsync().getThreads());
            assertEquals(5000, props.getAsync().getDrainTimeoutMs());
            assertEquals(3, props.getRetry().getMaxAttempts());
            assertEquals(Duration.ofMillis(200), props.getRetry().getInitialDelay());
            assertEquals(2.0, props.getRetry().getMultiplier());
            assertEquals(Duration.ofSeconds(60), props.getRetry().getMaxDelay());
            assertEquals(0.0, props.getRetry().getJitter());
            assertEquals(5, props.getCircuitBreaker().getFailureThreshold());
            assertEquals(2, props.getCircuitBreaker().getSuccessThreshold());
            assertEquals(Duration.ofSeconds(60), props.getCircuitBreaker().getOpenTimeout());
            assertNull(props.getCircuitBreaker().getHalfOpenMaxTrialCalls());
            assertEquals(1000, props.getDeadLetter().getCapacityPerType());
            assertEquals(Duration.ofSeconds(30), props.getHealth().getCheckInterval());
            assertEquals(0.5, props.getHealth().getUnhealthyErrorRate());
            assertEquals(0.1, props.getHealth().getDegradedErrorRate());
            assertEquals(Duration.ofSeconds(1), props.getHealth().getDegradedLatency());
            assertTrue(props.getHealth().isOrphanedPublishersDegrade());
            assertEquals(1, props.getHealth().getMinimumSamples());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("msgbus", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "msgbus.require-registered-types=false",
                "msgbus.types.42=OrderPlaced",
                "msgbus.types.43=OrderCancelled",
                "msgbus.async.threads=8",
                "msgbus.async.drain-timeout-ms=10000",
                "msgbus.retry.max-attempts=5",
                "msgbus.retry.initial-delay=500ms",
                "msgbus.retry.multiplier=1.5",
                "msgbus.retry.max-delay=2m",
                "msgbus.retry.jitter=0.2",
                "msgbus.circuit-breaker.failure-threshold=10",
                "msgbus.circuit-breaker.success-threshold=3",
                "msgbus.circuit-breaker.open-timeout=PT30S",
                "msgbus.circuit-breaker.half-open-max-trial-calls=5",
                "msgbus.dead-letter.capacity-per-type=50",
                "msgbus.health.check-interval=PT10S",
                "msgbus.health.unhealthy-error-rate=0.4",
                "msgbus.health.degraded-error-rate=0.05",
                "msgbus.health.degraded-latency=250ms",
                "msgbus.health.orphaned-publishers-degrade=false",
                "msgbus.health.minimum-samples=20",
                "msgbus.metrics.enabled=false",
                "msgbus.metrics.name-prefix=orders.bus"
        ).run(ctx -> {
            var props = ctx.getBean(MessageBusProperties.class);
            assertFalse(props.isRequireRegisteredTypes());
            assertEquals(Map.of(42, "OrderPlaced", 43, "OrderCancelled"), props.getTypes());
            assertEquals(8, props.getAsync().getThreads());
            assertEquals(10000, props.getAsync().getDrainTimeoutMs());
            assertEquals(5, props.getRetry().getMaxAttempts());
            assertEquals(Duration.ofMillis(500), props.getRetry().getInitialDelay());
            assertEquals(1.5, props.getRetry().getMultiplier());
            assertEquals(Duration.ofMinutes(2), props.getRetry().getMaxDelay());
            assertEquals(0.2, props.getRetry().getJitter());
            assertEquals(10, props.getCircuitBreaker().getFailureThreshold());
            assertEquals(3, props.getCircuitBreaker().getSuccessThreshold());
            assertEquals(Duration.ofSeconds(30), props.getCircuitBreaker().getOpenTimeout());
            assertEquals(5, props.getCircuitBreaker().getHalfOpenMaxTrialCalls());
            assertEquals(50, props.getDeadLetter().getCapacityPerType());
            assertEquals(Duration.ofSeconds(10), props.getHealth().getCheckInterval());
            assertEquals(0.4, props.getHealth().getUnhealthyErrorRate());
            assertEquals(0.05, props.getHealth().getDegradedErrorRate());
            assertEquals(Duration.ofMillis(250), props.getHealth().getDegradedLatency());
            assertFalse(props.getHealth().isOrphanedPublishersDegrade());
            assertEquals(20, props.getHealth().getMinimumSamples());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("orders.bus", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(MessageBusProperties.class)
    static class PropsConfig {
    }
}
