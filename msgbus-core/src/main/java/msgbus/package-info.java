/**
 * Root API of msgbus, an in-process publish/subscribe runtime with a reliability envelope.
 *
 * <h2>Core Design</h2>
 * <p>Publishers hand immutable {@link msgbus.Message}s to the {@link msgbus.MessageBus}, which
 * routes them by numeric type code to the subscribers registered for that type, in
 * subscription order. Each subscriber is isolated: its failures are retried with exponential
 * backoff, counted by the type's circuit breaker and, once retries are exhausted, parked in a
 * bounded {@linkplain msgbus.dead.DeadLetterStore dead-letter store} for inspection and
 * replay. A {@linkplain msgbus.health.HealthAggregator health aggregator} condenses the
 * statistics into {@code HEALTHY}, {@code DEGRADED} or {@code UNHEALTHY}.
 *
 * <p>Delivery is at-most-once per subscriber per publish; nothing is persisted.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>msgbus-core</b> - this API, registries, breakers, retry, dead letters, health</li>
 *   <li><b>msgbus-micrometer</b> - {@link msgbus.spi.MetricsExporter} bridge to Micrometer</li>
 *   <li><b>msgbus-spring-boot-starter</b> - auto-configuration and {@code @BusSubscriber}</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (MessageBus bus = MessageBus.builder().build()) {
 *   bus.registerType(42, "OrderPlaced");
 *   bus.subscribe(42, message -> System.out.println("Received: " + message.payload()));
 *   bus.publish(Message.of(42, "order-123"));
 * }
 * }</pre>
 *
 * @see msgbus.MessageBus
 * @see msgbus.Message
 * @see msgbus.MessageHandler
 * @see msgbus.PublishResult
 */
package msgbus;
