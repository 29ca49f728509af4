/**
 * Spring Boot auto-configuration for the message bus.
 *
 * <p>{@link msgbus.spring.boot.MessageBusAutoConfiguration} wires a {@link msgbus.MessageBus}
 * instance from {@code msgbus.*} application properties.
 *
 * <p>Use {@link msgbus.spring.boot.BusSubscriber @BusSubscriber} on handler beans
 * to subscribe them declaratively.
 *
 * @see msgbus.spring.boot.MessageBusAutoConfiguration
 * @see msgbus.spring.boot.MessageBusProperties
 * @see msgbus.spring.boot.BusSubscriber
 * @see msgbus.spring.boot.BusSubscriberRegistrar
 */
package msgbus.spring.boot;
