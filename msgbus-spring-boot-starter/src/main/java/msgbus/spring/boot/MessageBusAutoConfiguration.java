package msgbus.spring.boot;

import msgbus.MessageBus;
import msgbus.MessageInterceptor;
import msgbus.circuit.CircuitBreakerConfig;
import msgbus.health.HealthThresholds;
import msgbus.registry.TypeRegistry;
import msgbus.retry.RetryPolicy;
import msgbus.spi.MetricsExporter;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.Map;

/**
 * Auto-configuration for the message bus.
 *
 * <p>Wires up a {@link MessageBus} from {@link MessageBusProperties}, picking up any
 * {@link MetricsExporter}, {@link TypeRegistry} and {@link MessageInterceptor} beans, and
 * subscribes {@link BusSubscriber @BusSubscriber} beans once the context is initialized.
 *
 * @see MessageBusProperties
 * @see MessageBusMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(MessageBus.class)
@EnableConfigurationProperties(MessageBusProperties.class)
public class MessageBusAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public MessageBus messageBus(MessageBusProperties props,
      ObjectProvider<TypeRegistry> typeRegistryProvider,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<MessageInterceptor> interceptorProvider) {

    List<MessageInterceptor> interceptors = interceptorProvider.orderedStream().toList();
    var retry = props.getRetry();
    var cb = props.getCircuitBreaker();
    var health = props.getHealth();

    var circuitBreakerConfig = CircuitBreakerConfig.builder()
        .failureThreshold(cb.getFailureThreshold())
        .successThreshold(cb.getSuccessThreshold())
        .openTimeout(cb.getOpenTimeout());
    if (cb.getHalfOpenMaxTrialCalls() != null) {
      circuitBreakerConfig.halfOpenMaxTrialCalls(cb.getHalfOpenMaxTrialCalls());
    }

    var builder = MessageBus.builder()
        .requireRegisteredTypes(props.isRequireRegisteredTypes())
        .retryPolicy(RetryPolicy.builder()
            .maxAttempts(retry.getMaxAttempts())
            .initialDelay(retry.getInitialDelay())
            .multiplier(retry.getMultiplier())
            .maxDelay(retry.getMaxDelay())
            .jitter(retry.getJitter())
            .build())
        .circuitBreakerConfig(circuitBreakerConfig.build())
        .deadLetterCapacity(props.getDeadLetter().getCapacityPerType())
        .healthThresholds(HealthThresholds.builder()
            .unhealthyErrorRate(health.getUnhealthyErrorRate())
            .degradedErrorRate(health.getDegradedErrorRate())
            .degradedLatency(health.getDegradedLatency())
            .orphanedPublishersDegrade(health.isOrphanedPublishersDegrade())
            .minimumSamples(health.getMinimumSamples())
            .build())
        .healthCheckInterval(health.getCheckInterval())
        .asyncThreads(props.getAsync().getThreads())
        .drainTimeoutMs(props.getAsync().getDrainTimeoutMs());

    TypeRegistry typeRegistry = typeRegistryProvider.getIfAvailable();
    if (typeRegistry != null) {
      builder.typeRegistry(typeRegistry);
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    interceptors.forEach(builder::interceptor);

    return registerTypes(builder.build(), props.getTypes());
  }

  /** Registers the configured types, closing {@code bus} if any registration fails. */
  static MessageBus registerTypes(MessageBus bus, Map<Integer, String> types) {
    try {
      types.forEach(bus::registerType);
    } catch (RuntimeException e) {
      bus.close();
      throw e;
    }
    return bus;
  }

  @Bean
  @ConditionalOnMissingBean
  public BusSubscriberRegistrar busSubscriberRegistrar(ListableBeanFactory beanFactory,
      MessageBus messageBus) {
    return new BusSubscriberRegistrar(beanFactory, messageBus);
  }
}
