package relay.spring.boot;

import relay.breaker.CircuitBreakerRegistry;
import relay.bus.MessageBus;
import relay.dead.DeadLetterManager;
import relay.dispatch.DispatchService;
import relay.dispatch.ExponentialBackoffRetryPolicy;
import relay.jdbc.JdbcDeadLetterStores;
import relay.ratelimit.TokenBucketRateLimiter;
import relay.registry.DefaultChannelRegistry;
import relay.spi.ChannelRegistry;
import relay.spi.ChatChannel;
import relay.spi.DeadLetterStore;
import relay.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;

/**
 * Auto-configuration for outbound dispatch.
 *
 * <p>Wires a {@link MessageBus}, a {@link DefaultChannelRegistry} holding every
 * {@link ChatChannel} bean, a file-backed dead-letter store, and a
 * {@link DispatchService} consuming the bus' outbound lane. Any of these can be
 * replaced by declaring a bean of the same type.
 *
 * @see RelayProperties
 * @see RelayMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(DispatchService.class)
@EnableConfigurationProperties(RelayProperties.class)
public class RelayAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public MessageBus messageBus() {
    return new MessageBus();
  }

  @Bean
  @ConditionalOnMissingBean(ChannelRegistry.class)
  public DefaultChannelRegistry channelRegistry(ObjectProvider<ChatChannel> channels) {
    DefaultChannelRegistry registry = new DefaultChannelRegistry();
    channels.orderedStream().forEach(registry::register);
    return registry;
  }

  @Bean
  @ConditionalOnMissingBean(DeadLetterStore.class)
  @ConditionalOnClass(name = "org.h2.jdbcx.JdbcDataSource")
  @ConditionalOnProperty(prefix = "relay.dead-letter", name = "enabled", matchIfMissing = true)
  public DeadLetterStore deadLetterStore(RelayProperties props) {
    RelayProperties.DeadLetter dl = props.getDeadLetter();
    return JdbcDeadLetterStores.fileBacked(Path.of(dl.getPath()), dl.getTableName());
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "relay.circuit-breaker", name = "enabled")
  public CircuitBreakerRegistry circuitBreakerRegistry(RelayProperties props) {
    RelayProperties.CircuitBreaker cb = props.getCircuitBreaker();
    return CircuitBreakerRegistry.withDefaults(
        cb.getFailureThreshold(), cb.getResetTimeoutMs(), cb.getHalfOpenMax());
  }

  @Bean
  @ConditionalOnMissingBean
  public TokenBucketRateLimiter rateLimiter(RelayProperties props) {
    RelayProperties.RateLimit rl = props.getRateLimit();
    return TokenBucketRateLimiter.builder()
        .capacity(rl.getCapacity())
        .refillRate(rl.getRefillRate())
        .refillIntervalMs(rl.getRefillIntervalMs())
        .build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public DispatchService dispatchService(RelayProperties props,
      MessageBus bus,
      ChannelRegistry channelRegistry,
      TokenBucketRateLimiter rateLimiter,
      ObjectProvider<DeadLetterStore> deadLetterStoreProvider,
      ObjectProvider<CircuitBreakerRegistry> circuitBreakerProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {

    RelayProperties.Dispatch d = props.getDispatch();
    DispatchService service = DispatchService.builder()
        .bus(bus)
        .channelRegistry(channelRegistry)
        .deadLetterStore(deadLetterStoreProvider.getIfAvailable())
        .circuitBreakers(circuitBreakerProvider.getIfAvailable())
        .rateLimiter(rateLimiter)
        .metrics(metricsProvider.getIfAvailable())
        .retryPolicy(new ExponentialBackoffRetryPolicy(
            d.getRetryBaseMs(), d.getRetryMaxMs(), d.getRetryJitterMs()))
        .inlineRetries(d.getInlineRetries())
        .retryMax(d.getRetryMax())
        .consumeTimeoutMs(d.getConsumeTimeoutMs())
        .dedupeTtlMs(props.getDedupe().getTtlMs())
        .dedupeMaxSize(props.getDedupe().getMaxSize())
        .build();
    if (d.isAutoStart()) {
      service.start();
    }
    return service;
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean(DeadLetterStore.class)
  public DeadLetterManager deadLetterManager(DeadLetterStore deadLetterStore, MessageBus bus) {
    return new DeadLetterManager(deadLetterStore, bus);
  }
}
