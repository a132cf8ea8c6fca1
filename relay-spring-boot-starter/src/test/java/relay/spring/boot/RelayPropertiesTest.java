package relay.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

class RelayPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(RelayProperties.class);
            assertEquals(0, props.getDispatch().getInlineRetries());
            assertEquals(3, props.getDispatch().getRetryMax());
            assertEquals(700, props.getDispatch().getRetryBaseMs());
            assertEquals(25000, props.getDispatch().getRetryMaxMs());
            assertEquals(250, props.getDispatch().getRetryJitterMs());
            assertEquals(2000, props.getDispatch().getConsumeTimeoutMs());
            assertTrue(props.getDispatch().isAutoStart());
            assertTrue(props.getDeadLetter().isEnabled());
            assertEquals("data/dlq/dlq", props.getDeadLetter().getPath());
            assertEquals("outbound_dlq", props.getDeadLetter().getTableName());
            assertEquals(25000, props.getDedupe().getTtlMs());
            assertEquals(20000, props.getDedupe().getMaxSize());
            assertEquals(30, props.getRateLimit().getCapacity());
            assertEquals(1, props.getRateLimit().getRefillRate());
            assertEquals(1000, props.getRateLimit().getRefillIntervalMs());
            assertFalse(props.getCircuitBreaker().isEnabled());
            assertEquals(5, props.getCircuitBreaker().getFailureThreshold());
            assertEquals(30000, props.getCircuitBreaker().getResetTimeoutMs());
            assertEquals(1, props.getCircuitBreaker().getHalfOpenMax());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("relay", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "relay.dispatch.inline-retries=2",
                "relay.dispatch.retry-max=5",
                "relay.dispatch.retry-base-ms=100",
                "relay.dispatch.retry-max-ms=5000",
                "relay.dispatch.retry-jitter-ms=0",
                "relay.dispatch.consume-timeout-ms=500",
                "relay.dispatch.auto-start=false",
                "relay.dead-letter.enabled=false",
                "relay.dead-letter.path=/var/lib/relay/dlq",
                "relay.dead-letter.table-name=agent_dlq",
                "relay.dedupe.ttl-ms=1000",
                "relay.dedupe.max-size=10",
                "relay.rate-limit.capacity=60",
                "relay.rate-limit.refill-rate=2",
                "relay.rate-limit.refill-interval-ms=500",
                "relay.circuit-breaker.enabled=true",
                "relay.circuit-breaker.failure-threshold=3",
                "relay.circuit-breaker.reset-timeout-ms=10000",
                "relay.circuit-breaker.half-open-max=2",
                "relay.metrics.enabled=false",
                "relay.metrics.name-prefix=support.relay"
        ).run(ctx -> {
            var props = ctx.getBean(RelayProperties.class);
            assertEquals(2, props.getDispatch().getInlineRetries());
            assertEquals(5, props.getDispatch().getRetryMax());
            assertEquals(100, props.getDispatch().getRetryBaseMs());
            assertEquals(5000, props.getDispatch().getRetryMaxMs());
            assertEquals(0, props.getDispatch().getRetryJitterMs());
            assertEquals(500, props.getDispatch().getConsumeTimeoutMs());
            assertFalse(props.getDispatch().isAutoStart());
            assertFalse(props.getDeadLetter().isEnabled());
            assertEquals("/var/lib/relay/dlq", props.getDeadLetter().getPath());
            assertEquals("agent_dlq", props.getDeadLetter().getTableName());
            assertEquals(1000, props.getDedupe().getTtlMs());
            assertEquals(10, props.getDedupe().getMaxSize());
            assertEquals(60, props.getRateLimit().getCapacity());
            assertEquals(2, props.getRateLimit().getRefillRate());
            assertEquals(500, props.getRateLimit().getRefillIntervalMs());
            assertTrue(props.getCircuitBreaker().isEnabled());
            assertEquals(3, props.getCircuitBreaker().getFailureThreshold());
            assertEquals(10000, props.getCircuitBreaker().getResetTimeoutMs());
            assertEquals(2, props.getCircuitBreaker().getHalfOpenMax());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("support.relay", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void relaxedBindingAcceptsCamelCase() {
        runner.withPropertyValues("relay.dispatch.retryMax=7").run(ctx -> {
            assertEquals(7, ctx.getBean(RelayProperties.class).getDispatch().getRetryMax());
        });
    }

    @Configuration
    @EnableConfigurationProperties(RelayProperties.class)
    static class PropsConfig {
    }
}
