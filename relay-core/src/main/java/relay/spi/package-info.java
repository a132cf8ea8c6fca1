/**
 * Service Provider Interfaces for pluggable relay components.
 *
 * <ul>
 *   <li>{@link relay.spi.ChannelRegistry} - transmits messages to external channels</li>
 *   <li>{@link relay.spi.ChatChannel} - one concrete delivery channel</li>
 *   <li>{@link relay.spi.DeadLetterStore} - persists messages that exhausted their retries</li>
 *   <li>{@link relay.spi.MetricsExporter} - exports dispatch counters and gauges</li>
 * </ul>
 */
package relay.spi;
