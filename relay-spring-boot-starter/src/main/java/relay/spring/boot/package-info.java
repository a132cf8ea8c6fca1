/**
 * Spring Boot auto-configuration for outbound dispatch.
 *
 * <p>Properties live under the {@code relay} prefix, see
 * {@link relay.spring.boot.RelayProperties}.
 */
package relay.spring.boot;
