/**
 * Micrometer bridge for dispatch metrics.
 */
package relay.micrometer;
