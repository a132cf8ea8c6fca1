/**
 * Small shared helpers: thread factory and metadata JSON codec.
 */
package relay.util;
