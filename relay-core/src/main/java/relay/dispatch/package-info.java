/**
 * Outbound delivery pipeline: rate gate, dedupe, inline and out-of-band retries,
 * and dead-lettering.
 *
 * @see relay.dispatch.DispatchService
 */
package relay.dispatch;
