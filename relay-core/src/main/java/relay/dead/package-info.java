/**
 * Dead-letter records and the facade for listing and replaying them.
 *
 * @see relay.dead.DeadLetterManager
 * @see relay.spi.DeadLetterStore
 */
package relay.dead;
