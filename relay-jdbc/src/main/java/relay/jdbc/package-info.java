/**
 * JDBC-backed dead-letter storage.
 *
 * @see relay.jdbc.JdbcDeadLetterStore
 * @see relay.jdbc.JdbcDeadLetterStores
 */
package relay.jdbc;
