package relay.jdbc.spi;

import java.util.List;

/**
 * SPI for database-specific dead-letter SQL.
 *
 * <p>Register custom dialects via {@code META-INF/services/relay.jdbc.spi.Dialect}.
 * Built-in dialects: MySQL (+ TiDB), PostgreSQL, H2.
 *
 * @see relay.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * Idempotent DDL creating the dead-letter table.
   */
  String createTableSql(String table);

  /**
   * SQL inserting one dead letter.
   *
   * <p>Parameters (in order): dead_at (Timestamp), provider, chat_id, message_id,
   * sender_id, reply_to, thread_id, retry_count (int), error, content, metadata_json.
   */
  String insertSql(String table);

  /**
   * SQL selecting the newest dead letters first.
   *
   * <p>Parameters: limit (int)
   */
  String selectRecentSql(String table);
}
