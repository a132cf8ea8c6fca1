package relay.jdbc.dialect;

import relay.jdbc.spi.Dialect;

/**
 * Base dialect with standard SQL. Subclasses supply column types.
 *
 * <p>String columns are unbounded; ids and addresses come from producers and channels
 * with no length contract.
 */
public abstract class AbstractDialect implements Dialect {

  /** Auto-generated primary key column definition. */
  protected abstract String idColumn();

  protected String textType() {
    return "TEXT";
  }

  protected String timestampType() {
    return "TIMESTAMP";
  }

  @Override
  public String createTableSql(String table) {
    return "CREATE TABLE IF NOT EXISTS " + table + " (" +
        "id " + idColumn() + ", " +
        "dead_at " + timestampType() + " NOT NULL, " +
        "provider " + textType() + " NOT NULL, " +
        "chat_id " + textType() + " NOT NULL, " +
        "message_id " + textType() + " NOT NULL, " +
        "sender_id " + textType() + " NOT NULL, " +
        "reply_to " + textType() + " NOT NULL, " +
        "thread_id " + textType() + " NOT NULL, " +
        "retry_count INT NOT NULL, " +
        "error " + textType() + " NOT NULL, " +
        "content " + textType() + " NOT NULL, " +
        "metadata_json " + textType() + " NOT NULL)";
  }

  @Override
  public String insertSql(String table) {
    return "INSERT INTO " + table + " (" +
        "dead_at, provider, chat_id, message_id, sender_id, reply_to, thread_id, " +
        "retry_count, error, content, metadata_json" +
        ") VALUES (?,?,?,?,?,?,?,?,?,?,?)";
  }

  @Override
  public String selectRecentSql(String table) {
    return "SELECT dead_at, provider, chat_id, message_id, sender_id, reply_to, thread_id, " +
        "retry_count, error, content, metadata_json " +
        "FROM " + table + " ORDER BY id DESC LIMIT ?";
  }
}
