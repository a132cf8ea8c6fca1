package relay.jdbc;

import relay.dead.DeadLetterRecord;
import relay.jdbc.dialect.Dialects;
import relay.jdbc.spi.Dialect;
import relay.spi.DeadLetterStore;
import relay.util.JsonCodec;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * {@link DeadLetterStore} writing to a relational table ({@value TableNames#DEFAULT_TABLE}
 * by default).
 *
 * <p>The table is created on first use with the dialect's DDL. The dialect is detected
 * from the connection URL unless set explicitly. Writes are serialized through a lock;
 * metadata is stored as a flat JSON object.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * JdbcDeadLetterStore store = JdbcDeadLetterStore.builder(dataSource)
 *     .tableName("relay_dlq")
 *     .build();
 * }</pre>
 */
public final class JdbcDeadLetterStore implements DeadLetterStore {
  private static final Logger logger = Logger.getLogger(JdbcDeadLetterStore.class.getName());

  static final int DEFAULT_LIST_LIMIT = 100;

  private final DataSource dataSource;
  private final String tableName;
  private final JsonCodec jsonCodec;
  private final ReentrantLock writeLock = new ReentrantLock();
  private final Object initLock = new Object();
  private volatile Dialect dialect;
  private volatile String jdbcUrl;
  private volatile boolean tableReady;

  private JdbcDeadLetterStore(Builder builder) {
    this.dataSource = Objects.requireNonNull(builder.dataSource, "dataSource");
    this.tableName = TableNames.validate(builder.tableName);
    this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    this.dialect = builder.dialect;
  }

  public static Builder builder(DataSource dataSource) {
    return new Builder(dataSource);
  }

  public String tableName() {
    return tableName;
  }

  @Override
  public void append(DeadLetterRecord record) {
    Objects.requireNonNull(record, "record");
    writeLock.lock();
    try (Connection conn = dataSource.getConnection()) {
      ensureTable(conn);
      JdbcTemplate.update(conn, dialect.insertSql(tableName),
          Timestamp.from(record.at()),
          record.provider(),
          record.chatId(),
          record.messageId(),
          record.senderId(),
          record.replyTo(),
          record.threadId(),
          record.retryCount(),
          record.error(),
          record.content(),
          jsonCodec.toJson(record.metadata()));
    } catch (SQLException e) {
      throw new DeadLetterStoreException("Failed to append dead letter messageId=" + record.messageId(), e);
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public List<DeadLetterRecord> list(int limit) {
    int n = limit < 1 ? DEFAULT_LIST_LIMIT : limit;
    try (Connection conn = dataSource.getConnection()) {
      ensureTable(conn);
      return JdbcTemplate.query(conn, dialect.selectRecentSql(tableName), rs -> new DeadLetterRecord(
          rs.getTimestamp("dead_at").toInstant(),
          rs.getString("provider"),
          rs.getString("chat_id"),
          rs.getString("message_id"),
          rs.getString("sender_id"),
          rs.getString("reply_to"),
          rs.getString("thread_id"),
          rs.getInt("retry_count"),
          rs.getString("error"),
          rs.getString("content"),
          jsonCodec.parseObject(rs.getString("metadata_json"))), n);
    } catch (SQLException e) {
      throw new DeadLetterStoreException("Failed to list dead letters", e);
    }
  }

  /**
   * Returns the JDBC URL of the backing database, or the data source description when no
   * connection has been made yet.
   */
  @Override
  public String location() {
    String url = jdbcUrl;
    return url != null ? url : dataSource.toString();
  }

  private void ensureTable(Connection conn) throws SQLException {
    if (tableReady) {
      return;
    }
    synchronized (initLock) {
      if (tableReady) {
        return;
      }
      String url = conn.getMetaData().getURL();
      if (dialect == null) {
        dialect = Dialects.detect(url);
      }
      JdbcTemplate.execute(conn, dialect.createTableSql(tableName));
      jdbcUrl = url;
      tableReady = true;
      logger.info("Dead-letter table ready table=" + tableName + " dialect=" + dialect.name() + " url=" + url);
    }
  }

  /** Builder for {@link JdbcDeadLetterStore}. */
  public static final class Builder {
    private final DataSource dataSource;
    private String tableName = TableNames.DEFAULT_TABLE;
    private Dialect dialect;
    private JsonCodec jsonCodec;

    private Builder(DataSource dataSource) {
      this.dataSource = dataSource;
    }

    /** Optional. Defaults to {@value TableNames#DEFAULT_TABLE}. */
    public Builder tableName(String tableName) {
      this.tableName = tableName;
      return this;
    }

    /** Optional. Detected from the connection URL on first use when unset. */
    public Builder dialect(Dialect dialect) {
      this.dialect = dialect;
      return this;
    }

    /** Optional. Defaults to {@link JsonCodec#getDefault()}. */
    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    /**
     * @throws NullPointerException if the data source is null
     * @throws IllegalArgumentException if the table name is not a plain identifier
     */
    public JdbcDeadLetterStore build() {
      return new JdbcDeadLetterStore(this);
    }
  }
}
