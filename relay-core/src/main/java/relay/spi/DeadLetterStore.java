package relay.spi;

import relay.dead.DeadLetterRecord;

import java.util.List;

/**
 * Persistent sink for messages that exhausted their retry budget.
 *
 * <p>Writes are best effort from the dispatcher's point of view: a failing
 * {@link #append} is logged and otherwise ignored.
 *
 * @see relay.dead.DeadLetterManager
 */
public interface DeadLetterStore {

  /**
   * Persists a dead-letter record.
   *
   * @param record the failure context
   * @throws RuntimeException if the record could not be stored
   */
  void append(DeadLetterRecord record);

  /**
   * Returns the most recent records, newest first.
   *
   * @param limit maximum number of records; values below 1 fall back to 100
   */
  List<DeadLetterRecord> list(int limit);

  /**
   * Describes where records are kept (a file path or JDBC URL), for diagnostics.
   */
  String location();
}
