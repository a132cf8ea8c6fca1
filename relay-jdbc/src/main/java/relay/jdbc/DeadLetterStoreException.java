package relay.jdbc;

/**
 * Unchecked exception wrapping JDBC errors raised while reading or writing dead letters.
 */
public final class DeadLetterStoreException extends RuntimeException {
  public DeadLetterStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
