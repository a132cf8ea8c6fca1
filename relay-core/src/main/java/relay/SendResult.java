package relay;

/**
 * Outcome of a delivery attempt.
 *
 * <p>Delivery failures are reported as values rather than exceptions: a failed result
 * carries a free-form {@code error} string that the dispatch layer classifies as
 * retryable or not.
 *
 * @param ok        whether the message was delivered (or deduplicated)
 * @param messageId provider-assigned id of the delivered message; may be {@code null}
 * @param error     failure description; {@code null} on success
 */
public record SendResult(boolean ok, String messageId, String error) {

  public static SendResult success(String messageId) {
    return new SendResult(true, messageId, null);
  }

  public static SendResult failure(String error) {
    return new SendResult(false, null, error == null || error.isBlank() ? "unknown_error" : error);
  }
}
