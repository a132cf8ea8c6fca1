package relay.dispatch;

import java.util.List;
import java.util.Locale;

/**
 * Classifies free-form delivery errors as retryable or not.
 *
 * <p>An error is non-retryable when its lower-cased text contains any of
 * {@link #NON_RETRYABLE}. Matching is by substring, so an error that merely mentions
 * one of these markers is treated as non-retryable too.
 */
public final class ErrorClassifier {
  public static final List<String> NON_RETRYABLE = List.of(
      "invalid_auth",
      "not_authed",
      "channel_not_found",
      "chat_id_required",
      "bot_token_missing",
      "permission_denied",
      "invalid_arguments");

  private ErrorClassifier() {
  }

  public static boolean isRetryable(String error) {
    if (error == null || error.isEmpty()) {
      return true;
    }
    String lower = error.toLowerCase(Locale.ROOT);
    for (String marker : NON_RETRYABLE) {
      if (lower.contains(marker)) {
        return false;
      }
    }
    return true;
  }
}
