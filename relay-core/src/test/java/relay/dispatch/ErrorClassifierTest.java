package relay.dispatch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ErrorClassifierTest {

  @Test
  void knownMarkersAreNotRetryable() {
    for (String marker : ErrorClassifier.NON_RETRYABLE) {
      assertFalse(ErrorClassifier.isRetryable(marker), marker);
    }
  }

  @Test
  void matchingIsCaseInsensitiveSubstring() {
    assertFalse(ErrorClassifier.isRetryable("slack api error: INVALID_AUTH (token revoked)"));
    assertFalse(ErrorClassifier.isRetryable("telegram: Chat_Id_Required"));
  }

  @Test
  void everythingElseIsRetryable() {
    assertTrue(ErrorClassifier.isRetryable("timeout"));
    assertTrue(ErrorClassifier.isRetryable("rate_limited"));
    assertTrue(ErrorClassifier.isRetryable(""));
    assertTrue(ErrorClassifier.isRetryable(null));
  }
}
