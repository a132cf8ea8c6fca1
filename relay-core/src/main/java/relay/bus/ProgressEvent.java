package relay.bus;

import java.time.Instant;
import java.util.Objects;

/**
 * Step notification for a long-running task, routed to the chat it originated from.
 */
public record ProgressEvent(
    String taskId,
    int step,
    Integer totalSteps,
    String description,
    String provider,
    String chatId,
    Instant at) {

  public ProgressEvent {
    Objects.requireNonNull(taskId, "taskId");
    if (at == null) {
      at = Instant.now();
    }
  }
}
