package chorus.dispatch;

import chorus.model.DeliveryAttempt;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Settled result of one fan-out.
 *
 * @param messageId   id of the broadcast, digest or update
 * @param sentCount   recipients the transport accepted
 * @param failedCount recipients that failed after retries or timed out
 * @param elapsed     time from first dispatch until every recipient settled
 * @param attempts    one record per recipient
 */
public record BroadcastOutcome(String messageId, int sentCount, int failedCount, Duration elapsed,
    List<DeliveryAttempt> attempts) {

  public BroadcastOutcome {
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(elapsed, "elapsed");
    attempts = List.copyOf(attempts);
  }

  public int recipientCount() {
    return sentCount + failedCount;
  }
}
