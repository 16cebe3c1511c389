package chorus.model;

import java.util.Objects;

/**
 * Outcome of sending one outbound message to one recipient.
 *
 * @param messageId        broadcast id, or the synthetic id of a digest or update
 * @param recipientAddress destination address
 * @param status           terminal status once persisted
 * @param providerId       transport-assigned id on success, otherwise {@code null}
 * @param error            last failure reason, otherwise {@code null}
 * @param durationMs       wall time spent on this recipient including retries
 * @param retryCount       number of attempts after the first one
 */
public record DeliveryAttempt(
    String messageId,
    String recipientAddress,
    DeliveryStatus status,
    String providerId,
    String error,
    long durationMs,
    int retryCount) {

  public DeliveryAttempt {
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(recipientAddress, "recipientAddress");
    Objects.requireNonNull(status, "status");
  }

  public static DeliveryAttempt delivered(String messageId, String recipientAddress,
      String providerId, long durationMs, int retryCount) {
    return new DeliveryAttempt(messageId, recipientAddress, DeliveryStatus.DELIVERED,
        providerId, null, durationMs, retryCount);
  }

  public static DeliveryAttempt failed(String messageId, String recipientAddress,
      String error, long durationMs, int retryCount) {
    return new DeliveryAttempt(messageId, recipientAddress, DeliveryStatus.FAILED,
        null, error, durationMs, retryCount);
  }
}
