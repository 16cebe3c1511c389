package chorus.spi;

/**
 * Result of a single {@link Transport#send} call.
 *
 * @param ok         whether the provider accepted the message
 * @param providerId provider-side message id, if any
 * @param error      failure reason when {@code ok} is false
 */
public record SendResult(boolean ok, String providerId, String error) {

  public static SendResult success(String providerId) {
    return new SendResult(true, providerId, null);
  }

  public static SendResult failure(String error) {
    return new SendResult(false, null, error == null ? "unknown error" : error);
  }
}
