package chorus;

/**
 * Thrown when an outbound message has nobody to go to. Aborts the broadcast; surfaced
 * only to admin senders.
 */
public final class NoRecipientsException extends RuntimeException {

  public NoRecipientsException(String message) {
    super(message);
  }
}
