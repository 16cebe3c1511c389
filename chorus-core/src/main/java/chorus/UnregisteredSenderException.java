package chorus;

/**
 * Thrown when a broadcast is requested for an address the directory does not know.
 */
public final class UnregisteredSenderException extends RuntimeException {
  private final String address;

  public UnregisteredSenderException(String address) {
    super("Sender is not registered: " + address);
    this.address = address;
  }

  public String address() {
    return address;
  }
}
