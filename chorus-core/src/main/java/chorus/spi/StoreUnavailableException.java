package chorus.spi;

/**
 * Thrown by directory and ledger implementations when the backing store cannot serve a
 * request. Aborts the current operation.
 */
public class StoreUnavailableException extends RuntimeException {

  public StoreUnavailableException(String message) {
    super(message);
  }

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
