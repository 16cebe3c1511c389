package chorus.jdbc;

import chorus.spi.StoreUnavailableException;

/**
 * Unchecked exception wrapping JDBC errors thrown by the JDBC ledger and directory.
 */
public final class JdbcStoreException extends StoreUnavailableException {
  public JdbcStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
