package chorus.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Runs a unit of JDBC work on a fresh connection.
 */
public final class Connections {

  @FunctionalInterface
  public interface Work<T> {
    T apply(Connection conn) throws SQLException;
  }

  /** Runs {@code work} in auto-commit mode. */
  public static <T> T withConnection(ConnectionProvider provider, String operation, Work<T> work) {
    try (Connection conn = provider.getConnection()) {
      conn.setAutoCommit(true);
      return work.apply(conn);
    } catch (SQLException e) {
      throw new JdbcStoreException("Failed to " + operation, e);
    }
  }

  /** Runs {@code work} in one transaction, rolling back on any failure. */
  public static <T> T inTransaction(ConnectionProvider provider, String operation, Work<T> work) {
    try (Connection conn = provider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        T result = work.apply(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException e) {
      throw new JdbcStoreException("Failed to " + operation, e);
    }
  }

  private Connections() {}
}
