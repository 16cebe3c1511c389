package chorus.jdbc.ledger;

import chorus.jdbc.ConnectionProvider;
import chorus.jdbc.DataSourceConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC ledgers with auto-detection support.
 *
 * <p>Ledgers are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/chorus.jdbc.ledger.AbstractJdbcMessageLedger}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource, bound to it
 * AbstractJdbcMessageLedger ledger = JdbcMessageLedgers.detect(dataSource);
 *
 * // Unbound template by JDBC URL or name
 * AbstractJdbcMessageLedger mysql = JdbcMessageLedgers.detect("jdbc:mysql://localhost/chorus");
 * AbstractJdbcMessageLedger pg = JdbcMessageLedgers.get("postgresql");
 * }</pre>
 */
public final class JdbcMessageLedgers {

  private static final List<AbstractJdbcMessageLedger> LEDGERS;
  private static final Map<String, AbstractJdbcMessageLedger> BY_NAME = new ConcurrentHashMap<>();

  static {
    LEDGERS = ServiceLoader.load(AbstractJdbcMessageLedger.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcMessageLedger ledger : LEDGERS) {
      BY_NAME.put(ledger.name().toLowerCase(Locale.ROOT), ledger);
    }
  }

  private JdbcMessageLedgers() {
  }

  /**
   * Returns all registered ledger templates.
   */
  public static List<AbstractJdbcMessageLedger> all() {
    return LEDGERS;
  }

  /**
   * Gets an unbound ledger template by name.
   *
   * @param name ledger name (case-insensitive)
   * @return the ledger template
   * @throws IllegalArgumentException if no ledger found
   */
  public static AbstractJdbcMessageLedger get(String name) {
    AbstractJdbcMessageLedger ledger = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (ledger == null) {
      throw new IllegalArgumentException("Unknown message ledger: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return ledger;
  }

  /**
   * Detects the ledger from a DataSource and binds it to that DataSource.
   *
   * @param dataSource the data source
   * @return a ready-to-use ledger
   * @throws IllegalStateException if the JDBC URL cannot be read
   */
  public static AbstractJdbcMessageLedger detect(DataSource dataSource) {
    ConnectionProvider provider = new DataSourceConnectionProvider(dataSource);
    try (Connection conn = dataSource.getConnection()) {
      String url = conn.getMetaData().getURL();
      return detect(url).withConnectionProvider(provider);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect message ledger from DataSource", e);
    }
  }

  /**
   * Detects the unbound ledger template for a JDBC URL.
   *
   * @param jdbcUrl the JDBC URL
   * @return the matching ledger template
   * @throws IllegalArgumentException if no matching ledger found
   */
  public static AbstractJdbcMessageLedger detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }

    String lower = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcMessageLedger ledger : LEDGERS) {
      for (String prefix : ledger.jdbcUrlPrefixes()) {
        if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return ledger;
        }
      }
    }

    throw new IllegalArgumentException("No message ledger found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return LEDGERS.stream()
        .flatMap(l -> l.jdbcUrlPrefixes().stream())
        .toList();
  }
}
