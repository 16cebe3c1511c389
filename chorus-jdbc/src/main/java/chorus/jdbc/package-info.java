/**
 * JDBC support shared by the ledger and directory: connection access, a small query helper
 * and the {@link chorus.jdbc.JdbcStoreException} that maps SQL failures to
 * {@link chorus.spi.StoreUnavailableException}.
 *
 * @see chorus.jdbc.ledger
 * @see chorus.jdbc.directory
 */
package chorus.jdbc;
