/**
 * JDBC-based {@link chorus.spi.MessageLedger} implementations.
 *
 * <p>{@link chorus.jdbc.ledger.AbstractJdbcMessageLedger} provides shared SQL and row mapping;
 * subclasses supply the reaction upsert: H2 (update, then insert), MySQL
 * ({@code ON DUPLICATE KEY UPDATE}) and PostgreSQL ({@code ON CONFLICT DO UPDATE}).
 *
 * @see chorus.jdbc.ledger.AbstractJdbcMessageLedger
 * @see chorus.jdbc.ledger.JdbcMessageLedgers
 */
package chorus.jdbc.ledger;
