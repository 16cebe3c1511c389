package chorus.jdbc.ledger;

import chorus.jdbc.ConnectionProvider;
import chorus.jdbc.JdbcTemplate;
import chorus.model.Reaction;

import java.sql.Connection;
import java.util.List;

/**
 * PostgreSQL ledger.
 *
 * <p>Reaction upsert uses {@code INSERT ... ON CONFLICT (broadcast_id, reactor_address) DO UPDATE}.
 */
public final class PostgresMessageLedger extends AbstractJdbcMessageLedger {

  public PostgresMessageLedger() {
    super();
  }

  public PostgresMessageLedger(ConnectionProvider connectionProvider) {
    super(connectionProvider);
  }

  @Override
  public AbstractJdbcMessageLedger withConnectionProvider(ConnectionProvider connectionProvider) {
    return new PostgresMessageLedger(connectionProvider);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected void upsertReaction(Connection conn, Reaction reaction) {
    String sql = "INSERT INTO " + REACTION_TABLE + " (" + REACTION_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?)"
        + " ON CONFLICT (broadcast_id, reactor_address) DO UPDATE SET reactor_name=EXCLUDED.reactor_name,"
        + " emoji=EXCLUDED.emoji, previous_emoji=EXCLUDED.previous_emoji, active=EXCLUDED.active,"
        + " updated_at=EXCLUDED.updated_at";
    JdbcTemplate.update(conn, sql, reactionParams(reaction));
  }
}
