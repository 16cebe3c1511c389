package chorus.jdbc.ledger;

import chorus.jdbc.ConnectionProvider;
import chorus.jdbc.JdbcTemplate;
import chorus.model.Reaction;

import java.sql.Connection;
import java.util.List;

/**
 * MySQL ledger (also used for MariaDB and TiDB).
 *
 * <p>Reaction upsert uses {@code INSERT ... ON DUPLICATE KEY UPDATE} on the
 * {@code (broadcast_id, reactor_address)} primary key.
 */
public final class MySqlMessageLedger extends AbstractJdbcMessageLedger {

  public MySqlMessageLedger() {
    super();
  }

  public MySqlMessageLedger(ConnectionProvider connectionProvider) {
    super(connectionProvider);
  }

  @Override
  public AbstractJdbcMessageLedger withConnectionProvider(ConnectionProvider connectionProvider) {
    return new MySqlMessageLedger(connectionProvider);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
  }

  @Override
  protected void upsertReaction(Connection conn, Reaction reaction) {
    String sql = "INSERT INTO " + REACTION_TABLE + " (" + REACTION_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?)"
        + " ON DUPLICATE KEY UPDATE reactor_name=VALUES(reactor_name), emoji=VALUES(emoji),"
        + " previous_emoji=VALUES(previous_emoji), active=VALUES(active), updated_at=VALUES(updated_at)";
    JdbcTemplate.update(conn, sql, reactionParams(reaction));
  }
}
