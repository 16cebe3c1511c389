package chorus.jdbc.directory;

import chorus.jdbc.ConnectionProvider;
import chorus.jdbc.Connections;
import chorus.jdbc.DataSourceConnectionProvider;
import chorus.jdbc.JdbcTemplate;
import chorus.model.Recipient;
import chorus.model.SenderIdentity;
import chorus.spi.RecipientDirectory;

import javax.sql.DataSource;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link RecipientDirectory} over the {@code chorus_member} table.
 *
 * <p>Only rows with {@code active = true} are recipients or recognized senders. Members are
 * never deleted; {@link #deactivate(String)} takes them off the roster.
 */
public final class JdbcRecipientDirectory implements RecipientDirectory {
  static final String MEMBER_TABLE = "chorus_member";

  private static final JdbcTemplate.RowMapper<Recipient> RECIPIENT_ROW_MAPPER = rs -> new Recipient(
      rs.getString("address"),
      rs.getString("name"),
      rs.getBoolean("is_admin"));

  private final ConnectionProvider connectionProvider;

  public JdbcRecipientDirectory(ConnectionProvider connectionProvider) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  public static JdbcRecipientDirectory of(DataSource dataSource) {
    return new JdbcRecipientDirectory(new DataSourceConnectionProvider(dataSource));
  }

  @Override
  public List<Recipient> activeRecipients(String excludeAddress) {
    StringBuilder sql = new StringBuilder("SELECT address, name, is_admin FROM ")
        .append(MEMBER_TABLE).append(" WHERE active=?");
    List<Object> params = new ArrayList<>();
    params.add(true);
    if (excludeAddress != null) {
      sql.append(" AND address <> ?");
      params.add(excludeAddress);
    }
    sql.append(" ORDER BY address");
    return Connections.withConnection(connectionProvider, "query active members", conn ->
        JdbcTemplate.query(conn, sql.toString(), RECIPIENT_ROW_MAPPER, params.toArray()));
  }

  @Override
  public Optional<SenderIdentity> identity(String address) {
    String sql = "SELECT address, name, is_admin FROM " + MEMBER_TABLE + " WHERE address=? AND active=?";
    List<Recipient> rows = Connections.withConnection(connectionProvider, "look up member", conn ->
        JdbcTemplate.query(conn, sql, RECIPIENT_ROW_MAPPER, address, true));
    return rows.stream().findFirst().map(r -> new SenderIdentity(r.name(), r.admin()));
  }

  /**
   * Adds a member, or reactivates and renames an existing one.
   */
  public void addMember(String address, String name, boolean admin) {
    Objects.requireNonNull(address, "address");
    Objects.requireNonNull(name, "name");
    Connections.inTransaction(connectionProvider, "add member", conn -> {
      int updated = JdbcTemplate.update(conn,
          "UPDATE " + MEMBER_TABLE + " SET name=?, is_admin=?, active=? WHERE address=?",
          name, admin, true, address);
      if (updated == 0) {
        JdbcTemplate.update(conn,
            "INSERT INTO " + MEMBER_TABLE + " (address, name, is_admin, active, joined_at) VALUES (?,?,?,?,?)",
            address, name, admin, true, Instant.now());
      }
      return null;
    });
  }

  /**
   * Takes a member off the roster.
   *
   * @return whether a member was deactivated
   */
  public boolean deactivate(String address) {
    return Connections.withConnection(connectionProvider, "deactivate member", conn ->
        JdbcTemplate.update(conn, "UPDATE " + MEMBER_TABLE + " SET active=? WHERE address=? AND active=?",
            false, address, true)) > 0;
  }
}
