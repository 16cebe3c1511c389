package chorus.jdbc.ledger;

import chorus.jdbc.ConnectionProvider;
import chorus.jdbc.Connections;
import chorus.jdbc.JdbcTemplate;
import chorus.model.Broadcast;
import chorus.model.DeliveryAttempt;
import chorus.model.DeliveryStatus;
import chorus.model.Reaction;
import chorus.spi.MessageLedger;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC ledger with standard SQL implementations.
 *
 * <p>Instances loaded through {@link java.util.ServiceLoader} are unbound templates; call
 * {@link #withConnectionProvider(ConnectionProvider)} (or use {@link JdbcMessageLedgers#detect})
 * to get a usable ledger. Subclasses override {@link #upsertReaction(Connection, Reaction)}
 * with a native upsert. Register custom implementations via
 * {@code META-INF/services/chorus.jdbc.ledger.AbstractJdbcMessageLedger}.
 *
 * <p>Tables are created by {@code chorus/schema-<name>.sql} on the classpath.
 *
 * @see JdbcMessageLedgers
 */
public abstract class AbstractJdbcMessageLedger implements MessageLedger {
  protected static final String BROADCAST_TABLE = "chorus_broadcast";
  protected static final String REACTION_TABLE = "chorus_reaction";
  protected static final String DELIVERY_TABLE = "chorus_delivery_attempt";
  private static final int MAX_ERROR_LENGTH = 4000;

  protected static final String BROADCAST_COLUMNS =
      "id, sender_address, sender_name, message_text, created_at, reaction_summary, last_reaction_update";
  protected static final String REACTION_COLUMNS =
      "broadcast_id, reactor_address, reactor_name, emoji, previous_emoji, active, processed, created_at, updated_at";

  protected static final JdbcTemplate.RowMapper<Broadcast> BROADCAST_ROW_MAPPER = rs -> new Broadcast(
      rs.getString("id"),
      rs.getString("sender_address"),
      rs.getString("sender_name"),
      rs.getString("message_text"),
      JdbcTemplate.instant(rs, "created_at"),
      rs.getString("reaction_summary"),
      JdbcTemplate.instant(rs, "last_reaction_update"));

  protected static final JdbcTemplate.RowMapper<Reaction> REACTION_ROW_MAPPER = rs -> new Reaction(
      rs.getString("broadcast_id"),
      rs.getString("reactor_address"),
      rs.getString("reactor_name"),
      rs.getString("emoji"),
      rs.getString("previous_emoji"),
      rs.getBoolean("active"),
      rs.getBoolean("processed"),
      JdbcTemplate.instant(rs, "created_at"),
      JdbcTemplate.instant(rs, "updated_at"));

  private final ConnectionProvider connectionProvider;

  protected AbstractJdbcMessageLedger() {
    this.connectionProvider = null;
  }

  protected AbstractJdbcMessageLedger(ConnectionProvider connectionProvider) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  /**
   * Unique identifier for this ledger dialect (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this ledger handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a ledger of the same dialect that obtains connections from {@code connectionProvider}.
   */
  public abstract AbstractJdbcMessageLedger withConnectionProvider(ConnectionProvider connectionProvider);

  /** Classpath location of the DDL for this dialect. */
  public String schemaResource() {
    return "chorus/schema-" + name() + ".sql";
  }

  protected ConnectionProvider connections() {
    if (connectionProvider == null) {
      throw new IllegalStateException("Ledger '" + name() + "' has no connection provider; "
          + "use withConnectionProvider() or JdbcMessageLedgers.detect()");
    }
    return connectionProvider;
  }

  @Override
  public String saveBroadcast(Broadcast broadcast) {
    String sql = "INSERT INTO " + BROADCAST_TABLE + " (" + BROADCAST_COLUMNS + ") VALUES (?,?,?,?,?,?,?)";
    Connections.withConnection(connections(), "save broadcast", conn ->
        JdbcTemplate.update(conn, sql,
            broadcast.id(), broadcast.senderAddress(), broadcast.senderName(), broadcast.text(),
            broadcast.createdAt(), broadcast.reactionSummary(), broadcast.lastReactionUpdate()));
    return broadcast.id();
  }

  @Override
  public Optional<Broadcast> findBroadcast(String broadcastId) {
    String sql = "SELECT " + BROADCAST_COLUMNS + " FROM " + BROADCAST_TABLE + " WHERE id=?";
    List<Broadcast> rows = Connections.withConnection(connections(), "find broadcast", conn ->
        JdbcTemplate.query(conn, sql, BROADCAST_ROW_MAPPER, broadcastId));
    return rows.stream().findFirst();
  }

  @Override
  public List<Broadcast> recentBroadcasts(Instant since, String excludeSender, int limit) {
    StringBuilder sql = new StringBuilder("SELECT ").append(BROADCAST_COLUMNS)
        .append(" FROM ").append(BROADCAST_TABLE).append(" WHERE created_at >= ?");
    List<Object> params = new ArrayList<>();
    params.add(since);
    if (excludeSender != null) {
      sql.append(" AND sender_address <> ?");
      params.add(excludeSender);
    }
    sql.append(" ORDER BY created_at DESC, id DESC LIMIT ?");
    params.add(limit);
    return Connections.withConnection(connections(), "query recent broadcasts", conn ->
        JdbcTemplate.query(conn, sql.toString(), BROADCAST_ROW_MAPPER, params.toArray()));
  }

  @Override
  public void updateSummary(String broadcastId, String summary) {
    String sql = "UPDATE " + BROADCAST_TABLE + " SET reaction_summary=? WHERE id=?";
    Connections.withConnection(connections(), "update reaction summary", conn ->
        JdbcTemplate.update(conn, sql, summary == null ? "" : summary, broadcastId));
  }

  @Override
  public void markSummaryBroadcast(String broadcastId, Instant at) {
    String sql = "UPDATE " + BROADCAST_TABLE + " SET last_reaction_update=? WHERE id=?";
    Connections.withConnection(connections(), "mark summary broadcast", conn ->
        JdbcTemplate.update(conn, sql, at, broadcastId));
  }

  @Override
  public Optional<Reaction> getReaction(String broadcastId, String reactorAddress) {
    String sql = "SELECT " + REACTION_COLUMNS + " FROM " + REACTION_TABLE
        + " WHERE broadcast_id=? AND reactor_address=?";
    List<Reaction> rows = Connections.withConnection(connections(), "get reaction", conn ->
        JdbcTemplate.query(conn, sql, REACTION_ROW_MAPPER, broadcastId, reactorAddress));
    return rows.stream().findFirst();
  }

  @Override
  public void upsertReaction(Reaction reaction) {
    Connections.inTransaction(connections(), "upsert reaction", conn -> {
      upsertReaction(conn, reaction);
      return null;
    });
  }

  /**
   * Writes the row for the reaction's key. The {@code processed} flag of an existing row is
   * never changed here; only {@link #markProcessed} sets it.
   *
   * <p>Default: UPDATE, then INSERT when no row matched, inside the caller's transaction.
   */
  protected void upsertReaction(Connection conn, Reaction reaction) throws SQLException {
    String update = "UPDATE " + REACTION_TABLE
        + " SET reactor_name=?, emoji=?, previous_emoji=?, active=?, updated_at=?"
        + " WHERE broadcast_id=? AND reactor_address=?";
    int updated = JdbcTemplate.update(conn, update,
        reaction.reactorName(), reaction.emoji(), reaction.previousEmoji(), reaction.active(),
        reaction.updatedAt(), reaction.broadcastId(), reaction.reactorAddress());
    if (updated == 0) {
      String insert = "INSERT INTO " + REACTION_TABLE + " (" + REACTION_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?)";
      JdbcTemplate.update(conn, insert, reactionParams(reaction));
    }
  }

  protected static Object[] reactionParams(Reaction reaction) {
    return new Object[]{
        reaction.broadcastId(), reaction.reactorAddress(), reaction.reactorName(), reaction.emoji(),
        reaction.previousEmoji(), reaction.active(), reaction.processed(),
        reaction.createdAt(), reaction.updatedAt()};
  }

  @Override
  public List<Reaction> activeReactions(String broadcastId) {
    String sql = "SELECT " + REACTION_COLUMNS + " FROM " + REACTION_TABLE
        + " WHERE broadcast_id=? AND active=? ORDER BY updated_at, reactor_address";
    return Connections.withConnection(connections(), "query active reactions", conn ->
        JdbcTemplate.query(conn, sql, REACTION_ROW_MAPPER, broadcastId, true));
  }

  @Override
  public List<Reaction> unprocessedReactions(Instant since) {
    String sql = "SELECT " + REACTION_COLUMNS + " FROM " + REACTION_TABLE
        + " WHERE processed=? AND created_at >= ? ORDER BY created_at, broadcast_id, reactor_address";
    return Connections.withConnection(connections(), "query unprocessed reactions", conn ->
        JdbcTemplate.query(conn, sql, REACTION_ROW_MAPPER, false, since));
  }

  @Override
  public int markProcessed(Collection<Reaction> reactions) {
    if (reactions.isEmpty()) {
      return 0;
    }
    String sql = "UPDATE " + REACTION_TABLE + " SET processed=?"
        + " WHERE broadcast_id=? AND reactor_address=? AND processed=?";
    List<Object[]> rows = new ArrayList<>(reactions.size());
    for (Reaction reaction : reactions) {
      rows.add(new Object[]{true, reaction.broadcastId(), reaction.reactorAddress(), false});
    }
    return Connections.inTransaction(connections(), "mark reactions processed", conn ->
        JdbcTemplate.batchUpdate(conn, sql, rows));
  }

  @Override
  public void saveDeliveryAttempts(List<DeliveryAttempt> attempts) {
    if (attempts.isEmpty()) {
      return;
    }
    String sql = "INSERT INTO " + DELIVERY_TABLE
        + " (message_id, recipient_address, status, provider_id, error, duration_ms, retry_count, recorded_at)"
        + " VALUES (?,?,?,?,?,?,?,?)";
    Instant now = Instant.now();
    List<Object[]> rows = new ArrayList<>(attempts.size());
    for (DeliveryAttempt attempt : attempts) {
      rows.add(new Object[]{
          attempt.messageId(), attempt.recipientAddress(), attempt.status().code(),
          attempt.providerId(), truncateError(attempt.error()), attempt.durationMs(),
          attempt.retryCount(), now});
    }
    Connections.inTransaction(connections(), "save delivery attempts", conn ->
        JdbcTemplate.batchUpdate(conn, sql, rows));
  }

  /**
   * Returns the delivery attempts recorded for one message, in insertion order.
   */
  public List<DeliveryAttempt> deliveryAttempts(String messageId) {
    String sql = "SELECT message_id, recipient_address, status, provider_id, error, duration_ms, retry_count"
        + " FROM " + DELIVERY_TABLE + " WHERE message_id=? ORDER BY id";
    return Connections.withConnection(connections(), "query delivery attempts", conn ->
        JdbcTemplate.query(conn, sql, rs -> new DeliveryAttempt(
            rs.getString("message_id"),
            rs.getString("recipient_address"),
            DeliveryStatus.fromCode(rs.getInt("status")),
            rs.getString("provider_id"),
            rs.getString("error"),
            rs.getLong("duration_ms"),
            rs.getInt("retry_count")), messageId));
  }

  protected static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH);
  }
}
