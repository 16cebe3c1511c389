package chorus.jdbc.ledger;

import chorus.jdbc.ConnectionProvider;

import java.util.List;

/**
 * H2 ledger. Primarily for testing.
 *
 * <p>Uses the default update-then-insert reaction upsert from {@link AbstractJdbcMessageLedger}.
 */
public final class H2MessageLedger extends AbstractJdbcMessageLedger {

  public H2MessageLedger() {
    super();
  }

  public H2MessageLedger(ConnectionProvider connectionProvider) {
    super(connectionProvider);
  }

  @Override
  public AbstractJdbcMessageLedger withConnectionProvider(ConnectionProvider connectionProvider) {
    return new H2MessageLedger(connectionProvider);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
