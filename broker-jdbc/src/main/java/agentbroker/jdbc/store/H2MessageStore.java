package agentbroker.jdbc.store;

import agentbroker.jdbc.ConnectionProvider;

import java.util.List;

/**
 * H2 message store. Primarily for testing.
 *
 * <p>Uses the default transactional {@code UPDATE} then {@code SELECT} failure bookkeeping
 * from {@link AbstractJdbcMessageStore}.
 */
public final class H2MessageStore extends AbstractJdbcMessageStore {

  public H2MessageStore() {
    super();
  }

  public H2MessageStore(ConnectionProvider connectionProvider) {
    this(DEFAULT_TABLE, connectionProvider);
  }

  public H2MessageStore(String tableName, ConnectionProvider connectionProvider) {
    super(tableName, connectionProvider);
  }

  @Override
  public AbstractJdbcMessageStore withConnectionProvider(ConnectionProvider connectionProvider) {
    return new H2MessageStore(tableName(), connectionProvider);
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
