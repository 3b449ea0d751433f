package agentbroker.jdbc.store;

import agentbroker.jdbc.ConnectionProvider;

import java.util.List;

/**
 * MySQL message store. Also compatible with TiDB.
 *
 * <p>MySQL has no {@code UPDATE ... RETURNING}, so failures are recorded with the default
 * two-statement transaction. InnoDB's row lock on the updated row serializes concurrent
 * failures of the same message until commit.
 */
public final class MySqlMessageStore extends AbstractJdbcMessageStore {

  public MySqlMessageStore() {
    super();
  }

  public MySqlMessageStore(ConnectionProvider connectionProvider) {
    this(DEFAULT_TABLE, connectionProvider);
  }

  public MySqlMessageStore(String tableName, ConnectionProvider connectionProvider) {
    super(tableName, connectionProvider);
  }

  @Override
  public AbstractJdbcMessageStore withConnectionProvider(ConnectionProvider connectionProvider) {
    return new MySqlMessageStore(tableName(), connectionProvider);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }
}
