package agentbroker.jdbc.store;

import agentbroker.jdbc.ConnectionProvider;
import agentbroker.model.DeliveryState;
import agentbroker.model.FailureOutcome;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * PostgreSQL message store.
 *
 * <p>Records failures with a single {@code UPDATE ... RETURNING} round-trip. PostgreSQL
 * evaluates every {@code SET} expression against the old row, so the state decision sees the
 * retry count before the increment.
 */
public final class PostgresMessageStore extends AbstractJdbcMessageStore {

  public PostgresMessageStore() {
    super();
  }

  public PostgresMessageStore(ConnectionProvider connectionProvider) {
    this(DEFAULT_TABLE, connectionProvider);
  }

  public PostgresMessageStore(String tableName, ConnectionProvider connectionProvider) {
    super(tableName, connectionProvider);
  }

  @Override
  public AbstractJdbcMessageStore withConnectionProvider(ConnectionProvider connectionProvider) {
    return new PostgresMessageStore(tableName(), connectionProvider);
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
  public Optional<FailureOutcome> recordFailure(String messageId, int maxRetries) {
    Objects.requireNonNull(messageId, "messageId");
    String sql = "UPDATE " + tableName() + " SET "
        + "retry_count=retry_count + 1, "
        + "status=CASE WHEN retry_count + 1 <= ? THEN " + DeliveryState.PENDING.code()
        + " ELSE " + DeliveryState.FAILED.code() + " END "
        + "WHERE message_id=? RETURNING status, retry_count";
    return first(jdbc().query(sql, OUTCOME_MAPPER, maxRetries, messageId));
  }
}
