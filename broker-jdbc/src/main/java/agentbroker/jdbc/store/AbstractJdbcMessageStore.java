package agentbroker.jdbc.store;

import agentbroker.MessageEnvelope;
import agentbroker.MessageType;
import agentbroker.jdbc.ConnectionProvider;
import agentbroker.jdbc.JdbcTemplate;
import agentbroker.model.DeliveryState;
import agentbroker.model.FailureOutcome;
import agentbroker.model.StoredMessage;
import agentbroker.spi.MessageStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC message store with standard SQL implementations.
 *
 * <p>Rows live in one table (default {@value #DEFAULT_TABLE}) ordered by an auto-generated
 * {@code seq} column, which gives per-recipient insertion order. DDL for each database ships
 * on the classpath; see {@link #schemaResource()}.
 *
 * <p>Instances registered through
 * {@code META-INF/services/agentbroker.jdbc.store.AbstractJdbcMessageStore} are unbound
 * templates. Bind one to a database with {@link #withConnectionProvider} before use, or let
 * {@link JdbcMessageStores#detect(javax.sql.DataSource)} do it.
 *
 * <p>Subclasses override {@link #recordFailure} where the database offers a single
 * round-trip alternative to the default {@code UPDATE} then {@code SELECT} transaction.
 *
 * @see JdbcMessageStores
 */
public abstract class AbstractJdbcMessageStore implements MessageStore {
  protected static final String DEFAULT_TABLE = "agent_message";

  protected static final String COLUMNS = "message_id, sender, recipient, message_type, payload, "
      + "created_at, correlation_id, reply_to, signature, status, retry_count";

  protected static final JdbcTemplate.RowMapper<StoredMessage> ROW_MAPPER = rs -> new StoredMessage(
      MessageEnvelope.builder(rs.getString("sender"), rs.getString("recipient"))
          .messageId(rs.getString("message_id"))
          .messageType(MessageType.fromTag(rs.getString("message_type")))
          .payload(rs.getString("payload"))
          .timestamp(JdbcTemplate.getInstant(rs, "created_at"))
          .correlationId(rs.getString("correlation_id"))
          .replyTo(rs.getString("reply_to"))
          .signature(rs.getString("signature"))
          .build(),
      DeliveryState.fromCode(rs.getInt("status")),
      rs.getInt("retry_count"));

  protected static final JdbcTemplate.RowMapper<FailureOutcome> OUTCOME_MAPPER = rs -> new FailureOutcome(
      DeliveryState.fromCode(rs.getInt("status")),
      rs.getInt("retry_count"));

  private final String tableName;
  private final JdbcTemplate jdbc;

  protected AbstractJdbcMessageStore() {
    this(DEFAULT_TABLE, null);
  }

  protected AbstractJdbcMessageStore(String tableName, ConnectionProvider connectionProvider) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    this.tableName = tableName;
    this.jdbc = connectionProvider == null ? null : new JdbcTemplate(connectionProvider);
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a copy of this store bound to {@code connectionProvider}, keeping the table name.
   */
  public abstract AbstractJdbcMessageStore withConnectionProvider(ConnectionProvider connectionProvider);

  /**
   * Classpath location of the DDL creating {@value #DEFAULT_TABLE} for this database.
   */
  public String schemaResource() {
    return "agentbroker/jdbc/schema-" + name() + ".sql";
  }

  public boolean isBound() {
    return jdbc != null;
  }

  protected String tableName() {
    return tableName;
  }

  protected JdbcTemplate jdbc() {
    if (jdbc == null) {
      throw new IllegalStateException(name() + " message store has no ConnectionProvider; "
          + "call withConnectionProvider first");
    }
    return jdbc;
  }

  @Override
  public void saveMessage(MessageEnvelope envelope) {
    Objects.requireNonNull(envelope, "envelope");
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?)";
    jdbc().update(sql,
        envelope.messageId(), envelope.sender(), envelope.recipient(),
        envelope.messageType().tag(), envelope.payload(), envelope.timestamp(),
        envelope.correlationId(), envelope.replyTo(), envelope.signature(),
        DeliveryState.PENDING.code(), 0);
  }

  @Override
  public List<MessageEnvelope> getPendingMessages(String recipient) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName()
        + " WHERE recipient=? AND status=" + DeliveryState.PENDING.code() + " ORDER BY seq";
    return envelopes(jdbc().query(sql, ROW_MAPPER, recipient));
  }

  @Override
  public int countPending(String recipient) {
    return jdbc().queryForInt("SELECT COUNT(*) FROM " + tableName()
        + " WHERE recipient=? AND status=" + DeliveryState.PENDING.code(), recipient);
  }

  @Override
  public Optional<MessageEnvelope> getMessage(String messageId) {
    return find(messageId).map(StoredMessage::envelope);
  }

  /**
   * Returns the stored state of a message, for inspection.
   *
   * @param messageId the message id
   * @return the stored message, or empty if unknown
   */
  public Optional<StoredMessage> find(String messageId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE message_id=?";
    return jdbc().queryOne(sql, ROW_MAPPER, messageId);
  }

  @Override
  public boolean updateMessageState(String messageId, DeliveryState state) {
    Objects.requireNonNull(state, "state");
    String sql = "UPDATE " + tableName() + " SET status=? WHERE message_id=?";
    return jdbc().update(sql, state.code(), messageId) > 0;
  }

  @Override
  public boolean updateMessageState(String messageId, DeliveryState state, int retryCount) {
    Objects.requireNonNull(state, "state");
    String sql = "UPDATE " + tableName() + " SET status=?, retry_count=? WHERE message_id=?";
    return jdbc().update(sql, state.code(), retryCount, messageId) > 0;
  }

  @Override
  public int getRetryCount(String messageId) {
    return jdbc().queryForInt("SELECT retry_count FROM " + tableName() + " WHERE message_id=?", messageId);
  }

  @Override
  public List<MessageEnvelope> getConversationHistory(String agent1, String agent2, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    String sql = "SELECT " + COLUMNS + " FROM " + tableName()
        + " WHERE (sender=? AND recipient=?) OR (sender=? AND recipient=?)"
        + " ORDER BY seq DESC LIMIT ?";
    List<MessageEnvelope> newestFirst = envelopes(
        jdbc().query(sql, ROW_MAPPER, agent1, agent2, agent2, agent1, limit));
    Collections.reverse(newestFirst);
    return newestFirst;
  }

  /**
   * Increments the retry count and sets the resulting state in one {@code UPDATE}, then reads
   * the row back, all inside one transaction. The row lock taken by the update keeps
   * concurrent failures of the same message serialized.
   */
  @Override
  public Optional<FailureOutcome> recordFailure(String messageId, int maxRetries) {
    Objects.requireNonNull(messageId, "messageId");
    // status is assigned first: MySQL evaluates SET left to right
    String updateSql = "UPDATE " + tableName() + " SET "
        + "status=CASE WHEN retry_count + 1 <= ? THEN " + DeliveryState.PENDING.code()
        + " ELSE " + DeliveryState.FAILED.code() + " END, "
        + "retry_count=retry_count + 1 WHERE message_id=?";
    String selectSql = "SELECT status, retry_count FROM " + tableName() + " WHERE message_id=?";
    return jdbc().inTransaction(conn -> {
      if (JdbcTemplate.update(conn, updateSql, maxRetries, messageId) == 0) {
        return Optional.empty();
      }
      return first(JdbcTemplate.query(conn, selectSql, OUTCOME_MAPPER, messageId));
    });
  }

  @Override
  public List<StoredMessage> queryFailed(String recipient, int limit) {
    StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM ")
        .append(tableName()).append(" WHERE status=").append(DeliveryState.FAILED.code());
    List<Object> params = new ArrayList<>();
    if (recipient != null) {
      sql.append(" AND recipient=?");
      params.add(recipient);
    }
    sql.append(" ORDER BY seq LIMIT ?");
    params.add(limit);
    return jdbc().query(sql.toString(), ROW_MAPPER, params.toArray());
  }

  @Override
  public boolean replayFailed(String messageId) {
    String sql = "UPDATE " + tableName() + " SET status=" + DeliveryState.PENDING.code()
        + ", retry_count=0 WHERE message_id=? AND status=" + DeliveryState.FAILED.code();
    return jdbc().update(sql, messageId) > 0;
  }

  @Override
  public int countFailed(String recipient) {
    String sql = "SELECT COUNT(*) FROM " + tableName() + " WHERE status=" + DeliveryState.FAILED.code();
    if (recipient == null) {
      return jdbc().queryForInt(sql);
    }
    return jdbc().queryForInt(sql + " AND recipient=?", recipient);
  }

  protected static <T> Optional<T> first(List<T> rows) {
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  private static List<MessageEnvelope> envelopes(List<StoredMessage> rows) {
    List<MessageEnvelope> result = new ArrayList<>(rows.size());
    for (StoredMessage row : rows) {
      result.add(row.envelope());
    }
    return result;
  }
}
