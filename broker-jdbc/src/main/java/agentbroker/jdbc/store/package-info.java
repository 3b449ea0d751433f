/**
 * JDBC-based {@link agentbroker.spi.MessageStore} implementations.
 *
 * <p>{@link agentbroker.jdbc.store.AbstractJdbcMessageStore} provides shared SQL and row
 * mapping; subclasses name their database and JDBC URL prefixes. PostgreSQL overrides
 * failure bookkeeping with {@code UPDATE ... RETURNING}.
 *
 * @see agentbroker.jdbc.store.AbstractJdbcMessageStore
 * @see agentbroker.jdbc.store.H2MessageStore
 * @see agentbroker.jdbc.store.MySqlMessageStore
 * @see agentbroker.jdbc.store.PostgresMessageStore
 * @see agentbroker.jdbc.store.JdbcMessageStores
 */
package agentbroker.jdbc.store;
