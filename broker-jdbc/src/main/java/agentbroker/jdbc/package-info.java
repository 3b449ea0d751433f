/**
 * JDBC persistence for the broker: connection plumbing and the
 * {@link agentbroker.jdbc.MessageStoreException} raised by the stores in
 * {@link agentbroker.jdbc.store}.
 */
package agentbroker.jdbc;
