/**
 * In-process {@link agentbroker.spi.MessageStore} implementation. JDBC stores live in the
 * {@code broker-jdbc} module.
 */
package agentbroker.store;
